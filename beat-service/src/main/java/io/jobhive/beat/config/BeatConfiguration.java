package io.jobhive.beat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.beat.app.BeatHealthIndicator;
import io.jobhive.beat.app.BeatScheduler;
import io.jobhive.beat.app.ScheduleSynchronizer;
import io.jobhive.beat.domain.ScheduleStore;
import io.jobhive.client.CoreApi;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;

@Configuration(proxyBeanMethods = false)
public class BeatConfiguration {

  @Bean
  @ConditionalOnMissingBean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  BeatScheduler beatScheduler(ScheduleStore store, CoreApi core, Clock clock, MeterRegistry meters) {
    return new BeatScheduler(store, core, clock, meters);
  }

  @Bean
  ScheduleSynchronizer scheduleSynchronizer(ScheduleStore store, ObjectMapper mapper, Clock clock) {
    return new ScheduleSynchronizer(store, mapper, clock);
  }

  @Bean
  ApplicationRunner scheduleSync(ScheduleSynchronizer synchronizer, BeatProperties properties) {
    return args -> synchronizer.synchronize(properties.getSchedules());
  }

  @Bean
  SchedulingConfigurer beatLoop(BeatScheduler scheduler, BeatProperties properties) {
    return registrar -> registrar.addFixedDelayTask(scheduler::tick, properties.getTickInterval());
  }

  @Bean
  BeatHealthIndicator beatHealthIndicator(BeatScheduler scheduler) {
    return new BeatHealthIndicator(scheduler);
  }
}
