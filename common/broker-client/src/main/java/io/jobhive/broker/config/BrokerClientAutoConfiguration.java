package io.jobhive.broker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.broker.AmqpJobPublisher;
import io.jobhive.broker.ExponentialBackoff;
import io.jobhive.broker.JobMessageCodec;
import io.jobhive.broker.JobPublisher;
import io.jobhive.broker.JobTopology;
import io.jobhive.broker.RetryingJobPublisher;
import io.jobhive.job.WorkerTypeRegistry;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the job topology, the worker type registry and a confirming, retrying publisher.
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureAfter({RabbitAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnClass(RabbitTemplate.class)
@EnableConfigurationProperties({BrokerProperties.class, WorkerTypeProperties.class})
public class BrokerClientAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  WorkerTypeRegistry workerTypeRegistry(WorkerTypeProperties workerTypes, BrokerProperties broker) {
    return workerTypes.toRegistry(broker.getExchange());
  }

  @Bean
  @ConditionalOnMissingBean
  JobTopology jobTopology(BrokerProperties broker, WorkerTypeRegistry registry) {
    return new JobTopology(broker.getExchange(), broker.getRetryExchange(), broker.getDeadLetterExchange(), registry);
  }

  @Bean
  Declarables jobTopologyDeclarables(JobTopology topology) {
    return topology.declarables();
  }

  @Bean
  @ConditionalOnMissingBean
  JobMessageCodec jobMessageCodec(ObjectMapper mapper) {
    return new JobMessageCodec(mapper);
  }

  @Bean
  @ConditionalOnBean(RabbitTemplate.class)
  @ConditionalOnMissingBean(JobPublisher.class)
  JobPublisher jobPublisher(RabbitTemplate template, JobTopology topology, JobMessageCodec codec, BrokerProperties broker) {
    BrokerProperties.Publish publish = broker.getPublish();
    // unroutable jobs come back as returns instead of being dropped
    template.setMandatory(true);
    AmqpJobPublisher amqp = new AmqpJobPublisher(template, topology, codec, publish.getConfirmTimeout());
    ExponentialBackoff backoff = new ExponentialBackoff(publish.getInitialBackoff(), publish.getMaxBackoff(), 2.0);
    return new RetryingJobPublisher(amqp, publish.getMaxAttempts(), backoff);
  }
}
