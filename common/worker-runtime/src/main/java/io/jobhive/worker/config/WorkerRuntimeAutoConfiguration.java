package io.jobhive.worker.config;

import io.jobhive.broker.ExponentialBackoff;
import io.jobhive.broker.JobMessageCodec;
import io.jobhive.broker.JobPublisher;
import io.jobhive.broker.JobTopology;
import io.jobhive.broker.config.BrokerClientAutoConfiguration;
import io.jobhive.client.CoreApi;
import io.jobhive.client.config.CoreClientAutoConfiguration;
import io.jobhive.job.WorkerTypeRegistry;
import io.jobhive.worker.JobHandler;
import io.jobhive.worker.JobHandlerRegistry;
import io.jobhive.worker.JobWorkerRuntime;
import io.jobhive.worker.RuntimeSettings;
import io.jobhive.worker.WorkerPools;
import io.jobhive.worker.rabbit.JobListenerConfigurer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Starts a worker pool for each served type once handlers, the broker publisher and the
 * central-service client are available.
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureAfter({RabbitAutoConfiguration.class, BrokerClientAutoConfiguration.class, CoreClientAutoConfiguration.class})
@ConditionalOnBean({JobPublisher.class, CoreApi.class, JobHandler.class})
@ConditionalOnProperty(prefix = "jobhive.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(WorkerRuntimeProperties.class)
public class WorkerRuntimeAutoConfiguration {

  @Bean
  JobHandlerRegistry jobHandlerRegistry(ObjectProvider<JobHandler> handlers) {
    return new JobHandlerRegistry(handlers.orderedStream().toList());
  }

  @Bean(destroyMethod = "close")
  JobWorkerRuntime jobWorkerRuntime(WorkerRuntimeProperties properties,
                                    WorkerTypeRegistry registry,
                                    JobHandlerRegistry handlers,
                                    JobMessageCodec codec,
                                    JobPublisher publisher,
                                    CoreApi core,
                                    ObjectProvider<MeterRegistry> meters) {
    RuntimeSettings settings = new RuntimeSettings(
        properties.getMaxAttempts(),
        properties.getExecutionDeadline(),
        new ExponentialBackoff(properties.getRetryBackoffInitial(), properties.getRetryBackoffMax(), 2.0));
    return new JobWorkerRuntime(
        WorkerPools.resolve(properties.getTypes(), registry, handlers),
        codec,
        publisher,
        core,
        settings,
        meters.getIfAvailable(SimpleMeterRegistry::new),
        Clock.systemUTC());
  }

  @Bean
  SimpleRabbitListenerContainerFactory jobListenerContainerFactory(SimpleRabbitListenerContainerFactoryConfigurer configurer,
                                                                   ConnectionFactory connectionFactory) {
    SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
    configurer.configure(factory, connectionFactory);
    factory.setAcknowledgeMode(AcknowledgeMode.MANUAL);
    factory.setPrefetchCount(1);
    factory.setDefaultRequeueRejected(false);
    return factory;
  }

  @Bean
  JobListenerConfigurer jobListenerConfigurer(JobWorkerRuntime runtime,
                                              JobTopology topology,
                                              @Qualifier("jobListenerContainerFactory")
                                              SimpleRabbitListenerContainerFactory containerFactory) {
    return new JobListenerConfigurer(runtime, topology, containerFactory);
  }
}
