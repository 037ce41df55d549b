package io.jobhive.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.core.auth.AuthGatewayFilter;
import io.jobhive.core.auth.JwtVerifier;
import io.jobhive.core.domain.EnqueueGate;
import io.jobhive.core.notify.NotificationBroker;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

@Configuration(proxyBeanMethods = false)
public class CoreConfiguration {

    @Bean
    @ConditionalOnMissingBean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    EnqueueGate enqueueGate() {
        return new EnqueueGate();
    }

    @Bean(destroyMethod = "close")
    NotificationBroker notificationBroker(NotificationProperties properties, Clock clock, MeterRegistry meters) {
        return new NotificationBroker(properties, clock, meters);
    }

    @Bean
    JwtVerifier jwtVerifier(AuthProperties auth, Clock clock) {
        return new JwtVerifier(auth.getJwtSecret(), auth.getClockSkew(), clock);
    }

    @Bean
    FilterRegistrationBean<AuthGatewayFilter> authGatewayFilter(AuthProperties auth, JwtVerifier verifier,
                                                                ObjectMapper mapper) {
        AuthGatewayFilter filter = new AuthGatewayFilter(auth.getApiKey(), verifier, auth.getSubmitRoles(), mapper);
        FilterRegistrationBean<AuthGatewayFilter> registration = new FilterRegistrationBean<>(filter);
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }
}
