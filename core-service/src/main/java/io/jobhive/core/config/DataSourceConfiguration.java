package io.jobhive.core.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(name = "jobhive.store", havingValue = "jdbc", matchIfMissing = true)
public class DataSourceConfiguration {

    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    HikariDataSource dataSource(DataSourceProperties properties, DatabasePoolProperties pool) {
        HikariDataSource dataSource = properties.initializeDataSourceBuilder().type(HikariDataSource.class).build();
        dataSource.setPoolName("jobhive-core");
        dataSource.setMaximumPoolSize(pool.poolSize());
        dataSource.setMaxLifetime(pool.recycle().toMillis());
        dataSource.setConnectionTimeout(pool.timeout().toMillis());
        return dataSource;
    }
}
