package com.sqlstage.config;

import com.sqlstage.service.ConnectionManager;
import com.sqlstage.service.HikariDataSourceFactory;
import com.sqlstage.service.RetryPolicy;
import com.sqlstage.service.Sleeper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({DatabaseProperties.class, StagingProperties.class})
public class SqlStageConfiguration {

    @Bean
    public ConnectionManager connectionManager(DatabaseProperties properties) {
        RetryPolicy retryPolicy = new RetryPolicy(
                properties.getRetry().getAttempts(),
                properties.getRetry().getDelay());
        return new ConnectionManager(
                properties.toConnectionConfig(),
                new HikariDataSourceFactory(),
                retryPolicy,
                Sleeper.threadSleep());
    }
}
