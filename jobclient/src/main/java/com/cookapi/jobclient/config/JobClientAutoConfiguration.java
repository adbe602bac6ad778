package com.cookapi.jobclient.config;

import com.cookapi.jobclient.client.JobClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers a {@link JobClient} bean when {@code cook.client.url} is set.
 *
 * Reuses the application's ObjectMapper and MeterRegistry if it has them, so
 * request timings show up next to the application's own metrics.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(CookClientProperties.class)
public class JobClientAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "cook.client", name = "url")
    public JobClient cookJobClient(CookClientProperties properties,
                                   ObjectProvider<ObjectMapper> objectMapper,
                                   ObjectProvider<MeterRegistry> meterRegistry) {
        return new JobClient(properties,
                objectMapper.getIfAvailable(ObjectMapper::new),
                meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }
}
