package com.example.consult.shared.config;

import com.example.consult.shared.model.AppointmentRef;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.AllArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@AllArgsConstructor
public class CaffeineConfig {

    private final AppProperties appProperties;

    @Bean
    public Cache<Long, AppointmentRef> appointmentCache() {
        return Caffeine.newBuilder()
                .maximumSize(appProperties.getCache().getAppointments().getMaximumSize())
                .expireAfterWrite(appProperties.getCache().getAppointments().getExpireAfterWrite())
                .recordStats()
                .build();
    }
}
