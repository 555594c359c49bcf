package com.concord.core.strategy;

import com.concord.core.planner.PlannerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StrategyCatalogConfig {

    @Bean
    public StrategyCatalog strategyCatalog(PlannerProperties properties) {
        return StrategyCatalog.defaults(properties);
    }
}
