package com.propertyintel.price.config;

import com.propertyintel.price.assess.RecordSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    /**
     * Ruleset applied to every fetched dataset before training.
     */
    @Bean
    public RecordSchema recordSchema() {
        return RecordSchema.pricePaid();
    }
}
