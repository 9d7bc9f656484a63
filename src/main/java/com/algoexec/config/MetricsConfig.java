package com.algoexec.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/** Tags every meter with the application name and trading mode. */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final EngineProperties engineProperties;

    @Value("${spring.application.name:algoexec-engine}")
    private String applicationName;

    public MetricsConfig(MeterRegistry meterRegistry, EngineProperties engineProperties) {
        this.meterRegistry = meterRegistry;
        this.engineProperties = engineProperties;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry
                .config()
                .commonTags("application", applicationName, "mode", engineProperties.getMode().name());
    }
}
