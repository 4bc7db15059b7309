package com.purchasingpower.copilot.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "advisor")
public class AdvisorProperties {

    /**
     * Confidence reported when the knowledge base returns no retrieval score.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultConfidence = 0.85;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ToolExecutorProperties toolExecutor = new ToolExecutorProperties();
}
