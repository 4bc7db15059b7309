package com.purchasingpower.copilot.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ToolExecutorProperties {

    @Min(1)
    private int corePoolSize = 4;

    @Min(1)
    private int maxPoolSize = 8;

    @Min(0)
    private int queueCapacity = 100;

    @NotBlank
    private String threadNamePrefix = "advisor-tool-";

    @Min(0)
    private int awaitTerminationSeconds = 30;
}
