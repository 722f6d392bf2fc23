package com.scholary.vocalization.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the analysis pipeline.
 *
 * <p>Controls upload limits, the species catalogue, the accuracy floor, retry and timeout policy,
 * and the size of the worker pool and its queue.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Positive long maxUploadBytes,
    @NotEmpty Set<String> supportedSpecies,
    @DecimalMin("0.0") @DecimalMax("1.0") double accuracyFloor,
    @Positive int maxAttempts,
    @NotNull Duration retryBaseDelay,
    @NotNull Duration retryMaxDelay,
    @NotNull Duration jobTimeout,
    @Positive int workerThreads,
    @Positive int queueCapacity) {}
