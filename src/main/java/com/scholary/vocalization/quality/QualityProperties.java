package com.scholary.vocalization.quality;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds for the quality-control checks.
 *
 * <p>Maps to "quality.*" in application.yml.
 */
@ConfigurationProperties(prefix = "quality")
@Validated
public record QualityProperties(
    @Positive double minDurationSeconds,
    @Positive double maxDurationSeconds,
    @DecimalMin("0.0") @DecimalMax("1.0") double saturationLevel,
    @DecimalMin("0.0") @DecimalMax("1.0") double clippingRatioThreshold,
    @Positive int frameSize,
    @DecimalMin("0.0") double bandLowHz,
    @Positive double bandHighHz,
    double minSnrDb,
    @DecimalMin("0.0") double activeFrameDb,
    @DecimalMin("0.0") @DecimalMax("1.0") double peakRatio,
    @Positive double minPeakSeparationHz,
    @Positive int minOverlapFrames) {

  /** Defaults matching application.yml. */
  public static QualityProperties defaults() {
    return new QualityProperties(0.5, 600, 0.99, 0.01, 1024, 50, 20000, 10, 10, 0.25, 150, 5);
  }
}
