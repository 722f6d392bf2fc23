package com.scholary.vocalization.audio;

/**
 * Mono PCM signal normalized to [-1, 1].
 *
 * @param samples one float per frame, channels already mixed down
 * @param sampleRate frames per second
 */
public record DecodedAudio(float[] samples, int sampleRate) {

  public DecodedAudio {
    if (samples == null) {
      throw new IllegalArgumentException("samples must not be null");
    }
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("sampleRate must be positive, got " + sampleRate);
    }
  }

  public double durationSeconds() {
    return (double) samples.length / sampleRate;
  }
}
