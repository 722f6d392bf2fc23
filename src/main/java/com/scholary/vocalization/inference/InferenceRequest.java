package com.scholary.vocalization.inference;

import com.scholary.vocalization.artifact.AudioFormat;

/**
 * Input handed to an {@link InferenceBackend}.
 *
 * @param jobId job the call belongs to, for correlation on the backend side
 * @param species declared species
 * @param format container format of {@code audio}
 * @param audio decrypted container bytes
 * @param sampleRate decoded sample rate
 * @param durationSeconds decoded duration
 */
public record InferenceRequest(
    String jobId,
    String species,
    AudioFormat format,
    byte[] audio,
    int sampleRate,
    double durationSeconds) {}
