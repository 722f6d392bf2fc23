package com.scholary.vocalization.crypto;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for at-rest encryption of uploaded audio.
 *
 * @param key base64-encoded 256-bit AES key
 */
@ConfigurationProperties(prefix = "encryption")
@Validated
public record EncryptionProperties(@NotBlank String key) {}
