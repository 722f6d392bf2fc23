package com.scholary.vocalization.config;

import com.scholary.vocalization.crypto.AesGcmPayloadCipher;
import com.scholary.vocalization.crypto.EncryptionProperties;
import com.scholary.vocalization.crypto.PayloadCipher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for at-rest encryption of stored recordings. */
@Configuration
@EnableConfigurationProperties(EncryptionProperties.class)
public class CryptoConfig {

  @Bean
  public PayloadCipher payloadCipher(EncryptionProperties properties) {
    return AesGcmPayloadCipher.fromBase64(properties.key());
  }
}
