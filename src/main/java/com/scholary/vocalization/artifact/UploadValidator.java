package com.scholary.vocalization.artifact;

import java.util.Set;

/**
 * Checks upload input against the format, size and species rules.
 *
 * <p>Order matters for error reporting: format first, then size, then species.
 */
public class UploadValidator {

  private final long maxUploadBytes;
  private final Set<String> supportedSpecies;

  public UploadValidator(long maxUploadBytes, Set<String> supportedSpecies) {
    this.maxUploadBytes = maxUploadBytes;
    this.supportedSpecies = Set.copyOf(supportedSpecies);
  }

  /**
   * @return the parsed format
   * @throws UploadValidationException naming the first rule violated
   */
  public AudioFormat validate(long sizeBytes, String format, String species) {
    AudioFormat parsed =
        AudioFormat.parse(format).orElseThrow(() -> new UnsupportedFormatException(format));

    if (sizeBytes <= 0) {
      throw new UploadValidationException("Uploaded file is empty");
    }
    if (sizeBytes > maxUploadBytes) {
      throw new FileTooLargeException(sizeBytes, maxUploadBytes);
    }
    if (species == null || !supportedSpecies.contains(species)) {
      throw new UnsupportedSpeciesException(species);
    }
    return parsed;
  }
}
