package com.scholary.vocalization.quality;

/** Signal-quality findings recorded on a verdict. */
public enum QualityFlag {
  NOISY(false),
  OVERLAPPING(false),
  CLIPPED(true),
  TOO_SHORT(true),
  TOO_LONG(true),
  UNDECODABLE(true);

  private final boolean blocking;

  QualityFlag(boolean blocking) {
    this.blocking = blocking;
  }

  /** Blocking flags make the recording unusable; the others only degrade the result. */
  public boolean isBlocking() {
    return blocking;
  }
}
