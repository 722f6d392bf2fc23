package com.scholary.vocalization.quality;

import com.scholary.vocalization.audio.DecodedAudio;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic signal-quality checks run before any inference.
 *
 * <p>Checks, in order:
 *
 * <ul>
 *   <li>Duration: too short or too long for analysis (blocking)
 *   <li>Clipping: share of saturated samples above threshold (blocking)
 *   <li>Noise: in-band energy of the loudest frames against the quietest frames (SNR)
 *   <li>Overlap: more than one spectral peak in active frames, sustained over several frames
 * </ul>
 *
 * <p>The engine does no I/O and keeps no state between calls, so the same signal always produces
 * the same verdict.
 */
public class QualityControlEngine {

  static final double MAX_SNR_DB = 120.0;
  private static final double SCORE_REFERENCE_SNR_DB = 30.0;
  private static final double FLAG_PENALTY = 0.25;
  private static final double FRAME_PERCENTILE = 0.10;
  private static final double ENERGY_EPSILON = 1e-12;

  private final QualityProperties properties;
  private final double[] window;

  public QualityControlEngine(QualityProperties properties) {
    if (!Fft.isPowerOfTwo(properties.frameSize())) {
      throw new IllegalArgumentException(
          "quality.frameSize must be a power of two, got " + properties.frameSize());
    }
    this.properties = properties;
    this.window = hannWindow(properties.frameSize());
  }

  /**
   * Evaluate a decoded recording.
   *
   * @param artifactId artifact the verdict is recorded against
   * @param audio decoded mono signal
   * @return the verdict, never null
   */
  public QualityVerdict evaluate(String artifactId, DecodedAudio audio) {
    Set<QualityFlag> flags = EnumSet.noneOf(QualityFlag.class);
    float[] samples = audio.samples();

    double duration = audio.durationSeconds();
    if (duration < properties.minDurationSeconds()) {
      flags.add(QualityFlag.TOO_SHORT);
    } else if (duration > properties.maxDurationSeconds()) {
      flags.add(QualityFlag.TOO_LONG);
    }

    double clippingRatio = clippingRatio(samples);
    if (clippingRatio > properties.clippingRatioThreshold()) {
      flags.add(QualityFlag.CLIPPED);
    }

    double snrDb = 0.0;
    if (samples.length > 0) {
      SpectralSummary spectral = analyzeSpectrum(audio);
      snrDb = spectral.snrDb();
      if (snrDb < properties.minSnrDb()) {
        flags.add(QualityFlag.NOISY);
      }
      if (spectral.overlapping()) {
        flags.add(QualityFlag.OVERLAPPING);
      }
    }

    double score = clamp(snrDb / SCORE_REFERENCE_SNR_DB) - FLAG_PENALTY * flags.size();
    return QualityVerdict.of(artifactId, flags, clamp(score), duration, snrDb, clippingRatio);
  }

  double clippingRatio(float[] samples) {
    if (samples.length == 0) {
      return 0.0;
    }
    int saturated = 0;
    for (float sample : samples) {
      if (Math.abs(sample) >= properties.saturationLevel()) {
        saturated++;
      }
    }
    return (double) saturated / samples.length;
  }

  private SpectralSummary analyzeSpectrum(DecodedAudio audio) {
    int frameSize = properties.frameSize();
    int frameCount = (audio.samples().length + frameSize - 1) / frameSize;
    double binHz = (double) audio.sampleRate() / frameSize;
    int lowBin = Math.max(1, (int) Math.ceil(properties.bandLowHz() / binHz));
    int highBin =
        Math.min(frameSize / 2, (int) Math.floor(properties.bandHighHz() / binHz));

    // First pass: in-band energy per frame.
    double[] energies = new double[frameCount];
    for (int f = 0; f < frameCount; f++) {
      energies[f] = bandEnergy(magnitudes(audio.samples(), f), lowBin, highBin);
    }

    double[] sorted = energies.clone();
    Arrays.sort(sorted);
    int edge = Math.max(1, (int) Math.floor(frameCount * FRAME_PERCENTILE));
    double noise = mean(sorted, 0, edge);
    double signal = mean(sorted, frameCount - edge, frameCount);
    double snrDb = snrDb(signal, noise);

    // Second pass: peak counting, active frames only.
    double activeThreshold =
        Math.max(noise * Math.pow(10, properties.activeFrameDb() / 10.0), ENERGY_EPSILON);
    int minSeparationBins = Math.max(1, (int) Math.ceil(properties.minPeakSeparationHz() / binHz));
    int run = 0;
    boolean overlapping = false;
    for (int f = 0; f < frameCount && !overlapping; f++) {
      if (energies[f] <= activeThreshold) {
        run = 0;
        continue;
      }
      int peaks = countPeaks(magnitudes(audio.samples(), f), lowBin, highBin, minSeparationBins);
      run = peaks > 1 ? run + 1 : 0;
      overlapping = run >= properties.minOverlapFrames();
    }

    return new SpectralSummary(snrDb, overlapping);
  }

  private double[] magnitudes(float[] samples, int frame) {
    int frameSize = properties.frameSize();
    double[] re = new double[frameSize];
    double[] im = new double[frameSize];
    int offset = frame * frameSize;
    int available = Math.min(frameSize, samples.length - offset);
    for (int i = 0; i < available; i++) {
      re[i] = samples[offset + i] * window[i];
    }
    Fft.transform(re, im);

    double[] magnitudes = new double[frameSize / 2 + 1];
    for (int k = 0; k < magnitudes.length; k++) {
      magnitudes[k] = Math.hypot(re[k], im[k]);
    }
    return magnitudes;
  }

  private static double bandEnergy(double[] magnitudes, int lowBin, int highBin) {
    double energy = 0.0;
    for (int k = lowBin; k <= highBin; k++) {
      energy += magnitudes[k] * magnitudes[k];
    }
    return energy;
  }

  int countPeaks(double[] magnitudes, int lowBin, int highBin, int minSeparationBins) {
    double max = 0.0;
    for (int k = lowBin; k <= highBin; k++) {
      max = Math.max(max, magnitudes[k]);
    }
    if (max <= 0.0) {
      return 0;
    }

    double floor = max * properties.peakRatio();
    List<Integer> candidates = new ArrayList<>();
    for (int k = Math.max(lowBin, 1); k <= Math.min(highBin, magnitudes.length - 2); k++) {
      double m = magnitudes[k];
      if (m >= floor && m > magnitudes[k - 1] && m >= magnitudes[k + 1]) {
        candidates.add(k);
      }
    }

    // Strongest first; drop anything too close to a stronger accepted peak.
    candidates.sort((a, b) -> Double.compare(magnitudes[b], magnitudes[a]));
    List<Integer> accepted = new ArrayList<>();
    for (int candidate : candidates) {
      boolean separated =
          accepted.stream().allMatch(peak -> Math.abs(peak - candidate) >= minSeparationBins);
      if (separated) {
        accepted.add(candidate);
      }
    }
    return accepted.size();
  }

  private static double snrDb(double signal, double noise) {
    if (noise <= ENERGY_EPSILON) {
      return signal <= ENERGY_EPSILON ? 0.0 : MAX_SNR_DB;
    }
    return Math.min(MAX_SNR_DB, Math.max(0.0, 10 * Math.log10(signal / noise)));
  }

  private static double mean(double[] values, int from, int to) {
    double sum = 0.0;
    for (int i = from; i < to; i++) {
      sum += values[i];
    }
    return sum / (to - from);
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }

  private static double[] hannWindow(int size) {
    double[] w = new double[size];
    for (int i = 0; i < size; i++) {
      w[i] = 0.5 - 0.5 * Math.cos(2 * Math.PI * i / size);
    }
    return w;
  }

  private record SpectralSummary(double snrDb, boolean overlapping) {}
}
