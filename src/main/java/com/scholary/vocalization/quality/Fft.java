package com.scholary.vocalization.quality;

/** In-place iterative radix-2 FFT. */
final class Fft {

  private Fft() {}

  static boolean isPowerOfTwo(int n) {
    return n > 0 && (n & (n - 1)) == 0;
  }

  /**
   * @param re real parts, overwritten with the transform
   * @param im imaginary parts, overwritten with the transform
   */
  static void transform(double[] re, double[] im) {
    int n = re.length;
    if (!isPowerOfTwo(n) || im.length != n) {
      throw new IllegalArgumentException("FFT size must be a power of two, got " + n);
    }

    // bit-reversal permutation
    for (int i = 1, j = 0; i < n; i++) {
      int bit = n >> 1;
      for (; (j & bit) != 0; bit >>= 1) {
        j ^= bit;
      }
      j ^= bit;
      if (i < j) {
        double t = re[i];
        re[i] = re[j];
        re[j] = t;
        t = im[i];
        im[i] = im[j];
        im[j] = t;
      }
    }

    for (int len = 2; len <= n; len <<= 1) {
      double angle = -2 * Math.PI / len;
      double wRe = Math.cos(angle);
      double wIm = Math.sin(angle);
      for (int start = 0; start < n; start += len) {
        double curRe = 1;
        double curIm = 0;
        for (int k = 0; k < len / 2; k++) {
          int a = start + k;
          int b = a + len / 2;
          double tRe = re[b] * curRe - im[b] * curIm;
          double tIm = re[b] * curIm + im[b] * curRe;
          re[b] = re[a] - tRe;
          im[b] = im[a] - tIm;
          re[a] += tRe;
          im[a] += tIm;
          double nextRe = curRe * wRe - curIm * wIm;
          curIm = curRe * wIm + curIm * wRe;
          curRe = nextRe;
        }
      }
    }
  }
}
