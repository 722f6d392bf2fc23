package com.scholary.vocalization.audio;

import com.scholary.vocalization.artifact.AudioFormat;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.sound.sampled.AudioFormat.Encoding;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes uploaded audio into a mono float signal using Java Sound.
 *
 * <p>WAV is handled by the JDK. MP3 and FLAC decode only when a Java Sound provider for them is on
 * the classpath; without one they fail with {@link AudioDecodingException}, which the pipeline
 * records as an undecodable quality verdict.
 */
public class AudioDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioDecoder.class);

  private static final int BITS_PER_SAMPLE = 16;
  private static final float FULL_SCALE = 32768f;

  /**
   * @param bytes plaintext container bytes
   * @param declaredFormat format declared at upload, used for diagnostics
   * @return mono samples in [-1, 1]
   * @throws AudioDecodingException if the bytes cannot be parsed or converted to PCM
   */
  public DecodedAudio decode(byte[] bytes, AudioFormat declaredFormat) {
    try (AudioInputStream source = AudioSystem.getAudioInputStream(new ByteArrayInputStream(bytes));
        AudioInputStream pcm = toPcm16(source)) {

      javax.sound.sampled.AudioFormat format = pcm.getFormat();
      int channels = format.getChannels();
      int sampleRate = Math.round(format.getSampleRate());
      byte[] raw = pcm.readAllBytes();

      float[] samples = mixDown(raw, channels, format.isBigEndian());
      LOGGER.debug(
          "Decoded {} audio: sampleRate={}, channels={}, frames={}",
          declaredFormat,
          sampleRate,
          channels,
          samples.length);
      return new DecodedAudio(samples, sampleRate);

    } catch (UnsupportedAudioFileException e) {
      throw new AudioDecodingException("No decoder available for declared format " + declaredFormat, e);
    } catch (IOException | IllegalArgumentException e) {
      throw new AudioDecodingException("Failed to decode " + declaredFormat + " audio", e);
    }
  }

  private static AudioInputStream toPcm16(AudioInputStream source) {
    javax.sound.sampled.AudioFormat sourceFormat = source.getFormat();
    AudioInputStream signed = source;
    if (!Encoding.PCM_SIGNED.equals(sourceFormat.getEncoding())) {
      signed = AudioSystem.getAudioInputStream(Encoding.PCM_SIGNED, source);
    }

    javax.sound.sampled.AudioFormat signedFormat = signed.getFormat();
    if (signedFormat.getSampleSizeInBits() == BITS_PER_SAMPLE) {
      return signed;
    }

    javax.sound.sampled.AudioFormat target =
        new javax.sound.sampled.AudioFormat(
            Encoding.PCM_SIGNED,
            signedFormat.getSampleRate(),
            BITS_PER_SAMPLE,
            signedFormat.getChannels(),
            signedFormat.getChannels() * 2,
            signedFormat.getSampleRate(),
            false);
    return AudioSystem.getAudioInputStream(target, signed);
  }

  private static float[] mixDown(byte[] raw, int channels, boolean bigEndian) {
    int frameBytes = channels * 2;
    int frames = raw.length / frameBytes;
    float[] samples = new float[frames];

    for (int frame = 0; frame < frames; frame++) {
      float sum = 0f;
      for (int channel = 0; channel < channels; channel++) {
        int offset = frame * frameBytes + channel * 2;
        int lo = bigEndian ? raw[offset + 1] : raw[offset];
        int hi = bigEndian ? raw[offset] : raw[offset + 1];
        short value = (short) ((hi << 8) | (lo & 0xFF));
        sum += value / FULL_SCALE;
      }
      samples[frame] = sum / channels;
    }
    return samples;
  }
}
