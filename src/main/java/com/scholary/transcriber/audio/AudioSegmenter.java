package com.scholary.transcriber.audio;

import com.scholary.transcriber.config.TranscriptionProperties;
import com.scholary.transcriber.config.TranscriptionProperties.SegmentationProperties;
import com.scholary.transcriber.logging.StructuredLogger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes uploads and cuts them into chunks the speech service accepts.
 *
 * <p>Chunks are split at natural pauses so words are not cut in half. Each detected silence gives
 * one cut point, {@code keepSilence} after the silence begins: the segment before keeps a short
 * tail of quiet and the segment after starts with the rest of the pause. Segments are then packed
 * greedily into chunks of at most {@code maxChunkDuration}.
 *
 * <p>Continuous speech with no usable pause is hard-cut at {@code maxChunkDuration}, so no chunk
 * ever exceeds the limit.
 *
 * <p>Example (max 5 minutes):
 *
 * <pre>
 * Segments:  0:00-2:10 | 2:10-4:30 | 4:30-6:00 | 6:00-9:40
 * Chunk 0:   0:00-4:30 (two segments)
 * Chunk 1:   4:30-9:40 (two segments)
 * </pre>
 *
 * <p>All boundaries are frame offsets into the normalized buffer, so chunks tile it exactly.
 */
@Component
public class AudioSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSegmenter.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final AudioDecoder decoder;
  private final SegmentationProperties properties;
  private final SilenceDetector silenceDetector;

  public AudioSegmenter(AudioDecoder decoder, TranscriptionProperties properties) {
    this.decoder = decoder;
    this.properties = properties.segmentation();
    this.silenceDetector =
        new SilenceDetector(
            this.properties.analysisWindow(),
            this.properties.minSilence(),
            this.properties.silenceThresholdOffsetDb());
  }

  /**
   * Decode an uploaded file.
   *
   * @throws DecodeException if the bytes are not supported audio or contain no samples
   */
  public AudioBuffer decode(byte[] encoded) {
    if (encoded == null || encoded.length == 0) {
      throw new DecodeException("Audio payload is empty");
    }
    AudioBuffer audio = decoder.decode(encoded);
    if (audio.frameCount() == 0) {
      throw new DecodeException("Decoded audio contains no samples");
    }
    LOGGER.info(
        "Decoded audio: {} bytes in, {}s at {} Hz, {} channel(s)",
        encoded.length,
        String.format("%.2f", audio.durationSeconds()),
        audio.format().sampleRate(),
        audio.format().channels());
    return audio;
  }

  /** Split using the configured maximum chunk duration. */
  public List<AudioChunk> split(AudioBuffer audio) {
    return split(audio, properties.maxChunkDuration());
  }

  /**
   * Split a decoded recording into ordered chunks.
   *
   * @param audio the decoded recording, in any layout
   * @param maxChunkDuration upper bound for every chunk
   * @return chunks indexed from 0; empty only for an empty buffer
   */
  public List<AudioChunk> split(AudioBuffer audio, Duration maxChunkDuration) {
    AudioBuffer normalized = PcmNormalizer.normalize(audio, properties.sampleRate());
    PcmFormat format = normalized.format();
    long totalFrames = normalized.frameCount();
    long maxFrames = format.framesFor(maxChunkDuration);
    if (maxFrames <= 0) {
      throw new IllegalArgumentException("Max chunk duration is too short: " + maxChunkDuration);
    }
    if (totalFrames == 0) {
      return List.of();
    }
    if (totalFrames <= maxFrames) {
      LOGGER.info("Audio fits in a single chunk: {}s", normalized.durationSeconds());
      AudioChunk only = new AudioChunk(0, normalized.samples(), format, 0);
      STRUCTURED_LOGGER.logChunkPlanned(0, 0.0, only.span().end(), false);
      return List.of(only);
    }

    List<SilenceInterval> silences = silenceDetector.detect(normalized);
    List<Segment> segments =
        hardCut(segmentsAt(cutPoints(silences, format, totalFrames), totalFrames), maxFrames);
    List<Segment> packed = pack(segments, maxFrames);

    List<AudioChunk> chunks = new ArrayList<>(packed.size());
    for (Segment range : packed) {
      int index = chunks.size();
      AudioChunk chunk = slice(normalized, index, range);
      STRUCTURED_LOGGER.logChunkPlanned(
          index, chunk.span().start(), chunk.span().end(), range.forcedEnd());
      chunks.add(chunk);
    }
    LOGGER.info(
        "Split {}s of audio into {} chunks using {} silences",
        String.format("%.2f", normalized.durationSeconds()),
        chunks.size(),
        silences.size());
    return chunks;
  }

  private TreeSet<Long> cutPoints(
      List<SilenceInterval> silences, PcmFormat format, long totalFrames) {
    long keepFrames = format.framesFor(properties.keepSilence());
    TreeSet<Long> cuts = new TreeSet<>();
    for (SilenceInterval silence : silences) {
      long cut = Math.min(silence.startFrame() + keepFrames, silence.endFrame());
      if (cut > 0 && cut < totalFrames) {
        cuts.add(cut);
      }
    }
    return cuts;
  }

  private static List<Segment> segmentsAt(TreeSet<Long> cuts, long totalFrames) {
    List<Segment> segments = new ArrayList<>(cuts.size() + 1);
    long start = 0;
    for (long cut : cuts) {
      segments.add(new Segment(start, cut, false));
      start = cut;
    }
    segments.add(new Segment(start, totalFrames, false));
    return segments;
  }

  private static List<Segment> hardCut(List<Segment> segments, long maxFrames) {
    List<Segment> result = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      long start = segment.start();
      while (segment.end() - start > maxFrames) {
        result.add(new Segment(start, start + maxFrames, true));
        start += maxFrames;
      }
      result.add(new Segment(start, segment.end(), false));
    }
    return result;
  }

  private static List<Segment> pack(List<Segment> segments, long maxFrames) {
    List<Segment> chunks = new ArrayList<>();
    Segment current = null;
    for (Segment segment : segments) {
      if (current == null) {
        current = segment;
      } else if (segment.end() - current.start() <= maxFrames) {
        current = new Segment(current.start(), segment.end(), segment.forcedEnd());
      } else {
        chunks.add(current);
        current = segment;
      }
    }
    if (current != null) {
      chunks.add(current);
    }
    return chunks;
  }

  private static AudioChunk slice(AudioBuffer audio, int index, Segment range) {
    int frameSize = audio.format().frameSize();
    byte[] samples =
        Arrays.copyOfRange(
            audio.samples(), (int) (range.start() * frameSize), (int) (range.end() * frameSize));
    return new AudioChunk(index, samples, audio.format(), range.start());
  }

  /** Frame range {@code [start, end)}; {@code forcedEnd} marks a cut made without a pause. */
  private record Segment(long start, long end, boolean forcedEnd) {}
}
