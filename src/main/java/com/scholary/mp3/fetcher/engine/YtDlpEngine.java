package com.scholary.mp3.fetcher.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.mp3.fetcher.config.ConverterProperties;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link MediaEngine} backed by the yt-dlp command line tool (with ffmpeg for conversion).
 *
 * <p>yt-dlp is run with a JSON progress template and {@code --dump-single-json}, so stdout carries
 * two kinds of lines:
 *
 * <pre>
 * [progress]{"status": "downloading", "downloaded_bytes": 1024, "total_bytes": 4096, ...}
 * {"id": "abc", "title": "Song", "entries": [...], ...}
 * </pre>
 *
 * <p>The first kind is forwarded to the listener as it arrives; the second is the metadata
 * returned once the process exits. stderr is drained on its own thread so the process can never
 * block on a full pipe.
 */
@Component
public class YtDlpEngine implements MediaEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpEngine.class);

  static final String PROGRESS_PREFIX = "[progress]";
  private static final String OUTPUT_TEMPLATE = "%(title)s.%(ext)s";

  private final ConverterProperties properties;
  private final ObjectMapper objectMapper;

  public YtDlpEngine(ConverterProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    LOGGER.info(
        "Initialized yt-dlp engine: path={}, format={}, quality={}",
        properties.ytDlpPath(),
        properties.audioFormat(),
        properties.audioQuality());
  }

  @Override
  public String outputExtension() {
    return properties.audioFormat();
  }

  @Override
  public MediaInfo extract(String url, Path outputDir, EngineListener listener) {
    List<String> command = buildCommand(url, outputDir);
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process;
    try {
      process = new ProcessBuilder(command).directory(outputDir.toFile()).start();
    } catch (IOException e) {
      throw new EngineException(
          "yt-dlp not available at " + properties.ytDlpPath() + ": " + e.getMessage(), e);
    }

    AtomicReference<String> lastError = new AtomicReference<>();
    Thread errorThread = drainErrors(process, lastError);

    MediaInfo info = null;
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        MediaInfo parsed = handleLine(line, listener);
        if (parsed != null) {
          info = parsed;
        }
      }
    } catch (IOException e) {
      process.destroy();
      throw new EngineException("Failed to read yt-dlp output: " + e.getMessage(), e);
    }

    int exitCode;
    try {
      exitCode = process.waitFor();
      errorThread.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroy();
      throw new EngineException("yt-dlp interrupted", e);
    }

    if (exitCode != 0) {
      String message = lastError.get();
      throw new EngineException(
          message != null ? message : "yt-dlp exited with code " + exitCode);
    }
    if (info == null) {
      throw new EngineException("yt-dlp returned no metadata");
    }
    return info;
  }

  /** Build the yt-dlp command line for one extraction. */
  List<String> buildCommand(String url, Path outputDir) {
    List<String> command = new ArrayList<>();
    command.add(properties.ytDlpPath());
    command.add("--newline");
    command.add("--progress");
    command.add("--no-warnings");
    command.add("--no-simulate");
    command.add("--dump-single-json");
    command.add("--no-check-certificates");
    command.add("-f");
    command.add("bestaudio/best");
    command.add("-x");
    command.add("--audio-format");
    command.add(properties.audioFormat());
    command.add("--audio-quality");
    command.add(properties.audioQuality());
    command.add("-o");
    command.add(outputDir.resolve(OUTPUT_TEMPLATE).toString());
    command.add("--progress-template");
    command.add("download:" + PROGRESS_PREFIX + "%(progress)j");
    if (properties.ffmpegLocation() != null && !properties.ffmpegLocation().isBlank()) {
      command.add("--ffmpeg-location");
      command.add(properties.ffmpegLocation());
    }
    command.add("--");
    command.add(url);
    return command;
  }

  /**
   * Handle one stdout line.
   *
   * @return the parsed metadata if the line is the final info JSON, otherwise null
   */
  MediaInfo handleLine(String line, EngineListener listener) {
    String trimmed = line.strip();
    if (trimmed.startsWith(PROGRESS_PREFIX)) {
      String json = trimmed.substring(PROGRESS_PREFIX.length());
      try {
        listener.onProgress(objectMapper.readValue(json, EngineProgress.class));
      } catch (JsonProcessingException e) {
        LOGGER.debug("Ignoring unparseable progress line: {}", json);
      }
      return null;
    }
    if (trimmed.startsWith("{")) {
      try {
        return objectMapper.readValue(trimmed, MediaInfo.class);
      } catch (JsonProcessingException e) {
        throw new EngineException("Unreadable yt-dlp metadata: " + e.getOriginalMessage(), e);
      }
    }
    if (!trimmed.isEmpty()) {
      LOGGER.debug("yt-dlp: {}", trimmed);
    }
    return null;
  }

  private static Thread drainErrors(Process process, AtomicReference<String> lastError) {
    Thread errorThread =
        new Thread(
            () -> {
              try (BufferedReader reader =
                  new BufferedReader(
                      new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                  if (line.startsWith("ERROR:")) {
                    lastError.set(line.substring("ERROR:".length()).strip());
                    LOGGER.warn("yt-dlp error: {}", line);
                  } else {
                    LOGGER.debug("yt-dlp stderr: {}", line);
                  }
                }
              } catch (IOException e) {
                LOGGER.warn("Error reading yt-dlp stderr: {}", e.getMessage());
              }
            },
            "yt-dlp-stderr");
    errorThread.setDaemon(true);
    errorThread.start();
    return errorThread;
  }
}
