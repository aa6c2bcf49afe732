package com.scholary.mp3.fetcher.progress;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event on a job's progress stream.
 *
 * <p>Each variant knows its SSE event name and JSON payload. {@link Done} and {@link Failed} are
 * terminal: exactly one of them closes every job's stream.
 */
public interface ProgressEvent {

  String eventName();

  Map<String, Object> payload();

  default boolean isTerminal() {
    return false;
  }

  /** Bytes are being transferred. Every field is optional. */
  record Downloading(Double percent, Double speedBps, Long etaSeconds, String sourceFilename)
      implements ProgressEvent {

    public Downloading {
      if (percent != null && (percent < 0 || percent > 100)) {
        throw new IllegalArgumentException("percent must be within [0, 100]: " + percent);
      }
    }

    @Override
    public String eventName() {
      return "progress";
    }

    @Override
    public Map<String, Object> payload() {
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("status", "downloading");
      payload.put("percent", percent);
      payload.put("speed", speedBps);
      payload.put("eta", etaSeconds);
      payload.put("filename", sourceFilename);
      return payload;
    }
  }

  /** Free-form status line, e.g. "download finished, converting...". */
  record StatusNote(String text) implements ProgressEvent {

    @Override
    public String eventName() {
      return "progress";
    }

    @Override
    public Map<String, Object> payload() {
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("status", text);
      return payload;
    }
  }

  /** The job succeeded; the file can be fetched with the token. */
  record Done(String token, String displayName) implements ProgressEvent {

    @Override
    public String eventName() {
      return "done";
    }

    @Override
    public Map<String, Object> payload() {
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("token", token);
      payload.put("filename", displayName);
      return payload;
    }

    @Override
    public boolean isTerminal() {
      return true;
    }
  }

  /** The job failed; the message is surfaced to the client verbatim. */
  record Failed(String message) implements ProgressEvent {

    @Override
    public String eventName() {
      return "error";
    }

    @Override
    public Map<String, Object> payload() {
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("error", message);
      return payload;
    }

    @Override
    public boolean isTerminal() {
      return true;
    }
  }
}
