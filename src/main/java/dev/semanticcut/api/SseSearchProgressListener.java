package dev.semanticcut.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.semanticcut.search.RankedResult;
import dev.semanticcut.search.SearchProgressEvent;
import dev.semanticcut.search.SearchProgressListener;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Writes search progress to an {@link SseEmitter} as UI message stream events.
 *
 * <p>Event payloads, one JSON object per {@code data:} line:
 *
 * <ul>
 *   <li>{@code {"type":"data-status","data":{"id":stage,"status":"loading"|"done","message":...}}}
 *   <li>{@code {"type":"results","data":[...]}}
 *   <li>{@code {"type":"error","errorText":...}}
 *   <li>{@code [DONE]} after the results
 * </ul>
 *
 * <p>Reports cancellation once the emitter completes, times out or fails, which is how a client
 * disconnect reaches the pipeline. After that every further event is refused with a {@link
 * CancellationException}, except {@link #sendError}, which is dropped.
 */
class SseSearchProgressListener implements SearchProgressListener {

  static final String DONE = "[DONE]";

  private final SseEmitter emitter;
  private final ObjectMapper objectMapper;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  SseSearchProgressListener(SseEmitter emitter, ObjectMapper objectMapper) {
    this.emitter = emitter;
    this.objectMapper = objectMapper;
    emitter.onCompletion(() -> cancelled.set(true));
    emitter.onTimeout(() -> cancelled.set(true));
    emitter.onError(e -> cancelled.set(true));
  }

  @Override
  public void onProgress(SearchProgressEvent event) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("id", event.stage().id());
    data.put("status", event.status().id());
    data.put("message", event.message());
    data.putAll(event.details());
    send(Map.of("type", "data-status", "data", data));
  }

  @Override
  public boolean isCancelled() {
    return cancelled.get();
  }

  void sendResults(List<RankedResult> results) {
    send(Map.of("type", "results", "data", results));
    sendRaw(DONE);
  }

  void sendError(String errorText) {
    if (cancelled.get()) {
      return;
    }
    send(Map.of("type", "error", "errorText", errorText));
  }

  private void send(Map<String, Object> payload) {
    String json;
    try {
      json = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialise stream event", e);
    }
    sendRaw(json);
  }

  private void sendRaw(String data) {
    throwIfCancelled();
    try {
      emitter.send(SseEmitter.event().data(data));
    } catch (IOException e) {
      cancelled.set(true);
      throw new UncheckedIOException("Client stream closed", e);
    } catch (IllegalStateException e) {
      // emitter already completed, timed out or failed
      cancelled.set(true);
      CancellationException cancellation = new CancellationException("Client stream closed");
      cancellation.initCause(e);
      throw cancellation;
    }
  }
}
