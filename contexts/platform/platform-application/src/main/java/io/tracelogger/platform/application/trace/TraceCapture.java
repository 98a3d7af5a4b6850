package io.tracelogger.platform.application.trace;

import io.tracelogger.platform.domain.trace.TraceContext;
import io.tracelogger.platform.domain.trace.TraceRecord;
import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One open capture session: accumulates the response side of a traced request and sends the
 * record exactly once when closed.
 *
 * <p>Created by {@link TraceLogger#captureRequest(CaptureRequest)}; use with try-with-resources:
 *
 * <pre>{@code
 * try (TraceCapture capture = traceLogger.captureRequest(INBOUND, "/v1/payments/{id}", "POST")) {
 *   PaymentResult r = payments.create(cmd);
 *   capture.setResponse(201, r.toView());
 * }
 * }</pre>
 *
 * <p>While open, the session's trace id is active in {@link TraceContext} (and MDC) on the
 * creating thread. Sessions are not thread-safe and must be closed on the thread that opened
 * them.
 */
public final class TraceCapture implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TraceCapture.class);

  private final TraceLogger logger;
  private final CaptureRequest request;
  private final String traceId;
  private final Instant startedAt;
  private final TraceContext.Scope scope;
  private final Map<String, Object> metadata;

  private String route;
  private Integer statusCode;
  private Object responsePayload;
  private Throwable error;
  private boolean closed;

  TraceCapture(TraceLogger logger, CaptureRequest request, String traceId, Instant startedAt) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.request = Objects.requireNonNull(request, "request");
    this.traceId = Objects.requireNonNull(traceId, "traceId");
    this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    this.route = request.route();
    this.metadata = new LinkedHashMap<>(request.metadata());
    this.scope = TraceContext.open(traceId);
  }

  /** Trace id this session reports under. */
  public String traceId() {
    return traceId;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Records the response. Repeated calls overwrite earlier ones. A status outside the
   * three-digit range is recorded as absent; the payload is kept either way.
   *
   * @param statusCode HTTP status, non-standard codes included
   * @param responsePayload response body, may be null
   * @throws IllegalStateException if the session is already closed
   */
  public void setResponse(int statusCode, @Nullable Object responsePayload) {
    ensureOpen();
    if (TraceRecord.isRecordableStatus(statusCode)) {
      this.statusCode = statusCode;
    } else {
      log.debug("trace_status_dropped trace_id={} status={}", traceId, statusCode);
      this.statusCode = null;
    }
    this.responsePayload = responsePayload;
  }

  /** Records a response status without a body. */
  public void setResponse(int statusCode) {
    setResponse(statusCode, null);
  }

  public void addMetadata(String key, @Nullable Object value) {
    ensureOpen();
    metadata.put(Objects.requireNonNull(key, "key"), value);
  }

  /**
   * Records a failure of the traced work. The record will carry its type, message and stack and
   * will also be routed to the error-log stream.
   *
   * @param error failure, or {@code null} to clear a previous one
   */
  public void setError(@Nullable Throwable error) {
    ensureOpen();
    this.error = error;
  }

  /**
   * Replaces the route captured at entry, e.g. once the matched handler template is known.
   *
   * @param route endpoint template or path
   */
  public void setRoute(String route) {
    ensureOpen();
    this.route = Objects.requireNonNull(route, "route");
  }

  /**
   * Sends the accumulated record and restores the previous trace context. Export failures are
   * logged, never thrown. Subsequent calls do nothing.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      logger.emit(
          request,
          traceId,
          route,
          startedAt,
          logger.elapsedMillis(startedAt),
          statusCode,
          responsePayload,
          metadata,
          error);
    } finally {
      scope.close();
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("capture session already closed: traceId=" + traceId);
    }
  }
}
