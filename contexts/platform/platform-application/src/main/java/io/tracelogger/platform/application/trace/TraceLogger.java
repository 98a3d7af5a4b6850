package io.tracelogger.platform.application.trace;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.tracelogger.platform.domain.config.TraceLoggerConfig;
import io.tracelogger.platform.domain.error.TraceExportException;
import io.tracelogger.platform.domain.trace.TraceContext;
import io.tracelogger.platform.domain.trace.TraceDirection;
import io.tracelogger.platform.domain.trace.TraceRecord;
import jakarta.annotation.Nullable;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for request tracing.
 *
 * <p>Binds a {@link TraceLoggerConfig} to a {@link TraceExporter} and hands out capture
 * sessions. Each session produces exactly one record, sent synchronously when the session
 * closes. Export failures never reach the caller: they are logged (and optionally the record
 * itself is written to the {@code <this class>.fallback} logger) and dropped.
 *
 * <p>Thread-safety: safe to share. Sessions themselves are single-threaded.
 */
public final class TraceLogger {

  private static final Logger log = LoggerFactory.getLogger(TraceLogger.class);
  private static final Logger FALLBACK =
      LoggerFactory.getLogger(TraceLogger.class.getName() + ".fallback");

  private final TraceLoggerConfig config;
  private final TraceExporter exporter;
  private final Clock clock;
  private final PayloadRedactor redactor;
  private final String hostName;

  public TraceLogger(TraceLoggerConfig config, TraceExporter exporter) {
    this(config, exporter, Clock.systemUTC());
  }

  public TraceLogger(TraceLoggerConfig config, TraceExporter exporter, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.exporter = Objects.requireNonNull(exporter, "exporter");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.redactor = new PayloadRedactor(config.redactKeys());
    this.hostName = resolveHostName();
  }

  // ---------------- Sessions ----------------

  /**
   * Opens a session for a request without caller identity or payload.
   *
   * @param direction inbound or outbound
   * @param route endpoint template or path
   * @param method HTTP method
   * @return open session; close it exactly once
   */
  public TraceCapture captureRequest(TraceDirection direction, String route, String method) {
    return captureRequest(CaptureRequest.of(direction, route, method));
  }

  /**
   * Opens a session. No I/O happens here; the record is sent on {@link TraceCapture#close()}.
   *
   * @param request request-side fields
   * @return open session
   */
  public TraceCapture captureRequest(CaptureRequest request) {
    Objects.requireNonNull(request, "request");
    String traceId = ensureTraceId(request.traceId().orElse(null));
    return new TraceCapture(this, request, traceId, clock.instant());
  }

  /**
   * Runs {@code body} inside a session. A failure of the body is recorded on the session and
   * rethrown unchanged after the record was sent.
   *
   * @param request request-side fields
   * @param body traced work
   * @return the body's result
   * @throws E whatever the body throws
   */
  public <T, E extends Exception> T within(CaptureRequest request, CaptureBody<T, E> body)
      throws E {
    Objects.requireNonNull(body, "body");
    try (TraceCapture capture = captureRequest(request)) {
      try {
        return body.apply(capture);
      } catch (Throwable t) {
        if (!capture.isClosed()) {
          capture.setError(t);
        }
        throw t;
      }
    }
  }

  /**
   * Emits one record for work that was timed elsewhere, without opening a trace context.
   *
   * @param request request-side fields
   * @param statusCode response status, or {@code null} if none was observed
   * @param duration elapsed time of the work
   * @param responsePayload response body, may be null
   * @param error failure of the work, may be null
   * @return the trace id the record was sent under
   */
  public String logEvent(
      CaptureRequest request,
      @Nullable Integer statusCode,
      Duration duration,
      @Nullable Object responsePayload,
      @Nullable Throwable error) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(duration, "duration");
    String traceId = ensureTraceId(request.traceId().orElse(null));
    Instant end = clock.instant();
    emit(
        request,
        traceId,
        request.route(),
        end.minus(duration),
        duration.toNanos() / 1_000_000d,
        statusCode,
        responsePayload,
        request.metadata(),
        error);
    return traceId;
  }

  /**
   * Resolves the trace id for a new record: the candidate if non-blank, else the thread's active
   * {@link TraceContext}, else the current OpenTelemetry span's trace id, else a random UUID.
   *
   * @param candidate explicit trace id, may be null
   * @return never blank
   */
  public String ensureTraceId(@Nullable String candidate) {
    if (candidate != null && !candidate.isBlank()) {
      return candidate.trim();
    }
    var fromContext = TraceContext.currentTraceId();
    if (fromContext.isPresent()) {
      return fromContext.get();
    }
    SpanContext span = Span.current().getSpanContext();
    if (span.isValid()) {
      return span.getTraceId();
    }
    return UUID.randomUUID().toString();
  }

  // ---------------- Export ----------------

  double elapsedMillis(Instant startedAt) {
    Duration d = Duration.between(startedAt, clock.instant());
    return d.toNanos() / 1_000_000d;
  }

  void emit(
      CaptureRequest request,
      String traceId,
      String route,
      Instant startedAt,
      double durationMs,
      @Nullable Integer statusCode,
      @Nullable Object responsePayload,
      Map<String, Object> metadata,
      @Nullable Throwable error) {
    TraceRecord record = null;
    try {
      record =
          TraceRecord.builder(request.direction(), route, request.method())
              .traceId(traceId)
              .origin(config.serviceName(), config.environment())
              .timestamp(startedAt)
              .statusCode(statusCode)
              .durationMs(durationMs)
              .caller(
                  request.callerService().orElse(null),
                  request.callerUserId().orElse(null),
                  request.callerIp().orElse(null))
              .requestPayload(redactor.redact(request.requestPayload().orElse(null)))
              .responsePayload(redactor.redact(responsePayload))
              .metadata(metadata)
              .error(error)
              .hostName(hostName)
              .build();
      exporter.send(record);
      log.debug(
          "trace_exported trace_id={} route={} status={}",
          traceId,
          route,
          record.statusCode().orElse(null));
    } catch (TraceExportException e) {
      log.warn(
          "trace_export_failed kind={} status={} route={} msg={}",
          e.kind(),
          e.status().isPresent() ? e.status().getAsInt() : null,
          route,
          e.getMessage());
      fallback(record);
    } catch (RuntimeException e) {
      log.warn(
          "trace_export_failed kind=UNEXPECTED route={} class={} msg={}",
          route,
          e.getClass().getSimpleName(),
          e.getMessage(),
          e);
      fallback(record);
    }
  }

  private void fallback(@Nullable TraceRecord record) {
    if (record != null && config.fallbackLogging()) {
      FALLBACK.info("trace_record_fallback payload={}", record.toPayload());
    }
  }

  private static String resolveHostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException e) {
      String env = System.getenv("HOSTNAME");
      return (env == null || env.isBlank()) ? null : env;
    }
  }
}
