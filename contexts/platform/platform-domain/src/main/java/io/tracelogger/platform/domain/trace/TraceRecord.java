package io.tracelogger.platform.domain.trace;

import jakarta.annotation.Nullable;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One captured request/response pair, ready for export.
 *
 * <p>Instances are immutable and built once per capture session. Optional fields are exposed as
 * {@link Optional}s and omitted from {@link #toPayload()} when absent.
 *
 * <h2>Wire form</h2>
 *
 * <pre>{@code
 * {
 *   "trace_id": "...", "service": "payments", "environment": "prod",
 *   "timestamp": "2024-05-01T10:15:30.123Z", "direction": "inbound",
 *   "route": "/v1/payments/{payment_id}", "method": "POST",
 *   "status_code": 201, "duration_ms": 12.5,
 *   "request_payload": {...}, "response_payload": {...}, ...
 * }
 * }</pre>
 */
public final class TraceRecord {

  /** Status codes at or above this value route the record to the error-log endpoint as well. */
  public static final int ERROR_STATUS_THRESHOLD = 400;

  /** Lowest status a record carries. */
  public static final int MIN_STATUS = 100;

  /** Highest status a record carries. */
  public static final int MAX_STATUS = 999;

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private final String traceId;
  private final String service;
  private final String environment;
  private final Instant timestamp;
  private final TraceDirection direction;
  private final String route;
  private final String method;
  private final Integer statusCode;
  private final double durationMs;
  private final String callerService;
  private final String callerUserId;
  private final String callerIp;
  private final Object requestPayload;
  private final Object responsePayload;
  private final Map<String, Object> metadata;
  private final String errorType;
  private final String errorMessage;
  private final String errorStack;
  private final String hostName;

  private TraceRecord(Builder b) {
    this.traceId = Objects.requireNonNull(b.traceId, "traceId");
    this.service = Objects.requireNonNull(b.service, "service");
    this.environment = Objects.requireNonNull(b.environment, "environment");
    this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp");
    this.direction = Objects.requireNonNull(b.direction, "direction");
    this.route = Objects.requireNonNull(b.route, "route");
    this.method = Objects.requireNonNull(b.method, "method");
    this.statusCode = b.statusCode;
    this.durationMs = Math.round(b.durationMs * 100.0) / 100.0;
    this.callerService = b.callerService;
    this.callerUserId = b.callerUserId;
    this.callerIp = b.callerIp;
    this.requestPayload = b.requestPayload;
    this.responsePayload = b.responsePayload;
    this.metadata =
        (b.metadata == null || b.metadata.isEmpty())
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    this.errorType = b.errorType;
    this.errorMessage = b.errorMessage;
    this.errorStack = b.errorStack;
    this.hostName = b.hostName;
  }

  /**
   * Starts a builder with the request identity every record needs.
   *
   * @param direction inbound or outbound
   * @param route endpoint template or path
   * @param method HTTP method
   * @return builder
   */
  public static Builder builder(TraceDirection direction, String route, String method) {
    return new Builder(direction, route, method);
  }

  // ---------------- Accessors ----------------

  public String traceId() {
    return traceId;
  }

  public String service() {
    return service;
  }

  public String environment() {
    return environment;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public TraceDirection direction() {
    return direction;
  }

  public String route() {
    return route;
  }

  public String method() {
    return method;
  }

  /** Present only if a response was recorded. */
  public Optional<Integer> statusCode() {
    return Optional.ofNullable(statusCode);
  }

  public double durationMs() {
    return durationMs;
  }

  public Optional<String> callerService() {
    return Optional.ofNullable(callerService);
  }

  public Optional<String> callerUserId() {
    return Optional.ofNullable(callerUserId);
  }

  public Optional<String> callerIp() {
    return Optional.ofNullable(callerIp);
  }

  public Optional<Object> requestPayload() {
    return Optional.ofNullable(requestPayload);
  }

  /** Present only if a response with a body was recorded. */
  public Optional<Object> responsePayload() {
    return Optional.ofNullable(responsePayload);
  }

  public Map<String, Object> metadata() {
    return metadata;
  }

  public Optional<String> errorType() {
    return Optional.ofNullable(errorType);
  }

  public Optional<String> errorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  public Optional<String> errorStack() {
    return Optional.ofNullable(errorStack);
  }

  public Optional<String> hostName() {
    return Optional.ofNullable(hostName);
  }

  /**
   * Whether the record also belongs on the error-log stream: a recorded status of at least
   * {@value #ERROR_STATUS_THRESHOLD}, or a failure of the wrapped body.
   *
   * @return {@code true} for error records
   */
  public boolean isErrorRecord() {
    return (statusCode != null && statusCode >= ERROR_STATUS_THRESHOLD) || errorType != null;
  }

  /**
   * Renders the record as a JSON-ready map with snake_case keys. Absent values are omitted.
   *
   * @return insertion-ordered map
   */
  public Map<String, Object> toPayload() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("trace_id", traceId);
    out.put("service", service);
    out.put("environment", environment);
    out.put("timestamp", TIMESTAMP.format(timestamp.truncatedTo(ChronoUnit.MILLIS)));
    out.put("direction", direction.wireValue());
    out.put("route", route);
    out.put("method", method);
    putIfPresent(out, "status_code", statusCode);
    out.put("duration_ms", durationMs);
    putIfPresent(out, "caller_service", callerService);
    putIfPresent(out, "caller_user_id", callerUserId);
    putIfPresent(out, "caller_ip", callerIp);
    putIfPresent(out, "request_payload", requestPayload);
    putIfPresent(out, "response_payload", responsePayload);
    if (!metadata.isEmpty()) {
      out.put("metadata", metadata);
    }
    putIfPresent(out, "error_type", errorType);
    putIfPresent(out, "error_message", errorMessage);
    putIfPresent(out, "error_stack", errorStack);
    putIfPresent(out, "host_name", hostName);
    return out;
  }

  private static void putIfPresent(Map<String, Object> out, String key, @Nullable Object value) {
    if (value != null) {
      out.put(key, value);
    }
  }

  @Override
  public String toString() {
    // Payloads stay out of toString(); they may carry caller data.
    return "TraceRecord{traceId="
        + traceId
        + ", direction="
        + direction.wireValue()
        + ", method="
        + method
        + ", route="
        + route
        + ", status="
        + statusCode
        + ", error="
        + errorType
        + '}';
  }

  // ---------------- Builder ----------------

  /** Fluent builder for {@link TraceRecord}. */
  public static final class Builder {
    private final TraceDirection direction;
    private final String route;
    private final String method;

    private String traceId;
    private String service;
    private String environment;
    private Instant timestamp;
    private Integer statusCode;
    private double durationMs;
    private String callerService;
    private String callerUserId;
    private String callerIp;
    private Object requestPayload;
    private Object responsePayload;
    private Map<String, Object> metadata;
    private String errorType;
    private String errorMessage;
    private String errorStack;
    private String hostName;

    private Builder(TraceDirection direction, String route, String method) {
      this.direction = direction;
      this.route = route;
      this.method = method;
    }

    public Builder traceId(String traceId) {
      this.traceId = traceId;
      return this;
    }

    /**
     * Sets the emitting service identity.
     *
     * @param service service name
     * @param environment deployment environment
     * @return this builder
     */
    public Builder origin(String service, String environment) {
      this.service = service;
      this.environment = environment;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    /**
     * Sets the recorded response status.
     *
     * @param statusCode HTTP status or {@code null} when no response was recorded; a value
     *     outside {@value TraceRecord#MIN_STATUS}..{@value TraceRecord#MAX_STATUS} is recorded
     *     as absent
     * @return this builder
     */
    public Builder statusCode(@Nullable Integer statusCode) {
      this.statusCode =
          (statusCode != null && isRecordableStatus(statusCode)) ? statusCode : null;
      return this;
    }

    public Builder durationMs(double durationMs) {
      this.durationMs = Math.max(0d, durationMs);
      return this;
    }

    /**
     * Sets the optional caller identity.
     *
     * @param service calling service, if known
     * @param userId end-user id, if known
     * @param ip caller address, if known
     * @return this builder
     */
    public Builder caller(
        @Nullable String service, @Nullable String userId, @Nullable String ip) {
      this.callerService = service;
      this.callerUserId = userId;
      this.callerIp = ip;
      return this;
    }

    public Builder requestPayload(@Nullable Object requestPayload) {
      this.requestPayload = requestPayload;
      return this;
    }

    public Builder responsePayload(@Nullable Object responsePayload) {
      this.responsePayload = responsePayload;
      return this;
    }

    public Builder metadata(@Nullable Map<String, Object> metadata) {
      this.metadata = metadata;
      return this;
    }

    /**
     * Records the failure of the wrapped body: simple class name, message and full stack trace.
     *
     * @param error the failure, or {@code null} for none
     * @return this builder
     */
    public Builder error(@Nullable Throwable error) {
      if (error == null) {
        this.errorType = null;
        this.errorMessage = null;
        this.errorStack = null;
        return this;
      }
      this.errorType = error.getClass().getSimpleName();
      this.errorMessage = error.getMessage();
      StringWriter sw = new StringWriter(512);
      try (PrintWriter pw = new PrintWriter(sw)) {
        error.printStackTrace(pw);
      }
      this.errorStack = sw.toString();
      return this;
    }

    public Builder hostName(@Nullable String hostName) {
      this.hostName = hostName;
      return this;
    }

    /**
     * Builds the record.
     *
     * @return immutable record
     * @throws NullPointerException if a required field is missing
     */
    public TraceRecord build() {
      return new TraceRecord(this);
    }
  }

  /**
   * Whether a status fits the three-digit range HTTP clients accept, including non-standard
   * codes such as 299 or 700.
   *
   * @param status candidate
   * @return true within {@value #MIN_STATUS}..{@value #MAX_STATUS}
   */
  public static boolean isRecordableStatus(int status) {
    return status >= MIN_STATUS && status <= MAX_STATUS;
  }
}
