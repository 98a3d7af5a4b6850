package io.tracelogger.platform.application.trace;

import io.tracelogger.platform.domain.trace.TraceDirection;
import jakarta.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Request-side fields of a capture session.
 *
 * <p>{@code direction}, {@code route} and {@code method} are required; everything else defaults
 * to absent.
 *
 * <pre>{@code
 * CaptureRequest req =
 *     CaptureRequest.builder(TraceDirection.INBOUND, "/v1/payments/{payment_id}", "POST")
 *         .callerService("checkout")
 *         .requestPayload(Map.of("amount", 1200))
 *         .build();
 * }</pre>
 */
public final class CaptureRequest {

  private final TraceDirection direction;
  private final String route;
  private final String method;
  private final String callerService;
  private final String callerUserId;
  private final String callerIp;
  private final Object requestPayload;
  private final Map<String, Object> metadata;
  private final String traceId;

  private CaptureRequest(Builder b) {
    this.direction = Objects.requireNonNull(b.direction, "direction");
    this.route = Objects.requireNonNull(b.route, "route");
    this.method = Objects.requireNonNull(b.method, "method");
    this.callerService = b.callerService;
    this.callerUserId = b.callerUserId;
    this.callerIp = b.callerIp;
    this.requestPayload = b.requestPayload;
    this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    this.traceId = b.traceId;
  }

  /**
   * Shortcut for a request without identity, payload or metadata.
   *
   * @param direction inbound or outbound
   * @param route endpoint template or path
   * @param method HTTP method
   * @return request
   * @throws NullPointerException if any argument is null
   */
  public static CaptureRequest of(TraceDirection direction, String route, String method) {
    return builder(direction, route, method).build();
  }

  public static Builder builder(TraceDirection direction, String route, String method) {
    return new Builder(direction, route, method);
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

  public Map<String, Object> metadata() {
    return metadata;
  }

  /** Trace id supplied by the caller (e.g. from an inbound header). */
  public Optional<String> traceId() {
    return Optional.ofNullable(traceId);
  }

  /** Fluent builder for {@link CaptureRequest}. */
  public static final class Builder {
    private final TraceDirection direction;
    private final String route;
    private final String method;
    private String callerService;
    private String callerUserId;
    private String callerIp;
    private Object requestPayload;
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private String traceId;

    private Builder(TraceDirection direction, String route, String method) {
      this.direction = direction;
      this.route = route;
      this.method = method;
    }

    public Builder callerService(@Nullable String callerService) {
      this.callerService = callerService;
      return this;
    }

    public Builder callerUserId(@Nullable String callerUserId) {
      this.callerUserId = callerUserId;
      return this;
    }

    public Builder callerIp(@Nullable String callerIp) {
      this.callerIp = callerIp;
      return this;
    }

    public Builder requestPayload(@Nullable Object requestPayload) {
      this.requestPayload = requestPayload;
      return this;
    }

    /**
     * Adds metadata entries; {@code null} keys are skipped.
     *
     * @param metadata extra non-payload attributes
     * @return this builder
     */
    public Builder metadata(@Nullable Map<String, ?> metadata) {
      if (metadata != null) {
        metadata.forEach(
            (k, v) -> {
              if (k != null) {
                this.metadata.put(k, v);
              }
            });
      }
      return this;
    }

    public Builder traceId(@Nullable String traceId) {
      this.traceId = (traceId == null || traceId.isBlank()) ? null : traceId.trim();
      return this;
    }

    public CaptureRequest build() {
      return new CaptureRequest(this);
    }
  }
}
