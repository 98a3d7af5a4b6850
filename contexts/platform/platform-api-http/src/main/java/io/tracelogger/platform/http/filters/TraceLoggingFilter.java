package io.tracelogger.platform.http.filters;

import io.tracelogger.platform.application.trace.CaptureRequest;
import io.tracelogger.platform.application.trace.TraceCapture;
import io.tracelogger.platform.application.trace.TraceLogger;
import io.tracelogger.platform.domain.trace.TraceContext;
import io.tracelogger.platform.domain.trace.TraceDirection;
import io.tracelogger.platform.http.payload.PayloadParser;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Records every inbound HTTP exchange as one trace record.
 *
 * <p>Responsibilities:
 *
 * <ul>
 *   <li>Resolves the trace id from {@code X-Trace-Id} (first token) or generates one, and echoes
 *       it on the response.
 *   <li>Captures caller identity from {@code X-Caller-Service}, {@code X-User-Id} and the remote
 *       address.
 *   <li>Caches and parses JSON/form bodies up to {@code maxPayloadBytes}; handlers still see the
 *       full body.
 *   <li>Adds {@code query_params} and {@code user_agent} metadata.
 *   <li>Reports the matched handler pattern as route, the final status, or the failure thrown by
 *       the chain (which is rethrown).
 * </ul>
 *
 * <p>Thread-safety: stateless and thus thread-safe.
 */
@Order(TraceLoggingFilter.ORDER)
public final class TraceLoggingFilter extends OncePerRequestFilter {


  /** Runs early so the trace id is active for everything downstream. */
  public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 20;

  public static final String HEADER_CALLER_SERVICE = "X-Caller-Service";
  public static final String HEADER_USER_ID = "X-User-Id";
  public static final int DEFAULT_MAX_PAYLOAD_BYTES = 64 * 1024;

  /** Request attribute carrying the active trace id for downstream handlers. */
  public static final String REQUEST_ATTR_TRACE_ID = TraceLoggingFilter.class.getName() + ".TRACE_ID";

  private final TraceLogger traceLogger;
  private final PayloadParser payloadParser;
  private final int maxPayloadBytes;

  public TraceLoggingFilter(TraceLogger traceLogger, PayloadParser payloadParser) {
    this(traceLogger, payloadParser, DEFAULT_MAX_PAYLOAD_BYTES);
  }

  /**
   * Primary constructor.
   *
   * @param traceLogger session factory
   * @param payloadParser body parser
   * @param maxPayloadBytes bodies above this size are passed through unparsed
   */
  public TraceLoggingFilter(TraceLogger traceLogger, PayloadParser payloadParser, int maxPayloadBytes) {
    this.traceLogger = Objects.requireNonNull(traceLogger, "traceLogger");
    this.payloadParser = Objects.requireNonNull(payloadParser, "payloadParser");
    if (maxPayloadBytes < 0) {
      throw new IllegalArgumentException("maxPayloadBytes must be >= 0");
    }
    this.maxPayloadBytes = maxPayloadBytes;
  }

  // ---------------- Filter logic ----------------

  @Override
  protected void doFilterInternal(
      @NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response,
      @NonNull FilterChain chain)
      throws ServletException, IOException {

    // 1) Trace id (echoed before the response can commit)
    String traceId = traceLogger.ensureTraceId(firstHeaderValue(request.getHeader(TraceContext.HEADER)));
    response.setHeader(TraceContext.HEADER, traceId);

    // 2) Body
    HttpServletRequest effectiveRequest = request;
    Object payload = null;
    Map<String, Object> metadata = new LinkedHashMap<>();
    PayloadParser.Kind kind = PayloadParser.Kind.of(request.getContentType());
    if (kind != PayloadParser.Kind.NONE && mayHaveBody(request.getMethod())) {
      long declared = request.getContentLengthLong();
      if (declared > maxPayloadBytes) {
        metadata.put("request_payload_bytes", declared);
      } else {
        byte[] body = request.getInputStream().readAllBytes();
        effectiveRequest = new CachedBodyRequestWrapper(request, body, kind == PayloadParser.Kind.FORM);
        if (body.length > maxPayloadBytes) {
          metadata.put("request_payload_bytes", body.length);
        } else {
          payload = payloadParser.parse(body, kind);
        }
      }
    }

    // 3) Metadata
    metadata.put("query_params", queryParams(request.getQueryString()));
    String userAgent = request.getHeader("User-Agent");
    if (userAgent != null) {
      metadata.put("user_agent", userAgent);
    }

    CaptureRequest captureRequest =
        CaptureRequest.builder(TraceDirection.INBOUND, pathOf(request), request.getMethod())
            .traceId(traceId)
            .callerService(firstHeaderValue(request.getHeader(HEADER_CALLER_SERVICE)))
            .callerUserId(firstHeaderValue(request.getHeader(HEADER_USER_ID)))
            .callerIp(request.getRemoteAddr())
            .requestPayload(payload)
            .metadata(metadata)
            .build();

    effectiveRequest.setAttribute(REQUEST_ATTR_TRACE_ID, traceId);
    try (TraceCapture capture = traceLogger.captureRequest(captureRequest)) {
      try {
        chain.doFilter(effectiveRequest, response);
      } catch (Throwable t) {
        capture.setError(t);
        throw t;
      } finally {
        capture.setRoute(resolveRoute(effectiveRequest));
      }
      capture.setResponse(response.getStatus());
    } finally {
      effectiveRequest.removeAttribute(REQUEST_ATTR_TRACE_ID);
    }
  }

  // ---------------- Helpers ----------------

  /** Returns the first token before a comma (proxies may join multiple values). */
  private static String firstHeaderValue(String raw) {
    if (raw == null) {
      return null;
    }
    int comma = raw.indexOf(',');
    String s = (comma >= 0 ? raw.substring(0, comma) : raw).trim();
    return s.isEmpty() ? null : s;
  }

  private static boolean mayHaveBody(String method) {
    return switch (method.toUpperCase(Locale.ROOT)) {
      case "POST", "PUT", "PATCH", "DELETE" -> true;
      default -> false;
    };
  }

  private static String pathOf(HttpServletRequest request) {
    String p = request.getRequestURI();
    return (p == null || p.isEmpty()) ? "/" : p;
  }

  /** Matched handler template (e.g. {@code /v1/payments/{payment_id}}), else the raw path. */
  private static String resolveRoute(HttpServletRequest request) {
    Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    if (pattern instanceof String s && !s.isBlank()) {
      return s;
    }
    return pathOf(request);
  }

  private static Map<String, String> queryParams(String queryString) {
    try {
      return PayloadParser.parseForm(queryString, true);
    } catch (IllegalArgumentException e) {
      Map<String, String> raw = new LinkedHashMap<>(2);
      raw.put("raw", queryString);
      return raw;
    }
  }
}
