package io.tracelogger.platform.http.client;

import io.tracelogger.platform.application.trace.CaptureRequest;
import io.tracelogger.platform.application.trace.TraceCapture;
import io.tracelogger.platform.application.trace.TraceLogger;
import io.tracelogger.platform.domain.trace.TraceContext;
import io.tracelogger.platform.domain.trace.TraceDirection;
import io.tracelogger.platform.http.payload.PayloadParser;
import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpRequest;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

/**
 * Records outgoing calls made through {@code RestClient}/{@code RestTemplate} as OUTBOUND trace
 * records and propagates the active trace id as {@code X-Trace-Id}.
 *
 * <p>The response body is left untouched (it belongs to the caller); only the status is recorded,
 * non-standard codes included. An I/O failure of the call is recorded as the session error and
 * rethrown; nothing the interceptor does after the exchange can fail a call that succeeded.
 */
public final class TraceLoggingClientInterceptor implements ClientHttpRequestInterceptor {

  private static final Logger log = LoggerFactory.getLogger(TraceLoggingClientInterceptor.class);

  private final TraceLogger traceLogger;
  private final PayloadParser payloadParser;
  private final int maxPayloadBytes;

  public TraceLoggingClientInterceptor(
      TraceLogger traceLogger, PayloadParser payloadParser, int maxPayloadBytes) {
    this.traceLogger = Objects.requireNonNull(traceLogger, "traceLogger");
    this.payloadParser = Objects.requireNonNull(payloadParser, "payloadParser");
    this.maxPayloadBytes = maxPayloadBytes;
  }

  @Override
  public ClientHttpResponse intercept(
      HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
    String traceId =
        traceLogger.ensureTraceId(request.getHeaders().getFirst(TraceContext.HEADER));
    request.getHeaders().set(TraceContext.HEADER, traceId);

    URI uri = request.getURI();
    Map<String, Object> metadata = new LinkedHashMap<>();
    if (uri.getHost() != null) {
      metadata.put("target_host", uri.getHost());
    }

    MediaType contentType = request.getHeaders().getContentType();
    Object payload = null;
    if (body != null && body.length > 0 && body.length <= maxPayloadBytes) {
      payload =
          payloadParser.parse(
              body, PayloadParser.Kind.of(contentType == null ? null : contentType.toString()));
    }

    String path = (uri.getRawPath() == null || uri.getRawPath().isEmpty()) ? "/" : uri.getRawPath();
    CaptureRequest captureRequest =
        CaptureRequest.builder(TraceDirection.OUTBOUND, path, request.getMethod().name())
            .traceId(traceId)
            .requestPayload(payload)
            .metadata(metadata)
            .build();

    try (TraceCapture capture = traceLogger.captureRequest(captureRequest)) {
      ClientHttpResponse response;
      try {
        response = execution.execute(request, body);
      } catch (IOException | RuntimeException e) {
        capture.setError(e);
        throw e;
      }
      recordStatus(capture, response);
      return response;
    }
  }

  // ---------------- Helpers ----------------

  /** The response belongs to the caller; a status that cannot be read is left out of the record. */
  private static void recordStatus(TraceCapture capture, ClientHttpResponse response) {
    try {
      capture.setResponse(response.getStatusCode().value());
    } catch (IOException | RuntimeException e) {
      log.debug(
          "trace_status_unreadable trace_id={} class={} msg={}",
          capture.traceId(),
          e.getClass().getSimpleName(),
          e.getMessage());
    }
  }
}
