package io.tracelogger.platform.infrastructure.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.tracelogger.platform.application.trace.TraceExporter;
import io.tracelogger.platform.domain.error.TraceExportException;
import io.tracelogger.platform.domain.trace.TraceRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link TraceExporter} posting records to the internal observability API.
 *
 * <p>Every record goes to {@value #LOGS_PATH}; error records (status &gt;= 400 or a recorded
 * failure) are additionally posted to {@value #ERROR_LOGS_PATH}. Both calls carry the same
 * envelope:
 *
 * <pre>{@code {"records":[{...}],"ingestion_version":1}}</pre>
 *
 * <p>Calls are synchronous and never retried. Any failure surfaces as a {@link
 * TraceExportException}; the capture session decides what to do with it.
 *
 * <h2>Observability</h2>
 *
 * <ul>
 *   <li>Timer {@code trace_logger.export.latency} tagged with endpoint and outcome
 *   <li>Counter {@code trace_logger.export.failures} tagged with endpoint and kind
 *   <li>One CLIENT span {@code trace_logger.export} per record
 * </ul>
 */
public final class InternalObservabilityClient implements TraceExporter {

  private static final Logger log = LoggerFactory.getLogger(InternalObservabilityClient.class);

  public static final String LOGS_PATH = "/observability/logs";
  public static final String ERROR_LOGS_PATH = "/observability/error-logs";
  public static final int INGESTION_VERSION = 1;

  private final RestClient restClient;
  private final InternalServiceEndpoint endpoint;
  private final ObjectMapper mapper;
  private final MeterRegistry meters;
  private final Tracer tracer;

  public InternalObservabilityClient(
      RestClient.Builder restClientBuilder,
      InternalServiceEndpoint endpoint,
      ObjectMapper mapper,
      MeterRegistry meters,
      Tracer tracer) {
    Objects.requireNonNull(restClientBuilder, "restClientBuilder");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.meters = Objects.requireNonNull(meters, "meters");
    this.tracer = Objects.requireNonNull(tracer, "tracer");
    this.restClient =
        restClientBuilder
            .baseUrl(endpoint.baseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, endpoint.authorizationHeader())
            .build();
  }

  public InternalServiceEndpoint endpoint() {
    return endpoint;
  }

  @Override
  public void send(TraceRecord record) {
    Objects.requireNonNull(record, "record");
    final boolean errorRecord = record.isErrorRecord();

    Span span =
        tracer.spanBuilder("trace_logger.export").setSpanKind(SpanKind.CLIENT).startSpan();
    span.setAttribute("trace_logger.trace_id", record.traceId());
    span.setAttribute("trace_logger.direction", record.direction().wireValue());
    span.setAttribute("trace_logger.route", record.route());
    span.setAttribute("trace_logger.error_record", errorRecord);

    try (Scope ignored = span.makeCurrent()) {
      byte[] body = serialize(record);
      post(LOGS_PATH, body, record);
      if (errorRecord) {
        post(ERROR_LOGS_PATH, body, record);
      }
      span.setStatus(StatusCode.OK);
    } catch (TraceExportException e) {
      span.recordException(e).setStatus(StatusCode.ERROR, e.kind().title());
      throw e;
    } finally {
      span.end();
    }
  }

  // ---------------- Helpers ----------------

  private byte[] serialize(TraceRecord record) {
    Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("records", List.of(record.toPayload()));
    envelope.put("ingestion_version", INGESTION_VERSION);
    try {
      return mapper.writeValueAsBytes(envelope);
    } catch (JsonProcessingException e) {
      meters
          .counter(
              "trace_logger.export.failures",
              "endpoint",
              "none",
              "kind",
              TraceExportException.Kind.SERIALIZATION.name())
          .increment();
      throw TraceExportException.serialization(
          "trace record " + record.traceId() + " is not serializable", e);
    }
  }

  private void post(String path, byte[] body, TraceRecord record) {
    long t0 = System.nanoTime();
    String outcome = "error";
    try {
      restClient
          .post()
          .uri(path)
          .contentType(MediaType.APPLICATION_JSON)
          .body(body)
          .retrieve()
          .toBodilessEntity();
      outcome = "success";
      if (log.isDebugEnabled()) {
        log.debug(
            "trace_export_ok endpoint={} trace_id={} bytes={}", path, record.traceId(), body.length);
      }
    } catch (RestClientResponseException e) {
      int status = e.getStatusCode().value();
      TraceExportException ex =
          TraceExportException.rejected(status, "observability API answered " + status + " on " + path);
      outcome = ex.kind() == TraceExportException.Kind.AUTHENTICATION ? "unauthorized" : "rejected";
      countFailure(path, ex);
      throw ex;
    } catch (RestClientException e) {
      outcome = "transport";
      TraceExportException ex =
          TraceExportException.transport(
              "observability API unreachable at " + endpoint.baseUrl() + path, e);
      countFailure(path, ex);
      throw ex;
    } finally {
      Timer.builder("trace_logger.export.latency")
          .description("Observability API call latency")
          .tags(Tags.of("endpoint", path, "outcome", outcome))
          .register(meters)
          .record(System.nanoTime() - t0, TimeUnit.NANOSECONDS);
    }
  }

  private void countFailure(String path, TraceExportException e) {
    meters.counter("trace_logger.export.failures", "endpoint", path, "kind", e.kind().name()).increment();
  }
}
