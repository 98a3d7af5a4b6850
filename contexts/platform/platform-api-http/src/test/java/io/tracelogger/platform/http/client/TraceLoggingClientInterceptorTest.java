package io.tracelogger.platform.http.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withRawStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tracelogger.platform.application.trace.TraceExporter;
import io.tracelogger.platform.application.trace.TraceLogger;
import io.tracelogger.platform.domain.config.TraceLoggerConfig;
import io.tracelogger.platform.domain.trace.TraceContext;
import io.tracelogger.platform.domain.trace.TraceDirection;
import io.tracelogger.platform.domain.trace.TraceRecord;
import io.tracelogger.platform.http.payload.PayloadParser;
import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

@ExtendWith(MockitoExtension.class)
class TraceLoggingClientInterceptorTest {

  @Mock private TraceExporter exporter;

  private MockRestServiceServer server;
  private RestClient restClient;

  @BeforeEach
  void setUp() {
    TraceLogger traceLogger = new TraceLogger(TraceLoggerConfig.of("checkout", "test"), exporter);
    RestClient.Builder builder =
        RestClient.builder()
            .requestInterceptor(
                new TraceLoggingClientInterceptor(
                    traceLogger, new PayloadParser(new ObjectMapper()), 1024));
    server = MockRestServiceServer.bindTo(builder).build();
    restClient = builder.build();
  }

  @AfterEach
  void tearDown() {
    TraceContext.clear();
  }

  private TraceRecord sentRecord() {
    ArgumentCaptor<TraceRecord> captor = ArgumentCaptor.forClass(TraceRecord.class);
    verify(exporter, times(1)).send(captor.capture());
    return captor.getValue();
  }

  @Test
  void outboundCallPropagatesTraceIdAndRecordsStatus() {
    server
        .expect(requestTo("http://payments.test/v1/payments"))
        .andExpect(header("X-Trace-Id", "trace-77"))
        .andRespond(withStatus(HttpStatus.CREATED));

    try (TraceContext.Scope ignored = TraceContext.open("trace-77")) {
      restClient
          .post()
          .uri("http://payments.test/v1/payments")
          .contentType(MediaType.APPLICATION_JSON)
          .body("{\"amount\":1200}")
          .retrieve()
          .toBodilessEntity();
    }

    server.verify();
    TraceRecord record = sentRecord();
    assertThat(record.direction()).isEqualTo(TraceDirection.OUTBOUND);
    assertThat(record.traceId()).isEqualTo("trace-77");
    assertThat(record.route()).isEqualTo("/v1/payments");
    assertThat(record.method()).isEqualTo("POST");
    assertThat(record.statusCode()).contains(201);
    assertThat(record.requestPayload()).contains(Map.of("amount", 1200));
    assertThat(record.metadata()).containsEntry("target_host", "payments.test");
  }

  @Test
  void nonStandardStatusesReachTheCallerAndAreRecorded() {
    server.expect(requestTo("http://legacy.test/v1/quotes")).andRespond(withRawStatus(700));

    ResponseEntity<Void> entity =
        restClient.get().uri("http://legacy.test/v1/quotes").retrieve().toBodilessEntity();

    server.verify();
    assertThat(entity.getStatusCode().value()).isEqualTo(700);
    TraceRecord record = sentRecord();
    assertThat(record.statusCode()).contains(700);
    assertThat(record.errorType()).isEmpty();
  }

  @Test
  void unassignedSuccessStatusIsRecordedAsGiven() {
    server.expect(requestTo("http://legacy.test/v1/quotes")).andRespond(withRawStatus(299));

    ResponseEntity<Void> entity =
        restClient.get().uri("http://legacy.test/v1/quotes").retrieve().toBodilessEntity();

    assertThat(entity.getStatusCode().value()).isEqualTo(299);
    TraceRecord record = sentRecord();
    assertThat(record.statusCode()).contains(299);
    assertThat(record.isErrorRecord()).isFalse();
  }

  @Test
  void transportFailureIsRecordedAndRethrown() {
    server
        .expect(requestTo("http://payments.test/v1/refunds"))
        .andRespond(withException(new IOException("connection reset")));

    assertThatThrownBy(
            () -> restClient.get().uri("http://payments.test/v1/refunds").retrieve().toBodilessEntity())
        .isInstanceOf(ResourceAccessException.class);

    TraceRecord record = sentRecord();
    assertThat(record.errorType()).contains("IOException");
    assertThat(record.errorMessage()).contains("connection reset");
    assertThat(record.statusCode()).isEmpty();
  }
}
