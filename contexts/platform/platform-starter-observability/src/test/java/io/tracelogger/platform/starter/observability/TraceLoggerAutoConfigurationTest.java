package io.tracelogger.platform.starter.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

import io.tracelogger.platform.application.trace.TraceExporter;
import io.tracelogger.platform.application.trace.TraceLogger;
import io.tracelogger.platform.domain.config.TraceLoggerConfig;
import io.tracelogger.platform.domain.trace.TraceContext;
import io.tracelogger.platform.domain.trace.TraceDirection;
import io.tracelogger.platform.http.client.TraceLoggingClientInterceptor;
import io.tracelogger.platform.infrastructure.observability.InternalObservabilityClient;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.boot.web.client.RestTemplateCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class TraceLoggerAutoConfigurationTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(TraceLoggerAutoConfiguration.class))
          .withPropertyValues("tracelogger.auth-secret=s3cret");

  @Test
  void wiresLoggerAndHttpExporterByDefault() {
    runner
        .withPropertyValues("spring.application.name=Payments API")
        .run(
            ctx -> {
              assertThat(ctx).hasSingleBean(TraceLogger.class);
              assertThat(ctx).hasSingleBean(InternalObservabilityClient.class);
              assertThat(ctx).hasSingleBean(TraceLoggingClientInterceptor.class);
              assertThat(ctx).hasSingleBean(RestClientCustomizer.class);
              assertThat(ctx).hasSingleBean(RestTemplateCustomizer.class);

              TraceLoggerConfig config = ctx.getBean(TraceLoggerConfig.class);
              assertThat(config.serviceName()).isEqualTo("payments_api");
              assertThat(config.fallbackLogging()).isTrue();
            });
  }

  @Test
  void explicitPropertiesWin() {
    runner
        .withPropertyValues(
            "tracelogger.service-name=billing",
            "tracelogger.environment=prod",
            "tracelogger.api-url=http://observability.internal:9000/",
            "tracelogger.redact-keys=password,card_number",
            "tracelogger.fallback-logging=false",
            "TRACE_LOGGER_SERVICE_NAME=ignored")
        .run(
            ctx -> {
              TraceLoggerConfig config = ctx.getBean(TraceLoggerConfig.class);
              assertThat(config.serviceName()).isEqualTo("billing");
              assertThat(config.environment()).isEqualTo("prod");
              assertThat(config.apiUrl()).contains("http://observability.internal:9000");
              assertThat(config.redactKeys()).containsExactly("password", "card_number");
              assertThat(config.fallbackLogging()).isFalse();
              assertThat(ctx.getBean(InternalObservabilityClient.class).endpoint().baseUrl())
                  .isEqualTo("http://observability.internal:9000");
            });
  }

  @Test
  void environmentVariablesFillTheGaps() {
    runner
        .withPropertyValues(
            "TRACE_LOGGER_SERVICE_NAME=orders",
            "ENV=staging",
            "TRACE_LOGGER_API_URL=http://obs.staging:8005",
            "TRACE_LOGGER_REDACT_KEYS=token, secret ,")
        .run(
            ctx -> {
              TraceLoggerConfig config = ctx.getBean(TraceLoggerConfig.class);
              assertThat(config.serviceName()).isEqualTo("orders");
              assertThat(config.environment()).isEqualTo("staging");
              assertThat(config.apiUrl()).contains("http://obs.staging:8005");
              assertThat(config.redactKeys()).containsExactly("token", "secret");
            });
  }

  @Test
  void internalBaseUrlIsUsedWithoutOverride() {
    runner
        .withPropertyValues("INTERNAL_API_BASE_URL=http://internal-api.test:8005")
        .run(
            ctx ->
                assertThat(ctx.getBean(InternalObservabilityClient.class).endpoint().baseUrl())
                    .isEqualTo("http://internal-api.test:8005"));
  }

  @Test
  void disabledByProperty() {
    runner
        .withPropertyValues("tracelogger.enabled=false")
        .run(ctx -> assertThat(ctx).doesNotHaveBean(TraceLogger.class));
  }

  @Test
  void disabledByEnvironmentVariable() {
    runner
        .withPropertyValues("TRACE_LOGGER_ENABLED=no")
        .run(ctx -> assertThat(ctx).doesNotHaveBean(TraceLogger.class));
  }

  @Test
  void propertyOverridesEnvironmentSwitch() {
    runner
        .withPropertyValues("TRACE_LOGGER_ENABLED=false", "tracelogger.enabled=true")
        .run(ctx -> assertThat(ctx).hasSingleBean(TraceLogger.class));
  }

  @Test
  void missingSecretFailsStartup() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(TraceLoggerAutoConfiguration.class))
        .withPropertyValues("INTERNAL_AUTH_SECRET=")
        .run(
            ctx ->
                assertThat(ctx)
                    .hasFailed()
                    .getFailure()
                    .rootCause()
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("INTERNAL_AUTH_SECRET"));
  }

  @Test
  void customExporterReplacesHttpClient() {
    runner
        .withUserConfiguration(RecordingExporterConfig.class)
        .run(
            ctx -> {
              assertThat(ctx).doesNotHaveBean(InternalObservabilityClient.class);
              ctx.getBean(TraceLogger.class)
                  .captureRequest(TraceDirection.INBOUND, "/ping", "GET")
                  .close();
              assertThat(ctx.getBean(RecordingExporterConfig.class).sent).hasSize(1);
            });
  }

  @Test
  void clientInterceptorCanBeSwitchedOff() {
    runner
        .withPropertyValues("tracelogger.client-interceptor.enabled=false")
        .run(
            ctx -> {
              assertThat(ctx).doesNotHaveBean(TraceLoggingClientInterceptor.class);
              assertThat(ctx).doesNotHaveBean(RestClientCustomizer.class);
              assertThat(ctx).doesNotHaveBean(RestTemplateCustomizer.class);
            });
  }

  @Test
  void restTemplatesGetTheClientInterceptorOnce() {
    runner.run(
        ctx -> {
          TraceLoggingClientInterceptor interceptor =
              ctx.getBean(TraceLoggingClientInterceptor.class);
          RestTemplateCustomizer customizer = ctx.getBean(RestTemplateCustomizer.class);
          RestTemplate restTemplate = new RestTemplate();

          customizer.customize(restTemplate);
          customizer.customize(restTemplate);

          assertThat(restTemplate.getInterceptors()).containsExactly(interceptor);
        });
  }

  @Test
  void restTemplateBuiltFromTheBuilderTracesItsCalls() {
    runner
        .withUserConfiguration(RecordingExporterConfig.class)
        .run(
            ctx -> {
              RestTemplate restTemplate =
                  new RestTemplateBuilder(ctx.getBean(RestTemplateCustomizer.class)).build();
              MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
              server
                  .expect(requestTo("http://ledger.test/v1/entries"))
                  .andExpect(header("X-Trace-Id", "trace-rt"))
                  .andRespond(withStatus(HttpStatus.ACCEPTED));

              try (TraceContext.Scope ignored = TraceContext.open("trace-rt")) {
                restTemplate.postForEntity("http://ledger.test/v1/entries", "{}", Void.class);
              }

              server.verify();
              assertThat(ctx.getBean(RecordingExporterConfig.class).sent).hasSize(1);
            });
  }

  @Configuration(proxyBeanMethods = false)
  static class RecordingExporterConfig {
    final List<Object> sent = new ArrayList<>();

    @Bean
    TraceExporter recordingExporter() {
      return sent::add;
    }
  }
}
