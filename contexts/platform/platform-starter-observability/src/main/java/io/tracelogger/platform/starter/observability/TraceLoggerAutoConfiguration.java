package io.tracelogger.platform.starter.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.tracelogger.platform.application.trace.TraceExporter;
import io.tracelogger.platform.application.trace.TraceLogger;
import io.tracelogger.platform.domain.config.TraceLoggerConfig;
import io.tracelogger.platform.http.client.TraceLoggingClientInterceptor;
import io.tracelogger.platform.http.payload.PayloadParser;
import io.tracelogger.platform.infrastructure.observability.InternalObservabilityClient;
import io.tracelogger.platform.infrastructure.observability.InternalServiceEndpoint;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.boot.web.client.RestTemplateCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.core.env.Environment;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the trace logger: config, exporter, session factory and the outbound client interceptor.
 * All wiring is confined to the starter; core remains framework-agnostic.
 *
 * <p>Resolution of unset properties:
 *
 * <ul>
 *   <li>service name: {@code TRACE_LOGGER_SERVICE_NAME}, then {@code spring.application.name}
 *       (lowercased, spaces to underscores), then {@code unknown_service}
 *   <li>environment: {@code ENV}, then {@code local}
 *   <li>API URL: {@code TRACE_LOGGER_API_URL}, then {@code INTERNAL_API_BASE_URL}, then {@code
 *       http://internal-api:8005}
 *   <li>redact keys: comma-separated {@code TRACE_LOGGER_REDACT_KEYS}
 * </ul>
 */
@AutoConfiguration
@EnableConfigurationProperties(TraceLoggerProperties.class)
@ConditionalOnClass({RestClient.class, TraceLogger.class})
@Conditional(TraceLoggerEnabledCondition.class)
public class TraceLoggerAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(TraceLoggerAutoConfiguration.class);

  static final String ENV_SERVICE_NAME = "TRACE_LOGGER_SERVICE_NAME";
  static final String ENV_ENVIRONMENT = "ENV";
  static final String ENV_API_URL = "TRACE_LOGGER_API_URL";
  static final String ENV_REDACT_KEYS = "TRACE_LOGGER_REDACT_KEYS";
  static final String DEFAULT_SERVICE_NAME = "unknown_service";
  static final String DEFAULT_ENVIRONMENT = "local";

  private static final String INSTRUMENTATION_SCOPE = "io.tracelogger.platform";

  @Bean
  @ConditionalOnMissingBean
  public TraceLoggerConfig traceLoggerConfig(TraceLoggerProperties p, Environment env) {
    TraceLoggerConfig config = resolveConfig(p, env);
    log.info(
        "trace_logger_configured service={} environment={} api_url={} redact_keys={}",
        config.serviceName(),
        config.environment(),
        config.apiUrl().orElse("(default)"),
        config.redactKeys().size());
    return config;
  }

  @Bean
  @ConditionalOnMissingBean(TraceExporter.class)
  public InternalObservabilityClient internalObservabilityClient(
      TraceLoggerConfig config,
      TraceLoggerProperties p,
      Environment env,
      ObjectProvider<ObjectMapper> objectMapper,
      ObjectProvider<MeterRegistry> meterRegistry,
      ObjectProvider<OpenTelemetry> openTelemetry) {
    InternalServiceEndpoint endpoint =
        InternalServiceEndpoint.resolve(config.apiUrl(), p.getAuthSecret(), env::getProperty);

    // Own builder: the shared RestClient.Builder carries the tracing interceptor.
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(p.getConnectTimeout());
    requestFactory.setReadTimeout(p.getReadTimeout());

    return new InternalObservabilityClient(
        RestClient.builder().requestFactory(requestFactory),
        endpoint,
        objectMapper.getIfAvailable(ObjectMapper::new),
        meterRegistry.getIfAvailable(() -> Metrics.globalRegistry),
        openTelemetry.getIfAvailable(GlobalOpenTelemetry::get).getTracer(INSTRUMENTATION_SCOPE));
  }

  @Bean
  @ConditionalOnMissingBean
  public TraceLogger traceLogger(TraceLoggerConfig config, TraceExporter exporter) {
    return new TraceLogger(config, exporter);
  }

  @Bean
  @ConditionalOnMissingBean
  public PayloadParser tracePayloadParser(ObjectProvider<ObjectMapper> objectMapper) {
    return new PayloadParser(objectMapper.getIfAvailable(ObjectMapper::new));
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(
      prefix = "tracelogger.client-interceptor",
      name = "enabled",
      matchIfMissing = true)
  public TraceLoggingClientInterceptor traceLoggingClientInterceptor(
      TraceLogger traceLogger, PayloadParser payloadParser, TraceLoggerProperties p) {
    return new TraceLoggingClientInterceptor(
        traceLogger, payloadParser, p.getFilter().getMaxPayloadBytes());
  }

  @Bean
  @ConditionalOnClass(RestClientCustomizer.class)
  @ConditionalOnProperty(
      prefix = "tracelogger.client-interceptor",
      name = "enabled",
      matchIfMissing = true)
  public RestClientCustomizer traceLoggingRestClientCustomizer(
      TraceLoggingClientInterceptor interceptor) {
    return builder -> builder.requestInterceptor(interceptor);
  }

  @Bean
  @ConditionalOnClass(RestTemplateCustomizer.class)
  @ConditionalOnProperty(
      prefix = "tracelogger.client-interceptor",
      name = "enabled",
      matchIfMissing = true)
  public RestTemplateCustomizer traceLoggingRestTemplateCustomizer(
      TraceLoggingClientInterceptor interceptor) {
    return restTemplate -> {
      if (!restTemplate.getInterceptors().contains(interceptor)) {
        restTemplate.getInterceptors().add(interceptor);
      }
    };
  }

  // ---------------- Helpers ----------------

  static TraceLoggerConfig resolveConfig(TraceLoggerProperties p, Environment env) {
    String serviceName =
        firstNonBlank(p.getServiceName(), env.getProperty(ENV_SERVICE_NAME));
    if (serviceName == null) {
      String app = env.getProperty("spring.application.name");
      serviceName =
          (app == null || app.isBlank())
              ? DEFAULT_SERVICE_NAME
              : app.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }
    String environment = firstNonBlank(p.getEnvironment(), env.getProperty(ENV_ENVIRONMENT));

    List<String> redactKeys = p.getRedactKeys();
    if (redactKeys.isEmpty()) {
      String raw = env.getProperty(ENV_REDACT_KEYS);
      redactKeys = (raw == null) ? List.of() : Arrays.asList(raw.split(","));
    }

    return TraceLoggerConfig.builder(
            serviceName, environment == null ? DEFAULT_ENVIRONMENT : environment)
        .apiUrl(firstNonBlank(p.getApiUrl(), env.getProperty(ENV_API_URL)))
        .redactKeys(redactKeys)
        .fallbackLogging(p.isFallbackLogging())
        .build();
  }

  private static String firstNonBlank(String a, String b) {
    if (a != null && !a.isBlank()) {
      return a.trim();
    }
    if (b != null && !b.isBlank()) {
      return b.trim();
    }
    return null;
  }
}
