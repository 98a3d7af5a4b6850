package io.tracelogger.platform.starter.observability;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Prefix: tracelogger
 *
 * <p>Unset identity values fall back to the {@code TRACE_LOGGER_*}, {@code ENV} and {@code
 * INTERNAL_*} environment variables (see {@link TraceLoggerAutoConfiguration}).
 */
@Validated
@ConfigurationProperties(prefix = "tracelogger")
public class TraceLoggerProperties {

  /**
   * Master switch, declared here for configuration metadata. {@link TraceLoggerEnabledCondition}
   * reads {@code tracelogger.enabled} from the environment itself, before binding; when unset,
   * {@code TRACE_LOGGER_ENABLED} decides (default on).
   */
  private boolean enabled = true;

  /** Emitting service name. */
  private String serviceName;

  /** Deployment environment, e.g. prod. */
  private String environment;

  /** Base URL of the observability API. */
  private String apiUrl;

  /** Shared secret for the observability API; defaults to {@code INTERNAL_AUTH_SECRET}. */
  private String authSecret;

  /** Payload keys masked before export (case-insensitive). */
  @NotNull private List<String> redactKeys = new ArrayList<>();

  /** Write records that failed to export to the application log. */
  private boolean fallbackLogging = true;

  @NotNull private Duration connectTimeout = Duration.ofSeconds(2);

  @NotNull private Duration readTimeout = Duration.ofSeconds(5);

  @Valid private final Filter filter = new Filter();

  @Valid private final ClientInterceptor clientInterceptor = new ClientInterceptor();

  // Getters / Setters
  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getServiceName() {
    return serviceName;
  }

  public void setServiceName(String serviceName) {
    this.serviceName = serviceName;
  }

  public String getEnvironment() {
    return environment;
  }

  public void setEnvironment(String environment) {
    this.environment = environment;
  }

  public String getApiUrl() {
    return apiUrl;
  }

  public void setApiUrl(String apiUrl) {
    this.apiUrl = apiUrl;
  }

  public String getAuthSecret() {
    return authSecret;
  }

  public void setAuthSecret(String authSecret) {
    this.authSecret = authSecret;
  }

  public List<String> getRedactKeys() {
    return Collections.unmodifiableList(redactKeys);
  }

  public void setRedactKeys(List<String> redactKeys) {
    this.redactKeys = (redactKeys == null) ? new ArrayList<>() : new ArrayList<>(redactKeys);
  }

  public boolean isFallbackLogging() {
    return fallbackLogging;
  }

  public void setFallbackLogging(boolean fallbackLogging) {
    this.fallbackLogging = fallbackLogging;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public void setReadTimeout(Duration readTimeout) {
    this.readTimeout = readTimeout;
  }

  public Filter getFilter() {
    return filter;
  }

  public ClientInterceptor getClientInterceptor() {
    return clientInterceptor;
  }

  /** Inbound servlet filter settings. */
  public static class Filter {

    private boolean enabled = true;

    @NotEmpty private List<String> urlPatterns = new ArrayList<>(List.of("/*"));

    /** Bodies larger than this are passed through without being parsed. */
    @Min(0)
    private int maxPayloadBytes = 65536;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public List<String> getUrlPatterns() {
      return Collections.unmodifiableList(urlPatterns);
    }

    public void setUrlPatterns(List<String> urlPatterns) {
      this.urlPatterns = (urlPatterns == null) ? new ArrayList<>() : new ArrayList<>(urlPatterns);
    }

    public int getMaxPayloadBytes() {
      return maxPayloadBytes;
    }

    public void setMaxPayloadBytes(int maxPayloadBytes) {
      this.maxPayloadBytes = maxPayloadBytes;
    }
  }

  /** Outbound {@code RestClient} interceptor settings. */
  public static class ClientInterceptor {

    private boolean enabled = true;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }
  }
}
