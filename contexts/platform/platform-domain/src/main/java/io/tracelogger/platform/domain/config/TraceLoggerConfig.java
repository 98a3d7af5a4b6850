package io.tracelogger.platform.domain.config;

import jakarta.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable runtime configuration of a trace logger.
 *
 * <p>Holds the identity of the emitting service and the optional destination override. One
 * instance is shared read-only by every capture session created from the same logger.
 *
 * <p>Only presence of {@code serviceName} and {@code environment} is checked; empty strings are
 * accepted as given.
 */
public final class TraceLoggerConfig {

  private final String serviceName;
  private final String environment;
  private final String apiUrl; // nullable; normalized without trailing '/'
  private final Set<String> redactKeys;
  private final boolean fallbackLogging;

  private TraceLoggerConfig(Builder b) {
    this.serviceName = Objects.requireNonNull(b.serviceName, "serviceName");
    this.environment = Objects.requireNonNull(b.environment, "environment");
    this.apiUrl = normalizeUrl(b.apiUrl);
    this.redactKeys = Collections.unmodifiableSet(new LinkedHashSet<>(b.redactKeys));
    this.fallbackLogging = b.fallbackLogging;
  }

  /**
   * Shortcut for a config with defaults for everything but the service identity.
   *
   * @param serviceName emitting service
   * @param environment deployment environment (e.g. {@code prod})
   * @return config without API override or redaction
   * @throws NullPointerException if any argument is null
   */
  public static TraceLoggerConfig of(String serviceName, String environment) {
    return builder(serviceName, environment).build();
  }

  /**
   * Starts a builder with the two required fields.
   *
   * @param serviceName emitting service
   * @param environment deployment environment
   * @return builder
   */
  public static Builder builder(String serviceName, String environment) {
    return new Builder(serviceName, environment);
  }

  public String serviceName() {
    return serviceName;
  }

  public String environment() {
    return environment;
  }

  /** Destination base URL override; empty means the exporter picks its default. */
  public Optional<String> apiUrl() {
    return Optional.ofNullable(apiUrl);
  }

  /** Payload keys whose values get masked before export. */
  public Set<String> redactKeys() {
    return redactKeys;
  }

  /** Whether a record that failed to export is written to the application log instead. */
  public boolean fallbackLogging() {
    return fallbackLogging;
  }

  private static String normalizeUrl(@Nullable String url) {
    if (url == null) {
      return null;
    }
    String s = url.trim();
    while (s.endsWith("/")) {
      s = s.substring(0, s.length() - 1);
    }
    return s.isEmpty() ? null : s;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TraceLoggerConfig other)) {
      return false;
    }
    return fallbackLogging == other.fallbackLogging
        && serviceName.equals(other.serviceName)
        && environment.equals(other.environment)
        && Objects.equals(apiUrl, other.apiUrl)
        && redactKeys.equals(other.redactKeys);
  }

  @Override
  public int hashCode() {
    return Objects.hash(serviceName, environment, apiUrl, redactKeys, fallbackLogging);
  }

  @Override
  public String toString() {
    return "TraceLoggerConfig{serviceName='"
        + serviceName
        + "', environment='"
        + environment
        + "', apiUrl="
        + apiUrl
        + ", redactKeys="
        + redactKeys
        + ", fallbackLogging="
        + fallbackLogging
        + '}';
  }

  /** Fluent builder for {@link TraceLoggerConfig}. */
  public static final class Builder {
    private final String serviceName;
    private final String environment;
    private String apiUrl;
    private final Set<String> redactKeys = new LinkedHashSet<>();
    private boolean fallbackLogging = true;

    private Builder(String serviceName, String environment) {
      this.serviceName = serviceName;
      this.environment = environment;
    }

    /**
     * Overrides the destination base URL. Blank values mean "no override".
     *
     * @param apiUrl base URL, trailing slashes are dropped
     * @return this builder
     */
    public Builder apiUrl(@Nullable String apiUrl) {
      this.apiUrl = apiUrl;
      return this;
    }

    /**
     * Adds payload keys to mask. Blank entries are ignored.
     *
     * @param keys keys, matched case-insensitively at export time
     * @return this builder
     */
    public Builder redactKeys(@Nullable Iterable<String> keys) {
      if (keys != null) {
        for (String k : keys) {
          if (k != null && !k.isBlank()) {
            this.redactKeys.add(k.trim());
          }
        }
      }
      return this;
    }

    public Builder fallbackLogging(boolean fallbackLogging) {
      this.fallbackLogging = fallbackLogging;
      return this;
    }

    /**
     * Builds the config.
     *
     * @return immutable config
     * @throws NullPointerException if service name or environment is null
     */
    public TraceLoggerConfig build() {
      return new TraceLoggerConfig(this);
    }
  }
}
