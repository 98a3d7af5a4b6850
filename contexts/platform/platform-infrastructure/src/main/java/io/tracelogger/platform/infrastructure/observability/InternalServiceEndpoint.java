package io.tracelogger.platform.infrastructure.observability;

import jakarta.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Where and how to reach the internal observability API.
 *
 * <p>Base URL resolution: explicit override, then {@value #ENV_BASE_URL}, then {@value
 * #DEFAULT_BASE_URL}. The shared secret comes from the explicit value or {@value
 * #ENV_AUTH_SECRET}; without one the endpoint cannot be built.
 */
public final class InternalServiceEndpoint {

  public static final String ENV_BASE_URL = "INTERNAL_API_BASE_URL";
  public static final String ENV_AUTH_SECRET = "INTERNAL_AUTH_SECRET";
  public static final String DEFAULT_BASE_URL = "http://internal-api:8005";

  private final String baseUrl;
  private final String authSecret;

  private InternalServiceEndpoint(String baseUrl, String authSecret) {
    this.baseUrl = baseUrl;
    this.authSecret = authSecret;
  }

  /**
   * Resolves the endpoint from the process environment.
   *
   * @param baseUrlOverride configured base URL, if any
   * @return endpoint
   * @throws IllegalStateException if {@value #ENV_AUTH_SECRET} is not set
   */
  public static InternalServiceEndpoint fromEnvironment(Optional<String> baseUrlOverride) {
    return resolve(baseUrlOverride, null, System::getenv);
  }

  /**
   * Resolves the endpoint.
   *
   * @param baseUrlOverride configured base URL, if any
   * @param authSecret configured secret; blank means "read the environment"
   * @param env environment lookup
   * @return endpoint
   * @throws IllegalStateException if no secret is available
   */
  public static InternalServiceEndpoint resolve(
      Optional<String> baseUrlOverride,
      @Nullable String authSecret,
      Function<String, String> env) {
    Objects.requireNonNull(baseUrlOverride, "baseUrlOverride");
    Objects.requireNonNull(env, "env");

    String base =
        baseUrlOverride
            .filter(s -> !s.isBlank())
            .or(() -> Optional.ofNullable(env.apply(ENV_BASE_URL)).filter(s -> !s.isBlank()))
            .orElse(DEFAULT_BASE_URL)
            .trim();
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }

    String secret = firstNonBlank(authSecret, env.apply(ENV_AUTH_SECRET));
    if (secret == null) {
      throw new IllegalStateException(
          ENV_AUTH_SECRET + " is not set; the observability API requires an internal auth secret");
    }
    return new InternalServiceEndpoint(base, secret);
  }

  public String baseUrl() {
    return baseUrl;
  }

  /** Value of the {@code Authorization} header sent with every call. */
  public String authorizationHeader() {
    return "Bearer " + authSecret;
  }

  @Nullable
  private static String firstNonBlank(@Nullable String a, @Nullable String b) {
    if (a != null && !a.isBlank()) {
      return a.trim();
    }
    if (b != null && !b.isBlank()) {
      return b.trim();
    }
    return null;
  }

  @Override
  public String toString() {
    return "InternalServiceEndpoint{baseUrl='" + baseUrl + "', authSecret=***}";
  }
}
