package io.tracelogger.platform.starter.observability;

import java.util.Locale;
import org.springframework.boot.autoconfigure.condition.ConditionMessage;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches unless tracing was switched off. {@code tracelogger.enabled} wins; otherwise {@code
 * TRACE_LOGGER_ENABLED} must be {@code true} (any case) when present.
 */
class TraceLoggerEnabledCondition extends SpringBootCondition {

  static final String PROPERTY = "tracelogger.enabled";
  static final String ENV_VAR = "TRACE_LOGGER_ENABLED";

  @Override
  public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
    ConditionMessage.Builder message = ConditionMessage.forCondition("TraceLoggerEnabled");
    Environment env = context.getEnvironment();

    String explicit = env.getProperty(PROPERTY);
    if (explicit != null) {
      boolean on = Boolean.parseBoolean(explicit.trim());
      return new ConditionOutcome(on, message.because(PROPERTY + "=" + explicit));
    }
    String fromEnv = env.getProperty(ENV_VAR);
    if (fromEnv != null) {
      boolean on = "true".equals(fromEnv.trim().toLowerCase(Locale.ROOT));
      return new ConditionOutcome(on, message.because(ENV_VAR + "=" + fromEnv));
    }
    return ConditionOutcome.match(message.because("enabled by default"));
  }
}
