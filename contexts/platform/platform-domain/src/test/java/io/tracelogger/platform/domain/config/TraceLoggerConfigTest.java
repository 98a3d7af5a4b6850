package io.tracelogger.platform.domain.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class TraceLoggerConfigTest {

  @Test
  void defaults() {
    TraceLoggerConfig config = TraceLoggerConfig.of("payments", "prod");

    assertThat(config.serviceName()).isEqualTo("payments");
    assertThat(config.environment()).isEqualTo("prod");
    assertThat(config.apiUrl()).isEmpty();
    assertThat(config.redactKeys()).isEmpty();
    assertThat(config.fallbackLogging()).isTrue();
  }

  @Test
  void missingRequiredFieldsFailAtConstruction() {
    assertThatThrownBy(() -> TraceLoggerConfig.of(null, "prod"))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("serviceName");
    assertThatThrownBy(() -> TraceLoggerConfig.of("payments", null))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("environment");
  }

  @Test
  void emptyStringsAreAccepted() {
    TraceLoggerConfig config = TraceLoggerConfig.of("", "");

    assertThat(config.serviceName()).isEmpty();
  }

  @Test
  void apiUrlIsNormalized() {
    assertThat(
            TraceLoggerConfig.builder("s", "e").apiUrl("http://collector:8005//").build().apiUrl())
        .contains("http://collector:8005");
    assertThat(TraceLoggerConfig.builder("s", "e").apiUrl("  ").build().apiUrl()).isEmpty();
  }

  @Test
  void redactKeysSkipBlanksAndAreImmutable() {
    TraceLoggerConfig config =
        TraceLoggerConfig.builder("s", "e").redactKeys(List.of("password", " ", "token ")).build();

    assertThat(config.redactKeys()).containsExactly("password", "token");
    assertThatThrownBy(() -> config.redactKeys().add("x"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
