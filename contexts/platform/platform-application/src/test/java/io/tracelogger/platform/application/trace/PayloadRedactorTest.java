package io.tracelogger.platform.application.trace;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PayloadRedactorTest {

  private final PayloadRedactor redactor = new PayloadRedactor(List.of("password", " Token "));

  @Test
  void masksMatchingKeysCaseInsensitively() {
    Object out = redactor.redact(Map.of("PASSWORD", "s3cret", "token", "abc", "user", "ann"));

    assertThat(out)
        .isEqualTo(
            Map.of("PASSWORD", PayloadRedactor.REDACTED, "token", PayloadRedactor.REDACTED, "user", "ann"));
  }

  @Test
  void descendsIntoNestedMapsAndLists() {
    Map<String, Object> payload =
        Map.of(
            "user", Map.of("name", "ann", "password", "x"),
            "sessions", List.of(Map.of("token", "t1"), "plain"));

    Object out = redactor.redact(payload);

    assertThat(out)
        .isEqualTo(
            Map.of(
                "user", Map.of("name", "ann", "password", PayloadRedactor.REDACTED),
                "sessions", List.of(Map.of("token", PayloadRedactor.REDACTED), "plain")));
  }

  @Test
  void leavesInputUntouched() {
    Map<String, Object> payload = new HashMap<>();
    payload.put("password", "s3cret");

    redactor.redact(payload);

    assertThat(payload).containsEntry("password", "s3cret");
  }

  @Test
  void selfReferencingPayloadIsCutAtTheRepeat() {
    Map<String, Object> payload = new HashMap<>();
    List<Object> items = new ArrayList<>();
    payload.put("password", "s3cret");
    payload.put("self", payload);
    payload.put("items", items);
    items.add(payload);
    items.add(items);

    Object out = redactor.redact(payload);

    assertThat(out)
        .isEqualTo(
            Map.of(
                "password", PayloadRedactor.REDACTED,
                "self", PayloadRedactor.CYCLE,
                "items", List.of(PayloadRedactor.CYCLE, PayloadRedactor.CYCLE)));
  }

  @Test
  void sharedSiblingsAreNotMistakenForCycles() {
    Map<String, Object> shared = Map.of("token", "t1");

    Object out = redactor.redact(Map.of("a", shared, "b", List.of(shared, shared)));

    Map<String, Object> masked = Map.of("token", PayloadRedactor.REDACTED);
    assertThat(out).isEqualTo(Map.of("a", masked, "b", List.of(masked, masked)));
  }

  @Test
  void nonMapPayloadsPassThrough() {
    List<Object> list = List.of(Map.of("password", "x"));

    assertThat(redactor.redact(list)).isSameAs(list);
    assertThat(redactor.redact("password=x")).isEqualTo("password=x");
    assertThat(redactor.redact(null)).isNull();
  }

  @Test
  void inactiveWithoutKeys() {
    PayloadRedactor none = new PayloadRedactor(List.of(" ", ""));
    Map<String, Object> payload = Map.of("password", "x");

    assertThat(none.isActive()).isFalse();
    assertThat(none.redact(payload)).isSameAs(payload);
  }
}
