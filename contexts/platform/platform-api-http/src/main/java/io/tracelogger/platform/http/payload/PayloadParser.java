package io.tracelogger.platform.http.payload;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns captured HTTP bodies into structured payloads for trace records.
 *
 * <ul>
 *   <li>JSON bodies are parsed with Jackson into maps, lists and scalars.
 *   <li>{@code application/x-www-form-urlencoded} bodies become a flat map (last value wins,
 *       blank values dropped).
 *   <li>A body of either kind that fails to parse is kept as {@code {"raw": <first 2048 bytes>}}.
 *   <li>Any other content type yields no payload.
 * </ul>
 *
 * <p>Thread-safety: stateless apart from the (thread-safe) {@link ObjectMapper}.
 */
public final class PayloadParser {

  public static final int RAW_PREVIEW_BYTES = 2048;

  /** Body encodings we know how to parse. */
  public enum Kind {
    JSON,
    FORM,
    NONE;

    /**
     * Classifies a {@code Content-Type} header value.
     *
     * @param contentType header value, may be null
     * @return kind, {@link #NONE} when unknown
     */
    public static Kind of(@Nullable String contentType) {
      if (contentType == null) {
        return NONE;
      }
      String ct = contentType.toLowerCase(Locale.ROOT);
      if (ct.contains("application/json") || ct.contains("+json")) {
        return JSON;
      }
      if (ct.contains("application/x-www-form-urlencoded")) {
        return FORM;
      }
      return NONE;
    }
  }

  private final ObjectMapper mapper;

  public PayloadParser(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Parses a body.
   *
   * @param body raw bytes, may be empty
   * @param kind body encoding
   * @return structured payload, the raw preview on parse failure, or {@code null} for empty
   *     bodies and unknown encodings
   */
  @Nullable
  public Object parse(byte[] body, Kind kind) {
    if (body == null || body.length == 0 || kind == Kind.NONE) {
      return null;
    }
    try {
      return switch (kind) {
        case JSON -> mapper.readValue(body, Object.class);
        case FORM -> parseForm(strictUtf8(body), false);
        case NONE -> null;
      };
    } catch (IOException | IllegalArgumentException e) {
      Map<String, Object> raw = new LinkedHashMap<>(2);
      raw.put("raw", rawPreview(body));
      return raw;
    }
  }

  /**
   * Parses an {@code application/x-www-form-urlencoded} string. Later duplicates overwrite
   * earlier ones.
   *
   * @param encoded encoded pairs, may be null
   * @param keepBlankValues whether pairs with an empty value are kept
   * @return insertion-ordered map
   * @throws IllegalArgumentException on malformed percent-escapes
   */
  public static Map<String, String> parseForm(@Nullable String encoded, boolean keepBlankValues) {
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : formPairs(encoded)) {
      if (!e.getValue().isEmpty() || keepBlankValues) {
        out.put(e.getKey(), e.getValue());
      }
    }
    return out;
  }

  /**
   * Decodes every pair of an {@code application/x-www-form-urlencoded} string, duplicates and
   * blank values included, in order.
   *
   * @param encoded encoded pairs, may be null
   * @return decoded pairs
   * @throws IllegalArgumentException on malformed percent-escapes
   */
  public static List<Map.Entry<String, String>> formPairs(@Nullable String encoded) {
    List<Map.Entry<String, String>> out = new ArrayList<>();
    if (encoded == null || encoded.isEmpty()) {
      return out;
    }
    for (String part : encoded.split("[&;]")) {
      if (part.isEmpty()) {
        continue;
      }
      int eq = part.indexOf('=');
      String k = URLDecoder.decode(eq >= 0 ? part.substring(0, eq) : part, StandardCharsets.UTF_8);
      String v = eq >= 0 ? URLDecoder.decode(part.substring(eq + 1), StandardCharsets.UTF_8) : "";
      out.add(Map.entry(k, v));
    }
    return out;
  }

  /** First {@value #RAW_PREVIEW_BYTES} bytes decoded as UTF-8, invalid sequences dropped. */
  static String rawPreview(byte[] body) {
    int len = Math.min(body.length, RAW_PREVIEW_BYTES);
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.IGNORE)
          .onUnmappableCharacter(CodingErrorAction.IGNORE)
          .decode(ByteBuffer.wrap(body, 0, len))
          .toString();
    } catch (CharacterCodingException e) {
      // IGNORE actions never report; keep a lossy decode as last resort
      return new String(body, 0, len, StandardCharsets.UTF_8);
    }
  }

  private static String strictUtf8(byte[] body) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(body))
          .toString();
    } catch (CharacterCodingException e) {
      throw new IllegalArgumentException("form body is not valid UTF-8", e);
    }
  }
}
