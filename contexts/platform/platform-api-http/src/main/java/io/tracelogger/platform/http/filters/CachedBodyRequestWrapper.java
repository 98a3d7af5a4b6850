package io.tracelogger.platform.http.filters;

import io.tracelogger.platform.http.payload.PayloadParser;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request whose body was already consumed by the filter; replays the cached bytes.
 *
 * <p>For form posts the servlet container can no longer parse parameters from the stream, so the
 * wrapper serves them itself: query string first, then the form body.
 */
final class CachedBodyRequestWrapper extends HttpServletRequestWrapper {

  private static final Logger log = LoggerFactory.getLogger(CachedBodyRequestWrapper.class);

  private final byte[] cached;
  private final boolean formBody;
  private Map<String, String[]> parameters;

  CachedBodyRequestWrapper(HttpServletRequest request, byte[] cached, boolean formBody) {
    super(request);
    this.cached = (cached != null ? cached : new byte[0]);
    this.formBody = formBody;
  }

  @Override
  public ServletInputStream getInputStream() {
    final ByteArrayInputStream bais = new ByteArrayInputStream(cached);
    return new ServletInputStream() {
      @Override
      public int read() {
        return bais.read();
      }

      @Override
      public int read(byte[] b, int off, int len) {
        return bais.read(b, off, len);
      }

      @Override
      public boolean isFinished() {
        return bais.available() == 0;
      }

      @Override
      public boolean isReady() {
        return true;
      }

      @Override
      public void setReadListener(ReadListener readListener) {
        throw new UnsupportedOperationException("cached body is read synchronously");
      }
    };
  }

  @Override
  public BufferedReader getReader() {
    String enc = getCharacterEncoding();
    Charset cs = (enc != null && Charset.isSupported(enc)) ? Charset.forName(enc) : StandardCharsets.UTF_8;
    return new BufferedReader(new InputStreamReader(getInputStream(), cs));
  }

  @Override
  public int getContentLength() {
    return cached.length;
  }

  @Override
  public long getContentLengthLong() {
    return cached.length;
  }

  // ---------------- Parameters (form posts only) ----------------

  @Override
  public String getParameter(String name) {
    String[] values = getParameterMap().get(name);
    return (values == null || values.length == 0) ? null : values[0];
  }

  @Override
  public Map<String, String[]> getParameterMap() {
    if (!formBody) {
      return super.getParameterMap();
    }
    if (parameters == null) {
      Map<String, String[]> merged = new LinkedHashMap<>();
      addAll(merged, getQueryString());
      addAll(merged, new String(cached, StandardCharsets.UTF_8));
      parameters = Collections.unmodifiableMap(merged);
    }
    return parameters;
  }

  @Override
  public Enumeration<String> getParameterNames() {
    return Collections.enumeration(getParameterMap().keySet());
  }

  @Override
  public String[] getParameterValues(String name) {
    String[] values = getParameterMap().get(name);
    return values == null ? null : values.clone();
  }

  private static void addAll(Map<String, String[]> target, String encoded) {
    List<Map.Entry<String, String>> pairs;
    try {
      pairs = PayloadParser.formPairs(encoded);
    } catch (IllegalArgumentException e) {
      log.debug("form_parameters_malformed msg={}", e.getMessage());
      return;
    }
    for (Map.Entry<String, String> pair : pairs) {
      String[] prev = target.get(pair.getKey());
      if (prev == null) {
        target.put(pair.getKey(), new String[] {pair.getValue()});
      } else {
        String[] next = Arrays.copyOf(prev, prev.length + 1);
        next[prev.length] = pair.getValue();
        target.put(pair.getKey(), next);
      }
    }
  }
}
