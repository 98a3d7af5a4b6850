package io.tracelogger.platform.domain.trace;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.MDC;

/**
 * Per-thread holder of the active trace id.
 *
 * <p>- Pure domain; no Spring dependencies. <br>
 * - Mirrors the active trace id to MDC ("traceId") for logs. <br>
 * - Scopes nest: closing a scope restores whatever was active before it.
 */
public final class TraceContext {

  /** Canonical header carrying the trace id between services. */
  public static final String HEADER = "X-Trace-Id";

  /** MDC key for logs (must align with logging config). */
  public static final String MDC_TRACE_ID = "traceId";

  private static final ThreadLocal<String> TL_TRACE_ID = new ThreadLocal<>();

  private TraceContext() {}

  /**
   * Activates a trace id on the current thread.
   *
   * <p>Call {@link Scope#close()} in a finally block to restore the previous context.
   *
   * @param traceId trace id to activate
   * @return scope restoring the previous trace id/MDC on close
   * @throws NullPointerException if {@code traceId} is null
   */
  public static Scope open(String traceId) {
    Objects.requireNonNull(traceId, "traceId");
    final String prev = TL_TRACE_ID.get();
    final String prevMdc = MDC.get(MDC_TRACE_ID);

    TL_TRACE_ID.set(traceId);
    MDC.put(MDC_TRACE_ID, traceId);
    return new Scope(prev, prevMdc);
  }

  /**
   * Returns the trace id active on this thread, if any.
   *
   * @return optional trace id
   */
  public static Optional<String> currentTraceId() {
    return Optional.ofNullable(TL_TRACE_ID.get());
  }

  /** Clears the trace id from this thread and removes the MDC entry. */
  public static void clear() {
    TL_TRACE_ID.remove();
    MDC.remove(MDC_TRACE_ID);
  }

  /**
   * Disposable scope that restores the previous trace id on close.
   *
   * <p>Instances are created by {@link TraceContext#open(String)}.
   */
  public static final class Scope implements AutoCloseable {

    private final String previousTraceId;
    private final String previousMdc;

    private Scope(String previousTraceId, String previousMdc) {
      this.previousTraceId = previousTraceId;
      this.previousMdc = previousMdc;
    }

    @Override
    public void close() {
      if (previousTraceId == null) {
        TL_TRACE_ID.remove();
      } else {
        TL_TRACE_ID.set(previousTraceId);
      }

      if (previousMdc == null) {
        MDC.remove(MDC_TRACE_ID);
      } else {
        MDC.put(MDC_TRACE_ID, previousMdc);
      }
    }
  }
}
