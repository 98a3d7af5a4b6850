package io.tracelogger.platform.application.trace;

/**
 * Work executed inside a capture session by {@link TraceLogger#within(CaptureRequest,
 * CaptureBody)}.
 *
 * @param <T> result type
 * @param <E> checked failure the body may raise
 */
@FunctionalInterface
public interface CaptureBody<T, E extends Exception> {

  T apply(TraceCapture capture) throws E;
}
