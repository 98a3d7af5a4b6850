package io.tracelogger.platform.domain.error;

import jakarta.annotation.Nullable;
import java.io.Serial;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Raised by an exporter when a trace record could not be delivered.
 *
 * <p>Capture sessions always catch it: tracing is best-effort and must not fail the traced
 * request. The {@link Kind} tells the operator where to look; rejected and authentication
 * failures are expected operational states and skip stack-trace capture.
 */
public final class TraceExportException extends RuntimeException {

  @Serial private static final long serialVersionUID = 1L;

  /** Failure categories of an export attempt. */
  public enum Kind {
    /** Connection refused, timeout, DNS, broken stream. */
    TRANSPORT("Transport Failure", true),
    /** The collaborator refused our credentials (401/403). */
    AUTHENTICATION("Authentication Failed", false),
    /** Any other non-2xx answer. */
    REJECTED("Rejected By Collaborator", false),
    /** The record could not be turned into JSON. */
    SERIALIZATION("Serialization Failure", true);

    private final String title;
    private final boolean captureStackTrace;

    Kind(String title, boolean captureStackTrace) {
      this.title = title;
      this.captureStackTrace = captureStackTrace;
    }

    public String title() {
      return title;
    }
  }

  private final Kind kind;
  private final Integer status;

  private TraceExportException(
      Kind kind, @Nullable Integer status, String detail, @Nullable Throwable cause) {
    super(detail, cause, true, kind.captureStackTrace);
    this.kind = kind;
    this.status = status;
  }

  /**
   * The request never produced an HTTP answer.
   *
   * @param detail non-sensitive description
   * @param cause underlying I/O failure
   * @return exception of kind {@link Kind#TRANSPORT}
   */
  public static TraceExportException transport(String detail, @Nullable Throwable cause) {
    return new TraceExportException(Kind.TRANSPORT, null, requireDetail(detail), cause);
  }

  /**
   * The collaborator answered with a non-2xx status. 401 and 403 map to {@link
   * Kind#AUTHENTICATION}, everything else to {@link Kind#REJECTED}.
   *
   * @param status HTTP status received
   * @param detail non-sensitive description
   * @return exception carrying the status
   */
  public static TraceExportException rejected(int status, String detail) {
    Kind kind = (status == 401 || status == 403) ? Kind.AUTHENTICATION : Kind.REJECTED;
    return new TraceExportException(kind, status, requireDetail(detail), null);
  }

  public static TraceExportException serialization(String detail, Throwable cause) {
    return new TraceExportException(Kind.SERIALIZATION, null, requireDetail(detail), cause);
  }

  public Kind kind() {
    return kind;
  }

  /** HTTP status of the failed call, when the collaborator answered at all. */
  public OptionalInt status() {
    return status == null ? OptionalInt.empty() : OptionalInt.of(status);
  }

  private static String requireDetail(String detail) {
    Objects.requireNonNull(detail, "detail");
    if (detail.isBlank()) {
      throw new IllegalArgumentException("detail must not be blank");
    }
    return detail;
  }
}
