package io.tracelogger.platform.domain.trace;

import java.util.Locale;

/** Which side of the service a captured request crossed. */
public enum TraceDirection {
  /** A request received by this service. */
  INBOUND,
  /** A request this service made to another one. */
  OUTBOUND;

  /**
   * Returns the value used on the wire ({@code "inbound"} / {@code "outbound"}).
   *
   * @return lowercase name
   */
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
