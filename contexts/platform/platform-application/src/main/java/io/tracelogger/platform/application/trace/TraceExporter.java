package io.tracelogger.platform.application.trace;

import io.tracelogger.platform.domain.error.TraceExportException;
import io.tracelogger.platform.domain.trace.TraceRecord;

/**
 * Port (SPI) to the collaborator that delivers trace records to the observability API.
 *
 * <p>Implementations handle authentication, transport and serialization. They must block until
 * the record is delivered or has failed, and must not retry on their own.
 */
@FunctionalInterface
public interface TraceExporter {

  /**
   * Delivers one record.
   *
   * @param record the record to send
   * @throws TraceExportException if delivery failed
   */
  void send(TraceRecord record);
}
