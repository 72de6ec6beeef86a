package com.scholary.tts.handler.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a synthesis job.
 *
 * <p>QUEUED → PROCESSING → COMPLETED | FAILED. COMPLETED and FAILED are terminal.
 */
public enum JobStatus {
  QUEUED,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** Lower-case name used on the wire. */
  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
