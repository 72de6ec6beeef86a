package com.scholary.tts.handler.job;

/**
 * Thrown when admission control rejects a submission.
 *
 * <p>Nothing was enqueued. The client is expected to retry later.
 */
public class CapacityExceededException extends RuntimeException {

  private final int queueSize;
  private final int limit;

  public CapacityExceededException(int queueSize, int limit) {
    this(queueSize, limit, null);
  }

  public CapacityExceededException(int queueSize, int limit, Throwable cause) {
    super(
        String.format("Server is at capacity (queueSize=%d, limit=%d)", queueSize, limit), cause);
    this.queueSize = queueSize;
    this.limit = limit;
  }

  public int getQueueSize() {
    return queueSize;
  }

  public int getLimit() {
    return limit;
  }
}
