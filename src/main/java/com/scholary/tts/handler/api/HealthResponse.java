package com.scholary.tts.handler.api;

/**
 * Response for the health endpoint.
 *
 * <p>On an internal error the status is "unhealthy" and every counter is zero.
 */
public record HealthResponse(
    String status,
    int audioFilesCount,
    int activeJobsSize,
    int memoryJobsCount,
    String message) {

  public static HealthResponse healthy(int audioFiles, int activeJobs, int memoryJobs) {
    return new HealthResponse(
        "healthy", audioFiles, activeJobs, memoryJobs, "System is operational");
  }

  public static HealthResponse unhealthy(String error) {
    return new HealthResponse("unhealthy", 0, 0, 0, "Error: " + error);
  }
}
