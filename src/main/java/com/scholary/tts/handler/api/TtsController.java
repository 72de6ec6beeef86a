package com.scholary.tts.handler.api;

import com.scholary.tts.handler.job.JobManager;
import com.scholary.tts.handler.service.ArtifactAccessService;
import com.scholary.tts.handler.service.AudioArtifact;
import com.scholary.tts.handler.service.JobLister;
import com.scholary.tts.handler.service.JobStatusService;
import com.scholary.tts.handler.service.JobSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for text-to-speech jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting a synthesis job (returns job ID immediately)
 *   <li>Listing recent jobs, active and completed
 *   <li>Job status polling
 *   <li>Downloading and deleting the generated audio
 * </ul>
 *
 * <p>Errors are mapped to responses by {@link ApiExceptionHandler}.
 */
@RestController
@Tag(name = "TTS", description = "Asynchronous text-to-speech jobs")
public class TtsController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TtsController.class);

  static final MediaType AUDIO_MPEG = MediaType.parseMediaType("audio/mpeg");

  private final JobManager jobManager;
  private final JobStatusService jobStatusService;
  private final JobLister jobLister;
  private final ArtifactAccessService artifactAccessService;

  public TtsController(
      JobManager jobManager,
      JobStatusService jobStatusService,
      JobLister jobLister,
      ArtifactAccessService artifactAccessService) {
    this.jobManager = jobManager;
    this.jobStatusService = jobStatusService;
    this.jobLister = jobLister;
    this.artifactAccessService = artifactAccessService;
  }

  @PostMapping("/tts")
  @Operation(
      summary = "Submit synthesis job",
      description = "Queue text for synthesis and return a job ID for status polling")
  public ResponseEntity<TtsJobResponse> submit(
      @Valid @RequestBody TtsRequest request, HttpServletRequest httpRequest) {
    LOGGER.info(
        "TTS request from {} with User-Agent: {}, content length: {}",
        httpRequest.getRemoteAddr(),
        httpRequest.getHeader(HttpHeaders.USER_AGENT),
        request.text().length());

    String jobId = jobManager.submit(request.toSpeechRequest());
    return ResponseEntity.ok(new TtsJobResponse(jobId));
  }

  @GetMapping("/tts/jobs")
  @Operation(
      summary = "List jobs",
      description = "List recent jobs, active and completed, newest first")
  public ResponseEntity<List<JobSummary>> listJobs(
      @RequestParam(name = "limit", required = false) Integer limit) {
    List<JobSummary> jobs = limit == null ? jobLister.list() : jobLister.list(limit);
    return ResponseEntity.ok(jobs);
  }

  @GetMapping("/tts/status/{jobId}")
  @Operation(
      summary = "Get job status",
      description = "Check the status of a job; a stored artifact always reads as completed")
  public ResponseEntity<JobStatusResponse> getStatus(@PathVariable String jobId) {
    return ResponseEntity.ok(jobStatusService.status(jobId));
  }

  @GetMapping("/tts/audio/{jobId}")
  @Operation(
      summary = "Download audio",
      description = "Fetch the generated audio with cache headers")
  public ResponseEntity<byte[]> getAudio(@PathVariable String jobId) {
    AudioArtifact artifact = artifactAccessService.fetch(jobId);
    return ResponseEntity.ok()
        .contentType(AUDIO_MPEG)
        .header(HttpHeaders.CACHE_CONTROL, artifact.cacheControl())
        .eTag(artifact.etag())
        .body(artifact.audio());
  }

  @DeleteMapping("/tts/audio/{jobId}")
  @Operation(summary = "Delete audio", description = "Delete the generated audio for a job")
  public ResponseEntity<MessageResponse> deleteAudio(@PathVariable String jobId) {
    artifactAccessService.delete(jobId);
    return ResponseEntity.ok(
        new MessageResponse("Audio for job " + jobId + " deleted successfully"));
  }
}
