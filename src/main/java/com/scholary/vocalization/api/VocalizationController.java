package com.scholary.vocalization.api;

import com.scholary.vocalization.artifact.AudioFormat;
import com.scholary.vocalization.job.JobHandle;
import com.scholary.vocalization.result.AnalysisOutcome;
import com.scholary.vocalization.result.ResultNotReadyException;
import com.scholary.vocalization.service.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for vocalization analysis.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Uploading recordings
 *   <li>Triggering analysis (returns a job handle immediately)
 *   <li>Polling results and job status, and cancelling jobs
 *   <li>Listing supported species and formats
 * </ul>
 *
 * <p>The caller id arrives already authenticated in the {@code X-Caller-Id} header.
 */
@RestController
@Tag(name = "Vocalization", description = "Animal vocalization upload and analysis API")
public class VocalizationController {

  private static final Logger LOGGER = LoggerFactory.getLogger(VocalizationController.class);

  static final String CALLER_HEADER = "X-Caller-Id";

  private final PipelineOrchestrator orchestrator;

  public VocalizationController(PipelineOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  /**
   * Upload a recording.
   *
   * <p>The format is taken from the {@code format} parameter, or from the file extension when the
   * parameter is absent.
   */
  @PostMapping("/api/audio")
  @Operation(
      summary = "Upload recording",
      description = "Validate, encrypt and store a WAV, MP3 or FLAC recording")
  public ResponseEntity<UploadResponse> upload(
      @RequestParam("file") MultipartFile file,
      @RequestParam("species") String species,
      @RequestParam(value = "format", required = false) String format,
      @RequestHeader(CALLER_HEADER) String callerId)
      throws IOException {

    String declaredFormat =
        StringUtils.hasText(format)
            ? format
            : StringUtils.getFilenameExtension(file.getOriginalFilename());
    LOGGER.info(
        "Upload request: filename={}, species={}, format={}, caller={}",
        file.getOriginalFilename(),
        species,
        declaredFormat,
        callerId);

    String artifactId = orchestrator.upload(file.getBytes(), declaredFormat, species, callerId);
    return ResponseEntity.status(HttpStatus.CREATED).body(new UploadResponse(artifactId));
  }

  @PostMapping("/api/audio/{artifactId}/analysis")
  @Operation(
      summary = "Start analysis",
      description =
          "Queue analysis for an artifact; returns the running job if one is already active")
  public ResponseEntity<JobStatusResponse> triggerAnalysis(@PathVariable String artifactId) {
    JobHandle handle = orchestrator.triggerAnalysis(artifactId);
    HttpStatus status = handle.deduplicated() ? HttpStatus.OK : HttpStatus.ACCEPTED;
    return ResponseEntity.status(status).body(JobStatusResponse.from(handle));
  }

  /**
   * Get the latest analysis outcome.
   *
   * <p>Returns 202 with the artifact status while no job has finished.
   */
  @GetMapping("/api/audio/{artifactId}/analysis")
  @Operation(
      summary = "Get analysis result",
      description = "Latest terminal outcome: result, rejection verdict or failure reason")
  public ResponseEntity<?> getResult(@PathVariable String artifactId) {
    try {
      AnalysisOutcome outcome = orchestrator.getResult(artifactId);
      return ResponseEntity.ok(outcome);
    } catch (ResultNotReadyException e) {
      return ResponseEntity.accepted()
          .body(new AnalysisPendingResponse(e.getArtifactId(), e.getStatus()));
    }
  }

  @GetMapping("/api/jobs/{jobId}")
  @Operation(summary = "Get job status", description = "Check the status of an analysis job")
  public ResponseEntity<JobStatusResponse> getJob(@PathVariable String jobId) {
    return ResponseEntity.ok(JobStatusResponse.from(orchestrator.getJob(jobId)));
  }

  @DeleteMapping("/api/jobs/{jobId}")
  @Operation(
      summary = "Cancel job",
      description = "Cancel a queued or running job; no-op for finished jobs")
  public ResponseEntity<JobStatusResponse> cancel(@PathVariable String jobId) {
    JobHandle handle = orchestrator.cancel(jobId);
    LOGGER.info("Cancel request for job {}: now {}", jobId, handle.status());
    return ResponseEntity.ok(JobStatusResponse.from(handle));
  }

  @GetMapping("/api/species")
  @Operation(summary = "List species", description = "Species accepted at upload")
  public SpeciesResponse listSpecies() {
    return new SpeciesResponse(orchestrator.listSupportedSpecies());
  }

  @GetMapping("/api/formats")
  @Operation(summary = "List formats", description = "Audio formats accepted at upload")
  public FormatsResponse listFormats() {
    List<AudioFormat> formats = orchestrator.listSupportedFormats();
    return new FormatsResponse(
        formats.stream().map(AudioFormat::extension).toList(),
        formats.stream().map(AudioFormat::contentType).toList());
  }
}
