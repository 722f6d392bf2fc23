package com.scholary.vocalization.api;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.vocalization.artifact.ArtifactNotFoundException;
import com.scholary.vocalization.artifact.AudioFormat;
import com.scholary.vocalization.artifact.FileTooLargeException;
import com.scholary.vocalization.artifact.UnsupportedFormatException;
import com.scholary.vocalization.job.AnalysisJob;
import com.scholary.vocalization.job.FailureReason;
import com.scholary.vocalization.job.JobHandle;
import com.scholary.vocalization.job.JobNotFoundException;
import com.scholary.vocalization.job.JobStatus;
import com.scholary.vocalization.objectstore.StorageUnavailableException;
import com.scholary.vocalization.quality.QualityVerdict;
import com.scholary.vocalization.result.AnalysisOutcome;
import com.scholary.vocalization.result.AnalysisResult;
import com.scholary.vocalization.result.ResultExpiredException;
import com.scholary.vocalization.result.ResultNotReadyException;
import com.scholary.vocalization.service.PipelineOrchestrator;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(VocalizationController.class)
class VocalizationControllerTest {

  private static final byte[] AUDIO = {82, 73, 70, 70, 1, 2, 3};

  @Autowired private MockMvc mockMvc;

  @MockBean private PipelineOrchestrator orchestrator;

  @Test
  void upload_shouldReturnCreatedWithArtifactId() throws Exception {
    when(orchestrator.upload(any(), eq("wav"), eq("canis_lupus"), eq("lab-7")))
        .thenReturn("a-123");

    mockMvc
        .perform(
            multipart("/api/audio")
                .file(new MockMultipartFile("file", "howl.wav", "audio/wav", AUDIO))
                .param("species", "canis_lupus")
                .header("X-Caller-Id", "lab-7"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.artifactId").value("a-123"));

    verify(orchestrator).upload(AUDIO, "wav", "canis_lupus", "lab-7");
  }

  @Test
  void upload_shouldPreferExplicitFormat() throws Exception {
    when(orchestrator.upload(any(), eq("flac"), anyString(), anyString())).thenReturn("a-1");

    mockMvc
        .perform(
            multipart("/api/audio")
                .file(new MockMultipartFile("file", "recording", "audio/flac", AUDIO))
                .param("species", "canis_lupus")
                .param("format", "flac")
                .header("X-Caller-Id", "lab-7"))
        .andExpect(status().isCreated());
  }

  @Test
  void upload_shouldRequireCallerHeader() throws Exception {
    mockMvc
        .perform(
            multipart("/api/audio")
                .file(new MockMultipartFile("file", "howl.wav", "audio/wav", AUDIO))
                .param("species", "canis_lupus"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
  }

  @Test
  void upload_shouldMapValidationErrors() throws Exception {
    when(orchestrator.upload(any(), any(), any(), any()))
        .thenThrow(new UnsupportedFormatException("ogg"));

    mockMvc
        .perform(
            multipart("/api/audio")
                .file(new MockMultipartFile("file", "howl.ogg", "audio/ogg", AUDIO))
                .param("species", "canis_lupus")
                .header("X-Caller-Id", "lab-7"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.status").value(400))
        .andExpect(jsonPath("$.message").value(containsString("ogg")));
  }

  @Test
  void upload_shouldMapOversizedFileTo413() throws Exception {
    when(orchestrator.upload(any(), any(), any(), any()))
        .thenThrow(new FileTooLargeException(60_000_000L, 52_428_800L));

    mockMvc
        .perform(
            multipart("/api/audio")
                .file(new MockMultipartFile("file", "howl.wav", "audio/wav", AUDIO))
                .param("species", "canis_lupus")
                .header("X-Caller-Id", "lab-7"))
        .andExpect(status().isPayloadTooLarge())
        .andExpect(jsonPath("$.error").value("FILE_TOO_LARGE"));
  }

  @Test
  void upload_shouldMapStorageOutageTo503() throws Exception {
    when(orchestrator.upload(any(), any(), any(), any()))
        .thenThrow(new StorageUnavailableException("Storage unreachable", null));

    mockMvc
        .perform(
            multipart("/api/audio")
                .file(new MockMultipartFile("file", "howl.wav", "audio/wav", AUDIO))
                .param("species", "canis_lupus")
                .header("X-Caller-Id", "lab-7"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error").value("STORAGE_UNAVAILABLE"));
  }

  @Test
  void triggerAnalysis_shouldReturnAcceptedForNewJob() throws Exception {
    when(orchestrator.triggerAnalysis("a-1"))
        .thenReturn(new JobHandle("j-1", "a-1", JobStatus.UPLOADED, 0, false));

    mockMvc
        .perform(post("/api/audio/a-1/analysis"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("j-1"))
        .andExpect(jsonPath("$.deduplicated").value(false));
  }

  @Test
  void triggerAnalysis_shouldReturnOkForDuplicate() throws Exception {
    when(orchestrator.triggerAnalysis("a-1"))
        .thenReturn(new JobHandle("j-1", "a-1", JobStatus.DISPATCHED, 1, true));

    mockMvc
        .perform(post("/api/audio/a-1/analysis"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DISPATCHED"))
        .andExpect(jsonPath("$.deduplicated").value(true));
  }

  @Test
  void triggerAnalysis_shouldReturnNotFoundForUnknownArtifact() throws Exception {
    when(orchestrator.triggerAnalysis("nope")).thenThrow(new ArtifactNotFoundException("nope"));

    mockMvc
        .perform(post("/api/audio/nope/analysis"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("NOT_FOUND"));
  }

  @Test
  void getResult_shouldReturnOutcome() throws Exception {
    QualityVerdict verdict = QualityVerdict.of("a-1", Set.of(), 1.0, 2.0, 45.0, 0.0);
    Instant now = Instant.parse("2026-03-01T12:00:00Z");
    AnalysisResult result =
        new AnalysisResult(
            "j-1", "predator overhead", new TreeSet<>(List.of("alarm_call")), 0.95, verdict, false,
            now);
    when(orchestrator.getResult("a-1"))
        .thenReturn(
            new AnalysisOutcome(
                "a-1", "j-1", JobStatus.SUCCEEDED, 1, verdict, result, null, null, now));

    mockMvc
        .perform(get("/api/audio/a-1/analysis"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("SUCCEEDED"))
        .andExpect(jsonPath("$.result.translation").value("predator overhead"))
        .andExpect(jsonPath("$.result.tags[0]").value("alarm_call"))
        .andExpect(jsonPath("$.result.partial").value(false))
        .andExpect(jsonPath("$.qualityVerdict.usable").value(true));
  }

  @Test
  void getResult_shouldReturnAcceptedWhileRunning() throws Exception {
    when(orchestrator.getResult("a-1"))
        .thenThrow(new ResultNotReadyException("a-1", JobStatus.DISPATCHED));

    mockMvc
        .perform(get("/api/audio/a-1/analysis"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("DISPATCHED"));
  }

  @Test
  void getResult_shouldReturnGoneWhenOutcomeExpired() throws Exception {
    when(orchestrator.getResult("a-1"))
        .thenThrow(new ResultExpiredException("a-1", JobStatus.SUCCEEDED));

    mockMvc
        .perform(get("/api/audio/a-1/analysis"))
        .andExpect(status().isGone())
        .andExpect(jsonPath("$.error").value("RESULT_EXPIRED"));
  }

  @Test
  void getResult_shouldReturnNotFoundForUnknownArtifact() throws Exception {
    when(orchestrator.getResult("nope")).thenThrow(new ArtifactNotFoundException("nope"));

    mockMvc.perform(get("/api/audio/nope/analysis")).andExpect(status().isNotFound());
  }

  @Test
  void getJob_shouldReturnJobDetails() throws Exception {
    AnalysisJob job = new AnalysisJob("j-1", "a-1");
    job.fail(FailureReason.STORAGE_UNAVAILABLE, "bucket missing");
    when(orchestrator.getJob("j-1")).thenReturn(job);

    mockMvc
        .perform(get("/api/jobs/j-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FAILED"))
        .andExpect(jsonPath("$.failureReason").value("STORAGE_UNAVAILABLE"))
        .andExpect(jsonPath("$.lastError").value("bucket missing"));
  }

  @Test
  void getJob_shouldReturnNotFoundForUnknownJob() throws Exception {
    when(orchestrator.getJob("nope")).thenThrow(new JobNotFoundException("nope"));

    mockMvc.perform(get("/api/jobs/nope")).andExpect(status().isNotFound());
  }

  @Test
  void cancel_shouldReturnHandle() throws Exception {
    when(orchestrator.cancel("j-1"))
        .thenReturn(new JobHandle("j-1", "a-1", JobStatus.FAILED, 1, false));

    mockMvc
        .perform(delete("/api/jobs/j-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FAILED"));
  }

  @Test
  void listSpecies_shouldReturnCatalogue() throws Exception {
    when(orchestrator.listSupportedSpecies())
        .thenReturn(new TreeSet<>(List.of("panthera_leo", "canis_lupus")));

    mockMvc
        .perform(get("/api/species"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.species[0]").value("canis_lupus"))
        .andExpect(jsonPath("$.species[1]").value("panthera_leo"));
  }

  @Test
  void listFormats_shouldReturnExtensionsAndContentTypes() throws Exception {
    when(orchestrator.listSupportedFormats()).thenReturn(List.of(AudioFormat.values()));

    mockMvc
        .perform(get("/api/formats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.formats[0]").value("wav"))
        .andExpect(jsonPath("$.contentTypes[1]").value("audio/mpeg"));
  }

  @Test
  void unexpectedError_shouldReturn500() throws Exception {
    when(orchestrator.listSupportedSpecies()).thenThrow(new IllegalStateException("boom"));

    mockMvc
        .perform(get("/api/species"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"));
  }
}
