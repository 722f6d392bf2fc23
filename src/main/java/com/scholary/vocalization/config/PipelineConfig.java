package com.scholary.vocalization.config;

import com.scholary.vocalization.artifact.ArtifactRepository;
import com.scholary.vocalization.artifact.UploadValidator;
import com.scholary.vocalization.audio.AudioDecoder;
import com.scholary.vocalization.crypto.PayloadCipher;
import com.scholary.vocalization.inference.InferenceBackend;
import com.scholary.vocalization.job.ArtifactLeaseTable;
import com.scholary.vocalization.job.JobRepository;
import com.scholary.vocalization.objectstore.ArtifactStore;
import com.scholary.vocalization.quality.QualityControlEngine;
import com.scholary.vocalization.quality.QualityProperties;
import com.scholary.vocalization.result.OutcomeRepository;
import com.scholary.vocalization.result.ResultAggregator;
import com.scholary.vocalization.scheduler.JobScheduler;
import com.scholary.vocalization.scheduler.RetryPolicy;
import com.scholary.vocalization.service.PipelineOrchestrator;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the analysis pipeline.
 *
 * <p>The lease table is a plain bean shared by the scheduler and the orchestrator; nothing else
 * should hold a reference to it.
 */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, QualityProperties.class})
public class PipelineConfig {

  @Bean
  public ArtifactLeaseTable artifactLeaseTable() {
    return new ArtifactLeaseTable();
  }

  @Bean
  public RetryPolicy retryPolicy(PipelineProperties properties) {
    return new RetryPolicy(
        properties.maxAttempts(), properties.retryBaseDelay(), properties.retryMaxDelay());
  }

  @Bean
  public JobScheduler jobScheduler(
      ArtifactLeaseTable leaseTable,
      JobRepository jobRepository,
      @Qualifier("pipelineExecutor") ThreadPoolTaskExecutor pipelineExecutor,
      @Qualifier("inferenceExecutor") ThreadPoolTaskExecutor inferenceExecutor,
      InferenceBackend inferenceBackend,
      RetryPolicy retryPolicy,
      PipelineProperties properties) {

    return new JobScheduler(
        leaseTable,
        jobRepository,
        pipelineExecutor,
        inferenceExecutor,
        inferenceBackend,
        retryPolicy,
        properties.jobTimeout());
  }

  @Bean
  public ResultAggregator resultAggregator(PipelineProperties properties) {
    return new ResultAggregator(properties.accuracyFloor(), Clock.systemUTC());
  }

  @Bean
  public UploadValidator uploadValidator(PipelineProperties properties) {
    return new UploadValidator(properties.maxUploadBytes(), properties.supportedSpecies());
  }

  @Bean
  public AudioDecoder audioDecoder() {
    return new AudioDecoder();
  }

  @Bean
  public QualityControlEngine qualityControlEngine(QualityProperties properties) {
    return new QualityControlEngine(properties);
  }

  @Bean
  public PipelineOrchestrator pipelineOrchestrator(
      ArtifactRepository artifactRepository,
      JobRepository jobRepository,
      OutcomeRepository outcomeRepository,
      ArtifactStore artifactStore,
      PayloadCipher payloadCipher,
      AudioDecoder audioDecoder,
      QualityControlEngine qualityControlEngine,
      JobScheduler jobScheduler,
      ResultAggregator resultAggregator,
      ArtifactLeaseTable leaseTable,
      UploadValidator uploadValidator,
      PipelineProperties properties) {

    return new PipelineOrchestrator(
        artifactRepository,
        jobRepository,
        outcomeRepository,
        artifactStore,
        payloadCipher,
        audioDecoder,
        qualityControlEngine,
        jobScheduler,
        resultAggregator,
        leaseTable,
        uploadValidator,
        properties.supportedSpecies());
  }
}
