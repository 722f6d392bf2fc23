package com.scholary.vocalization.job;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  @Test
  void findById_shouldReturnSavedJob() {
    JobRepository repository = new JobRepository(10, 1);
    AnalysisJob job = new AnalysisJob("j1", "a1");

    repository.save(job);

    assertThat(repository.findById("j1")).containsSame(job);
    assertThat(repository.findById("unknown")).isEmpty();
  }

  @Test
  void runningJob_shouldSurviveSizePressure() {
    JobRepository repository = new JobRepository(10, 1);
    AnalysisJob running = new AnalysisJob("running", "busy");
    running.transitionTo(JobStatus.QUALITY_CHECKED);
    running.transitionTo(JobStatus.DISPATCHED);
    repository.save(running);

    for (int i = 0; i < 500; i++) {
      AnalysisJob finished = new AnalysisJob("done-" + i, "artifact-" + i);
      repository.save(finished);
      finished.transitionTo(JobStatus.QUALITY_CHECKED);
      finished.transitionTo(JobStatus.REJECTED);
      repository.save(finished);
    }

    assertThat(repository.findById("running")).containsSame(running);
  }
}
