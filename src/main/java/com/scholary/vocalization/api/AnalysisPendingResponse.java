package com.scholary.vocalization.api;

import com.scholary.vocalization.job.JobStatus;

/** Returned with 202 while an artifact has no finished analysis yet. */
public record AnalysisPendingResponse(String artifactId, JobStatus status) {}
