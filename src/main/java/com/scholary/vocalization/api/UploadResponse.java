package com.scholary.vocalization.api;

/** Response for a successful upload. */
public record UploadResponse(String artifactId) {}
