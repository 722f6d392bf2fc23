package com.scholary.vocalization.inference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for a remote translation/tagging model service.
 *
 * <p>Sends the decrypted recording as multipart/form-data to {@code {baseUrl}/api/v1/infer} and
 * parses a JSON body of the form {@code {"translation": ..., "tags": [...], "confidence": ...}}.
 *
 * <p>Status mapping: 200 is success; 400, 415 and 422 mean the model rejected the input
 * ({@link ModelErrorException}); everything else, and any I/O failure, is transient
 * ({@link InferenceUnavailableException}). No retries happen here, the scheduler owns them.
 */
public class HttpInferenceBackend implements InferenceBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpInferenceBackend.class);

  private final HttpClient httpClient;
  private final InferenceProperties properties;
  private final ObjectMapper objectMapper;

  public HttpInferenceBackend(InferenceProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
  }

  HttpInferenceBackend(
      HttpClient httpClient, InferenceProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    LOGGER.info("Initialized inference client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public InferenceOutput infer(InferenceRequest request) {
    String boundary = UUID.randomUUID().toString();
    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/infer"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(buildMultipartBody(request, boundary))
            .build();

    LOGGER.debug("Sending inference request: jobId={}, uri={}", request.jobId(), httpRequest.uri());

    HttpResponse<String> response;
    try {
      response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new InferenceUnavailableException("Inference service unreachable: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InferenceUnavailableException("Inference request interrupted", e);
    }

    int status = response.statusCode();
    if (status == 400 || status == 415 || status == 422) {
      throw new ModelErrorException(
          String.format("Model rejected input (status %d): %s", status, response.body()));
    }
    if (status != 200) {
      throw new InferenceUnavailableException(
          String.format("Inference service returned status %d: %s", status, response.body()));
    }

    try {
      InferenceOutput output = objectMapper.readValue(response.body(), InferenceOutput.class);
      LOGGER.info(
          "Inference successful: jobId={}, tags={}, confidence={}",
          request.jobId(),
          output.tags(),
          output.confidence());
      return output;
    } catch (JsonProcessingException e) {
      throw new ModelErrorException("Unparseable inference response: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public String name() {
    return "http";
  }

  /**
   * Build a multipart/form-data body.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="{jobId}.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="species"
   *
   * canis_lupus
   * --boundary--
   * </pre>
   */
  private static BodyPublisher buildMultipartBody(InferenceRequest request, String boundary) {
    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(request.jobId())
        .append('.')
        .append(request.format().extension())
        .append("\"\r\n");
    sb.append("Content-Type: ").append(request.format().contentType()).append("\r\n\r\n");
    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    appendField(sb, boundary, "species", request.species());
    appendField(sb, boundary, "jobId", request.jobId());
    appendField(sb, boundary, "sampleRate", String.valueOf(request.sampleRate()));
    sb.append("--").append(boundary).append("--\r\n");
    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    byte[] audio = request.audio();
    byte[] body = new byte[prefix.length + audio.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(audio, 0, body, prefix.length, audio.length);
    System.arraycopy(suffix, 0, body, prefix.length + audio.length, suffix.length);
    return BodyPublishers.ofByteArray(body);
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }
}
