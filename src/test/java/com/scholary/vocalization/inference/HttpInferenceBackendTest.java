package com.scholary.vocalization.inference;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.scholary.vocalization.artifact.AudioFormat;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

class HttpInferenceBackendTest {

  @RegisterExtension
  static WireMockExtension modelService =
      WireMockExtension.newInstance().options(wireMockConfig().dynamicPort()).build();

  private HttpInferenceBackend backend;

  @BeforeEach
  void setUp() {
    InferenceProperties properties =
        new InferenceProperties(
            InferenceProperties.Backend.HTTP,
            modelService.getRuntimeInfo().getHttpBaseUrl(),
            5,
            5,
            0.85);
    backend = new HttpInferenceBackend(properties, new ObjectMapper());
  }

  @Test
  void infer_shouldPostAudioAndParseOutput() {
    modelService.stubFor(
        post(urlEqualTo("/api/v1/infer"))
            .willReturn(
                okJson(
                    "{\"translation\":\"predator overhead\","
                        + "\"tags\":[\"alarm_call\"],\"confidence\":0.93}")));

    InferenceOutput output = backend.infer(request());

    assertThat(output.translation()).isEqualTo("predator overhead");
    assertThat(output.tags()).containsExactly("alarm_call");
    assertThat(output.confidence()).isEqualTo(0.93);
    modelService.verify(
        postRequestedFor(urlEqualTo("/api/v1/infer"))
            .withHeader("Content-Type", containing("multipart/form-data"))
            .withRequestBody(containing("name=\"species\""))
            .withRequestBody(containing("corvus_brachyrhynchos"))
            .withRequestBody(containing("filename=\"job-1.wav\"")));
  }

  @Test
  void infer_shouldTreatServerErrorAsUnavailable() {
    modelService.stubFor(
        post(urlEqualTo("/api/v1/infer")).willReturn(aResponse().withStatus(503)));

    assertThatThrownBy(() -> backend.infer(request()))
        .isInstanceOf(InferenceUnavailableException.class)
        .hasMessageContaining("503");
  }

  @Test
  void infer_shouldTreatUnprocessableInputAsModelError() {
    modelService.stubFor(
        post(urlEqualTo("/api/v1/infer"))
            .willReturn(aResponse().withStatus(422).withBody("sample rate unsupported")));

    assertThatThrownBy(() -> backend.infer(request()))
        .isInstanceOf(ModelErrorException.class)
        .hasMessageContaining("422");
  }

  @Test
  void infer_shouldLeaveMissingConfidenceUnset() {
    modelService.stubFor(
        post(urlEqualTo("/api/v1/infer"))
            .willReturn(okJson("{\"translation\":\"contact call\",\"tags\":[\"social\"]}")));

    InferenceOutput output = backend.infer(request());

    assertThat(output.translation()).isEqualTo("contact call");
    assertThat(output.confidence()).isNull();
  }

  @Test
  void infer_shouldTreatGarbageBodyAsModelError() {
    modelService.stubFor(post(urlEqualTo("/api/v1/infer")).willReturn(okJson("not json")));

    assertThatThrownBy(() -> backend.infer(request())).isInstanceOf(ModelErrorException.class);
  }

  @Test
  void infer_shouldTreatConnectionFaultAsUnavailable() {
    modelService.stubFor(
        post(urlEqualTo("/api/v1/infer"))
            .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

    assertThatThrownBy(() -> backend.infer(request()))
        .isInstanceOf(InferenceUnavailableException.class);
  }

  private static InferenceRequest request() {
    return new InferenceRequest(
        "job-1",
        "corvus_brachyrhynchos",
        AudioFormat.WAV,
        "RIFF fake wav".getBytes(StandardCharsets.US_ASCII),
        16000,
        2.0);
  }
}
