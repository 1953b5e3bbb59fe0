package com.flamingo.ai.kbsearch.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class OllamaModelUnloaderTest {

  private MockRestServiceServer server;
  private SimpleMeterRegistry meterRegistry;
  private OllamaModelUnloader unloader;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    meterRegistry = new SimpleMeterRegistry();
    unloader = new OllamaModelUnloader(builder, meterRegistry);
  }

  @Test
  @DisplayName("should request an immediate unload of the model")
  void shouldPostZeroKeepAlive() {
    server
        .expect(requestTo("http://gpu:11434/api/generate"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().json("{\"model\":\"llama3\",\"keep_alive\":0}"))
        .andRespond(withSuccess());

    unloader.unload("http://gpu:11434/", "llama3");

    server.verify();
  }

  @Test
  @DisplayName("should count a failed unload without throwing")
  void shouldCountFailure() {
    server.expect(requestTo("http://gpu:11434/api/generate")).andRespond(withServerError());

    unloader.unload("http://gpu:11434", "llama3");

    assertThat(meterRegistry.counter("embedding.device.release.failure", "model", "llama3").count())
        .isEqualTo(1.0);
  }
}
