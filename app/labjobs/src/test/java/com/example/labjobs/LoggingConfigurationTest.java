package com.example.labjobs;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.TraceIds;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  private String logbackXml;

  @BeforeEach
  void loadConfiguration() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();
    logbackXml = new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
  }

  @Test
  void consoleOutputIsStructuredJson() {
    assertThat(logbackXml)
        .contains("net.logstash.logback.encoder.LoggingEventCompositeJsonEncoder")
        .contains("\"service\":\"${SERVICE_NAME}\"")
        .contains("defaultValue=\"labjobs\"");
  }

  @Test
  void tickTraceIdIsWrittenUnderTheKeyTheTickPopulates() {
    assertThat(logbackXml).contains("\"trace_id\":\"%X{" + TraceIds.MDC_KEY + ":-");
  }

  @Test
  void requestFieldsSetByTheInterceptorAreEmitted() {
    assertThat(logbackXml)
        .contains("\"request_id\":\"%X{request_id:-}\"")
        .contains("\"actor\":\"%X{actor:-}\"");
  }
}
