package com.mk.fx.qa.rivet.execution.cfg;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.rivet.execution.engine.RivetEngine;
import com.mk.fx.qa.rivet.execution.engine.UnitExecutor;
import com.mk.fx.qa.rivet.execution.redact.RedactionPolicy;
import com.mk.fx.qa.rivet.execution.template.TemplateResolver;
import com.mk.fx.qa.rivet.rest.LoadHttpClient;
import com.mk.fx.qa.rivet.rest.RestResponseData;
import com.mk.fx.qa.rivet.rest.Transport;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class EngineCfgTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withConfiguration(AutoConfigurations.of(EngineCfg.class));

  @Test
  void defaults_wireTheEngine() {
    contextRunner.run(
        context -> {
          assertThat(context).hasSingleBean(RivetEngine.class);
          assertThat(context).hasSingleBean(LoadHttpClient.class);
          assertThat(context).hasSingleBean(TemplateResolver.class);
          assertThat(context).hasSingleBean(UnitExecutor.class);
          var properties = context.getBean(EngineProperties.class);
          assertThat(properties.getConcurrency()).isEqualTo(1);
          assertThat(properties.getDefaultTimeout()).isEqualTo(Duration.ofSeconds(30));
        });
  }

  @Test
  void properties_areBound() {
    contextRunner
        .withPropertyValues(
            "rivet.engine.concurrency=4",
            "rivet.engine.default-timeout=2s",
            "rivet.engine.retry.max-attempts=3",
            "rivet.engine.redaction.body-limit=64")
        .run(
            context -> {
              var properties = context.getBean(EngineProperties.class);
              assertThat(properties.getConcurrency()).isEqualTo(4);
              assertThat(properties.getDefaultTimeout()).isEqualTo(Duration.ofSeconds(2));
              assertThat(properties.getRetry().toPolicy().maxAttempts()).isEqualTo(3);
              var redaction = context.getBean(RedactionPolicy.class);
              assertThat(redaction.body("x".repeat(100))).contains("(truncated");
            });
  }

  @Test
  void customTransport_replacesTheHttpClient() {
    contextRunner
        .withUserConfiguration(CustomTransportConfig.class)
        .run(
            context -> {
              assertThat(context).doesNotHaveBean(LoadHttpClient.class);
              assertThat(context).hasSingleBean(Transport.class);
              assertThat(context).hasSingleBean(RivetEngine.class);
            });
  }

  @Test
  void invalidProperty_failsStartup() {
    contextRunner
        .withPropertyValues("rivet.engine.concurrency=0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods = false)
  static class CustomTransportConfig {
    @Bean
    Transport cannedTransport() {
      return (request, timeout) -> {
        var response = new RestResponseData();
        response.setStatusCode(204);
        return response;
      };
    }
  }
}
