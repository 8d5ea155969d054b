package com.mk.fx.qa.rivet.execution.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.rivet.execution.assertion.AssertionEvaluator;
import com.mk.fx.qa.rivet.execution.coverage.CoverageCalculator;
import com.mk.fx.qa.rivet.execution.engine.RivetEngine;
import com.mk.fx.qa.rivet.execution.engine.RunRegistry;
import com.mk.fx.qa.rivet.execution.engine.TestRunExecutor;
import com.mk.fx.qa.rivet.execution.engine.UnitExecutor;
import com.mk.fx.qa.rivet.execution.load.PerformanceRunner;
import com.mk.fx.qa.rivet.execution.redact.RedactionPolicy;
import com.mk.fx.qa.rivet.execution.retry.RetryController;
import com.mk.fx.qa.rivet.execution.template.TemplateResolver;
import com.mk.fx.qa.rivet.rest.LoadHttpClient;
import com.mk.fx.qa.rivet.rest.Transport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Wires the engine. An embedding application may provide its own {@link Transport}, {@link
 * TemplateResolver} or {@link ObjectMapper} bean; the defaults below back off when it does.
 */
@Slf4j
@Configuration
@Import(ObjectMapperConfig.class)
@EnableConfigurationProperties(EngineProperties.class)
public class EngineCfg {

  @Bean
  @ConditionalOnMissingBean(Transport.class)
  public LoadHttpClient loadHttpClient(EngineProperties properties) {
    var client = properties.getClient();
    return new LoadHttpClient(
        client.getBaseUrl(), client.getConnectTimeoutSeconds(), client.getHeaders());
  }

  @Bean
  @ConditionalOnMissingBean
  public TemplateResolver templateResolver() {
    return TemplateResolver.systemEnvironment();
  }

  @Bean
  public AssertionEvaluator assertionEvaluator(ObjectMapper objectMapper) {
    return new AssertionEvaluator(objectMapper);
  }

  @Bean
  public RedactionPolicy redactionPolicy(EngineProperties properties) {
    return properties.getRedaction().toPolicy();
  }

  @Bean
  public RunRegistry runRegistry() {
    return new RunRegistry();
  }

  @Bean
  public CoverageCalculator coverageCalculator() {
    return new CoverageCalculator();
  }

  @Bean
  public UnitExecutor unitExecutor(
      Transport transport,
      AssertionEvaluator assertionEvaluator,
      RedactionPolicy redactionPolicy,
      EngineProperties properties) {
    return new UnitExecutor(
        transport,
        assertionEvaluator,
        new RetryController(),
        redactionPolicy,
        properties.getDefaultTimeout(),
        properties.getRetry().toPolicy());
  }

  @Bean
  public TestRunExecutor testRunExecutor(
      UnitExecutor unitExecutor,
      TemplateResolver templateResolver,
      CoverageCalculator coverageCalculator,
      RunRegistry runRegistry,
      EngineProperties properties) {
    return new TestRunExecutor(
        unitExecutor,
        templateResolver,
        properties.getMetrics().toSettings(),
        coverageCalculator,
        runRegistry,
        properties.getConcurrency(),
        properties.getMaxConcurrency());
  }

  @Bean
  public PerformanceRunner performanceRunner(
      UnitExecutor unitExecutor, TemplateResolver templateResolver, EngineProperties properties) {
    return new PerformanceRunner(
        unitExecutor, templateResolver, properties.getMetrics().toSettings());
  }

  @Bean
  public RivetEngine rivetEngine(
      TestRunExecutor testRunExecutor,
      PerformanceRunner performanceRunner,
      CoverageCalculator coverageCalculator,
      RunRegistry runRegistry,
      EngineProperties properties) {
    log.info(
        "Rivet engine configured: concurrency={}, maxConcurrency={}, defaultTimeout={}ms",
        properties.getConcurrency(),
        properties.getMaxConcurrency(),
        properties.getDefaultTimeout().toMillis());
    return new RivetEngine(testRunExecutor, performanceRunner, coverageCalculator, runRegistry);
  }
}
