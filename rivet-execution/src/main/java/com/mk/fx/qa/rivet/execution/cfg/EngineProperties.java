package com.mk.fx.qa.rivet.execution.cfg;

import com.mk.fx.qa.rivet.execution.metrics.MetricsSettings;
import com.mk.fx.qa.rivet.execution.redact.RedactionPolicy;
import com.mk.fx.qa.rivet.execution.retry.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Engine defaults, bound from {@code rivet.engine.*}. */
@Data
@Validated
@ConfigurationProperties(prefix = "rivet.engine")
public class EngineProperties {

  /** Concurrency bound of a functional run when the caller sets none. */
  @Min(1)
  @Max(256)
  private int concurrency = 1;

  /** Largest concurrency bound a caller may request. */
  @Min(1)
  @Max(1024)
  private int maxConcurrency = 256;

  /** Per-request timeout when a test case sets none. */
  @NotNull private Duration defaultTimeout = Duration.ofSeconds(30);

  @Valid private final Client client = new Client();

  @Valid private final Retry retry = new Retry();

  @Valid private final Metrics metrics = new Metrics();

  @Valid private final Redaction redaction = new Redaction();

  @Data
  public static class Client {
    /** Prefix for relative request URLs. */
    private String baseUrl;

    @Min(1)
    private int connectTimeoutSeconds = 5;

    /** Headers sent with every request unless the request sets them. */
    private Map<String, String> headers = new LinkedHashMap<>();
  }

  @Data
  public static class Retry {
    @Min(1)
    private int maxAttempts = 1;

    @NotNull private Duration baseBackoff = Duration.ofMillis(100);

    @DecimalMin("1.0")
    private double multiplier = 2.0;

    private Duration maxBackoff = Duration.ofSeconds(10);

    private Set<Integer> retryableStatuses =
        new LinkedHashSet<>(RetryPolicy.DEFAULT_RETRYABLE_STATUSES);

    private boolean retryAssertionFailures;

    public RetryPolicy toPolicy() {
      return RetryPolicy.builder()
          .maxAttempts(maxAttempts)
          .baseBackoff(baseBackoff)
          .backoffMultiplier(multiplier)
          .maxBackoff(maxBackoff)
          .retryableStatuses(retryableStatuses)
          .retryAssertionFailures(retryAssertionFailures)
          .build()
          .validate();
    }
  }

  @Data
  public static class Metrics {
    /** Bytes of exact latency samples kept before switching to the reservoir. */
    @Positive private long memoryCapBytes = MetricsSettings.DEFAULT_MEMORY_CAP_BYTES;

    @Positive private int reservoirSize = MetricsSettings.DEFAULT_RESERVOIR_SIZE;

    @NotNull private Duration throughputWindow = MetricsSettings.DEFAULT_THROUGHPUT_WINDOW;

    public MetricsSettings toSettings() {
      return MetricsSettings.fromMemoryCap(memoryCapBytes, reservoirSize, throughputWindow);
    }
  }

  @Data
  public static class Redaction {
    private Set<String> headers = new LinkedHashSet<>(RedactionPolicy.DEFAULT_HEADERS);

    private Set<String> sensitiveKeys = new LinkedHashSet<>(RedactionPolicy.DEFAULT_KEYS);

    @Min(0)
    private int bodyLimit = RedactionPolicy.DEFAULT_BODY_LIMIT;

    public RedactionPolicy toPolicy() {
      return new RedactionPolicy(headers, sensitiveKeys, bodyLimit);
    }
  }
}
