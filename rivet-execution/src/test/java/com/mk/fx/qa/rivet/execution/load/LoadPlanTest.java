package com.mk.fx.qa.rivet.execution.load;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.rivet.execution.engine.RunConfigurationException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LoadPlanTest {

  @Test
  void defaults_areAppliedByTheBuilder() {
    var plan = LoadPlan.constant(2, Duration.ofSeconds(10));

    assertEquals(LoadPlan.DEFAULT_TICK_INTERVAL, plan.tickInterval());
    assertEquals(LoadPlan.DEFAULT_REPORT_INTERVAL, plan.reportInterval());
    assertEquals(LoadPlan.DEFAULT_DRAIN_TIMEOUT, plan.drainTimeout());
    assertEquals(ThinkTime.Type.NONE, plan.thinkTime().type());
    assertEquals(2, plan.effectiveMaxConcurrency());
  }

  @Test
  void spike_maxConcurrency_coversThePeak() {
    var plan = LoadPlan.spike(3, Duration.ofMinutes(1));
    assertEquals(6, plan.effectivePeak());
    assertEquals(6, plan.effectiveMaxConcurrency());
  }

  @Test
  void validate_rejectsInvalidPlans() {
    var ok = LoadPlan.constant(2, Duration.ofSeconds(10));

    assertSame(ok, ok.validate());
    assertInvalid(ok.toBuilder().targetConcurrency(0).build());
    assertInvalid(ok.toBuilder().pattern(null).build());
    assertInvalid(ok.toBuilder().duration(Duration.ZERO).build());
    assertInvalid(ok.toBuilder().targetRps(-1.0).build());
    assertInvalid(ok.toBuilder().maxConcurrency(0).build());
    assertInvalid(ok.toBuilder().drainTimeout(Duration.ofSeconds(-1)).build());
    assertInvalid(LoadPlan.rampUp(5, Duration.ofSeconds(20), Duration.ofSeconds(10)));
    assertInvalid(LoadPlan.rampUp(5, Duration.ZERO, Duration.ofSeconds(10)));
    assertInvalid(
        LoadPlan.spike(5, Duration.ofMinutes(1)).toBuilder()
            .spikeDuration(Duration.ofSeconds(30))
            .build());
    assertInvalid(
        LoadPlan.spike(5, Duration.ofMinutes(1)).toBuilder().spikePeakConcurrency(2).build());
    assertInvalid(LoadPlan.spike(5, Duration.ofMinutes(1)).toBuilder().spikeCycles(0).build());
  }

  private static void assertInvalid(LoadPlan plan) {
    assertThrows(RunConfigurationException.class, plan::validate);
  }
}
