package com.mk.fx.qa.rivet.execution.load;

import com.mk.fx.qa.rivet.execution.metrics.ErrorSample;
import com.mk.fx.qa.rivet.execution.metrics.MetricsSnapshot;
import com.mk.fx.qa.rivet.execution.metrics.TimeSeriesPoint;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * Final result of a performance run.
 *
 * @param metrics final statistics, {@code finalSnapshot} is always set
 * @param launched units dispatched to a worker
 * @param completed units that produced a response or a failure
 * @param cancelledUnits in-flight units abandoned after the drain timeout or an abort
 * @param peakInFlight highest concurrency actually reached
 * @param phases phase transitions in order, ending with {@link LoadPhase#DONE}
 * @param cancelled whether the run was aborted before its duration elapsed
 */
@Builder
public record PerformanceResult(
    String runId,
    MetricsSnapshot metrics,
    Map<Integer, Long> statusCodes,
    Map<String, Long> errorBreakdown,
    List<ErrorSample> errorSamples,
    List<TimeSeriesPoint> timeSeries,
    long launched,
    long completed,
    long cancelledUnits,
    int peakInFlight,
    List<PhaseChange> phases,
    boolean cancelled,
    String cancellationReason) {

  public PerformanceResult {
    statusCodes = statusCodes == null ? Map.of() : Map.copyOf(statusCodes);
    errorBreakdown = errorBreakdown == null ? Map.of() : Map.copyOf(errorBreakdown);
    errorSamples = errorSamples == null ? List.of() : List.copyOf(errorSamples);
    timeSeries = timeSeries == null ? List.of() : List.copyOf(timeSeries);
    phases = phases == null ? List.of() : List.copyOf(phases);
  }
}
