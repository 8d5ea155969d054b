package com.mk.fx.qa.rivet.execution.scheduler;

import com.mk.fx.qa.rivet.execution.model.ExecutionUnit;
import com.mk.fx.qa.rivet.execution.model.Outcome;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;

/** Executes one unit to its terminal outcome on a worker thread. */
@FunctionalInterface
public interface UnitWorker {
  Outcome run(ExecutionUnit unit, BooleanSupplier cancelled) throws InterruptedException;

  /**
   * Same as {@link #run(ExecutionUnit, BooleanSupplier)}, reporting each attempt number as it
   * starts so an abandoned unit can record how far it got.
   */
  default Outcome run(ExecutionUnit unit, BooleanSupplier cancelled, IntConsumer attemptStarted)
      throws InterruptedException {
    attemptStarted.accept(1);
    return run(unit, cancelled);
  }
}
