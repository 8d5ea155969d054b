package com.mk.fx.qa.rivet.execution.engine;

import com.mk.fx.qa.rivet.execution.collate.RunProgress;

/**
 * Receives a partial snapshot after every recorded outcome. Calls are serialized; a listener that
 * throws is logged and otherwise ignored.
 */
@FunctionalInterface
public interface ProgressListener {

  void onProgress(RunProgress progress);
}
