package com.verlumen.marketpipe.pipeline;

import com.verlumen.marketpipe.instruments.Instrument;
import java.time.Instant;
import java.util.List;

/** The single entry point an external scheduler triggers. */
public interface CycleRunner {
  /**
   * Ingests, computes features and emits signals for {@code instruments} as of {@code asOf}.
   * Running it twice with no new upstream data leaves all stored state unchanged. Failures are
   * reported, never thrown.
   */
  CycleReport runCycle(List<Instrument> instruments, Instant asOf);
}
