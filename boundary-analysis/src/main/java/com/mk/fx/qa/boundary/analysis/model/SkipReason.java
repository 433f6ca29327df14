package com.mk.fx.qa.boundary.analysis.model;

/** Why a condition produced no comparison. */
public enum SkipReason {
  /** A variant was measured but yielded zero usable samples. */
  EMPTY_SAMPLE_SET,
  /** Only one of the two variants has data for the condition. */
  MISSING_COUNTERPART,
  /** The network condition could not be applied, so nothing was measured. */
  SHAPING_FAILED,
  /** Not measured because shaping left by an earlier condition could not be released. */
  SWEEP_STOPPED
}
