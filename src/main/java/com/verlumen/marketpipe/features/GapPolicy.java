package com.verlumen.marketpipe.features;

/** What a feature does when its trailing window has missing expected periods. */
public enum GapPolicy {
  /** Withheld unless every point of the window is present. */
  GAP_SENSITIVE,
  /** Computed over whichever points fall inside the window. */
  GAP_TOLERANT
}
