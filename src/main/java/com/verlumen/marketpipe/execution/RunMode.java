package com.verlumen.marketpipe.execution;

/** WET runs talk to real providers; DRY runs use synthetic data and publish nothing. */
public enum RunMode {
  WET,
  DRY;

  public static RunMode fromString(String name) {
    return RunMode.valueOf(name.trim().toUpperCase());
  }
}
