package com.verlumen.marketpipe.signals;

public enum Decision {
  BUY,
  SELL,
  HOLD;

  /** BUY and SELL are worth acting on; HOLD is only logged. */
  public boolean isActionable() {
    return this != HOLD;
  }
}
