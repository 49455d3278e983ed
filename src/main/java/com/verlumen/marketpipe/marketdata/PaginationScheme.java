package com.verlumen.marketpipe.marketdata;

public enum PaginationScheme {
  /** Opaque continuation token handed back by the provider or adapter. */
  PAGE_TOKEN,
  /** Successive requests over [startTime, endTime] windows. */
  TIME_WINDOW
}
