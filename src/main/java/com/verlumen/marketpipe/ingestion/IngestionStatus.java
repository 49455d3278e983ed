package com.verlumen.marketpipe.ingestion;

public enum IngestionStatus {
  SUCCEEDED,
  INGESTION_FAILED,
  INGESTION_TIMEOUT
}
