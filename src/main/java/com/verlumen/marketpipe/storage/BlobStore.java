package com.verlumen.marketpipe.storage;

import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * Key-addressable object storage: a local directory in development, a bucket in production.
 *
 * <p>Keys are {@code /}-separated paths. Every write is atomic: readers observe either the old
 * bytes or the new bytes, never a partial object. A successful return means the object is durable.
 */
public interface BlobStore {
  /**
   * Stores {@code data} under {@code key} unless the key already exists.
   *
   * @return true if the object was written, false if the key was already present
   */
  boolean putIfAbsent(String key, byte[] data) throws StorageException;

  /** Stores {@code data} under {@code key}, replacing any existing object. */
  void put(String key, byte[] data) throws StorageException;

  Optional<byte[]> get(String key) throws StorageException;

  /** All keys beginning with {@code prefix}, in lexicographic order. */
  ImmutableList<String> list(String prefix) throws StorageException;
}
