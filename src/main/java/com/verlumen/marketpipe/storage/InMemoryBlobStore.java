package com.verlumen.marketpipe.storage;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.inject.Inject;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/** Process-local {@link BlobStore} used by dry runs and tests. */
public final class InMemoryBlobStore implements BlobStore {
  private final ConcurrentNavigableMap<String, byte[]> objects = new ConcurrentSkipListMap<>();

  @Inject
  public InMemoryBlobStore() {}

  @Override
  public boolean putIfAbsent(String key, byte[] data) {
    return objects.putIfAbsent(key, data.clone()) == null;
  }

  @Override
  public void put(String key, byte[] data) {
    objects.put(key, data.clone());
  }

  @Override
  public Optional<byte[]> get(String key) {
    return Optional.ofNullable(objects.get(key)).map(byte[]::clone);
  }

  @Override
  public ImmutableList<String> list(String prefix) {
    return objects.tailMap(prefix, true).keySet().stream()
        .takeWhile(key -> key.startsWith(prefix))
        .collect(ImmutableList.toImmutableList());
  }

  /** Copy of every stored object, for state comparisons. */
  public ImmutableSortedMap<String, byte[]> snapshot() {
    return ImmutableSortedMap.copyOf(objects);
  }
}
