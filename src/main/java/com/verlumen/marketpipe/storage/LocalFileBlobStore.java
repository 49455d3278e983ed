package com.verlumen.marketpipe.storage;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link BlobStore} backed by a local directory.
 *
 * <p>Objects are written to a temporary sibling, forced to disk and then moved into place, so a
 * crash never leaves a torn object behind. {@link #putIfAbsent} publishes with a hard link, which
 * fails atomically when the target exists.
 */
public final class LocalFileBlobStore implements BlobStore {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String TEMP_SUFFIX = ".tmp";

  private final Path root;

  public LocalFileBlobStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public boolean putIfAbsent(String key, byte[] data) throws StorageException {
    Path target = resolve(key);
    if (Files.exists(target)) {
      return false;
    }
    Path temp = writeTemp(target, data);
    try {
      Files.createLink(target, temp);
      return true;
    } catch (FileAlreadyExistsException e) {
      logger.atFine().log("Object %s appeared concurrently, keeping existing copy", key);
      return false;
    } catch (IOException e) {
      throw new StorageException("Unable to publish " + key, e);
    } finally {
      deleteQuietly(temp);
    }
  }

  @Override
  public void put(String key, byte[] data) throws StorageException {
    Path target = resolve(key);
    Path temp = writeTemp(target, data);
    try {
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new StorageException("Unable to publish " + key, e);
    }
  }

  @Override
  public Optional<byte[]> get(String key) throws StorageException {
    try {
      return Optional.of(Files.readAllBytes(resolve(key)));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new StorageException("Unable to read " + key, e);
    }
  }

  @Override
  public ImmutableList<String> list(String prefix) throws StorageException {
    // Only the deepest directory named by the prefix needs walking.
    int lastSlash = prefix.lastIndexOf('/');
    Path start = lastSlash < 0 ? root : root.resolve(prefix.substring(0, lastSlash));
    if (!Files.isDirectory(start)) {
      return ImmutableList.of();
    }
    try (Stream<Path> files = Files.walk(start)) {
      return files
          .filter(Files::isRegularFile)
          .map(path -> root.relativize(path).toString().replace('\\', '/'))
          .filter(key -> !key.endsWith(TEMP_SUFFIX))
          .filter(key -> key.startsWith(prefix))
          .sorted()
          .collect(toImmutableList());
    } catch (IOException e) {
      throw new StorageException("Unable to list " + prefix, e);
    }
  }

  private Path resolve(String key) {
    checkArgument(!key.isEmpty() && !key.startsWith("/"), "Invalid key: %s", key);
    for (String segment : Splitter.on('/').split(key)) {
      checkArgument(!segment.isEmpty() && !segment.equals("..") && !segment.equals("."),
          "Invalid key: %s", key);
    }
    return root.resolve(key);
  }

  private static Path writeTemp(Path target, byte[] data) throws StorageException {
    try {
      Files.createDirectories(target.getParent());
      Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), TEMP_SUFFIX);
      try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      return temp;
    } catch (IOException e) {
      throw new StorageException("Unable to stage write for " + target, e);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Unable to delete temporary file %s", path);
    }
  }
}
