package org.waabox.concierge.lease.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.concierge.leader.LeaseStore;
import org.waabox.concierge.leader.LeaseStoreUnavailableException;

/**
 * A {@link LeaseStore} that keeps leases as files in a directory shared by
 * the processes of one host.
 *
 * <p>Each lease key gets its own file. Conditional writes hold an exclusive
 * lock on a {@code .lock} file of the directory, so that the read, the
 * comparison and the write happen as one step across processes. Instances
 * within the same JVM are serialized by an in-process lock, since file
 * locks are held per JVM.
 *
 * <p>Writes use an atomic pattern: the value is written to a temporary file
 * and then renamed, so readers never see a partial lease.
 *
 * <p>Storage layout:
 * <pre>
 * {baseDir}/
 *   .lock
 *   {url-encoded lease key}.lease
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemLeaseStore implements LeaseStore {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FileSystemLeaseStore.class);

  /** The name of the lock file within the base directory. */
  private static final String LOCK_FILE = ".lock";

  /** The extension of the lease files. */
  private static final String LEASE_SUFFIX = ".lease";

  /** Serializes the writers of this JVM. */
  private static final ReentrantLock JVM_LOCK = new ReentrantLock();

  /** The base directory where the leases are stored. */
  private final Path baseDir;

  /**
   * Creates a new FileSystemLeaseStore with the given base directory.
   *
   * <p>If the base directory does not exist, it is created along with any
   * necessary parent directories.
   *
   * @param theBaseDir the base directory for lease storage, never null
   *
   * @throws UncheckedIOException if the directory cannot be created
   */
  public FileSystemLeaseStore(final Path theBaseDir) {
    baseDir = Objects.requireNonNull(theBaseDir,
        "baseDir must not be null");
    try {
      Files.createDirectories(baseDir);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to create base directory: " + baseDir, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Optional<String> read(final String key) {
    Objects.requireNonNull(key, "key must not be null");
    try {
      return readFile(fileFor(key));
    } catch (final IOException e) {
      throw new LeaseStoreUnavailableException(
          "Failed to read lease: " + key, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean writeIfFresh(final String key, final String observed,
      final String value) {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(value, "value must not be null");

    final Path file = fileFor(key);
    JVM_LOCK.lock();
    try (FileChannel lockChannel = FileChannel.open(
             baseDir.resolve(LOCK_FILE), StandardOpenOption.CREATE,
             StandardOpenOption.WRITE);
         FileLock lock = lockChannel.lock()) {

      final Optional<String> current = readFile(file);
      if (!Objects.equals(current.orElse(null), observed)) {
        log.debug("Lease {} changed since it was read", key);
        return false;
      }
      final Path temp = baseDir.resolve(file.getFileName() + ".tmp");
      Files.writeString(temp, value, StandardCharsets.UTF_8);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
      return true;

    } catch (final IOException e) {
      throw new LeaseStoreUnavailableException(
          "Failed to write lease: " + key, e);
    } finally {
      JVM_LOCK.unlock();
    }
  }

  /**
   * Returns the base directory.
   *
   * @return the directory, never null
   */
  public Path baseDir() {
    return baseDir;
  }

  /**
   * Resolves the file of a lease key.
   *
   * @param key the lease key
   * @return the lease file, never null
   */
  private Path fileFor(final String key) {
    return baseDir.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8)
        + LEASE_SUFFIX);
  }

  /**
   * Reads a lease file.
   *
   * <p>Undecodable bytes are replaced rather than rejected, so a corrupt
   * file reads as an unparseable lease that can be overwritten.
   *
   * @param file the lease file
   * @return the content, or empty if the file does not exist
   * @throws IOException if the file cannot be read
   */
  private static Optional<String> readFile(final Path file)
      throws IOException {
    try {
      return Optional.of(new String(Files.readAllBytes(file),
          StandardCharsets.UTF_8));
    } catch (final NoSuchFileException e) {
      return Optional.empty();
    }
  }
}
