package com.scholary.mix.analyzer.fingerprint;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-level fingerprint cache: a bounded Caffeine cache in front of one binary file per key.
 *
 * <p>Files are written to a temporary sibling and moved into place atomically, so a reader never
 * sees a half-written entry and two processes writing the same key just replace each other's
 * identical file. An unreadable file is logged and treated as a miss.
 *
 * <p>File layout (big-endian): magic, sampleRate, hopLength, rows, columns, sourcePath (UTF),
 * then the feature values row by row.
 */
public class DiskFingerprintCache implements FingerprintCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiskFingerprintCache.class);

  static final int MAGIC = 0x43485231;
  private static final String EXTENSION = ".chroma";

  private final Path directory;
  private final Cache<String, Fingerprint> memory;

  public DiskFingerprintCache(FingerprintProperties properties) {
    this(Path.of(properties.cacheDir()), properties.memoryCacheSize());
  }

  public DiskFingerprintCache(Path directory, int memoryCacheSize) {
    this.directory = directory;
    this.memory = Caffeine.newBuilder().maximumSize(memoryCacheSize).recordStats().build();
    LOGGER.info(
        "Initialized fingerprint cache: dir={}, memoryCacheSize={}", directory, memoryCacheSize);
  }

  @Override
  public void put(String cacheKey, Fingerprint fingerprint) {
    memory.put(cacheKey, fingerprint);
    try {
      Files.createDirectories(directory);
      Path target = fileFor(cacheKey);
      Path temp = Files.createTempFile(directory, cacheKey, ".tmp");
      try {
        write(temp, fingerprint);
        move(temp, target);
      } finally {
        Files.deleteIfExists(temp);
      }
      LOGGER.debug("Cached fingerprint: key={}, frames={}", cacheKey, fingerprint.frameCount());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write fingerprint cache entry " + cacheKey, e);
    }
  }

  @Override
  public Optional<Fingerprint> get(String cacheKey) {
    Fingerprint fingerprint = memory.getIfPresent(cacheKey);
    if (fingerprint != null) {
      LOGGER.debug("Memory cache hit: key={}", cacheKey);
      return Optional.of(fingerprint);
    }

    Path file = fileFor(cacheKey);
    try {
      fingerprint = read(file);
    } catch (NoSuchFileException e) {
      LOGGER.debug("Cache miss: key={}", cacheKey);
      return Optional.empty();
    } catch (IOException e) {
      LOGGER.warn("Ignoring unreadable fingerprint cache file {}: {}", file, e.getMessage());
      return Optional.empty();
    }

    memory.put(cacheKey, fingerprint);
    LOGGER.debug("Disk cache hit: key={}", cacheKey);
    return Optional.of(fingerprint);
  }

  @Override
  public void evict(String cacheKey) {
    memory.invalidate(cacheKey);
    try {
      Files.deleteIfExists(fileFor(cacheKey));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to evict fingerprint cache entry " + cacheKey, e);
    }
    LOGGER.debug("Evicted fingerprint: key={}", cacheKey);
  }

  /**
   * Get cache statistics for monitoring.
   *
   * @return cache stats
   */
  public String getStats() {
    var stats = memory.stats();
    return String.format(
        "FingerprintCache[memorySize=%d, hitRate=%.2f%%, evictions=%d]",
        memory.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }

  Path fileFor(String cacheKey) {
    return directory.resolve(cacheKey + EXTENSION);
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void write(Path file, Fingerprint fingerprint) throws IOException {
    double[][] features = fingerprint.features();
    try (DataOutputStream out =
        new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(file)))) {
      out.writeInt(MAGIC);
      out.writeInt(fingerprint.sampleRate());
      out.writeInt(fingerprint.hopLength());
      out.writeInt(features.length);
      out.writeInt(fingerprint.frameCount());
      out.writeUTF(fingerprint.sourcePath() == null ? "" : fingerprint.sourcePath());
      for (double[] row : features) {
        for (double value : row) {
          out.writeDouble(value);
        }
      }
    }
  }

  private static Fingerprint read(Path file) throws IOException {
    try (DataInputStream in =
        new DataInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
      int magic = in.readInt();
      if (magic != MAGIC) {
        throw new IOException("Not a fingerprint cache file (bad magic)");
      }
      int sampleRate = in.readInt();
      int hopLength = in.readInt();
      int rows = in.readInt();
      int columns = in.readInt();
      if (rows != Fingerprint.PITCH_CLASSES || columns < 0) {
        throw new IOException("Corrupt fingerprint dimensions " + rows + "x" + columns);
      }
      long payloadBytes = (long) rows * columns * Double.BYTES;
      if (payloadBytes > Files.size(file)) {
        throw new IOException(
            "Fingerprint header claims " + payloadBytes + " bytes but file is shorter");
      }
      String sourcePath = in.readUTF();
      double[][] features = new double[rows][columns];
      for (int r = 0; r < rows; r++) {
        for (int c = 0; c < columns; c++) {
          features[r][c] = in.readDouble();
        }
      }
      try {
        return new Fingerprint(features, sampleRate, hopLength, sourcePath);
      } catch (IllegalArgumentException e) {
        throw new IOException("Corrupt fingerprint header", e);
      }
    }
  }
}
