package de.ialistannen.rex.cache;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.Striped;
import de.ialistannen.rex.cache.CacheException.Kind;
import de.ialistannen.rex.oci.Digest;
import de.ialistannen.rex.oci.ValidationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A two tier cache for registry metadata: a bounded in-memory layer in front of one json file per entry on disk.
 * <p>
 * Files are written to a temporary file first and then atomically moved into place, so readers (in this or another
 * process) never see half written entries. Content entries are verified against their digest when written and when
 * read back.
 */
public class CacheStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(CacheStore.class);

  private static final int FORMAT_VERSION = 1;
  private static final String ENTRY_SUFFIX = ".json";
  private static final String TEMP_SUFFIX = ".tmp";
  public static final long DEFAULT_MEMORY_ENTRIES = 1000;

  private final Path directory;
  private final CachePolicy policy;
  private final Clock clock;
  private final ObjectMapper objectMapper;
  private final Cache<String, CacheEntry> memory;
  private final Striped<Lock> locks;

  public CacheStore(Path directory, CachePolicy policy) {
    this(directory, policy, DEFAULT_MEMORY_ENTRIES, Clock.systemUTC());
  }

  public CacheStore(Path directory, CachePolicy policy, long memoryEntries, Clock clock) {
    this.directory = directory;
    this.policy = policy;
    this.clock = clock;

    this.objectMapper = new ObjectMapper()
      .findAndRegisterModules()
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    this.memory = Caffeine.newBuilder()
      .maximumSize(memoryEntries)
      .build();
    this.locks = Striped.lock(64);
  }

  public Path directory() {
    return directory;
  }

  /**
   * @return the clock used to judge freshness
   */
  public Clock clock() {
    return clock;
  }

  /**
   * Looks up an entry. Listing entries older than their staleness threshold count as a miss.
   *
   * @param key the key
   * @return the entry, if present and fresh
   * @throws CacheException if the disk could not be read ({@link Kind#IO_FAILURE}), the stored entry could not be
   *   decoded ({@link Kind#CORRUPT}, the entry is evicted) or its payload does not match its digest
   *   ({@link Kind#INTEGRITY}, the entry is evicted)
   */
  public Optional<CacheEntry> get(CacheKey key) throws CacheException {
    CacheEntry cached = memory.getIfPresent(memoryKey(key));
    if (cached != null) {
      if (isFresh(cached)) {
        return Optional.of(cached);
      }
      memory.invalidate(memoryKey(key));
      return Optional.empty();
    }

    Path path = pathFor(key);
    byte[] raw;
    try {
      raw = Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new CacheException(Kind.IO_FAILURE, "Could not read cache entry " + path, e);
    }

    CacheEntry entry = decode(key, path, raw);
    if (!isFresh(entry)) {
      LOGGER.debug("Cache entry '{}' is stale (fetched {})", key.value(), entry.fetchedAt());
      return Optional.empty();
    }

    memory.put(memoryKey(key), entry);
    return Optional.of(entry);
  }

  /**
   * Stores an entry. Content entries are written once: storing a digest that is already present succeeds without
   * touching the disk. Listing entries overwrite older ones.
   *
   * @param entry the entry
   * @throws CacheException with {@link Kind#INTEGRITY} if the payload of a content entry does not match its digest,
   *   in which case nothing is stored, or with {@link Kind#IO_FAILURE} if writing failed
   */
  public void put(CacheEntry entry) throws CacheException {
    CacheKey key = entry.key();
    if (key.kind().isContentAddressed()) {
      verifyIntegrity(entry);
    }

    Path path = pathFor(key);
    Lock lock = locks.get(key.value());
    lock.lock();
    try {
      if (key.kind().isContentAddressed() && Files.exists(path)) {
        LOGGER.trace("Content entry '{}' already present", key.value());
      } else {
        write(path, encode(entry));
      }
      memory.put(memoryKey(key), entry);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes an entry from both tiers. Removing an absent entry is not an error.
   *
   * @param key the key
   * @throws CacheException if the file could not be deleted
   */
  public void invalidate(CacheKey key) throws CacheException {
    memory.invalidate(memoryKey(key));

    Lock lock = locks.get(key.value());
    lock.lock();
    try {
      Files.deleteIfExists(pathFor(key));
    } catch (IOException e) {
      throw new CacheException(Kind.IO_FAILURE, "Could not delete cache entry for '" + key.value() + "'", e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Deletes stale listing entries, undecodable files and leftover temporary files.
   *
   * @return what was removed
   * @throws CacheException if the cache directory could not be walked
   */
  public RemovalStats prune() throws CacheException {
    long removed = 0;
    long reclaimed = 0;

    for (Path file : listFiles()) {
      boolean remove;
      if (file.getFileName().toString().endsWith(TEMP_SUFFIX)) {
        remove = true;
      } else if (!file.getFileName().toString().endsWith(ENTRY_SUFFIX)) {
        continue;
      } else {
        remove = shouldPrune(file);
      }
      if (!remove) {
        continue;
      }

      long size = sizeOf(file);
      if (deleteQuietly(file)) {
        removed++;
        reclaimed += size;
      }
    }
    memory.invalidateAll();

    LOGGER.info("Pruned {} cache entries, reclaimed {} bytes", removed, reclaimed);
    return new RemovalStats(removed, reclaimed);
  }

  /**
   * Deletes every entry.
   *
   * @return what was removed
   * @throws CacheException if the cache directory could not be walked
   */
  public RemovalStats clear() throws CacheException {
    memory.invalidateAll();

    long removed = 0;
    long reclaimed = 0;
    for (Path file : listFiles()) {
      long size = sizeOf(file);
      if (deleteQuietly(file)) {
        removed++;
        reclaimed += size;
      }
    }

    LOGGER.info("Cleared {} cache entries, reclaimed {} bytes", removed, reclaimed);
    return new RemovalStats(removed, reclaimed);
  }

  /**
   * @return entry counts and disk usage
   * @throws CacheException if the cache directory could not be walked
   */
  public CacheStats stats() throws CacheException {
    List<Path> entries = listFiles().stream()
      .filter(it -> it.getFileName().toString().endsWith(ENTRY_SUFFIX))
      .toList();
    long bytes = entries.stream().mapToLong(CacheStore::sizeOf).sum();

    return new CacheStats(entries.size(), bytes, memory.estimatedSize());
  }

  private boolean isFresh(CacheEntry entry) {
    Optional<Duration> threshold = policy.stalenessThreshold(entry.kind());
    if (threshold.isEmpty()) {
      return true;
    }
    Duration age = Duration.between(entry.fetchedAt(), clock.instant());
    return age.compareTo(threshold.get()) <= 0;
  }

  private boolean shouldPrune(Path file) {
    try {
      StoredEntry stored = objectMapper.readValue(file.toFile(), StoredEntry.class);
      CacheKey key = new CacheKey(stored.key(), stored.kind());
      CacheEntry entry = new CacheEntry(key, stored.payload(), Optional.empty(), stored.fetchedAt());
      return stored.version() != FORMAT_VERSION || !isFresh(entry);
    } catch (IOException | RuntimeException e) {
      LOGGER.debug("Pruning undecodable cache file {}", file, e);
      return true;
    }
  }

  private static void verifyIntegrity(CacheEntry entry) throws CacheException {
    Digest digest = entry.digest()
      .orElseThrow(() -> new CacheException(
        Kind.INTEGRITY,
        "Content entry '" + entry.key().value() + "' has no digest"
      ));
    if (!digest.toString().equals(entry.key().value())) {
      throw new CacheException(
        Kind.INTEGRITY,
        "Entry claims digest " + digest + " but is keyed as '" + entry.key().value() + "'"
      );
    }
    if (!digest.matches(entry.payload())) {
      throw new CacheException(
        Kind.INTEGRITY,
        "Payload does not match its digest " + digest + ", actual "
          + Digest.compute(digest.algorithm(), entry.payload())
      );
    }
  }

  private byte[] encode(CacheEntry entry) throws CacheException {
    StoredEntry stored = new StoredEntry(
      FORMAT_VERSION,
      entry.key().value(),
      entry.kind(),
      entry.digest().map(Digest::toString).orElse(null),
      entry.fetchedAt(),
      entry.payload()
    );
    try {
      return objectMapper.writeValueAsBytes(stored);
    } catch (JacksonException e) {
      throw new CacheException(Kind.IO_FAILURE, "Could not serialize cache entry '" + entry.key().value() + "'", e);
    }
  }

  private CacheEntry decode(CacheKey key, Path path, byte[] raw) throws CacheException {
    StoredEntry stored;
    try {
      stored = objectMapper.readValue(raw, StoredEntry.class);
    } catch (IOException e) {
      evict(key, path);
      throw new CacheException(Kind.CORRUPT, "Cache entry " + path + " could not be decoded", e);
    }

    if (stored == null || stored.version() != FORMAT_VERSION || stored.payload() == null
      || stored.fetchedAt() == null || !key.value().equals(stored.key()) || !sameFamily(key.kind(), stored.kind())) {
      evict(key, path);
      throw new CacheException(Kind.CORRUPT, "Cache entry " + path + " does not belong to '" + key.value() + "'");
    }

    Optional<Digest> digest;
    try {
      digest = Optional.ofNullable(stored.digest()).map(Digest::parse);
    } catch (ValidationException e) {
      evict(key, path);
      throw new CacheException(Kind.CORRUPT, "Cache entry " + path + " has an invalid digest", e);
    }

    CacheEntry entry = new CacheEntry(key, stored.payload(), digest, stored.fetchedAt());
    if (key.kind().isContentAddressed()) {
      try {
        verifyIntegrity(entry);
      } catch (CacheException e) {
        evict(key, path);
        throw e;
      }
    }
    return entry;
  }

  // Content kinds share one file per digest
  private static boolean sameFamily(CacheKind requested, CacheKind stored) {
    if (requested.isContentAddressed()) {
      return stored != null && stored.isContentAddressed();
    }
    return requested == stored;
  }

  private void evict(CacheKey key, Path path) {
    LOGGER.warn("Evicting unusable cache entry '{}' at {}", key.value(), path);
    memory.invalidate(memoryKey(key));
    deleteQuietly(path);
  }

  private void write(Path path, byte[] content) throws CacheException {
    Path temp = null;
    try {
      Files.createDirectories(path.getParent());
      temp = Files.createTempFile(path.getParent(), path.getFileName().toString(), TEMP_SUFFIX);
      Files.write(temp, content);
      try {
        Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        LOGGER.debug("Atomic move not supported for {}, falling back to replace", path);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
      }
      temp = null;
    } catch (IOException e) {
      throw new CacheException(Kind.IO_FAILURE, "Could not write cache entry " + path, e);
    } finally {
      if (temp != null) {
        deleteQuietly(temp);
      }
    }
  }

  private List<Path> listFiles() throws CacheException {
    if (Files.notExists(directory)) {
      return List.of();
    }
    try (Stream<Path> files = Files.walk(directory)) {
      return files.filter(Files::isRegularFile).toList();
    } catch (IOException e) {
      throw new CacheException(Kind.IO_FAILURE, "Could not list cache directory " + directory, e);
    }
  }

  private Path pathFor(CacheKey key) {
    if (key.kind().isContentAddressed()) {
      Digest digest = key.digest().orElseThrow();
      return directory.resolve("content")
        .resolve(digest.algorithm().identifier())
        .resolve(digest.hex() + ENTRY_SUFFIX);
    }
    String hashedKey = Hashing.sha256().hashString(key.value(), StandardCharsets.UTF_8).toString();
    return directory.resolve("listings")
      .resolve(key.kind().name().toLowerCase(Locale.ROOT))
      .resolve(hashedKey + ENTRY_SUFFIX);
  }

  private static String memoryKey(CacheKey key) {
    return key.kind() + "|" + key.value();
  }

  private static long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      LOGGER.debug("Could not determine size of {}", file, e);
      return 0;
    }
  }

  private static boolean deleteQuietly(Path file) {
    try {
      return Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Could not delete cache file {}", file, e);
      return false;
    }
  }

  @JsonSerialize
  @JsonDeserialize
  record StoredEntry(
    int version,
    String key,
    CacheKind kind,
    String digest,
    Instant fetchedAt,
    byte[] payload
  ) {

  }
}
