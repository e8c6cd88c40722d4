package de.ialistannen.rex.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.rex.cache.CacheException.Kind;
import de.ialistannen.rex.oci.Digest;
import de.ialistannen.rex.testing.MutableClock;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CacheStoreTest {

  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
  private static final byte[] MANIFEST = "{\"schemaVersion\":2}".getBytes(StandardCharsets.UTF_8);
  private static final Digest MANIFEST_DIGEST = Digest.compute(MANIFEST);

  @TempDir
  Path cacheDir;

  private MutableClock clock;
  private CacheStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = newStore();
  }

  @Test
  void returnsStoredContent() throws CacheException {
    store.put(CacheEntry.content(CacheKind.MANIFEST, MANIFEST_DIGEST, MANIFEST, START));

    CacheEntry entry = store.get(CacheKey.content(CacheKind.MANIFEST, MANIFEST_DIGEST)).orElseThrow();

    assertThat(entry.payload()).isEqualTo(MANIFEST);
    assertThat(entry.digest()).contains(MANIFEST_DIGEST);
  }

  @Test
  void callerCanNotModifyCachedContent() throws CacheException {
    byte[] payload = MANIFEST.clone();
    store.put(CacheEntry.content(CacheKind.MANIFEST, MANIFEST_DIGEST, payload, START));
    payload[0] = 'X';

    CacheKey key = CacheKey.content(CacheKind.MANIFEST, MANIFEST_DIGEST);
    store.get(key).orElseThrow().payload()[0] = 'Y';

    CacheEntry entry = store.get(key).orElseThrow();
    assertThat(entry.payload()).isEqualTo(MANIFEST);
    assertThat(MANIFEST_DIGEST.matches(entry.payload())).isTrue();
  }

  @Test
  void readsContentBackFromDiskInNewStore() throws CacheException {
    store.put(CacheEntry.content(CacheKind.MANIFEST, MANIFEST_DIGEST, MANIFEST, START));

    CacheStore other = newStore();

    assertThat(other.get(CacheKey.content(CacheKind.MANIFEST, MANIFEST_DIGEST)))
      .map(CacheEntry::payload)
      .contains(MANIFEST);
  }

  @Test
  void missesUnknownKeys() throws CacheException {
    assertThat(store.get(CacheKey.content(CacheKind.CONFIG, MANIFEST_DIGEST))).isEmpty();
    assertThat(store.get(CacheKey.tagList("r", "app"))).isEmpty();
  }

  @Test
  void contentPutIsIdempotent() throws CacheException, IOException {
    store.put(CacheEntry.content(CacheKind.MANIFEST, MANIFEST_DIGEST, MANIFEST, START));
    Path file = singleEntryFile();
    byte[] firstWrite = Files.readAllBytes(file);

    clock.advance(Duration.ofDays(3));
    store.put(CacheEntry.content(CacheKind.MANIFEST, MANIFEST_DIGEST, MANIFEST, clock.instant()));

    assertThat(Files.readAllBytes(file)).isEqualTo(firstWrite);
    assertThat(store.stats().diskEntries()).isEqualTo(1);
  }

  @Test
  void contentNeverGoesStale() throws CacheException {
    store.put(CacheEntry.content(CacheKind.CONFIG, MANIFEST_DIGEST, MANIFEST, START));

    clock.advance(Duration.ofDays(3650));

    assertThat(newStore().get(CacheKey.content(CacheKind.CONFIG, MANIFEST_DIGEST))).isPresent();
  }

  @Test
  void rejectsContentNotMatchingItsDigest() throws CacheException {
    Digest otherDigest = Digest.compute("something else".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> store.put(CacheEntry.content(CacheKind.MANIFEST, otherDigest, MANIFEST, START)))
      .isInstanceOfSatisfying(CacheException.class, e -> assertThat(e.kind()).isEqualTo(Kind.INTEGRITY));

    assertThat(store.get(CacheKey.content(CacheKind.MANIFEST, otherDigest))).isEmpty();
    assertThat(store.stats().diskEntries()).isZero();
  }

  @Test
  void listingsGoStaleAfterTheirThreshold() throws CacheException {
    CacheKey tags = CacheKey.tagList("registry", "app");
    CacheKey catalog = CacheKey.catalog("registry");
    store.put(CacheEntry.listing(tags, "[\"v1\"]".getBytes(StandardCharsets.UTF_8), clock.instant()));
    store.put(CacheEntry.listing(catalog, "[\"app\"]".getBytes(StandardCharsets.UTF_8), clock.instant()));

    clock.advance(Duration.ofMinutes(29));
    assertThat(store.get(tags)).isPresent();

    clock.advance(Duration.ofMinutes(2));
    assertThat(store.get(tags)).isEmpty();
    assertThat(newStore().get(tags)).isEmpty();
    assertThat(store.get(catalog)).isPresent();
  }

  @Test
  void listingPutOverwrites() throws CacheException {
    CacheKey tags = CacheKey.tagList("registry", "app");
    store.put(CacheEntry.listing(tags, "[\"v1\"]".getBytes(StandardCharsets.UTF_8), clock.instant()));
    store.put(CacheEntry.listing(tags, "[\"v1\",\"v2\"]".getBytes(StandardCharsets.UTF_8), clock.instant()));

    assertThat(newStore().get(tags))
      .map(it -> new String(it.payload(), StandardCharsets.UTF_8))
      .contains("[\"v1\",\"v2\"]");
  }

  @Test
  void contentKindsShareStorage() throws CacheException {
    store.put(CacheEntry.content(CacheKind.MANIFEST, MANIFEST_DIGEST, MANIFEST, START));

    assertThat(newStore().get(CacheKey.content(CacheKind.CONFIG, MANIFEST_DIGEST))).isPresent();
  }

  @Test
  void evictsUndecodableEntries() throws CacheException, IOException {
    store.put(CacheEntry.content(CacheKind.MANIFEST, MANIFEST_DIGEST, MANIFEST, START));
    Path file = singleEntryFile();
    Files.writeString(file, "{\"version\": 1, \"payl");

    CacheStore other = newStore();
    CacheKey key = CacheKey.content(CacheKind.MANIFEST, MANIFEST_DIGEST);

    assertThatThrownBy(() -> other.get(key))
      .isInstanceOfSatisfying(CacheException.class, e -> assertThat(e.kind()).isEqualTo(Kind.CORRUPT));
    assertThat(file).doesNotExist();
    assertThat(other.get(key)).isEmpty();
  }

  @Test
  void evictsTamperedContent() throws CacheException, IOException {
    store.put(CacheEntry.content(CacheKind.MANIFEST, MANIFEST_DIGEST, MANIFEST, START));
    Path file = singleEntryFile();
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode stored = (ObjectNode) objectMapper.readTree(file.toFile());
    stored.put("payload", "tampered".getBytes(StandardCharsets.UTF_8));
    objectMapper.writeValue(file.toFile(), stored);

    CacheStore other = newStore();

    assertThatThrownBy(() -> other.get(CacheKey.content(CacheKind.MANIFEST, MANIFEST_DIGEST)))
      .isInstanceOfSatisfying(CacheException.class, e -> assertThat(e.kind()).isEqualTo(Kind.INTEGRITY));
    assertThat(file).doesNotExist();
  }

  @Test
  void invalidateRemovesBothTiers() throws CacheException {
    CacheKey tags = CacheKey.tagList("registry", "app");
    store.put(CacheEntry.listing(tags, "[]".getBytes(StandardCharsets.UTF_8), clock.instant()));

    store.invalidate(tags);
    store.invalidate(tags);

    assertThat(store.get(tags)).isEmpty();
    assertThat(store.stats().diskEntries()).isZero();
  }

  @Test
  void concurrentPutsOfSameContentLeaveOneEntry() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < 32; i++) {
      futures.add(executor.submit(() -> {
        start.await();
        store.put(CacheEntry.content(CacheKind.MANIFEST, MANIFEST_DIGEST, MANIFEST, START));
        return null;
      }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }
    executor.shutdown();

    assertThat(allFiles()).hasSize(1);
    assertThat(newStore().get(CacheKey.content(CacheKind.MANIFEST, MANIFEST_DIGEST)))
      .map(CacheEntry::payload)
      .contains(MANIFEST);
  }

  @Test
  void pruneRemovesStaleListingsAndLeftovers() throws CacheException, IOException {
    store.put(CacheEntry.content(CacheKind.MANIFEST, MANIFEST_DIGEST, MANIFEST, START));
    store.put(CacheEntry.listing(
      CacheKey.tagList("registry", "app"),
      "[]".getBytes(StandardCharsets.UTF_8),
      clock.instant()
    ));
    Files.writeString(cacheDir.resolve("leftover.json.tmp"), "partial");

    clock.advance(Duration.ofHours(2));
    RemovalStats removed = store.prune();

    assertThat(removed.removedEntries()).isEqualTo(2);
    assertThat(removed.reclaimedBytes()).isPositive();
    assertThat(store.stats().diskEntries()).isEqualTo(1);
  }

  @Test
  void clearRemovesEverything() throws CacheException {
    store.put(CacheEntry.content(CacheKind.MANIFEST, MANIFEST_DIGEST, MANIFEST, START));
    store.put(CacheEntry.listing(CacheKey.catalog("registry"), "[]".getBytes(StandardCharsets.UTF_8), START));

    CacheStats before = store.stats();
    RemovalStats removed = store.clear();

    assertThat(before.diskEntries()).isEqualTo(2);
    assertThat(before.diskBytes()).isPositive();
    assertThat(removed.removedEntries()).isEqualTo(2);
    assertThat(store.stats()).isEqualTo(new CacheStats(0, 0, 0));
    assertThat(store.get(CacheKey.catalog("registry"))).isEmpty();
  }

  @Test
  void statsOfMissingDirectoryAreEmpty() throws CacheException {
    CacheStore missing = new CacheStore(cacheDir.resolve("does-not-exist"), CachePolicy.defaults());

    assertThat(missing.stats().diskEntries()).isZero();
  }

  private CacheStore newStore() {
    return new CacheStore(cacheDir, CachePolicy.defaults(), 100, clock);
  }

  private Path singleEntryFile() throws IOException {
    List<Path> files = allFiles();
    assertThat(files).hasSize(1);
    return files.get(0);
  }

  private List<Path> allFiles() throws IOException {
    try (Stream<Path> files = Files.walk(cacheDir)) {
      return files.filter(Files::isRegularFile).toList();
    }
  }
}
