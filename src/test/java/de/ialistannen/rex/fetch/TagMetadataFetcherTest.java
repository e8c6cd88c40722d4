package de.ialistannen.rex.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.ialistannen.rex.config.ExplorerSettings;
import de.ialistannen.rex.fetch.SkippedTaskException.Reason;
import de.ialistannen.rex.model.TagInfo;
import de.ialistannen.rex.oci.Digest;
import de.ialistannen.rex.oci.MediaTypes;
import de.ialistannen.rex.oci.ValidationException;
import de.ialistannen.rex.registry.NotFoundException;
import de.ialistannen.rex.registry.ProtocolException;
import de.ialistannen.rex.registry.TransportException;
import de.ialistannen.rex.registry.UnauthorizedException;
import de.ialistannen.rex.testing.FakeRegistry;
import de.ialistannen.rex.testing.RegistryMock;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@RegistryMock
class TagMetadataFetcherTest {

  private static final Instant CREATED = Instant.parse("2024-03-04T05:06:07Z");

  @TempDir
  Path cacheDir;

  @Test
  void fetchesAllTagsInListingOrder(FakeRegistry registry) throws InterruptedException {
    for (int i = 0; i < 20; i++) {
      registry.addImage("team/app", "v" + i, "linux", "amd64", CREATED.plusSeconds(i), 100, i);
      registry.delay(FakeRegistry.manifestPath("team/app", "v" + i), (i * 7) % 40);
    }

    FetchResult<TagInfo> result;
    try (TagMetadataFetcher fetcher = fetcher(registry, 8)) {
      result = fetcher.fetchTags("team/app");
    }

    assertThat(result.failures()).isEmpty();
    assertThat(result.successes())
      .extracting(TagInfo::name)
      .containsExactlyElementsOf(IntStream.range(0, 20).mapToObj(i -> "v" + i).toList());

    TagInfo fifth = result.successes().get(5);
    assertThat(fifth.size()).contains(105L);
    assertThat(fifth.lastModified()).contains(CREATED.plusSeconds(5));
    assertThat(fifth.platforms()).containsExactly("linux/amd64");
    assertThat(fifth.digest()).isPresent();
  }

  @Test
  void secondFetchIsServedFromCache(FakeRegistry registry) throws InterruptedException {
    for (int i = 0; i < 5; i++) {
      registry.addImage("app", "v" + i, "linux", "arm64", CREATED, 10);
    }

    try (TagMetadataFetcher fetcher = fetcher(registry, 4)) {
      fetcher.fetchTags("app");
      int afterFirst = registry.requestCount();

      FetchResult<TagInfo> second = fetcher.fetchTags("app");

      assertThat(second.successes()).hasSize(5);
      assertThat(registry.requestCount()).isEqualTo(afterFirst);
    }

    int beforeRestart = registry.requestCount();
    try (TagMetadataFetcher restarted = fetcher(registry, 4)) {
      assertThat(restarted.fetchTags("app").successes()).hasSize(5);
    }
    assertThat(registry.requestCount()).isEqualTo(beforeRestart);
  }

  @Test
  void describesMultiPlatformIndex(FakeRegistry registry) throws InterruptedException {
    String digest = registry.addIndex("app", "multi", CREATED, "linux/amd64", "linux/arm64");

    List<TagInfo> tags;
    try (TagMetadataFetcher fetcher = fetcher(registry, 2)) {
      tags = fetcher.fetchTags("app").successes();
    }

    assertThat(tags).hasSize(1);
    TagInfo tag = tags.get(0);
    assertThat(tag.digest()).contains(Digest.parse(digest));
    assertThat(tag.platforms()).containsExactly("linux/amd64", "linux/arm64");
    assertThat(tag.lastModified()).isEmpty();
    assertThat(tag.size()).hasValueSatisfying(it -> assertThat(it).isPositive());
  }

  @Test
  void failedTagsDoNotAffectOthers(FakeRegistry registry) throws InterruptedException {
    for (int i = 0; i < 5; i++) {
      registry.addImage("app", "v" + i, "linux", "amd64", CREATED, 10);
    }
    registry.respond(FakeRegistry.manifestPath("app", "v1"), 500, Map.of(), 1);
    registry.respond(FakeRegistry.manifestPath("app", "v3"), 404, Map.of(), 1);

    FetchResult<TagInfo> result;
    try (TagMetadataFetcher fetcher = fetcher(registry, 3)) {
      result = fetcher.fetchTags("app");
    }

    assertThat(result.successes()).extracting(TagInfo::name).containsExactly("v0", "v2", "v4");
    assertThat(result.failures()).extracting(FetchFailure::item).containsExactly("v1", "v3");
    assertThat(result.failures().get(0).error()).isInstanceOf(TransportException.class);
    assertThat(result.failures().get(1).error()).isInstanceOf(NotFoundException.class);
  }

  @Test
  void manifestWithoutConfigDigestIsProtocolFailure(FakeRegistry registry) throws InterruptedException {
    registry.addImage("app", "good", "linux", "amd64", CREATED, 10);
    registry.addRawManifest("app", "broken", MediaTypes.OCI_MANIFEST, """
      {
        "schemaVersion": 2,
        "mediaType": "application/vnd.oci.image.manifest.v1+json",
        "config": {"mediaType": "application/vnd.oci.image.config.v1+json", "size": 12},
        "layers": []
      }
      """);

    FetchResult<TagInfo> result;
    try (TagMetadataFetcher fetcher = fetcher(registry, 2)) {
      result = fetcher.fetchTags("app");
    }

    assertThat(result.successes()).extracting(TagInfo::name).containsExactly("good");
    assertThat(result.failures()).extracting(FetchFailure::item).containsExactly("broken");
    assertThat(result.failures().get(0).error()).isInstanceOf(ProtocolException.class);
  }

  @Test
  void retriesRateLimitedTags(FakeRegistry registry) throws InterruptedException {
    registry.addImage("app", "v1", "linux", "amd64", CREATED, 10);
    registry.respond(FakeRegistry.manifestPath("app", "v1"), 429, Map.of("Retry-After", "0"), 2);

    ExplorerSettings settings = ExplorerSettings.defaults(registry.url(), cacheDir)
      .withConcurrency(2)
      .withRetryPolicy(new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(10), true));

    FetchResult<TagInfo> result;
    try (TagMetadataFetcher fetcher = new TagMetadataFetcher(settings)) {
      result = fetcher.fetchTags("app");
    }

    assertThat(result.failures()).isEmpty();
    assertThat(registry.requestCount(FakeRegistry.manifestPath("app", "v1"))).isEqualTo(3);
  }

  @Test
  void deniedTagSkipsTheRest(FakeRegistry registry) throws InterruptedException {
    for (int i = 0; i < 4; i++) {
      registry.addImage("app", "v" + i, "linux", "amd64", CREATED, 10);
    }
    registry.respond(FakeRegistry.manifestPath("app", "v0"), 403, Map.of(), 1);

    FetchResult<TagInfo> result;
    try (TagMetadataFetcher fetcher = fetcher(registry, 1)) {
      result = fetcher.fetchTags("app");
    }

    assertThat(result.successes()).isEmpty();
    assertThat(result.failures()).hasSize(4);
    assertThat(result.failures().get(0).error()).isInstanceOf(UnauthorizedException.class);
    assertThat(result.failures().subList(1, 4))
      .allSatisfy(it -> assertThat(it.error())
        .isInstanceOfSatisfying(
          SkippedTaskException.class,
          skipped -> assertThat(skipped.reason()).isEqualTo(Reason.UNAUTHORIZED)
        ));
  }

  @Test
  void missingRepositoryFailsTheWholeCall(FakeRegistry registry) {
    try (TagMetadataFetcher fetcher = fetcher(registry, 2)) {
      assertThatThrownBy(() -> fetcher.fetchTags("missing")).isInstanceOf(NotFoundException.class);
    }
  }

  @Test
  void rejectsInvalidRepositoryNamesWithoutRequests(FakeRegistry registry) {
    try (TagMetadataFetcher fetcher = fetcher(registry, 2)) {
      assertThatThrownBy(() -> fetcher.fetchTags("Bad/Name")).isInstanceOf(ValidationException.class);
    }
    assertThat(registry.requestCount()).isZero();
  }

  @Test
  void emptyRepositoryHasNoTags(FakeRegistry registry) throws InterruptedException {
    registry.addRepository("empty");

    try (TagMetadataFetcher fetcher = fetcher(registry, 2)) {
      FetchResult<TagInfo> result = fetcher.fetchTags("empty");

      assertThat(result.successes()).isEmpty();
      assertThat(result.failures()).isEmpty();
    }
  }

  @Test
  void reportsProgress(FakeRegistry registry) throws InterruptedException {
    for (int i = 0; i < 6; i++) {
      registry.addImage("app", "v" + i, "linux", "amd64", CREATED, 10);
    }
    List<Integer> totals = new CopyOnWriteArrayList<>();

    try (TagMetadataFetcher fetcher = fetcher(registry, 3)) {
      fetcher.fetchTags("app", new CancellationSignal(), (completed, total) -> totals.add(total));
    }

    assertThat(totals).hasSize(6).containsOnly(6);
  }

  private TagMetadataFetcher fetcher(FakeRegistry registry, int concurrency) {
    return new TagMetadataFetcher(registry.url(), cacheDir, Optional.empty(), concurrency);
  }
}
