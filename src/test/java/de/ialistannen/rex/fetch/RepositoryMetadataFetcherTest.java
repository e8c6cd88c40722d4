package de.ialistannen.rex.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.ialistannen.rex.model.RepositoryItem;
import de.ialistannen.rex.oci.MediaTypes;
import de.ialistannen.rex.registry.RateLimitedException;
import de.ialistannen.rex.registry.UnauthorizedException;
import de.ialistannen.rex.testing.FakeRegistry;
import de.ialistannen.rex.testing.RegistryMock;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@RegistryMock
class RepositoryMetadataFetcherTest {

  private static final Instant OLD = Instant.parse("2023-01-01T00:00:00Z");
  private static final Instant NEW = Instant.parse("2024-06-01T12:00:00Z");

  @TempDir
  Path cacheDir;

  @Test
  void describesRepositoriesInCatalogOrder(FakeRegistry registry) throws InterruptedException {
    registry.addImage("web", "1.0", "linux", "amd64", OLD, 100);
    registry.addImage("web", "2.0", "linux", "amd64", NEW, 300, 200);
    registry.addRepository("empty");
    registry.addIndex("tools/cli", "latest", NEW, "linux/amd64", "linux/arm64");

    FetchResult<RepositoryItem> result;
    try (RepositoryMetadataFetcher fetcher = fetcher(registry)) {
      result = fetcher.fetchRepositories();
    }

    assertThat(result.failures()).isEmpty();
    assertThat(result.successes()).extracting(RepositoryItem::name).containsExactly("web", "empty", "tools/cli");

    RepositoryItem web = result.successes().get(0);
    assertThat(web.tagCount()).contains(2);
    assertThat(web.totalSize()).contains(500L);
    assertThat(web.lastUpdated()).contains(NEW);

    RepositoryItem empty = result.successes().get(1);
    assertThat(empty).isEqualTo(new RepositoryItem("empty", Optional.of(0), Optional.empty(), Optional.empty()));

    RepositoryItem cli = result.successes().get(2);
    assertThat(cli.tagCount()).contains(1);
    assertThat(cli.totalSize()).isPresent();
    assertThat(cli.lastUpdated()).isEmpty();
  }

  @Test
  void degradesToTagCountWhenDetailsFail(FakeRegistry registry) throws InterruptedException {
    registry.addImage("web", "1.0", "linux", "amd64", OLD, 100);
    registry.respond(FakeRegistry.manifestPath("web", "1.0"), 502, Map.of(), 1);

    List<RepositoryItem> items;
    try (RepositoryMetadataFetcher fetcher = fetcher(registry)) {
      items = fetcher.fetchRepositories().successes();
    }

    assertThat(items).containsExactly(
      new RepositoryItem("web", Optional.of(1), Optional.empty(), Optional.empty())
    );
  }

  @Test
  void malformedDescriptorDegradesToTagCount(FakeRegistry registry) throws InterruptedException {
    registry.addRawManifest("web", "1.0", MediaTypes.OCI_INDEX, """
      {
        "schemaVersion": 2,
        "mediaType": "application/vnd.oci.image.index.v1+json",
        "manifests": [{"mediaType": "application/vnd.oci.image.manifest.v1+json", "size": 10}]
      }
      """);

    FetchResult<RepositoryItem> result;
    try (RepositoryMetadataFetcher fetcher = fetcher(registry)) {
      result = fetcher.fetchRepositories();
    }

    assertThat(result.failures()).isEmpty();
    assertThat(result.successes()).containsExactly(
      new RepositoryItem("web", Optional.of(1), Optional.empty(), Optional.empty())
    );
  }

  @Test
  void deniedRepositoryIsAFailure(FakeRegistry registry) throws InterruptedException {
    registry.addImage("open", "1.0", "linux", "amd64", OLD, 100);
    registry.addImage("secret", "1.0", "linux", "amd64", OLD, 100);
    registry.respond(FakeRegistry.tagsPath("secret"), 401, Map.of(), 1);

    FetchResult<RepositoryItem> result;
    try (RepositoryMetadataFetcher fetcher = fetcher(registry)) {
      result = fetcher.fetchRepositories();
    }

    assertThat(result.successes()).extracting(RepositoryItem::name).containsExactly("open");
    assertThat(result.failures()).singleElement().satisfies(it -> {
      assertThat(it.item()).isEqualTo("secret");
      assertThat(it.error()).isInstanceOf(UnauthorizedException.class);
    });
  }

  @Test
  void fetchesExplicitRepositoriesWithoutCatalog(FakeRegistry registry) throws InterruptedException {
    registry.addImage("a", "1", "linux", "amd64", OLD, 1);
    registry.addImage("b", "1", "linux", "amd64", OLD, 2);

    FetchResult<RepositoryItem> result;
    try (RepositoryMetadataFetcher fetcher = fetcher(registry)) {
      result = fetcher.fetchRepositories(List.of("b", "a"), new CancellationSignal(), ProgressListener.NONE);
    }

    assertThat(result.successes()).extracting(RepositoryItem::name).containsExactly("b", "a");
    assertThat(registry.requests()).doesNotContain("/v2/_catalog");
  }

  @Test
  void catalogFailureFailsTheWholeCall(FakeRegistry registry) {
    registry.respond("/v2/_catalog", 429, Map.of("Retry-After", "30"), 1);

    try (RepositoryMetadataFetcher fetcher = fetcher(registry)) {
      assertThatThrownBy(fetcher::fetchRepositories).isInstanceOf(RateLimitedException.class);
    }
  }

  @Test
  void emptyCatalogGivesEmptyResult(FakeRegistry registry) throws InterruptedException {
    try (RepositoryMetadataFetcher fetcher = fetcher(registry)) {
      FetchResult<RepositoryItem> result = fetcher.fetchRepositories();

      assertThat(result.successes()).isEmpty();
      assertThat(result.hasFailures()).isFalse();
    }
  }

  private RepositoryMetadataFetcher fetcher(FakeRegistry registry) {
    return new RepositoryMetadataFetcher(registry.url(), cacheDir, Optional.empty(), 4);
  }
}
