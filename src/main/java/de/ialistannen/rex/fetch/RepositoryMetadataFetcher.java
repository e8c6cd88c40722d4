package de.ialistannen.rex.fetch;

import de.ialistannen.rex.auth.Credentials;
import de.ialistannen.rex.cache.CacheException;
import de.ialistannen.rex.config.ExplorerSettings;
import de.ialistannen.rex.model.FetchedManifest;
import de.ialistannen.rex.model.RepositoryItem;
import de.ialistannen.rex.oci.ImageIndex;
import de.ialistannen.rex.oci.ImageManifest;
import de.ialistannen.rex.oci.Reference;
import de.ialistannen.rex.registry.NotFoundException;
import de.ialistannen.rex.registry.ProtocolException;
import de.ialistannen.rex.registry.RegistryException;
import de.ialistannen.rex.registry.TransportException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches an overview of repositories, in parallel.
 */
public class RepositoryMetadataFetcher implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(RepositoryMetadataFetcher.class);

  private final MetadataResolver resolver;
  private final FetchPool pool;

  public RepositoryMetadataFetcher(
    String registryUrl,
    Path cacheDir,
    Optional<Credentials> credentials,
    int concurrency
  ) {
    this(
      ExplorerSettings.defaults(registryUrl, cacheDir)
        .withCredentials(credentials)
        .withConcurrency(concurrency)
    );
  }

  public RepositoryMetadataFetcher(ExplorerSettings settings) {
    this(MetadataResolver.create(settings), new FetchPool(settings.concurrency(), settings.retryPolicy()));
  }

  public RepositoryMetadataFetcher(MetadataResolver resolver, FetchPool pool) {
    this.resolver = resolver;
    this.pool = pool;
  }

  /**
   * Lists the catalog of the registry and fetches an overview of every repository in it.
   *
   * @return the repositories in catalog order, and the ones that failed
   * @throws RegistryException if the catalog itself could not be fetched
   * @throws InterruptedException ?
   */
  public FetchResult<RepositoryItem> fetchRepositories() throws InterruptedException {
    return fetchRepositories(new CancellationSignal(), ProgressListener.NONE);
  }

  /**
   * Lists the catalog of the registry and fetches an overview of every repository in it.
   *
   * @param cancellation stops repositories that have not been started yet
   * @param progress notified after every repository
   * @return the repositories in catalog order, and the ones that failed
   * @throws RegistryException if the catalog itself could not be fetched
   * @throws InterruptedException ?
   */
  public FetchResult<RepositoryItem> fetchRepositories(CancellationSignal cancellation, ProgressListener progress)
    throws InterruptedException {
    return fetchRepositories(resolver.repositories(), cancellation, progress);
  }

  /**
   * Fetches an overview of the given repositories, for registries that do not offer a catalog.
   *
   * @param repositories the repositories
   * @param cancellation stops repositories that have not been started yet
   * @param progress notified after every repository
   * @return the repositories in input order, and the ones that failed
   * @throws InterruptedException ?
   */
  public FetchResult<RepositoryItem> fetchRepositories(
    List<String> repositories,
    CancellationSignal cancellation,
    ProgressListener progress
  ) throws InterruptedException {
    if (repositories.isEmpty()) {
      return FetchResult.empty();
    }

    List<FetchTask<String>> tasks = IntStream.range(0, repositories.size())
      .mapToObj(i -> new FetchTask<>(
        i,
        repositories.get(i),
        repositories.get(i),
        TaskKind.REPOSITORY_METADATA
      ))
      .toList();
    List<TaskOutcome<RepositoryItem>> outcomes = pool.run(tasks, this::describeRepository, cancellation, progress);

    FetchResult<RepositoryItem> result = FetchResult.collect(tasks, outcomes, Function.identity());
    LOGGER.info(
      "Fetched {} repositor(y/ies), {} failed",
      result.successes().size(),
      result.failures().size()
    );
    return result;
  }

  private RepositoryItem describeRepository(String repository) throws CacheException, InterruptedException {
    Reference.forRepository(resolver.registryHost(), repository);

    List<String> tags = resolver.tags(repository);
    if (tags.isEmpty()) {
      return new RepositoryItem(repository, Optional.of(0), Optional.empty(), Optional.empty());
    }

    // The last listed tag stands in for the newest one, the API has no better notion of recency
    String latestTag = tags.get(tags.size() - 1);
    Optional<Long> size = Optional.empty();
    Optional<Instant> lastUpdated = Optional.empty();
    try {
      FetchedManifest manifest = resolver.manifestForTag(repository, latestTag);
      size = Optional.of(manifest.document().totalSize());
      if (manifest.document() instanceof ImageManifest image) {
        lastUpdated = resolver.configuration(repository, image.config().digest()).createdAt();
      } else if (manifest.document() instanceof ImageIndex) {
        LOGGER.debug("'{}':'{}' is an index, it has no single creation date", repository, latestTag);
      }
    } catch (NotFoundException | TransportException | ProtocolException e) {
      LOGGER.warn(
        "Could not fetch details of '{}':'{}', reporting the tag count only: {}",
        repository,
        latestTag,
        e.getMessage()
      );
    }

    return new RepositoryItem(repository, Optional.of(tags.size()), size, lastUpdated);
  }

  @Override
  public void close() {
    pool.close();
  }
}
