package de.ialistannen.rex;

import de.ialistannen.rex.cache.CacheException;
import de.ialistannen.rex.cache.CacheStore;
import de.ialistannen.rex.config.ExplorerSettings;
import de.ialistannen.rex.fetch.CancellationSignal;
import de.ialistannen.rex.fetch.FetchPool;
import de.ialistannen.rex.fetch.FetchResult;
import de.ialistannen.rex.fetch.FetchTask;
import de.ialistannen.rex.fetch.MetadataResolver;
import de.ialistannen.rex.fetch.ProgressListener;
import de.ialistannen.rex.fetch.RepositoryMetadataFetcher;
import de.ialistannen.rex.fetch.TagMetadataFetcher;
import de.ialistannen.rex.fetch.TaskKind;
import de.ialistannen.rex.fetch.TaskOutcome;
import de.ialistannen.rex.fetch.TaskOutcome.Failed;
import de.ialistannen.rex.fetch.TaskOutcome.Succeeded;
import de.ialistannen.rex.model.FetchedManifest;
import de.ialistannen.rex.model.RepositoryItem;
import de.ialistannen.rex.model.TagInfo;
import de.ialistannen.rex.oci.Digest;
import de.ialistannen.rex.oci.ImageConfiguration;
import de.ialistannen.rex.oci.Platform;
import de.ialistannen.rex.oci.Reference;
import de.ialistannen.rex.registry.RegistryVersion;
import de.ialistannen.rex.search.ImageSearchResult;
import de.ialistannen.rex.search.RegistrySearch;
import de.ialistannen.rex.search.SearchResult;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The entry point for exploring a single registry. Tag and repository batches share one worker pool and one cache.
 */
public class RegistryExplorer implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(RegistryExplorer.class);

  private final MetadataResolver resolver;
  private final FetchPool pool;
  private final TagMetadataFetcher tagFetcher;
  private final RepositoryMetadataFetcher repositoryFetcher;

  public RegistryExplorer(ExplorerSettings settings) {
    this(MetadataResolver.create(settings), new FetchPool(settings.concurrency(), settings.retryPolicy()));
  }

  public RegistryExplorer(MetadataResolver resolver, FetchPool pool) {
    this.resolver = resolver;
    this.pool = pool;
    this.tagFetcher = new TagMetadataFetcher(resolver, pool);
    this.repositoryFetcher = new RepositoryMetadataFetcher(resolver, pool);
  }

  /**
   * @return the api version the registry announced
   * @throws InterruptedException ?
   */
  public RegistryVersion checkVersion() throws InterruptedException {
    return resolver.checkVersion();
  }

  public FetchResult<TagInfo> fetchTags(String repository) throws InterruptedException {
    return tagFetcher.fetchTags(repository);
  }

  public FetchResult<TagInfo> fetchTags(String repository, CancellationSignal cancellation, ProgressListener progress)
    throws InterruptedException {
    return tagFetcher.fetchTags(repository, cancellation, progress);
  }

  public FetchResult<RepositoryItem> fetchRepositories() throws InterruptedException {
    return repositoryFetcher.fetchRepositories();
  }

  public FetchResult<RepositoryItem> fetchRepositories(CancellationSignal cancellation, ProgressListener progress)
    throws InterruptedException {
    return repositoryFetcher.fetchRepositories(cancellation, progress);
  }

  /**
   * Fetches the manifest a reference points to.
   *
   * @param reference the reference
   * @param platform resolves an index to the manifest for this platform
   * @return the verified manifest
   * @throws CacheException if a payload failed its integrity check
   * @throws InterruptedException ?
   */
  public FetchedManifest fetchManifest(Reference reference, Optional<Platform> platform)
    throws CacheException, InterruptedException {
    return resolver.manifest(reference, platform);
  }

  /**
   * Fetches a config blob. The registry needs to know the repository it belongs to.
   *
   * @param repository the repository
   * @param digest the digest of the config
   * @return the verified config bytes
   * @throws CacheException if a payload failed its integrity check
   * @throws InterruptedException ?
   */
  public byte[] fetchConfig(String repository, Digest digest) throws CacheException, InterruptedException {
    return resolver.config(repository, digest);
  }

  public ImageConfiguration fetchImageConfiguration(String repository, Digest digest)
    throws CacheException, InterruptedException {
    return resolver.configuration(repository, digest);
  }

  /**
   * Fuzzy searches the repository names of the (cached) catalog.
   *
   * @param query the query
   * @return the matching repositories, most relevant first
   * @throws InterruptedException ?
   */
  public List<SearchResult> searchRepositories(String query) throws InterruptedException {
    return RegistrySearch.searchRepositories(query, resolver.repositories());
  }

  /**
   * Fuzzy searches the (cached) tag list of one repository.
   *
   * @param repository the repository
   * @param query the query
   * @return the matching tags, most relevant first
   * @throws InterruptedException ?
   */
  public List<SearchResult> searchTags(String repository, String query) throws InterruptedException {
    return RegistrySearch.searchTags(query, resolver.tags(repository));
  }

  /**
   * Fuzzy searches {@code repository:tag} pairs, see {@link RegistrySearch#searchImages}. Only the tag lists of
   * repositories matching the repository part of the query are fetched. Repositories whose tags can not be listed are
   * left out.
   *
   * @param query the query, e.g. {@code alp} or {@code alp:lat}
   * @return the matching images, most relevant first
   * @throws InterruptedException ?
   */
  public List<ImageSearchResult> searchImages(String query) throws InterruptedException {
    List<String> candidates = RegistrySearch
      .searchRepositories(RegistrySearch.repositoryPart(query), resolver.repositories())
      .stream()
      .map(SearchResult::value)
      .toList();

    List<FetchTask<String>> tasks = IntStream.range(0, candidates.size())
      .mapToObj(i -> new FetchTask<>(i, candidates.get(i), candidates.get(i), TaskKind.TAG_LIST))
      .toList();
    List<TaskOutcome<List<String>>> outcomes = pool.run(
      tasks,
      resolver::tags,
      new CancellationSignal(),
      ProgressListener.NONE
    );

    Map<String, List<String>> tags = new HashMap<>();
    for (FetchTask<String> task : tasks) {
      TaskOutcome<List<String>> outcome = outcomes.get(task.position());
      if (outcome instanceof Succeeded<List<String>> succeeded) {
        tags.put(task.target(), succeeded.value());
      } else if (outcome instanceof Failed<List<String>> failed) {
        LOGGER.info("Leaving '{}' out of the search: {}", task.target(), failed.error().getMessage());
      }
    }

    return RegistrySearch.searchImages(query, candidates, tags);
  }

  /**
   * @return the host and port of the registry this explorer talks to
   */
  public String registryHost() {
    return resolver.registryHost();
  }

  /**
   * @return the repository path to use for a reference on this registry
   */
  public String repositoryOf(Reference reference) {
    return reference.repositoryForRegistry(resolver.dockerHubCompat());
  }

  public CacheStore cache() {
    return resolver.cache();
  }

  @Override
  public void close() {
    pool.close();
  }
}
