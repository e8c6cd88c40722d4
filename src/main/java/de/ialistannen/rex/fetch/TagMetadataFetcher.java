package de.ialistannen.rex.fetch;

import de.ialistannen.rex.auth.Credentials;
import de.ialistannen.rex.cache.CacheException;
import de.ialistannen.rex.config.ExplorerSettings;
import de.ialistannen.rex.model.FetchedManifest;
import de.ialistannen.rex.model.TagInfo;
import de.ialistannen.rex.oci.ImageConfiguration;
import de.ialistannen.rex.oci.ImageIndex;
import de.ialistannen.rex.oci.ImageManifest;
import de.ialistannen.rex.oci.Reference;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches metadata for every tag of a repository, in parallel.
 */
public class TagMetadataFetcher implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(TagMetadataFetcher.class);

  private final MetadataResolver resolver;
  private final FetchPool pool;

  public TagMetadataFetcher(
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

  public TagMetadataFetcher(ExplorerSettings settings) {
    this(MetadataResolver.create(settings), new FetchPool(settings.concurrency(), settings.retryPolicy()));
  }

  public TagMetadataFetcher(MetadataResolver resolver, FetchPool pool) {
    this.resolver = resolver;
    this.pool = pool;
  }

  /**
   * Fetches metadata for all tags of a repository.
   *
   * @param repository the repository
   * @return the tags in listing order, and the tags that failed
   * @throws de.ialistannen.rex.oci.ValidationException if the repository name is invalid
   * @throws de.ialistannen.rex.registry.RegistryException if the tag list itself could not be fetched
   * @throws InterruptedException ?
   */
  public FetchResult<TagInfo> fetchTags(String repository) throws InterruptedException {
    return fetchTags(repository, new CancellationSignal(), ProgressListener.NONE);
  }

  /**
   * Fetches metadata for all tags of a repository.
   *
   * @param repository the repository
   * @param cancellation stops tags that have not been started yet
   * @param progress notified after every tag
   * @return the tags in listing order, and the tags that failed
   * @throws de.ialistannen.rex.oci.ValidationException if the repository name is invalid
   * @throws de.ialistannen.rex.registry.RegistryException if the tag list itself could not be fetched
   * @throws InterruptedException ?
   */
  public FetchResult<TagInfo> fetchTags(
    String repository,
    CancellationSignal cancellation,
    ProgressListener progress
  ) throws InterruptedException {
    Reference.forRepository(resolver.registryHost(), repository);

    List<String> tags = resolver.tags(repository);
    if (tags.isEmpty()) {
      LOGGER.info("Repository '{}' has no tags", repository);
      return FetchResult.empty();
    }

    List<FetchTask<String>> tasks = IntStream.range(0, tags.size())
      .mapToObj(i -> new FetchTask<>(i, tags.get(i), repository, TaskKind.TAG_METADATA))
      .toList();
    List<TaskOutcome<TagInfo>> outcomes = pool.run(
      tasks,
      tag -> describeTag(repository, tag),
      cancellation,
      progress
    );

    FetchResult<TagInfo> result = FetchResult.collect(tasks, outcomes, Function.identity());
    LOGGER.info(
      "Fetched {} tag(s) of '{}', {} failed",
      result.successes().size(),
      repository,
      result.failures().size()
    );
    return result;
  }

  private TagInfo describeTag(String repository, String tag) throws CacheException, InterruptedException {
    Reference.forTag(resolver.registryHost(), repository, tag);
    FetchedManifest manifest = resolver.manifestForTag(repository, tag);

    if (manifest.document() instanceof ImageIndex index) {
      return new TagInfo(
        tag,
        Optional.of(manifest.digest()),
        Optional.of(index.totalSize()),
        Optional.empty(),
        index.platforms()
      );
    }

    ImageManifest image = (ImageManifest) manifest.document();
    ImageConfiguration configuration = resolver.configuration(repository, image.config().digest());

    return new TagInfo(
      tag,
      Optional.of(manifest.digest()),
      Optional.of(image.totalSize()),
      configuration.createdAt(),
      configuration.platform().map(it -> List.of(it.toString())).orElse(List.of())
    );
  }

  @Override
  public void close() {
    pool.close();
  }
}
