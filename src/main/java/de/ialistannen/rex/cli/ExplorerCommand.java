package de.ialistannen.rex.cli;

import de.ialistannen.rex.RegistryExplorer;
import de.ialistannen.rex.cache.CacheException;
import de.ialistannen.rex.fetch.FetchResult;
import de.ialistannen.rex.model.FetchedManifest;
import de.ialistannen.rex.model.RepositoryItem;
import de.ialistannen.rex.model.TagInfo;
import de.ialistannen.rex.oci.Digest;
import de.ialistannen.rex.oci.ImageManifest;
import de.ialistannen.rex.oci.Platform;
import de.ialistannen.rex.oci.Reference;
import de.ialistannen.rex.oci.ValidationException;
import de.ialistannen.rex.registry.RegistryException;
import de.ialistannen.rex.search.ImageSearchResult;
import de.ialistannen.rex.search.SearchResult;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The things the command line can do. Every method returns the process exit code: 0 if everything was fetched,
 * 1 if anything failed.
 */
public class ExplorerCommand {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExplorerCommand.class);

  private final RegistryExplorer explorer;
  private final OutputRenderer renderer;

  public ExplorerCommand(RegistryExplorer explorer, OutputRenderer renderer) {
    this.explorer = explorer;
    this.renderer = renderer;
  }

  public int listRepositories() throws InterruptedException {
    FetchResult<RepositoryItem> result;
    try {
      result = explorer.fetchRepositories();
    } catch (RegistryException | ValidationException e) {
      LOGGER.debug("Listing repositories failed", e);
      renderer.error("Could not list repositories: " + e.getMessage());
      return 1;
    }

    renderer.repositories(result.successes());
    renderer.failures(result.failures());
    return result.hasFailures() ? 1 : 0;
  }

  public int listTags(String repository) throws InterruptedException {
    FetchResult<TagInfo> result;
    try {
      result = explorer.fetchTags(repository);
    } catch (RegistryException | ValidationException e) {
      LOGGER.debug("Listing tags of '{}' failed", repository, e);
      renderer.error("Could not list tags of '" + repository + "': " + e.getMessage());
      return 1;
    }

    renderer.tags(result.successes());
    renderer.failures(result.failures());
    return result.hasFailures() ? 1 : 0;
  }

  public int inspect(String reference, Optional<String> platform) throws InterruptedException {
    try {
      Reference parsed = Reference.parse(reference);
      Optional<Platform> wantedPlatform = platform.map(Platform::parse);
      warnOnForeignRegistry(parsed);

      FetchedManifest manifest = explorer.fetchManifest(parsed, wantedPlatform);
      Optional<byte[]> config = Optional.empty();
      if (manifest.document() instanceof ImageManifest image) {
        String repository = explorer.repositoryOf(parsed);
        Digest configDigest = image.config().digest();
        byte[] raw = explorer.fetchConfig(repository, configDigest);
        // Served from the cache, fails if the blob is no image config
        explorer.fetchImageConfiguration(repository, configDigest);
        config = Optional.of(raw);
      }

      renderer.manifest(parsed, manifest, config);
      return 0;
    } catch (RegistryException | ValidationException | CacheException e) {
      LOGGER.debug("Inspecting '{}' failed", reference, e);
      renderer.error("Could not inspect '" + reference + "': " + e.getMessage());
      return 1;
    }
  }

  /**
   * Searches repositories and images, or only the tags of one repository.
   *
   * @param query the query
   * @param repository restricts the search to the tags of this repository
   * @param limit the maximum number of results per section
   * @return the exit code
   * @throws InterruptedException ?
   */
  public int search(String query, Optional<String> repository, Optional<Integer> limit) throws InterruptedException {
    if (limit.isPresent() && limit.get() < 0) {
      renderer.error("Limit must not be negative, got " + limit.get());
      return 1;
    }
    try {
      if (repository.isPresent()) {
        List<SearchResult> tags = explorer.searchTags(repository.get(), query);
        renderer.tagSearch(query, repository.get(), truncate(tags, limit));
        return 0;
      }
      List<SearchResult> repositories = explorer.searchRepositories(query);
      List<ImageSearchResult> images = explorer.searchImages(query);
      renderer.search(query, truncate(repositories, limit), truncate(images, limit));
      return 0;
    } catch (RegistryException | ValidationException e) {
      LOGGER.debug("Searching for '{}' failed", query, e);
      renderer.error("Could not search for '" + query + "': " + e.getMessage());
      return 1;
    }
  }

  private static <T> List<T> truncate(List<T> values, Optional<Integer> limit) {
    if (limit.isEmpty() || values.size() <= limit.get()) {
      return values;
    }
    return values.subList(0, limit.get());
  }

  private void warnOnForeignRegistry(Reference reference) {
    if (reference.registry().equals(Reference.DEFAULT_REGISTRY)) {
      return;
    }
    if (!reference.registry().equalsIgnoreCase(explorer.registryHost())) {
      LOGGER.warn(
        "Reference names registry '{}', but '{}' is queried. Only the repository path is used.",
        reference.registry(),
        explorer.registryHost()
      );
    }
  }
}
