package de.ialistannen.rex.config;

import de.ialistannen.rex.auth.Credentials;
import de.ialistannen.rex.cache.CachePolicy;
import de.ialistannen.rex.cache.CacheStore;
import de.ialistannen.rex.fetch.RetryPolicy;
import de.ialistannen.rex.registry.HttpRegistryClient;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything needed to talk to one registry.
 *
 * @param registryUrl the registry url, normalized on construction
 * @param cacheDir the directory to cache metadata in
 * @param credentials the credentials to send, empty for anonymous access
 * @param concurrency how many registry calls may be in flight at once
 * @param cachePolicy when cached listings go stale
 * @param requestTimeout the deadline of every single registry call
 * @param retryPolicy how rate limited calls are retried
 * @param memoryCacheEntries how many entries the in-memory cache tier holds
 * @param dockerHubCompat whether the registry stores official images under {@code library/}
 */
public record ExplorerSettings(
  String registryUrl,
  Path cacheDir,
  Optional<Credentials> credentials,
  int concurrency,
  CachePolicy cachePolicy,
  Duration requestTimeout,
  RetryPolicy retryPolicy,
  long memoryCacheEntries,
  boolean dockerHubCompat
) {

  public static final int DEFAULT_CONCURRENCY = 8;
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  public ExplorerSettings {
    registryUrl = HttpRegistryClient.normalizeUrl(registryUrl);
    Objects.requireNonNull(cacheDir, "cacheDir");
    Objects.requireNonNull(credentials, "credentials");
    Objects.requireNonNull(cachePolicy, "cachePolicy");
    Objects.requireNonNull(retryPolicy, "retryPolicy");
    if (concurrency < 1) {
      throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
    }
    if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("Request timeout must be positive, got " + requestTimeout);
    }
    if (memoryCacheEntries < 0) {
      throw new IllegalArgumentException("Memory cache size must not be negative, got " + memoryCacheEntries);
    }
  }

  /**
   * @param registryUrl the registry url
   * @param cacheDir the cache directory
   * @return settings for anonymous access with default limits
   */
  public static ExplorerSettings defaults(String registryUrl, Path cacheDir) {
    return new ExplorerSettings(
      registryUrl,
      cacheDir,
      Optional.empty(),
      DEFAULT_CONCURRENCY,
      CachePolicy.defaults(),
      DEFAULT_REQUEST_TIMEOUT,
      RetryPolicy.defaults(),
      CacheStore.DEFAULT_MEMORY_ENTRIES,
      false
    );
  }

  public ExplorerSettings withCredentials(Optional<Credentials> credentials) {
    return new ExplorerSettings(
      registryUrl, cacheDir, credentials, concurrency, cachePolicy, requestTimeout, retryPolicy,
      memoryCacheEntries, dockerHubCompat
    );
  }

  public ExplorerSettings withConcurrency(int concurrency) {
    return new ExplorerSettings(
      registryUrl, cacheDir, credentials, concurrency, cachePolicy, requestTimeout, retryPolicy,
      memoryCacheEntries, dockerHubCompat
    );
  }

  public ExplorerSettings withCachePolicy(CachePolicy cachePolicy) {
    return new ExplorerSettings(
      registryUrl, cacheDir, credentials, concurrency, cachePolicy, requestTimeout, retryPolicy,
      memoryCacheEntries, dockerHubCompat
    );
  }

  public ExplorerSettings withRequestTimeout(Duration requestTimeout) {
    return new ExplorerSettings(
      registryUrl, cacheDir, credentials, concurrency, cachePolicy, requestTimeout, retryPolicy,
      memoryCacheEntries, dockerHubCompat
    );
  }

  public ExplorerSettings withRetryPolicy(RetryPolicy retryPolicy) {
    return new ExplorerSettings(
      registryUrl, cacheDir, credentials, concurrency, cachePolicy, requestTimeout, retryPolicy,
      memoryCacheEntries, dockerHubCompat
    );
  }

  public ExplorerSettings withDockerHubCompat(boolean dockerHubCompat) {
    return new ExplorerSettings(
      registryUrl, cacheDir, credentials, concurrency, cachePolicy, requestTimeout, retryPolicy,
      memoryCacheEntries, dockerHubCompat
    );
  }
}
