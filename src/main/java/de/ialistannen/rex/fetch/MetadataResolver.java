package de.ialistannen.rex.fetch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.ialistannen.rex.cache.CacheEntry;
import de.ialistannen.rex.cache.CacheException;
import de.ialistannen.rex.cache.CacheException.Kind;
import de.ialistannen.rex.cache.CacheKey;
import de.ialistannen.rex.cache.CacheKind;
import de.ialistannen.rex.cache.CacheStore;
import de.ialistannen.rex.config.ExplorerSettings;
import de.ialistannen.rex.model.FetchedManifest;
import de.ialistannen.rex.oci.Descriptor;
import de.ialistannen.rex.oci.Digest;
import de.ialistannen.rex.oci.ImageConfiguration;
import de.ialistannen.rex.oci.ImageIndex;
import de.ialistannen.rex.oci.ManifestDocument;
import de.ialistannen.rex.oci.Platform;
import de.ialistannen.rex.oci.Reference;
import de.ialistannen.rex.oci.ValidationException;
import de.ialistannen.rex.registry.HttpRegistryClient;
import de.ialistannen.rex.registry.ManifestResponse;
import de.ialistannen.rex.registry.NotFoundException;
import de.ialistannen.rex.registry.ProtocolException;
import de.ialistannen.rex.registry.RegistryClient;
import de.ialistannen.rex.registry.RegistryVersion;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Redirect;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves registry metadata cache first, fetching and writing through on a miss.
 * <p>
 * Cache read and write failures degrade to plain fetching, except for integrity violations which are rethrown.
 * Concurrent requests for the same key share a single registry call.
 */
public class MetadataResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataResolver.class);
  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
  };

  private final RegistryClient client;
  private final CacheStore cache;
  private final boolean dockerHubCompat;
  private final ObjectMapper objectMapper;
  private final SingleFlight<CacheKey> singleFlight;

  public MetadataResolver(RegistryClient client, CacheStore cache, boolean dockerHubCompat) {
    this.client = client;
    this.cache = cache;
    this.dockerHubCompat = dockerHubCompat;

    this.objectMapper = new ObjectMapper().findAndRegisterModules();
    this.singleFlight = new SingleFlight<>();
  }

  /**
   * Wires an http client and a cache store up according to the settings.
   *
   * @param settings the settings
   * @return the resolver
   */
  public static MetadataResolver create(ExplorerSettings settings) {
    HttpClient httpClient = HttpClient.newBuilder()
      .connectTimeout(settings.requestTimeout())
      .followRedirects(Redirect.NORMAL)
      .build();
    RegistryClient client = new HttpRegistryClient(
      httpClient,
      settings.registryUrl(),
      settings.credentials(),
      settings.requestTimeout()
    );
    CacheStore cache = new CacheStore(
      settings.cacheDir(),
      settings.cachePolicy(),
      settings.memoryCacheEntries(),
      Clock.systemUTC()
    );

    return new MetadataResolver(client, cache, settings.dockerHubCompat());
  }

  public RegistryClient client() {
    return client;
  }

  public CacheStore cache() {
    return cache;
  }

  public boolean dockerHubCompat() {
    return dockerHubCompat;
  }

  /**
   * @return the registry host and port, the way references name it
   */
  public String registryHost() {
    return URI.create(client.registryUrl()).getAuthority();
  }

  public RegistryVersion checkVersion() throws InterruptedException {
    return client.checkVersion();
  }

  /**
   * @return all repositories of the registry
   * @throws InterruptedException ?
   */
  public List<String> repositories() throws InterruptedException {
    return listing(CacheKey.catalog(client.registryUrl()), client::listRepositories);
  }

  /**
   * @param repository the repository
   * @return all tags of the repository
   * @throws InterruptedException ?
   */
  public List<String> tags(String repository) throws InterruptedException {
    return listing(CacheKey.tagList(client.registryUrl(), repository), () -> client.listTags(repository));
  }

  /**
   * Resolves a reference to a manifest. A digest wins over a tag. If a platform is given and the reference points to
   * an index, the matching child manifest is returned.
   *
   * @param reference the reference
   * @param platform the platform to resolve an index to
   * @return the manifest
   * @throws NotFoundException if the index has no manifest for the platform
   * @throws CacheException if a payload failed its integrity check
   * @throws InterruptedException ?
   */
  public FetchedManifest manifest(Reference reference, Optional<Platform> platform)
    throws CacheException, InterruptedException {
    String repository = reference.repositoryForRegistry(dockerHubCompat);

    FetchedManifest manifest;
    if (reference.digest().isPresent()) {
      manifest = manifest(repository, reference.digest().get());
    } else {
      manifest = manifestForTag(repository, reference.tag().orElse(Reference.DEFAULT_TAG));
    }

    if (platform.isEmpty() || !(manifest.document() instanceof ImageIndex index)) {
      return manifest;
    }
    Descriptor child = index.findManifest(platform.get())
      .orElseThrow(() -> new NotFoundException(
        "No manifest for platform " + platform.get() + " in '" + reference + "'"
      ));
    LOGGER.debug("Resolved {} of '{}' to {}", platform.get(), reference, child.digest());

    return manifest(repository, child.digest());
  }

  /**
   * Resolves the manifest a tag currently points to.
   *
   * @param repository the repository
   * @param tag the tag
   * @return the manifest
   * @throws CacheException if a payload failed its integrity check
   * @throws InterruptedException ?
   */
  public FetchedManifest manifestForTag(String repository, String tag) throws CacheException, InterruptedException {
    CacheKey pointerKey = CacheKey.tagManifest(client.registryUrl(), repository, tag);

    Optional<Digest> cachedDigest = lookup(pointerKey).flatMap(entry -> decodePointer(pointerKey, entry));
    if (cachedDigest.isPresent()) {
      return manifest(repository, cachedDigest.get());
    }

    return singleFlight.load(pointerKey, () -> {
      ManifestResponse response = client.fetchManifest(repository, tag);
      FetchedManifest manifest = toManifest(response.digest(), response.body(), response.contentType());

      store(CacheEntry.content(CacheKind.MANIFEST, response.digest(), response.body(), cache.clock().instant()));
      store(CacheEntry.listing(
        pointerKey,
        response.digest().toString().getBytes(StandardCharsets.UTF_8),
        cache.clock().instant()
      ));

      return manifest;
    });
  }

  /**
   * Fetches a manifest by digest. Manifests never change, so a cached copy is always used.
   *
   * @param repository the repository
   * @param digest the digest of the manifest
   * @return the manifest
   * @throws CacheException if a payload failed its integrity check
   * @throws InterruptedException ?
   */
  public FetchedManifest manifest(String repository, Digest digest) throws CacheException, InterruptedException {
    byte[] body = content(
      CacheKey.content(CacheKind.MANIFEST, digest),
      () -> client.fetchManifest(repository, digest.toString()).body()
    );
    return toManifest(digest, body, Optional.empty());
  }

  /**
   * Fetches a config blob by digest.
   *
   * @param repository the repository the blob belongs to
   * @param digest the digest of the blob
   * @return the raw config
   * @throws CacheException if a payload failed its integrity check
   * @throws InterruptedException ?
   */
  public byte[] config(String repository, Digest digest) throws CacheException, InterruptedException {
    return content(CacheKey.content(CacheKind.CONFIG, digest), () -> client.fetchBlob(repository, digest));
  }

  /**
   * Fetches and decodes a config blob.
   *
   * @param repository the repository the blob belongs to
   * @param digest the digest of the blob
   * @return the decoded config
   * @throws ProtocolException if the blob is not a valid image config
   * @throws CacheException if a payload failed its integrity check
   * @throws InterruptedException ?
   */
  public ImageConfiguration configuration(String repository, Digest digest)
    throws CacheException, InterruptedException {
    byte[] raw = config(repository, digest);
    try {
      return objectMapper.readValue(raw, ImageConfiguration.class);
    } catch (IOException e) {
      throw new ProtocolException("Malformed image config " + digest + " in '" + repository + "'", e);
    }
  }

  private byte[] content(CacheKey key, Fetch<byte[]> fetch) throws CacheException, InterruptedException {
    Optional<CacheEntry> cached = lookup(key);
    if (cached.isPresent()) {
      return cached.get().payload();
    }

    return singleFlight.load(key, () -> {
      Optional<CacheEntry> raced = lookup(key);
      if (raced.isPresent()) {
        return raced.get().payload();
      }

      byte[] payload = fetch.fetch();
      Digest digest = key.digest().orElseThrow();
      store(CacheEntry.content(key.kind(), digest, payload, cache.clock().instant()));
      return payload;
    });
  }

  private List<String> listing(CacheKey key, Fetch<List<String>> fetch) throws InterruptedException {
    Optional<List<String>> cached = lookupListing(key);
    if (cached.isPresent()) {
      LOGGER.debug("Cache hit for '{}'", key.value());
      return cached.get();
    }

    try {
      return singleFlight.load(key, () -> {
        List<String> values = fetch.fetch();
        try {
          store(CacheEntry.listing(key, objectMapper.writeValueAsBytes(values), cache.clock().instant()));
        } catch (IOException e) {
          LOGGER.warn("Could not encode listing '{}' for the cache", key.value(), e);
        }
        return values;
      });
    } catch (CacheException e) {
      // Listings carry no digest, so the store never reports integrity problems for them
      throw new IllegalStateException("Unexpected cache failure for listing '" + key.value() + "'", e);
    }
  }

  private Optional<List<String>> lookupListing(CacheKey key) {
    Optional<CacheEntry> entry;
    try {
      entry = lookup(key);
    } catch (CacheException e) {
      LOGGER.warn("Ignoring cached listing '{}': {}", key.value(), e.getMessage());
      return Optional.empty();
    }
    if (entry.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(entry.get().payload(), STRING_LIST));
    } catch (IOException e) {
      LOGGER.warn("Cached listing '{}' is not a list of strings, dropping it", key.value());
      invalidateQuietly(key);
      return Optional.empty();
    }
  }

  private Optional<Digest> decodePointer(CacheKey key, CacheEntry entry) {
    try {
      return Optional.of(Digest.parse(new String(entry.payload(), StandardCharsets.UTF_8)));
    } catch (ValidationException e) {
      LOGGER.warn("Cached tag pointer '{}' holds no valid digest, dropping it", key.value());
      invalidateQuietly(key);
      return Optional.empty();
    }
  }

  private FetchedManifest toManifest(Digest digest, byte[] body, Optional<String> contentType) {
    try {
      return new FetchedManifest(digest, ManifestDocument.parse(objectMapper, body, contentType), body);
    } catch (IOException e) {
      throw new ProtocolException("Malformed manifest " + digest, e);
    }
  }

  private Optional<CacheEntry> lookup(CacheKey key) throws CacheException {
    try {
      return cache.get(key);
    } catch (CacheException e) {
      if (e.kind() == Kind.INTEGRITY) {
        throw e;
      }
      LOGGER.warn("Cache read for '{}' failed, treating it as a miss: {}", key.value(), e.getMessage());
      return Optional.empty();
    }
  }

  private void store(CacheEntry entry) throws CacheException {
    try {
      cache.put(entry);
    } catch (CacheException e) {
      if (e.kind() == Kind.INTEGRITY) {
        throw e;
      }
      LOGGER.warn("Cache write for '{}' failed, continuing without: {}", entry.key().value(), e.getMessage());
    }
  }

  private void invalidateQuietly(CacheKey key) {
    try {
      cache.invalidate(key);
    } catch (CacheException e) {
      LOGGER.warn("Could not drop cache entry '{}'", key.value(), e);
    }
  }

  @FunctionalInterface
  private interface Fetch<T> {

    T fetch() throws InterruptedException;
  }
}
