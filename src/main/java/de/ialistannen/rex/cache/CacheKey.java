package de.ialistannen.rex.cache;

import de.ialistannen.rex.oci.Digest;
import java.util.Optional;

/**
 * Identifies a cache entry.
 *
 * @param value the key string. The digest for content entries, a registry and repository derived path otherwise.
 * @param kind the kind of entry
 */
public record CacheKey(String value, CacheKind kind) {

  public static CacheKey content(CacheKind kind, Digest digest) {
    if (!kind.isContentAddressed()) {
      throw new IllegalArgumentException(kind + " entries are not content addressed");
    }
    return new CacheKey(digest.toString(), kind);
  }

  public static CacheKey catalog(String registry) {
    return new CacheKey(registry + "/_catalog", CacheKind.CATALOG);
  }

  public static CacheKey tagList(String registry, String repository) {
    return new CacheKey(registry + "/" + repository + "/_tags", CacheKind.TAG_LIST);
  }

  public static CacheKey tagManifest(String registry, String repository, String tag) {
    return new CacheKey(registry + "/" + repository + "/_manifests/" + tag, CacheKind.TAG_MANIFEST);
  }

  /**
   * @return the digest this key addresses, for content keys
   */
  public Optional<Digest> digest() {
    if (!kind.isContentAddressed()) {
      return Optional.empty();
    }
    return Optional.of(Digest.parse(value));
  }
}
