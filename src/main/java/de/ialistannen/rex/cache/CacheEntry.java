package de.ialistannen.rex.cache;

import de.ialistannen.rex.oci.Digest;
import java.time.Instant;
import java.util.Optional;

/**
 * A single cached value.
 *
 * @param key the key
 * @param payload the cached bytes. Copied on the way in and out, callers never share the cached array.
 * @param digest the claimed digest of the payload. Always present for content entries.
 * @param fetchedAt when the payload was fetched from the registry
 */
public record CacheEntry(CacheKey key, byte[] payload, Optional<Digest> digest, Instant fetchedAt) {

  public CacheEntry {
    payload = payload.clone();
  }

  public static CacheEntry content(CacheKind kind, Digest digest, byte[] payload, Instant fetchedAt) {
    return new CacheEntry(CacheKey.content(kind, digest), payload, Optional.of(digest), fetchedAt);
  }

  public static CacheEntry listing(CacheKey key, byte[] payload, Instant fetchedAt) {
    if (key.kind().isContentAddressed()) {
      throw new IllegalArgumentException(key.kind() + " entries need a digest");
    }
    return new CacheEntry(key, payload, Optional.empty(), fetchedAt);
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  public CacheKind kind() {
    return key.kind();
  }
}
