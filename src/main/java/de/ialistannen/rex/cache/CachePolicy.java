package de.ialistannen.rex.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * How long listing entries stay fresh. Content entries never go stale.
 *
 * @param catalog staleness threshold for repository listings
 * @param tagList staleness threshold for tag listings
 * @param tagManifest staleness threshold for tag to manifest resolutions
 */
public record CachePolicy(Duration catalog, Duration tagList, Duration tagManifest) {

  public CachePolicy {
    requireNonNegative(catalog, "catalog");
    requireNonNegative(tagList, "tagList");
    requireNonNegative(tagManifest, "tagManifest");
  }

  public static CachePolicy defaults() {
    return new CachePolicy(Duration.ofHours(1), Duration.ofMinutes(30), Duration.ofDays(1));
  }

  /**
   * @param threshold the staleness threshold for every listing kind
   * @return a policy using the same threshold everywhere
   */
  public static CachePolicy uniform(Duration threshold) {
    return new CachePolicy(threshold, threshold, threshold);
  }

  /**
   * @param kind the kind of entry
   * @return the maximum age for entries of that kind, or empty if they never go stale
   */
  public Optional<Duration> stalenessThreshold(CacheKind kind) {
    return switch (kind) {
      case CATALOG -> Optional.of(catalog);
      case TAG_LIST -> Optional.of(tagList);
      case TAG_MANIFEST -> Optional.of(tagManifest);
      case MANIFEST, CONFIG -> Optional.empty();
    };
  }

  private static void requireNonNegative(Duration duration, String name) {
    if (duration == null || duration.isNegative()) {
      throw new IllegalArgumentException(name + " threshold must be a non-negative duration, got " + duration);
    }
  }
}
