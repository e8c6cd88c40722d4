package de.ialistannen.rex.cache;

/**
 * What a cache entry holds. Content kinds are addressed by their digest and never change, listing kinds are addressed
 * by registry and repository and go stale.
 */
public enum CacheKind {
  CATALOG(false),
  TAG_LIST(false),
  /**
   * The digest a tag pointed to when it was last resolved.
   */
  TAG_MANIFEST(false),
  MANIFEST(true),
  CONFIG(true);

  private final boolean contentAddressed;

  CacheKind(boolean contentAddressed) {
    this.contentAddressed = contentAddressed;
  }

  public boolean isContentAddressed() {
    return contentAddressed;
  }
}
