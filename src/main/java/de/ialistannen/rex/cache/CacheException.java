package de.ialistannen.rex.cache;

/**
 * A cache operation failed.
 */
public class CacheException extends Exception {

  private final Kind kind;

  public CacheException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public CacheException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  public enum Kind {
    /**
     * Reading or writing the disk failed.
     */
    IO_FAILURE,
    /**
     * A stored entry could not be decoded. It was removed.
     */
    CORRUPT,
    /**
     * A payload did not match the digest it claimed.
     */
    INTEGRITY
  }
}
