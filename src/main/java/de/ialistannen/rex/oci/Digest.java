package de.ialistannen.rex.oci;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A validated content digest of the form {@code <algorithm>:<hex>}.
 * <p>
 * Instances can only be obtained by parsing or by hashing content, so every digest in the system is well-formed.
 */
public final class Digest {

  private static final Pattern HEX_PATTERN = Pattern.compile("[a-f0-9]+");

  private final DigestAlgorithm algorithm;
  private final String hex;

  private Digest(DigestAlgorithm algorithm, String hex) {
    this.algorithm = algorithm;
    this.hex = hex;
  }

  /**
   * Parses and validates a digest string.
   *
   * @param value the digest, e.g. {@code sha256:<64 hex chars>}
   * @return the parsed digest
   * @throws ValidationException if the algorithm is unknown or the hex part has the wrong length or charset
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Digest parse(String value) {
    if (value == null || value.isEmpty()) {
      throw new ValidationException("Digest must not be empty");
    }
    int separator = value.indexOf(':');
    if (separator < 0 || separator != value.lastIndexOf(':')) {
      throw new ValidationException("Digest '" + value + "' must contain exactly one ':' separator");
    }

    String algorithmName = value.substring(0, separator);
    String hex = value.substring(separator + 1);

    DigestAlgorithm algorithm = DigestAlgorithm.fromIdentifier(algorithmName)
      .orElseThrow(() -> new ValidationException(
        "Unsupported digest algorithm '" + algorithmName + "' in '" + value + "'"
      ));

    if (hex.length() != algorithm.hexLength()) {
      throw new ValidationException(
        "Digest '%s' must have %d hex characters for %s, got %d".formatted(
          value, algorithm.hexLength(), algorithm.identifier(), hex.length()
        )
      );
    }
    if (!HEX_PATTERN.matcher(hex).matches()) {
      throw new ValidationException("Digest '" + value + "' must only contain lowercase hex characters");
    }

    return new Digest(algorithm, hex);
  }

  /**
   * Computes the sha256 digest of some content.
   *
   * @param content the content
   * @return its digest
   */
  public static Digest compute(byte[] content) {
    return compute(DigestAlgorithm.SHA256, content);
  }

  public static Digest compute(DigestAlgorithm algorithm, byte[] content) {
    return new Digest(algorithm, algorithm.hash(content));
  }

  /**
   * @param content the content to check
   * @return true if hashing the content with this digest's algorithm yields this digest
   */
  public boolean matches(byte[] content) {
    return algorithm.hash(content).equals(hex);
  }

  public DigestAlgorithm algorithm() {
    return algorithm;
  }

  public String hex() {
    return hex;
  }

  /**
   * @return the first twelve hex characters, the way docker abbreviates ids
   */
  public String shortHex() {
    return hex.substring(0, 12);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Digest digest = (Digest) o;
    return algorithm == digest.algorithm && hex.equals(digest.hex);
  }

  @Override
  public int hashCode() {
    return Objects.hash(algorithm, hex);
  }

  @JsonValue
  @Override
  public String toString() {
    return algorithm.identifier() + ":" + hex;
  }
}
