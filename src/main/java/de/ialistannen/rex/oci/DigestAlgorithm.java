package de.ialistannen.rex.oci;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.util.Arrays;
import java.util.Optional;

/**
 * The content digest algorithms registries are allowed to use.
 */
public enum DigestAlgorithm {
  SHA256("sha256", 64, Hashing.sha256()),
  SHA384("sha384", 96, Hashing.sha384()),
  SHA512("sha512", 128, Hashing.sha512());

  private final String identifier;
  private final int hexLength;
  private final HashFunction hashFunction;

  DigestAlgorithm(String identifier, int hexLength, HashFunction hashFunction) {
    this.identifier = identifier;
    this.hexLength = hexLength;
    this.hashFunction = hashFunction;
  }

  public String identifier() {
    return identifier;
  }

  public int hexLength() {
    return hexLength;
  }

  /**
   * @param content the content to hash
   * @return the lowercase hex encoded hash of the content
   */
  public String hash(byte[] content) {
    return hashFunction.hashBytes(content).toString();
  }

  public static Optional<DigestAlgorithm> fromIdentifier(String identifier) {
    return Arrays.stream(values())
      .filter(it -> it.identifier.equals(identifier))
      .findFirst();
  }
}
