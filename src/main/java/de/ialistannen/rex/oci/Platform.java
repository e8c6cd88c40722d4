package de.ialistannen.rex.oci;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Optional;

/**
 * The platform an image runs on.
 *
 * @param os the operating system, e.g. {@code linux}
 * @param architecture the cpu architecture, e.g. {@code arm64}
 * @param variant the cpu variant, e.g. {@code v8}. May be null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(Include.NON_NULL)
public record Platform(String os, String architecture, String variant) {

  /**
   * Parses a platform in {@code os/arch[/variant]} notation.
   *
   * @param value the platform string
   * @return the platform
   * @throws ValidationException if the string has the wrong shape
   */
  public static Platform parse(String value) {
    String[] parts = value.split("/", -1);
    if (parts.length < 2 || parts.length > 3) {
      throw new ValidationException("Platform '" + value + "' must look like 'os/arch[/variant]'");
    }
    for (String part : parts) {
      if (part.isBlank()) {
        throw new ValidationException("Platform '" + value + "' contains an empty component");
      }
    }
    return new Platform(parts[0], parts[1], parts.length == 3 ? parts[2] : null);
  }

  public Optional<String> variantIfPresent() {
    return Optional.ofNullable(variant);
  }

  /**
   * Checks whether a concrete platform satisfies this one. A missing variant on this platform matches any variant.
   *
   * @param other the platform to test
   * @return true if the other platform satisfies this one
   */
  public boolean matches(Platform other) {
    if (other == null) {
      return false;
    }
    if (!os.equals(other.os()) || !architecture.equals(other.architecture())) {
      return false;
    }
    return variant == null || variant.equals(other.variant());
  }

  @Override
  public String toString() {
    if (variant == null) {
      return os + "/" + architecture;
    }
    return os + "/" + architecture + "/" + variant;
  }
}
