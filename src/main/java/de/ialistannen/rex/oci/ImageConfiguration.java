package de.ialistannen.rex.oci;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * The parts of an image config blob we care about.
 *
 * @param created the RFC 3339 creation timestamp, may be null
 * @param os the operating system, may be null
 * @param architecture the architecture, may be null
 * @param variant the cpu variant, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageConfiguration(String created, String os, String architecture, String variant) {

  public Optional<Instant> createdAt() {
    if (created == null || created.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(OffsetDateTime.parse(created).toInstant());
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  public Optional<Platform> platform() {
    if (os == null || architecture == null) {
      return Optional.empty();
    }
    return Optional.of(new Platform(os, architecture, variant));
  }
}
