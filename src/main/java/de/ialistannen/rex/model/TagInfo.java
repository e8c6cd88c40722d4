package de.ialistannen.rex.model;

import de.ialistannen.rex.oci.Digest;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Metadata about a single tag.
 *
 * @param name the tag
 * @param digest the digest of the manifest the tag points to
 * @param size the size of all layers, or of all child manifests for an index
 * @param lastModified the creation time recorded in the image config
 * @param platforms the platforms the tag is available for, in {@code os/arch[/variant]} notation
 */
public record TagInfo(
  String name,
  Optional<Digest> digest,
  Optional<Long> size,
  Optional<Instant> lastModified,
  List<String> platforms
) {

  public TagInfo {
    platforms = List.copyOf(platforms);
  }
}
