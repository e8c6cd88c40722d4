package de.ialistannen.rex.oci;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A multi-platform index, pointing to one manifest per platform.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageIndex(int schemaVersion, String mediaType, List<Descriptor> manifests)
  implements ManifestDocument {

  public ImageIndex {
    manifests = manifests == null ? List.of() : List.copyOf(manifests);
  }

  ImageIndex withMediaType(String mediaType) {
    return new ImageIndex(schemaVersion, mediaType, manifests);
  }

  @Override
  public long totalSize() {
    return manifests.stream().mapToLong(Descriptor::size).sum();
  }

  /**
   * @return the platforms of all children, in {@code os/arch[/variant]} notation
   */
  public List<String> platforms() {
    return manifests.stream()
      .map(Descriptor::platform)
      .filter(Objects::nonNull)
      .map(Platform::toString)
      .toList();
  }

  /**
   * @param platform the wanted platform
   * @return the first child manifest matching the platform
   */
  public Optional<Descriptor> findManifest(Platform platform) {
    return manifests.stream()
      .filter(it -> platform.matches(it.platform()))
      .findFirst();
  }
}
