package de.ialistannen.rex.oci;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageManifest(
  int schemaVersion,
  String mediaType,
  Descriptor config,
  List<Descriptor> layers
) implements ManifestDocument {

  public ImageManifest {
    layers = layers == null ? List.of() : List.copyOf(layers);
  }

  ImageManifest withMediaType(String mediaType) {
    return new ImageManifest(schemaVersion, mediaType, config, layers);
  }

  @Override
  public long totalSize() {
    return layers.stream().mapToLong(Descriptor::size).sum();
  }
}
