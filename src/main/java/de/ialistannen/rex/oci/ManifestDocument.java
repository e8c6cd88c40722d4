package de.ialistannen.rex.oci;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Optional;

/**
 * A manifest fetched from a registry, either for a single image or a multi-platform index.
 */
public sealed interface ManifestDocument permits ImageManifest, ImageIndex {

  /**
   * @return the media type. Falls back to the content type the registry served, if the document omits it.
   */
  String mediaType();

  /**
   * @return the summed size of all layers for an image or of all child manifests for an index
   */
  long totalSize();

  /**
   * Decodes a manifest or index. The kind is decided by the embedded media type, then the content type of the
   * response and finally the document shape.
   *
   * @param objectMapper the mapper to use
   * @param body the raw document
   * @param contentType the content type the registry served, if any
   * @return the decoded document
   * @throws IOException if the body is not a manifest we understand
   */
  static ManifestDocument parse(ObjectMapper objectMapper, byte[] body, Optional<String> contentType)
    throws IOException {
    JsonNode root = objectMapper.readTree(body);
    if (root == null || !root.isObject()) {
      throw new IOException("Manifest is not a json object");
    }

    String mediaType = Optional.ofNullable(root.get("mediaType"))
      .map(JsonNode::asText)
      .or(() -> contentType.map(it -> it.split(";")[0].trim()))
      .orElse("");

    boolean index;
    if (MediaTypes.isIndex(mediaType)) {
      index = true;
    } else if (MediaTypes.isManifest(mediaType)) {
      index = false;
    } else if (root.has("manifests")) {
      index = true;
    } else if (root.has("config") && root.has("layers")) {
      index = false;
    } else {
      throw new IOException("Unsupported manifest type '" + mediaType + "'");
    }

    if (index) {
      ImageIndex document = objectMapper.treeToValue(root, ImageIndex.class);
      return document.withMediaType(mediaType);
    }
    ImageManifest document = objectMapper.treeToValue(root, ImageManifest.class);
    if (document.config() == null) {
      throw new IOException("Image manifest has no config descriptor");
    }
    return document.withMediaType(mediaType);
  }
}
