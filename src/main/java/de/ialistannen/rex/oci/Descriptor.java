package de.ialistannen.rex.oci;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Points to a piece of content by digest.
 *
 * @param mediaType the type of the referenced content
 * @param digest the digest of the content
 * @param size the size in bytes
 * @param platform the platform of the referenced manifest. Only present in index entries, may be null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Descriptor(String mediaType, Digest digest, long size, Platform platform) {

  public Descriptor {
    if (digest == null) {
      throw new IllegalArgumentException("Descriptor of type '" + mediaType + "' has no digest");
    }
    if (size < 0) {
      throw new IllegalArgumentException("Descriptor " + digest + " has a negative size " + size);
    }
  }
}
