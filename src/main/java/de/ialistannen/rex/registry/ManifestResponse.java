package de.ialistannen.rex.registry;

import de.ialistannen.rex.oci.Digest;
import java.util.Optional;

/**
 * A manifest exactly as the registry served it.
 *
 * @param body the raw bytes
 * @param digest the digest announced by the registry or, if it sent none, computed from the body
 * @param contentType the served content type
 */
public record ManifestResponse(byte[] body, Digest digest, Optional<String> contentType) {

}
