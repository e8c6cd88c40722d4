package de.ialistannen.rex.model;

import de.ialistannen.rex.oci.Digest;
import de.ialistannen.rex.oci.ManifestDocument;

/**
 * A verified manifest.
 *
 * @param digest the digest of the raw bytes
 * @param document the decoded manifest or index
 * @param raw the bytes exactly as the registry served them
 */
public record FetchedManifest(Digest digest, ManifestDocument document, byte[] raw) {

}
