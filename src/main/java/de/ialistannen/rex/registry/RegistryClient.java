package de.ialistannen.rex.registry;

import de.ialistannen.rex.oci.Digest;
import de.ialistannen.rex.oci.Platform;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the metadata endpoints of a distribution (v2) registry.
 * <p>
 * All methods throw subclasses of {@link RegistryException} on failure.
 */
public interface RegistryClient {

  /**
   * @return the normalized base url of the registry, without trailing slash
   */
  String registryUrl();

  /**
   * Checks that the registry speaks the v2 API and that we may access it.
   *
   * @return the announced api version
   * @throws InterruptedException ?
   */
  RegistryVersion checkVersion() throws InterruptedException;

  /**
   * Lists all repositories, following pagination until the end.
   *
   * @return the repository names in the order the registry returned them
   * @throws InterruptedException ?
   */
  List<String> listRepositories() throws InterruptedException;

  /**
   * Lists all tags of a repository, following pagination until the end.
   *
   * @param repository the repository
   * @return the tags in the order the registry returned them
   * @throws InterruptedException ?
   */
  List<String> listTags(String repository) throws InterruptedException;

  /**
   * Fetches a manifest or index.
   *
   * @param repository the repository
   * @param reference a tag or a digest
   * @return the manifest as served
   * @throws InterruptedException ?
   */
  ManifestResponse fetchManifest(String repository, String reference) throws InterruptedException;

  /**
   * Fetches a manifest and, if it is an index and a platform was given, the child manifest for that platform.
   *
   * @param repository the repository
   * @param reference a tag or a digest
   * @param platform the platform to resolve an index to
   * @return the manifest as served
   * @throws NotFoundException if the index has no manifest for the platform
   * @throws InterruptedException ?
   */
  ManifestResponse fetchManifest(String repository, String reference, Optional<Platform> platform)
    throws InterruptedException;

  /**
   * Fetches a blob and verifies it against its digest.
   *
   * @param repository the repository the blob belongs to
   * @param digest the digest of the blob
   * @return the blob content
   * @throws InterruptedException ?
   */
  byte[] fetchBlob(String repository, Digest digest) throws InterruptedException;
}
