package de.ialistannen.rex.oci;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed image reference: {@code [registry/]repository[:tag][@digest]}.
 * <p>
 * References without a registry default to Docker Hub, where single component repositories live under
 * {@code library/}.
 */
public final class Reference {

  public static final String DEFAULT_REGISTRY = "docker.io";
  public static final String DEFAULT_TAG = "latest";

  private static final String LEGACY_DEFAULT_REGISTRY = "index.docker.io";
  private static final String LIBRARY_PREFIX = "library/";

  private final String registry;
  private final String repository;
  private final Optional<String> tag;
  private final Optional<Digest> digest;

  private Reference(String registry, String repository, Optional<String> tag, Optional<Digest> digest) {
    this.registry = registry;
    this.repository = repository;
    this.tag = tag;
    this.digest = digest;
  }

  /**
   * Parses a reference string.
   *
   * @param value the reference, e.g. {@code ghcr.io/owner/app:1.2@sha256:...}
   * @return the parsed reference
   * @throws ValidationException if any part violates the reference grammar
   */
  public static Reference parse(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("Reference must not be empty");
    }

    String remainder = value;
    Optional<Digest> digest = Optional.empty();
    int at = remainder.indexOf('@');
    if (at >= 0) {
      String digestPart = remainder.substring(at + 1);
      try {
        digest = Optional.of(Digest.parse(digestPart));
      } catch (ValidationException e) {
        throw new ValidationException("Invalid digest in reference '" + value + "': " + e.getMessage(), e);
      }
      remainder = remainder.substring(0, at);
    }

    Optional<String> tag = Optional.empty();
    int lastColon = remainder.lastIndexOf(':');
    if (lastColon > remainder.lastIndexOf('/')) {
      String tagPart = remainder.substring(lastColon + 1);
      validateTag(tagPart, value);
      tag = Optional.of(tagPart);
      remainder = remainder.substring(0, lastColon);
    }

    if (remainder.isEmpty()) {
      throw new ValidationException("Reference '" + value + "' has no repository name");
    }
    if (remainder.length() > ReferenceGrammar.MAX_NAME_LENGTH) {
      throw new ValidationException(
        "Repository name in '%s' is longer than %d characters".formatted(value, ReferenceGrammar.MAX_NAME_LENGTH)
      );
    }

    String registry = DEFAULT_REGISTRY;
    String repository = remainder;
    int firstSlash = remainder.indexOf('/');
    if (firstSlash > 0 && ReferenceGrammar.looksLikeDomain(remainder.substring(0, firstSlash))) {
      registry = remainder.substring(0, firstSlash);
      repository = remainder.substring(firstSlash + 1);
      validateRegistry(registry, value);
    }
    if (registry.equals(LEGACY_DEFAULT_REGISTRY)) {
      registry = DEFAULT_REGISTRY;
    }

    validateRepository(repository, value);
    if (registry.equals(DEFAULT_REGISTRY) && !repository.contains("/")) {
      repository = LIBRARY_PREFIX + repository;
    }

    return new Reference(registry, repository, tag, digest);
  }

  /**
   * Builds a tag reference for a repository name that is already known to live on the given registry. No docker hub
   * defaults are applied.
   *
   * @param registry the registry host, with an optional port
   * @param repository the repository path
   * @param tag the tag
   * @return the reference
   * @throws ValidationException if any part violates the reference grammar
   */
  public static Reference forTag(String registry, String repository, String tag) {
    String description = registry + "/" + repository + ":" + tag;
    validateRegistry(registry, description);
    validateRepository(repository, description);
    validateTag(tag, description);

    return new Reference(registry, repository, Optional.of(tag), Optional.empty());
  }

  /**
   * Builds an untagged reference for a repository known to live on the given registry.
   *
   * @param registry the registry host, with an optional port
   * @param repository the repository path
   * @return the reference
   * @throws ValidationException if any part violates the reference grammar
   */
  public static Reference forRepository(String registry, String repository) {
    String description = registry + "/" + repository;
    validateRegistry(registry, description);
    validateRepository(repository, description);

    return new Reference(registry, repository, Optional.empty(), Optional.empty());
  }

  private static void validateRegistry(String registry, String reference) {
    if (!ReferenceGrammar.DOMAIN_PATTERN.matcher(registry).matches()) {
      throw new ValidationException("Invalid registry '" + registry + "' in '" + reference + "'");
    }
  }

  private static void validateRepository(String repository, String reference) {
    if (repository.isEmpty()) {
      throw new ValidationException("Reference '" + reference + "' has no repository name");
    }
    if (repository.length() > ReferenceGrammar.MAX_NAME_LENGTH) {
      throw new ValidationException(
        "Repository name in '%s' is longer than %d characters".formatted(reference, ReferenceGrammar.MAX_NAME_LENGTH)
      );
    }
    if (!repository.equals(repository.toLowerCase(Locale.ROOT))) {
      throw new ValidationException("Repository name in '" + reference + "' must be lowercase");
    }
    for (String component : repository.split("/", -1)) {
      if (component.isEmpty()) {
        throw new ValidationException("Repository name in '" + reference + "' has an empty path component");
      }
      if (!ReferenceGrammar.PATH_COMPONENT_PATTERN.matcher(component).matches()) {
        throw new ValidationException(
          "Invalid path component '" + component + "' in repository of '" + reference + "'"
        );
      }
    }
  }

  private static void validateTag(String tag, String reference) {
    if (!ReferenceGrammar.TAG_PATTERN.matcher(tag).matches()) {
      throw new ValidationException("Invalid tag '" + tag + "' in '" + reference + "'");
    }
  }

  public String registry() {
    return registry;
  }

  /**
   * @return the full repository path, including a {@code library/} prefix for official docker hub images
   */
  public String repository() {
    return repository;
  }

  /**
   * Returns the repository path as it should be sent to a registry. Registries mirroring docker hub often store
   * official images without the {@code library/} prefix.
   *
   * @param dockerHubCompat whether to strip the implicit {@code library/} prefix
   * @return the repository path to use in requests
   */
  public String repositoryForRegistry(boolean dockerHubCompat) {
    if (!dockerHubCompat && repository.startsWith(LIBRARY_PREFIX)) {
      String rest = repository.substring(LIBRARY_PREFIX.length());
      if (!rest.contains("/")) {
        return rest;
      }
    }
    return repository;
  }

  public Optional<String> tag() {
    return tag;
  }

  public Optional<Digest> digest() {
    return digest;
  }

  /**
   * @return the digest if present, the tag otherwise, falling back to {@value DEFAULT_TAG}
   */
  public String manifestReference() {
    return digest.map(Digest::toString).orElseGet(() -> tag.orElse(DEFAULT_TAG));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Reference reference = (Reference) o;
    return registry.equals(reference.registry)
      && repository.equals(reference.repository)
      && tag.equals(reference.tag)
      && digest.equals(reference.digest);
  }

  @Override
  public int hashCode() {
    return Objects.hash(registry, repository, tag, digest);
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder(registry).append('/').append(repository);
    tag.ifPresent(it -> result.append(':').append(it));
    digest.ifPresent(it -> result.append('@').append(it));
    return result.toString();
  }
}
