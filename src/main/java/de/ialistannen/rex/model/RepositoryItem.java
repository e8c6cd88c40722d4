package de.ialistannen.rex.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Metadata about a repository.
 *
 * @param name the repository name
 * @param tagCount how many tags it has
 * @param totalSize the size of its most recently listed tag
 * @param lastUpdated the creation time of its most recently listed tag
 */
public record RepositoryItem(
  String name,
  Optional<Integer> tagCount,
  Optional<Long> totalSize,
  Optional<Instant> lastUpdated
) {

}
