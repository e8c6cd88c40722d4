package de.ialistannen.rex.search;

import java.util.Comparator;

/**
 * A matched {@code repository:tag} pair.
 *
 * @param repository the repository
 * @param tag the tag
 * @param score the relevance, higher is better
 */
public record ImageSearchResult(String repository, String tag, int score) {

  public static final Comparator<ImageSearchResult> BY_RELEVANCE = Comparator
    .comparingInt(ImageSearchResult::score)
    .reversed()
    .thenComparing(ImageSearchResult::reference);

  public String reference() {
    return repository + ":" + tag;
  }
}
