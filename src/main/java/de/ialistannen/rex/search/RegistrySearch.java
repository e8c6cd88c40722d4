package de.ialistannen.rex.search;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Fuzzy search over repository and tag names. Case is ignored unless the query contains upper case letters.
 */
public final class RegistrySearch {

  private static final FuzzyMatcher MATCHER = new FuzzyMatcher(CaseMatching.SMART);

  private RegistrySearch() {
    throw new UnsupportedOperationException("No instantiation");
  }

  public static List<SearchResult> searchRepositories(String query, Collection<String> repositories) {
    return MATCHER.search(query, repositories);
  }

  public static List<SearchResult> searchTags(String query, Collection<String> tags) {
    return MATCHER.search(query, tags);
  }

  /**
   * Searches {@code repository:tag} pairs. A query of the form {@code repo:tag} matches both parts separately and
   * averages their scores. A query without a colon only matches repository names and yields every tag of them.
   *
   * @param query the query
   * @param repositories the repositories to search
   * @param tags the tags per repository. Repositories without an entry contribute nothing.
   * @return the matching pairs, most relevant first
   */
  public static List<ImageSearchResult> searchImages(
    String query,
    Collection<String> repositories,
    Map<String, List<String>> tags
  ) {
    int colon = query.indexOf(':');
    String repositoryQuery = repositoryPart(query);

    List<ImageSearchResult> results = new ArrayList<>();
    for (SearchResult repository : searchRepositories(repositoryQuery, repositories)) {
      List<String> repositoryTags = tags.get(repository.value());
      if (repositoryTags == null) {
        continue;
      }
      if (colon < 0) {
        for (String tag : repositoryTags) {
          results.add(new ImageSearchResult(repository.value(), tag, repository.score()));
        }
        continue;
      }
      for (SearchResult tag : searchTags(query.substring(colon + 1), repositoryTags)) {
        int combined = (repository.score() + tag.score()) / 2;
        results.add(new ImageSearchResult(repository.value(), tag.value(), combined));
      }
    }

    results.sort(ImageSearchResult.BY_RELEVANCE);
    return results;
  }

  /**
   * @param query the image query
   * @return the part of the query that is matched against repository names
   */
  public static String repositoryPart(String query) {
    int colon = query.indexOf(':');
    return colon < 0 ? query : query.substring(0, colon);
  }
}
