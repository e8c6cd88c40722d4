package de.ialistannen.rex.search;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RegistrySearchTest {

  private static final List<String> REPOSITORIES = List.of("alpine", "ubuntu", "team/alpaca");
  private static final Map<String, List<String>> TAGS = Map.of(
    "alpine", List.of("latest", "3.19", "edge"),
    "ubuntu", List.of("latest", "22.04"),
    "team/alpaca", List.of("v1", "latest-dev")
  );

  @Test
  void searchesRepositoriesWithSmartCase() {
    assertThat(RegistrySearch.searchRepositories("ALP", REPOSITORIES)).isEmpty();
    assertThat(RegistrySearch.searchRepositories("alp", REPOSITORIES))
      .extracting(SearchResult::value)
      .containsExactly("alpine", "team/alpaca");
  }

  @Test
  void searchesTags() {
    assertThat(RegistrySearch.searchTags("lat", List.of("3.19", "stable", "latest")))
      .extracting(SearchResult::value)
      .containsExactly("latest");
  }

  @Test
  void queryWithoutColonYieldsAllTagsOfMatchingRepositories() {
    List<ImageSearchResult> results = RegistrySearch.searchImages("ubu", REPOSITORIES, TAGS);

    assertThat(results).extracting(ImageSearchResult::reference).containsExactly("ubuntu:22.04", "ubuntu:latest");
    assertThat(results).extracting(ImageSearchResult::score).containsOnly(results.get(0).score());
  }

  @Test
  void queryWithColonMatchesRepositoryAndTag() {
    List<ImageSearchResult> results = RegistrySearch.searchImages("alp:lat", REPOSITORIES, TAGS);

    assertThat(results)
      .extracting(ImageSearchResult::reference)
      .containsExactly("alpine:latest", "team/alpaca:latest-dev");

    int alpineScore = RegistrySearch.searchRepositories("alp", List.of("alpine")).get(0).score();
    int latestScore = RegistrySearch.searchTags("lat", List.of("latest")).get(0).score();
    assertThat(results.get(0).score()).isEqualTo((alpineScore + latestScore) / 2);
  }

  @Test
  void emptyTagQueryMatchesEveryTag() {
    List<ImageSearchResult> results = RegistrySearch.searchImages("ubuntu:", REPOSITORIES, TAGS);

    assertThat(results).extracting(ImageSearchResult::tag).containsExactlyInAnyOrder("latest", "22.04");
  }

  @Test
  void repositoriesWithoutTagsContributeNothing() {
    List<ImageSearchResult> results = RegistrySearch.searchImages("alp", REPOSITORIES, Map.of());

    assertThat(results).isEmpty();
  }

  @Test
  void splitsRepositoryPart() {
    assertThat(RegistrySearch.repositoryPart("alp:lat")).isEqualTo("alp");
    assertThat(RegistrySearch.repositoryPart("alp")).isEqualTo("alp");
  }
}
