package de.ialistannen.rex.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.rex.fetch.FetchFailure;
import de.ialistannen.rex.model.FetchedManifest;
import de.ialistannen.rex.model.RepositoryItem;
import de.ialistannen.rex.model.TagInfo;
import de.ialistannen.rex.oci.ImageConfiguration;
import de.ialistannen.rex.oci.ImageIndex;
import de.ialistannen.rex.oci.ImageManifest;
import de.ialistannen.rex.oci.Reference;
import de.ialistannen.rex.search.ImageSearchResult;
import de.ialistannen.rex.search.SearchResult;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Prints results as a plain table or as json. Results go to the output stream, failures to the error stream.
 */
public class OutputRenderer {

  private static final String MISSING = "-";
  private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB"};

  private final PrintStream out;
  private final PrintStream err;
  private final boolean json;
  private final ObjectMapper objectMapper;

  public OutputRenderer(PrintStream out, PrintStream err, boolean json) {
    this.out = out;
    this.err = err;
    this.json = json;

    this.objectMapper = new ObjectMapper()
      .findAndRegisterModules()
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .enable(SerializationFeature.INDENT_OUTPUT);
  }

  public void tags(List<TagInfo> tags) {
    if (json) {
      printJson(tags);
      return;
    }
    List<List<String>> rows = new ArrayList<>();
    for (TagInfo tag : tags) {
      rows.add(List.of(
        tag.name(),
        tag.digest().map(it -> it.algorithm().identifier() + ":" + it.shortHex()).orElse(MISSING),
        tag.size().map(OutputRenderer::formatBytes).orElse(MISSING),
        tag.lastModified().map(Instant::toString).orElse(MISSING),
        tag.platforms().isEmpty() ? MISSING : String.join(", ", tag.platforms())
      ));
    }
    printTable(List.of("TAG", "DIGEST", "SIZE", "CREATED", "PLATFORMS"), rows);
  }

  public void repositories(List<RepositoryItem> repositories) {
    if (json) {
      printJson(repositories);
      return;
    }
    List<List<String>> rows = new ArrayList<>();
    for (RepositoryItem repository : repositories) {
      rows.add(List.of(
        repository.name(),
        repository.tagCount().map(String::valueOf).orElse(MISSING),
        repository.totalSize().map(OutputRenderer::formatBytes).orElse(MISSING),
        repository.lastUpdated().map(Instant::toString).orElse(MISSING)
      ));
    }
    printTable(List.of("REPOSITORY", "TAGS", "SIZE", "UPDATED"), rows);
  }

  /**
   * Prints a manifest and, for single platform images, its config.
   *
   * @param reference the reference the user asked for
   * @param manifest the manifest
   * @param config the raw config blob, if there is one
   */
  public void manifest(Reference reference, FetchedManifest manifest, Optional<byte[]> config) {
    if (json) {
      ObjectNode root = objectMapper.createObjectNode();
      root.put("reference", reference.toString());
      root.put("digest", manifest.digest().toString());
      root.set("manifest", readTree(manifest.raw()));
      config.ifPresent(it -> root.set("config", readTree(it)));
      printJson(root);
      return;
    }

    out.println("Reference:  " + reference);
    out.println("Digest:     " + manifest.digest());
    out.println("Media type: " + manifest.document().mediaType());
    out.println("Size:       " + formatBytes(manifest.document().totalSize()));

    if (manifest.document() instanceof ImageIndex index) {
      out.println("Platforms:");
      index.manifests().forEach(it -> out.println(
        "  " + (it.platform() == null ? "unknown" : it.platform()) + "  " + it.digest()
      ));
    } else if (manifest.document() instanceof ImageManifest image) {
      out.println("Config:     " + image.config().digest());
      out.println("Layers:     " + image.layers().size());
      config.map(this::readConfiguration).ifPresent(it -> {
        out.println("Platform:   " + it.platform().map(Object::toString).orElse(MISSING));
        out.println("Created:    " + it.createdAt().map(Instant::toString).orElse(MISSING));
      });
    }
  }

  /**
   * Prints repository and image matches, most relevant first.
   *
   * @param query the query
   * @param repositories the matching repositories
   * @param images the matching {@code repository:tag} pairs
   */
  public void search(String query, List<SearchResult> repositories, List<ImageSearchResult> images) {
    if (json) {
      ObjectNode root = objectMapper.createObjectNode();
      root.put("query", query);
      ArrayNode repositoryNodes = root.putArray("repositories");
      for (SearchResult repository : repositories) {
        repositoryNodes.addObject()
          .put("name", repository.value())
          .put("score", repository.score());
      }
      ArrayNode imageNodes = root.putArray("images");
      for (ImageSearchResult image : images) {
        imageNodes.addObject()
          .put("repository", image.repository())
          .put("tag", image.tag())
          .put("reference", image.reference())
          .put("score", image.score());
      }
      printJson(root);
      return;
    }

    if (repositories.isEmpty() && images.isEmpty()) {
      out.println("No results found");
      return;
    }
    if (!repositories.isEmpty()) {
      out.println("Repositories:");
      repositories.forEach(it -> out.println("  " + it.value()));
    }
    if (!images.isEmpty()) {
      if (!repositories.isEmpty()) {
        out.println();
      }
      out.println("Images:");
      images.forEach(it -> out.println("  " + it.reference()));
    }
  }

  public void tagSearch(String query, String repository, List<SearchResult> tags) {
    if (json) {
      ObjectNode root = objectMapper.createObjectNode();
      root.put("query", query);
      root.put("repository", repository);
      ArrayNode tagNodes = root.putArray("tags");
      for (SearchResult tag : tags) {
        tagNodes.addObject()
          .put("name", tag.value())
          .put("score", tag.score());
      }
      printJson(root);
      return;
    }

    if (tags.isEmpty()) {
      out.println("No results found");
      return;
    }
    out.println("Tags of " + repository + ":");
    tags.forEach(it -> out.println("  " + it.value()));
  }

  public void failures(List<FetchFailure> failures) {
    for (FetchFailure failure : failures) {
      err.println("error: " + failure.item() + ": " + failure.error().getMessage());
    }
  }

  public void error(String message) {
    err.println("error: " + message);
  }

  private void printTable(List<String> headers, List<List<String>> rows) {
    int[] widths = new int[headers.size()];
    for (int i = 0; i < headers.size(); i++) {
      widths[i] = headers.get(i).length();
    }
    for (List<String> row : rows) {
      for (int i = 0; i < row.size(); i++) {
        widths[i] = Math.max(widths[i], row.get(i).length());
      }
    }

    out.println(formatRow(headers, widths));
    for (List<String> row : rows) {
      out.println(formatRow(row, widths));
    }
  }

  private static String formatRow(List<String> cells, int[] widths) {
    StringBuilder line = new StringBuilder();
    for (int i = 0; i < cells.size(); i++) {
      if (i > 0) {
        line.append("  ");
      }
      if (i == cells.size() - 1) {
        line.append(cells.get(i));
      } else {
        line.append(String.format("%-" + widths[i] + "s", cells.get(i)));
      }
    }
    return line.toString();
  }

  /**
   * @param bytes a size in bytes
   * @return the size in decimal units, e.g. {@code 12.3 MB}
   */
  static String formatBytes(long bytes) {
    if (bytes < 1000) {
      return bytes + " B";
    }
    double value = bytes;
    int unit = 0;
    while (value >= 1000 && unit < SIZE_UNITS.length - 1) {
      value /= 1000;
      unit++;
    }
    return String.format(Locale.ROOT, "%.1f %s", value, SIZE_UNITS[unit]);
  }

  private ImageConfiguration readConfiguration(byte[] raw) {
    try {
      return objectMapper.readValue(raw, ImageConfiguration.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Config is not valid json", e);
    }
  }

  private JsonNode readTree(byte[] raw) {
    try {
      return objectMapper.readTree(raw);
    } catch (IOException e) {
      throw new UncheckedIOException("Document is not valid json", e);
    }
  }

  private void printJson(Object value) {
    try {
      out.println(objectMapper.writeValueAsString(value));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Could not serialize output", e);
    }
  }
}
