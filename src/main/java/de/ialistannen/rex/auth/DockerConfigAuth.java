package de.ialistannen.rex.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map.Entry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single entry of the {@code auths} section in a docker {@code config.json}.
 *
 * @param url the registry the entry is for, as docker writes it (usually {@code host[:port]})
 * @param encodedAuth base64 encoded {@code username:password}
 */
public record DockerConfigAuth(String url, String encodedAuth) {

  private static final Logger LOGGER = LoggerFactory.getLogger(DockerConfigAuth.class);

  /**
   * Loads the docker authentications from a given config file.
   *
   * @param pathToConfig the path to the docker config
   * @return the stored authentications
   * @throws IOException if an error occurs
   */
  public static List<DockerConfigAuth> loadAuthentications(Path pathToConfig) throws IOException {
    ObjectNode root = new ObjectMapper().readValue(Files.readString(pathToConfig), ObjectNode.class);
    JsonNode auths = root.get("auths");
    if (auths == null || !auths.isObject()) {
      return List.of();
    }

    return fromJson((ObjectNode) auths);
  }

  /**
   * Extracts the stored registry authentications from the "auths" part of the config file. Entries that only use a
   * credential helper carry no {@code auth} field and are skipped.
   *
   * @param authsNode the auths node
   * @return the found docker registry authentications
   */
  private static List<DockerConfigAuth> fromJson(ObjectNode authsNode) {
    List<DockerConfigAuth> auths = new ArrayList<>();

    var iterator = authsNode.fields();
    while (iterator.hasNext()) {
      Entry<String, JsonNode> entry = iterator.next();
      JsonNode auth = entry.getValue().get("auth");
      if (auth == null || auth.asText().isBlank()) {
        LOGGER.debug("Skipping docker config entry for '{}' without inline auth", entry.getKey());
        continue;
      }
      auths.add(new DockerConfigAuth(entry.getKey(), auth.asText()));
    }

    return auths;
  }

  /**
   * Finds the credentials stored for a registry.
   *
   * @param auths the loaded entries
   * @param registryUrl the url of the registry, including its scheme
   * @return the credentials, if any entry matches the registry host
   */
  public static Optional<Credentials> forRegistry(List<DockerConfigAuth> auths, String registryUrl) {
    URI registryUri;
    try {
      registryUri = new URI(registryUrl);
    } catch (URISyntaxException e) {
      LOGGER.warn("Can not look up docker credentials for malformed url '{}'", registryUrl);
      return Optional.empty();
    }

    return auths.stream()
      .filter(authSection -> hostMatches(authSection.url(), registryUri))
      .findFirst()
      .flatMap(DockerConfigAuth::toCredentials);
  }

  /**
   * @return the decoded username and password, if the stored value is valid
   */
  public Optional<Credentials> toCredentials() {
    String decoded;
    try {
      decoded = new String(Base64.getDecoder().decode(encodedAuth), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Docker config entry for '{}' is not valid base64", url);
      return Optional.empty();
    }
    int separator = decoded.indexOf(':');
    if (separator < 0) {
      LOGGER.warn("Docker config entry for '{}' is not of the form 'user:password'", url);
      return Optional.empty();
    }
    return Optional.of(Credentials.basic(decoded.substring(0, separator), decoded.substring(separator + 1)));
  }

  private static boolean hostMatches(String dockerConfigUrl, URI ourUrl) {
    String ourDockerFormatUrl = ourUrl.getHost();
    if (ourDockerFormatUrl == null) {
      return false;
    }
    if (ourUrl.getPort() >= 0) {
      ourDockerFormatUrl += ":" + ourUrl.getPort();
    }
    if (dockerConfigUrl.equalsIgnoreCase(ourDockerFormatUrl)) {
      return true;
    }
    try {
      URI configUri = dockerConfigUrl.contains("://")
        ? new URI(dockerConfigUrl)
        : new URI("https://" + dockerConfigUrl);
      String configHost = configUri.getHost();
      if (configUri.getPort() >= 0) {
        configHost += ":" + configUri.getPort();
      }
      return ourDockerFormatUrl.equalsIgnoreCase(configHost);
    } catch (URISyntaxException e) {
      return false;
    }
  }
}
