package de.ialistannen.rex;

import de.ialistannen.rex.auth.Credentials;
import de.ialistannen.rex.auth.DockerConfigAuth;
import de.ialistannen.rex.cli.CliArguments;
import de.ialistannen.rex.cli.CliArgumentsParser;
import de.ialistannen.rex.cli.ExplorerCommand;
import de.ialistannen.rex.cli.OutputRenderer;
import de.ialistannen.rex.config.ExplorerSettings;
import de.ialistannen.rex.registry.HttpRegistryClient;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws InterruptedException {
    CliArguments arguments = new CliArgumentsParser().parseOrExit(args);

    ExplorerSettings settings;
    try {
      settings = settingsFromArgs(arguments);
    } catch (IOException | IllegalArgumentException e) {
      LOGGER.debug("Invalid arguments", e);
      System.err.println("error: " + e.getMessage());
      System.exit(2);
      return;
    }

    int status;
    try (RegistryExplorer explorer = new RegistryExplorer(settings)) {
      ExplorerCommand command = new ExplorerCommand(
        explorer,
        new OutputRenderer(System.out, System.err, arguments.json())
      );

      if (arguments.search().isPresent()) {
        status = command.search(arguments.search().get(), arguments.target(), arguments.limit());
      } else if (arguments.target().isEmpty()) {
        status = command.listRepositories();
      } else if (arguments.inspect()) {
        status = command.inspect(arguments.target().get(), arguments.platform());
      } else {
        status = command.listTags(arguments.target().get());
      }
    }

    System.exit(status);
  }

  private static ExplorerSettings settingsFromArgs(CliArguments arguments) throws IOException {
    String registryUrl = HttpRegistryClient.normalizeUrl(arguments.registryUrl());

    ExplorerSettings settings = ExplorerSettings.defaults(registryUrl, cacheDirFromArgs(arguments))
      .withCredentials(credentialsFromArgs(arguments, registryUrl))
      .withDockerHubCompat(arguments.dockerHubCompat());

    if (arguments.concurrency().isPresent()) {
      settings = settings.withConcurrency(arguments.concurrency().get());
    }
    if (arguments.timeoutSeconds().isPresent()) {
      settings = settings.withRequestTimeout(Duration.ofSeconds(arguments.timeoutSeconds().get()));
    }
    return settings;
  }

  private static Path cacheDirFromArgs(CliArguments arguments) {
    if (arguments.cacheDir().isPresent()) {
      return Path.of(arguments.cacheDir().get());
    }
    String xdgCache = System.getenv("XDG_CACHE_HOME");
    if (xdgCache != null && !xdgCache.isBlank()) {
      return Path.of(xdgCache, "rex");
    }
    return Path.of(System.getProperty("user.home"), ".cache", "rex");
  }

  private static Optional<Credentials> credentialsFromArgs(CliArguments arguments, String registryUrl)
    throws IOException {
    if (arguments.token().isPresent()) {
      return Optional.of(Credentials.bearer(arguments.token().get()));
    }
    if (arguments.username().isPresent()) {
      String password = arguments.password()
        .orElseThrow(() -> new IllegalArgumentException("--username needs a --password as well"));
      return Optional.of(Credentials.basic(arguments.username().get(), password));
    }

    Path pathToFile = Path.of(System.getProperty("user.home"), ".docker/config.json");
    if (arguments.dockerConfigPath().isEmpty()) {
      if (!Files.exists(pathToFile)) {
        return Optional.empty();
      }
      LOGGER.debug("Using default docker config path");
    } else {
      pathToFile = Path.of(arguments.dockerConfigPath().get());
    }

    LOGGER.debug("Loading auth from '{}'", pathToFile);
    return DockerConfigAuth.forRegistry(DockerConfigAuth.loadAuthentications(pathToFile), registryUrl);
  }
}
