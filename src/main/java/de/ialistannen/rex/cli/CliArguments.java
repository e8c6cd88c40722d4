package de.ialistannen.rex.cli;

import java.util.Optional;
import net.jbock.Command;
import net.jbock.Option;
import net.jbock.Parameter;

@Command(name = "rex", description = "Explores the repositories, tags and images of an OCI registry", publicParser = true)
public interface CliArguments {

  @Option(
    names = "--inspect",
    description = "Treat the target as an image reference and show its manifest and config"
  )
  boolean inspect();

  @Option(
    names = "--search",
    description = "Fuzzy search repositories and images, or only the tags of TARGET if given. 'repo:tag' searches both",
    paramLabel = "QUERY"
  )
  Optional<String> search();

  @Option(names = "--limit", description = "Show at most this many results per section with --search", paramLabel = "N")
  Optional<Integer> limit();

  @Option(
    names = "--cache-dir",
    description = "Directory to cache metadata in. Default: $XDG_CACHE_HOME/rex or ~/.cache/rex",
    paramLabel = "PATH"
  )
  Optional<String> cacheDir();

  @Option(
    names = "--concurrency",
    description = "How many requests may run at the same time. Default: 8",
    paramLabel = "N"
  )
  Optional<Integer> concurrency();

  @Option(
    names = "--timeout",
    description = "Timeout of a single request in seconds. Default: 30",
    paramLabel = "SECONDS"
  )
  Optional<Integer> timeoutSeconds();

  @Option(names = "--username", description = "Username for basic auth", paramLabel = "USER")
  Optional<String> username();

  @Option(names = "--password", description = "Password for basic auth", paramLabel = "PASSWORD")
  Optional<String> password();

  @Option(names = "--token", description = "Bearer token to send", paramLabel = "TOKEN")
  Optional<String> token();

  @Option(
    names = "--docker-config",
    description = "Path to docker config to read credentials from. Default: ~/.docker/config.json",
    paramLabel = "PATH"
  )
  Optional<String> dockerConfigPath();

  @Option(
    names = "--platform",
    description = "Platform to resolve multi-platform images to with --inspect, e.g. 'linux/arm64'",
    paramLabel = "OS/ARCH"
  )
  Optional<String> platform();

  @Option(
    names = "--docker-hub-compat",
    description = "Keep the 'library/' prefix of official images when talking to the registry"
  )
  boolean dockerHubCompat();

  @Option(names = "--json", description = "Print json instead of a table")
  boolean json();

  @Parameter(index = 0, description = "The registry url, e.g. 'localhost:5000'", paramLabel = "REGISTRY")
  String registryUrl();

  @Parameter(
    index = 1,
    description = "Repository to list the tags of, or the image reference to inspect. Omit to list repositories",
    paramLabel = "TARGET"
  )
  Optional<String> target();
}
