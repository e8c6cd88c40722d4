package de.ialistannen.rex.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.ialistannen.rex.auth.Credentials;
import de.ialistannen.rex.oci.Descriptor;
import de.ialistannen.rex.oci.Digest;
import de.ialistannen.rex.oci.ImageIndex;
import de.ialistannen.rex.oci.ManifestDocument;
import de.ialistannen.rex.oci.MediaTypes;
import de.ialistannen.rex.oci.Platform;
import de.ialistannen.rex.oci.ValidationException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Talks to a registry using the distribution v2 API.
 */
public class HttpRegistryClient implements RegistryClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpRegistryClient.class);

  private static final Pattern NEXT_LINK_PATTERN = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?next\"?");
  private static final Pattern SECONDS_PATTERN = Pattern.compile("\\d+");
  private static final String JSON = "application/json";
  private static final String MANIFEST_ACCEPT = String.join(", ", MediaTypes.MANIFEST_TYPES);
  private static final int MAX_ERROR_BODY_LENGTH = 512;

  private final HttpClient client;
  private final ObjectMapper objectMapper;
  private final String registryUrl;
  private final Optional<Credentials> credentials;
  private final Duration requestTimeout;
  private final OptionalInt pageSize;
  private final Clock clock;

  public HttpRegistryClient(
    HttpClient client,
    String registryUrl,
    Optional<Credentials> credentials,
    Duration requestTimeout
  ) {
    this(client, registryUrl, credentials, requestTimeout, OptionalInt.empty(), Clock.systemUTC());
  }

  public HttpRegistryClient(
    HttpClient client,
    String registryUrl,
    Optional<Credentials> credentials,
    Duration requestTimeout,
    OptionalInt pageSize,
    Clock clock
  ) {
    this.client = client;
    this.registryUrl = normalizeUrl(registryUrl);
    this.credentials = credentials;
    this.requestTimeout = requestTimeout;
    this.pageSize = pageSize;
    this.clock = clock;

    this.objectMapper = new ObjectMapper().findAndRegisterModules();
  }

  /**
   * Normalizes a user supplied registry url: whitespace is trimmed, {@code http://} is assumed if no scheme is given
   * and trailing slashes are removed.
   *
   * @param url the url
   * @return the normalized url
   * @throws ValidationException if the url is empty
   */
  public static String normalizeUrl(String url) {
    if (url == null || url.isBlank()) {
      throw new ValidationException("Registry url must not be empty");
    }
    String normalized = url.trim();
    if (!normalized.contains("://")) {
      normalized = "http://" + normalized;
    }
    while (normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    URI uri;
    try {
      uri = URI.create(normalized);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Registry url '" + url + "' is malformed", e);
    }
    if (uri.getHost() == null) {
      throw new ValidationException("Registry url '" + url + "' has no host");
    }
    return normalized;
  }

  @Override
  public String registryUrl() {
    return registryUrl;
  }

  @Override
  public RegistryVersion checkVersion() throws InterruptedException {
    HttpResponse<byte[]> response = send(request(toUri("/v2/"), JSON), "/v2/");

    return new RegistryVersion(response.headers().firstValue("Docker-Distribution-API-Version"));
  }

  @Override
  public List<String> listRepositories() throws InterruptedException {
    LOGGER.debug("Listing repositories of {}", registryUrl);

    List<String> repositories = new ArrayList<>();
    for (byte[] page : fetchPages(toUri("/v2/_catalog" + pageQuery()), "catalog")) {
      Catalog catalog = readJson(page, Catalog.class, "catalog");
      if (catalog.repositories() != null) {
        repositories.addAll(catalog.repositories());
      }
    }
    return repositories;
  }

  @Override
  public List<String> listTags(String repository) throws InterruptedException {
    LOGGER.debug("Listing tags of '{}' on {}", repository, registryUrl);

    List<String> tags = new ArrayList<>();
    String resource = "tags of '" + repository + "'";
    for (byte[] page : fetchPages(toUri("/v2/" + repository + "/tags/list" + pageQuery()), resource)) {
      TagList tagList = readJson(page, TagList.class, resource);
      if (tagList.name() != null && !tagList.name().equals(repository)) {
        throw new ProtocolException(
          "Asked for tags of '" + repository + "' but registry answered for '" + tagList.name() + "'"
        );
      }
      if (tagList.tags() != null) {
        tags.addAll(tagList.tags());
      }
    }
    return tags;
  }

  @Override
  public ManifestResponse fetchManifest(String repository, String reference) throws InterruptedException {
    LOGGER.debug("Fetching manifest for '{}':'{}'", repository, reference);

    // Tags can not contain colons, so this is a digest and must be valid before we go to the network
    Optional<Digest> expectedDigest = reference.contains(":")
      ? Optional.of(Digest.parse(reference))
      : Optional.empty();

    String resource = repository + ":" + reference;
    HttpResponse<byte[]> response = send(
      request(toUri("/v2/" + repository + "/manifests/" + reference), MANIFEST_ACCEPT),
      resource
    );
    byte[] body = response.body();

    if (expectedDigest.isPresent()) {
      if (!expectedDigest.get().matches(body)) {
        throw new ProtocolException(
          "Manifest '" + resource + "' does not match its digest, got " + Digest.compute(body)
        );
      }
      return new ManifestResponse(body, expectedDigest.get(), response.headers().firstValue("Content-Type"));
    }

    Digest digest = response.headers()
      .firstValue("Docker-Content-Digest")
      .map(it -> parseRemoteDigest(it, resource))
      .orElseGet(() -> Digest.compute(body));

    return new ManifestResponse(body, digest, response.headers().firstValue("Content-Type"));
  }

  @Override
  public ManifestResponse fetchManifest(String repository, String reference, Optional<Platform> platform)
    throws InterruptedException {
    ManifestResponse response = fetchManifest(repository, reference);
    if (platform.isEmpty()) {
      return response;
    }

    ManifestDocument document;
    try {
      document = ManifestDocument.parse(objectMapper, response.body(), response.contentType());
    } catch (IOException e) {
      throw new ProtocolException("Malformed manifest for '" + repository + ":" + reference + "'", e);
    }
    if (!(document instanceof ImageIndex index)) {
      return response;
    }

    Descriptor child = index.findManifest(platform.get())
      .orElseThrow(() -> new NotFoundException(
        "No manifest for platform " + platform.get() + " in '" + repository + ":" + reference + "'"
      ));
    LOGGER.debug("Resolved {} of '{}':'{}' to {}", platform.get(), repository, reference, child.digest());

    return fetchManifest(repository, child.digest().toString());
  }

  @Override
  public byte[] fetchBlob(String repository, Digest digest) throws InterruptedException {
    LOGGER.debug("Fetching blob {} of '{}'", digest, repository);

    String resource = repository + "@" + digest;
    HttpResponse<byte[]> response = send(
      request(toUri("/v2/" + repository + "/blobs/" + digest), "*/*"),
      resource
    );
    byte[] body = response.body();
    if (!digest.matches(body)) {
      throw new ProtocolException(
        "Blob '" + resource + "' does not match its digest, got " + Digest.compute(digest.algorithm(), body)
      );
    }
    return body;
  }

  private List<byte[]> fetchPages(URI firstPage, String resource) throws InterruptedException {
    List<byte[]> pages = new ArrayList<>();
    Set<URI> seen = new HashSet<>();

    URI next = firstPage;
    while (next != null) {
      if (!seen.add(next)) {
        throw new ProtocolException("Pagination of " + resource + " loops back to " + next);
      }
      HttpResponse<byte[]> response = send(request(next, JSON), resource);
      pages.add(response.body());
      next = nextPage(response).orElse(null);
    }

    LOGGER.debug("Fetched {} in {} page(s)", resource, pages.size());
    return pages;
  }

  private Optional<URI> nextPage(HttpResponse<?> response) {
    for (String link : response.headers().allValues("Link")) {
      Matcher matcher = NEXT_LINK_PATTERN.matcher(link);
      if (matcher.find()) {
        try {
          return Optional.of(response.uri().resolve(matcher.group(1)));
        } catch (IllegalArgumentException e) {
          throw new ProtocolException("Invalid pagination link '" + link + "'", e);
        }
      }
    }
    return Optional.empty();
  }

  private String pageQuery() {
    if (pageSize.isEmpty()) {
      return "";
    }
    return "?n=" + pageSize.getAsInt();
  }

  private HttpRequest request(URI uri, String accept) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
      .header("User-Agent", "rex")
      .header("Accept", accept)
      .timeout(requestTimeout)
      .GET();
    credentials.ifPresent(it -> builder.header("Authorization", it.headerValue()));

    return builder.build();
  }

  private URI toUri(String path) {
    try {
      return URI.create(registryUrl + path);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Can not build a request url for '" + path + "'", e);
    }
  }

  /**
   * Sends a request and classifies every non 2xx answer.
   *
   * @param request the request
   * @param resource a description of what we fetch, for error messages
   * @return the successful response
   * @throws InterruptedException ?
   * @throws RegistryException if the request failed
   */
  private HttpResponse<byte[]> send(HttpRequest request, String resource) throws InterruptedException {
    LOGGER.debug(
      "Sending request to {}, ({}) headers: {}",
      request.uri(),
      request.method(),
      request.headers().map().keySet()
    );

    HttpResponse<byte[]> response = exchange(request, resource);

    LOGGER.debug("Got response {}-{}: {}", response.uri(), response.statusCode(), response.headers().map());

    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      return response;
    }
    if (status == 401 || status == 403) {
      throw new UnauthorizedException(resource, status);
    }
    if (status == 404) {
      throw new NotFoundException("Could not find " + resource + " on " + registryUrl);
    }
    if (status == 429) {
      Optional<Duration> retryAfter = response.headers()
        .firstValue("Retry-After")
        .flatMap(it -> parseRetryAfter(it, clock));
      throw new RateLimitedException(resource, retryAfter);
    }
    if (status >= 500) {
      throw new TransportException(
        "Registry failed to serve " + resource + " with status " + status + ": " + errorBody(response)
      );
    }
    throw new ProtocolException(
      "Unexpected status " + status + " for " + resource + ": " + errorBody(response)
    );
  }

  /**
   * Performs the exchange, including reading the body, within the request timeout. The timeout on the request itself
   * only covers the wait for the response headers.
   */
  private HttpResponse<byte[]> exchange(HttpRequest request, String resource) throws InterruptedException {
    CompletableFuture<HttpResponse<byte[]>> future = client.sendAsync(request, BodyHandlers.ofByteArray());
    try {
      return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new TransportException("Request for " + resource + " timed out after " + requestTimeout, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof HttpTimeoutException) {
        throw new TransportException("Request for " + resource + " timed out after " + requestTimeout, cause);
      }
      if (cause instanceof IOException) {
        throw new TransportException("Request for " + resource + " to " + registryUrl + " failed", cause);
      }
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new TransportException("Request for " + resource + " to " + registryUrl + " failed", cause);
    }
  }

  private <T> T readJson(byte[] body, Class<T> type, String resource) {
    try {
      T value = objectMapper.readValue(body, type);
      if (value == null) {
        throw new ProtocolException("Empty response body for " + resource);
      }
      return value;
    } catch (IOException e) {
      throw new ProtocolException("Malformed response body for " + resource, e);
    }
  }

  private static Digest parseRemoteDigest(String value, String resource) {
    try {
      return Digest.parse(value);
    } catch (ValidationException e) {
      throw new ProtocolException("Registry sent an invalid digest for " + resource + ": " + e.getMessage(), e);
    }
  }

  private static String errorBody(HttpResponse<byte[]> response) {
    String body = new String(response.body(), StandardCharsets.UTF_8);
    if (body.length() > MAX_ERROR_BODY_LENGTH) {
      return body.substring(0, MAX_ERROR_BODY_LENGTH) + "...";
    }
    return body;
  }

  /**
   * Parses a {@code Retry-After} header, which is either a number of seconds or an HTTP date.
   *
   * @param value the header value
   * @param clock the clock to measure dates against
   * @return the time to wait. Dates in the past yield zero.
   */
  static Optional<Duration> parseRetryAfter(String value, Clock clock) {
    String trimmed = value.trim();
    if (SECONDS_PATTERN.matcher(trimmed).matches()) {
      try {
        return Optional.of(Duration.ofSeconds(Long.parseLong(trimmed)));
      } catch (NumberFormatException e) {
        LOGGER.debug("Retry-After '{}' is out of range", trimmed);
        return Optional.empty();
      }
    }
    try {
      ZonedDateTime date = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
      Duration wait = Duration.between(clock.instant(), date.toInstant());
      return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
    } catch (DateTimeParseException e) {
      LOGGER.debug("Ignoring unparseable Retry-After '{}'", trimmed);
      return Optional.empty();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Catalog(List<String> repositories) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TagList(String name, List<String> tags) {

  }
}
