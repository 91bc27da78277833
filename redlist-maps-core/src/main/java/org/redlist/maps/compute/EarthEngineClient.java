package org.redlist.maps.compute;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.redlist.maps.config.MapsConfig;
import org.redlist.maps.util.Format;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ComputeService} that calls the Earth Engine REST API (v1) with {@link HttpClient}.
 * <p>
 * Every request carries the configured user agent, a bearer token from the {@link ComputeSession} and the
 * {@code http_timeout} from {@link MapsConfig}; requests are never retried.
 *
 * @see <a href="https://developers.google.com/earth-engine/reference/rest">Earth Engine REST API</a>
 */
public class EarthEngineClient implements ComputeService {

  private static final Logger LOGGER = LoggerFactory.getLogger(EarthEngineClient.class);
  private static final Format FORMAT = Format.defaultInstance();
  private static final String USER_AGENT = "User-Agent";
  private static final int MAX_ERROR_LENGTH = 500;
  private static final ObjectMapper objectMapper = new ObjectMapper()
    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final ComputeSession session;
  private final MapsConfig config;
  private final HttpClient client;

  public EarthEngineClient(ComputeSession session, MapsConfig config) {
    this(session, config, HttpClient.newBuilder()
      .connectTimeout(config.httpTimeout())
      .followRedirects(HttpClient.Redirect.NORMAL)
      .build());
  }

  EarthEngineClient(ComputeSession session, MapsConfig config, HttpClient client) {
    this.session = session;
    this.config = config;
    this.client = client;
  }

  public static EarthEngineClient create(MapsConfig config) {
    return new EarthEngineClient(ComputeSession.from(config), config);
  }

  @Override
  public String project() {
    return session.project();
  }

  @Override
  public boolean hasCredentials() {
    return session.hasCredentials();
  }

  private String projectPath() {
    if (session.project() == null || session.project().isBlank()) {
      throw new IllegalStateException("No Earth Engine project configured, set ee_project");
    }
    return "projects/" + session.project();
  }

  /** Returns the full resource name for an asset path relative to the project. */
  String assetName(String assetPath) {
    return assetPath.startsWith("projects/") ? assetPath : projectPath() + "/assets/" + assetPath;
  }

  private static String assetId(String assetName) {
    int idx = assetName.indexOf("/assets/");
    return idx >= 0 ? assetName.substring(idx + "/assets/".length()) : assetName;
  }

  private String url(String path) {
    return session.baseUrl() + "/v1/" + path;
  }

  private HttpRequest.Builder newHttpRequest(String url) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
      .timeout(config.httpTimeout())
      .header(USER_AGENT, config.httpUserAgent());
    if (session.hasCredentials()) {
      builder.header("Authorization", "Bearer " + session.accessToken());
    }
    if (session.project() != null) {
      builder.header("x-goog-user-project", session.project());
    }
    return builder;
  }

  private HttpRequest post(String url, JsonNode body) throws IOException {
    return newHttpRequest(url)
      .header("Content-Type", "application/json")
      .POST(HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)))
      .build();
  }

  private static byte[] checkStatus(HttpRequest request, HttpResponse<byte[]> response)
    throws ComputeServiceException {
    int status = response.statusCode();
    if (status / 100 != 2) {
      String body = new String(response.body(), StandardCharsets.UTF_8);
      String message = errorMessage(body);
      throw new ComputeServiceException(status,
        "%s %s returned %d: %s".formatted(request.method(), request.uri().getPath(), status, message));
    }
    return response.body();
  }

  /** Extracts {@code error.message} from a JSON error body, or returns the start of the raw body. */
  private static String errorMessage(String body) {
    try {
      JsonNode error = objectMapper.readTree(body).path("error").path("message");
      if (error.isTextual()) {
        return error.asText();
      }
    } catch (IOException e) {
      LOGGER.trace("Error body was not JSON", e);
    }
    return body.length() > MAX_ERROR_LENGTH ? body.substring(0, MAX_ERROR_LENGTH) + "..." : body;
  }

  private byte[] send(HttpRequest request) throws IOException, InterruptedException {
    LOGGER.debug("{} {}", request.method(), request.uri());
    return checkStatus(request, client.send(request, HttpResponse.BodyHandlers.ofByteArray()));
  }

  private JsonNode sendJson(HttpRequest request) throws IOException, InterruptedException {
    byte[] body = send(request);
    return body.length == 0 ? objectMapper.createObjectNode() : objectMapper.readTree(body);
  }

  private ObjectNode computePixelsBody(Image image, PixelGrid grid) {
    ObjectNode body = objectMapper.createObjectNode();
    body.set("expression", image.expression().toJson());
    body.put("fileFormat", "GEO_TIFF");
    body.set("grid", grid.toJson());
    return body;
  }

  @Override
  public byte[] computePixels(Image image, PixelGrid grid) throws IOException, InterruptedException {
    var request = post(url(projectPath() + "/image:computePixels"), computePixelsBody(image, grid));
    byte[] result = send(request);
    LOGGER.info("Downloaded {}B {}x{} GeoTIFF", FORMAT.storage(result.length), grid.width(), grid.height());
    return result;
  }

  @Override
  public CompletableFuture<byte[]> computePixelsAsync(Image image, PixelGrid grid) {
    HttpRequest request;
    try {
      request = post(url(projectPath() + "/image:computePixels"), computePixelsBody(image, grid));
    } catch (IOException | RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    LOGGER.debug("{} {}", request.method(), request.uri());
    return client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
      .thenApply(response -> {
        try {
          byte[] result = checkStatus(request, response);
          LOGGER.info("Downloaded {}B {}x{} GeoTIFF", FORMAT.storage(result.length), grid.width(), grid.height());
          return result;
        } catch (ComputeServiceException e) {
          throw new CompletionException(e);
        }
      });
  }

  @Override
  public JsonNode computeValue(Expression expression) throws IOException, InterruptedException {
    ObjectNode body = objectMapper.createObjectNode();
    body.set("expression", expression.toJson());
    return sendJson(post(url(projectPath() + "/value:compute"), body)).path("result");
  }

  @Override
  public Optional<JsonNode> getAsset(String assetPath) throws IOException, InterruptedException {
    try {
      return Optional.of(sendJson(newHttpRequest(url(assetName(assetPath))).GET().build()));
    } catch (ComputeServiceException e) {
      if (e.statusCode() == 404) {
        return Optional.empty();
      }
      throw e;
    }
  }

  @Override
  public void createFolder(String assetPath) throws IOException, InterruptedException {
    String name = assetName(assetPath);
    String project = name.substring(0, name.indexOf("/assets/"));
    ObjectNode body = objectMapper.createObjectNode();
    body.put("type", "FOLDER");
    String url = url(project + "/assets?assetId=" + URLEncoder.encode(assetId(name), StandardCharsets.UTF_8));
    sendJson(post(url, body));
    LOGGER.info("Created folder {}", name);
  }

  @Override
  public JsonNode listAssets(String parentPath) throws IOException, InterruptedException {
    String parent = parentPath == null ? projectPath() + "/assets" : assetName(parentPath);
    return sendJson(newHttpRequest(url(parent + ":listAssets")).GET().build());
  }

  @Override
  public JsonNode exportImage(Image image, ExportRequest request) throws IOException, InterruptedException {
    ObjectNode body = objectMapper.createObjectNode();
    body.set("expression", image.expression().toJson());
    body.put("description", request.description());
    body.put("maxPixels", request.maxPixels());
    body.putObject("assetExportOptions")
      .putObject("earthEngineDestination")
      .put("name", assetName(request.assetId()));
    ObjectNode grid = body.putObject("grid");
    grid.put("crsWkt", request.crsWkt());
    ObjectNode affine = grid.putObject("affineTransform");
    affine.put("scaleX", request.scale());
    affine.put("scaleY", -request.scale());
    JsonNode operation = sendJson(post(url(projectPath() + "/image:export"), body));
    LOGGER.info("Started export {} to {}: {}", request.description(), request.assetId(),
      operation.path("name").asText("unknown operation"));
    return operation;
  }
}
