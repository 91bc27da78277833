package org.redlist.maps.compute;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.redlist.maps.config.Arguments;
import org.redlist.maps.config.MapsConfig;
import org.redlist.maps.geo.Extent;

class EarthEngineClientTest {

  private record Recorded(String method, String uri, Map<String, List<String>> headers, JsonNode body) {}

  private record Response(int status, byte[] body) {}

  private HttpServer server;
  private final List<Recorded> requests = new CopyOnWriteArrayList<>();
  private final Map<String, Response> responses = new ConcurrentHashMap<>();
  private EarthEngineClient client;

  @BeforeEach
  void start() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/", this::handle);
    server.start();
    MapsConfig config = MapsConfig.from(Arguments.of(
      "ee_base_url", "http://localhost:" + server.getAddress().getPort() + "/",
      "ee_project", "my-project",
      "ee_access_token", "secret-token",
      "http_user_agent", "redlist-maps-test"
    ));
    client = EarthEngineClient.create(config);
  }

  @AfterEach
  void stop() {
    server.stop(0);
  }

  private void handle(HttpExchange exchange) throws IOException {
    byte[] body = exchange.getRequestBody().readAllBytes();
    requests.add(new Recorded(
      exchange.getRequestMethod(),
      exchange.getRequestURI().toString(),
      Map.copyOf(exchange.getRequestHeaders()),
      body.length == 0 ? null : Expression.MAPPER.readTree(body)
    ));
    String path = exchange.getRequestURI().getPath();
    Response response = responses.getOrDefault(path, new Response(404,
      "{\"error\": {\"code\": 404, \"message\": \"not found\"}}".getBytes(StandardCharsets.UTF_8)));
    exchange.sendResponseHeaders(response.status, response.body.length == 0 ? -1 : response.body.length);
    if (response.body.length > 0) {
      exchange.getResponseBody().write(response.body);
    }
    exchange.close();
  }

  private void respond(String path, int status, String body) {
    responses.put(path, new Response(status, body.getBytes(StandardCharsets.UTF_8)));
  }

  private static String header(Recorded request, String name) {
    return request.headers().entrySet().stream()
      .filter(e -> e.getKey().equalsIgnoreCase(name))
      .map(e -> e.getValue().get(0))
      .findFirst()
      .orElse(null);
  }

  @Test
  void testComputePixels() throws Exception {
    byte[] tiff = {0x49, 0x49, 42, 0};
    responses.put("/v1/projects/my-project/image:computePixels", new Response(200, tiff));
    PixelGrid grid = PixelGrid.covering(new Extent(0, 100, 0, 50), "EPSG:32648", 10);

    assertArrayEquals(tiff, client.computePixels(Image.load("a"), grid));
    assertArrayEquals(tiff, client.computePixelsAsync(Image.load("a").mask(), grid).get());

    assertEquals(2, requests.size());
    Recorded request = requests.get(0);
    assertEquals("POST", request.method());
    assertEquals("Bearer secret-token", header(request, "Authorization"));
    assertEquals("my-project", header(request, "x-goog-user-project"));
    assertEquals("redlist-maps-test", header(request, "User-Agent"));
    assertEquals("GEO_TIFF", request.body().get("fileFormat").asText());
    assertEquals(Image.load("a").expression().toJson(), request.body().get("expression"));
    assertEquals(10, request.body().at("/grid/dimensions/width").asInt());
    assertEquals(-10, request.body().at("/grid/affineTransform/scaleY").asDouble());
    assertEquals(50, request.body().at("/grid/affineTransform/translateY").asDouble());
    assertEquals("EPSG:32648", request.body().at("/grid/crsCode").asText());
  }

  @Test
  void testErrorResponse() {
    respond("/v1/projects/my-project/image:computePixels", 400,
      "{\"error\": {\"code\": 400, \"message\": \"Image.load: asset not found\"}}");
    PixelGrid grid = PixelGrid.covering(new Extent(0, 10, 0, 10), "EPSG:32648", 1);

    var e = assertThrows(ComputeServiceException.class, () -> client.computePixels(Image.load("a"), grid));
    assertEquals(400, e.statusCode());
    assertTrue(e.getMessage().endsWith("Image.load: asset not found"), e.getMessage());

    var async = assertThrows(ExecutionException.class, () -> client.computePixelsAsync(Image.load("a"), grid).get());
    assertTrue(async.getCause() instanceof ComputeServiceException, async.toString());
  }

  @Test
  void testComputeValue() throws Exception {
    respond("/v1/projects/my-project/value:compute", 200, "{\"result\": 1234.5}");
    JsonNode result = client.computeValue(Expression.constant(1));
    assertEquals(1234.5, result.asDouble());
  }

  @Test
  void testAssets() throws Exception {
    respond("/v1/projects/my-project/assets/existing", 200, "{\"type\": \"FOLDER\"}");
    respond("/v1/projects/my-project/assets", 200, "{}");
    respond("/v1/projects/my-project/assets:listAssets", 200, "{\"assets\": []}");

    assertEquals(Optional.empty(), client.getAsset("missing"));
    assertEquals("FOLDER", client.getAsset("existing").orElseThrow().get("type").asText());
    assertEquals("FOLDER", client.getAsset("projects/my-project/assets/existing").orElseThrow().get("type").asText());

    client.createFolder("new/folder");
    Recorded create = requests.get(requests.size() - 1);
    assertEquals("POST", create.method());
    assertEquals("/v1/projects/my-project/assets?assetId=new%2Ffolder", create.uri());
    assertEquals("FOLDER", create.body().get("type").asText());

    assertTrue(client.listAssets(null).get("assets").isArray());
  }

  @Test
  void testUnauthorized() {
    respond("/v1/projects/my-project/assets:listAssets", 401,
      "{\"error\": {\"code\": 401, \"message\": \"Request had invalid authentication credentials.\"}}");
    var e = assertThrows(ComputeServiceException.class, () -> client.listAssets(null));
    assertTrue(e.isAuthError());
    assertFalse(AuthCheck.check(client).authenticated());
  }

  @Test
  void testAssetNames() {
    assertEquals("projects/my-project/assets/a/b", client.assetName("a/b"));
    assertEquals("projects/other/assets/c", client.assetName("projects/other/assets/c"));
  }

  @Test
  void testExport() throws Exception {
    respond("/v1/projects/my-project/image:export", 200, "{\"name\": \"projects/my-project/operations/ABC\"}");
    JsonNode operation = client.exportImage(Image.load("a"),
      new ExportRequest("aoo", "out/aoo", "WKT", 1000, ExportRequest.DEFAULT_MAX_PIXELS));
    assertEquals("projects/my-project/operations/ABC", operation.get("name").asText());
    JsonNode body = requests.get(0).body();
    assertEquals("aoo", body.get("description").asText());
    assertEquals("projects/my-project/assets/out/aoo",
      body.at("/assetExportOptions/earthEngineDestination/name").asText());
    assertEquals(1000, body.at("/grid/affineTransform/scaleX").asDouble());
  }
}
