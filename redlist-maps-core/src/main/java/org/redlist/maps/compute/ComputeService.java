package org.redlist.maps.compute;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A remote raster and vector compute service.
 * <p>
 * Failures surface as {@link IOException}, with {@link ComputeServiceException} for error responses and
 * {@link java.net.http.HttpTimeoutException} for timeouts.
 */
public interface ComputeService {

  /** Returns the cloud project requests are billed to, or {@code null} if none is configured. */
  String project();

  /** Returns true if credentials are configured, without checking that they are valid. */
  boolean hasCredentials();

  /** Computes {@code image} over {@code grid} and returns the result as GeoTIFF bytes. */
  byte[] computePixels(Image image, PixelGrid grid) throws IOException, InterruptedException;

  /**
   * Asynchronous form of {@link #computePixels(Image, PixelGrid)}. The default implementation computes on the calling
   * thread and returns a completed future.
   */
  default CompletableFuture<byte[]> computePixelsAsync(Image image, PixelGrid grid) {
    try {
      return CompletableFuture.completedFuture(computePixels(image, grid));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return CompletableFuture.failedFuture(e);
    } catch (IOException | RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /** Evaluates {@code expression} and returns its JSON value. */
  JsonNode computeValue(Expression expression) throws IOException, InterruptedException;

  /** Returns the metadata of an asset, or empty if it does not exist. */
  Optional<JsonNode> getAsset(String assetPath) throws IOException, InterruptedException;

  /**
   * Creates a folder asset.
   *
   * @throws ComputeServiceException with {@link ComputeServiceException#isAlreadyExists()} if it exists already
   */
  void createFolder(String assetPath) throws IOException, InterruptedException;

  /** Lists the assets directly under {@code parentPath}, the project root when {@code null}. */
  JsonNode listAssets(String parentPath) throws IOException, InterruptedException;

  /** Starts a batch export and returns the long-running operation that tracks it. */
  JsonNode exportImage(Image image, ExportRequest request) throws IOException, InterruptedException;
}
