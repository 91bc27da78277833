package org.redlist.maps.raster;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.redlist.maps.RenderRequest;
import org.redlist.maps.compute.ComputeService;
import org.redlist.maps.compute.Image;
import org.redlist.maps.compute.PixelGrid;
import org.redlist.maps.config.MapsConfig;
import org.redlist.maps.reader.ResolvedBoundary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads a remote raster over a region's map frame.
 * <p>
 * The service returns GeoTIFFs without a nodata value, so the raster and its validity mask are requested as two
 * separate images over the same {@link PixelGrid} and combined locally. Both requests run concurrently.
 * <p>
 * Any failure (timeout, error response, undecodable bytes) produces a {@link FetchResult.Degraded} so the map can
 * still be drawn without the raster.
 */
public class RasterFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(RasterFetcher.class);

  private final ComputeService service;
  private final int downloadScaleMultiplier;

  public RasterFetcher(ComputeService service, MapsConfig config) {
    this(service, config.downloadScaleMultiplier());
  }

  public RasterFetcher(ComputeService service, int downloadScaleMultiplier) {
    this.service = service;
    this.downloadScaleMultiplier = downloadScaleMultiplier;
  }

  /** Returns the grid that rasters for {@code boundary} are requested on. */
  public PixelGrid grid(ResolvedBoundary boundary, int dpi) {
    double scale = PixelGrid.scaleFor(boundary.extent(), dpi, downloadScaleMultiplier);
    return PixelGrid.covering(boundary.extent(), boundary.zone().crsCode(), scale);
  }

  /** Returns the image whose values are downloaded for {@code request}. */
  static Image valueImage(Image source, RenderRequest request) {
    if (request.fetchMode() == FetchMode.VISUALIZED) {
      return source.visualize(request.visualization());
    }
    return source;
  }

  /** Returns the image to download before styling, clipped to the lon/lat boundary if requested. */
  static Image sourceImage(Image image, ResolvedBoundary boundary, RenderRequest request) {
    // the service does not accept multipolygons in a projected coordinate system
    return request.clipImage() ? image.clip(boundary.lonLatGeometry()) : image;
  }

  public FetchResult fetch(Image image, ResolvedBoundary boundary, RenderRequest request) {
    PixelGrid grid = grid(boundary, request.dpi());
    Image source = sourceImage(image, boundary, request);
    LOGGER.info("Fetching {}x{} raster at {}m per pixel in {}", grid.width(), grid.height(),
      Math.round(grid.scale()), grid.crsCode());

    CompletableFuture<byte[]> values = service.computePixelsAsync(valueImage(source, request), grid);
    CompletableFuture<byte[]> mask = service.computePixelsAsync(source.mask(), grid);
    try {
      CompletableFuture.allOf(values, mask).get();
      DecodedRaster decodedValues = GeoTiffDecoder.decode(values.get());
      DecodedRaster decodedMask = GeoTiffDecoder.decode(mask.get());
      RasterBounds bounds = decodedValues.bounds()
        .orElseGet(() -> new RasterBounds(grid.left(), grid.right(), grid.bottom(), grid.top()));
      RasterLayer layer = RasterLayer.composite(decodedValues, decodedMask, bounds);
      LOGGER.debug("Raster has {} bands, {} of {} pixels visible", layer.bands(), layer.visibleCount(),
        (long) layer.width() * layer.height());
      return FetchResult.success(layer);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      values.cancel(true);
      mask.cancel(true);
      return FetchResult.degraded("Interrupted while downloading Earth Engine image. Skipping basemap layer.", e);
    } catch (ExecutionException | CompletionException e) {
      return degraded(e.getCause() instanceof Exception cause ? cause : e);
    } catch (IOException | RuntimeException e) {
      return degraded(e);
    }
  }

  private static FetchResult degraded(Exception e) {
    if (e instanceof HttpTimeoutException) {
      return FetchResult.degraded("Earth Engine image download timed out. Skipping basemap layer.", e);
    }
    return FetchResult.degraded("Failed to download or display Earth Engine image: " + e.getMessage(), e);
  }
}
