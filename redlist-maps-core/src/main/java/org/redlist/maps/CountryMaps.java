package org.redlist.maps;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;
import org.redlist.maps.compute.ComputeService;
import org.redlist.maps.compute.EarthEngineClient;
import org.redlist.maps.config.MapsConfig;
import org.redlist.maps.geo.GeometryException;
import org.redlist.maps.raster.FetchResult;
import org.redlist.maps.raster.RasterFetcher;
import org.redlist.maps.raster.RasterLayer;
import org.redlist.maps.reader.BoundaryResolver;
import org.redlist.maps.reader.BoundaryStore;
import org.redlist.maps.reader.BoundaryStoreContext;
import org.redlist.maps.reader.ContextSource;
import org.redlist.maps.reader.NaturalEarthBoundaryStore;
import org.redlist.maps.reader.NaturalEarthContext;
import org.redlist.maps.reader.NaturalEarthDatabase;
import org.redlist.maps.reader.ResolvedBoundary;
import org.redlist.maps.render.MapRenderer;
import org.redlist.maps.render.RenderedMap;
import org.redlist.maps.render.WorldBackground;
import org.redlist.maps.util.LogUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draws region maps: resolves the region boundary, downloads the raster basemap when the request names one, then
 * renders everything to a PNG.
 * <p>
 * A failed raster download is logged and the map is drawn without it. Every other failure propagates.
 */
public class CountryMaps implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(CountryMaps.class);

  private final BoundaryResolver resolver;
  private final RasterFetcher fetcher;
  private final MapRenderer renderer;
  private final Closeable resources;

  /**
   * @param resolver  region code to boundary lookup
   * @param fetcher   raster downloader, or {@code null} to ignore raster basemaps
   * @param renderer  draws the map
   * @param resources closed with this instance, or {@code null}
   */
  public CountryMaps(BoundaryResolver resolver, RasterFetcher fetcher, MapRenderer renderer, Closeable resources) {
    this.resolver = resolver;
    this.fetcher = fetcher;
    this.renderer = renderer;
    this.resources = resources;
  }

  /** Returns an instance drawing boundaries from {@code store} without context layers or a world image. */
  public static CountryMaps of(BoundaryStore store, ComputeService service) {
    return new CountryMaps(
      new BoundaryResolver(store),
      service == null ? null : new RasterFetcher(service, MapsConfig.DEFAULT_DOWNLOAD_SCALE_MULTIPLIER),
      new MapRenderer(new BoundaryStoreContext(store), null),
      store
    );
  }

  /**
   * Returns an instance backed by the Natural Earth database, world image and Earth Engine credentials in
   * {@code config}.
   *
   * @throws IllegalArgumentException if {@code natural_earth} is not configured
   * @throws IOException              if the world image cannot be read
   */
  public static CountryMaps create(MapsConfig config) throws IOException {
    if (config.naturalEarth() == null) {
      throw new IllegalArgumentException("natural_earth must point to a Natural Earth sqlite file or zip");
    }
    WorldBackground world = config.worldImage() == null ? null : WorldBackground.read(config.worldImage());
    NaturalEarthDatabase database =
      new NaturalEarthDatabase(config.naturalEarth(), config.tmpDir(), config.keepUnzippedSources());
    BoundaryStore store = new NaturalEarthBoundaryStore(database);
    ContextSource context = new NaturalEarthContext(database);
    RasterFetcher fetcher = null;
    if (config.hasEarthEngineCredentials()) {
      fetcher = new RasterFetcher(EarthEngineClient.create(config), config);
    } else {
      LOGGER.debug("No Earth Engine credentials configured, raster basemaps are disabled");
    }
    return new CountryMaps(new BoundaryResolver(store), fetcher, new MapRenderer(context, world), database);
  }

  /**
   * Draws the map described by {@code request}.
   *
   * @throws org.redlist.maps.reader.RegionCodeTypeException    if the region code is not text
   * @throws org.redlist.maps.reader.InvalidRegionCodeException if the region code is not 2 letters
   * @throws org.redlist.maps.reader.RegionNotFoundException    if the region is unknown
   * @throws GeometryException                                  if the boundary cannot be projected
   * @throws IOException                                        if the PNG cannot be written
   */
  public RenderedMap render(RenderRequest request) throws GeometryException, IOException {
    try {
      LogUtil.setStage("resolve");
      ResolvedBoundary boundary = resolver.resolve(request.regionCode());

      Optional<RasterLayer> raster = Optional.empty();
      if (request.image().isPresent()) {
        LogUtil.setStage("fetch");
        raster = fetch(request, boundary);
      }

      LogUtil.setStage("render");
      return renderer.render(request, boundary, raster);
    } finally {
      LogUtil.clearStage();
    }
  }

  private Optional<RasterLayer> fetch(RenderRequest request, ResolvedBoundary boundary) {
    if (fetcher == null) {
      LOGGER.warn("No Earth Engine credentials configured. Skipping basemap layer.");
      return Optional.empty();
    }
    FetchResult result = fetcher.fetch(request.image().get(), boundary, request);
    if (result instanceof FetchResult.Degraded degraded) {
      LOGGER.warn(degraded.reason());
      LOGGER.debug("Raster download failure", degraded.cause());
    }
    return result.layer();
  }

  @Override
  public void close() throws IOException {
    if (resources != null) {
      resources.close();
    }
  }
}
