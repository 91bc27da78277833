package org.redlist.maps.raster;

import java.util.Optional;

/**
 * The outcome of fetching a remote raster: either the decoded layer or the reason the map has to be drawn without it.
 */
public interface FetchResult {

  static Success success(RasterLayer layer) {
    return new Success(layer);
  }

  static Degraded degraded(String reason, Exception cause) {
    return new Degraded(reason, cause);
  }

  /** Returns the layer if the fetch succeeded. */
  Optional<RasterLayer> layer();

  default boolean isSuccess() {
    return layer().isPresent();
  }

  record Success(RasterLayer get) implements FetchResult {

    @Override
    public Optional<RasterLayer> layer() {
      return Optional.of(get);
    }
  }

  /**
   * The raster could not be fetched or decoded.
   *
   * @param reason human-readable warning
   * @param cause  the underlying error
   */
  record Degraded(String reason, Exception cause) implements FetchResult {

    @Override
    public Optional<RasterLayer> layer() {
      return Optional.empty();
    }
  }
}
