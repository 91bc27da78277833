package org.redlist.maps.config;

import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.lang3.StringUtils;

/**
 * Holder for common parameters used by many components in redlist-maps.
 */
public record MapsConfig(
  Arguments arguments,
  String httpUserAgent,
  Duration httpTimeout,
  String earthEngineBaseUrl,
  String earthEngineProject,
  String earthEngineAccessToken,
  Path naturalEarth,
  Path worldImage,
  Path tmpDir,
  boolean keepUnzippedSources,
  int downloadScaleMultiplier
) {

  public static final String DEFAULT_EARTH_ENGINE_URL = "https://earthengine.googleapis.com";
  public static final int DEFAULT_DOWNLOAD_SCALE_MULTIPLIER = 4;

  public MapsConfig {
    if (downloadScaleMultiplier <= 0) {
      throw new IllegalArgumentException(
        "download_scale_multiplier must be > 0, was " + downloadScaleMultiplier);
    }
    if (httpTimeout.isNegative() || httpTimeout.isZero()) {
      throw new IllegalArgumentException("http_timeout must be positive, was " + httpTimeout);
    }
  }

  public static MapsConfig defaults() {
    return from(Arguments.of());
  }

  public static MapsConfig from(Arguments arguments) {
    return new MapsConfig(
      arguments,
      arguments.getString("http_user_agent", "User-Agent header to set when calling remote services",
        "redlist-maps (https://github.com/redlist/redlist-maps)"),
      arguments.getDuration("http_timeout", "Timeout to use for each remote raster or compute request", "5m"),
      arguments.getString("ee_base_url", "Earth Engine REST endpoint", DEFAULT_EARTH_ENGINE_URL),
      arguments.getString("ee_project|google_cloud_project", "Google Cloud project used for Earth Engine calls",
        null),
      arguments.getString("ee_access_token", "OAuth2 access token for Earth Engine calls", null),
      arguments.inputFile("natural_earth", "Natural Earth sqlite file (or zip containing it) with country boundaries",
        null),
      arguments.inputFile("world_image", "equirectangular world image drawn as the reference background", null),
      arguments.file("tmpdir", "temp directory", Path.of("data", "tmp")),
      arguments.getBoolean("keep_unzipped", "keep unzipped sources around after running", false),
      arguments.getInteger("download_scale_multiplier",
        "raster download budget: longest extent side / (dpi * multiplier) gives the pixel size",
        DEFAULT_DOWNLOAD_SCALE_MULTIPLIER)
    );
  }

  /** Returns true if enough information is configured to call the remote compute service. */
  public boolean hasEarthEngineCredentials() {
    return StringUtils.isNotBlank(earthEngineAccessToken);
  }
}
