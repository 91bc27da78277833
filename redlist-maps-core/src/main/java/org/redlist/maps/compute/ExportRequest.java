package org.redlist.maps.compute;

/**
 * Parameters of a batch export of an image into an asset.
 *
 * @param description human-readable task name
 * @param assetId     destination asset path, relative to the project or a full {@code projects/...} name
 * @param crsWkt      coordinate system of the exported pixels
 * @param scale       pixel size in meters
 * @param maxPixels   upper bound on exported pixels
 */
public record ExportRequest(String description, String assetId, String crsWkt, double scale, long maxPixels) {

  /** The service's own limit when a request does not raise it. */
  public static final long DEFAULT_MAX_PIXELS = 100_000_000;
}
