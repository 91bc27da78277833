package org.redlist.maps.assessment;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.List;
import org.redlist.maps.compute.ComputeService;
import org.redlist.maps.compute.ExportRequest;
import org.redlist.maps.compute.Expression;
import org.redlist.maps.compute.Image;

/**
 * The global 10 x 10 km grid used for area of occupancy (AOO) in IUCN Red List of Ecosystems assessments, defined in
 * World Cylindrical Equal Area (ESRI:54034).
 *
 * @see <a href="https://www.iucnrle.org/rle-material-and-tools">Global 10 x 10-km grids suitable for use in IUCN Red
 *      List of Ecosystems assessments</a>
 */
public class AooGrid {

  public static final String CRS_WKT = """
    PROJCS["World_Cylindrical_Equal_Area",
        GEOGCS["WGS 84",
            DATUM["WGS_1984",
                SPHEROID["WGS 84",6378137,298.257223563,
                    AUTHORITY["EPSG","7030"]],
                AUTHORITY["EPSG","6326"]],
            PRIMEM["Greenwich",0],
            UNIT["Degree",0.0174532925199433]],
        PROJECTION["Cylindrical_Equal_Area"],
        PARAMETER["standard_parallel_1",0],
        PARAMETER["central_meridian",0],
        PARAMETER["false_easting",0],
        PARAMETER["false_northing",0],
        UNIT["metre",1,
            AUTHORITY["EPSG","9001"]],
        AXIS["Easting",EAST],
        AXIS["Northing",NORTH],
        AUTHORITY["ESRI","54034"]]""";

  /** Grid cell size in meters. */
  public static final double CELL_SIZE = 10_000;
  /**
   * Export pixel size in meters. Coarser exports fail on the service: without a scale the export is too large, and at
   * 10 km or 5 km the reprojection output is too large.
   */
  public static final double EXPORT_SCALE = 1_000;
  public static final int DEFAULT_MAX_PIXELS = 65_536;

  private AooGrid() {}

  /** Returns an expression evaluating to the grid projection with 10 km cells. */
  public static Expression projection() {
    return Expression.invoke("Projection",
      "crs", CRS_WKT,
      "transform", List.of(CELL_SIZE, 0d, 0d, 0d, CELL_SIZE, 0d));
  }

  /**
   * Returns the fraction of each grid cell covered by presence pixels of {@code classImage}, with empty cells masked.
   */
  public static Image fractionalCoverage(Image classImage, int maxPixels) {
    Image coverage = classImage
      .unmask(0)
      .reduceResolution(Expression.invoke("Reducer.mean"), false, maxPixels)
      .reproject(projection());
    return coverage.updateMask(coverage.gt(0));
  }

  /**
   * Starts an export of {@link #fractionalCoverage(Image, int)} into {@code assetId} and returns the operation
   * tracking it.
   */
  public static JsonNode exportFractionalCoverage(ComputeService service, Image classImage, String assetId,
    String description, int maxPixels) throws IOException, InterruptedException {
    return service.exportImage(
      fractionalCoverage(classImage, maxPixels),
      new ExportRequest(description, assetId, CRS_WKT, EXPORT_SCALE, ExportRequest.DEFAULT_MAX_PIXELS)
    );
  }
}
