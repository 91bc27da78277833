package org.redlist.maps.render;

import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.proj4j.Proj4jException;
import org.redlist.maps.geo.MapProjection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A whole-world reference image in equirectangular (plate carrée) layout, reprojected under a map.
 * <p>
 * The image is sampled once per block of {@link #BLOCK_SIZE} output pixels, which is far below what the eye can tell
 * apart on a background layer.
 */
public class WorldBackground {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorldBackground.class);
  static final int BLOCK_SIZE = 4;

  private final BufferedImage image;

  public WorldBackground(BufferedImage image) {
    this.image = image;
  }

  /**
   * Reads the image at {@code path}.
   *
   * @throws IOException if the file cannot be read or is not an image
   */
  public static WorldBackground read(Path path) throws IOException {
    BufferedImage image = ImageIO.read(path.toFile());
    if (image == null) {
      throw new IOException("Not a readable image: " + path);
    }
    LOGGER.info("Loaded {}x{} world image from {}", image.getWidth(), image.getHeight(), path);
    return new WorldBackground(image);
  }

  /** Returns the image color at {@code lon, lat}. */
  int sample(double lon, double lat) {
    double wrapped = ((lon + 180) % 360 + 360) % 360;
    int x = (int) Math.floor(wrapped / 360 * image.getWidth());
    int y = (int) Math.floor((90 - lat) / 180 * image.getHeight());
    return image.getRGB(Math.min(image.getWidth() - 1, Math.max(0, x)),
      Math.min(image.getHeight() - 1, Math.max(0, y)));
  }

  /** Fills the map frame of {@code canvas} with the world image as seen through {@code projection}. */
  public void draw(Graphics2D graphics, MapCanvas canvas, MapProjection projection) {
    Rectangle frame = canvas.frame();
    int cols = (frame.width + BLOCK_SIZE - 1) / BLOCK_SIZE;
    int rows = (frame.height + BLOCK_SIZE - 1) / BLOCK_SIZE;
    BufferedImage reprojected = new BufferedImage(cols, rows, BufferedImage.TYPE_INT_ARGB);
    for (int row = 0; row < rows; row++) {
      for (int col = 0; col < cols; col++) {
        Point2D world = canvas.toWorld(frame.x + (col + 0.5) * BLOCK_SIZE, frame.y + (row + 0.5) * BLOCK_SIZE);
        try {
          Coordinate lonLat = projection.unproject(world.getX(), world.getY());
          if (Double.isFinite(lonLat.x) && Double.isFinite(lonLat.y) && Math.abs(lonLat.y) <= 90) {
            reprojected.setRGB(col, row, sample(lonLat.x, lonLat.y));
          }
        } catch (Proj4jException e) {
          LOGGER.trace("No world image pixel at {}", world);
        }
      }
    }
    graphics.drawImage(reprojected, frame.x, frame.y, cols * BLOCK_SIZE, rows * BLOCK_SIZE, null);
  }
}
