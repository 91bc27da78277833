package org.redlist.maps.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.redlist.maps.RenderRequest;
import org.redlist.maps.TestUtils;
import org.redlist.maps.geo.Extent;
import org.redlist.maps.geo.GeometryException;
import org.redlist.maps.raster.RasterBounds;
import org.redlist.maps.raster.RasterLayer;
import org.redlist.maps.reader.BoundaryResolver;
import org.redlist.maps.reader.BoundaryStoreContext;
import org.redlist.maps.reader.ContextSource;
import org.redlist.maps.reader.ResolvedBoundary;

class MapRendererTest {

  private static final int DPI = 40;

  @TempDir
  Path tempDir;

  private final ResolvedBoundary singapore;

  MapRendererTest() throws GeometryException {
    singapore = new BoundaryResolver(TestUtils.boundaryStore()).resolve("SG");
  }

  private RenderRequest.Builder request(String name) {
    return RenderRequest.builder("SG")
      .outputPath(tempDir.resolve(name))
      .dpi(DPI)
      .widthInches(6)
      .heightInches(4);
  }

  private static BufferedImage read(Path path) throws IOException {
    BufferedImage image = ImageIO.read(path.toFile());
    assertTrue(image != null, "not a PNG: " + path);
    return image;
  }

  private static RasterLayer fullFrameRaster(Extent extent, double value, boolean visible) {
    int width = 6;
    int height = 4;
    double[][][] values = new double[height][width][1];
    boolean[][] mask = new boolean[height][width];
    for (int row = 0; row < height; row++) {
      for (int col = 0; col < width; col++) {
        values[row][col][0] = value;
        mask[row][col] = visible;
      }
    }
    return new RasterLayer(values, mask, new RasterBounds(extent.minX(), extent.maxX(), extent.minY(),
      extent.maxY()));
  }

  @Test
  void testWritesPngAtRequestedSize() throws IOException {
    RenderedMap map = new MapRenderer(ContextSource.NONE, null)
      .render(request("sg.png").title("Singapore").build(), singapore, Optional.empty());

    assertEquals(tempDir.resolve("sg.png"), map.outputPath());
    assertTrue(Files.size(map.outputPath()) > 0);
    BufferedImage image = read(map.outputPath());
    assertEquals(6 * DPI, image.getWidth());
    assertEquals(4 * DPI, image.getHeight());
    Rectangle frame = map.frame().bounds();
    assertTrue(new Rectangle(0, 0, image.getWidth(), image.getHeight()).contains(frame));
  }

  @Test
  void testCreatesParentDirectories() throws IOException {
    Path output = tempDir.resolve("nested").resolve("dir").resolve("map.png");
    new MapRenderer(ContextSource.NONE, null)
      .render(request("ignored.png").outputPath(output).build(), singapore, Optional.empty());
    assertTrue(Files.isRegularFile(output));
  }

  @Test
  void testSpinesDrawnOnlyWithGrid() throws IOException {
    MapRenderer renderer = new MapRenderer(ContextSource.NONE, null);
    RenderedMap withGrid = renderer.render(
      request("grid.png").showGrid(true).showSurroundingCountries(false).build(), singapore, Optional.empty());
    RenderedMap withoutGrid = renderer.render(
      request("nogrid.png").showGrid(false).showSurroundingCountries(false).build(), singapore, Optional.empty());

    assertTrue(withGrid.frame().leftSpineVisible());
    assertTrue(withGrid.frame().bottomSpineVisible());
    assertTrue(withGrid.frame().anySpineVisible());
    assertFalse(withoutGrid.frame().anySpineVisible());
    assertEquals(withGrid.frame().bounds(), withoutGrid.frame().bounds());

    Rectangle frame = withGrid.frame().bounds();
    int x = frame.x;
    int y = frame.y + frame.height / 2;
    assertNotEquals(Color.WHITE.getRGB(), read(withGrid.outputPath()).getRGB(x, y));
    assertEquals(Color.WHITE.getRGB(), read(withoutGrid.outputPath()).getRGB(x, y));
  }

  @Test
  void testFullyMaskedRasterLeavesMapUnchanged() throws IOException {
    MapRenderer renderer = new MapRenderer(ContextSource.NONE, null);
    RenderedMap without = renderer.render(request("plain.png").build(), singapore, Optional.empty());
    RenderedMap masked = renderer.render(request("masked.png").build(), singapore,
      Optional.of(fullFrameRaster(singapore.extent(), 1, false)));

    BufferedImage a = read(without.outputPath());
    BufferedImage b = read(masked.outputPath());
    for (int y = 0; y < a.getHeight(); y++) {
      for (int x = 0; x < a.getWidth(); x++) {
        assertEquals(a.getRGB(x, y), b.getRGB(x, y), "pixel " + x + "," + y);
      }
    }
  }

  @Test
  void testVisibleRasterIsDrawnUnderRegion() throws IOException {
    RenderedMap map = new MapRenderer(ContextSource.NONE, null).render(
      request("raster.png").showGrid(false).showSurroundingCountries(false).build(), singapore,
      Optional.of(fullFrameRaster(singapore.extent(), 1, true)));

    BufferedImage image = read(map.outputPath());
    Rectangle frame = map.frame().bounds();
    assertEquals(Colormap.PRESENT.getRGB(), image.getRGB(frame.x + 2, frame.y + 2));
    assertEquals(Color.WHITE.getRGB(), image.getRGB(1, 1));
  }

  @Test
  void testSurroundingCountriesDrawnAroundRegion() throws IOException {
    MapRenderer renderer = new MapRenderer(new BoundaryStoreContext(TestUtils.boundaryStore()), null);
    RenderedMap map = renderer.render(request("context.png").showGrid(false).build(), singapore, Optional.empty());
    BufferedImage image = read(map.outputPath());
    Rectangle frame = map.frame().bounds();
    // corner of the frame is outside Singapore and the store has no ocean layer
    assertEquals(Color.WHITE.getRGB(), image.getRGB(frame.x + 1, frame.y + 1));
  }

  @Test
  void testWorldBackgroundIsSampled() throws IOException {
    BufferedImage world = new BufferedImage(36, 18, BufferedImage.TYPE_INT_RGB);
    for (int y = 0; y < 18; y++) {
      for (int x = 0; x < 36; x++) {
        world.setRGB(x, y, Color.MAGENTA.getRGB());
      }
    }
    RenderedMap map = new MapRenderer(ContextSource.NONE, new WorldBackground(world)).render(
      request("world.png").showGrid(false).build(), singapore, Optional.empty());
    BufferedImage image = read(map.outputPath());
    Rectangle frame = map.frame().bounds();
    assertEquals(Color.MAGENTA.getRGB(), image.getRGB(frame.x + 1, frame.y + 1));
  }

  @Test
  void testAxisLabels() {
    assertEquals("Easting (km) - UTM Zone 48N", MapRenderer.xAxisLabel(singapore));
    assertEquals("351", MapRenderer.kilometers(350_600));
    assertEquals("0", MapRenderer.kilometers(-200));
    assertEquals("-12", MapRenderer.kilometers(-12_000));
    assertEquals(4.1666f, MapRenderer.points(0.5, 600), 1e-3f);
  }

  @Test
  void testPngCarriesDpi() throws IOException {
    RenderedMap map = new MapRenderer(ContextSource.NONE, null)
      .render(request("dpi.png").build(), singapore, Optional.empty());
    assertEquals(DPI, PngWriterTest.readDpi(map.outputPath()));
  }
}
