package org.redlist.maps;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.redlist.maps.compute.FakeComputeService;
import org.redlist.maps.compute.Image;
import org.redlist.maps.config.Arguments;
import org.redlist.maps.config.MapsConfig;
import org.redlist.maps.reader.InvalidRegionCodeException;
import org.redlist.maps.reader.RegionCodeTypeException;
import org.redlist.maps.reader.RegionNotFoundException;
import org.redlist.maps.render.RenderedMap;

class CountryMapsTest {

  private static final Image ECOSYSTEM = Image.load("projects/test/assets/ecosystem");

  @TempDir
  Path tempDir;

  private RenderRequest.Builder request(Object code) {
    return RenderRequest.builder(code)
      .outputPath(tempDir.resolve("maps").resolve("out.png"))
      .dpi(30)
      .widthInches(6)
      .heightInches(4);
  }

  @Test
  void testRendersWithoutRaster() throws Exception {
    var service = new FakeComputeService();
    try (var maps = CountryMaps.of(TestUtils.boundaryStore(), service)) {
      RenderedMap map = maps.render(request("sg").title("Singapore").build());
      BufferedImage image = ImageIO.read(map.outputPath().toFile());
      assertEquals(180, image.getWidth());
      assertEquals(120, image.getHeight());
    }
    assertTrue(service.pixelRequests.isEmpty());
  }

  @Test
  void testRendersWithRaster() throws Exception {
    var service = new FakeComputeService().onPixels(image -> TestUtils.constantGeoTiff(8, 6, 1));
    try (var maps = CountryMaps.of(TestUtils.boundaryStore(), service)) {
      RenderedMap map = maps.render(request("SG").image(ECOSYSTEM).build());
      assertTrue(Files.size(map.outputPath()) > 0);
    }
    assertEquals(2, service.pixelRequests.size());
    assertEquals(service.grids.get(0), service.grids.get(1));
  }

  @Test
  void testRasterTimeoutStillWritesMap() throws Exception {
    var service = new FakeComputeService().onPixels(image -> {
      throw new HttpTimeoutException("request timed out");
    });
    try (var maps = CountryMaps.of(TestUtils.boundaryStore(), service)) {
      RenderedMap map = maps.render(request("SG").image(ECOSYSTEM).build());
      assertTrue(Files.isRegularFile(map.outputPath()));
    }
  }

  @Test
  void testNoServiceSkipsRaster() throws Exception {
    try (var maps = CountryMaps.of(TestUtils.boundaryStore(), null)) {
      RenderedMap map = maps.render(request("SG").image(ECOSYSTEM).build());
      assertTrue(Files.isRegularFile(map.outputPath()));
    }
  }

  @Test
  void testInvalidCodesFailBeforeAnyDownload() throws IOException {
    var service = new FakeComputeService().onPixels(image -> TestUtils.constantGeoTiff(2, 2, 1));
    try (var maps = CountryMaps.of(TestUtils.boundaryStore(), service)) {
      assertThrows(RegionCodeTypeException.class, () -> maps.render(request(12).image(ECOSYSTEM).build()));
      assertThrows(InvalidRegionCodeException.class, () -> maps.render(request("SGP").image(ECOSYSTEM).build()));
      assertThrows(RegionNotFoundException.class, () -> maps.render(request("ZZ").image(ECOSYSTEM).build()));
    }
    assertTrue(service.pixelRequests.isEmpty());
    assertTrue(Files.notExists(tempDir.resolve("maps").resolve("out.png")));
  }

  @Test
  void testCreateRequiresNaturalEarth() {
    var e = assertThrows(IllegalArgumentException.class,
      () -> CountryMaps.create(MapsConfig.from(Arguments.of("tmpdir", tempDir))));
    assertTrue(e.getMessage().contains("natural_earth"), e.getMessage());
  }
}
