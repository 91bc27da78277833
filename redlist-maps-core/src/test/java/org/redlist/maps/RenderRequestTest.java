package org.redlist.maps;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.redlist.maps.compute.Image;
import org.redlist.maps.compute.Visualization;
import org.redlist.maps.config.Arguments;
import org.redlist.maps.raster.FetchMode;

class RenderRequestTest {

  @Test
  void testDefaults() {
    RenderRequest request = RenderRequest.builder("SG").build();
    assertEquals("SG", request.regionCode());
    assertEquals(Path.of("sg.png"), request.outputPath());
    assertTrue(request.showBorder());
    assertTrue(request.showGrid());
    assertTrue(request.showSurroundingCountries());
    assertTrue(request.showWorldBackground());
    assertEquals("white", request.fillColor());
    assertEquals("black", request.edgeColor());
    assertEquals(1.5, request.edgeWidth());
    assertEquals(Optional.empty(), request.title());
    assertEquals(300, request.dpi());
    assertEquals(3600, request.widthPixels());
    assertEquals(2400, request.heightPixels());
    assertEquals(Optional.empty(), request.image());
    assertFalse(request.clipImage());
    assertEquals(Visualization.DEFAULT, request.visualization());
    assertEquals(FetchMode.RAW_VALUES, request.fetchMode());
    assertTrue(request.hasFill());
  }

  @Test
  void testFillNone() {
    assertFalse(RenderRequest.builder("SG").fillColor("none").build().hasFill());
    assertFalse(RenderRequest.builder("SG").fillColor("None").build().hasFill());
    assertTrue(RenderRequest.builder("SG").fillColor(null).build().hasFill());
  }

  @Test
  void testEmptyTitleIsNoTitle() {
    assertEquals(Optional.empty(), RenderRequest.builder("SG").title("").build().title());
    assertEquals(Optional.of("Singapore"), RenderRequest.builder("SG").title("Singapore").build().title());
  }

  @Test
  void testValidation() {
    assertThrows(IllegalArgumentException.class, () -> RenderRequest.builder("SG").dpi(0).build());
    assertThrows(IllegalArgumentException.class, () -> RenderRequest.builder("SG").widthInches(0).build());
    assertThrows(IllegalArgumentException.class, () -> RenderRequest.builder("SG").heightInches(-1).build());
    assertThrows(IllegalArgumentException.class, () -> RenderRequest.builder("SG").edgeWidth(-1).build());
  }

  @Test
  void testNonTextCodeStillGetsOutputPath() {
    assertEquals(Path.of("123.png"), RenderRequest.builder(123).build().outputPath());
  }

  @Test
  void testFromArguments() {
    RenderRequest request = RenderRequest.fromArguments("mm", Arguments.of(
      "output", "out/myanmar.png",
      "grid", "false",
      "surrounding", "false",
      "fill_color", "none",
      "edge_width", "0.5",
      "title", "Myanmar",
      "dpi", "150",
      "width", "10",
      "height", "6",
      "image", "projects/test/assets/ecosystem",
      "bands", "classification",
      "clip_image", "true",
      "vis_min", "0",
      "vis_max", "1",
      "palette", "lightgray,darkgreen",
      "fetch_mode", "visualized"
    ));

    assertEquals(Path.of("out/myanmar.png"), request.outputPath());
    assertFalse(request.showGrid());
    assertFalse(request.showSurroundingCountries());
    assertTrue(request.showBorder());
    assertFalse(request.hasFill());
    assertEquals(0.5, request.edgeWidth());
    assertEquals(Optional.of("Myanmar"), request.title());
    assertEquals(1500, request.widthPixels());
    assertEquals(900, request.heightPixels());
    assertEquals(Optional.of(Image.load("projects/test/assets/ecosystem").select("classification")), request.image());
    assertTrue(request.clipImage());
    assertEquals(new Visualization(0d, 1d, List.of("lightgray", "darkgreen")), request.visualization());
    assertEquals(FetchMode.VISUALIZED, request.fetchMode());
  }

  @Test
  void testFromArgumentsDefaults() {
    RenderRequest request = RenderRequest.fromArguments("MM", Arguments.of());
    assertEquals(Path.of("mm.png"), request.outputPath());
    assertEquals(Visualization.DEFAULT, request.visualization());
    assertEquals(Optional.empty(), request.image());
    assertEquals(Optional.empty(), request.title());
  }

  @Test
  void testImageCollection() {
    RenderRequest request = RenderRequest.fromArguments("MM", Arguments.of("image_collection", "projects/x/tiles"));
    assertEquals(Optional.of(Image.mosaic("projects/x/tiles")), request.image());
  }
}
