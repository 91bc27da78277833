package org.redlist.maps.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.stream.ImageInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

class PngWriterTest {

  /** Returns the resolution stored in a PNG's pHYs chunk. */
  static int readDpi(Path path) throws IOException {
    try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
      ImageReader reader = ImageIO.getImageReaders(in).next();
      try {
        reader.setInput(in);
        IIOMetadata metadata = reader.getImageMetadata(0);
        Node root = metadata.getAsTree("javax_imageio_png_1.0");
        Element physical = (Element) ((Element) root).getElementsByTagName("pHYs").item(0);
        assertEquals("meter", physical.getAttribute("unitSpecifier"));
        assertEquals(physical.getAttribute("pixelsPerUnitXAxis"), physical.getAttribute("pixelsPerUnitYAxis"));
        return (int) Math.round(Integer.parseInt(physical.getAttribute("pixelsPerUnitXAxis")) * 0.0254);
      } finally {
        reader.dispose();
      }
    }
  }

  @Test
  void testWritesImageWithDpi(@TempDir Path tempDir) throws IOException {
    BufferedImage image = new BufferedImage(3, 2, BufferedImage.TYPE_INT_ARGB);
    image.setRGB(1, 1, Color.RED.getRGB());
    Path path = tempDir.resolve("out.png");

    PngWriter.write(image, path, 300);

    BufferedImage read = ImageIO.read(path.toFile());
    assertEquals(3, read.getWidth());
    assertEquals(Color.RED.getRGB(), read.getRGB(1, 1));
    assertEquals(0, read.getRGB(0, 0) >>> 24);
    assertEquals(300, readDpi(path));
  }

  @Test
  void testReplacesExistingFile(@TempDir Path tempDir) throws IOException {
    Path path = tempDir.resolve("out.png");
    Files.write(path, new byte[100_000]);
    PngWriter.write(new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB), path, 72);
    assertEquals(2, ImageIO.read(path.toFile()).getWidth());
  }

  @Test
  void testMissingDirectoryFails(@TempDir Path tempDir) {
    Path path = tempDir.resolve("missing").resolve("out.png");
    assertThrows(IOException.class,
      () -> PngWriter.write(new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB), path, 72));
  }
}
