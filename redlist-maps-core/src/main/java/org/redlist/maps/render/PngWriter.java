package org.redlist.maps.render;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;

/**
 * Writes PNG files that record their resolution in a {@code pHYs} chunk.
 */
public class PngWriter {

  private static final double METERS_PER_INCH = 0.0254;
  // the standard javax_imageio_1.0 pixel size does not round-trip through pHYs, so write the native node
  private static final String PNG_FORMAT = "javax_imageio_png_1.0";

  private PngWriter() {}

  /**
   * Writes {@code image} to {@code path} tagged with {@code dpi}, replacing any existing file.
   *
   * @throws IOException if the file cannot be written
   */
  public static void write(BufferedImage image, Path path, int dpi) throws IOException {
    ImageWriter writer = ImageIO.getImageWritersByFormatName("png").next();
    try (
      OutputStream file = Files.newOutputStream(path);
      ImageOutputStream out = new MemoryCacheImageOutputStream(file)
    ) {
      IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image),
        writer.getDefaultWriteParam());
      metadata.mergeTree(PNG_FORMAT, resolution(dpi));
      writer.setOutput(out);
      writer.write(null, new IIOImage(image, null, metadata), writer.getDefaultWriteParam());
    } finally {
      writer.dispose();
    }
  }

  private static IIOMetadataNode resolution(int dpi) {
    String pixelsPerMeter = Long.toString(Math.round(dpi / METERS_PER_INCH));
    IIOMetadataNode physical = new IIOMetadataNode("pHYs");
    physical.setAttribute("pixelsPerUnitXAxis", pixelsPerMeter);
    physical.setAttribute("pixelsPerUnitYAxis", pixelsPerMeter);
    physical.setAttribute("unitSpecifier", "meter");
    IIOMetadataNode root = new IIOMetadataNode(PNG_FORMAT);
    root.appendChild(physical);
    return root;
  }
}
