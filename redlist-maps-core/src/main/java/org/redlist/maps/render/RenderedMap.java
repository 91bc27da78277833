package org.redlist.maps.render;

import java.nio.file.Path;

/**
 * A map written to disk.
 *
 * @param outputPath the PNG file
 * @param frame      placement of the map inside the image
 */
public record RenderedMap(Path outputPath, MapFrame frame) {}
