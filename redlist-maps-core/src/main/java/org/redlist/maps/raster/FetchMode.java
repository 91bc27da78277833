package org.redlist.maps.raster;

/**
 * How a remote raster is turned into colors.
 */
public enum FetchMode {
  /** Download raw values and color them locally with the request's visualization. */
  RAW_VALUES,
  /** Ask the service for an 8-bit RGB rendering of the visualization and draw it as is. */
  VISUALIZED
}
