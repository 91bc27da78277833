package org.redlist.maps.assessment;

import org.locationtech.jts.geom.Geometry;

/**
 * Extent of occurrence of an ecosystem.
 *
 * @param hull    the minimum convex polygon around every presence pixel, in lon/lat
 * @param areaKm2 area of {@code hull} in square kilometers
 */
public record EooResult(Geometry hull, double areaKm2) {}
