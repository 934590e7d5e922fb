package com.onthegomap.tilerunner.geo;

import org.locationtech.jts.geom.Geometry;

/**
 * Shape measures attached to every merged feature before acceptance filters run.
 */
public class ShapeMetrics {

  public static final String AREA = "area_sqm";
  public static final String FRACTAL_DIMENSION = "fractal_d";

  private ShapeMetrics() {}

  /** Returns the planar area of {@code geometry} in square map units. */
  public static double area(Geometry geometry) {
    return geometry.getArea();
  }

  /**
   * Returns the fractal dimension {@code 2 * ln(perimeter) / ln(area)} of {@code geometry}.
   * <p>
   * Compact shapes approach 1, ragged outlines approach 2. Returns {@link Double#NaN} when the value is undefined,
   * which is when the area is at most 1 square unit or the perimeter is 0.
   */
  public static double fractalDimension(Geometry geometry) {
    double area = geometry.getArea();
    double perimeter = geometry.getLength();
    if (area <= 1 || perimeter <= 0) {
      return Double.NaN;
    }
    return 2 * Math.log(perimeter) / Math.log(area);
  }
}
