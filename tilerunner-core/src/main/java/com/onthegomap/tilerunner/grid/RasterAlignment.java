package com.onthegomap.tilerunner.grid;

/**
 * Cell size and origin of the primary raster input, used to keep tile edges on raster cell boundaries.
 */
public record RasterAlignment(double resolution, double originX, double originY) {

  public RasterAlignment {
    if (!(resolution > 0) || Double.isInfinite(resolution)) {
      throw new IllegalArgumentException("raster resolution must be positive, got " + resolution);
    }
  }

  public static RasterAlignment of(double resolution) {
    return new RasterAlignment(resolution, 0, 0);
  }

  /** Returns the largest raster cell boundary on the x axis that is {@code <= x}. */
  public double snapDownX(double x) {
    return originX + Math.floor(round((x - originX) / resolution)) * resolution;
  }

  /** Returns the largest raster cell boundary on the y axis that is {@code <= y}. */
  public double snapDownY(double y) {
    return originY + Math.floor(round((y - originY) / resolution)) * resolution;
  }

  /** Returns {@code length} rounded up to a whole number of raster cells. */
  public double roundUpToCells(double length) {
    return Math.ceil(round(length / resolution)) * resolution;
  }

  /** Returns true if {@code length} is a whole number of raster cells. */
  public boolean isMultiple(double length) {
    double cells = round(length / resolution);
    return cells == Math.rint(cells);
  }

  // absorb floating point noise like 2.9999999999999996 cells
  private static double round(double cells) {
    double nearest = Math.rint(cells);
    return Math.abs(cells - nearest) < 1e-9 ? nearest : cells;
  }
}
