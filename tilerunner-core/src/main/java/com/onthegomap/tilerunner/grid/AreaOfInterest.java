package com.onthegomap.tilerunner.grid;

import com.onthegomap.tilerunner.geo.GeoUtils;
import java.util.Optional;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

/**
 * The whole extent to process: a boundary and, when there is a primary raster input, the raster grid tiles must align
 * with.
 */
public record AreaOfInterest(Geometry boundary, RasterAlignment rasterAlignment) {

  public AreaOfInterest {
    if (boundary == null || boundary.isEmpty()) {
      throw new IllegalArgumentException("area of interest must not be empty");
    }
  }

  public static AreaOfInterest of(Envelope extent) {
    return new AreaOfInterest(GeoUtils.toGeometry(extent), null);
  }

  public static AreaOfInterest of(Geometry boundary) {
    return new AreaOfInterest(boundary, null);
  }

  public AreaOfInterest withAlignment(RasterAlignment alignment) {
    return new AreaOfInterest(boundary, alignment);
  }

  public Envelope extent() {
    return boundary.getEnvelopeInternal();
  }

  public Optional<RasterAlignment> alignment() {
    return Optional.ofNullable(rasterAlignment);
  }
}
