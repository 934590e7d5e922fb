package com.onthegomap.tilerunner.grid;

import com.onthegomap.tilerunner.geo.GeoUtils;
import java.util.Optional;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

/**
 * One cell of the grid the area of interest is split into.
 *
 * @param id     stable identifier for the run, used to name workspaces and to order results
 * @param row    row of the cell counted from the south, 0 for explicit grids
 * @param column column of the cell counted from the west
 */
public record Tile(int id, int row, int column, Envelope extent, RasterAlignment rasterAlignment) {

  public Tile {
    if (id < 1) {
      throw new IllegalArgumentException("tile id must be positive, got " + id);
    }
    extent = new Envelope(extent);
  }

  public Optional<RasterAlignment> alignment() {
    return Optional.ofNullable(rasterAlignment);
  }

  public Geometry geometry() {
    return GeoUtils.toGeometry(extent);
  }

  @Override
  public String toString() {
    return "Tile{id=" + id + ", row=" + row + ", column=" + column + ", extent=" + extent + "}";
  }
}
