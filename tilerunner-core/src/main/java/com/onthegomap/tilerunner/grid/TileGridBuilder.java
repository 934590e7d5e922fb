package com.onthegomap.tilerunner.grid;

import com.onthegomap.tilerunner.geojson.GeoJson;
import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits an {@link AreaOfInterest} into the {@link Tile tiles} one worker each will process.
 * <p>
 * Tile ids are assigned before cells without data are dropped, so a tile keeps the same id no matter which input data
 * is present: {@code row * columns + column + 1} with rows counted from the south.
 */
public class TileGridBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileGridBuilder.class);

  private TileGridBuilder() {}

  /**
   * Returns a regular grid of {@code tileEdge} sized cells covering the bounding box of {@code aoi}, keeping only cells
   * that overlap at least one of {@code coverage}.
   * <p>
   * When the area fits in one tile on both axes the result is a single tile equal to the extent of the area. Otherwise
   * the grid origin is snapped down to a multiple of {@code tileEdge} and then onto the raster grid of the area, if it
   * has one. A tile edge that is not a whole number of raster cells is rounded up to one.
   *
   * @param coverage layers with the data workers need, empty to keep every cell
   * @throws NoOverlappingDataException if no cell overlaps any coverage layer
   * @throws IllegalArgumentException   if {@code tileEdge} is not positive
   */
  public static TileGrid build(AreaOfInterest aoi, double tileEdge, List<CoverageLayer> coverage) {
    if (!(tileEdge > 0) || Double.isInfinite(tileEdge)) {
      throw new IllegalArgumentException("tile edge must be positive, got " + tileEdge);
    }
    Envelope extent = aoi.extent();
    RasterAlignment alignment = aoi.rasterAlignment();

    if (extent.getWidth() <= tileEdge && extent.getHeight() <= tileEdge) {
      LOGGER.info("Area of interest fits in one tile of {} units, not splitting it", tileEdge);
      return filter(List.of(new Tile(1, 0, 0, extent, alignment)), 1, 1, tileEdge, coverage);
    }

    double edge = tileEdge;
    if (alignment != null && !alignment.isMultiple(edge)) {
      edge = alignment.roundUpToCells(edge);
      LOGGER.warn("Tile edge {} is not a multiple of the raster resolution {}, using {}", tileEdge,
        alignment.resolution(), edge);
    }

    double minX = Math.floor(extent.getMinX() / edge) * edge;
    double minY = Math.floor(extent.getMinY() / edge) * edge;
    if (alignment != null) {
      minX = alignment.snapDownX(minX);
      minY = alignment.snapDownY(minY);
    }
    int columns = cellsToCover(minX, extent.getMaxX(), edge);
    int rows = cellsToCover(minY, extent.getMaxY(), edge);

    List<Tile> tiles = new ArrayList<>(rows * columns);
    for (int row = 0; row < rows; row++) {
      for (int column = 0; column < columns; column++) {
        // neighbours share the same expression for their common edge
        var cell = new Envelope(minX + column * edge, minX + (column + 1) * edge, minY + row * edge,
          minY + (row + 1) * edge);
        tiles.add(new Tile(row * columns + column + 1, row, column, cell, alignment));
      }
    }
    LOGGER.info("Created grid of {} rows x {} columns with {} unit tiles", rows, columns, edge);
    return filter(tiles, rows, columns, edge, coverage);
  }

  /**
   * Returns one tile per cell of a grid that was built beforehand, numbered {@code 1..n} in the order given, keeping
   * only cells that overlap at least one of {@code coverage}.
   */
  public static TileGrid fromExplicitGrid(List<Geometry> cells, AreaOfInterest aoi, List<CoverageLayer> coverage) {
    List<Tile> tiles = new ArrayList<>(cells.size());
    for (int i = 0; i < cells.size(); i++) {
      tiles.add(new Tile(i + 1, 0, i, cells.get(i).getEnvelopeInternal(), aoi.rasterAlignment()));
    }
    return fromTiles(tiles, coverage);
  }

  /**
   * Returns one tile per feature of a GeoJSON grid file, using the {@code cat} or {@code id} property of each feature
   * as the tile id when it has one.
   *
   * @throws IllegalArgumentException if two cells have the same id
   */
  public static TileGrid fromGridFile(Path gridFile, AreaOfInterest aoi, List<CoverageLayer> coverage) {
    List<GeoJsonFeature> cells = GeoJson.read(gridFile);
    List<Tile> tiles = new ArrayList<>(cells.size());
    for (int i = 0; i < cells.size(); i++) {
      GeoJsonFeature cell = cells.get(i);
      int id = cellId(cell, i + 1);
      tiles.add(new Tile(id, 0, i, cell.geometry().getEnvelopeInternal(), aoi.rasterAlignment()));
    }
    tiles.sort((a, b) -> Integer.compare(a.id(), b.id()));
    return fromTiles(tiles, coverage);
  }

  private static TileGrid fromTiles(List<Tile> tiles, List<CoverageLayer> coverage) {
    if (tiles.isEmpty()) {
      throw new IllegalArgumentException("explicit grid has no cells");
    }
    Set<Integer> ids = new HashSet<>();
    for (Tile tile : tiles) {
      if (!ids.add(tile.id())) {
        throw new IllegalArgumentException("duplicate tile id " + tile.id() + " in explicit grid");
      }
    }
    return filter(tiles, 1, tiles.size(), 0, coverage);
  }

  private static int cellId(GeoJsonFeature cell, int fallback) {
    for (String key : List.of("cat", "id")) {
      double value = cell.getDouble(key);
      if (!Double.isNaN(value) && value >= 1 && value == Math.rint(value)) {
        return (int) value;
      }
    }
    return fallback;
  }

  private static int cellsToCover(double min, double max, double edge) {
    double cells = (max - min) / edge;
    double rounded = Math.rint(cells);
    // absorb floating point noise so 2.0000000001 cells does not add a column
    int result = Math.abs(cells - rounded) < 1e-9 ? (int) rounded : (int) Math.ceil(cells);
    return Math.max(1, result);
  }

  private static TileGrid filter(List<Tile> tiles, int rows, int columns, double edge, List<CoverageLayer> coverage) {
    if (coverage.isEmpty()) {
      return new TileGrid(tiles, rows, columns, edge, 0);
    }
    List<Tile> kept = new ArrayList<>();
    for (Tile tile : tiles) {
      for (CoverageLayer layer : coverage) {
        if (layer.intersects(tile.extent())) {
          kept.add(tile);
          break;
        }
      }
    }
    int discarded = tiles.size() - kept.size();
    if (kept.isEmpty()) {
      throw new NoOverlappingDataException(
        "no overlapping data: none of the " + tiles.size() + " tiles overlaps " + coverage);
    }
    if (discarded > 0) {
      LOGGER.info("Skipping {} of {} tiles that overlap none of {}", discarded, tiles.size(), coverage);
    }
    return new TileGrid(kept, rows, columns, edge, discarded);
  }
}
