package com.onthegomap.tilerunner.grid;

import static com.onthegomap.tilerunner.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilerunner.geo.GeoUtils;
import com.onthegomap.tilerunner.geojson.GeoJson;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

class TileGridBuilderTest {

  private static void assertCovers(Envelope extent, TileGrid grid) throws Exception {
    Geometry union = GeoUtils.union(grid.tiles().stream().map(Tile::geometry).toList());
    assertTrue(union.covers(GeoUtils.toGeometry(extent)), "grid does not cover " + extent);
  }

  @Test
  void testSmallAreaIsOneTile() {
    var extent = new Envelope(100, 600, 200, 900);
    var grid = TileGridBuilder.build(AreaOfInterest.of(extent), 1000, List.of());
    assertEquals(1, grid.tileCount());
    var tile = grid.tiles().get(0);
    assertEquals(1, tile.id());
    assertEquals(extent, tile.extent());
  }

  @Test
  void testAreaExactlyOneTileWide() {
    var grid = TileGridBuilder.build(AreaOfInterest.of(new Envelope(0, 1000, 0, 1000)), 1000, List.of());
    assertEquals(1, grid.tileCount());
  }

  @Test
  void testTwoByTwoGrid() throws Exception {
    var extent = new Envelope(0, 2000, 0, 2000);
    var grid = TileGridBuilder.build(AreaOfInterest.of(extent), 1000, List.of());
    assertEquals(4, grid.tileCount());
    assertEquals(2, grid.rows());
    assertEquals(2, grid.columns());
    assertEquals(List.of(1, 2, 3, 4), grid.tiles().stream().map(Tile::id).toList());
    assertEquals(new Envelope(0, 1000, 0, 1000), grid.tiles().get(0).extent());
    assertEquals(new Envelope(1000, 2000, 0, 1000), grid.tiles().get(1).extent());
    assertEquals(new Envelope(0, 1000, 1000, 2000), grid.tiles().get(2).extent());
    assertCovers(extent, grid);
  }

  @ParameterizedTest
  @CsvSource({
    "150, 230, 2650, 1310, 1000",
    "-1234.5, -99.25, 3.5, 4000, 750",
    "0.1, 0.1, 0.9, 5000.1, 333.3",
  })
  void testGridCoversAreaWithoutGaps(double minX, double minY, double maxX, double maxY, double edge) throws Exception {
    var extent = new Envelope(minX, maxX, minY, maxY);
    var grid = TileGridBuilder.build(AreaOfInterest.of(extent), edge, List.of());
    assertCovers(extent, grid);
    assertEquals(grid.rows() * grid.columns(), grid.tileCount());
    for (Tile tile : grid.tiles()) {
      assertEquals(edge, tile.extent().getWidth(), 1e-6);
      assertEquals(tile.row() * grid.columns() + tile.column() + 1, tile.id());
    }
  }

  @Test
  void testNeighbouringTilesShareEdges() {
    var grid = TileGridBuilder.build(AreaOfInterest.of(new Envelope(0.1, 0.9, 0.1, 5000.1)), 333.3, List.of());
    List<Tile> tiles = grid.tiles();
    assertEquals(16, tiles.size());
    for (int i = 1; i < tiles.size(); i++) {
      assertEquals(tiles.get(i - 1).extent().getMaxY(), tiles.get(i).extent().getMinY(), 0d, tiles.get(i).toString());
    }
  }

  @Test
  void testOriginSnapsToMultipleOfEdge() {
    var grid = TileGridBuilder.build(AreaOfInterest.of(new Envelope(150, 2100, 230, 1200)), 1000, List.of());
    assertEquals(new Envelope(0, 1000, 0, 1000), grid.tiles().get(0).extent());
    assertEquals(3, grid.columns());
    assertEquals(2, grid.rows());
  }

  @Test
  void testRasterAlignmentRoundsEdgeUp() throws Exception {
    var alignment = new RasterAlignment(0.3, 0.1, 0.1);
    var extent = new Envelope(0.1, 2500.1, 0.1, 1500.1);
    var grid = TileGridBuilder.build(AreaOfInterest.of(extent).withAlignment(alignment), 1000, List.of());
    assertTrue(alignment.isMultiple(grid.tileEdge()), "edge " + grid.tileEdge());
    assertTrue(grid.tileEdge() >= 1000);
    for (Tile tile : grid.tiles()) {
      assertTrue(alignment.isMultiple(tile.extent().getMinX() - alignment.originX()), tile.toString());
      assertTrue(alignment.isMultiple(tile.extent().getMinY() - alignment.originY()), tile.toString());
      assertEquals(alignment, tile.alignment().orElseThrow());
    }
    assertCovers(extent, grid);
  }

  @Test
  void testCoverageFilterKeepsIds() {
    var coverage = new CoverageLayer("buildings", List.of(rectangle(1500, 1500, 1600, 1600)));
    var grid = TileGridBuilder.build(AreaOfInterest.of(new Envelope(0, 2000, 0, 2000)), 1000, List.of(coverage));
    assertEquals(1, grid.tileCount());
    assertEquals(4, grid.tiles().get(0).id());
    assertEquals(3, grid.discarded());
  }

  @Test
  void testCoverageTouchingTileBoundaryCounts() {
    var coverage = new CoverageLayer("trees", List.of(rectangle(900, 100, 1000, 200)));
    var grid = TileGridBuilder.build(AreaOfInterest.of(new Envelope(0, 2000, 0, 1000)), 1000, List.of(coverage));
    assertEquals(List.of(1, 2), grid.tiles().stream().map(Tile::id).toList());
  }

  @Test
  void testNoOverlappingData() {
    var coverage = new CoverageLayer("buildings", List.of(rectangle(5000, 5000, 5100, 5100)));
    var aoi = AreaOfInterest.of(new Envelope(0, 2000, 0, 2000));
    var error = assertThrows(NoOverlappingDataException.class,
      () -> TileGridBuilder.build(aoi, 1000, List.of(coverage)));
    assertTrue(error.getMessage().startsWith("no overlapping data"), error.getMessage());
  }

  @Test
  void testInvalidEdge() {
    var aoi = AreaOfInterest.of(new Envelope(0, 2000, 0, 2000));
    assertThrows(IllegalArgumentException.class, () -> TileGridBuilder.build(aoi, 0, List.of()));
    assertThrows(IllegalArgumentException.class, () -> TileGridBuilder.build(aoi, -5, List.of()));
    assertThrows(IllegalArgumentException.class, () -> TileGridBuilder.build(aoi, Double.NaN, List.of()));
  }

  @Test
  void testExplicitGrid() {
    var aoi = AreaOfInterest.of(new Envelope(0, 300, 0, 100));
    var grid = TileGridBuilder.fromExplicitGrid(List.of(
      rectangle(0, 0, 100, 100),
      rectangle(100, 0, 200, 100),
      rectangle(200, 0, 300, 100)
    ), aoi, List.of(new CoverageLayer("data", List.of(rectangle(150, 10, 250, 20)))));
    assertEquals(List.of(2, 3), grid.tiles().stream().map(Tile::id).toList());
    assertEquals(1, grid.discarded());
  }

  @Test
  void testGridFile(@TempDir Path tmp) {
    Path file = tmp.resolve("grid.geojson");
    GeoJson.write(file, List.of(
      feature(rectangle(100, 0, 200, 100), "cat", 7),
      feature(rectangle(0, 0, 100, 100), "cat", 3)
    ));
    var grid = TileGridBuilder.fromGridFile(file, AreaOfInterest.of(new Envelope(0, 200, 0, 100)), List.of());
    assertEquals(List.of(3, 7), grid.tiles().stream().map(Tile::id).toList());
    assertEquals(new Envelope(0, 100, 0, 100), grid.tiles().get(0).extent());
  }

  @Test
  void testGridFileDuplicateIds(@TempDir Path tmp) {
    Path file = tmp.resolve("grid.geojson");
    GeoJson.write(file, List.of(
      feature(rectangle(100, 0, 200, 100), "id", 1),
      feature(rectangle(0, 0, 100, 100), "id", 1)
    ));
    var aoi = AreaOfInterest.of(new Envelope(0, 200, 0, 100));
    assertThrows(IllegalArgumentException.class, () -> TileGridBuilder.fromGridFile(file, aoi, List.of()));
  }

  @Test
  void testTileIdMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new Tile(0, 0, 0, new Envelope(0, 1, 0, 1), null));
  }

  @Test
  void testRasterAlignment() {
    var alignment = RasterAlignment.of(0.5);
    assertTrue(alignment.isMultiple(1000));
    assertFalse(alignment.isMultiple(1000.2));
    assertEquals(1000.5, alignment.roundUpToCells(1000.2), 1e-9);
    assertEquals(10.0, alignment.snapDownX(10.3), 1e-9);
    assertEquals(0.6, RasterAlignment.of(0.2).roundUpToCells(0.6000000000000001), 1e-9);
    assertThrows(IllegalArgumentException.class, () -> RasterAlignment.of(0));
  }
}
