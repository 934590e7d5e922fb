package com.onthegomap.tilerunner.addons;

import static com.onthegomap.tilerunner.addons.AddonTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilerunner.RunResult;
import com.onthegomap.tilerunner.config.Arguments;
import com.onthegomap.tilerunner.engine.EngineCommand;
import com.onthegomap.tilerunner.geo.ShapeMetrics;
import com.onthegomap.tilerunner.geojson.GeoJson;
import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(30)
class ExtractGreenRoofsTest {

  private static final List<GeoJsonFeature> BUILDINGS = List.of(
    feature(rectangle(900, 100, 1100, 200), "building_cat", 1),
    feature(rectangle(1500, 500, 1600, 600), "building_cat", 2),
    feature(rectangle(100, 1100, 200, 1200), "building_cat", 3)
  );

  @TempDir
  Path tmp;
  private Path buildings;

  @BeforeEach
  void writeBuildings() {
    buildings = tmp.resolve("buildings.geojson");
    GeoJson.write(buildings, BUILDINGS);
  }

  private Arguments args(Object... extra) {
    return Arguments.of(extra).orElse(Arguments.of(
      "bounds", "0,0,2000,2000",
      "ndsm", "ndsm",
      "ndvi", "ndvi",
      "red", "dop_r",
      "green", "dop_g",
      "blue", "dop_b",
      "gb_thresh", "145",
      "buildings", buildings
    ));
  }

  @Test
  void testCommand() {
    var engine = new ClippingEngine(Map.of());
    runner(tmp, engine).run(ExtractGreenRoofs.from(args("trees", "trees_2021")), tmp.resolve("out"));

    assertEquals(3, engine.commands.size(), "the tile without buildings is not processed");
    EngineCommand command = engine.commands.get(0);
    assertEquals(ExtractGreenRoofs.WORKER, command.operation());
    assertEquals("ndsm", command.get("ndom"));
    assertEquals("dop_g", command.get("green"));
    assertEquals("145", command.get("gb_thresh"));
    assertEquals("trees_2021", command.get("trees"));
    assertNull(command.get("fnk"));
    assertEquals(buildings.toString(), command.get("buildings"));
    assertEquals("vegetation", command.get("output_vegetation"));
    assertTrue(command.flags().isEmpty());
  }

  @Test
  void testGreenBlueThresholdRequired() {
    var withPercentile = args("gb_perc", "20");
    assertThrows(IllegalArgumentException.class, () -> ExtractGreenRoofs.from(withPercentile));
    var withoutThreshold = Arguments.of("bounds", "0,0,1,1", "ndsm", "a", "ndvi", "b", "red", "r", "green", "g",
      "blue", "b", "buildings", buildings);
    assertThrows(IllegalArgumentException.class, () -> ExtractGreenRoofs.from(withoutThreshold));
  }

  @Test
  void testOutputsMustDiffer() {
    var args = args("output_buildings", "roofs", "output_vegetation", "roofs");
    assertThrows(IllegalArgumentException.class, () -> ExtractGreenRoofs.from(args));
  }

  @Test
  void testVegetationProportion() {
    var engine = new ClippingEngine(Map.of(
      ExtractGreenRoofs.BUILDINGS, BUILDINGS,
      ExtractGreenRoofs.VEGETATION, List.of(
        // 30% of building 1, split by a tile border
        feature(rectangle(950, 120, 1050, 180), "building_cat", 1),
        // 0.5% of building 2
        feature(rectangle(1500, 500, 1510, 505), "building_cat", 2),
        // smaller than min_veg_size
        feature(rectangle(1590, 590, 1591, 591), "building_cat", 2)
      )
    ));
    RunResult result = runner(tmp, engine).run(ExtractGreenRoofs.from(args()), tmp.resolve("out"));

    assertEquals(RunResult.Outcome.SUCCESS, result.outcome());
    assertEquals(List.of("greenroof_buildings", "greenroof_vegetation"), List.copyOf(result.written().keySet()));

    GeoJsonFeature roof = only(GeoJson.read(result.written().get("greenroof_buildings")));
    assertEquals(1, roof.getDouble("building_cat"));
    assertEquals(20_000, roof.getDouble(ShapeMetrics.AREA), 1e-6);
    assertEquals(30, roof.getDouble(ExtractGreenRoofs.VEG_PROPORTION), 1e-6);

    GeoJsonFeature vegetation = only(GeoJson.read(result.written().get("greenroof_vegetation")));
    assertEquals(1, vegetation.getDouble("building_cat"));
    assertEquals(6_000, vegetation.getDouble(ShapeMetrics.AREA), 1e-6);
  }

  @Test
  void testLowerProportionKeepsMoreRoofs() {
    var engine = new ClippingEngine(Map.of(
      ExtractGreenRoofs.BUILDINGS, BUILDINGS,
      ExtractGreenRoofs.VEGETATION, List.of(feature(rectangle(1500, 500, 1510, 505), "building_cat", 2))
    ));
    RunResult result = runner(tmp, engine).run(ExtractGreenRoofs.from(args("min_veg_proportion", "0.1")),
      tmp.resolve("out"));

    GeoJsonFeature roof = only(GeoJson.read(result.written().get("greenroof_buildings")));
    assertEquals(2, roof.getDouble("building_cat"));
    assertEquals(1, roof.getDouble("cat"), "cat is renumbered after dropping buildings 1 and 3");
    assertEquals(0.5, roof.getDouble(ExtractGreenRoofs.VEG_PROPORTION), 1e-6);
    GeoJsonFeature vegetation = only(GeoJson.read(result.written().get("greenroof_vegetation")));
    assertEquals(1, vegetation.getDouble("cat"));
  }
}
