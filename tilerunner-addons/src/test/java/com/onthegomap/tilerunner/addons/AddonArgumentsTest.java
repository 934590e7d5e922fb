package com.onthegomap.tilerunner.addons;

import static com.onthegomap.tilerunner.addons.AddonTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilerunner.budget.ResourceBudget;
import com.onthegomap.tilerunner.config.Arguments;
import com.onthegomap.tilerunner.geojson.GeoJson;
import com.onthegomap.tilerunner.grid.AreaOfInterest;
import com.onthegomap.tilerunner.grid.RasterAlignment;
import com.onthegomap.tilerunner.grid.Tile;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;

class AddonArgumentsTest {

  @TempDir
  Path tmp;

  @Test
  void testAreaFromBounds() {
    AreaOfInterest area = AddonArguments.areaOfInterest(Arguments.of("bounds", "0,0,2000,1000"));
    assertEquals(new Envelope(0, 2000, 0, 1000), area.extent());
    assertTrue(area.alignment().isEmpty());
  }

  @Test
  void testAreaFromFile() {
    Path file = tmp.resolve("area.geojson");
    GeoJson.write(file, List.of(
      feature(rectangle(0, 0, 100, 100)),
      feature(rectangle(100, 0, 300, 50))
    ));
    AreaOfInterest area = AddonArguments.areaOfInterest(Arguments.of("area", file));
    assertEquals(new Envelope(0, 300, 0, 100), area.extent());
    assertEquals(20_000, area.boundary().getArea(), 1e-6);
  }

  @Test
  void testAreaFileWinsOverBounds() {
    Path file = tmp.resolve("area.geojson");
    GeoJson.write(file, List.of(feature(rectangle(0, 0, 100, 100))));
    AreaOfInterest area = AddonArguments.areaOfInterest(Arguments.of("area", file, "bounds", "0,0,5000,5000"));
    assertEquals(new Envelope(0, 100, 0, 100), area.extent());
  }

  @Test
  void testMissingArea() {
    assertThrows(IllegalArgumentException.class, () -> AddonArguments.areaOfInterest(Arguments.of()));
  }

  @Test
  void testRasterAlignment() {
    AreaOfInterest area = AddonArguments.areaOfInterest(Arguments.of(
      "bounds", "0,0,10,10",
      "resolution", "0.5",
      "origin_x", "0.25"
    ));
    assertEquals(new RasterAlignment(0.5, 0.25, 0), area.alignment().orElseThrow());
  }

  @Test
  void testWorkerCommand() {
    Tile tile = new Tile(1, 0, 0, new Envelope(0, 1000, 0, 500), RasterAlignment.of(0.5));
    ResourceBudget budget = new ResourceBudget(2, 200, 400, List.of());
    assertEquals(
      List.of("worker", "n=500", "s=0", "e=1000", "w=0", "res=0.5", "memory=200"),
      AddonArguments.workerCommand("worker", tile, budget).toArgs()
    );
  }

  @Test
  void testWorkerCommandWithoutAlignment() {
    Tile tile = new Tile(3, 0, 2, new Envelope(2000, 2500.5, 0, 500), null);
    ResourceBudget budget = new ResourceBudget(1, 300, 300, List.of());
    assertEquals(
      List.of("worker", "n=500", "s=0", "e=2500.5", "w=2000", "memory=300"),
      AddonArguments.workerCommand("worker", tile, budget).toArgs()
    );
  }

  @Test
  void testOutputDir() {
    assertEquals(Path.of("data", "output"), AddonArguments.outputDir(Arguments.of()));
    assertEquals(tmp, AddonArguments.outputDir(Arguments.of("output_dir", tmp)));
  }
}
