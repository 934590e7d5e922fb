package com.onthegomap.tilerunner;

import static com.onthegomap.tilerunner.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilerunner.budget.HostResources;
import com.onthegomap.tilerunner.budget.ResourceBudget;
import com.onthegomap.tilerunner.cleanup.CleanupRegistry;
import com.onthegomap.tilerunner.collect.CompletionRecord;
import com.onthegomap.tilerunner.config.Arguments;
import com.onthegomap.tilerunner.config.TileRunnerConfig;
import com.onthegomap.tilerunner.engine.Engine;
import com.onthegomap.tilerunner.engine.EngineCommand;
import com.onthegomap.tilerunner.engine.EngineResult;
import com.onthegomap.tilerunner.geo.ShapeMetrics;
import com.onthegomap.tilerunner.geojson.GeoJson;
import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import com.onthegomap.tilerunner.grid.AreaOfInterest;
import com.onthegomap.tilerunner.grid.CoverageLayer;
import com.onthegomap.tilerunner.grid.NoOverlappingDataException;
import com.onthegomap.tilerunner.grid.Tile;
import com.onthegomap.tilerunner.merge.AcceptanceFilter;
import com.onthegomap.tilerunner.merge.DissolveStrategy;
import com.onthegomap.tilerunner.merge.MergePlan;
import com.onthegomap.tilerunner.merge.MergeSpec;
import com.onthegomap.tilerunner.merge.RasterPatcher;
import com.onthegomap.tilerunner.worker.TileFailuresException;
import com.onthegomap.tilerunner.workspace.IsolationException;
import com.onthegomap.tilerunner.workspace.WorkspaceContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;

@Timeout(30)
class TileRunnerTest {

  @TempDir
  Path tmp;

  /** Splits the area 0..2000 into four 1000 unit tiles with a building crossing the border of tiles 1 and 2. */
  private static final Map<Integer, List<GeoJsonFeature>> BUILDINGS = Map.of(
    1, List.of(feature(rectangle(900, 100, 1000, 200), "Etagen", 2), feature(rectangle(10, 10, 12, 12), "Etagen", 1)),
    2, List.of(feature(rectangle(1000, 100, 1100, 200), "Etagen", 2)),
    3, List.of(feature(rectangle(100, 1100, 200, 1200), "Etagen", 5))
  );

  private static class BuildingAnalysis implements TiledAnalysis {

    private final List<CoverageLayer> coverage;

    BuildingAnalysis(List<CoverageLayer> coverage) {
      this.coverage = coverage;
    }

    BuildingAnalysis() {
      this(List.of());
    }

    @Override
    public String name() {
      return "buildings-test";
    }

    @Override
    public AreaOfInterest areaOfInterest() {
      return AreaOfInterest.of(new Envelope(0, 2000, 0, 2000));
    }

    @Override
    public EngineCommand command(Tile tile, ResourceBudget budget) {
      return EngineCommand.of("extract").with("tile", tile.id()).with("memory", budget.memoryPerWorkerMb());
    }

    @Override
    public List<CoverageLayer> coverage() {
      return coverage;
    }

    @Override
    public MergePlan mergePlan() {
      return MergePlan.of("buildings", MergeSpec.dissolve(DissolveStrategy.all()).exploded()
        .filter(AcceptanceFilter.minArea(50)));
    }
  }

  /** Engine that writes the buildings of each tile and reports them like a real worker would. */
  private static class FakeEngine implements Engine {

    private final Set<Integer> failing;
    private final Set<String> memory = ConcurrentHashMap.newKeySet();
    private final AtomicInteger calls = new AtomicInteger();

    FakeEngine(Integer... failing) {
      this.failing = Set.of(failing);
    }

    @Override
    public EngineResult execute(EngineCommand command, WorkspaceContext context)
      throws IOException {
      calls.incrementAndGet();
      memory.add(command.get("memory"));
      int tileId = Integer.parseInt(command.get("tile"));
      if (failing.contains(tileId)) {
        return EngineResult.failure(1, "ERROR: tile " + tileId + " is corrupt", Duration.ZERO);
      }
      var buildings = BUILDINGS.get(tileId);
      if (buildings == null) {
        CompletionRecord.skipped(context.name(), "no buildings").writeTo(context);
      } else {
        GeoJson.write(context.workspace().resolve("buildings.geojson"), buildings);
        CompletionRecord.success(context.name(), Map.of("buildings", "buildings.geojson"), List.of())
          .writeTo(context);
      }
      return EngineResult.success("processed tile " + tileId, Duration.ZERO);
    }
  }

  private TileRunner runner(Object... extraArgs) {
    Arguments args = Arguments.of(extraArgs).orElse(Arguments.of(
      "tmpdir", tmp.resolve("tmp"),
      "nprocs", 2,
      "memory", 400,
      "tile_size", 1000
    ));
    return TileRunner.create(TileRunnerConfig.from(args), new CleanupRegistry())
      .setHostResources(HostResources.of(4, 16_000));
  }

  private void assertTemporaryFilesRemoved() throws IOException {
    Path tmpDir = tmp.resolve("tmp");
    if (Files.exists(tmpDir)) {
      try (Stream<Path> children = Files.list(tmpDir)) {
        assertEquals(List.of(), children.toList());
      }
    }
  }

  @Test
  void testMergesSuccessfulTilesAndSkipsEmptyOnes() throws IOException {
    var engine = new FakeEngine();
    var runner = runner().setEngine(engine);
    Path output = tmp.resolve("out");

    RunResult result = runner.run(new BuildingAnalysis(), output);

    assertEquals(RunResult.Outcome.SUCCESS, result.outcome());
    assertEquals(0, result.exitCode());
    assertEquals(4, result.grid().tileCount());
    assertEquals(4, engine.calls.get());
    assertEquals(List.of(4), result.skippedTiles());
    assertEquals(List.of(), result.failedTiles());
    assertEquals(3, result.output().layer("buildings").sourceCount());
    assertEquals(Set.of("200"), engine.memory);
    assertTrue(result.peakConcurrency() <= 2);

    Path file = output.resolve("buildings.geojson");
    assertEquals(Map.of("buildings", file), result.written());
    List<GeoJsonFeature> merged = GeoJson.read(file);
    // the 2x2 building is removed by the area filter, the split one comes out whole
    assertEquals(2, merged.size());
    assertEquals(List.of(20_000.0, 10_000.0),
      merged.stream().map(f -> f.getDouble(ShapeMetrics.AREA)).sorted((a, b) -> Double.compare(b, a)).toList());
    assertEquals(List.of(1, 2), merged.stream().map(f -> ((Number) f.getTag("cat")).intValue()).toList());
    assertTemporaryFilesRemoved();
  }

  @Test
  void testFailFastThrowsAndCleansUp() throws IOException {
    var runner = runner("nprocs", 1).setEngine(new FakeEngine(2));
    var error = assertThrows(TileFailuresException.class, () -> runner.run(new BuildingAnalysis(), tmp.resolve("out")));
    assertEquals(List.of(2), error.failedTileIds());
    assertEquals(List.of(3, 4), error.notRun());
    assertTrue(error.failures().get(0).errorDetail().contains("tile 2 is corrupt"));
    assertFalse(Files.exists(tmp.resolve("out").resolve("buildings.geojson")));
    assertTemporaryFilesRemoved();
  }

  @Test
  void testCollectAllMergesWhatSucceeded() throws IOException {
    var runner = runner("failure_policy", "collect_all").setEngine(new FakeEngine(3));
    RunResult result = runner.run(new BuildingAnalysis(), tmp.resolve("out"));

    assertEquals(RunResult.Outcome.COMPLETED_WITH_FAILURES, result.outcome());
    assertEquals(1, result.exitCode());
    assertEquals(List.of(3), result.failedTiles());
    assertEquals(1, GeoJson.read(tmp.resolve("out").resolve("buildings.geojson")).size());
    assertTemporaryFilesRemoved();
  }

  @Test
  void testAllTilesSkipped() throws IOException {
    var runner = runner().setEngine((command, context) -> {
      CompletionRecord.skipped(context.name(), "nothing here").writeTo(context);
      return EngineResult.success("", Duration.ZERO);
    });
    RunResult result = runner.run(new BuildingAnalysis(), tmp.resolve("out"));

    assertEquals(RunResult.Outcome.NO_QUALIFYING_OUTPUT, result.outcome());
    assertEquals(0, result.exitCode());
    assertEquals(List.of(1, 2, 3, 4), result.skippedTiles());
    assertTrue(result.written().isEmpty());
    assertFalse(Files.exists(tmp.resolve("out").resolve("buildings.geojson")));
  }

  @Test
  void testRefusesToOverwriteWithoutForce() throws IOException {
    Path output = tmp.resolve("out");
    Files.createDirectories(output);
    Files.writeString(output.resolve("buildings.geojson"), "{}");
    var engine = new FakeEngine();

    assertThrows(IllegalArgumentException.class, () -> runner().setEngine(engine).run(new BuildingAnalysis(), output));
    assertEquals(0, engine.calls.get());

    RunResult result = runner("force", true).setEngine(engine).run(new BuildingAnalysis(), output);
    assertEquals(RunResult.Outcome.SUCCESS, result.outcome());
    assertEquals(2, GeoJson.read(output.resolve("buildings.geojson")).size());
  }

  @Test
  void testTilesWithoutDataAreNotRun() {
    var engine = new FakeEngine();
    var coverage = new CoverageLayer("ndsm", List.of(rectangle(1500, 500, 1600, 600)));
    RunResult result = runner().setEngine(engine).run(new BuildingAnalysis(List.of(coverage)), tmp.resolve("out"));

    assertEquals(1, engine.calls.get());
    assertEquals(List.of(2), result.grid().tiles().stream().map(Tile::id).toList());
    assertEquals(3, result.grid().discarded());
    assertEquals(1, result.budget().workerCount());
  }

  @Test
  void testNoOverlappingData() {
    var coverage = new CoverageLayer("ndsm", List.of(rectangle(5000, 5000, 5100, 5100)));
    var runner = runner().setEngine(new FakeEngine());
    assertThrows(NoOverlappingDataException.class,
      () -> runner.run(new BuildingAnalysis(List.of(coverage)), tmp.resolve("out")));
  }

  @Test
  void testForeignWorkspaceReportIsFatal() throws IOException {
    var runner = runner("failure_policy", "collect_all").setEngine((command, context) -> {
      CompletionRecord.skipped("tile_1_someoneelse", null).writeTo(context);
      return EngineResult.success("", Duration.ZERO);
    });
    assertThrows(IsolationException.class, () -> runner.run(new BuildingAnalysis(), tmp.resolve("out")));
    assertTemporaryFilesRemoved();
  }

  @Test
  void testRasterOutputsArePatched() throws IOException {
    List<String> patchInputs = new CopyOnWriteArrayList<>();
    var runner = runner().setEngine((command, context) -> {
      if (RasterPatcher.PATCH.equals(command.operation())) {
        patchInputs.add(command.get("input"));
        Files.writeString(Path.of(command.get("output")), "patched");
      } else if ("4".equals(command.get("tile"))) {
        CompletionRecord.skipped(context.name(), "no imagery").writeTo(context);
      } else {
        Files.writeString(context.workspace().resolve("tree_pixels.tif"), "tile " + command.get("tile"));
        CompletionRecord.success(context.name(), Map.of("tree_pixels", "tree_pixels.tif"), List.of())
          .writeTo(context);
      }
      return EngineResult.success("", Duration.ZERO);
    });
    var analysis = new BuildingAnalysis() {
      @Override
      public MergePlan mergePlan() {
        return MergePlan.raster("tree_pixels", "trees");
      }
    };

    RunResult result = runner.run(analysis, tmp.resolve("out"));

    assertEquals(RunResult.Outcome.SUCCESS, result.outcome());
    Path raster = tmp.resolve("out").resolve("trees.tif");
    assertEquals(Map.of("trees", raster), result.written());
    assertEquals("patched", Files.readString(raster));
    assertEquals(1, patchInputs.size());
    assertEquals(3, patchInputs.get(0).split(",").length);
    assertTemporaryFilesRemoved();

    assertThrows(IllegalArgumentException.class, () -> runner().run(analysis, tmp.resolve("out")));
  }

  @Test
  void testEngineExceptionIsTileFailure() {
    var runner = runner("failure_policy", "collect_all").setEngine((command, context) -> {
      throw new IOException("engine binary missing");
    });
    RunResult result = runner.run(new BuildingAnalysis(), tmp.resolve("out"));
    assertEquals(List.of(1, 2, 3, 4), result.failedTiles());
    assertEquals(1, result.exitCode());
  }
}
