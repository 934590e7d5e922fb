package com.onthegomap.tilerunner;

import com.onthegomap.tilerunner.budget.ResourceBudget;
import com.onthegomap.tilerunner.collect.TileManifest;
import com.onthegomap.tilerunner.engine.EngineCommand;
import com.onthegomap.tilerunner.grid.AreaOfInterest;
import com.onthegomap.tilerunner.grid.CoverageLayer;
import com.onthegomap.tilerunner.grid.Tile;
import com.onthegomap.tilerunner.merge.MergePlan;
import com.onthegomap.tilerunner.merge.MergedOutput;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * An analysis that is too large for one pass and runs as one worker per tile.
 * <p>
 * Implementations provide the per-tile engine command and describe how the tile outputs are merged; {@link TileRunner}
 * does the tiling, scheduling, collecting and merging.
 */
public interface TiledAnalysis {

  /** Name used in logs and as the prefix of worker threads. */
  String name();

  /** Returns the extent to split into tiles. */
  AreaOfInterest areaOfInterest();

  /** Returns the engine call that processes {@code tile} with the memory {@code budget} grants one worker. */
  EngineCommand command(Tile tile, ResourceBudget budget);

  /** Returns the data a tile must overlap to be worth processing, empty to process every tile. */
  default List<CoverageLayer> coverage() {
    return List.of();
  }

  /** Returns a pre-built grid to use instead of a regular one. */
  default Optional<Path> gridFile() {
    return Optional.empty();
  }

  /** Returns which worker outputs are merged and how. */
  MergePlan mergePlan();

  /** Hook to adjust the merged layers before they are written, for example to compute run-wide statistics. */
  default MergedOutput postProcess(MergedOutput merged, TileManifest manifest) {
    return merged;
  }
}
