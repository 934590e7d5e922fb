package com.onthegomap.tilerunner.addons;

import com.onthegomap.tilerunner.RunResult;
import com.onthegomap.tilerunner.TileRunner;
import com.onthegomap.tilerunner.TiledAnalysis;
import com.onthegomap.tilerunner.budget.ResourceBudget;
import com.onthegomap.tilerunner.collect.TileManifest;
import com.onthegomap.tilerunner.config.Arguments;
import com.onthegomap.tilerunner.engine.EngineCommand;
import com.onthegomap.tilerunner.geo.ShapeMetrics;
import com.onthegomap.tilerunner.grid.AreaOfInterest;
import com.onthegomap.tilerunner.grid.Tile;
import com.onthegomap.tilerunner.merge.AcceptanceFilter;
import com.onthegomap.tilerunner.merge.MergePlan;
import com.onthegomap.tilerunner.merge.MergeSpec;
import com.onthegomap.tilerunner.merge.MergedLayer;
import com.onthegomap.tilerunner.merge.MergedOutput;
import com.onthegomap.tilerunner.merge.SymmetricComparison;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares tree crowns detected at two points in time.
 * <p>
 * Each tile runs {@value #WORKER}, which writes three outputs: {@code congruent} trees found in both layers, trees
 * {@code only_<input>} that are gone and trees {@code only_<reference>} that are new. Every output is dissolved across
 * tiles and written as {@code <output>_<category>}. A congruent overlap is kept if it covers at least
 * {@code congr_thresh} percent of the tree in {@code input} ({@value #AREA_T1}); gone and new trees are filtered by
 * {@code diff_min_size} and {@code diff_max_fd}.
 */
public class TreeChangeDetection implements TiledAnalysis {

  private static final Logger LOGGER = LoggerFactory.getLogger(TreeChangeDetection.class);

  public static final String WORKER = "v.trees.cd.worker";
  public static final String AREA_T1 = "area_sqm_t1";

  private final AreaOfInterest areaOfInterest;
  private final String input;
  private final String reference;
  private final SymmetricComparison comparison;
  private final double congruentThreshold;
  private final double diffMinSize;
  private final double diffMaxFractalDimension;
  private final String output;

  TreeChangeDetection(AreaOfInterest areaOfInterest, String input, String reference, double congruentThreshold,
    double diffMinSize, double diffMaxFractalDimension, String output) {
    this.areaOfInterest = areaOfInterest;
    this.input = input;
    this.reference = reference;
    this.comparison = SymmetricComparison.of(input, reference);
    if (comparison.nameA().equals(comparison.nameB())) {
      throw new IllegalArgumentException("input and reference must have different names, both are "
        + comparison.nameA());
    }
    this.congruentThreshold = congruentThreshold;
    this.diffMinSize = diffMinSize;
    this.diffMaxFractalDimension = diffMaxFractalDimension;
    this.output = output;
  }

  public static TreeChangeDetection from(Arguments args) {
    return new TreeChangeDetection(
      AddonArguments.areaOfInterest(args),
      args.getString("input", "tree layer of the earlier point in time", "tree_objects"),
      args.getString("reference", "tree layer of the later point in time"),
      args.getDouble("congr_thresh", "minimum overlap in percent of a tree to count as congruent", 90),
      args.getDouble("diff_min_size", "minimum size of a gone or new tree in square map units", 0.25),
      args.getDouble("diff_max_fd", "maximum fractal dimension of a gone or new tree", 2.5),
      args.getString("output", "prefix of the output layers", "trees_difference")
    );
  }

  public static void main(String[] args) throws Exception {
    run(Arguments.fromArgsOrConfigFile(args).withExactlyOnceLogging());
  }

  static void run(Arguments args) {
    TreeChangeDetection analysis = from(args);
    RunResult result = TileRunner.create(args).run(analysis, AddonArguments.outputDir(args));
    AddonArguments.exitOnFailure(result);
  }

  @Override
  public String name() {
    return "trees-cd";
  }

  @Override
  public AreaOfInterest areaOfInterest() {
    return areaOfInterest;
  }

  @Override
  public EngineCommand command(Tile tile, ResourceBudget budget) {
    return AddonArguments.workerCommand(WORKER, tile, budget)
      .with("inp_t1", input)
      .with("inp_t2", reference)
      .with("output_suffix", String.join(",", comparison.categories()));
  }

  /** Returns the name of the layer written for {@code category}. */
  public String layerName(String category) {
    return output + "_" + category;
  }

  @Override
  public MergePlan mergePlan() {
    Map<String, MergeSpec> specs = new LinkedHashMap<>();
    specs.put(SymmetricComparison.CONGRUENT, comparison.spec()
      .filter(AcceptanceFilter.minCoverage(AREA_T1, congruentThreshold))
      .renameTo(layerName(SymmetricComparison.CONGRUENT)));
    for (String category : List.of(comparison.onlyA(), comparison.onlyB())) {
      specs.put(category, comparison.spec()
        .filter(AcceptanceFilter.minArea(diffMinSize))
        .filter(AcceptanceFilter.maxFractalDimension(diffMaxFractalDimension))
        .renameTo(layerName(category)));
    }
    return MergePlan.comparison(comparison, specs);
  }

  @Override
  public MergedOutput postProcess(MergedOutput merged, TileManifest manifest) {
    Map<String, MergedLayer> layers = new LinkedHashMap<>();
    for (String category : comparison.categories()) {
      String name = layerName(category);
      List<String> dropped = category.equals(SymmetricComparison.CONGRUENT) ?
        List.of(ShapeMetrics.AREA, ShapeMetrics.FRACTAL_DIMENSION, comparison.sourceAttribute(), AREA_T1) :
        List.of(ShapeMetrics.AREA, ShapeMetrics.FRACTAL_DIMENSION, comparison.sourceAttribute());
      MergedLayer layer = LayerAttributes.drop(merged.layer(name), dropped);
      layers.put(name, layer);
    }
    LOGGER.info("Congruent trees: {}, gone trees in {}: {}, new trees in {}: {}",
      layers.get(layerName(SymmetricComparison.CONGRUENT)).size(),
      comparison.nameA(), layers.get(layerName(comparison.onlyA())).size(),
      comparison.nameB(), layers.get(layerName(comparison.onlyB())).size());
    return new MergedOutput(layers);
  }
}
