package com.onthegomap.tilerunner.addons;

import com.onthegomap.tilerunner.RunResult;
import com.onthegomap.tilerunner.TileRunner;
import com.onthegomap.tilerunner.TiledAnalysis;
import com.onthegomap.tilerunner.budget.ResourceBudget;
import com.onthegomap.tilerunner.config.Arguments;
import com.onthegomap.tilerunner.engine.EngineCommand;
import com.onthegomap.tilerunner.grid.AreaOfInterest;
import com.onthegomap.tilerunner.grid.Tile;
import com.onthegomap.tilerunner.merge.MergePlan;

/**
 * Applies a trained tree classification model to an image group.
 * <p>
 * Each tile runs {@value #WORKER}, which classifies the pixels of its tile and writes them as the raster output
 * {@value #CLASSIFICATION}. The tile rasters are patched into one raster named by {@code output}.
 */
public class ApplyTreeModel implements TiledAnalysis {

  public static final String WORKER = "r.trees.mlapply.worker";
  public static final String CLASSIFICATION = "classification";

  private final AreaOfInterest areaOfInterest;
  private final String group;
  private final String model;
  private final String output;

  ApplyTreeModel(AreaOfInterest areaOfInterest, String group, String model, String output) {
    this.areaOfInterest = areaOfInterest;
    this.group = group;
    this.model = model;
    this.output = output;
  }

  public static ApplyTreeModel from(Arguments args) {
    return new ApplyTreeModel(
      AddonArguments.areaOfInterest(args),
      args.getString("group", "image group the model is applied to", "ml_input"),
      args.getString("model", "trained classification model file", "gelsenkirchen_2020_ml_trees_randomforest.gz"),
      args.getString("output", "name of the classified raster", "tree_pixels")
    );
  }

  public static void main(String[] args) throws Exception {
    run(Arguments.fromArgsOrConfigFile(args).withExactlyOnceLogging());
  }

  static void run(Arguments args) {
    ApplyTreeModel analysis = from(args);
    RunResult result = TileRunner.create(args).run(analysis, AddonArguments.outputDir(args));
    AddonArguments.exitOnFailure(result);
  }

  @Override
  public String name() {
    return "trees-mlapply";
  }

  @Override
  public AreaOfInterest areaOfInterest() {
    return areaOfInterest;
  }

  @Override
  public EngineCommand command(Tile tile, ResourceBudget budget) {
    return AddonArguments.workerCommand(WORKER, tile, budget)
      .with("group", group)
      .with("model", model)
      .with("output", CLASSIFICATION);
  }

  @Override
  public MergePlan mergePlan() {
    return MergePlan.raster(CLASSIFICATION, output);
  }
}
