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
import com.onthegomap.tilerunner.merge.MergeEngine;
import com.onthegomap.tilerunner.merge.MergePlan;
import com.onthegomap.tilerunner.merge.MergedLayer;
import com.onthegomap.tilerunner.merge.MergedOutput;
import com.onthegomap.tilerunner.merge.SymmetricComparison;
import com.onthegomap.tilerunner.util.Format;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects buildings that differ between an extracted building layer ({@code input}) and a reference layer
 * ({@code reference}).
 * <p>
 * Each tile runs {@value #WORKER}, which writes the symmetric difference of both layers in its tile as output
 * {@value #CHANGE}, with {@code a_cat} set on parts of reference buildings and {@code b_cat} on parts of input
 * buildings. Parts are dissolved across tiles, filtered by {@code min_size} and {@code max_fd}, tagged with the layer
 * they come from in {@code source} and trimmed to {@link #OUTPUT_ATTRIBUTES}, with the fractal dimension written as
 * {@value #FRACTAL_DIMENSION}.
 * <p>
 * With {@code quality=true} (or {@code --q}) workers also report {@value QualityMeasures#AREA_IDENTIFIED},
 * {@value QualityMeasures#AREA_INPUT} and {@value QualityMeasures#AREA_REFERENCE} per tile, which are summed into
 * completeness and correctness of the input layer.
 */
public class BuildingChangeDetection implements TiledAnalysis {

  private static final Logger LOGGER = LoggerFactory.getLogger(BuildingChangeDetection.class);

  public static final String WORKER = "v.cd.areas.worker";
  public static final String CHANGE = "change";
  public static final String FRACTAL_DIMENSION = "fractal_dimension";
  public static final List<String> OUTPUT_ATTRIBUTES =
    List.of(MergeEngine.CAT, "Etagen", ShapeMetrics.AREA, FRACTAL_DIMENSION, "source");

  private final AreaOfInterest areaOfInterest;
  private final String input;
  private final String reference;
  private final SymmetricComparison comparison;
  private final double minSize;
  private final double maxFractalDimension;
  private final boolean quality;
  private final String output;
  private QualityMeasures qualityMeasures = null;

  BuildingChangeDetection(AreaOfInterest areaOfInterest, String input, String reference, double minSize,
    double maxFractalDimension, boolean quality, String output) {
    this.areaOfInterest = areaOfInterest;
    this.input = input;
    this.reference = reference;
    this.comparison = SymmetricComparison.of(reference, input);
    this.minSize = minSize;
    this.maxFractalDimension = maxFractalDimension;
    this.quality = quality;
    this.output = output;
  }

  public static BuildingChangeDetection from(Arguments args) {
    return new BuildingChangeDetection(
      AddonArguments.areaOfInterest(args),
      args.getString("input", "building layer to check"),
      args.getString("reference", "reference building layer"),
      args.getDouble("min_size", "minimum size of a changed area in square map units", 5),
      args.getDouble("max_fd", "maximum fractal dimension of a changed area", 2.5),
      args.getBoolean("quality|q", "compute completeness and correctness of the input", false),
      args.getString("output", "name of the output layer", "buildings_difference")
    );
  }

  public static void main(String[] args) throws Exception {
    run(Arguments.fromArgsOrConfigFile(args).withExactlyOnceLogging());
  }

  static void run(Arguments args) {
    BuildingChangeDetection analysis = from(args);
    RunResult result = TileRunner.create(args).run(analysis, AddonArguments.outputDir(args));
    AddonArguments.exitOnFailure(result);
  }

  @Override
  public String name() {
    return "building-cd";
  }

  @Override
  public AreaOfInterest areaOfInterest() {
    return areaOfInterest;
  }

  @Override
  public EngineCommand command(Tile tile, ResourceBudget budget) {
    return AddonArguments.workerCommand(WORKER, tile, budget)
      .with("input", input)
      .with("reference", reference)
      .with("output", CHANGE)
      .withFlag("q", quality);
  }

  @Override
  public MergePlan mergePlan() {
    return new MergePlan(Map.of(CHANGE, comparison.spec()
      .filter(AcceptanceFilter.minArea(minSize))
      .filter(AcceptanceFilter.maxFractalDimension(maxFractalDimension))
      .renameTo(output)), comparison);
  }

  @Override
  public MergedOutput postProcess(MergedOutput merged, TileManifest manifest) {
    if (quality) {
      qualityMeasures = QualityMeasures.sum(manifest.attributes());
      Format format = Format.defaultInstance();
      LOGGER.info("Area of the input layer: {} sqm, of the reference layer: {} sqm, identified in both: {} sqm",
        format.decimal(qualityMeasures.areaInput()), format.decimal(qualityMeasures.areaReference()),
        format.decimal(qualityMeasures.areaIdentified()));
      LOGGER.info("Completeness (identified / reference area): {}, correctness (identified / input area): {}",
        format.percent(qualityMeasures.completeness()), format.percent(qualityMeasures.correctness()));
    }
    MergedLayer change = merged.layer(output);
    change = LayerAttributes.rename(change, ShapeMetrics.FRACTAL_DIMENSION, FRACTAL_DIMENSION);
    return new MergedOutput(Map.of(output, LayerAttributes.keepOnly(change, OUTPUT_ATTRIBUTES)));
  }

  /** Returns the quality measures of the last run, empty unless quality assessment was requested. */
  public Optional<QualityMeasures> quality() {
    return Optional.ofNullable(qualityMeasures);
  }
}
