package com.onthegomap.tilerunner.addons;

import com.onthegomap.tilerunner.RunResult;
import com.onthegomap.tilerunner.TileRunner;
import com.onthegomap.tilerunner.TiledAnalysis;
import com.onthegomap.tilerunner.budget.ResourceBudget;
import com.onthegomap.tilerunner.config.Arguments;
import com.onthegomap.tilerunner.engine.EngineCommand;
import com.onthegomap.tilerunner.grid.AreaOfInterest;
import com.onthegomap.tilerunner.grid.CoverageLayer;
import com.onthegomap.tilerunner.grid.Tile;
import com.onthegomap.tilerunner.merge.AcceptanceFilter;
import com.onthegomap.tilerunner.merge.DissolveStrategy;
import com.onthegomap.tilerunner.merge.MergePlan;
import com.onthegomap.tilerunner.merge.MergeSpec;
import java.nio.file.Path;
import java.util.List;

/**
 * Extracts building footprints from an nDSM and an NDVI raster, restricted to the areas a land-use vector (FNK) marks
 * as possibly built up.
 * <p>
 * Each tile runs {@value #WORKER}, which writes the building candidates of its tile as output {@value #BUILDINGS}.
 * Candidates are dissolved across tiles, split into one feature per building and only kept if they are at least
 * {@code min_size} large and no more ragged than {@code max_fd}; holes smaller than {@code min_size} are filled.
 * <p>
 * Example: {@code extract-buildings bounds=... ndsm=ndsm ndvi_raster=ndvi ndvi_thresh=145 fnk_vector=fnk.geojson
 * fnk_column=code}
 */
public class ExtractBuildings implements TiledAnalysis {

  public static final String WORKER = "r.extract.buildings.worker";
  public static final String BUILDINGS = "buildings";

  private final AreaOfInterest areaOfInterest;
  private final String ndsm;
  private final String ndviRaster;
  private final double ndviThreshold;
  private final Path fnkVector;
  private final String fnkColumn;
  private final double minSize;
  private final double maxFractalDimension;
  private final boolean segmentation;
  private final String output;
  private final List<CoverageLayer> coverage;

  ExtractBuildings(AreaOfInterest areaOfInterest, String ndsm, String ndviRaster, double ndviThreshold, Path fnkVector,
    String fnkColumn, double minSize, double maxFractalDimension, boolean segmentation, String output) {
    this.areaOfInterest = areaOfInterest;
    this.ndsm = ndsm;
    this.ndviRaster = ndviRaster;
    this.ndviThreshold = ndviThreshold;
    this.fnkVector = fnkVector;
    this.fnkColumn = fnkColumn;
    this.minSize = minSize;
    this.maxFractalDimension = maxFractalDimension;
    this.segmentation = segmentation;
    this.output = output;
    this.coverage = List.of(CoverageLayer.fromGeoJson("fnk", fnkVector));
  }

  /**
   * Returns the analysis configured from {@code args}.
   *
   * @throws IllegalArgumentException if a required parameter is missing or {@code ndvi_perc} is used
   */
  public static ExtractBuildings from(Arguments args) {
    if (args.has("ndvi_perc")) {
      throw new IllegalArgumentException(
        "ndvi_perc is not supported, derive the NDVI threshold from the percentile beforehand and use ndvi_thresh");
    }
    Double ndviThreshold = args.getDoubleObject("ndvi_thresh", "NDVI value above which a cell counts as vegetation");
    if (ndviThreshold == null) {
      throw new IllegalArgumentException("Missing required parameter: ndvi_thresh");
    }
    return new ExtractBuildings(
      AddonArguments.areaOfInterest(args),
      args.getString("ndsm|ndom", "normalized digital surface model raster"),
      args.getString("ndvi_raster", "NDVI raster"),
      ndviThreshold,
      args.inputFile("fnk_vector", "GeoJSON land-use vector (FNK)"),
      args.getString("fnk_column", "attribute of fnk_vector holding the land-use code"),
      args.getDouble("min_size", "minimum building size in square map units", 20),
      args.getDouble("max_fd", "maximum fractal dimension of a building", 2.1),
      args.getBoolean("segmentation|s", "segment the nDSM before classifying", false),
      args.getString("output", "name of the output layer", BUILDINGS)
    );
  }

  public static void main(String[] args) throws Exception {
    run(Arguments.fromArgsOrConfigFile(args).withExactlyOnceLogging());
  }

  static void run(Arguments args) {
    ExtractBuildings analysis = from(args);
    RunResult result = TileRunner.create(args).run(analysis, AddonArguments.outputDir(args));
    AddonArguments.exitOnFailure(result);
  }

  @Override
  public String name() {
    return "extract-buildings";
  }

  @Override
  public AreaOfInterest areaOfInterest() {
    return areaOfInterest;
  }

  @Override
  public EngineCommand command(Tile tile, ResourceBudget budget) {
    return AddonArguments.workerCommand(WORKER, tile, budget)
      .with("ndom", ndsm)
      .with("ndvi_raster", ndviRaster)
      .with("ndvi_thresh", ndviThreshold)
      .with("fnk_vector", fnkVector)
      .with("fnk_column", fnkColumn)
      .with("output", BUILDINGS)
      .withFlag("s", segmentation);
  }

  @Override
  public List<CoverageLayer> coverage() {
    return coverage;
  }

  @Override
  public MergePlan mergePlan() {
    return MergePlan.of(BUILDINGS, MergeSpec.dissolve(DissolveStrategy.all())
      .exploded()
      .fillHolesSmallerThan(minSize)
      .filter(AcceptanceFilter.minArea(minSize))
      .filter(AcceptanceFilter.maxFractalDimension(maxFractalDimension))
      .renameTo(output));
  }
}
