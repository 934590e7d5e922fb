package com.onthegomap.tilerunner.addons;

import com.onthegomap.tilerunner.RunResult;
import com.onthegomap.tilerunner.TileRunner;
import com.onthegomap.tilerunner.TiledAnalysis;
import com.onthegomap.tilerunner.budget.ResourceBudget;
import com.onthegomap.tilerunner.collect.TileManifest;
import com.onthegomap.tilerunner.config.Arguments;
import com.onthegomap.tilerunner.engine.EngineCommand;
import com.onthegomap.tilerunner.geo.ShapeMetrics;
import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import com.onthegomap.tilerunner.grid.AreaOfInterest;
import com.onthegomap.tilerunner.grid.CoverageLayer;
import com.onthegomap.tilerunner.grid.Tile;
import com.onthegomap.tilerunner.merge.AcceptanceFilter;
import com.onthegomap.tilerunner.merge.DissolveStrategy;
import com.onthegomap.tilerunner.merge.MergeEngine;
import com.onthegomap.tilerunner.merge.MergePlan;
import com.onthegomap.tilerunner.merge.MergeSpec;
import com.onthegomap.tilerunner.merge.MergedLayer;
import com.onthegomap.tilerunner.merge.MergedOutput;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds vegetated roofs from building footprints, an nDSM, an NDVI raster and the RGB bands of an orthophoto.
 * <p>
 * Each tile runs {@value #WORKER}, which writes the roof vegetation of its tile as output {@value #VEGETATION} and the
 * footprints it looked at as output {@value #BUILDINGS}, both carrying the footprint id in {@value #BUILDING_CAT}.
 * Fragments are dissolved per building across tiles. Vegetation patches smaller than {@code min_veg_size} are dropped,
 * then every building gets {@value #VEG_PROPORTION}, the percentage of its roof covered by vegetation, and only
 * buildings with at least {@code min_veg_proportion} percent and their vegetation are kept.
 */
public class ExtractGreenRoofs implements TiledAnalysis {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractGreenRoofs.class);

  public static final String WORKER = "r.extract.greenroofs.worker";
  public static final String BUILDINGS = "buildings";
  public static final String VEGETATION = "vegetation";
  public static final String BUILDING_CAT = "building_cat";
  public static final String VEG_PROPORTION = "veg_proportion";

  private final AreaOfInterest areaOfInterest;
  private final Map<String, Object> inputs;
  private final double minVegetationSize;
  private final double minVegetationProportion;
  private final boolean segmentation;
  private final String outputBuildings;
  private final String outputVegetation;
  private final List<CoverageLayer> coverage;

  ExtractGreenRoofs(AreaOfInterest areaOfInterest, Map<String, Object> inputs, Path buildings,
    double minVegetationSize, double minVegetationProportion, boolean segmentation, String outputBuildings,
    String outputVegetation) {
    if (outputBuildings.equals(outputVegetation)) {
      throw new IllegalArgumentException("output_buildings and output_vegetation must differ, both are "
        + outputBuildings);
    }
    this.areaOfInterest = areaOfInterest;
    this.inputs = new LinkedHashMap<>(inputs);
    this.inputs.put("buildings", buildings);
    this.minVegetationSize = minVegetationSize;
    this.minVegetationProportion = minVegetationProportion;
    this.segmentation = segmentation;
    this.outputBuildings = outputBuildings;
    this.outputVegetation = outputVegetation;
    this.coverage = List.of(CoverageLayer.fromGeoJson(BUILDINGS, buildings));
  }

  /**
   * Returns the analysis configured from {@code args}.
   *
   * @throws IllegalArgumentException if a required parameter is missing or {@code gb_perc} is used
   */
  public static ExtractGreenRoofs from(Arguments args) {
    if (args.has("gb_perc")) {
      throw new IllegalArgumentException("gb_perc is not supported, derive the green/blue ratio threshold from the "
        + "percentile beforehand and use gb_thresh");
    }
    Double gbThreshold = args.getDoubleObject("gb_thresh", "green/blue ratio threshold on a scale from 0-255");
    if (gbThreshold == null) {
      throw new IllegalArgumentException("Missing required parameter: gb_thresh");
    }
    Map<String, Object> inputs = new LinkedHashMap<>();
    inputs.put("ndom", args.getString("ndsm|ndom", "normalized digital surface model raster"));
    inputs.put("ndvi", args.getString("ndvi", "NDVI raster"));
    inputs.put("red", args.getString("red", "red band of the orthophoto"));
    inputs.put("green", args.getString("green", "green band of the orthophoto"));
    inputs.put("blue", args.getString("blue", "blue band of the orthophoto"));
    inputs.put("gb_thresh", gbThreshold);
    inputs.put("fnk", args.getString("fnk", "land-use vector (FNK)", null));
    inputs.put("fnk_column", args.getString("fnk_column", "attribute of fnk holding the land-use code", null));
    inputs.put("trees", args.getString("trees", "tree polygons to exclude from roofs", null));
    return new ExtractGreenRoofs(
      AddonArguments.areaOfInterest(args),
      inputs,
      args.inputFile("buildings", "GeoJSON building footprints"),
      args.getDouble("min_veg_size", "minimum size of a roof vegetation patch in square map units", 5),
      args.getDouble("min_veg_proportion", "minimum percentage of a roof covered by vegetation", 10),
      args.getBoolean("segmentation|s", "segment the image before extracting green roofs", false),
      args.getString("output_buildings", "name of the green roof building layer", "greenroof_buildings"),
      args.getString("output_vegetation", "name of the roof vegetation layer", "greenroof_vegetation")
    );
  }

  public static void main(String[] args) throws Exception {
    run(Arguments.fromArgsOrConfigFile(args).withExactlyOnceLogging());
  }

  static void run(Arguments args) {
    ExtractGreenRoofs analysis = from(args);
    RunResult result = TileRunner.create(args).run(analysis, AddonArguments.outputDir(args));
    AddonArguments.exitOnFailure(result);
  }

  @Override
  public String name() {
    return "extract-greenroofs";
  }

  @Override
  public AreaOfInterest areaOfInterest() {
    return areaOfInterest;
  }

  @Override
  public EngineCommand command(Tile tile, ResourceBudget budget) {
    EngineCommand command = AddonArguments.workerCommand(WORKER, tile, budget);
    for (var entry : inputs.entrySet()) {
      command = command.with(entry.getKey(), entry.getValue());
    }
    return command
      .with("output_buildings", BUILDINGS)
      .with("output_vegetation", VEGETATION)
      .withFlag("s", segmentation);
  }

  @Override
  public List<CoverageLayer> coverage() {
    return coverage;
  }

  @Override
  public MergePlan mergePlan() {
    Map<String, MergeSpec> layers = new LinkedHashMap<>();
    layers.put(BUILDINGS, MergeSpec.dissolve(DissolveStrategy.byAttribute(BUILDING_CAT)).renameTo(outputBuildings));
    layers.put(VEGETATION, MergeSpec.dissolve(DissolveStrategy.byAttribute(BUILDING_CAT))
      .exploded()
      .filter(AcceptanceFilter.minArea(minVegetationSize))
      .renameTo(outputVegetation));
    return MergePlan.of(layers);
  }

  @Override
  public MergedOutput postProcess(MergedOutput merged, TileManifest manifest) {
    MergedLayer buildings = merged.layer(outputBuildings);
    MergedLayer vegetation = merged.layer(outputVegetation);
    Map<Object, Double> vegetationArea = new HashMap<>();
    for (GeoJsonFeature patch : vegetation.features()) {
      Object id = buildingId(patch);
      if (id != null) {
        vegetationArea.merge(id, patch.getDouble(ShapeMetrics.AREA), Double::sum);
      }
    }

    List<GeoJsonFeature> greenRoofs = new ArrayList<>();
    for (GeoJsonFeature building : buildings.features()) {
      double roofArea = building.getDouble(ShapeMetrics.AREA);
      double proportion = roofArea > 0 ? vegetationArea.getOrDefault(buildingId(building), 0d) / roofArea * 100 : 0;
      if (proportion >= minVegetationProportion) {
        greenRoofs.add(building.withTag(VEG_PROPORTION, proportion));
      }
    }
    Set<Object> kept = greenRoofs.stream().map(ExtractGreenRoofs::buildingId).collect(Collectors.toSet());
    List<GeoJsonFeature> keptVegetation = vegetation.features().stream()
      .filter(patch -> kept.contains(buildingId(patch)))
      .toList();
    LOGGER.info("{} of {} buildings have at least {}% roof vegetation", greenRoofs.size(), buildings.size(),
      minVegetationProportion);

    Map<String, MergedLayer> layers = new LinkedHashMap<>();
    layers.put(outputBuildings,
      new MergedLayer(outputBuildings, MergeEngine.renumber(greenRoofs), buildings.sourceCount()));
    layers.put(outputVegetation,
      new MergedLayer(outputVegetation, MergeEngine.renumber(keptVegetation), vegetation.sourceCount()));
    return new MergedOutput(layers);
  }

  // building_cat can be read as 3 from one tile and 3.0 from another
  private static Object buildingId(GeoJsonFeature feature) {
    return DissolveStrategy.byAttribute(BUILDING_CAT).identity(feature);
  }
}
