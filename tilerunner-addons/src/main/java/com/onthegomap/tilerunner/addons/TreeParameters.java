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
import com.onthegomap.tilerunner.grid.CoverageLayer;
import com.onthegomap.tilerunner.grid.Tile;
import com.onthegomap.tilerunner.merge.DissolveStrategy;
import com.onthegomap.tilerunner.merge.MergeEngine;
import com.onthegomap.tilerunner.merge.MergePlan;
import com.onthegomap.tilerunner.merge.MergeSpec;
import com.onthegomap.tilerunner.merge.MergedLayer;
import com.onthegomap.tilerunner.merge.MergedOutput;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes parameters like height, crown diameter and distance to the next building for every tree crown.
 * <p>
 * Each tile runs {@value #WORKER} on the crowns inside its tile, with the complete crown layer available for
 * neighbourhood parameters, and writes them as output {@value #TREECROWNS}. A crown cut by a tile border is dissolved
 * by its {@value MergeEngine#CAT}, which is kept so the result joins back to the input crowns.
 */
public class TreeParameters implements TiledAnalysis {

  private static final Logger LOGGER = LoggerFactory.getLogger(TreeParameters.class);

  public static final String WORKER = "v.trees.param.worker";
  public static final String TREECROWNS = "treecrowns";
  public static final List<String> PARAMETERS =
    List.of("position", "hoehe", "dm", "volumen", "flaeche", "ndvi", "dist_geb", "dist_baum");

  private final AreaOfInterest areaOfInterest;
  private final Path treecrowns;
  private final String ndsm;
  private final String ndvi;
  private final String buildings;
  private final Integer distanceBuilding;
  private final int distanceTree;
  private final List<String> parameters;
  private final String output;
  private final List<CoverageLayer> coverage;

  /** @throws IllegalArgumentException if a parameter is unknown or needs an input that is missing */
  TreeParameters(AreaOfInterest areaOfInterest, Path treecrowns, String ndsm, String ndvi, String buildings,
    Integer distanceBuilding, int distanceTree, List<String> parameters, String output) {
    if (parameters.isEmpty()) {
      throw new IllegalArgumentException("treeparamset must name at least one of " + PARAMETERS);
    }
    for (String parameter : parameters) {
      if (!PARAMETERS.contains(parameter)) {
        throw new IllegalArgumentException("Unknown tree parameter '" + parameter + "', expected one of " +
          PARAMETERS);
      }
    }
    requireInput(parameters, "dist_geb", buildings, "buildings");
    requireInput(parameters, "ndvi", ndvi, "ndvi");
    requireInput(parameters, "hoehe", ndsm, "ndsm");
    this.areaOfInterest = areaOfInterest;
    this.treecrowns = treecrowns;
    this.ndsm = ndsm;
    this.ndvi = ndvi;
    this.buildings = buildings;
    this.distanceBuilding = distanceBuilding;
    this.distanceTree = distanceTree;
    this.parameters = List.copyOf(parameters);
    this.output = output;
    this.coverage = List.of(CoverageLayer.fromGeoJson(TREECROWNS, treecrowns));
  }

  private static void requireInput(List<String> parameters, String parameter, String input, String name) {
    if (parameters.contains(parameter) && input == null) {
      throw new IllegalArgumentException("Tree parameter " + parameter + " needs " + name + " as input");
    }
  }

  public static TreeParameters from(Arguments args) {
    return new TreeParameters(
      AddonArguments.areaOfInterest(args),
      args.inputFile("treecrowns", "GeoJSON tree crowns"),
      args.getString("ndsm|ndom", "normalized digital surface model raster", null),
      args.getString("ndvi", "NDVI raster", null),
      args.getString("buildings", "building layer", null),
      args.getObject("distance_building", "range in which neighbouring buildings are searched for", null,
        Integer::valueOf),
      args.getInteger("distance_tree", "range in which neighbouring trees are searched for", 500),
      args.getList("treeparamset", "tree parameters to compute", PARAMETERS),
      args.getString("output", "name of the tree parameter layer", "tree_parameters")
    );
  }

  public static void main(String[] args) throws Exception {
    run(Arguments.fromArgsOrConfigFile(args).withExactlyOnceLogging());
  }

  static void run(Arguments args) {
    TreeParameters analysis = from(args);
    RunResult result = TileRunner.create(args).run(analysis, AddonArguments.outputDir(args));
    AddonArguments.exitOnFailure(result);
  }

  @Override
  public String name() {
    return "trees-param";
  }

  @Override
  public AreaOfInterest areaOfInterest() {
    return areaOfInterest;
  }

  @Override
  public EngineCommand command(Tile tile, ResourceBudget budget) {
    return AddonArguments.workerCommand(WORKER, tile, budget)
      .with("treecrowns_complete", treecrowns.toAbsolutePath())
      .with("ndsm", ndsm)
      .with("ndvi", ndvi)
      .with("buildings", buildings)
      .with("distance_building", distanceBuilding)
      .with("distance_tree", distanceTree)
      .with("treeparamset", String.join(",", parameters))
      .with("output", TREECROWNS);
  }

  @Override
  public List<CoverageLayer> coverage() {
    return coverage;
  }

  @Override
  public MergePlan mergePlan() {
    return MergePlan.of(TREECROWNS,
      MergeSpec.dissolve(DissolveStrategy.byAttribute(MergeEngine.CAT)).keepingIds().renameTo(output));
  }

  @Override
  public MergedOutput postProcess(MergedOutput merged, TileManifest manifest) {
    MergedLayer trees = LayerAttributes.drop(merged.layer(output),
      List.of(ShapeMetrics.AREA, ShapeMetrics.FRACTAL_DIMENSION));
    LOGGER.info("Computed {} for {} tree crowns", parameters, trees.size());
    return new MergedOutput(Map.of(output, trees));
  }
}
