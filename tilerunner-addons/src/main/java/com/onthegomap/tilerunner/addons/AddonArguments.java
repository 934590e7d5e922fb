package com.onthegomap.tilerunner.addons;

import com.onthegomap.tilerunner.RunResult;
import com.onthegomap.tilerunner.budget.ResourceBudget;
import com.onthegomap.tilerunner.config.Arguments;
import com.onthegomap.tilerunner.engine.EngineCommand;
import com.onthegomap.tilerunner.geo.GeoUtils;
import com.onthegomap.tilerunner.geo.GeometryException;
import com.onthegomap.tilerunner.geojson.GeoJson;
import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import com.onthegomap.tilerunner.grid.AreaOfInterest;
import com.onthegomap.tilerunner.grid.RasterAlignment;
import com.onthegomap.tilerunner.grid.Tile;
import java.nio.file.Path;
import java.util.List;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arguments and engine parameters shared by every addon.
 */
final class AddonArguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(AddonArguments.class);

  private AddonArguments() {}

  /**
   * Returns the area to process from either {@code bounds=minx,miny,maxx,maxy} or a GeoJSON {@code area} file, aligned
   * to the raster grid given by {@code resolution} if set.
   *
   * @throws IllegalArgumentException if neither is set or the area file has no polygons
   */
  static AreaOfInterest areaOfInterest(Arguments args) {
    Envelope bounds = args.bounds("bounds", "extent to process as minx,miny,maxx,maxy");
    Path areaFile = args.file("area", "GeoJSON file with the boundary to process", null);
    AreaOfInterest result;
    if (areaFile != null) {
      List<Geometry> geometries = GeoJson.read(areaFile).stream().map(GeoJsonFeature::geometry).toList();
      try {
        result = AreaOfInterest.of(GeoUtils.union(geometries));
      } catch (GeometryException e) {
        throw new IllegalArgumentException("Unable to read area of interest from " + areaFile, e);
      }
    } else if (bounds != null) {
      result = AreaOfInterest.of(bounds);
    } else {
      throw new IllegalArgumentException("Missing required parameter: bounds or area");
    }
    Double resolution = args.getDoubleObject("resolution", "cell size of the primary raster input");
    if (resolution != null) {
      result = result.withAlignment(new RasterAlignment(resolution,
        args.getDouble("origin_x", "x coordinate of a raster cell corner", 0),
        args.getDouble("origin_y", "y coordinate of a raster cell corner", 0)));
    }
    return result;
  }

  static Path outputDir(Arguments args) {
    return args.file("output_dir", "directory the merged layers are written to", Path.of("data", "output"));
  }

  /** Returns the call of {@code operation} restricted to {@code tile} with the memory one worker may use. */
  static EngineCommand workerCommand(String operation, Tile tile, ResourceBudget budget) {
    Envelope extent = tile.extent();
    EngineCommand command = EngineCommand.of(operation)
      .with("n", extent.getMaxY())
      .with("s", extent.getMinY())
      .with("e", extent.getMaxX())
      .with("w", extent.getMinX());
    if (tile.alignment().isPresent()) {
      command = command.with("res", tile.alignment().get().resolution());
    }
    return command.with("memory", budget.memoryPerWorkerMb());
  }

  /** Exits the JVM with a non-zero code if some tiles failed. */
  static void exitOnFailure(RunResult result) {
    if (result.exitCode() != 0) {
      LOGGER.error("Tiles {} failed, their area is missing from the output", result.failedTiles());
      System.exit(result.exitCode());
    }
  }
}
