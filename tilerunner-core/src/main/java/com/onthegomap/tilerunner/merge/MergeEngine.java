package com.onthegomap.tilerunner.merge;

import com.onthegomap.tilerunner.collect.TileManifest;
import com.onthegomap.tilerunner.geo.GeoUtils;
import com.onthegomap.tilerunner.geo.GeometryException;
import com.onthegomap.tilerunner.geo.ShapeMetrics;
import com.onthegomap.tilerunner.geojson.GeoJson;
import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines the outputs of successful tiles into one layer per output and removes tiling artifacts.
 * <p>
 * Merging is done in two steps. {@link #combine} handles the number of sources explicitly: no source gives an empty
 * layer, one source is copied as is, and several sources are unioned and dissolved by identity so a feature split by
 * a tile boundary comes out once. {@link #finish} then computes {@value ShapeMetrics#AREA} and
 * {@value ShapeMetrics#FRACTAL_DIMENSION} on the merged features, fills small holes and applies the acceptance
 * filters. Filters never run on individual tiles.
 */
public class MergeEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(MergeEngine.class);
  public static final String CAT = "cat";

  /** Merges every output named in {@code plan} from the successful tiles in {@code manifest}. */
  public MergedOutput mergeAll(TileManifest manifest, MergePlan plan) {
    Map<String, MergedLayer> layers = new LinkedHashMap<>();
    for (var entry : plan.layers().entrySet()) {
      String name = entry.getKey();
      MergeSpec spec = entry.getValue();
      List<TileManifest.Source> sources = manifest.sources(name);
      List<List<GeoJsonFeature>> features = new ArrayList<>(sources.size());
      for (TileManifest.Source source : sources) {
        features.add(GeoJson.read(source.path()));
      }
      String layerName = spec.outputName() == null ? name : spec.outputName();
      MergedLayer merged = finish(combine(layerName, features, spec.dissolve(), spec.explode(), !spec.keepIds()), spec);
      if (plan.isComparison()) {
        merged = new MergedLayer(merged.name(),
          merged.features().stream().map(plan.comparison()::tagSource).toList(), merged.sourceCount());
      }
      LOGGER.info("Merged {} tiles into {} features of {}", merged.sourceCount(), merged.size(), layerName);
      layers.put(layerName, merged);
    }
    return new MergedOutput(layers);
  }

  /**
   * Returns one layer made from the features of each tile in {@code sources}, given in tile id order.
   *
   * @param explode split every dissolved feature into one feature per polygon
   */
  public MergedLayer combine(String layerName, List<List<GeoJsonFeature>> sources, DissolveStrategy strategy,
    boolean explode) {
    return combine(layerName, sources, strategy, explode, true);
  }

  private MergedLayer combine(String layerName, List<List<GeoJsonFeature>> sources, DissolveStrategy strategy,
    boolean explode, boolean renumber) {
    if (sources.isEmpty()) {
      return MergedLayer.empty(layerName);
    } else if (sources.size() == 1) {
      return new MergedLayer(layerName, sources.get(0), 1);
    }

    Map<Object, List<GeoJsonFeature>> groups = new LinkedHashMap<>();
    int dropped = 0;
    for (List<GeoJsonFeature> source : sources) {
      for (GeoJsonFeature feature : source) {
        if (feature.geometry() == null || !GeoUtils.isPolygonal(feature.geometry())) {
          dropped++;
          continue;
        }
        Object identity = strategy.identity(feature);
        groups.computeIfAbsent(identity == null ? new Object() : identity, k -> new ArrayList<>()).add(feature);
      }
    }
    if (dropped > 0) {
      LOGGER.warn("Dropped {} empty or non-polygonal features from {}", dropped, layerName);
    }

    List<GeoJsonFeature> result = new ArrayList<>();
    for (List<GeoJsonFeature> group : groups.values()) {
      dissolve(layerName, group, explode, result);
    }
    return new MergedLayer(layerName, renumber ? renumber(result) : result, sources.size());
  }

  private static void dissolve(String layerName, List<GeoJsonFeature> group, boolean explode,
    List<GeoJsonFeature> result) {
    Geometry merged;
    try {
      merged = GeoUtils.union(group.stream().map(GeoJsonFeature::geometry).toList());
    } catch (GeometryException e) {
      e.log("Unable to dissolve " + group.size() + " fragments of " + layerName + ", keeping them separate");
      result.addAll(group);
      return;
    }
    List<Polygon> polygons = new ArrayList<>();
    GeoUtils.extractPolygons(merged, polygons, 0, 0);
    if (polygons.isEmpty()) {
      return;
    }
    if (!explode || group.size() == 1 && polygons.size() == 1) {
      result.add(new GeoJsonFeature(GeoUtils.combinePolygons(polygons), group.get(0).tags()));
      return;
    }
    STRtree index = new STRtree();
    for (int i = 0; i < group.size(); i++) {
      index.insert(group.get(i).geometry().getEnvelopeInternal(), i);
    }
    for (Polygon polygon : polygons) {
      result.add(new GeoJsonFeature(polygon, firstContributor(group, index, polygon).tags()));
    }
  }

  // attributes come from the first fragment, in tile order, that makes up the polygon
  private static GeoJsonFeature firstContributor(List<GeoJsonFeature> group, STRtree index, Polygon polygon) {
    int first = Integer.MAX_VALUE;
    for (Object candidate : index.query(polygon.getEnvelopeInternal())) {
      int i = (Integer) candidate;
      if (i < first && group.get(i).geometry().intersects(polygon)) {
        first = i;
      }
    }
    return group.get(first == Integer.MAX_VALUE ? 0 : first);
  }

  /**
   * Returns {@code layer} with small holes filled, shape metrics computed and only the features every filter of
   * {@code spec} accepts.
   */
  public MergedLayer finish(MergedLayer layer, MergeSpec spec) {
    List<GeoJsonFeature> kept = new ArrayList<>(layer.size());
    int rejected = 0;
    for (GeoJsonFeature feature : layer.features()) {
      Geometry geometry = feature.geometry();
      if (geometry == null) {
        rejected++;
        continue;
      }
      if (spec.minHoleArea() > 0) {
        List<Polygon> polygons = new ArrayList<>();
        GeoUtils.extractPolygons(geometry, polygons, 0, spec.minHoleArea());
        if (polygons.isEmpty()) {
          rejected++;
          continue;
        }
        geometry = GeoUtils.combinePolygons(polygons);
      }
      GeoJsonFeature measured = feature.withGeometry(geometry)
        .withTag(ShapeMetrics.AREA, ShapeMetrics.area(geometry))
        .withTag(ShapeMetrics.FRACTAL_DIMENSION, ShapeMetrics.fractalDimension(geometry));
      if (accepts(spec.filters(), measured)) {
        kept.add(measured);
      } else {
        rejected++;
      }
    }
    if (rejected > 0) {
      LOGGER.info("Removed {} of {} features from {} with {}", rejected, layer.size(), layer.name(), spec.filters());
    }
    return new MergedLayer(layer.name(), spec.keepIds() ? kept : renumber(kept), layer.sourceCount());
  }

  private static boolean accepts(List<AcceptanceFilter> filters, GeoJsonFeature feature) {
    for (AcceptanceFilter filter : filters) {
      if (!filter.accept(feature)) {
        return false;
      }
    }
    return true;
  }

  /** Returns {@code features} with {@value #CAT} set to {@code 1..n} as the first attribute. */
  public static List<GeoJsonFeature> renumber(List<GeoJsonFeature> features) {
    List<GeoJsonFeature> result = new ArrayList<>(features.size());
    int cat = 1;
    for (GeoJsonFeature feature : features) {
      Map<String, Object> tags = new LinkedHashMap<>();
      tags.put(CAT, cat++);
      feature.tags().forEach((key, value) -> {
        if (!CAT.equals(key)) {
          tags.put(key, value);
        }
      });
      result.add(new GeoJsonFeature(feature.geometry(), tags));
    }
    return result;
  }
}
