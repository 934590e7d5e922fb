package com.onthegomap.tilerunner.grid;

import com.onthegomap.tilerunner.geo.GeoUtils;
import com.onthegomap.tilerunner.geojson.GeoJson;
import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import java.nio.file.Path;
import java.util.List;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;

/**
 * Input data a worker needs, indexed so tiles without any of it can be skipped before a worker is launched.
 */
public class CoverageLayer {

  private final String name;
  private final int size;
  private final STRtree index = new STRtree();

  public CoverageLayer(String name, List<Geometry> geometries) {
    this.name = name;
    this.size = geometries.size();
    for (Geometry geometry : geometries) {
      if (geometry != null && !geometry.isEmpty()) {
        index.insert(geometry.getEnvelopeInternal(), geometry);
      }
    }
    index.build();
  }

  /** Returns a layer with the geometries of every feature in a GeoJSON file. */
  public static CoverageLayer fromGeoJson(String name, Path path) {
    return new CoverageLayer(name, GeoJson.read(path).stream().map(GeoJsonFeature::geometry).toList());
  }

  public String name() {
    return name;
  }

  public int size() {
    return size;
  }

  /** Returns true if any geometry of this layer shares at least one point with {@code extent}. */
  public boolean intersects(Envelope extent) {
    PreparedGeometry prepared = PreparedGeometryFactory.prepare(GeoUtils.toGeometry(extent));
    for (Object candidate : index.query(extent)) {
      if (prepared.intersects((Geometry) candidate)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "CoverageLayer{name='" + name + "', size=" + size + "}";
  }
}
