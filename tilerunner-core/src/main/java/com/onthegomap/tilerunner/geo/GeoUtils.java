package com.onthegomap.tilerunner.geo;

import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;
import org.locationtech.jts.geom.util.GeometryFixer;
import org.locationtech.jts.operation.union.UnaryUnionOp;

/**
 * A collection of utilities for working with JTS data structures and tile outputs in projected map units.
 */
public class GeoUtils {

  public static final GeometryFactory JTS_FACTORY = new GeometryFactory(PackedCoordinateSequenceFactory.DOUBLE_FACTORY);
  public static final Geometry EMPTY_GEOMETRY = JTS_FACTORY.createGeometryCollection();
  public static final Polygon EMPTY_POLYGON = JTS_FACTORY.createPolygon();
  private static final Polygon[] EMPTY_POLYGON_ARRAY = new Polygon[0];

  private GeoUtils() {}

  /** Returns a rectangle covering {@code envelope}, or a point or line if the envelope has no area. */
  public static Geometry toGeometry(Envelope envelope) {
    return JTS_FACTORY.toGeometry(envelope);
  }

  public static MultiPolygon createMultiPolygon(List<Polygon> polygon) {
    return JTS_FACTORY.createMultiPolygon(polygon.toArray(EMPTY_POLYGON_ARRAY));
  }

  public static Polygon createPolygon(LinearRing exteriorRing, List<LinearRing> rings) {
    return JTS_FACTORY.createPolygon(exteriorRing, rings.toArray(LinearRing[]::new));
  }

  public static Geometry combinePolygons(List<Polygon> polys) {
    return polys.size() == 1 ? polys.get(0) : createMultiPolygon(polys);
  }

  public static Geometry createGeometryCollection(List<Geometry> geometries) {
    return JTS_FACTORY.createGeometryCollection(geometries.toArray(Geometry[]::new));
  }

  /**
   * Returns a copy of {@code geom} with self-intersections fixed by buffering by 0.
   *
   * @throws GeometryException if a robustness error occurred
   */
  public static Geometry fixPolygon(Geometry geom) throws GeometryException {
    try {
      return geom.buffer(0);
    } catch (TopologyException e) {
      throw new GeometryException("fix_polygon_topology_error", "robustness error fixing polygon: " + e, e);
    }
  }

  /**
   * Returns the union of {@code geometries}, repairing the inputs and trying again if the first attempt hits a
   * robustness error.
   *
   * @throws GeometryException if the union still fails after repairing the inputs
   */
  public static Geometry union(List<Geometry> geometries) throws GeometryException {
    if (geometries.isEmpty()) {
      return EMPTY_GEOMETRY;
    }
    try {
      return UnaryUnionOp.union(geometries);
    } catch (TopologyException e) {
      // invalid inputs make union throw, so fix them and retry
      List<Geometry> fixed = new ArrayList<>(geometries.size());
      for (Geometry geometry : geometries) {
        fixed.add(fixPolygon(GeometryFixer.fix(geometry)));
      }
      try {
        return UnaryUnionOp.union(fixed);
      } catch (TopologyException e2) {
        throw new GeometryException("union_topology_error", "robustness error merging polygons: " + e2, e2)
          .addGeometryDetails("inputs", createGeometryCollection(geometries));
      }
    }
  }

  /**
   * Puts every polygon from {@code geom} with an area greater than {@code minArea} into {@code result}, dropping holes
   * smaller than {@code minHoleArea} and anything that is not polygonal.
   */
  public static void extractPolygons(Geometry geom, List<Polygon> result, double minArea, double minHoleArea) {
    if (geom instanceof Polygon poly) {
      if (!poly.isEmpty() && Area.ofRing(poly.getExteriorRing().getCoordinateSequence()) > minArea) {
        int innerRings = poly.getNumInteriorRing();
        if (minHoleArea > 0 && innerRings > 0) {
          List<LinearRing> rings = new ArrayList<>(innerRings);
          for (int i = 0; i < innerRings; i++) {
            LinearRing innerRing = poly.getInteriorRingN(i);
            if (Area.ofRing(innerRing.getCoordinateSequence()) >= minHoleArea) {
              rings.add(innerRing);
            }
          }
          if (rings.size() != innerRings) {
            poly = createPolygon(poly.getExteriorRing(), rings);
          }
        }
        if (poly.getArea() > minArea) {
          result.add(poly);
        }
      }
    } else if (geom instanceof GeometryCollection) {
      for (int i = 0; i < geom.getNumGeometries(); i++) {
        extractPolygons(geom.getGeometryN(i), result, minArea, minHoleArea);
      }
    }
  }

  /** Returns true if {@code geom} is a polygon or multipolygon with a non-zero area. */
  public static boolean isPolygonal(Geometry geom) {
    return (geom instanceof Polygon || geom instanceof MultiPolygon) && geom.getArea() > 0;
  }
}
