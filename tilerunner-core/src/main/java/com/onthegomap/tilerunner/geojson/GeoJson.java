package com.onthegomap.tilerunner.geojson;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onthegomap.tilerunner.util.FileUtils;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * Reads and writes GeoJSON feature collections, the exchange format between workers and the merge step.
 */
public class GeoJson {

  private static final JsonFactory FACTORY = new ObjectMapper().getFactory();

  private GeoJson() {}

  /** Returns every feature in the GeoJSON file at {@code path}. */
  public static List<GeoJsonFeature> read(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read GeoJSON from " + path, e);
    }
  }

  public static List<GeoJsonFeature> read(InputStream in) throws IOException {
    List<GeoJsonFeature> result = new ArrayList<>();
    try (var iterator = new GeoJsonFeatureIterator(in)) {
      iterator.forEachRemaining(result::add);
    }
    return result;
  }

  /** Writes {@code features} as a {@code FeatureCollection} to {@code path}, replacing anything there. */
  public static void write(Path path, List<GeoJsonFeature> features) {
    FileUtils.createParentDirectories(path);
    try (OutputStream out = Files.newOutputStream(path)) {
      write(out, features);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write GeoJSON to " + path, e);
    }
  }

  public static void write(OutputStream out, List<GeoJsonFeature> features) throws IOException {
    try (JsonGenerator gen = FACTORY.createGenerator(out, JsonEncoding.UTF8)) {
      gen.writeStartObject();
      gen.writeStringField("type", "FeatureCollection");
      gen.writeArrayFieldStart("features");
      for (var feature : features) {
        gen.writeStartObject();
        gen.writeStringField("type", "Feature");
        gen.writeObjectField("properties", feature.tags());
        gen.writeFieldName("geometry");
        writeGeometry(gen, feature.geometry());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
  }

  private static void writeGeometry(JsonGenerator gen, Geometry geometry) throws IOException {
    if (geometry == null) {
      gen.writeNull();
      return;
    }
    gen.writeStartObject();
    gen.writeStringField("type", geometry.getGeometryType());
    if (geometry instanceof GeometryCollection && !(geometry instanceof MultiPoint) &&
      !(geometry instanceof MultiLineString) && !(geometry instanceof MultiPolygon)) {
      gen.writeArrayFieldStart("geometries");
      for (int i = 0; i < geometry.getNumGeometries(); i++) {
        writeGeometry(gen, geometry.getGeometryN(i));
      }
      gen.writeEndArray();
    } else {
      gen.writeFieldName("coordinates");
      writeCoordinates(gen, geometry);
    }
    gen.writeEndObject();
  }

  private static void writeCoordinates(JsonGenerator gen, Geometry geometry) throws IOException {
    if (geometry instanceof Point point) {
      if (point.isEmpty()) {
        gen.writeStartArray();
        gen.writeEndArray();
      } else {
        writeCoordinate(gen, point.getCoordinate());
      }
    } else if (geometry instanceof LineString line) {
      writeCoordinateList(gen, line.getCoordinates());
    } else if (geometry instanceof Polygon polygon) {
      gen.writeStartArray();
      if (!polygon.isEmpty()) {
        writeCoordinateList(gen, polygon.getExteriorRing().getCoordinates());
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
          writeCoordinateList(gen, polygon.getInteriorRingN(i).getCoordinates());
        }
      }
      gen.writeEndArray();
    } else {
      gen.writeStartArray();
      for (int i = 0; i < geometry.getNumGeometries(); i++) {
        writeCoordinates(gen, geometry.getGeometryN(i));
      }
      gen.writeEndArray();
    }
  }

  private static void writeCoordinateList(JsonGenerator gen, Coordinate[] coordinates) throws IOException {
    gen.writeStartArray();
    for (Coordinate coordinate : coordinates) {
      writeCoordinate(gen, coordinate);
    }
    gen.writeEndArray();
  }

  private static void writeCoordinate(JsonGenerator gen, Coordinate coordinate) throws IOException {
    gen.writeStartArray();
    gen.writeNumber(coordinate.x);
    gen.writeNumber(coordinate.y);
    gen.writeEndArray();
  }
}
