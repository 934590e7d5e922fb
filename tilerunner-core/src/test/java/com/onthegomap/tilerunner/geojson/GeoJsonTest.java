package com.onthegomap.tilerunner.geojson;

import static com.onthegomap.tilerunner.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilerunner.geo.GeoUtils;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

class GeoJsonTest {

  private static List<GeoJsonFeature> parse(String json) throws IOException {
    return GeoJson.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void testReadFeatureCollection() throws IOException {
    var features = parse("""
      {
        "type": "FeatureCollection",
        "crs": {"type": "name", "properties": {"name": "EPSG:25832"}},
        "features": [
          {"type": "Feature", "properties": {"cat": 1, "name": "a"},
           "geometry": {"type": "Polygon", "coordinates": [[[0,0],[10,0],[10,10],[0,10],[0,0]]]}},
          {"type": "Feature", "properties": null,
           "geometry": {"type": "Point", "coordinates": [1.5, 2.5]}}
        ]
      }
      """);
    assertEquals(2, features.size());
    assertInstanceOf(Polygon.class, features.get(0).geometry());
    assertEquals(100, features.get(0).geometry().getArea(), 1e-9);
    assertEquals(1, ((Number) features.get(0).getTag("cat")).intValue());
    assertEquals("a", features.get(0).getTag("name"));
    assertInstanceOf(Point.class, features.get(1).geometry());
    assertTrue(features.get(1).tags().isEmpty());
  }

  @Test
  void testReadEmptyCollection() throws IOException {
    assertEquals(List.of(), parse("{\"type\": \"FeatureCollection\", \"features\": []}"));
    assertEquals(List.of(), parse(""));
  }

  @Test
  void testFeaturesWithoutGeometryAreSkipped() throws IOException {
    var features = parse("""
      {"type": "FeatureCollection", "features": [
        {"type": "Feature", "properties": {"cat": 1}, "geometry": null},
        {"type": "Feature", "properties": {"cat": 2}, "geometry": {"type": "Point", "coordinates": [0, 0]}}
      ]}
      """);
    assertEquals(1, features.size());
    assertEquals(2, ((Number) features.get(0).getTag("cat")).intValue());
  }

  @Test
  void testWriteThenRead(@TempDir Path tmp) {
    Path file = tmp.resolve("nested").resolve("out.geojson");
    var multi = feature(GeoUtils.createMultiPolygon(List.of(
      rectangleWithHole(0, 0, 10, 10, 2, 2, 4, 4),
      rectangle(20, 20, 30, 30)
    )), "cat", 7L, "source", "ref");
    GeoJson.write(file, List.of(multi, feature(rectangle(0, 0, 1, 1))));

    var read = GeoJson.read(file);
    assertEquals(2, read.size());
    assertInstanceOf(MultiPolygon.class, read.get(0).geometry());
    assertEquals(multi.geometry().getArea(), read.get(0).geometry().getArea(), 1e-9);
    assertEquals(7, ((Number) read.get(0).getTag("cat")).intValue());
    assertEquals("ref", read.get(0).getTag("source"));
  }

  @Test
  void testMissingFile(@TempDir Path tmp) {
    assertThrows(UncheckedIOException.class, () -> GeoJson.read(tmp.resolve("missing.geojson")));
  }

  @Test
  void testFeatureTags() {
    var feature = feature(rectangle(0, 0, 1, 1), "number", 2, "text", "3.5", "other", "x", "empty", null);
    assertEquals(2, feature.getDouble("number"), 0);
    assertEquals(3.5, feature.getDouble("text"), 0);
    assertTrue(Double.isNaN(feature.getDouble("other")));
    assertTrue(Double.isNaN(feature.getDouble("missing")));
    assertFalse(feature.hasTag("empty"));
    assertTrue(feature.hasTag("text"));

    var updated = feature.withTag("number", 5);
    assertEquals(5, updated.getTag("number"));
    assertEquals(2, feature.getTag("number"));
  }
}
