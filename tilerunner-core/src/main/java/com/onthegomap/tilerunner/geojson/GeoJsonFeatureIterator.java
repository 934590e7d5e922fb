package com.onthegomap.tilerunner.geojson;

import static com.fasterxml.jackson.core.JsonParser.Feature.INCLUDE_SOURCE_IN_LOCATION;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onthegomap.tilerunner.geo.GeoUtils;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams features out of a GeoJSON {@code FeatureCollection} (or a sequence of bare features) without loading the
 * whole document.
 */
public class GeoJsonFeatureIterator implements Iterator<GeoJsonFeature>, Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(GeoJsonFeatureIterator.class);
  private final ObjectMapper mapper = new ObjectMapper();
  private final JsonParser parser;
  private GeoJsonFeature next = null;
  private Map<String, Object> properties = null;
  private GeoJsonGeometry geometry;
  private int nestingLevel = 0;

  @JsonIgnoreProperties(ignoreUnknown = true)
  private record GeoJsonGeometry(String type, List<?> coordinates, List<GeoJsonGeometry> geometries) {}

  public GeoJsonFeatureIterator(InputStream in) throws IOException {
    this.parser = new JsonFactory().createParser(in);
    parser.enable(INCLUDE_SOURCE_IN_LOCATION);
    advance();
  }

  @Override
  public void close() {
    try {
      parser.close();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public boolean hasNext() {
    return next != null;
  }

  @Override
  public GeoJsonFeature next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    GeoJsonFeature item = next;
    advance();
    return item;
  }

  private void advance() {
    try {
      geometry = null;
      properties = null;
      next = null;
      JsonToken token = null;
      while (next == null && !parser.isClosed()) {
        if (nestingLevel == 0) {
          findNextStruct();
        }
        while (!parser.isClosed() && (nestingLevel > 0) && !(token = parser.nextToken()).isStructEnd()) {
          if (token == JsonToken.START_OBJECT) {
            nestingLevel++;
          } else if (token == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            switch (field) {
              case "geometry" -> consumeGeometry();
              case "properties" -> consumeProperties();
              case "type" -> consume(JsonToken.VALUE_STRING);
              case "features" -> {
                consume(JsonToken.START_ARRAY);
                nestingLevel++;
                if (parser.nextToken() == JsonToken.START_OBJECT) {
                  nestingLevel++;
                } else {
                  // empty collection
                  nestingLevel--;
                }
              }
              default -> {
                parser.nextToken();
                parser.skipChildren();
              }
            }
          } else {
            LOGGER.warn("Unexpected token inside struct at {}: {}", loc(), token);
          }
        }
        if (token == JsonToken.END_ARRAY) {
          nestingLevel--;
        } else if (token == JsonToken.END_OBJECT) {
          var geom = geometry == null ? null : toGeometry(geometry);
          if (geom != null) {
            next = new GeoJsonFeature(geom, properties == null ? Map.of() : properties);
          }
          geometry = null;
          properties = null;
          nestingLevel--;
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void consume(JsonToken tokenType) throws IOException {
    if (parser.nextToken() != tokenType) {
      LOGGER.warn("Unexpected token type at {}: {}", loc(), tokenType);
    }
  }

  private void findNextStruct() throws IOException {
    JsonToken token;
    while ((token = parser.nextToken()) != null && token != JsonToken.START_OBJECT) {
      LOGGER.warn("Unexpected top-level token at {}: {}", loc(), token);
      parser.skipChildren();
    }
    if (token == null) {
      parser.close();
    } else {
      nestingLevel++;
    }
  }

  private String loc() {
    return parser.currentTokenLocation().offsetDescription();
  }

  private Geometry toGeometry(GeoJsonGeometry geom) {
    String type = geom.type == null ? "" : geom.type;
    return switch (type) {
      case "Point" -> GeoUtils.JTS_FACTORY.createPoint(coordinate(geom.coordinates));
      case "LineString" -> GeoUtils.JTS_FACTORY.createLineString(coordinates(geom.coordinates));
      case "Polygon" -> polygon(geom.coordinates);
      case "MultiPoint" -> GeoUtils.JTS_FACTORY.createMultiPointFromCoords(coordinates(geom.coordinates));
      case "MultiLineString" -> GeoUtils.JTS_FACTORY.createMultiLineString(lists(geom.coordinates).stream()
        .map(line -> GeoUtils.JTS_FACTORY.createLineString(coordinates(line)))
        .toArray(org.locationtech.jts.geom.LineString[]::new));
      case "MultiPolygon" -> GeoUtils.createMultiPolygon(lists(geom.coordinates).stream().map(this::polygon).toList());
      case "GeometryCollection" -> GeoUtils.createGeometryCollection(geom.geometries == null ? List.of() :
        geom.geometries.stream().map(this::toGeometry).filter(g -> g != null).toList());
      default -> {
        LOGGER.warn("Unexpected geometry type: {}", geom.type);
        yield null;
      }
    };
  }

  private Polygon polygon(List<?> list) {
    List<LinearRing> rings = lists(list).stream()
      .map(ring -> GeoUtils.JTS_FACTORY.createLinearRing(coordinates(ring)))
      .toList();
    if (rings.isEmpty()) {
      return GeoUtils.EMPTY_POLYGON;
    }
    return GeoUtils.createPolygon(rings.get(0), rings.subList(1, rings.size()));
  }

  private static Coordinate coordinate(List<?> list) {
    return new CoordinateXY(((Number) list.get(0)).doubleValue(), ((Number) list.get(1)).doubleValue());
  }

  private static Coordinate[] coordinates(List<?> list) {
    return lists(list).stream().map(GeoJsonFeatureIterator::coordinate).toArray(Coordinate[]::new);
  }

  private static List<List<?>> lists(List<?> list) {
    return list.stream().filter(List.class::isInstance).<List<?>>map(List.class::cast).toList();
  }

  @SuppressWarnings("unchecked")
  private void consumeProperties() throws IOException {
    if (parser.nextToken() == JsonToken.VALUE_NULL) {
      properties = null;
    } else {
      properties = mapper.readValue(parser, Map.class);
    }
  }

  private void consumeGeometry() throws IOException {
    if (parser.nextToken() == JsonToken.VALUE_NULL) {
      geometry = null;
    } else {
      geometry = mapper.readValue(parser, GeoJsonGeometry.class);
    }
  }
}
