package com.onthegomap.tilerunner.merge;

import com.onthegomap.tilerunner.geo.ShapeMetrics;
import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A global rule a merged feature must satisfy to be kept.
 * <p>
 * Filters only ever see merged features, after {@link ShapeMetrics#AREA} and {@link ShapeMetrics#FRACTAL_DIMENSION}
 * have been computed on them, since a feature spanning several tiles only has its real size and shape once merged.
 */
public interface AcceptanceFilter {

  Logger LOGGER = LoggerFactory.getLogger(AcceptanceFilter.class);

  boolean accept(GeoJsonFeature feature);

  /** Rejects features with an area below {@code minArea}. */
  static AcceptanceFilter minArea(double minArea) {
    return new AcceptanceFilter() {
      @Override
      public boolean accept(GeoJsonFeature feature) {
        return !(feature.getDouble(ShapeMetrics.AREA) < minArea);
      }

      @Override
      public String toString() {
        return ShapeMetrics.AREA + ">=" + minArea;
      }
    };
  }

  /** Rejects features with a fractal dimension above {@code maxFractalDimension}. */
  static AcceptanceFilter maxFractalDimension(double maxFractalDimension) {
    return new AcceptanceFilter() {
      @Override
      public boolean accept(GeoJsonFeature feature) {
        return !(feature.getDouble(ShapeMetrics.FRACTAL_DIMENSION) > maxFractalDimension);
      }

      @Override
      public String toString() {
        return ShapeMetrics.FRACTAL_DIMENSION + "<=" + maxFractalDimension;
      }
    };
  }

  /**
   * Rejects features whose merged area is less than {@code percent}% of the area stored in {@code referenceAttribute}.
   * <p>
   * When a feature lacks the attribute nothing can be compared: it is kept and a warning is logged once per filter.
   */
  static AcceptanceFilter minCoverage(String referenceAttribute, double percent) {
    AtomicBoolean warned = new AtomicBoolean(false);
    return new AcceptanceFilter() {
      @Override
      public boolean accept(GeoJsonFeature feature) {
        double reference = feature.getDouble(referenceAttribute);
        if (Double.isNaN(reference)) {
          if (warned.compareAndSet(false, true)) {
            LOGGER.warn("No attribute <{}> on merged features, can not filter with {}% coverage, keeping them",
              referenceAttribute, percent);
          }
          return true;
        }
        return !(feature.getDouble(ShapeMetrics.AREA) < percent * 0.01 * reference);
      }

      @Override
      public String toString() {
        return ShapeMetrics.AREA + ">=" + percent + "% of " + referenceAttribute;
      }
    };
  }
}
