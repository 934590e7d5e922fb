package com.onthegomap.tilerunner.addons;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agreement between an extracted dataset and a reference dataset, summed over all tiles.
 *
 * @param areaIdentified area covered by both datasets
 * @param areaInput      total area of the extracted dataset
 * @param areaReference  total area of the reference dataset
 */
public record QualityMeasures(double areaIdentified, double areaInput, double areaReference) {

  public static final String AREA_IDENTIFIED = "area_identified";
  public static final String AREA_INPUT = "area_input";
  public static final String AREA_REFERENCE = "area_ref";
  private static final Logger LOGGER = LoggerFactory.getLogger(QualityMeasures.class);

  /**
   * Returns the sum of the areas every tile reported, ignoring attribute sets without them. Values that are not numbers
   * count as 0 and are reported in one warning.
   */
  public static QualityMeasures sum(List<Map<String, Object>> tileAttributes) {
    double identified = 0, input = 0, reference = 0;
    List<String> invalid = new ArrayList<>();
    for (Map<String, Object> attributes : tileAttributes) {
      if (attributes.containsKey(AREA_IDENTIFIED)) {
        identified += number(attributes, AREA_IDENTIFIED, invalid);
        input += number(attributes, AREA_INPUT, invalid);
        reference += number(attributes, AREA_REFERENCE, invalid);
      }
    }
    if (!invalid.isEmpty()) {
      LOGGER.warn("Ignoring {} area values that are not numbers: {}", invalid.size(), invalid);
    }
    return new QualityMeasures(identified, input, reference);
  }

  private static double number(Map<String, Object> attributes, String key, List<String> invalid) {
    Object value = attributes.get(key);
    if (value instanceof Number number) {
      return number.doubleValue();
    } else if (value instanceof String string) {
      try {
        return Double.parseDouble(string.strip());
      } catch (NumberFormatException e) {
        invalid.add(key + "=" + string);
      }
    }
    return 0;
  }

  /** Share of the reference area that was identified, {@link Double#NaN} without reference area. */
  public double completeness() {
    return areaReference > 0 ? areaIdentified / areaReference : Double.NaN;
  }

  /** Share of the extracted area that is confirmed by the reference, {@link Double#NaN} without extracted area. */
  public double correctness() {
    return areaInput > 0 ? areaIdentified / areaInput : Double.NaN;
  }
}
