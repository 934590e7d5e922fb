package com.onthegomap.tilerunner.merge;

import com.onthegomap.tilerunner.geojson.GeoJsonFeature;
import java.util.List;

/**
 * Comparison of two datasets A and B whose workers emit the categories {@code congruent}, {@code only_<A>} and
 * {@code only_<B>}.
 * <p>
 * Fragments are matched across tiles by {@code bCat ?? aCat} and every merged feature is tagged with the dataset it
 * comes from: A's name when it carries {@code aCat}, otherwise B's name.
 */
public record SymmetricComparison(String nameA, String nameB, String aCatAttribute, String bCatAttribute,
  String sourceAttribute) {

  public static final String CONGRUENT = "congruent";

  public static SymmetricComparison of(String nameA, String nameB) {
    return new SymmetricComparison(baseName(nameA), baseName(nameB), "a_cat", "b_cat", "source");
  }

  /** Strips a {@code @mapset} style qualifier and any directory or extension from a dataset name. */
  static String baseName(String name) {
    String result = name;
    int at = result.indexOf('@');
    if (at > 0) {
      result = result.substring(0, at);
    }
    int slash = Math.max(result.lastIndexOf('/'), result.lastIndexOf('\\'));
    if (slash >= 0) {
      result = result.substring(slash + 1);
    }
    int dot = result.lastIndexOf('.');
    if (dot > 0) {
      result = result.substring(0, dot);
    }
    return result;
  }

  public String onlyA() {
    return "only_" + nameA;
  }

  public String onlyB() {
    return "only_" + nameB;
  }

  public List<String> categories() {
    return List.of(CONGRUENT, onlyA(), onlyB());
  }

  public DissolveStrategy dissolve() {
    return DissolveStrategy.coalesce(bCatAttribute, aCatAttribute);
  }

  /** Returns the merge spec matching fragments of a category across tiles. */
  public MergeSpec spec() {
    return MergeSpec.dissolve(dissolve());
  }

  public GeoJsonFeature tagSource(GeoJsonFeature feature) {
    if (feature.hasTag(aCatAttribute)) {
      return feature.withTag(sourceAttribute, nameA);
    } else if (feature.hasTag(bCatAttribute)) {
      return feature.withTag(sourceAttribute, nameB);
    }
    return feature;
  }
}
