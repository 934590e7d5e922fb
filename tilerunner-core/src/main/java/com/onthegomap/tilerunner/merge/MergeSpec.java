package com.onthegomap.tilerunner.merge;

import java.util.ArrayList;
import java.util.List;

/**
 * How the tile outputs of one named output are merged and which features survive.
 *
 * @param dissolve        how fragments are matched across tiles
 * @param explode         split dissolved multipolygons into one feature per polygon
 * @param minHoleArea     interior holes smaller than this are filled, 0 keeps every hole
 * @param filters         acceptance filters applied to the merged features
 * @param outputName      name of the merged layer, {@code null} to keep the output name
 * @param keepIds         keep the {@code cat} each feature had in its tile instead of renumbering
 */
public record MergeSpec(
  DissolveStrategy dissolve,
  boolean explode,
  double minHoleArea,
  List<AcceptanceFilter> filters,
  String outputName,
  boolean keepIds
) {

  public MergeSpec {
    filters = List.copyOf(filters);
  }

  public static MergeSpec dissolve(DissolveStrategy strategy) {
    return new MergeSpec(strategy, false, 0, List.of(), null, false);
  }

  public MergeSpec exploded() {
    return new MergeSpec(dissolve, true, minHoleArea, filters, outputName, keepIds);
  }

  public MergeSpec fillHolesSmallerThan(double area) {
    return new MergeSpec(dissolve, explode, area, filters, outputName, keepIds);
  }

  public MergeSpec filter(AcceptanceFilter filter) {
    List<AcceptanceFilter> copy = new ArrayList<>(filters);
    copy.add(filter);
    return new MergeSpec(dissolve, explode, minHoleArea, copy, outputName, keepIds);
  }

  public MergeSpec renameTo(String name) {
    return new MergeSpec(dissolve, explode, minHoleArea, filters, name, keepIds);
  }

  /** Keeps feature ids from the tiles, for outputs whose {@code cat} refers back to an input layer. */
  public MergeSpec keepingIds() {
    return new MergeSpec(dissolve, explode, minHoleArea, filters, outputName, true);
  }
}
