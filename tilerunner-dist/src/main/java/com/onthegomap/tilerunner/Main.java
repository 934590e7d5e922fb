package com.onthegomap.tilerunner;

import static java.util.Map.entry;

import com.onthegomap.tilerunner.addons.ApplyTreeModel;
import com.onthegomap.tilerunner.addons.BuildingChangeDetection;
import com.onthegomap.tilerunner.addons.ExtractBuildings;
import com.onthegomap.tilerunner.addons.ExtractGreenRoofs;
import com.onthegomap.tilerunner.addons.TreeChangeDetection;
import com.onthegomap.tilerunner.addons.TreeParameters;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Main entry-point for the executable jar, which delegates to the {@code public static void main(String[] args)} method
 * of the analysis named by the first argument.
 */
public class Main {

  private static final Map<String, EntryPoint> ENTRY_POINTS = Map.ofEntries(
    entry("extract-buildings", ExtractBuildings::main),
    entry("r.extract.buildings", ExtractBuildings::main),

    entry("extract-greenroofs", ExtractGreenRoofs::main),
    entry("r.extract.greenroofs", ExtractGreenRoofs::main),

    entry("building-cd", BuildingChangeDetection::main),
    entry("v.cd.areas", BuildingChangeDetection::main),

    entry("trees-cd", TreeChangeDetection::main),
    entry("v.trees.cd", TreeChangeDetection::main),

    entry("trees-mlapply", ApplyTreeModel::main),
    entry("r.trees.mlapply", ApplyTreeModel::main),

    entry("trees-param", TreeParameters::main),
    entry("v.trees.param", TreeParameters::main)
  );

  public static void main(String[] args) throws Exception {
    Optional<EntryPoint> task = args.length > 0 ? findTask(args[0]) : Optional.empty();
    if (task.isEmpty()) {
      System.err.println(args.length > 0 ? "Unrecognized task: " + args[0] : "Missing task");
      System.err.println("possibilities: " + new TreeSet<>(ENTRY_POINTS.keySet()));
      System.exit(1);
    }
    task.get().main(Arrays.copyOfRange(args, 1, args.length));
  }

  static Optional<EntryPoint> findTask(String name) {
    return Optional.ofNullable(ENTRY_POINTS.get(name.trim().toLowerCase(Locale.ROOT)));
  }

  @FunctionalInterface
  interface EntryPoint {

    void main(String[] args) throws Exception;
  }
}
