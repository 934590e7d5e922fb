package com.onthegomap.tilerunner.stats;

import java.lang.management.ManagementFactory;
import java.util.OptionalLong;

/**
 * A collection of utilities to gather information about the host that runs the workers.
 */
public class ProcessInfo {

  private ProcessInfo() {}

  /** Returns the number of processors available to the JVM. */
  public static int getAvailableProcessors() {
    return Runtime.getRuntime().availableProcessors();
  }

  /**
   * Returns the total amount of memory available on the system if available.
   */
  public static OptionalLong getSystemMemoryBytes() {
    if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean osBean) {
      return OptionalLong.of(osBean.getTotalMemorySize());
    } else {
      return OptionalLong.empty();
    }
  }

  /**
   * Returns the physical memory that is currently free plus free swap space, if the JVM exposes it.
   * <p>
   * Worker processes run outside the JVM heap so this is the budget they share.
   */
  public static OptionalLong getSystemFreeMemoryBytes() {
    if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean osBean) {
      return OptionalLong.of(osBean.getFreeMemorySize() + osBean.getFreeSwapSpaceSize());
    } else {
      return OptionalLong.empty();
    }
  }
}
