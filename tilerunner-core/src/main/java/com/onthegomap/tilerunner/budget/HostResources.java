package com.onthegomap.tilerunner.budget;

import com.onthegomap.tilerunner.stats.ProcessInfo;

/** Read-only view of the CPU and memory a host can give to worker processes. */
public interface HostResources {

  int availableProcessors();

  /** Free physical memory plus free swap in megabytes. */
  long freeMemoryMb();

  /** Returns the resources of the machine this JVM runs on. */
  static HostResources system() {
    return new HostResources() {
      @Override
      public int availableProcessors() {
        return ProcessInfo.getAvailableProcessors();
      }

      @Override
      public long freeMemoryMb() {
        return ProcessInfo.getSystemFreeMemoryBytes().orElse(0) / (1024 * 1024);
      }

      @Override
      public String toString() {
        return "HostResources.system()";
      }
    };
  }

  /** Returns fixed resources, used when the caller already knows the host limits. */
  static HostResources of(int processors, long freeMemoryMb) {
    return new HostResources() {
      @Override
      public int availableProcessors() {
        return processors;
      }

      @Override
      public long freeMemoryMb() {
        return freeMemoryMb;
      }

      @Override
      public String toString() {
        return "HostResources{processors=" + processors + ", freeMemoryMb=" + freeMemoryMb + "}";
      }
    };
  }
}
