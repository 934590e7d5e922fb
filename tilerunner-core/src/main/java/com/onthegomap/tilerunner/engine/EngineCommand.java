package com.onthegomap.tilerunner.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A named engine operation with a flat {@code key=value} parameter map and optional flags.
 * <p>
 * Parameters keep insertion order so the command line is reproducible in logs.
 */
public record EngineCommand(String operation, Map<String, String> parameters, Set<String> flags) {

  public EngineCommand {
    if (operation == null || operation.isBlank()) {
      throw new IllegalArgumentException("engine operation must not be blank");
    }
    parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    flags = Collections.unmodifiableSet(new LinkedHashSet<>(flags));
  }

  public static EngineCommand of(String operation) {
    return new EngineCommand(operation, Map.of(), Set.of());
  }

  /** Returns a copy with {@code key} set to {@code value}, or unchanged if {@code value} is null. */
  public EngineCommand with(String key, Object value) {
    if (value == null) {
      return this;
    }
    Map<String, String> copy = new LinkedHashMap<>(parameters);
    copy.put(key, value instanceof Double d && d == Math.rint(d) && !d.isInfinite() ?
      Long.toString(d.longValue()) : value.toString());
    return new EngineCommand(operation, copy, flags);
  }

  /** Returns a copy with {@code flag} set, or unchanged if {@code enabled} is false. */
  public EngineCommand withFlag(String flag, boolean enabled) {
    if (!enabled) {
      return this;
    }
    Set<String> copy = new LinkedHashSet<>(flags);
    copy.add(flag);
    return new EngineCommand(operation, parameters, copy);
  }

  public EngineCommand withFlag(String flag) {
    return withFlag(flag, true);
  }

  public String get(String key) {
    return parameters.get(key);
  }

  /**
   * Returns the command as arguments: the operation, then {@code key=value} pairs, then {@code -f} for single-letter
   * flags and {@code --flag} for longer ones.
   */
  public List<String> toArgs() {
    List<String> args = new ArrayList<>(1 + parameters.size() + flags.size());
    args.add(operation);
    parameters.forEach((key, value) -> args.add(key + "=" + value));
    for (String flag : flags) {
      args.add((flag.length() == 1 ? "-" : "--") + flag);
    }
    return args;
  }

  @Override
  public String toString() {
    return String.join(" ", toArgs());
  }
}
