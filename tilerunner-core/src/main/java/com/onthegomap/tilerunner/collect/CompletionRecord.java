package com.onthegomap.tilerunner.collect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onthegomap.tilerunner.workspace.WorkspaceContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The message a worker leaves for the orchestrator when it finishes, either as {@value #FILE_NAME} in its workspace or
 * as the last line of its output starting with {@value #MARKER}.
 * <p>
 * Example: {@code {"status":"success","workspace":"tile_3_ab12","outputs":{"buildings":"buildings.geojson"}}}
 *
 * @param status     {@value #SUCCESS} or {@value #SKIPPED}
 * @param workspace  name of the workspace the worker ran in
 * @param outputs    output name to a file path relative to the workspace
 * @param attributes optional per-feature or per-tile attributes
 * @param message    optional human readable note, for example why a tile was skipped
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompletionRecord(
  String status,
  String workspace,
  Map<String, String> outputs,
  List<Map<String, Object>> attributes,
  String message
) {

  public static final String FILE_NAME = "tile-result.json";
  public static final String MARKER = "TILERUNNER_RESULT";
  public static final String SUCCESS = "success";
  public static final String SKIPPED = "skipped";
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public CompletionRecord {
    outputs = outputs == null ? Map.of() : new LinkedHashMap<>(outputs);
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }

  public static CompletionRecord success(String workspace, Map<String, String> outputs,
    List<Map<String, Object>> attributes) {
    return new CompletionRecord(SUCCESS, workspace, outputs, attributes, null);
  }

  public static CompletionRecord skipped(String workspace, String message) {
    return new CompletionRecord(SKIPPED, workspace, Map.of(), List.of(), message);
  }

  public static CompletionRecord parse(String json) throws JsonProcessingException {
    return MAPPER.readValue(json, CompletionRecord.class);
  }

  public String toJson() {
    try {
      return MAPPER.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize " + this, e);
    }
  }

  /** Returns the single line a worker prints to report this record on its output. */
  public String toMarkerLine() {
    return MARKER + " " + toJson();
  }

  /** Writes this record to {@value #FILE_NAME} in the workspace of {@code context}. */
  public void writeTo(WorkspaceContext context) throws IOException {
    Files.writeString(context.workspace().resolve(FILE_NAME), toJson(), StandardCharsets.UTF_8);
  }

  /** Returns the JSON text after the last {@value #MARKER} line in {@code output}, or {@code null} if none. */
  static String findMarker(String output) {
    String found = null;
    for (String line : output.lines().toList()) {
      String stripped = line.strip();
      if (stripped.startsWith(MARKER)) {
        found = stripped.substring(MARKER.length()).strip();
      }
    }
    return found;
  }

  /** Reads the completion record file from {@code workspaceDir} if the worker wrote one. */
  static String readFile(Path workspaceDir) throws IOException {
    Path file = workspaceDir.resolve(FILE_NAME);
    return Files.exists(file) ? new String(Files.readAllBytes(file), StandardCharsets.UTF_8) : null;
  }
}
