package com.onthegomap.tilerunner.geo;

import java.util.ArrayList;
import java.util.function.Supplier;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error caused by unexpected geometry in a tile output that should be handled to avoid halting the whole merge for
 * one bad feature.
 */
public class GeometryException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryException.class);

  private final String code;
  private final ArrayList<Supplier<String>> detailsSuppliers = new ArrayList<>();

  /**
   * Constructs a new exception with a detailed error message caused by {@code cause}.
   *
   * @param code    string that uniquely identifies this error condition
   * @param message description of the error, detailed enough to find the offending geometry from it
   * @param cause   the original exception that was thrown
   */
  public GeometryException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public GeometryException(String code, String message) {
    super(message);
    this.code = code;
  }

  public GeometryException addDetails(Supplier<String> detailsSupplier) {
    this.detailsSuppliers.add(detailsSupplier);
    return this;
  }

  public GeometryException addGeometryDetails(String original, Geometry geometry) {
    return addDetails(() -> original + " (wkt): " + new WKTWriter().write(geometry));
  }

  /** Returns the unique code for this error condition. */
  public String code() {
    return code;
  }

  /** Logs the error as a warning, including any details that were attached to it. */
  public void log(String logContext) {
    StringBuilder log = new StringBuilder(logContext + ": " + getMessage());
    for (var details : detailsSuppliers) {
      log.append("\n").append(details.get());
    }
    LOGGER.warn(log.toString(), getCause());
  }
}
