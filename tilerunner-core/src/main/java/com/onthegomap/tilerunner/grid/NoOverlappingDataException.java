package com.onthegomap.tilerunner.grid;

import com.onthegomap.tilerunner.util.Exceptions;

/** Thrown when none of the tiles of a grid overlaps the data a run needs. */
public class NoOverlappingDataException extends Exceptions.FatalTileRunnerException {

  public NoOverlappingDataException(String message) {
    super(message);
  }
}
