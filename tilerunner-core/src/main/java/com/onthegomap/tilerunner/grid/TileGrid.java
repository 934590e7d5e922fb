package com.onthegomap.tilerunner.grid;

import java.util.List;

/**
 * The tiles a run processes, ordered by id.
 *
 * @param rows      rows of the full grid before filtering, 1 for explicit grids
 * @param columns   columns of the full grid before filtering
 * @param tileEdge  edge length of a cell, 0 for explicit grids
 * @param discarded number of cells dropped because they overlap none of the input data
 */
public record TileGrid(List<Tile> tiles, int rows, int columns, double tileEdge, int discarded) {

  public TileGrid {
    tiles = List.copyOf(tiles);
  }

  public int tileCount() {
    return tiles.size();
  }
}
