package com.onthegomap.tilerunner;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MainTest {

  @ParameterizedTest
  @ValueSource(strings = {
    "extract-buildings", "r.extract.buildings", "extract-greenroofs", "r.extract.greenroofs", "building-cd",
    "v.cd.areas", "trees-cd", "v.trees.cd", " Trees-CD ", "trees-mlapply", "r.trees.mlapply",
    "trees-param", "v.trees.param"
  })
  void testFindTask(String name) {
    assertTrue(Main.findTask(name).isPresent());
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "generate-openmaptiles", "bounds=0,0,1,1"})
  void testUnknownTask(String name) {
    assertTrue(Main.findTask(name).isEmpty());
  }
}
