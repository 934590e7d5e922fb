package com.onthegomap.tilerunner.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class LogUtilTest {
  @Test
  void testStageHandling() {
    assertNull(LogUtil.getStage());
    LogUtil.setStage("test");
    assertEquals("test", LogUtil.getStage());
    LogUtil.setStage(LogUtil.getStage(), "child");
    assertEquals("test:child", LogUtil.getStage());
    LogUtil.clearStage();
    assertNull(LogUtil.getStage());
  }

  @Test
  void testWithStageRestoresPrevious() {
    LogUtil.setStage("run");
    String inner = LogUtil.withStage("merge", LogUtil::getStage);
    assertEquals("run:merge", inner);
    assertEquals("run", LogUtil.getStage());
    LogUtil.clearStage();
    assertEquals("tile_1", LogUtil.withStage("tile_1", LogUtil::getStage));
    assertNull(LogUtil.getStage());
  }
}
