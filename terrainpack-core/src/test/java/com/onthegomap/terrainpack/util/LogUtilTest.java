package com.onthegomap.terrainpack.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class LogUtilTest {

  @AfterEach
  void clear() {
    LogUtil.clearStage();
  }

  @Test
  void testStage() {
    assertNull(LogUtil.getStage());
    LogUtil.setStage("fetch");
    assertEquals("fetch", LogUtil.getStage());
    assertEquals("fetch", MDC.get(LogUtil.STAGE_KEY));
    LogUtil.clearStage();
    assertNull(LogUtil.getStage());
  }

  @Test
  void testNestedStage() {
    LogUtil.setStage("package", "writer");
    assertEquals("package/writer", LogUtil.getStage());
    LogUtil.setStage("geometry", "geometry");
    assertEquals("geometry", LogUtil.getStage());
    LogUtil.setStage(null, "worker");
    assertEquals("worker", LogUtil.getStage());
  }

  @Test
  void testBlankStageClears() {
    LogUtil.setStage("fetch");
    LogUtil.setStage(" ");
    assertNull(LogUtil.getStage());
  }
}
