package org.redlist.maps.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class LogUtilTest {

  @AfterEach
  void cleanup() {
    LogUtil.clearStage();
  }

  @Test
  void testStageHandling() {
    assertNull(LogUtil.getStage());
    LogUtil.setStage("resolve");
    assertEquals("resolve", LogUtil.getStage());
    assertEquals("[resolve] ", MDC.get(LogUtil.STAGE_KEY));
    LogUtil.clearStage();
    assertNull(LogUtil.getStage());
  }

  @Test
  void testSubStageRestoresParent() {
    LogUtil.setStage("resolve");
    try (var ignored = LogUtil.enterSubStage("boundaries")) {
      assertEquals("resolve:boundaries", LogUtil.getStage());
    }
    assertEquals("resolve", LogUtil.getStage());
  }

  @Test
  void testSubStageWithoutParent() {
    try (var ignored = LogUtil.enterSubStage("boundaries")) {
      assertEquals("boundaries", LogUtil.getStage());
    }
    assertNull(LogUtil.getStage());
  }

  @Test
  void testSubStageRestoredOnException() {
    LogUtil.setStage("render");
    try (var ignored = LogUtil.enterSubStage("boundaries")) {
      throw new IllegalStateException("boom");
    } catch (IllegalStateException e) {
      assertEquals("render", LogUtil.getStage());
    }
  }
}
