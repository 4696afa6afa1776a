package nl.adgroot.docingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.Test;

class LoggingRoutingTest {

  @Test
  void poiLog4jLogger_isBackedBySlf4j_andFollowsLogbackLevels() {
    Logger poi = LogManager.getLogger("org.apache.poi.xwpf.usermodel.XWPFDocument");

    assertEquals("org.apache.logging.slf4j.SLF4JLogger", poi.getClass().getName());
    assertFalse(poi.isInfoEnabled(), "org.apache is at WARN in logback-test.xml");
    assertTrue(poi.isWarnEnabled());
  }
}
