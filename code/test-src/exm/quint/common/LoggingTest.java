package exm.quint.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Enumeration;

import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.Test;

public class LoggingTest {

  @Test
  public void testEmittedOnce() {
    String msg = "duplicate check " + System.nanoTime();
    assertTrue(Logging.addEmitted(Level.WARN, msg));
    assertFalse(Logging.addEmitted(Level.WARN, msg));
    // Same text at another level counts separately
    assertTrue(Logging.addEmitted(Level.INFO, msg));
  }

  @Test
  public void testUniqueWarn() {
    String msg = "unique warning " + System.nanoTime();
    Logging.uniqueWarn(msg);
    assertFalse(Logging.addEmitted(Level.WARN, msg));
  }

  @Test
  public void testInitLogging() throws Exception {
    Logger logger = Logging.getQuintLogger();
    Level saved = logger.getLevel();
    try {
      assertEquals("exm.quint", Settings.initLogging().getName());
      assertEquals(Level.DEBUG, logger.getLevel());
      Logging.setupLogging("", true);
      assertEquals(Level.TRACE, logger.getLevel());
    } finally {
      logger.setLevel(saved);
    }
  }

  @Test
  public void testRepeatedSetupKeepsOneFileAppender() throws Exception {
    Logger logger = Logging.getQuintLogger();
    Level saved = logger.getLevel();
    File first = File.createTempFile("quint-log", ".txt");
    File second = File.createTempFile("quint-log", ".txt");
    try {
      Logging.setupLogging(first.getPath(), false);
      Logging.setupLogging(second.getPath(), false);

      int fileAppenders = 0;
      Enumeration<?> appenders = logger.getAllAppenders();
      while (appenders.hasMoreElements()) {
        Appender a = (Appender)appenders.nextElement();
        if (Logging.FILE_APPENDER_NAME.equals(a.getName())) {
          fileAppenders++;
        }
      }
      assertEquals(1, fileAppenders);
      FileAppender current =
          (FileAppender)logger.getAppender(Logging.FILE_APPENDER_NAME);
      assertEquals(second.getPath(), current.getFile());
    } finally {
      Appender a = logger.getAppender(Logging.FILE_APPENDER_NAME);
      if (a != null) {
        logger.removeAppender(a);
        a.close();
      }
      logger.setLevel(saved);
      first.delete();
      second.delete();
    }
  }
}
