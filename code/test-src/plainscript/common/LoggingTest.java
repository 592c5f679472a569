package plainscript.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;

import java.io.File;
import java.io.IOException;
import java.util.Enumeration;

import org.apache.log4j.Appender;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import plainscript.common.exceptions.InvalidOptionException;

public class LoggingTest {

  private File first;
  private File second;

  @After
  public void cleanup() {
    Logger logger = Logging.getPSCLogger();
    Appender appender = logger.getAppender(Logging.FILE_APPENDER_NAME);
    if (appender != null) {
      logger.removeAppender(appender);
      appender.close();
    }
    if (first != null) {
      first.delete();
    }
    if (second != null) {
      second.delete();
    }
  }

  private static int countFileAppenders(Logger logger) {
    int count = 0;
    Enumeration<?> appenders = logger.getAllAppenders();
    while (appenders.hasMoreElements()) {
      Appender a = (Appender)appenders.nextElement();
      if (Logging.FILE_APPENDER_NAME.equals(a.getName())) {
        count++;
      }
    }
    return count;
  }

  @Test
  public void testSetupTwiceKeepsOneFileAppender()
      throws IOException, InvalidOptionException {
    first = File.createTempFile("psc-log", ".txt");
    second = File.createTempFile("psc-log", ".txt");
    Logging.setupLogging(first.getPath(), false);
    Logger logger = Logging.setupLogging(second.getPath(), false);
    assertNotNull(logger.getAppender(Logging.FILE_APPENDER_NAME));
    assertEquals(1, countFileAppenders(logger));
  }

  @Test
  public void testNoLogFileAddsNoAppender() throws InvalidOptionException {
    Logger logger = Logging.setupLogging("", false);
    assertEquals(0, countFileAppenders(logger));
  }
}
