package com.gentoro.capindex;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.capindex.exception.ValidationException;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaultsToHelpWithClasspathConfig() {
    StartupParameters params = new StartupParameters(new String[0]);
    assertEquals("help", params.mode());
    assertEquals(ConfigurationProvider.DEFAULT_LOCATION, params.configFile());
  }

  @Test
  void parsesNameValuePairsAndFlags() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--mode", "query", "--element", "reviewer", "--verbose", "stray"});
    assertEquals("query", params.mode());
    assertEquals("reviewer", params.getOptional("element").orElseThrow());
    assertTrue(params.isParameterPresent("verbose"));
    assertEquals("stray", params.getOptional("verbose").orElseThrow());
    assertTrue(params.getOptional("verb").isEmpty());
  }

  @Test
  void flagWithoutValueIsPresentButEmpty() {
    StartupParameters params = new StartupParameters(new String[] {"--mode", "query", "--dry-run"});
    assertTrue(params.isParameterPresent("dry-run"));
    assertTrue(params.getOptional("dry-run").isEmpty());
  }

  @Test
  void rejectsUnknownMode() {
    assertThrows(
        ValidationException.class, () -> new StartupParameters(new String[] {"--mode", "serve"}));
  }

  @Test
  void buildModeNeedsElementFile() {
    ValidationException e =
        assertThrows(
            ValidationException.class,
            () -> new StartupParameters(new String[] {"--mode", "build"}));
    assertTrue(e.getMessage().contains("--elements"));
  }
}
