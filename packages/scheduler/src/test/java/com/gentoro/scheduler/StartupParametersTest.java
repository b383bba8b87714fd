package com.gentoro.scheduler;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.scheduler.exception.ConfigException;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void parsesNamedParameters() {
    StartupParameters parameters =
        new StartupParameters(
            new String[] {"--config=/etc/scheduler.yaml", "--port=9090", "--dev"});

    assertEquals("/etc/scheduler.yaml", parameters.configFile());
    assertEquals(9090, parameters.getParameter("port", Integer.class));
    assertTrue(parameters.getParameter("dev", Boolean.class));
    assertNull(parameters.getParameter("missing", String.class));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(ConfigException.class, () -> new StartupParameters(new String[] {"config"}));
    StartupParameters parameters = new StartupParameters(new String[] {"--port=abc"});
    assertThrows(ConfigException.class, () -> parameters.getParameter("port", Integer.class));
  }
}
