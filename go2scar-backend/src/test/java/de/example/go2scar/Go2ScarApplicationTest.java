package de.example.go2scar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Go2ScarApplicationTest {

  @Test
  void positionalArgumentsSelectFileConversion() {
    assertTrue(Go2ScarApplication.hasPositionalArgs(new String[] {"main.go.json"}));
    assertTrue(Go2ScarApplication.hasPositionalArgs(new String[] {"--server.port=0", "in.json", "out.scar"}));
  }

  @Test
  void optionsAloneStartTheServer() {
    assertFalse(Go2ScarApplication.hasPositionalArgs(new String[] {}));
    assertFalse(Go2ScarApplication.hasPositionalArgs(new String[] {"--server.port=9090"}));
  }
}
