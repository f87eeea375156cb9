package ca.gc.cra.qsolog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void commonDefaultsApplyToEveryMode() {
    for (String mode : new String[] {"import", "export", "AWARDS"}) {
      Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);
      assertEquals("none", defaults.get("metricsExporter"));
      assertEquals("PARALLEL", defaults.get("engine"));
      assertEquals("100", defaults.get("parallelThreshold"));
      assertEquals("5000", defaults.get("summaryChunkSize"));
      assertTrue(defaults.get("store").endsWith("qsolog.adi"));
    }
  }

  @Test
  void modeSpecificDefaults() {
    assertEquals("false", DefaultsForMode.asFlatMap("import").get("dryRun"));
    assertEquals("QSOLOG", DefaultsForMode.asFlatMap("export").get("programId"));
    assertEquals("100", DefaultsForMode.asFlatMap("awards").get("awards.vucc"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
