package ca.gc.cra.qsolog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.NoSuchFileException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class CommandSupportTest {
  private static final Logger log = LoggerFactory.getLogger(CommandSupportTest.class);

  @AfterEach
  void tearDown() {
    Thread.interrupted();
    CliPrinter.clearTestWriter();
  }

  @Test
  void failuresMapToExitCodes() {
    assertEquals(ExitCode.IO_ERROR, CommandSupport.failure("import", new NoSuchFileException("x.adi"), log));
    assertEquals(ExitCode.CONFIG_ERROR,
        CommandSupport.failure("awards", new IllegalArgumentException("bad"), log));
    assertEquals(ExitCode.RUNTIME_FAILURE, CommandSupport.failure("export", new IllegalStateException(), log));
  }

  @Test
  void interruptedIoRestoresInterruptFlag() {
    assertEquals(ExitCode.INTERRUPTED, CommandSupport.failure("import", new InterruptedIOException(), log));
    assertTrue(Thread.currentThread().isInterrupted());
  }

  @Test
  void cliOverridesAndDryRunFlagReachSettings() {
    StringWriter buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));

    CommandSupport.Resolution resolution = CommandSupport.resolve(
        "import", CliInput.parse(new String[] {"in=a.adi", "workers=3", "--dry-run"}), "usage", "help", log);

    assertNull(resolution.exitCode());
    assertEquals("3", resolution.settings().get("workers"));
    assertEquals("true", resolution.settings().get("dryRun"));
    assertFalse(resolution.settings().containsKey("metricsExporter"));
  }

  @Test
  void helpFinishesWithSuccess() {
    StringWriter buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));

    CommandSupport.Resolution resolution =
        CommandSupport.resolve("export", CliInput.parse(new String[] {"-h"}), "usage", "full help", log);

    assertTrue(resolution.finished());
    assertEquals(ExitCode.SUCCESS, resolution.exitCode());
    assertTrue(buffer.toString().contains("full help"));
  }

  @Test
  void ioFailureBeatsGenericMapping() {
    assertEquals(ExitCode.IO_ERROR, CommandSupport.failure("export", new IOException("disk full"), log));
  }
}
