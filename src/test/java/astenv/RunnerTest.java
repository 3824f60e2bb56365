package astenv;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RunnerTest {
  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;
  private String dataDir;

  @BeforeEach
  public void setUp() throws Exception {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    dataDir = Path.of(RunnerTest.class.getResource("/assignments").toURI()).toString();
  }

  private int run(String... args) {
    return Runner.run(args,
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  @Test
  public void testUsage() {
    assertEquals(2, run());
    assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    assertEquals(2, run(dataDir, "zero", "0"));
  }

  @Test
  public void testStarterReport() {
    assertEquals(0, run(dataDir, "0", "0"));

    String report = out.toString(StandardCharsets.UTF_8);
    assertTrue(report.contains("cursor:   5/7"), report);
    assertTrue(report.contains("[60]"), report);
    assertTrue(report.contains("tests:    fail"), report);
  }

  @Test
  public void testSolvedVariantPasses() {
    assertEquals(0, run(dataDir, "0", "1"));
    assertTrue(out.toString(StandardCharsets.UTF_8).contains("tests:    pass"));
  }

  @Test
  public void testBadAssignment() {
    assertEquals(1, run(dataDir, "0", "3"));
    assertEquals(1, run(dataDir, "1", "0"));
  }
}
