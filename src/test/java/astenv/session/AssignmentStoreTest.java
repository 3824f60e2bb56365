package astenv.session;

import astenv.core.CoreModel.*;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AssignmentStoreTest {
  private AssignmentStore store;

  static Path assignmentsDir() throws URISyntaxException {
    return Path.of(AssignmentStoreTest.class.getResource("/assignments").toURI());
  }

  @BeforeEach
  public void setUp() throws Exception {
    store = new AssignmentStore(assignmentsDir());
  }

  @Test
  public void testLayout() {
    assertEquals(store.dataDir().resolve("3").resolve("2.json"), store.starterPath(3, 2));
    assertEquals(store.dataDir().resolve("3").resolve("tests.json"), store.testsPath(3));
  }

  @Test
  public void testStarterCodeIsMarked() throws Exception {
    Expr program = store.loadStarterCode(0, 0);

    assertTrue(program instanceof Let);
    Let let = (Let) program;
    assertEquals(0, let.binder());
    assertTrue(let.starter());
    assertTrue(let.definition().starter());
    assertTrue(((Fun) let.definition()).annotation().starter());
    assertTrue(let.body().starter());
  }

  @Test
  public void testUnitTests() throws Exception {
    assertEquals(List.of(new UnitTest(0, 1), new UnitTest(1, 2), new UnitTest(5, 6)), store.loadUnitTests(0));
  }

  @Test
  public void testMissingFiles() {
    assertThrows(AssignmentFormatException.class, () -> store.loadStarterCode(0, 42));
    assertThrows(AssignmentFormatException.class, () -> store.loadUnitTests(7));
  }

  @Test
  public void testMalformedStarter() {
    assertThrows(AssignmentFormatException.class, () -> store.loadStarterCode(0, 9));
  }

  @Test
  public void testIllTypedStarter() {
    AssignmentFormatException e = assertThrows(AssignmentFormatException.class, () -> store.loadStarterCode(0, 3));
    assertTrue(e.getMessage().contains("3.json"));
  }

  @Test
  public void testLiteralOutsideFlatRangeRejected() {
    AssignmentFormatException e = assertThrows(AssignmentFormatException.class, () -> store.loadStarterCode(0, 4));
    assertTrue(e.getMessage().contains("4.json"));
    assertTrue(e.getMessage().contains("67108864"));
  }

  @Test
  public void testShadowingBinderRejected() {
    AssignmentFormatException e = assertThrows(AssignmentFormatException.class, () -> store.loadStarterCode(0, 5));
    assertTrue(e.getMessage().contains("binder x0 is bound more than once"));
  }

  @Test
  public void testEmptyUnitTests() {
    assertThrows(AssignmentFormatException.class, () -> store.loadUnitTests(1));
  }
}
