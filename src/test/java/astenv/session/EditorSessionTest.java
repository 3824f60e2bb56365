package astenv.session;

import astenv.core.CoreModel.*;
import astenv.cursor.CursorInfo;
import astenv.runtime.EditorConfig;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EditorSessionTest {
  private static final int MOVE_PARENT = 0;
  private static final int MOVE_CHILD_1 = 2;
  private static final int HOLE = 4;
  private static final int INT_ONE = 9;
  private static final int PLUS_LEFT = 14;
  private static final int FIRST_ARG = 60;

  private EditorConfig config;
  private EditorSession session;

  @BeforeEach
  public void setUp() throws Exception {
    config = new EditorConfig(50, 10, 100, AssignmentStoreTest.assignmentsDir());
    session = new EditorSession(config);
  }

  @Test
  public void testNothingLoaded() {
    assertThrows(IllegalStateException.class, () -> session.state());
    assertThrows(IllegalStateException.class, () -> session.applyAction(0, HOLE));
  }

  @Test
  public void testLoadPlacesCursorOnFirstHole() throws Exception {
    int root = session.loadStarterCode(0, 0);

    assertEquals(session.state().root(), root);
    CursorInfo info = session.cursorInfo();
    // 前序：0 let, 1 x0, 2 fun, 3 Int, 4 x1, 5 ?, 6 ?
    assertEquals(5, info.cursorPosition());
    assertEquals(7, info.numNodes());
    assertTrue(info.varsInScope().isEmpty());
    assertEquals(List.of(new CursorInfo.ScopedArg(1, 0, 0)), info.argsInScope());
  }

  @Test
  public void testPermittedActionsRespectStarterCode() throws Exception {
    session.loadStarterCode(0, 0);

    int[] mask = session.permittedActions();

    assertEquals(70, mask.length);
    assertEquals(0, mask[MOVE_PARENT]);
    assertEquals(1, mask[HOLE]);
    assertEquals(1, mask[FIRST_ARG]);
    assertEquals(0, mask[FIRST_ARG + 1]);
  }

  @Test
  public void testEditUntilTestsPass() throws Exception {
    int root = session.loadStarterCode(0, 0);
    session.loadUnitTests(0);
    assertFalse(session.checkUnitTests(root));

    // ? -> x1 -> x1 + ? -> x1 + 1
    for (int tag : new int[] {FIRST_ARG, PLUS_LEFT, MOVE_PARENT, MOVE_CHILD_1, INT_ONE}) {
      assertEquals(1, session.permittedActions()[tag], "tag " + tag);
      root = session.applyAction(root, tag);
    }

    Expr program = session.zipper().unzip();
    Fun fun = (Fun) ((Let) program).definition();
    assertEquals(new BinOp(new Var(1), BinOpKind.PLUS, new IntE(1)), fun.body());
    assertTrue(session.checkUnitTests(root));
  }

  @Test
  public void testSolvedAndWrongVariants() throws Exception {
    session.loadUnitTests(0);

    assertTrue(session.checkUnitTests(session.loadStarterCode(0, 1)));
    assertFalse(session.checkUnitTests(session.loadStarterCode(0, 2)));
  }

  @Test
  public void testUnknownRootRejected() throws Exception {
    int root = session.loadStarterCode(0, 0);

    assertThrows(IllegalArgumentException.class, () -> session.applyAction(root + 1, HOLE));
    assertThrows(IllegalArgumentException.class, () -> session.applyAction(root, 70));
  }

  @Test
  public void testLimitsEnforcedOnLoad() {
    EditorSession small = new EditorSession(config.withMaxNodes(5));
    assertThrows(AssignmentFormatException.class, () -> small.loadStarterCode(0, 0));

    EditorSession fewVars = new EditorSession(new EditorConfig(50, 1, 100, config.dataDir()));
    assertThrows(AssignmentFormatException.class, () -> fewVars.loadStarterCode(0, 0));
  }

  @Test
  public void testUnitTestTable() throws Exception {
    session.loadUnitTests(0);

    assertArrayEquals(new int[][] {{0, 1}, {1, 2}, {5, 6}}, session.unitTestTable());
  }

  @Test
  public void testObservationIsPadded() throws Exception {
    session.loadStarterCode(0, 0);

    Observation observation = session.observe();

    assertEquals(50, observation.nodes().length);
    assertEquals(-1, observation.nodes()[7]);
    assertEquals(50, observation.edges().length);
    assertArrayEquals(new int[] {-1, -1, -1}, observation.edges()[49]);
    assertEquals(1, observation.starter()[0]);
    assertEquals(-1, observation.starter()[7]);
    assertEquals(5, observation.cursorPosition());
    assertEquals(10, observation.varsInScope().length);
    assertEquals(-1, observation.varsInScope()[0]);
    assertArrayEquals(new int[] {0, 0}, observation.argsInScope()[0]);
    assertArrayEquals(new int[] {-1, -1}, observation.argsInScope()[1]);
    assertEquals(0, observation.assignment());
    assertArrayEquals(session.permittedActions(), observation.permittedActions());
  }
}
