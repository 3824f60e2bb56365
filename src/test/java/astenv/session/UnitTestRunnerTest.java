package astenv.session;

import astenv.core.CoreModel.*;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UnitTestRunnerTest {
  private static final List<UnitTest> INCREMENT = List.of(new UnitTest(0, 1), new UnitTest(-3, -2), new UnitTest(9, 10));

  private final UnitTestRunner runner = new UnitTestRunner(100);

  private static Let program(Expr definition) {
    return new Let(0, definition, new Hole());
  }

  private static Expr increment() {
    return new Fun(1, new IntT(), new BinOp(new Var(1), BinOpKind.PLUS, new IntE(1)));
  }

  @Test
  public void testIsTestable() {
    assertTrue(UnitTestRunner.isTestable(program(increment())));
    assertTrue(UnitTestRunner.isTestable(program(new Fix(1, new HoleT(), new Hole()))));
    assertFalse(UnitTestRunner.isTestable(increment()));
    assertFalse(UnitTestRunner.isTestable(program(new IntE(1))));
    assertFalse(UnitTestRunner.isTestable(new Let(0, increment(), new IntE(0))));
  }

  @Test
  public void testApplicationFor() {
    Let let = program(increment());

    assertEquals(new Let(0, increment(), new BinOp(new Var(0), BinOpKind.AP, new IntE(4))),
        UnitTestRunner.applicationFor(let, 4));
  }

  @Test
  public void testPassingProgram() {
    assertTrue(runner.run(program(increment()), INCREMENT));
  }

  @Test
  public void testWrongAnswer() {
    Expr identity = new Fun(1, new IntT(), new Var(1));
    assertFalse(runner.run(program(identity), INCREMENT));
  }

  @Test
  public void testRecursiveProgram() {
    // fix x1 -> fun x2 -> if x2 < 1 then 0 else x2 + x1 (x2 - 1)
    Expr recurse = new BinOp(new Var(1), BinOpKind.AP, new BinOp(new Var(2), BinOpKind.MINUS, new IntE(1)));
    Expr sum = new Fix(1, new ArrowT(new IntT(), new IntT()), new Fun(2, new IntT(),
        new If(new BinOp(new Var(2), BinOpKind.LT, new IntE(1)),
            new IntE(0),
            new BinOp(new Var(2), BinOpKind.PLUS, recurse))));

    assertTrue(runner.run(program(sum), List.of(new UnitTest(0, 0), new UnitTest(4, 10))));
  }

  @Test
  public void testRuntimeFailuresCountAsFailures() {
    Expr unfinished = new Fun(1, new IntT(), new Hole());
    Expr divide = new Fun(1, new IntT(), new BinOp(new IntE(1), BinOpKind.DIV, new Var(1)));
    Expr loop = new Fix(1, new HoleT(), new Fun(2, new HoleT(), new BinOp(new Var(1), BinOpKind.AP, new Var(2))));
    Expr bool = new Fun(1, new IntT(), new BinOp(new Var(1), BinOpKind.LT, new IntE(1)));

    assertFalse(runner.run(program(unfinished), INCREMENT));
    assertFalse(runner.run(program(divide), List.of(new UnitTest(0, 0))));
    assertFalse(runner.run(program(loop), List.of(new UnitTest(0, 0))));
    assertFalse(runner.run(program(bool), List.of(new UnitTest(0, 1))));
  }

  @Test
  public void testNonTestableProgramFails() {
    assertFalse(runner.run(new Hole(), INCREMENT));
  }

  @Test
  public void testEmptyTestListPasses() {
    assertTrue(runner.run(program(increment()), List.of()));
  }
}
