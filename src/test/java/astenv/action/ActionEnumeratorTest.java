package astenv.action;

import astenv.core.CoreModel.*;
import astenv.core.Terms;
import astenv.cursor.CursorInfo;
import astenv.cursor.CursorInfoBuilder;
import astenv.flat.FlatCodec;
import astenv.typing.Typing;
import astenv.typing.TypingContext;
import astenv.zipper.Zipper;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ActionEnumeratorTest {

  private static Action construct(Shape shape) {
    return new Action.Construct(shape);
  }

  private static List<Action> atoms() {
    List<Action> atoms = new ArrayList<>();
    atoms.add(construct(new Shape.Hole()));
    atoms.add(construct(new Shape.Nil()));
    for (int v = ActionEnumerator.MIN_INT_LITERAL; v <= ActionEnumerator.MAX_INT_LITERAL; v++) {
      atoms.add(construct(new Shape.IntLit(v)));
    }
    atoms.add(construct(new Shape.BoolLit(true)));
    atoms.add(construct(new Shape.BoolLit(false)));
    return atoms;
  }

  @Test
  public void testEmptyProgramWithoutBudgetOffersOnlyAtoms() {
    ActionEnumerator enumerator = new ActionEnumerator(1);
    CursorInfo info = CursorInfoBuilder.build(Zipper.at(new Hole()));

    assertEquals(atoms(), enumerator.enumerate(info, true));
  }

  @Test
  public void testEmptyProgramFullMenu() {
    ActionEnumerator enumerator = new ActionEnumerator(50);

    List<Action> actions = enumerator.legalActions(Zipper.at(new Hole()), new VarAllocator(10));

    assertTrue(actions.containsAll(atoms()));
    assertTrue(actions.contains(construct(new Shape.Let(Shape.Side.LEFT))));
    assertTrue(actions.contains(construct(new Shape.Neg())));
    assertTrue(actions.contains(construct(new Shape.BinOp(BinOpKind.PLUS, Shape.Side.RIGHT))));
    assertFalse(actions.contains(new Action.MoveParent()));
    assertFalse(actions.contains(new Action.MoveChild(0)));
    assertFalse(actions.contains(construct(new Shape.Fun())));
    assertFalse(actions.contains(construct(new Shape.Fix())));
  }

  @Test
  public void testBooleanUnderNegation() {
    // -(^true)：期望 Int，实际 Bool
    Expr program = new UnOp(UnOpKind.NEG, new Bool(true));
    CursorInfo info = CursorInfoBuilder.build(Zipper.at(program, 1));

    List<Action> actions = new ActionEnumerator(50).enumerate(info, true);

    assertTrue(actions.contains(new Action.MoveParent()));
    assertFalse(actions.contains(construct(new Shape.Neg())));
    for (BinOpKind op : BinOpKind.values()) {
      if (op.isArithmetic() || op.isComparison()) {
        assertFalse(actions.contains(construct(new Shape.BinOp(op, Shape.Side.LEFT))), op.name());
        assertFalse(actions.contains(construct(new Shape.BinOp(op, Shape.Side.RIGHT))), op.name());
      }
    }
    assertTrue(actions.contains(construct(new Shape.IntLit(0))));
    assertFalse(actions.contains(construct(new Shape.BoolLit(true))));
    assertTrue(actions.contains(construct(new Shape.BinOp(BinOpKind.AP, Shape.Side.RIGHT))));
    assertTrue(actions.contains(construct(new Shape.If(Shape.IfSlot.COND))));
    assertFalse(actions.contains(construct(new Shape.If(Shape.IfSlot.THEN))));
  }

  @Test
  public void testFullBudgetOffersOnlyMovesAtomsAndReferences() {
    // let x0 = 1 in ^(x0 + 2)，共 6 个节点
    Expr program = new Let(0, new IntE(1), new BinOp(new Var(0), BinOpKind.PLUS, new IntE(2)));
    CursorInfo info = CursorInfoBuilder.build(Zipper.at(program, 3));

    List<Action> expected = new ArrayList<>();
    expected.add(new Action.MoveParent());
    expected.add(new Action.MoveChild(0));
    expected.add(new Action.MoveChild(1));
    expected.addAll(atoms());
    expected.add(construct(new Shape.Var(0)));

    assertEquals(expected, new ActionEnumerator(6).enumerate(info, true));
  }

  @Test
  public void testLetWithHoleDefinitionOnlyEntersDefinition() {
    CursorInfo info = CursorInfoBuilder.build(Zipper.at(new Let(0, new Hole(), new Hole())));

    List<Action> actions = new ActionEnumerator(50).enumerate(info, true);

    assertTrue(actions.contains(new Action.MoveChild(0)));
    assertFalse(actions.contains(new Action.MoveChild(1)));
  }

  @Test
  public void testLetUnwrapKeepsBoundVariableInScope() {
    ActionEnumerator enumerator = new ActionEnumerator(50);

    List<Action> used = enumerator.enumerate(
        CursorInfoBuilder.build(Zipper.at(new Let(0, new IntE(1), new Var(0)))), true);
    assertTrue(used.contains(new Action.Unwrap(0)));
    assertFalse(used.contains(new Action.Unwrap(1)));

    List<Action> unused = enumerator.enumerate(
        CursorInfoBuilder.build(Zipper.at(new Let(0, new IntE(1), new IntE(2)))), true);
    assertTrue(unused.contains(new Action.Unwrap(0)));
    assertTrue(unused.contains(new Action.Unwrap(1)));
  }

  @Test
  public void testNoLetWhenVariablesExhausted() {
    CursorInfo info = CursorInfoBuilder.build(Zipper.at(new Hole()));

    List<Action> actions = new ActionEnumerator(50).enumerate(info, false);

    assertFalse(actions.contains(construct(new Shape.Let(Shape.Side.LEFT))));
    assertFalse(actions.contains(construct(new Shape.Let(Shape.Side.RIGHT))));
  }

  @Test
  public void testReferencesFilteredByExpectedType() {
    // let x0 = 1 in let x1 = true in -(^?)
    Expr program = new Let(0, new IntE(1), new Let(1, new Bool(true), new UnOp(UnOpKind.NEG, new Hole())));
    CursorInfo info = CursorInfoBuilder.build(Zipper.at(program, 7));

    List<Action> actions = new ActionEnumerator(50).enumerate(info, true);

    // varsInScope 最近绑定在前：0 -> x1 (Bool)，1 -> x0 (Int)
    assertFalse(actions.contains(construct(new Shape.Var(0))));
    assertTrue(actions.contains(construct(new Shape.Var(1))));
  }

  @Test
  public void testPreviewWithholdsDefinitionThatBreaksBody() {
    // let x0 = ^1 in x0 + 1
    Expr program = new Let(0, new IntE(1), new BinOp(new Var(0), BinOpKind.PLUS, new IntE(1)));
    Zipper zipper = Zipper.at(program, 2);
    ActionEnumerator enumerator = new ActionEnumerator(50);
    Action toTrue = construct(new Shape.BoolLit(true));

    assertTrue(enumerator.enumerate(CursorInfoBuilder.build(zipper), true).contains(toTrue));
    assertFalse(enumerator.legalActions(zipper, new VarAllocator(10)).contains(toTrue));
    assertTrue(enumerator.legalActions(zipper, new VarAllocator(10)).contains(construct(new Shape.IntLit(2))));
  }

  @Test
  public void testRandomWalkStaysWellTyped() {
    ActionEnumerator enumerator = new ActionEnumerator(12);
    VarAllocator allocator = new VarAllocator(3);
    Random random = new Random(42);
    Zipper zipper = Zipper.at(new Hole());

    for (int step = 0; step < 300; step++) {
      List<Action> legal = enumerator.legalActions(zipper, allocator);
      if (legal.isEmpty()) {
        break;
      }
      Action action = legal.get(random.nextInt(legal.size()));
      zipper = new ActionApplicator(allocator).apply(zipper, action);

      Expr root = zipper.unzip();
      assertTrue(Terms.size(root) <= 12, Terms.show(root));
      assertTrue(Typing.synthesize(TypingContext.empty(), root).isPresent(), Terms.show(root));
    }
  }

  @Test
  public void testRandomWalkKeepsScopeAndEncodingConsistent() {
    for (long seed = 0; seed < 20; seed++) {
      ActionEnumerator enumerator = new ActionEnumerator(20);
      VarAllocator allocator = new VarAllocator(4);
      Random random = new Random(seed);
      Zipper zipper = Zipper.at(new Hole());

      for (int step = 0; step < 300; step++) {
        List<Action> legal = enumerator.legalActions(zipper, allocator);
        if (legal.isEmpty()) {
          break;
        }
        zipper = new ActionApplicator(allocator).apply(zipper, legal.get(random.nextInt(legal.size())));
        Expr root = zipper.unzip();
        String where = "seed " + seed + " step " + step + ": " + Terms.show(root);

        assertTrue(Terms.freeVars(root).isEmpty(), where);
        assertEquals(zipper, FlatCodec.unflatten(FlatCodec.flatten(zipper)), where);
        for (int index = 0; index < Terms.size(root); index++) {
          Zipper at;
          try {
            at = Zipper.at(root, index);
          } catch (IllegalArgumentException binder) {
            continue;
          }
          assertScopeBound(CursorInfoBuilder.build(at), where + " @" + index);
        }
      }
    }
  }

  private static void assertScopeBound(CursorInfo info, String where) {
    List<Integer> scoped = new ArrayList<>();
    info.varsInScope().forEach(v -> scoped.add(v.var()));
    info.argsInScope().forEach(a -> scoped.add(a.var()));
    for (int var : scoped) {
      long bindings = info.typingContext().bindings().stream().filter(b -> b.var() == var).count();
      assertEquals(1, bindings, where + " x" + var);
    }
  }
}
