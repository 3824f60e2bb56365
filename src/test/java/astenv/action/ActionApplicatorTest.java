package astenv.action;

import astenv.core.CoreModel.*;
import astenv.core.Terms;
import astenv.zipper.Zipper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public class ActionApplicatorTest {
  private VarAllocator allocator;
  private ActionApplicator applicator;

  @BeforeEach
  public void setUp() {
    allocator = new VarAllocator(10);
    applicator = new ActionApplicator(allocator);
  }

  private static Action construct(Shape shape) {
    return new Action.Construct(shape);
  }

  @Test
  public void testAtomReplacesFocus() {
    Zipper next = applicator.apply(Zipper.at(new Hole()), construct(new Shape.IntLit(-2)));

    assertEquals(new IntE(-2), next.unzip());
    assertEquals(0, next.cursorIndex());
  }

  @Test
  public void testBinOpWrapKeepsCursorOnOriginalFocus() {
    Zipper left = applicator.apply(Zipper.at(new IntE(1)),
        construct(new Shape.BinOp(BinOpKind.PLUS, Shape.Side.LEFT)));
    assertEquals(new BinOp(new IntE(1), BinOpKind.PLUS, new Hole()), left.unzip());
    assertEquals(new IntE(1), left.focus());
    assertEquals(1, left.cursorIndex());

    Zipper right = applicator.apply(Zipper.at(new IntE(1)),
        construct(new Shape.BinOp(BinOpKind.CONS, Shape.Side.RIGHT)));
    assertEquals(new BinOp(new Hole(), BinOpKind.CONS, new IntE(1)), right.unzip());
    assertEquals(2, right.cursorIndex());
  }

  @Test
  public void testLetWrapAllocatesFreshBinders() {
    Zipper first = applicator.apply(Zipper.at(new IntE(1)), construct(new Shape.Let(Shape.Side.LEFT)));
    assertEquals(new Let(0, new IntE(1), new Hole()), first.unzip());
    assertEquals(2, first.cursorIndex());

    Zipper second = applicator.apply(first, construct(new Shape.Let(Shape.Side.RIGHT)));
    assertEquals(new Let(0, new Let(1, new Hole(), new IntE(1)), new Hole()), second.unzip());
    assertEquals(new IntE(1), second.focus());
    assertEquals(2, allocator.allocated());
  }

  @Test
  public void testIfWrapPlacesFocusInRequestedSlot() {
    Zipper next = applicator.apply(Zipper.at(new Bool(true)), construct(new Shape.If(Shape.IfSlot.ELSE)));

    assertEquals(new If(new Hole(), new Hole(), new Bool(true)), next.unzip());
    assertEquals(3, next.cursorIndex());
  }

  @Test
  public void testVariableReference() {
    // let x0 = 1 in ^?
    Zipper zipper = Zipper.at(new Let(0, new IntE(1), new Hole()), 3);

    Zipper next = applicator.apply(zipper, construct(new Shape.Var(0)));

    assertEquals(new Let(0, new IntE(1), new Var(0)), next.unzip());
  }

  @Test
  public void testArgumentReference() {
    // fun (x4 : Int) -> ^?
    Zipper zipper = Zipper.at(new Fun(4, new IntT(), new Hole()), 3);

    Zipper next = applicator.apply(zipper, construct(new Shape.Arg(0)));

    assertEquals(new Fun(4, new IntT(), new Var(4)), next.unzip());
  }

  @Test
  public void testUnwrapPromotesChild() {
    Zipper zipper = Zipper.at(new Let(0, new IntE(7), new BinOp(new IntE(1), BinOpKind.TIMES, new IntE(2))), 3);

    Zipper next = applicator.apply(zipper, new Action.Unwrap(1));

    assertEquals(new Let(0, new IntE(7), new IntE(2)), next.unzip());
    assertEquals(3, next.cursorIndex());
  }

  @Test
  public void testImpossibleMovesAreNoOps() {
    Zipper root = Zipper.at(new IntE(1));

    assertSame(root, applicator.apply(root, new Action.MoveParent()));
    assertSame(root, applicator.apply(root, new Action.MoveChild(0)));
    assertSame(root, applicator.apply(root, new Action.Unwrap(2)));
  }

  @Test
  public void testMoveParentBlockedByStarterParent() {
    Expr program = Terms.markStarter(new UnOp(UnOpKind.NEG, new Hole()));
    Zipper zipper = Zipper.at(program, 1);

    assertSame(zipper, applicator.apply(zipper, new Action.MoveParent()));
  }

  @Test
  public void testMovesNavigateTree() {
    Zipper root = Zipper.at(new If(new Bool(true), new IntE(1), new IntE(2)));

    Zipper elseBranch = applicator.apply(root, new Action.MoveChild(2));
    assertEquals(new IntE(2), elseBranch.focus());
    assertEquals(3, elseBranch.cursorIndex());

    Zipper back = applicator.apply(elseBranch, new Action.MoveParent());
    assertEquals(root, back);
  }
}
