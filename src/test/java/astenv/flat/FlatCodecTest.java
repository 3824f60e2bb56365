package astenv.flat;

import astenv.core.CoreModel.*;
import astenv.core.Terms;
import astenv.zipper.Zipper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FlatCodecTest {
  private static final Expr PROGRAM = Terms.markStarter(new Let(0,
      new Fix(1, new ArrowT(new IntT(), new IntT()),
          new Fun(2, new IntT(),
              new If(new BinOp(new Var(2), BinOpKind.LE, new IntE(0)),
                  new IntE(1),
                  new BinOp(new Var(1), BinOpKind.AP, new BinOp(new Var(2), BinOpKind.MINUS, new IntE(1)))))),
      new Hole()));

  @Test
  public void testNodeTableIsPreorder() {
    Expr expr = new Let(0, new IntE(-2), new Var(0));

    FlatTree tree = FlatCodec.flatten(Zipper.at(expr, 3));

    assertEquals(4, tree.nodeCount());
    assertEquals(NodeKind.LET, FlatCodec.kindOf(tree.nodes()[0]));
    assertEquals(NodeKind.BINDER, FlatCodec.kindOf(tree.nodes()[1]));
    assertEquals(0, FlatCodec.payloadOf(tree.nodes()[1]));
    assertEquals(NodeKind.INT, FlatCodec.kindOf(tree.nodes()[2]));
    assertEquals(-2, FlatCodec.payloadOf(tree.nodes()[2]));
    assertEquals(NodeKind.VAR, FlatCodec.kindOf(tree.nodes()[3]));
    assertArrayEquals(new int[] {0, 1, FlatCodec.SLOT_BINDER}, tree.edges()[0]);
    assertArrayEquals(new int[] {0, 2, FlatCodec.SLOT_DEFINITION}, tree.edges()[1]);
    assertArrayEquals(new int[] {0, 3, FlatCodec.SLOT_BODY}, tree.edges()[2]);
    assertEquals(0, tree.root());
    assertEquals(3, tree.cursor());
  }

  @Test
  public void testRoundTripPreservesTreeAndCursor() {
    for (int index = 0; index < Terms.size(PROGRAM); index++) {
      Zipper zipper;
      try {
        zipper = Zipper.at(PROGRAM, index);
      } catch (IllegalArgumentException binder) {
        continue;
      }
      Zipper back = FlatCodec.unflatten(FlatCodec.flatten(zipper));
      assertEquals(zipper, back, "index " + index);
      assertEquals(index, back.cursorIndex());
    }
  }

  @Test
  public void testStarterFlagsSurvive() {
    Zipper edited = Zipper.at(PROGRAM, Terms.size(PROGRAM) - 1).replace(new IntE(2));

    FlatTree tree = FlatCodec.flatten(edited);

    assertEquals(1, tree.starter()[0]);
    assertEquals(0, tree.starter()[tree.nodeCount() - 1]);
    assertEquals(edited.unzip(), FlatCodec.unflatten(tree).unzip());
  }

  @Test
  public void testMissingChildIsRejected() {
    FlatTree tree = FlatCodec.flatten(Zipper.at(new Pair(new IntE(1), new IntE(2))));
    FlatTree broken = new FlatTree(tree.nodes(), new int[][] {tree.edges()[0]}, tree.starter(), 0, 0);

    assertThrows(IllegalArgumentException.class, () -> FlatCodec.unflatten(broken));
  }

  @Test
  public void testUnknownKindIsRejected() {
    FlatTree tree = new FlatTree(new int[] {63}, new int[0][], new int[] {0}, 0, 0);

    assertThrows(IllegalArgumentException.class, () -> FlatCodec.unflatten(tree));
  }

  @Test
  public void testIntLiteralAtPayloadBounds() {
    assertEquals(-(1 << 25), FlatCodec.MIN_PAYLOAD);
    assertEquals((1 << 25) - 1, FlatCodec.MAX_PAYLOAD);
    for (int value : new int[] {FlatCodec.MIN_PAYLOAD, FlatCodec.MAX_PAYLOAD}) {
      Zipper zipper = Zipper.at(new BinOp(new IntE(value), BinOpKind.PLUS, new Hole()), 2);
      assertEquals(zipper, FlatCodec.unflatten(FlatCodec.flatten(zipper)), "value " + value);
    }
  }

  @Test
  public void testIntLiteralOutsidePayloadBoundsIsRejected() {
    for (int value : new int[] {1 << 25, -(1 << 25) - 1, 1 << 26}) {
      Zipper zipper = Zipper.at(new BinOp(new IntE(value), BinOpKind.PLUS, new Hole()), 2);
      assertThrows(IllegalArgumentException.class, () -> FlatCodec.flatten(zipper), "value " + value);
    }
    assertThrows(IllegalArgumentException.class, () -> FlatCodec.word(NodeKind.INT, 1 << 25));
  }
}
