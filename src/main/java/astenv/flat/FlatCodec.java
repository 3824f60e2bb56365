package astenv.flat;

import astenv.core.CoreModel.*;
import astenv.runtime.ErrorMessages;
import astenv.zipper.Zipper;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 拉链与扁平节点/边表之间的转换。
 *
 * 节点表按前序排列，节点下标即光标线性下标；flatten 后 unflatten 得到完全相同的树与光标。
 */
public final class FlatCodec {
  /** 节点字中 kind 所占的位数。 */
  public static final int KIND_BITS = 6;
  private static final int KIND_MASK = (1 << KIND_BITS) - 1;
  /** payload 可表示的范围：去掉 kind 位后剩余的有符号位。 */
  public static final int MIN_PAYLOAD = Integer.MIN_VALUE >> KIND_BITS;
  public static final int MAX_PAYLOAD = Integer.MAX_VALUE >> KIND_BITS;

  /** 边的 slot：let/fun/fix 的绑定变量。 */
  public static final int SLOT_BINDER = 0;
  /** 边的 slot：let 定义或 fun/fix 类型标注。 */
  public static final int SLOT_DEFINITION = 1;
  /** 边的 slot：let/fun/fix 主体。 */
  public static final int SLOT_BODY = 2;

  private FlatCodec() {}

  public static boolean fitsPayload(int payload) {
    return payload >= MIN_PAYLOAD && payload <= MAX_PAYLOAD;
  }

  /**
   * @throws IllegalArgumentException payload 超出 [MIN_PAYLOAD, MAX_PAYLOAD]
   */
  public static int word(NodeKind kind, int payload) {
    if (!fitsPayload(payload)) {
      throw new IllegalArgumentException(ErrorMessages.invalidFlatEncoding(
          kind + " payload " + payload + " is outside [" + MIN_PAYLOAD + ", " + MAX_PAYLOAD + "]"));
    }
    return (payload << KIND_BITS) | kind.ordinal();
  }

  public static NodeKind kindOf(int word) {
    NodeKind kind = NodeKind.fromCode(word & KIND_MASK);
    if (kind == null) {
      throw new IllegalArgumentException(ErrorMessages.invalidFlatEncoding("unknown node kind in word " + word));
    }
    return kind;
  }

  public static int payloadOf(int word) {
    return word >> KIND_BITS;
  }

  // ==================== flatten ====================

  public static FlatTree flatten(Zipper zipper) {
    Writer writer = new Writer();
    writer.term(zipper.unzip(), -1, 0);
    return new FlatTree(
        writer.nodes.stream().mapToInt(Integer::intValue).toArray(),
        writer.edges.toArray(new int[0][]),
        writer.starter.stream().mapToInt(Integer::intValue).toArray(),
        0,
        zipper.cursorIndex());
  }

  private static final class Writer {
    final List<Integer> nodes = new ArrayList<>();
    final List<Integer> starter = new ArrayList<>();
    final List<int[]> edges = new ArrayList<>();

    int emit(NodeKind kind, int payload, boolean isStarter, int parent, int slot) {
      int index = nodes.size();
      nodes.add(word(kind, payload));
      starter.add(isStarter ? 1 : 0);
      if (parent >= 0) {
        edges.add(new int[] {parent, index, slot});
      }
      return index;
    }

    void term(Term term, int parent, int slot) {
      boolean s = term.starter();
      if (term instanceof Var v) { emit(NodeKind.VAR, v.id(), s, parent, slot); return; }
      if (term instanceof IntE i) { emit(NodeKind.INT, i.value(), s, parent, slot); return; }
      if (term instanceof Bool b) { emit(NodeKind.BOOL, b.value() ? 1 : 0, s, parent, slot); return; }
      if (term instanceof Nil) { emit(NodeKind.NIL, 0, s, parent, slot); return; }
      if (term instanceof Hole) { emit(NodeKind.HOLE, 0, s, parent, slot); return; }
      if (term instanceof UnOp u) {
        int self = emit(NodeKind.NEG, 0, s, parent, slot);
        term(u.arg(), self, 0);
        return;
      }
      if (term instanceof BinOp b) {
        int self = emit(NodeKind.of(b.op()), 0, s, parent, slot);
        term(b.left(), self, 0);
        term(b.right(), self, 1);
        return;
      }
      if (term instanceof Pair p) {
        int self = emit(NodeKind.PAIR, 0, s, parent, slot);
        term(p.left(), self, 0);
        term(p.right(), self, 1);
        return;
      }
      if (term instanceof If i) {
        int self = emit(NodeKind.IF, 0, s, parent, slot);
        term(i.cond(), self, 0);
        term(i.thenExpr(), self, 1);
        term(i.elseExpr(), self, 2);
        return;
      }
      if (term instanceof Let l) {
        int self = emit(NodeKind.LET, 0, s, parent, slot);
        emit(NodeKind.BINDER, l.binder(), s, self, SLOT_BINDER);
        term(l.definition(), self, SLOT_DEFINITION);
        term(l.body(), self, SLOT_BODY);
        return;
      }
      if (term instanceof Fun f) {
        binder(NodeKind.FUN, f.binder(), f.annotation(), f.body(), s, parent, slot);
        return;
      }
      if (term instanceof Fix f) {
        binder(NodeKind.FIX, f.binder(), f.annotation(), f.body(), s, parent, slot);
        return;
      }
      if (term instanceof IntT) { emit(NodeKind.T_INT, 0, s, parent, slot); return; }
      if (term instanceof BoolT) { emit(NodeKind.T_BOOL, 0, s, parent, slot); return; }
      if (term instanceof HoleT) { emit(NodeKind.T_HOLE, 0, s, parent, slot); return; }
      if (term instanceof ListT l) {
        int self = emit(NodeKind.T_LIST, 0, s, parent, slot);
        term(l.elem(), self, 0);
        return;
      }
      if (term instanceof ProdT p) {
        int self = emit(NodeKind.T_PROD, 0, s, parent, slot);
        term(p.left(), self, 0);
        term(p.right(), self, 1);
        return;
      }
      ArrowT a = (ArrowT) term;
      int self = emit(NodeKind.T_ARROW, 0, s, parent, slot);
      term(a.param(), self, 0);
      term(a.result(), self, 1);
    }

    void binder(NodeKind kind, int binder, Type annotation, Expr body, boolean s, int parent, int slot) {
      int self = emit(kind, 0, s, parent, slot);
      term(annotation, self, SLOT_DEFINITION);
      emit(NodeKind.BINDER, binder, s, self, SLOT_BINDER);
      term(body, self, SLOT_BODY);
    }
  }

  // ==================== unflatten ====================

  /**
   * 从扁平表重建拉链，光标位于 {@code tree.cursor()}。
   *
   * @throws IllegalArgumentException 表结构不完整或节点种类与位置不符
   */
  public static Zipper unflatten(FlatTree tree) {
    Reader reader = new Reader(tree);
    Term root = reader.term(tree.root());
    if (!(root instanceof Expr expr)) {
      throw new IllegalArgumentException(ErrorMessages.invalidFlatEncoding("root is not an expression"));
    }
    return Zipper.at(expr, tree.cursor() - tree.root());
  }

  private static final class Reader {
    final FlatTree tree;
    final Map<Integer, Map<Integer, Integer>> children = new HashMap<>();

    Reader(FlatTree tree) {
      this.tree = tree;
      for (int[] edge : tree.edges()) {
        if (edge.length != 3) {
          throw new IllegalArgumentException(ErrorMessages.invalidFlatEncoding("edge rows must have 3 columns"));
        }
        children.computeIfAbsent(edge[0], k -> new HashMap<>()).put(edge[2], edge[1]);
      }
    }

    Term term(int index) {
      if (index < 0 || index >= tree.nodes().length) {
        throw new IllegalArgumentException(ErrorMessages.invalidFlatEncoding("node index " + index + " out of range"));
      }
      int word = tree.nodes()[index];
      NodeKind kind = kindOf(word);
      int payload = payloadOf(word);
      boolean s = tree.starter()[index] != 0;
      if (kind.isBinOp()) {
        return new BinOp(expr(child(index, 0)), kind.binOp(), expr(child(index, 1)), s);
      }
      switch (kind) {
        case HOLE: return new Hole(s);
        case NIL: return new Nil(s);
        case INT: return new IntE(payload, s);
        case BOOL: return new Bool(payload != 0, s);
        case VAR: return new Var(payload, s);
        case NEG: return new UnOp(UnOpKind.NEG, expr(child(index, 0)), s);
        case IF: return new If(expr(child(index, 0)), expr(child(index, 1)), expr(child(index, 2)), s);
        case PAIR: return new Pair(expr(child(index, 0)), expr(child(index, 1)), s);
        case LET:
          return new Let(binder(index), expr(child(index, SLOT_DEFINITION)), expr(child(index, SLOT_BODY)), s);
        case FUN:
          return new Fun(binder(index), type(child(index, SLOT_DEFINITION)), expr(child(index, SLOT_BODY)), s);
        case FIX:
          return new Fix(binder(index), type(child(index, SLOT_DEFINITION)), expr(child(index, SLOT_BODY)), s);
        case T_INT: return new IntT(s);
        case T_BOOL: return new BoolT(s);
        case T_HOLE: return new HoleT(s);
        case T_LIST: return new ListT(type(child(index, 0)), s);
        case T_PROD: return new ProdT(type(child(index, 0)), type(child(index, 1)), s);
        case T_ARROW: return new ArrowT(type(child(index, 0)), type(child(index, 1)), s);
        default:
          throw new IllegalArgumentException(ErrorMessages.invalidFlatEncoding("unexpected " + kind + " at " + index));
      }
    }

    int child(int parent, int slot) {
      Map<Integer, Integer> slots = children.get(parent);
      Integer child = slots == null ? null : slots.get(slot);
      if (child == null) {
        throw new IllegalArgumentException(
            ErrorMessages.invalidFlatEncoding("node " + parent + " has no child in slot " + slot));
      }
      return child;
    }

    int binder(int parent) {
      int index = child(parent, SLOT_BINDER);
      int word = tree.nodes()[index];
      if (kindOf(word) != NodeKind.BINDER) {
        throw new IllegalArgumentException(ErrorMessages.invalidFlatEncoding("node " + index + " is not a binder"));
      }
      return payloadOf(word);
    }

    Expr expr(int index) {
      Term term = term(index);
      if (!(term instanceof Expr e)) {
        throw new IllegalArgumentException(ErrorMessages.invalidFlatEncoding("node " + index + " is not an expression"));
      }
      return e;
    }

    Type type(int index) {
      Term term = term(index);
      if (!(term instanceof Type t)) {
        throw new IllegalArgumentException(ErrorMessages.invalidFlatEncoding("node " + index + " is not a type"));
      }
      return t;
    }
  }
}
