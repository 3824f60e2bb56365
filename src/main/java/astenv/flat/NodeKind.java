package astenv.flat;

import astenv.core.CoreModel.BinOpKind;

/**
 * 扁平节点表中的节点种类，编码为枚举序号。
 */
public enum NodeKind {
  HOLE, NIL, INT, BOOL, VAR, NEG,
  PLUS, MINUS, TIMES, DIV, LT, LE, GT, GE, EQ, NE, CONS, AP,
  IF, LET, FUN, FIX, PAIR,
  /** let/fun/fix 绑定的变量，payload 为变量编号。 */
  BINDER,
  T_INT, T_BOOL, T_HOLE, T_LIST, T_PROD, T_ARROW;

  private static final NodeKind[] VALUES = values();

  public static NodeKind of(BinOpKind op) {
    return VALUES[PLUS.ordinal() + op.ordinal()];
  }

  public static NodeKind fromCode(int code) {
    if (code < 0 || code >= VALUES.length) {
      return null;
    }
    return VALUES[code];
  }

  public boolean isBinOp() {
    return ordinal() >= PLUS.ordinal() && ordinal() <= AP.ordinal();
  }

  public BinOpKind binOp() {
    if (!isBinOp()) {
      throw new IllegalStateException(this + " is not a binary operator");
    }
    return BinOpKind.values()[ordinal() - PLUS.ordinal()];
  }
}
