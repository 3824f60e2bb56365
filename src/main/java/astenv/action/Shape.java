package astenv.action;

import astenv.core.CoreModel.BinOpKind;

/**
 * 构造动作的形状：原子、对当前焦点的包裹，以及按作用域位置的变量/参数引用。
 *
 * 包裹类形状用 {@link Side} 或 {@link IfSlot} 标明原焦点落在新节点的哪个位置。
 */
public sealed interface Shape {

  enum Side { LEFT, RIGHT }

  enum IfSlot { COND, THEN, ELSE }

  record Hole() implements Shape {}

  record Nil() implements Shape {}

  record IntLit(int value) implements Shape {}

  record BoolLit(boolean value) implements Shape {}

  /** 取负包裹。 */
  record Neg() implements Shape {}

  /** 二元运算包裹；LEFT 表示原焦点成为左操作数。 */
  record BinOp(BinOpKind op, Side side) implements Shape {}

  /** let 包裹；LEFT 表示原焦点成为定义，RIGHT 表示原焦点成为主体。 */
  record Let(Side side) implements Shape {}

  record If(IfSlot slot) implements Shape {}

  record Pair(Side side) implements Shape {}

  /** fun 包裹，原焦点成为函数体，参数类型标注为 Hole。 */
  record Fun() implements Shape {}

  record Fix() implements Shape {}

  /** 引用 varsInScope 中第 index 个变量。 */
  record Var(int index) implements Shape {}

  /** 引用 argsInScope 中第 index 个参数。 */
  record Arg(int index) implements Shape {}
}
