package astenv.action;

import astenv.core.CoreModel.BinOpKind;
import astenv.runtime.ErrorMessages;
import java.util.Collection;

/**
 * 动作与整数编号之间的双向映射，供宿主以定长掩码表示合法动作。
 *
 * 编号布局：
 * <pre>
 *  0        移动到父节点
 *  1..3     移动到第 0..2 个子节点
 *  4        Hole
 *  5        Nil
 *  6..10    整数 -2..2
 *  11..12   true / false
 *  13       取负
 *  14..25   二元运算，原焦点在左（按 BinOpKind 顺序）
 *  26..37   二元运算，原焦点在右
 *  38..39   let（焦点为定义 / 主体）
 *  40..42   if（焦点为条件 / then / else）
 *  43..44   fun / fix
 *  45..46   pair（焦点在左 / 右）
 *  47..49   unwrap 0..2
 *  50..     变量引用 0..maxVars-1，随后是参数引用 0..maxVars-1
 * </pre>
 */
public final class ActionCodec {
  public static final int NUM_FIXED_ACTIONS = 50;

  private static final int MOVE_CHILD = 1;
  private static final int HOLE = 4;
  private static final int NIL = 5;
  private static final int INT = 6;
  private static final int BOOL = 11;
  private static final int NEG = 13;
  private static final int BINOP_LEFT = 14;
  private static final int BINOP_RIGHT = BINOP_LEFT + BinOpKind.values().length;
  private static final int LET = 38;
  private static final int IF = 40;
  private static final int FUN = 43;
  private static final int FIX = 44;
  private static final int PAIR = 45;
  private static final int UNWRAP = 47;
  private static final int MAX_CHILDREN = 3;

  private final int maxVars;

  public ActionCodec(int maxVars) {
    this.maxVars = maxVars;
  }

  /** 编号总数，即动作掩码的长度。 */
  public int size() {
    return NUM_FIXED_ACTIONS + 2 * maxVars;
  }

  public int encode(Action action) {
    if (action instanceof Action.MoveParent) return 0;
    if (action instanceof Action.MoveChild move) return MOVE_CHILD + checkChild(move.child());
    if (action instanceof Action.Unwrap unwrap) return UNWRAP + checkChild(unwrap.child());
    Shape shape = ((Action.Construct) action).shape();
    if (shape instanceof Shape.Hole) return HOLE;
    if (shape instanceof Shape.Nil) return NIL;
    if (shape instanceof Shape.IntLit lit) {
      if (lit.value() < ActionEnumerator.MIN_INT_LITERAL || lit.value() > ActionEnumerator.MAX_INT_LITERAL) {
        throw new IllegalArgumentException("Integer literal has no action tag: " + lit.value());
      }
      return INT + lit.value() - ActionEnumerator.MIN_INT_LITERAL;
    }
    if (shape instanceof Shape.BoolLit lit) return lit.value() ? BOOL : BOOL + 1;
    if (shape instanceof Shape.Neg) return NEG;
    if (shape instanceof Shape.BinOp binOp) {
      return (binOp.side() == Shape.Side.LEFT ? BINOP_LEFT : BINOP_RIGHT) + binOp.op().ordinal();
    }
    if (shape instanceof Shape.Let let) return LET + let.side().ordinal();
    if (shape instanceof Shape.If ifShape) return IF + ifShape.slot().ordinal();
    if (shape instanceof Shape.Fun) return FUN;
    if (shape instanceof Shape.Fix) return FIX;
    if (shape instanceof Shape.Pair pair) return PAIR + pair.side().ordinal();
    if (shape instanceof Shape.Var ref) return NUM_FIXED_ACTIONS + checkRef(ref.index());
    Shape.Arg ref = (Shape.Arg) shape;
    return NUM_FIXED_ACTIONS + maxVars + checkRef(ref.index());
  }

  /**
   * @throws IllegalArgumentException 编号越界
   */
  public Action decode(int tag) {
    if (tag < 0 || tag >= size()) {
      throw new IllegalArgumentException(ErrorMessages.actionTagOutOfRange(tag, size()));
    }
    if (tag == 0) return new Action.MoveParent();
    if (tag < HOLE) return new Action.MoveChild(tag - MOVE_CHILD);
    if (tag == HOLE) return construct(new Shape.Hole());
    if (tag == NIL) return construct(new Shape.Nil());
    if (tag < BOOL) return construct(new Shape.IntLit(tag - INT + ActionEnumerator.MIN_INT_LITERAL));
    if (tag < NEG) return construct(new Shape.BoolLit(tag == BOOL));
    if (tag == NEG) return construct(new Shape.Neg());
    if (tag < BINOP_RIGHT) return construct(new Shape.BinOp(BinOpKind.values()[tag - BINOP_LEFT], Shape.Side.LEFT));
    if (tag < LET) return construct(new Shape.BinOp(BinOpKind.values()[tag - BINOP_RIGHT], Shape.Side.RIGHT));
    if (tag < IF) return construct(new Shape.Let(Shape.Side.values()[tag - LET]));
    if (tag < FUN) return construct(new Shape.If(Shape.IfSlot.values()[tag - IF]));
    if (tag == FUN) return construct(new Shape.Fun());
    if (tag == FIX) return construct(new Shape.Fix());
    if (tag < UNWRAP) return construct(new Shape.Pair(Shape.Side.values()[tag - PAIR]));
    if (tag < NUM_FIXED_ACTIONS) return new Action.Unwrap(tag - UNWRAP);
    if (tag < NUM_FIXED_ACTIONS + maxVars) return construct(new Shape.Var(tag - NUM_FIXED_ACTIONS));
    return construct(new Shape.Arg(tag - NUM_FIXED_ACTIONS - maxVars));
  }

  /**
   * 0/1 掩码，长度为 {@link #size()}。
   */
  public int[] mask(Collection<Action> actions) {
    int[] mask = new int[size()];
    for (Action action : actions) {
      mask[encode(action)] = 1;
    }
    return mask;
  }

  private static Action construct(Shape shape) {
    return new Action.Construct(shape);
  }

  private static int checkChild(int child) {
    if (child < 0 || child >= MAX_CHILDREN) {
      throw new IllegalArgumentException("Child index has no action tag: " + child);
    }
    return child;
  }

  private int checkRef(int index) {
    if (index < 0 || index >= maxVars) {
      throw new IllegalArgumentException("Reference index has no action tag: " + index);
    }
    return index;
  }
}
