package astenv.action;

import astenv.core.CoreModel;
import astenv.core.CoreModel.Expr;
import astenv.core.CoreModel.Term;
import astenv.core.Terms;
import astenv.cursor.CursorInfo;
import astenv.cursor.CursorInfoBuilder;
import astenv.zipper.Frame;
import astenv.zipper.Zipper;
import java.util.List;
import java.util.Optional;

/**
 * 状态转移：对拉链应用一个动作，得到新的拉链。
 *
 * 纯结构改写，递归深度不超过树高。合法性由 {@link ActionEnumerator} 把关，
 * 这里对不可能执行的移动（没有父节点、子节点不存在）按空操作处理。
 */
public final class ActionApplicator {
  private final VarAllocator allocator;

  public ActionApplicator(VarAllocator allocator) {
    this.allocator = allocator;
  }

  public Zipper apply(Zipper zipper, Action action) {
    if (action instanceof Action.MoveParent) {
      Optional<Frame> parent = zipper.parent();
      if (parent.isEmpty() || parent.get().starter()) {
        return zipper;
      }
      return zipper.up().orElse(zipper);
    }
    if (action instanceof Action.MoveChild move) {
      return zipper.down(move.child()).orElse(zipper);
    }
    if (action instanceof Action.Unwrap unwrap) {
      List<Term> children = Terms.children(zipper.focus());
      if (zipper.inType() || unwrap.child() < 0 || unwrap.child() >= children.size()) {
        return zipper;
      }
      Term child = children.get(unwrap.child());
      return child instanceof Expr ? zipper.replace(child) : zipper;
    }
    if (zipper.inType()) {
      return zipper;
    }
    return construct(zipper, ((Action.Construct) action).shape());
  }

  private Zipper construct(Zipper zipper, Shape shape) {
    Expr focus = (Expr) zipper.focus();
    if (shape instanceof Shape.Hole) return zipper.replace(new CoreModel.Hole());
    if (shape instanceof Shape.Nil) return zipper.replace(new CoreModel.Nil());
    if (shape instanceof Shape.IntLit lit) return zipper.replace(new CoreModel.IntE(lit.value()));
    if (shape instanceof Shape.BoolLit lit) return zipper.replace(new CoreModel.Bool(lit.value()));
    if (shape instanceof Shape.Var ref) {
      CursorInfo info = CursorInfoBuilder.build(zipper);
      return zipper.replace(new CoreModel.Var(info.varsInScope().get(ref.index()).var()));
    }
    if (shape instanceof Shape.Arg ref) {
      CursorInfo info = CursorInfoBuilder.build(zipper);
      return zipper.replace(new CoreModel.Var(info.argsInScope().get(ref.index()).var()));
    }
    if (shape instanceof Shape.Neg) {
      return wrap(zipper, new CoreModel.UnOp(CoreModel.UnOpKind.NEG, focus), 0);
    }
    if (shape instanceof Shape.BinOp binOp) {
      return binOp.side() == Shape.Side.LEFT
          ? wrap(zipper, new CoreModel.BinOp(focus, binOp.op(), new CoreModel.Hole()), 0)
          : wrap(zipper, new CoreModel.BinOp(new CoreModel.Hole(), binOp.op(), focus), 1);
    }
    if (shape instanceof Shape.Let let) {
      int binder = allocator.allocate();
      return let.side() == Shape.Side.LEFT
          ? wrap(zipper, new CoreModel.Let(binder, focus, new CoreModel.Hole()), 0)
          : wrap(zipper, new CoreModel.Let(binder, new CoreModel.Hole(), focus), 1);
    }
    if (shape instanceof Shape.If ifShape) {
      switch (ifShape.slot()) {
        case COND:
          return wrap(zipper, new CoreModel.If(focus, new CoreModel.Hole(), new CoreModel.Hole()), 0);
        case THEN:
          return wrap(zipper, new CoreModel.If(new CoreModel.Hole(), focus, new CoreModel.Hole()), 1);
        default:
          return wrap(zipper, new CoreModel.If(new CoreModel.Hole(), new CoreModel.Hole(), focus), 2);
      }
    }
    if (shape instanceof Shape.Pair pair) {
      return pair.side() == Shape.Side.LEFT
          ? wrap(zipper, new CoreModel.Pair(focus, new CoreModel.Hole()), 0)
          : wrap(zipper, new CoreModel.Pair(new CoreModel.Hole(), focus), 1);
    }
    if (shape instanceof Shape.Fun) {
      return wrap(zipper, new CoreModel.Fun(allocator.allocate(), new CoreModel.HoleT(), focus), 1);
    }
    return wrap(zipper, new CoreModel.Fix(allocator.allocate(), new CoreModel.HoleT(), focus), 1);
  }

  /** 用新节点替换焦点，光标随原焦点进入新节点的第 child 个位置。 */
  private static Zipper wrap(Zipper zipper, Expr wrapper, int child) {
    return zipper.replace(wrapper).down(child).orElseThrow();
  }
}
