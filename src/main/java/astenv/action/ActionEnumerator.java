package astenv.action;

import astenv.core.CoreModel.*;
import astenv.core.Terms;
import astenv.cursor.CursorInfo;
import astenv.cursor.CursorInfoBuilder;
import astenv.cursor.ScopeException;
import astenv.cursor.TypeCheckException;
import astenv.runtime.ErrorMessages;
import astenv.types.Typ;
import astenv.types.Types;
import astenv.typing.Typing;
import astenv.typing.TypingContext;
import astenv.zipper.Frame;
import astenv.zipper.Zipper;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 动作枚举器：根据光标快照与剩余节点预算给出全部合法动作。
 *
 * 输出无重复，顺序固定为：移动、原子、包裹、引用、unwrap。
 */
public final class ActionEnumerator {
  private static final Logger logger = Logger.getLogger(ActionEnumerator.class.getName());

  /** 可构造的整数字面量。 */
  public static final int MIN_INT_LITERAL = -2;
  public static final int MAX_INT_LITERAL = 2;

  private static final BinOpKind[] ARITHMETIC = {BinOpKind.PLUS, BinOpKind.MINUS, BinOpKind.TIMES, BinOpKind.DIV};
  private static final BinOpKind[] COMPARISON = {
      BinOpKind.LT, BinOpKind.LE, BinOpKind.GT, BinOpKind.GE, BinOpKind.EQ, BinOpKind.NE};

  private final int maxNodes;

  public ActionEnumerator(int maxNodes) {
    this.maxNodes = maxNodes;
  }

  public int maxNodes() {
    return maxNodes;
  }

  /**
   * 完整的合法动作集：规则筛选后，再对每个动作预演一次，
   * 只保留结果仍能在根部综合出类型、且不超出节点上限的动作。
   *
   * 规则基于相容关系，而相容关系不具传递性（例如修改 let 定义会影响主体中对该变量的使用），
   * 预演用于补上这一缺口。
   */
  public List<Action> legalActions(Zipper zipper, VarAllocator allocator) {
    CursorInfo info = CursorInfoBuilder.build(zipper);
    List<Action> candidates = enumerate(info, allocator.canAllocate());
    List<Action> legal = new ArrayList<>(candidates.size());
    for (Action action : candidates) {
      if (survivesPreview(zipper, action, allocator)) {
        legal.add(action);
      } else if (logger.isLoggable(Level.FINE)) {
        logger.fine("withholding " + action + " at index " + info.cursorPosition());
      }
    }
    return legal;
  }

  private boolean survivesPreview(Zipper zipper, Action action, VarAllocator allocator) {
    Zipper next = new ActionApplicator(allocator.copy()).apply(zipper, action);
    if (!(action instanceof Action.MoveParent) && !(action instanceof Action.MoveChild)) {
      Expr root = next.unzip();
      if (Terms.size(root) > maxNodes || Typing.synthesize(TypingContext.empty(), root).isEmpty()) {
        return false;
      }
    }
    try {
      // 新光标处也必须能继续枚举，否则下一步会卡死
      enumerate(CursorInfoBuilder.build(next), allocator.canAllocate());
      return true;
    } catch (TypeCheckException e) {
      logger.log(Level.FINE, "preview left the cursor in an untypeable position", e);
      return false;
    }
  }

  /**
   * 只按规则枚举（不预演）。
   *
   * @param info 光标快照
   * @param canAllocate 是否还能分配新的绑定变量
   */
  public List<Action> enumerate(CursorInfo info, boolean canAllocate) {
    Set<Action> actions = new LinkedHashSet<>();
    addMoves(info, actions);
    if (info.inType()) {
      return new ArrayList<>(actions);
    }

    Typ expected = info.expectedType();
    Typ actual = info.actualType();
    int remaining = maxNodes - info.numNodes();

    addAtoms(expected, actions);
    if (remaining >= 1) {
      addNeg(expected, actual, actions);
    }
    if (remaining >= 2) {
      addBinOps(expected, actual, actions);
    }
    if (remaining > 2) {
      if (canAllocate) {
        actions.add(new Action.Construct(new Shape.Let(Shape.Side.LEFT)));
        actions.add(new Action.Construct(new Shape.Let(Shape.Side.RIGHT)));
      }
      addIfs(expected, actual, actions);
      // fun/fix 包裹需要可编辑的参数类型标注，暂不提供
    }
    if (remaining >= 2) {
      addPairs(expected, actual, actions);
    }
    addReferences(info, expected, actions);
    if (remaining > 2) {
      addUnwraps(info, expected, actions);
    }
    return new ArrayList<>(actions);
  }

  private static void addMoves(CursorInfo info, Set<Action> actions) {
    Frame parent = info.parent();
    if (parent != null && !parent.starter()) {
      actions.add(new Action.MoveParent());
    }
    Term term = info.currentTerm();
    int children = Terms.children(term).size();
    if (term instanceof Let let) {
      Typ defType = Typing.synthesize(info.typingContext(), let.definition())
          .orElseThrow(() -> new TypeCheckException(ErrorMessages.typeCannotBeInferred(Terms.show(let.definition()))));
      // 定义仍是 Hole 类型时主体尚无意义，只允许进入定义
      children = defType == Typ.HOLE ? 1 : 2;
    }
    for (int n = 0; n < children; n++) {
      actions.add(new Action.MoveChild(n));
    }
  }

  private static void addAtoms(Typ expected, Set<Action> actions) {
    actions.add(new Action.Construct(new Shape.Hole()));
    if (Types.consistent(new Typ.ListOf(Typ.HOLE), expected)) {
      actions.add(new Action.Construct(new Shape.Nil()));
    }
    if (Types.consistent(Typ.INT, expected)) {
      for (int v = MIN_INT_LITERAL; v <= MAX_INT_LITERAL; v++) {
        actions.add(new Action.Construct(new Shape.IntLit(v)));
      }
    }
    if (Types.consistent(Typ.BOOL, expected)) {
      actions.add(new Action.Construct(new Shape.BoolLit(true)));
      actions.add(new Action.Construct(new Shape.BoolLit(false)));
    }
  }

  private static void addNeg(Typ expected, Typ actual, Set<Action> actions) {
    if (Types.consistent(Typ.INT, expected) && Types.consistent(Typ.INT, actual)) {
      actions.add(new Action.Construct(new Shape.Neg()));
    }
  }

  private static void addBinOps(Typ expected, Typ actual, Set<Action> actions) {
    boolean intFocus = Types.consistent(Typ.INT, actual);
    if (intFocus && Types.consistent(Typ.INT, expected)) {
      addBothSides(ARITHMETIC, actions);
    }
    if (intFocus && Types.consistent(Typ.BOOL, expected)) {
      addBothSides(COMPARISON, actions);
    }

    // 应用：焦点作为参数总是可行；作为函数时结果类型须与期望相容
    if (actual instanceof Typ.Arrow arrow) {
      if (Types.consistent(expected, arrow.result())) {
        actions.add(binOp(BinOpKind.AP, Shape.Side.LEFT));
      }
    } else if (actual == Typ.HOLE) {
      actions.add(binOp(BinOpKind.AP, Shape.Side.LEFT));
    }
    actions.add(binOp(BinOpKind.AP, Shape.Side.RIGHT));

    // cons：焦点作为表头需与元素类型相容，作为表尾需与列表类型相容
    if (expected instanceof Typ.ListOf list) {
      if (Types.consistent(actual, list.elem())) {
        actions.add(binOp(BinOpKind.CONS, Shape.Side.LEFT));
      }
      if (Types.consistent(actual, expected)) {
        actions.add(binOp(BinOpKind.CONS, Shape.Side.RIGHT));
      }
    } else if (expected == Typ.HOLE) {
      actions.add(binOp(BinOpKind.CONS, Shape.Side.LEFT));
      if (Types.consistent(actual, new Typ.ListOf(Typ.HOLE))) {
        actions.add(binOp(BinOpKind.CONS, Shape.Side.RIGHT));
      }
    }
  }

  private static void addBothSides(BinOpKind[] ops, Set<Action> actions) {
    for (BinOpKind op : ops) {
      actions.add(binOp(op, Shape.Side.LEFT));
    }
    for (BinOpKind op : ops) {
      actions.add(binOp(op, Shape.Side.RIGHT));
    }
  }

  private static Action binOp(BinOpKind op, Shape.Side side) {
    return new Action.Construct(new Shape.BinOp(op, side));
  }

  private static void addIfs(Typ expected, Typ actual, Set<Action> actions) {
    if (Types.consistent(actual, Typ.BOOL)) {
      actions.add(new Action.Construct(new Shape.If(Shape.IfSlot.COND)));
    }
    if (Types.consistent(actual, expected)) {
      actions.add(new Action.Construct(new Shape.If(Shape.IfSlot.THEN)));
      actions.add(new Action.Construct(new Shape.If(Shape.IfSlot.ELSE)));
    }
  }

  private static void addPairs(Typ expected, Typ actual, Set<Action> actions) {
    if (Types.consistent(expected, new Typ.Prod(actual, Typ.HOLE))) {
      actions.add(new Action.Construct(new Shape.Pair(Shape.Side.LEFT)));
    }
    if (Types.consistent(expected, new Typ.Prod(Typ.HOLE, actual))) {
      actions.add(new Action.Construct(new Shape.Pair(Shape.Side.RIGHT)));
    }
  }

  private static void addReferences(CursorInfo info, Typ expected, Set<Action> actions) {
    TypingContext ctx = info.typingContext();
    List<CursorInfo.ScopedVar> vars = info.varsInScope();
    for (int i = 0; i < vars.size(); i++) {
      if (Types.consistent(lookup(ctx, vars.get(i).var()), expected)) {
        actions.add(new Action.Construct(new Shape.Var(i)));
      }
    }
    List<CursorInfo.ScopedArg> args = info.argsInScope();
    for (int i = 0; i < args.size(); i++) {
      if (Types.consistent(lookup(ctx, args.get(i).var()), expected)) {
        actions.add(new Action.Construct(new Shape.Arg(i)));
      }
    }
  }

  private static Typ lookup(TypingContext ctx, int var) {
    return ctx.lookup(var).orElseThrow(() -> new ScopeException(ErrorMessages.variableNotInScope(var)));
  }

  /**
   * 每个表达式子节点单独判断：其综合类型与期望类型相容才能提升；
   * 若当前节点绑定的变量在该子节点中自由出现，提升会留下悬空引用，不允许。
   */
  private static void addUnwraps(CursorInfo info, Typ expected, Set<Action> actions) {
    Term term = info.currentTerm();
    TypingContext ctx = info.typingContext();
    if (term instanceof Let let) {
      Typ defType = synthesize(ctx, let.definition());
      if (Types.consistent(expected, defType)) {
        actions.add(new Action.Unwrap(0));
      }
      if (!Terms.occursFree(let.binder(), let.body())
          && Types.consistent(expected, synthesize(ctx.extend(let.binder(), defType), let.body()))) {
        actions.add(new Action.Unwrap(1));
      }
      return;
    }
    if (term instanceof Fun fun) {
      addBinderBodyUnwrap(ctx.extend(fun.binder(), Types.strip(fun.annotation())), fun.binder(), fun.body(), expected, actions);
      return;
    }
    if (term instanceof Fix fix) {
      addBinderBodyUnwrap(ctx.extend(fix.binder(), Types.strip(fix.annotation())), fix.binder(), fix.body(), expected, actions);
      return;
    }
    List<Term> children = Terms.children(term);
    for (int n = 0; n < children.size(); n++) {
      if (Types.consistent(expected, synthesize(ctx, (Expr) children.get(n)))) {
        actions.add(new Action.Unwrap(n));
      }
    }
  }

  private static void addBinderBodyUnwrap(TypingContext inner, int binder, Expr body, Typ expected, Set<Action> actions) {
    if (!Terms.occursFree(binder, body) && Types.consistent(expected, synthesize(inner, body))) {
      actions.add(new Action.Unwrap(1));
    }
  }

  private static Typ synthesize(TypingContext ctx, Expr expr) {
    return Typing.synthesize(ctx, expr)
        .orElseThrow(() -> new TypeCheckException(ErrorMessages.typeCannotBeInferred(Terms.show(expr))));
  }
}
