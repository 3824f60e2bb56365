package astenv.cursor;

import astenv.core.CoreModel.*;
import astenv.core.Terms;
import astenv.cursor.CursorInfo.ScopedArg;
import astenv.cursor.CursorInfo.ScopedVar;
import astenv.runtime.ErrorMessages;
import astenv.types.Typ;
import astenv.types.Types;
import astenv.typing.Typing;
import astenv.typing.TypingContext;
import astenv.zipper.Frame;
import astenv.zipper.Zipper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 沿拉链路径从根向光标下降一次，同时计算：
 * 1. 每一层下推的期望类型（分析义务）
 * 2. 作用域：let 变量与 fun/fix 参数，以及类型上下文
 * 3. 光标的前序线性下标（跳过的兄弟子树大小之和）
 * 4. 光标处子树的综合类型
 *
 * 任何必须存在的类型推导失败都以 {@link TypeCheckException} 抛出。
 */
public final class CursorInfoBuilder {
  private static final Logger logger = Logger.getLogger(CursorInfoBuilder.class.getName());

  private CursorInfoBuilder() {}

  public static CursorInfo build(Zipper zipper) {
    Expr root = zipper.unzip();
    int numNodes = Terms.size(root);

    Term current = root;
    List<ScopedVar> vars = new ArrayList<>();
    List<ScopedArg> args = new ArrayList<>();
    TypingContext ctx = TypingContext.empty();
    Typ expected = Typ.HOLE;
    int index = 0;
    Frame previous = null;

    for (Frame frame : zipper.path()) {
      if (current instanceof Expr && frame.inExpression()
          && !(frame instanceof Frame.FunParam) && !(frame instanceof Frame.FixParam)) {
        if (frame instanceof Frame.LetBody letBody) {
          Typ defType = synthesizeOrThrow(ctx, letBody.definition());
          vars.add(0, new ScopedVar(letBody.binder(), index + 1));
          ctx = ctx.extend(letBody.binder(), defType);
        } else if (frame instanceof Frame.FunBody funBody) {
          args.add(0, nextArg(funBody.binder(), previous, args));
          ctx = ctx.extend(funBody.binder(), Types.strip(funBody.annotation()));
        } else if (frame instanceof Frame.FixBody fixBody) {
          args.add(0, nextArg(fixBody.binder(), previous, args));
          ctx = ctx.extend(fixBody.binder(), Types.strip(fixBody.annotation()));
        }
        expected = expectedForChild(frame, ctx, expected);
      }
      index += frame.offset();
      current = Terms.children(current).get(frame.slot());
      previous = frame;
    }

    Frame parent = zipper.parent().orElse(null);
    if (current instanceof Type) {
      // 类型标注中没有变量，作用域与类型上下文均为空
      return new CursorInfo(current, parent, List.of(), List.of(), TypingContext.empty(),
          null, null, index, numNodes, zipper);
    }
    Typ actual = synthesizeOrThrow(ctx, (Expr) current);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("cursor at " + index + "/" + numNodes + " focus=" + Terms.show(current)
          + " expected=" + Types.show(expected) + " actual=" + Types.show(actual));
    }
    return new CursorInfo(current, parent, Collections.unmodifiableList(vars),
        Collections.unmodifiableList(args), ctx, expected, actual, index, numNodes, zipper);
  }

  /**
   * 计算进入 frame 所指子节点时的期望类型。绑定已在调用前加入 {@code ctx}。
   */
  private static Typ expectedForChild(Frame frame, TypingContext ctx, Typ expected) {
    if (frame instanceof Frame.UnOpArg) {
      return Typ.INT;
    }
    if (frame instanceof Frame.BinOpLeft left) {
      BinOpKind op = left.op();
      if (op == BinOpKind.CONS) {
        Typ tail = synthesizeOrThrow(ctx, left.right());
        if (tail == Typ.HOLE) return Typ.HOLE;
        if (tail instanceof Typ.ListOf list) return list.elem();
        throw new TypeCheckException(ErrorMessages.typeExpectedShape("list", Types.show(tail)));
      }
      if (op == BinOpKind.AP) {
        return new Typ.Arrow(synthesizeOrThrow(ctx, left.right()), expected);
      }
      return Typ.INT;
    }
    if (frame instanceof Frame.BinOpRight right) {
      BinOpKind op = right.op();
      if (op == BinOpKind.CONS) {
        return new Typ.ListOf(synthesizeOrThrow(ctx, right.left()));
      }
      if (op == BinOpKind.AP) {
        Typ fn = synthesizeOrThrow(ctx, right.left());
        if (fn == Typ.HOLE) return Typ.HOLE;
        if (fn instanceof Typ.Arrow arrow) return arrow.param();
        throw new TypeCheckException(ErrorMessages.typeExpectedShape("function", Types.show(fn)));
      }
      return Typ.INT;
    }
    if (frame instanceof Frame.IfCond) {
      return Typ.BOOL;
    }
    if (frame instanceof Frame.IfThen ifThen) {
      return branchType(expected, synthesizeOrThrow(ctx, ifThen.elseExpr()));
    }
    if (frame instanceof Frame.IfElse ifElse) {
      return branchType(expected, synthesizeOrThrow(ctx, ifElse.thenExpr()));
    }
    if (frame instanceof Frame.LetDef) {
      return Typ.HOLE;
    }
    if (frame instanceof Frame.LetBody) {
      return expected;
    }
    if (frame instanceof Frame.FunBody) {
      if (expected == Typ.HOLE) return Typ.HOLE;
      if (expected instanceof Typ.Arrow arrow) return arrow.result();
      throw new TypeCheckException(ErrorMessages.typeExpectedShape("function", Types.show(expected)));
    }
    if (frame instanceof Frame.FixBody fixBody) {
      return Types.strip(fixBody.annotation());
    }
    if (frame instanceof Frame.PairLeft) {
      if (expected == Typ.HOLE) return Typ.HOLE;
      if (expected instanceof Typ.Prod prod) return prod.left();
      throw new TypeCheckException(ErrorMessages.typeExpectedShape("product", Types.show(expected)));
    }
    if (frame instanceof Frame.PairRight) {
      if (expected == Typ.HOLE) return Typ.HOLE;
      if (expected instanceof Typ.Prod prod) return prod.right();
      throw new TypeCheckException(ErrorMessages.typeExpectedShape("product", Types.show(expected)));
    }
    throw new IllegalStateException("Unexpected frame " + frame);
  }

  private static Typ branchType(Typ expected, Typ otherBranch) {
    return Types.commonType(expected, otherBranch).orElseThrow(() -> new TypeCheckException(
        ErrorMessages.conflictingBranchTypes(Types.show(expected), Types.show(otherBranch))));
  }

  /**
   * 直接嵌套在另一个 fun 主体中的 fun/fix 属于同一函数的后续参数；否则开启新的函数序号。
   */
  private static ScopedArg nextArg(int var, Frame previous, List<ScopedArg> args) {
    if (previous instanceof Frame.FunBody && !args.isEmpty()) {
      ScopedArg last = args.get(0);
      return new ScopedArg(var, last.function(), last.argument() + 1);
    }
    if (args.isEmpty()) {
      return new ScopedArg(var, 0, 0);
    }
    return new ScopedArg(var, args.get(0).function() + 1, 0);
  }

  static Typ synthesizeOrThrow(TypingContext ctx, Expr expr) {
    return Typing.synthesize(ctx, expr)
        .orElseThrow(() -> new TypeCheckException(ErrorMessages.typeCannotBeInferred(Terms.show(expr))));
  }
}
