package astenv.typing;

import astenv.core.CoreModel.*;
import astenv.types.Typ;
import astenv.types.Types;
import java.util.Optional;

/**
 * 双向类型检查：综合（synthesize）与分析（analyze）。
 *
 * 两者相互递归，编辑动作的合法性判断依赖二者的严格一致。
 */
public final class Typing {
  private Typing() {}

  /**
   * 自底向上推导表达式类型；任一子表达式类型错误时返回 empty。
   */
  public static Optional<Typ> synthesize(TypingContext ctx, Expr expr) {
    if (expr instanceof Var v) {
      return ctx.lookup(v.id());
    }
    if (expr instanceof IntE) return Optional.of(Typ.INT);
    if (expr instanceof Bool) return Optional.of(Typ.BOOL);
    if (expr instanceof Nil) return Optional.of(new Typ.ListOf(Typ.HOLE));
    if (expr instanceof Hole) return Optional.of(Typ.HOLE);
    if (expr instanceof UnOp u) {
      return analyze(ctx, u.arg(), Typ.INT) ? Optional.of(Typ.INT) : Optional.empty();
    }
    if (expr instanceof BinOp b) {
      return synthesizeBinOp(ctx, b);
    }
    if (expr instanceof Pair p) {
      Optional<Typ> left = synthesize(ctx, p.left());
      Optional<Typ> right = synthesize(ctx, p.right());
      if (left.isEmpty() || right.isEmpty()) return Optional.empty();
      return Optional.of(new Typ.Prod(left.get(), right.get()));
    }
    if (expr instanceof If i) {
      if (!analyze(ctx, i.cond(), Typ.BOOL)) return Optional.empty();
      Optional<Typ> thenType = synthesize(ctx, i.thenExpr());
      Optional<Typ> elseType = synthesize(ctx, i.elseExpr());
      if (thenType.isEmpty() || elseType.isEmpty()) return Optional.empty();
      return Types.commonType(thenType.get(), elseType.get());
    }
    if (expr instanceof Let l) {
      return synthesize(ctx, l.definition())
          .flatMap(defType -> synthesize(ctx.extend(l.binder(), defType), l.body()));
    }
    if (expr instanceof Fun f) {
      Typ param = Types.strip(f.annotation());
      return synthesize(ctx.extend(f.binder(), param), f.body())
          .map(result -> new Typ.Arrow(param, result));
    }
    Fix f = (Fix) expr;
    Typ declared = Types.strip(f.annotation());
    return analyze(ctx.extend(f.binder(), declared), f.body(), declared)
        ? Optional.of(declared)
        : Optional.empty();
  }

  private static Optional<Typ> synthesizeBinOp(TypingContext ctx, BinOp b) {
    BinOpKind op = b.op();
    if (op.isArithmetic() || op.isComparison()) {
      if (analyze(ctx, b.left(), Typ.INT) && analyze(ctx, b.right(), Typ.INT)) {
        return Optional.of(op.isArithmetic() ? Typ.INT : Typ.BOOL);
      }
      return Optional.empty();
    }
    if (op == BinOpKind.AP) {
      Optional<Typ> fn = synthesize(ctx, b.left());
      if (fn.isPresent() && fn.get() instanceof Typ.Arrow arrow) {
        return analyze(ctx, b.right(), arrow.param()) ? Optional.of(arrow.result()) : Optional.empty();
      }
      if (fn.isPresent() && fn.get() == Typ.HOLE) {
        return analyze(ctx, b.right(), Typ.HOLE) ? Optional.of(Typ.HOLE) : Optional.empty();
      }
      return Optional.empty();
    }
    // CONS
    Optional<Typ> tail = synthesize(ctx, b.right());
    if (tail.isPresent() && tail.get() instanceof Typ.ListOf list) {
      return analyze(ctx, b.left(), list.elem()) ? Optional.of(list) : Optional.empty();
    }
    if (tail.isPresent() && tail.get() == Typ.HOLE) {
      return analyze(ctx, b.left(), Typ.HOLE) ? Optional.of(new Typ.ListOf(Typ.HOLE)) : Optional.empty();
    }
    return Optional.empty();
  }

  /**
   * 自顶向下检查表达式是否符合目标类型。
   *
   * fun/fix/pair/if/let 将目标类型结构性地下推；其余形式退化为综合后检查相容性。
   */
  public static boolean analyze(TypingContext ctx, Expr expr, Typ target) {
    if (expr instanceof Fun f) {
      Typ param = Types.strip(f.annotation());
      TypingContext inner = ctx.extend(f.binder(), param);
      if (target == Typ.HOLE) {
        return analyze(inner, f.body(), Typ.HOLE);
      }
      if (target instanceof Typ.Arrow arrow) {
        return Types.consistent(param, arrow.param()) && analyze(inner, f.body(), arrow.result());
      }
      return false;
    }
    if (expr instanceof Fix f) {
      Typ declared = Types.strip(f.annotation());
      return Types.consistent(declared, target)
          && analyze(ctx.extend(f.binder(), declared), f.body(), declared);
    }
    if (expr instanceof Pair p) {
      if (target instanceof Typ.Prod prod) {
        return analyze(ctx, p.left(), prod.left()) && analyze(ctx, p.right(), prod.right());
      }
      if (target == Typ.HOLE) {
        return analyze(ctx, p.left(), Typ.HOLE) && analyze(ctx, p.right(), Typ.HOLE);
      }
      return false;
    }
    if (expr instanceof If i) {
      return analyze(ctx, i.cond(), Typ.BOOL)
          && analyze(ctx, i.thenExpr(), target)
          && analyze(ctx, i.elseExpr(), target);
    }
    if (expr instanceof Let l) {
      Optional<Typ> defType = synthesize(ctx, l.definition());
      return defType.isPresent() && analyze(ctx.extend(l.binder(), defType.get()), l.body(), target);
    }
    Optional<Typ> actual = synthesize(ctx, expr);
    return actual.isPresent() && Types.consistent(actual.get(), target);
  }
}
