package astenv.zipper;

import astenv.core.CoreModel.*;
import astenv.core.Terms;

/**
 * 拉链路径上的一层：父节点去掉光标所在分支后剩下的部分。
 *
 * 每个 frame 完整持有未进入的兄弟子树，记录父节点的 starter 标记、
 * 光标分支在父节点中的结构位置 {@link #slot()}，以及该分支相对父节点的前序偏移 {@link #offset()}。
 */
public sealed interface Frame {

  /** 用子树填回空位，重建父节点。 */
  Term plug(Term child);

  /** 父节点是否属于初始代码。 */
  boolean starter();

  /** 光标分支是父节点的第几个结构子节点。 */
  int slot();

  /** 光标分支的线性下标减去父节点的线性下标。 */
  int offset();

  /** 父节点位于表达式树中（类型标注内部的 frame 返回 false）。 */
  default boolean inExpression() {
    return true;
  }

  // ==================== 表达式 frame ====================

  record UnOpArg(UnOpKind op, boolean starter) implements Frame {
    public Term plug(Term child) { return new UnOp(op, (Expr) child, starter); }
    public int slot() { return 0; }
    public int offset() { return 1; }
  }

  record BinOpLeft(BinOpKind op, Expr right, boolean starter) implements Frame {
    public Term plug(Term child) { return new BinOp((Expr) child, op, right, starter); }
    public int slot() { return 0; }
    public int offset() { return 1; }
  }

  record BinOpRight(Expr left, BinOpKind op, boolean starter) implements Frame {
    public Term plug(Term child) { return new BinOp(left, op, (Expr) child, starter); }
    public int slot() { return 1; }
    public int offset() { return 1 + Terms.size(left); }
  }

  record IfCond(Expr thenExpr, Expr elseExpr, boolean starter) implements Frame {
    public Term plug(Term child) { return new If((Expr) child, thenExpr, elseExpr, starter); }
    public int slot() { return 0; }
    public int offset() { return 1; }
  }

  record IfThen(Expr cond, Expr elseExpr, boolean starter) implements Frame {
    public Term plug(Term child) { return new If(cond, (Expr) child, elseExpr, starter); }
    public int slot() { return 1; }
    public int offset() { return 1 + Terms.size(cond); }
  }

  record IfElse(Expr cond, Expr thenExpr, boolean starter) implements Frame {
    public Term plug(Term child) { return new If(cond, thenExpr, (Expr) child, starter); }
    public int slot() { return 2; }
    public int offset() { return 1 + Terms.size(cond) + Terms.size(thenExpr); }
  }

  record LetDef(int binder, Expr body, boolean starter) implements Frame {
    public Term plug(Term child) { return new Let(binder, (Expr) child, body, starter); }
    public int slot() { return 0; }
    public int offset() { return 2; }
  }

  record LetBody(int binder, Expr definition, boolean starter) implements Frame {
    public Term plug(Term child) { return new Let(binder, definition, (Expr) child, starter); }
    public int slot() { return 1; }
    public int offset() { return 2 + Terms.size(definition); }
  }

  record FunParam(int binder, Expr body, boolean starter) implements Frame {
    public Term plug(Term child) { return new Fun(binder, (Type) child, body, starter); }
    public int slot() { return 0; }
    public int offset() { return 1; }
  }

  record FunBody(int binder, Type annotation, boolean starter) implements Frame {
    public Term plug(Term child) { return new Fun(binder, annotation, (Expr) child, starter); }
    public int slot() { return 1; }
    public int offset() { return 2 + Terms.size(annotation); }
  }

  record FixParam(int binder, Expr body, boolean starter) implements Frame {
    public Term plug(Term child) { return new Fix(binder, (Type) child, body, starter); }
    public int slot() { return 0; }
    public int offset() { return 1; }
  }

  record FixBody(int binder, Type annotation, boolean starter) implements Frame {
    public Term plug(Term child) { return new Fix(binder, annotation, (Expr) child, starter); }
    public int slot() { return 1; }
    public int offset() { return 2 + Terms.size(annotation); }
  }

  record PairLeft(Expr right, boolean starter) implements Frame {
    public Term plug(Term child) { return new Pair((Expr) child, right, starter); }
    public int slot() { return 0; }
    public int offset() { return 1; }
  }

  record PairRight(Expr left, boolean starter) implements Frame {
    public Term plug(Term child) { return new Pair(left, (Expr) child, starter); }
    public int slot() { return 1; }
    public int offset() { return 1 + Terms.size(left); }
  }

  // ==================== 类型 frame ====================

  record ListElem(boolean starter) implements Frame {
    public Term plug(Term child) { return new ListT((Type) child, starter); }
    public int slot() { return 0; }
    public int offset() { return 1; }
    public boolean inExpression() { return false; }
  }

  record ProdLeft(Type right, boolean starter) implements Frame {
    public Term plug(Term child) { return new ProdT((Type) child, right, starter); }
    public int slot() { return 0; }
    public int offset() { return 1; }
    public boolean inExpression() { return false; }
  }

  record ProdRight(Type left, boolean starter) implements Frame {
    public Term plug(Term child) { return new ProdT(left, (Type) child, starter); }
    public int slot() { return 1; }
    public int offset() { return 1 + Terms.size(left); }
    public boolean inExpression() { return false; }
  }

  record ArrowParam(Type result, boolean starter) implements Frame {
    public Term plug(Term child) { return new ArrowT((Type) child, result, starter); }
    public int slot() { return 0; }
    public int offset() { return 1; }
    public boolean inExpression() { return false; }
  }

  record ArrowResult(Type param, boolean starter) implements Frame {
    public Term plug(Term child) { return new ArrowT(param, (Type) child, starter); }
    public int slot() { return 1; }
    public int offset() { return 1 + Terms.size(param); }
    public boolean inExpression() { return false; }
  }
}
