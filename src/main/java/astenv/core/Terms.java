package astenv.core;

import astenv.core.CoreModel.*;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 树结构工具：节点计数、结构子节点、自由变量检查与 starter 标记。
 *
 * 前序线性化约定：
 * - let：let 节点、绑定变量节点、定义子树、主体子树
 * - fun/fix：节点本身、类型标注子树、绑定变量节点、主体子树
 * - 其余节点：节点本身后依次是各子节点
 */
public final class Terms {
  private Terms() {}

  /**
   * 计算子树在前序线性化中占用的节点数（含绑定变量节点）。
   */
  public static int size(Term term) {
    if (term instanceof UnOp u) return 1 + size(u.arg());
    if (term instanceof BinOp b) return 1 + size(b.left()) + size(b.right());
    if (term instanceof Pair p) return 1 + size(p.left()) + size(p.right());
    if (term instanceof If i) return 1 + size(i.cond()) + size(i.thenExpr()) + size(i.elseExpr());
    if (term instanceof Let l) return 2 + size(l.definition()) + size(l.body());
    if (term instanceof Fun f) return 2 + size(f.annotation()) + size(f.body());
    if (term instanceof Fix f) return 2 + size(f.annotation()) + size(f.body());
    if (term instanceof ListT l) return 1 + size(l.elem());
    if (term instanceof ProdT p) return 1 + size(p.left()) + size(p.right());
    if (term instanceof ArrowT a) return 1 + size(a.param()) + size(a.result());
    return 1;
  }

  /**
   * 结构子节点（光标可以进入、unwrap 可以提升的位置），不含绑定变量。
   */
  public static List<Term> children(Term term) {
    if (term instanceof UnOp u) return List.of(u.arg());
    if (term instanceof BinOp b) return List.of(b.left(), b.right());
    if (term instanceof Pair p) return List.of(p.left(), p.right());
    if (term instanceof If i) return List.of(i.cond(), i.thenExpr(), i.elseExpr());
    if (term instanceof Let l) return List.of(l.definition(), l.body());
    if (term instanceof Fun f) return List.of(f.annotation(), f.body());
    if (term instanceof Fix f) return List.of(f.annotation(), f.body());
    if (term instanceof ListT l) return List.of(l.elem());
    if (term instanceof ProdT p) return List.of(p.left(), p.right());
    if (term instanceof ArrowT a) return List.of(a.param(), a.result());
    return List.of();
  }

  public static boolean isAtom(Term term) {
    return children(term).isEmpty();
  }

  /**
   * 判断变量是否在表达式中自由出现。
   */
  public static boolean occursFree(int var, Expr expr) {
    if (expr instanceof Var v) return v.id() == var;
    if (expr instanceof UnOp u) return occursFree(var, u.arg());
    if (expr instanceof BinOp b) return occursFree(var, b.left()) || occursFree(var, b.right());
    if (expr instanceof Pair p) return occursFree(var, p.left()) || occursFree(var, p.right());
    if (expr instanceof If i) {
      return occursFree(var, i.cond()) || occursFree(var, i.thenExpr()) || occursFree(var, i.elseExpr());
    }
    if (expr instanceof Let l) {
      return occursFree(var, l.definition()) || (l.binder() != var && occursFree(var, l.body()));
    }
    if (expr instanceof Fun f) return f.binder() != var && occursFree(var, f.body());
    if (expr instanceof Fix f) return f.binder() != var && occursFree(var, f.body());
    return false;
  }

  /**
   * 表达式中自由出现的全部变量，按编号升序。
   */
  public static SortedSet<Integer> freeVars(Expr expr) {
    SortedSet<Integer> out = new TreeSet<>();
    collectFree(expr, new HashSet<>(), out);
    return out;
  }

  private static void collectFree(Expr expr, Set<Integer> bound, Set<Integer> out) {
    if (expr instanceof Var v) {
      if (!bound.contains(v.id())) out.add(v.id());
      return;
    }
    if (expr instanceof Let l) {
      collectFree(l.definition(), bound, out);
      collectUnder(l.binder(), l.body(), bound, out);
      return;
    }
    if (expr instanceof Fun f) {
      collectUnder(f.binder(), f.body(), bound, out);
      return;
    }
    if (expr instanceof Fix f) {
      collectUnder(f.binder(), f.body(), bound, out);
      return;
    }
    for (Term child : children(expr)) {
      collectFree((Expr) child, bound, out);
    }
  }

  private static void collectUnder(int binder, Expr body, Set<Integer> bound, Set<Integer> out) {
    boolean added = bound.add(binder);
    collectFree(body, bound, out);
    if (added) bound.remove(binder);
  }

  /**
   * 最大的变量编号（绑定或引用），没有变量时返回 -1。
   */
  public static int maxVarId(Term term) {
    int max = -1;
    if (term instanceof Var v) max = v.id();
    if (term instanceof Let l) max = l.binder();
    if (term instanceof Fun f) max = f.binder();
    if (term instanceof Fix f) max = f.binder();
    for (Term child : children(term)) {
      max = Math.max(max, maxVarId(child));
    }
    return max;
  }

  /**
   * 前序列出所有绑定变量编号，重复绑定（遮蔽）会出现多次。
   */
  public static List<Integer> binders(Term term) {
    List<Integer> out = new ArrayList<>();
    collectBinders(term, out);
    return out;
  }

  private static void collectBinders(Term term, List<Integer> out) {
    if (term instanceof Let l) out.add(l.binder());
    if (term instanceof Fun f) out.add(f.binder());
    if (term instanceof Fix f) out.add(f.binder());
    for (Term child : children(term)) {
      collectBinders(child, out);
    }
  }

  /**
   * 返回所有节点都带 starter 标记的副本。
   */
  public static Expr markStarter(Expr expr) {
    if (expr instanceof Var v) return new Var(v.id(), true);
    if (expr instanceof IntE i) return new IntE(i.value(), true);
    if (expr instanceof Bool b) return new Bool(b.value(), true);
    if (expr instanceof Nil) return new Nil(true);
    if (expr instanceof Hole) return new Hole(true);
    if (expr instanceof UnOp u) return new UnOp(u.op(), markStarter(u.arg()), true);
    if (expr instanceof BinOp b) {
      return new BinOp(markStarter(b.left()), b.op(), markStarter(b.right()), true);
    }
    if (expr instanceof Pair p) return new Pair(markStarter(p.left()), markStarter(p.right()), true);
    if (expr instanceof If i) {
      return new If(markStarter(i.cond()), markStarter(i.thenExpr()), markStarter(i.elseExpr()), true);
    }
    if (expr instanceof Let l) {
      return new Let(l.binder(), markStarter(l.definition()), markStarter(l.body()), true);
    }
    if (expr instanceof Fun f) {
      return new Fun(f.binder(), markStarter(f.annotation()), markStarter(f.body()), true);
    }
    Fix f = (Fix) expr;
    return new Fix(f.binder(), markStarter(f.annotation()), markStarter(f.body()), true);
  }

  public static Type markStarter(Type type) {
    if (type instanceof IntT) return new IntT(true);
    if (type instanceof BoolT) return new BoolT(true);
    if (type instanceof HoleT) return new HoleT(true);
    if (type instanceof ListT l) return new ListT(markStarter(l.elem()), true);
    if (type instanceof ProdT p) return new ProdT(markStarter(p.left()), markStarter(p.right()), true);
    ArrowT a = (ArrowT) type;
    return new ArrowT(markStarter(a.param()), markStarter(a.result()), true);
  }

  /**
   * 前序遍历中第一个 Hole 表达式的线性下标，没有时返回 -1。
   */
  public static int firstHoleIndex(Term root) {
    return firstHole(root, 0);
  }

  private static int firstHole(Term term, int index) {
    if (term instanceof Hole) return index;
    int childIndex = index + 1;
    if (term instanceof Let l) {
      int found = firstHole(l.definition(), index + 2);
      return found >= 0 ? found : firstHole(l.body(), index + 2 + size(l.definition()));
    }
    if (term instanceof Fun f) return firstHole(f.body(), index + 2 + size(f.annotation()));
    if (term instanceof Fix f) return firstHole(f.body(), index + 2 + size(f.annotation()));
    for (Term child : children(term)) {
      int found = firstHole(child, childIndex);
      if (found >= 0) return found;
      childIndex += size(child);
    }
    return -1;
  }

  /**
   * 简短的文本形式，用于日志与命令行输出。
   */
  public static String show(Term term) {
    if (term instanceof Var v) return "x" + v.id();
    if (term instanceof IntE i) return Integer.toString(i.value());
    if (term instanceof Bool b) return Boolean.toString(b.value());
    if (term instanceof Nil) return "[]";
    if (term instanceof Hole) return "?";
    if (term instanceof UnOp u) return "-(" + show(u.arg()) + ")";
    if (term instanceof BinOp b) {
      if (b.op() == BinOpKind.AP) return "(" + show(b.left()) + " " + show(b.right()) + ")";
      return "(" + show(b.left()) + " " + symbol(b.op()) + " " + show(b.right()) + ")";
    }
    if (term instanceof Pair p) return "(" + show(p.left()) + ", " + show(p.right()) + ")";
    if (term instanceof If i) {
      return "(if " + show(i.cond()) + " then " + show(i.thenExpr()) + " else " + show(i.elseExpr()) + ")";
    }
    if (term instanceof Let l) {
      return "(let x" + l.binder() + " = " + show(l.definition()) + " in " + show(l.body()) + ")";
    }
    if (term instanceof Fun f) {
      return "(fun (x" + f.binder() + " : " + show(f.annotation()) + ") -> " + show(f.body()) + ")";
    }
    if (term instanceof Fix f) {
      return "(fix (x" + f.binder() + " : " + show(f.annotation()) + ") -> " + show(f.body()) + ")";
    }
    if (term instanceof IntT) return "int";
    if (term instanceof BoolT) return "bool";
    if (term instanceof HoleT) return "?";
    if (term instanceof ListT l) return show(l.elem()) + " list";
    if (term instanceof ProdT p) return "(" + show(p.left()) + " * " + show(p.right()) + ")";
    ArrowT a = (ArrowT) term;
    return "(" + show(a.param()) + " -> " + show(a.result()) + ")";
  }

  private static String symbol(BinOpKind op) {
    switch (op) {
      case PLUS: return "+";
      case MINUS: return "-";
      case TIMES: return "*";
      case DIV: return "/";
      case LT: return "<";
      case LE: return "<=";
      case GT: return ">";
      case GE: return ">=";
      case EQ: return "=";
      case NE: return "!=";
      case CONS: return "::";
      default: return "";
    }
  }
}
