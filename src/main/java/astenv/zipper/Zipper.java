package astenv.zipper;

import astenv.core.CoreModel.*;
import astenv.core.Terms;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 带唯一光标的树：光标处子树 {@code focus} 加上从根到光标的 frame 路径（根在前）。
 *
 * 不变量：把路径逐层填回即得到一棵普通的完整树；表达式树与类型标注树共用同一套路径。
 */
public final class Zipper {
  private final Term focus;
  private final List<Frame> path;

  private Zipper(Term focus, List<Frame> path) {
    this.focus = Objects.requireNonNull(focus, "focus");
    this.path = path;
  }

  /**
   * 光标位于根节点。
   */
  public static Zipper at(Expr root) {
    return new Zipper(root, List.of());
  }

  /**
   * 在前序线性下标处打开拉链。
   *
   * @throws IllegalArgumentException 下标不对应任何结构节点（越界或指向绑定变量节点）
   */
  public static Zipper at(Expr root, int index) {
    Zipper z = at(root);
    int current = 0;
    while (current != index) {
      Optional<Zipper> next = Optional.empty();
      int childIndex = current;
      List<Term> children = Terms.children(z.focus);
      for (int n = children.size() - 1; n >= 0; n--) {
        Zipper child = z.down(n).orElseThrow();
        int start = current + child.path.get(child.path.size() - 1).offset();
        if (start <= index) {
          next = Optional.of(child);
          childIndex = start;
          break;
        }
      }
      if (next.isEmpty() || index >= current + Terms.size(z.focus)) {
        throw new IllegalArgumentException("No node at index " + index);
      }
      z = next.get();
      current = childIndex;
    }
    return z;
  }

  public Term focus() {
    return focus;
  }

  /** 根在前的 frame 路径（只读）。 */
  public List<Frame> path() {
    return path;
  }

  /** 直接父节点所在的 frame，光标位于根时为 empty。 */
  public Optional<Frame> parent() {
    return path.isEmpty() ? Optional.empty() : Optional.of(path.get(path.size() - 1));
  }

  public boolean atRoot() {
    return path.isEmpty();
  }

  /** 光标是否位于类型标注内部。 */
  public boolean inType() {
    return focus instanceof Type;
  }

  public Optional<Zipper> up() {
    if (path.isEmpty()) {
      return Optional.empty();
    }
    Frame last = path.get(path.size() - 1);
    return Optional.of(new Zipper(last.plug(focus), path.subList(0, path.size() - 1)));
  }

  /**
   * 进入第 n 个结构子节点；子节点不存在时返回 empty。
   */
  public Optional<Zipper> down(int n) {
    Optional<Frame> frame = open(focus, n);
    if (frame.isEmpty()) {
      return Optional.empty();
    }
    List<Frame> next = new ArrayList<>(path.size() + 1);
    next.addAll(path);
    next.add(frame.get());
    return Optional.of(new Zipper(Terms.children(focus).get(n), Collections.unmodifiableList(next)));
  }

  /** 用新子树替换光标处子树，光标位置不变。 */
  public Zipper replace(Term term) {
    if (inType() != (term instanceof Type)) {
      throw new IllegalArgumentException("Cannot replace " + Terms.show(focus) + " with " + Terms.show(term));
    }
    return new Zipper(term, path);
  }

  /** 去掉光标，返回完整的树。 */
  public Expr unzip() {
    Term current = focus;
    for (int i = path.size() - 1; i >= 0; i--) {
      current = path.get(i).plug(current);
    }
    return (Expr) current;
  }

  /** 光标在整棵树前序线性化中的下标。 */
  public int cursorIndex() {
    int index = 0;
    for (Frame frame : path) {
      index += frame.offset();
    }
    return index;
  }

  private static Optional<Frame> open(Term parent, int n) {
    boolean s = parent.starter();
    if (parent instanceof UnOp u && n == 0) return Optional.of(new Frame.UnOpArg(u.op(), s));
    if (parent instanceof BinOp b) {
      if (n == 0) return Optional.of(new Frame.BinOpLeft(b.op(), b.right(), s));
      if (n == 1) return Optional.of(new Frame.BinOpRight(b.left(), b.op(), s));
    }
    if (parent instanceof If i) {
      if (n == 0) return Optional.of(new Frame.IfCond(i.thenExpr(), i.elseExpr(), s));
      if (n == 1) return Optional.of(new Frame.IfThen(i.cond(), i.elseExpr(), s));
      if (n == 2) return Optional.of(new Frame.IfElse(i.cond(), i.thenExpr(), s));
    }
    if (parent instanceof Let l) {
      if (n == 0) return Optional.of(new Frame.LetDef(l.binder(), l.body(), s));
      if (n == 1) return Optional.of(new Frame.LetBody(l.binder(), l.definition(), s));
    }
    if (parent instanceof Fun f) {
      if (n == 0) return Optional.of(new Frame.FunParam(f.binder(), f.body(), s));
      if (n == 1) return Optional.of(new Frame.FunBody(f.binder(), f.annotation(), s));
    }
    if (parent instanceof Fix f) {
      if (n == 0) return Optional.of(new Frame.FixParam(f.binder(), f.body(), s));
      if (n == 1) return Optional.of(new Frame.FixBody(f.binder(), f.annotation(), s));
    }
    if (parent instanceof Pair p) {
      if (n == 0) return Optional.of(new Frame.PairLeft(p.right(), s));
      if (n == 1) return Optional.of(new Frame.PairRight(p.left(), s));
    }
    if (parent instanceof ListT && n == 0) return Optional.of(new Frame.ListElem(s));
    if (parent instanceof ProdT p) {
      if (n == 0) return Optional.of(new Frame.ProdLeft(p.right(), s));
      if (n == 1) return Optional.of(new Frame.ProdRight(p.left(), s));
    }
    if (parent instanceof ArrowT a) {
      if (n == 0) return Optional.of(new Frame.ArrowParam(a.result(), s));
      if (n == 1) return Optional.of(new Frame.ArrowResult(a.param(), s));
    }
    return Optional.empty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Zipper other && focus.equals(other.focus) && path.equals(other.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(focus, path);
  }

  @Override
  public String toString() {
    return "Zipper[focus=" + Terms.show(focus) + ", index=" + cursorIndex() + "]";
  }
}
