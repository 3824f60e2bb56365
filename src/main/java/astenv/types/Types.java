package astenv.types;

import astenv.core.CoreModel;
import java.util.Optional;

/**
 * 类型相容关系与公共类型计算。
 *
 * {@link #consistent} 与 {@link #commonType} 必须保持同步：
 * 相容的两个类型一定存在公共类型。
 */
public final class Types {
  private Types() {}

  /**
   * 相容性：自反、对称，Hole 与任何类型相容；复合类型逐分量相容；构造子不同则不相容。
   */
  public static boolean consistent(Typ t1, Typ t2) {
    if (t1 == Typ.HOLE || t2 == Typ.HOLE) {
      return true;
    }
    if (t1 instanceof Typ.ListOf l1 && t2 instanceof Typ.ListOf l2) {
      return consistent(l1.elem(), l2.elem());
    }
    if (t1 instanceof Typ.Prod p1 && t2 instanceof Typ.Prod p2) {
      return consistent(p1.left(), p2.left()) && consistent(p1.right(), p2.right());
    }
    if (t1 instanceof Typ.Arrow a1 && t2 instanceof Typ.Arrow a2) {
      return consistent(a1.param(), a2.param()) && consistent(a1.result(), a2.result());
    }
    return t1 == t2;
  }

  /**
   * 公共类型：递归地用另一侧对应分量替换 Hole，得到最具体的类型。
   *
   * @return 不相容时返回 empty
   */
  public static Optional<Typ> commonType(Typ t1, Typ t2) {
    if (!consistent(t1, t2)) {
      return Optional.empty();
    }
    if (t1 == Typ.HOLE) return Optional.of(t2);
    if (t2 == Typ.HOLE) return Optional.of(t1);
    if (t1 instanceof Typ.ListOf l1 && t2 instanceof Typ.ListOf l2) {
      return commonType(l1.elem(), l2.elem()).map(Typ.ListOf::new);
    }
    if (t1 instanceof Typ.Prod p1 && t2 instanceof Typ.Prod p2) {
      Optional<Typ> left = commonType(p1.left(), p2.left());
      Optional<Typ> right = commonType(p1.right(), p2.right());
      if (left.isEmpty() || right.isEmpty()) return Optional.empty();
      return Optional.of(new Typ.Prod(left.get(), right.get()));
    }
    if (t1 instanceof Typ.Arrow a1 && t2 instanceof Typ.Arrow a2) {
      Optional<Typ> param = commonType(a1.param(), a2.param());
      Optional<Typ> result = commonType(a1.result(), a2.result());
      if (param.isEmpty() || result.isEmpty()) return Optional.empty();
      return Optional.of(new Typ.Arrow(param.get(), result.get()));
    }
    if (t1 == t2) {
      return Optional.of(t1);
    }
    return Optional.empty();
  }

  /**
   * 将用户书写的类型标注转换为内部类型代数。
   */
  public static Typ strip(CoreModel.Type annotation) {
    if (annotation instanceof CoreModel.IntT) return Typ.INT;
    if (annotation instanceof CoreModel.BoolT) return Typ.BOOL;
    if (annotation instanceof CoreModel.HoleT) return Typ.HOLE;
    if (annotation instanceof CoreModel.ListT l) return new Typ.ListOf(strip(l.elem()));
    if (annotation instanceof CoreModel.ProdT p) return new Typ.Prod(strip(p.left()), strip(p.right()));
    CoreModel.ArrowT a = (CoreModel.ArrowT) annotation;
    return new Typ.Arrow(strip(a.param()), strip(a.result()));
  }

  public static String show(Typ t) {
    if (t == Typ.INT) return "Int";
    if (t == Typ.BOOL) return "Bool";
    if (t == Typ.HOLE) return "?";
    if (t instanceof Typ.ListOf l) return "List(" + show(l.elem()) + ")";
    if (t instanceof Typ.Prod p) return "(" + show(p.left()) + " * " + show(p.right()) + ")";
    Typ.Arrow a = (Typ.Arrow) t;
    return "(" + show(a.param()) + " -> " + show(a.result()) + ")";
  }
}
