package astenv.types;

/**
 * 带 Hole 的简单类型代数：Int、Bool、Hole、List(T)、Prod(T, T)、Arrow(T, T)。
 *
 * 类型只有结构值语义，没有身份。{@link Base#HOLE} 是通配类型，与任何类型相容。
 */
public sealed interface Typ permits Typ.Base, Typ.ListOf, Typ.Prod, Typ.Arrow {

  Typ INT = Base.INT;
  Typ BOOL = Base.BOOL;
  Typ HOLE = Base.HOLE;

  enum Base implements Typ { INT, BOOL, HOLE }

  record ListOf(Typ elem) implements Typ {}

  record Prod(Typ left, Typ right) implements Typ {}

  record Arrow(Typ param, Typ result) implements Typ {}
}
