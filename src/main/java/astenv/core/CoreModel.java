package astenv.core;

import com.fasterxml.jackson.annotation.*;

/**
 * 编辑器所操作的语言模型：表达式树与类型标注树。
 *
 * 所有节点都是不可变 record，结构相等即相等；每个节点携带 {@code starter} 标记，
 * 表示该节点来自题目给定的初始代码（初始代码的父节点不允许光标向上越过）。
 * JSON 形式使用 {@code kind} 字段区分节点类型，供作业文件与求值器共用。
 */
public final class CoreModel {
  private CoreModel() {}

  /** 表达式节点与类型节点的公共父接口。 */
  public sealed interface Term permits Expr, Type {
    boolean starter();
  }

  public enum UnOpKind { NEG }

  public enum BinOpKind {
    PLUS, MINUS, TIMES, DIV,
    LT, LE, GT, GE, EQ, NE,
    CONS, AP;

    public boolean isArithmetic() {
      return this == PLUS || this == MINUS || this == TIMES || this == DIV;
    }

    public boolean isComparison() {
      return ordinal() >= LT.ordinal() && ordinal() <= NE.ordinal();
    }
  }

  // ==================== 表达式 ====================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Var.class, name = "Var"),
    @JsonSubTypes.Type(value = IntE.class, name = "Int"),
    @JsonSubTypes.Type(value = Bool.class, name = "Bool"),
    @JsonSubTypes.Type(value = Nil.class, name = "Nil"),
    @JsonSubTypes.Type(value = Hole.class, name = "Hole"),
    @JsonSubTypes.Type(value = UnOp.class, name = "UnOp"),
    @JsonSubTypes.Type(value = BinOp.class, name = "BinOp"),
    @JsonSubTypes.Type(value = If.class, name = "If"),
    @JsonSubTypes.Type(value = Let.class, name = "Let"),
    @JsonSubTypes.Type(value = Fun.class, name = "Fun"),
    @JsonSubTypes.Type(value = Fix.class, name = "Fix"),
    @JsonSubTypes.Type(value = Pair.class, name = "Pair")
  })
  public sealed interface Expr extends Term
      permits Var, IntE, Bool, Nil, Hole, UnOp, BinOp, If, Let, Fun, Fix, Pair {}

  @JsonTypeName("Var")
  public record Var(int id, boolean starter) implements Expr {
    public Var(int id) { this(id, false); }
  }

  @JsonTypeName("Int")
  public record IntE(int value, boolean starter) implements Expr {
    public IntE(int value) { this(value, false); }
  }

  @JsonTypeName("Bool")
  public record Bool(boolean value, boolean starter) implements Expr {
    public Bool(boolean value) { this(value, false); }
  }

  @JsonTypeName("Nil")
  public record Nil(boolean starter) implements Expr {
    public Nil() { this(false); }
  }

  @JsonTypeName("Hole")
  public record Hole(boolean starter) implements Expr {
    public Hole() { this(false); }
  }

  @JsonTypeName("UnOp")
  public record UnOp(UnOpKind op, Expr arg, boolean starter) implements Expr {
    public UnOp(UnOpKind op, Expr arg) { this(op, arg, false); }
  }

  @JsonTypeName("BinOp")
  public record BinOp(Expr left, BinOpKind op, Expr right, boolean starter) implements Expr {
    public BinOp(Expr left, BinOpKind op, Expr right) { this(left, op, right, false); }
  }

  @JsonTypeName("If")
  public record If(Expr cond, Expr thenExpr, Expr elseExpr, boolean starter) implements Expr {
    public If(Expr cond, Expr thenExpr, Expr elseExpr) { this(cond, thenExpr, elseExpr, false); }
  }

  /** {@code let binder = definition in body} */
  @JsonTypeName("Let")
  public record Let(int binder, Expr definition, Expr body, boolean starter) implements Expr {
    public Let(int binder, Expr definition, Expr body) { this(binder, definition, body, false); }
  }

  /** {@code fun (binder : annotation) -> body} */
  @JsonTypeName("Fun")
  public record Fun(int binder, Type annotation, Expr body, boolean starter) implements Expr {
    public Fun(int binder, Type annotation, Expr body) { this(binder, annotation, body, false); }
  }

  /** {@code fix (binder : annotation) -> body}，binder 在 body 中指代自身 */
  @JsonTypeName("Fix")
  public record Fix(int binder, Type annotation, Expr body, boolean starter) implements Expr {
    public Fix(int binder, Type annotation, Expr body) { this(binder, annotation, body, false); }
  }

  @JsonTypeName("Pair")
  public record Pair(Expr left, Expr right, boolean starter) implements Expr {
    public Pair(Expr left, Expr right) { this(left, right, false); }
  }

  // ==================== 类型标注 ====================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = IntT.class, name = "TInt"),
    @JsonSubTypes.Type(value = BoolT.class, name = "TBool"),
    @JsonSubTypes.Type(value = HoleT.class, name = "THole"),
    @JsonSubTypes.Type(value = ListT.class, name = "TList"),
    @JsonSubTypes.Type(value = ProdT.class, name = "TProd"),
    @JsonSubTypes.Type(value = ArrowT.class, name = "TArrow")
  })
  public sealed interface Type extends Term permits IntT, BoolT, HoleT, ListT, ProdT, ArrowT {}

  @JsonTypeName("TInt")
  public record IntT(boolean starter) implements Type {
    public IntT() { this(false); }
  }

  @JsonTypeName("TBool")
  public record BoolT(boolean starter) implements Type {
    public BoolT() { this(false); }
  }

  @JsonTypeName("THole")
  public record HoleT(boolean starter) implements Type {
    public HoleT() { this(false); }
  }

  @JsonTypeName("TList")
  public record ListT(Type elem, boolean starter) implements Type {
    public ListT(Type elem) { this(elem, false); }
  }

  @JsonTypeName("TProd")
  public record ProdT(Type left, Type right, boolean starter) implements Type {
    public ProdT(Type left, Type right) { this(left, right, false); }
  }

  @JsonTypeName("TArrow")
  public record ArrowT(Type param, Type result, boolean starter) implements Type {
    public ArrowT(Type param, Type result) { this(param, result, false); }
  }

  // ==================== 作业文件 ====================

  /** 单个单元测试：程序以 {@code input} 调用时应返回 {@code output}。 */
  public record UnitTest(int input, int output) {}

  /**
   * 求值器的输入：带步数上限的程序。
   *
   * @param fuel 允许的函数调用次数，不大于 0 时使用 {@code ASTENV_EVAL_FUEL}
   * @param body 程序主体
   */
  public record Program(int fuel, Expr body) {}
}
