package astenv.nodes;

import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.dsl.Idempotent;
import com.oracle.truffle.api.dsl.Specialization;

/**
 * 字面量节点 - 使用 Truffle DSL 进行类型特化，避免通用类型装箱成本。
 * 整数、布尔值与空列表都由此节点产生。
 */
public abstract class LiteralNode extends AstEnvExpressionNode {
  private enum ValueKind {
    INT, BOOLEAN, OBJECT
  }

  @CompilationFinal private final Object value;
  @CompilationFinal private final ValueKind kind;

  protected LiteralNode(int value) { this.value = value; this.kind = ValueKind.INT; }
  protected LiteralNode(boolean value) { this.value = value; this.kind = ValueKind.BOOLEAN; }
  protected LiteralNode(Object value) { this.value = value; this.kind = ValueKind.OBJECT; }

  public static LiteralNode create(Object value) {
    if (value instanceof Integer i) {
      return LiteralNodeGen.create(i.intValue());
    } else if (value instanceof Boolean b) {
      return LiteralNodeGen.create(b.booleanValue());
    }
    return LiteralNodeGen.create(value);
  }

  @Specialization(guards = "isInt()")
  protected int doInt() {
    Profiler.inc("literal");
    return ((Integer) value).intValue();
  }

  @Specialization(guards = "isBoolean()")
  protected boolean doBoolean() {
    Profiler.inc("literal");
    return ((Boolean) value).booleanValue();
  }

  @Specialization(replaces = {"doInt", "doBoolean"})
  protected Object doGeneric() {
    Profiler.inc("literal");
    return value;
  }

  @Idempotent protected boolean isInt() { return kind == ValueKind.INT; }
  @Idempotent protected boolean isBoolean() { return kind == ValueKind.BOOLEAN; }
}
