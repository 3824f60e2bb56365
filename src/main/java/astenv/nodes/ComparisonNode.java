package astenv.nodes;

import astenv.core.CoreModel.BinOpKind;
import astenv.runtime.ErrorMessages;
import astenv.runtime.EvalException;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;

/**
 * 整数比较，结果为布尔值。
 */
@NodeChild(value = "leftNode", type = AstEnvExpressionNode.class)
@NodeChild(value = "rightNode", type = AstEnvExpressionNode.class)
public abstract class ComparisonNode extends AstEnvExpressionNode {
  @CompilationFinal protected final BinOpKind op;

  protected ComparisonNode(BinOpKind op) {
    if (!op.isComparison()) {
      throw new IllegalArgumentException("Not a comparison operator: " + op);
    }
    this.op = op;
  }

  public static ComparisonNode create(BinOpKind op, AstEnvExpressionNode left, AstEnvExpressionNode right) {
    return ComparisonNodeGen.create(op, left, right);
  }

  @Specialization
  protected boolean doInt(int left, int right) {
    Profiler.inc("compare");
    switch (op) {
      case LT:
        return left < right;
      case LE:
        return left <= right;
      case GT:
        return left > right;
      case GE:
        return left >= right;
      case EQ:
        return left == right;
      default:
        return left != right;
    }
  }

  @Fallback
  protected Object typeError(Object left, Object right) {
    throw new EvalException(
        ErrorMessages.operationExpectedType(op.name(), "Int", left + ", " + right), this);
  }
}
