package astenv.nodes;

import astenv.core.CoreModel.BinOpKind;
import astenv.runtime.ErrorMessages;
import astenv.runtime.EvalException;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;

/**
 * 整数四则运算。溢出按补码回绕，除法向零截断，除数为 0 时抛出 {@link EvalException}。
 */
@NodeChild(value = "leftNode", type = AstEnvExpressionNode.class)
@NodeChild(value = "rightNode", type = AstEnvExpressionNode.class)
public abstract class ArithmeticNode extends AstEnvExpressionNode {
  @CompilationFinal protected final BinOpKind op;

  protected ArithmeticNode(BinOpKind op) {
    if (!op.isArithmetic()) {
      throw new IllegalArgumentException("Not an arithmetic operator: " + op);
    }
    this.op = op;
  }

  public static ArithmeticNode create(BinOpKind op, AstEnvExpressionNode left, AstEnvExpressionNode right) {
    return ArithmeticNodeGen.create(op, left, right);
  }

  @Specialization
  protected int doInt(int left, int right) {
    Profiler.inc("arith");
    switch (op) {
      case PLUS:
        return left + right;
      case MINUS:
        return left - right;
      case TIMES:
        return left * right;
      default:
        if (right == 0) {
          throw new EvalException(ErrorMessages.arithmeticDivisionByZero(), this);
        }
        return left / right;
    }
  }

  @Fallback
  protected Object typeError(Object left, Object right) {
    throw new EvalException(
        ErrorMessages.operationExpectedType(op.name(), "Int", left + ", " + right), this);
  }
}
