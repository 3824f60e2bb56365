package astenv.nodes;

import astenv.runtime.ErrorMessages;
import astenv.runtime.EvalException;
import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;

/**
 * 整数取负。
 */
@NodeChild(value = "operandNode", type = AstEnvExpressionNode.class)
public abstract class NegateNode extends AstEnvExpressionNode {

  public static NegateNode create(AstEnvExpressionNode operand) {
    return NegateNodeGen.create(operand);
  }

  @Specialization
  protected int doInt(int value) {
    Profiler.inc("neg");
    return -value;
  }

  @Fallback
  protected Object typeError(Object value) {
    throw new EvalException(ErrorMessages.operationExpectedType("neg", "Int", String.valueOf(value)), this);
  }
}
