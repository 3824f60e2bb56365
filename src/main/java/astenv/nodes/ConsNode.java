package astenv.nodes;

import astenv.runtime.ErrorMessages;
import astenv.runtime.EvalException;
import astenv.runtime.ListValue;
import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;

/**
 * 列表构造 {@code head :: tail}。
 */
@NodeChild(value = "headNode", type = AstEnvExpressionNode.class)
@NodeChild(value = "tailNode", type = AstEnvExpressionNode.class)
public abstract class ConsNode extends AstEnvExpressionNode {

  public static ConsNode create(AstEnvExpressionNode head, AstEnvExpressionNode tail) {
    return ConsNodeGen.create(head, tail);
  }

  @Specialization
  protected ListValue doCons(Object head, ListValue tail) {
    Profiler.inc("cons");
    return ListValue.cons(head, tail);
  }

  @Fallback
  protected Object typeError(Object head, Object tail) {
    throw new EvalException(ErrorMessages.operationExpectedType("cons", "List", String.valueOf(tail)), this);
  }
}
