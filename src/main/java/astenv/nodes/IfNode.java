package astenv.nodes;

import astenv.runtime.AstEnvConfig;
import astenv.runtime.ErrorMessages;
import astenv.runtime.EvalException;
import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 条件分支节点 - 利用 Truffle DSL 针对布尔条件进行特化，非布尔条件视为运行时类型错误。
 */
@NodeChild(value = "condNode", type = AstEnvExpressionNode.class)
public abstract class IfNode extends AstEnvExpressionNode {
  @Child private AstEnvExpressionNode thenNode;
  @Child private AstEnvExpressionNode elseNode;

  protected IfNode(AstEnvExpressionNode thenNode, AstEnvExpressionNode elseNode) {
    this.thenNode = thenNode;
    this.elseNode = elseNode;
  }

  public static IfNode create(AstEnvExpressionNode cond, AstEnvExpressionNode thenNode, AstEnvExpressionNode elseNode) {
    return IfNodeGen.create(thenNode, elseNode, cond);
  }

  @Specialization
  protected Object doBooleanCond(VirtualFrame frame, boolean condValue) {
    Profiler.inc("if");
    if (AstEnvConfig.DEBUG) {
      System.err.println("DEBUG: if condition=" + condValue);
    }
    return condValue ? thenNode.executeGeneric(frame) : elseNode.executeGeneric(frame);
  }

  @Fallback
  protected Object typeError(Object condValue) {
    throw new EvalException(ErrorMessages.operationExpectedType("if", "Bool", String.valueOf(condValue)), this);
  }
}
