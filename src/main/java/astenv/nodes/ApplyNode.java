package astenv.nodes;

import astenv.AstEnvContext;
import astenv.runtime.AstEnvConfig;
import astenv.runtime.ClosureValue;
import astenv.runtime.ErrorMessages;
import astenv.runtime.EvalException;
import com.oracle.truffle.api.CallTarget;
import com.oracle.truffle.api.dsl.Cached;
import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;
import com.oracle.truffle.api.nodes.DirectCallNode;
import com.oracle.truffle.api.nodes.IndirectCallNode;

/**
 * 函数应用节点（AP 运算）
 *
 * 每次调用消耗一个求值步数。调用目标单态时使用 DirectCallNode 缓存，
 * 超过缓存上限后退化为 IndirectCallNode。
 */
@NodeChild(value = "functionNode", type = AstEnvExpressionNode.class)
@NodeChild(value = "argumentNode", type = AstEnvExpressionNode.class)
public abstract class ApplyNode extends AstEnvExpressionNode {

  public static ApplyNode create(AstEnvExpressionNode function, AstEnvExpressionNode argument) {
    return ApplyNodeGen.create(function, argument);
  }

  @Specialization(guards = "closure.getCallTarget() == cachedTarget", limit = "3")
  protected Object doDirect(
      ClosureValue closure,
      Object argument,
      @Cached("closure.getCallTarget()") CallTarget cachedTarget,
      @Cached("create(cachedTarget)") DirectCallNode callNode) {
    enter(closure, argument);
    return callNode.call(closure.pack(argument));
  }

  @Specialization(replaces = "doDirect")
  protected Object doIndirect(ClosureValue closure, Object argument, @Cached IndirectCallNode callNode) {
    enter(closure, argument);
    return callNode.call(closure.getCallTarget(), closure.pack(argument));
  }

  @Fallback
  protected Object notAFunction(Object function, Object argument) {
    throw new EvalException(ErrorMessages.operationExpectedType("apply", "function", String.valueOf(function)), this);
  }

  private void enter(ClosureValue closure, Object argument) {
    Profiler.inc("apply");
    AstEnvContext.get(this).consumeFuel(this);
    if (AstEnvConfig.DEBUG) {
      System.err.println("DEBUG: apply " + closure + " to " + argument);
    }
  }
}
