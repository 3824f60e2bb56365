package astenv.nodes;

import astenv.runtime.ErrorMessages;
import astenv.runtime.EvalException;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 未完成的 Hole：求值即失败。
 */
public final class HoleNode extends AstEnvExpressionNode {
  @Override
  public Object executeGeneric(VirtualFrame frame) {
    Profiler.inc("hole");
    throw new EvalException(ErrorMessages.holeReached(), this);
  }
}
