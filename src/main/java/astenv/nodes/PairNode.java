package astenv.nodes;

import astenv.runtime.PairValue;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;

@NodeChild(value = "leftNode", type = AstEnvExpressionNode.class)
@NodeChild(value = "rightNode", type = AstEnvExpressionNode.class)
public abstract class PairNode extends AstEnvExpressionNode {

  public static PairNode create(AstEnvExpressionNode left, AstEnvExpressionNode right) {
    return PairNodeGen.create(left, right);
  }

  @Specialization
  protected PairValue doPair(Object left, Object right) {
    Profiler.inc("pair");
    return new PairValue(left, right);
  }
}
