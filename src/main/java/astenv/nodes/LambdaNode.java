package astenv.nodes;

import astenv.runtime.ClosureValue;
import com.oracle.truffle.api.CallTarget;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.dsl.Idempotent;
import com.oracle.truffle.api.dsl.Specialization;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;

/**
 * LambdaNode - 在运行时创建 ClosureValue，按值捕获主体中的自由变量
 */
public abstract class LambdaNode extends AstEnvExpressionNode {
  @CompilationFinal private final String name;
  @Children private final ReadVarNode[] captureExprs;
  @CompilationFinal private final CallTarget callTarget;

  protected LambdaNode(String name, ReadVarNode[] captureExprs, CallTarget callTarget) {
    this.name = name;
    this.captureExprs = captureExprs;
    this.callTarget = callTarget;
  }

  public static LambdaNode create(String name, ReadVarNode[] captureExprs, CallTarget callTarget) {
    return LambdaNodeGen.create(name, captureExprs, callTarget);
  }

  @Specialization(guards = "hasNoCaptures()")
  protected ClosureValue doNoClosure() {
    Profiler.inc("lambda_create");
    return new ClosureValue(name, callTarget, new Object[0]);
  }

  @Specialization
  @ExplodeLoop
  protected ClosureValue doWithClosure(VirtualFrame frame) {
    Profiler.inc("lambda_create");
    Object[] capturedValues = new Object[captureExprs.length];
    for (int i = 0; i < captureExprs.length; i++) {
      capturedValues[i] = captureExprs[i].executeGeneric(frame);
    }
    return new ClosureValue(name, callTarget, capturedValues);
  }

  @Idempotent
  protected boolean hasNoCaptures() {
    return captureExprs.length == 0;
  }

  @Override
  public String toString() {
    return "LambdaNode(" + name + ", captures=" + captureExprs.length + ")";
  }
}
