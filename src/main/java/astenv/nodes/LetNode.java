package astenv.nodes;

import astenv.runtime.AstEnvConfig;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * let 绑定节点：按定义值的类型写入 Frame 槽位，随后求值主体。
 *
 * 配合 {@link ReadVarNode} 的类型化读取，整数与布尔值无需装箱。
 */
@NodeChild(value = "valueNode", type = AstEnvExpressionNode.class)
public abstract class LetNode extends AstEnvExpressionNode {
  @CompilationFinal private final int var;
  @CompilationFinal private final int slotIndex;
  @Child private AstEnvExpressionNode bodyNode;

  protected LetNode(int var, int slotIndex, AstEnvExpressionNode bodyNode) {
    this.var = var;
    this.slotIndex = slotIndex;
    this.bodyNode = bodyNode;
  }

  public static LetNode create(int var, int slotIndex, AstEnvExpressionNode valueNode, AstEnvExpressionNode bodyNode) {
    return LetNodeGen.create(var, slotIndex, bodyNode, valueNode);
  }

  @Specialization
  protected Object doInt(VirtualFrame frame, int value) {
    Profiler.inc("let");
    frame.setInt(slotIndex, value);
    debug(value);
    return bodyNode.executeGeneric(frame);
  }

  @Specialization
  protected Object doBoolean(VirtualFrame frame, boolean value) {
    Profiler.inc("let");
    frame.setBoolean(slotIndex, value);
    debug(value);
    return bodyNode.executeGeneric(frame);
  }

  @Specialization(replaces = {"doInt", "doBoolean"})
  protected Object doObject(VirtualFrame frame, Object value) {
    Profiler.inc("let");
    frame.setObject(slotIndex, value);
    debug(value);
    return bodyNode.executeGeneric(frame);
  }

  private void debug(Object value) {
    if (AstEnvConfig.DEBUG) {
      System.err.println("DEBUG: let x" + var + " slot[" + slotIndex + "]=" + value);
    }
  }
}
