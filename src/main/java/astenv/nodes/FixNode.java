package astenv.nodes;

import astenv.runtime.AstEnvConfig;
import astenv.runtime.RecursiveCell;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * fix 节点：先把空的 {@link RecursiveCell} 写入槽位，求值主体后再填入主体的值。
 *
 * 主体中的闭包以 raw 方式捕获单元，调用时单元已填充；主体在闭包之外直接读取自身会失败。
 */
public final class FixNode extends AstEnvExpressionNode {
  @CompilationFinal private final int var;
  @CompilationFinal private final int slotIndex;
  @Child private AstEnvExpressionNode bodyNode;

  public FixNode(int var, int slotIndex, AstEnvExpressionNode bodyNode) {
    this.var = var;
    this.slotIndex = slotIndex;
    this.bodyNode = bodyNode;
  }

  @Override
  public Object executeGeneric(VirtualFrame frame) {
    Profiler.inc("fix");
    RecursiveCell cell = new RecursiveCell(var);
    frame.setObject(slotIndex, cell);
    Object value = bodyNode.executeGeneric(frame);
    cell.set(value);
    if (AstEnvConfig.DEBUG) {
      System.err.println("DEBUG: fix x" + var + " slot[" + slotIndex + "]=" + value);
    }
    return value;
  }
}
