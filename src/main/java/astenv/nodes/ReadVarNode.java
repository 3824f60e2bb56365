package astenv.nodes;

import astenv.runtime.ErrorMessages;
import astenv.runtime.EvalException;
import astenv.runtime.RecursiveCell;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.dsl.Specialization;
import com.oracle.truffle.api.frame.FrameSlotTypeException;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 变量读取节点（Frame 版本），使用 Truffle DSL 类型特化。
 *
 * - 优先尝试从 Frame 槽位读取类型化值（frame.getInt/getBoolean）
 * - 当类型不匹配时（FrameSlotTypeException），自动重写为更通用的特化
 * - 对象槽位中的 {@link RecursiveCell} 会被解引用；闭包捕获使用 raw 模式，原样传递单元
 */
public abstract class ReadVarNode extends AstEnvExpressionNode {
  @CompilationFinal protected final int var;
  @CompilationFinal protected final int slotIndex;
  @CompilationFinal protected final boolean raw;

  protected ReadVarNode(int var, int slotIndex, boolean raw) {
    this.var = var;
    this.slotIndex = slotIndex;
    this.raw = raw;
  }

  public static ReadVarNode create(int var, int slotIndex) {
    return ReadVarNodeGen.create(var, slotIndex, false);
  }

  /**
   * 闭包捕获用的读取：不解引用 fix 单元。
   */
  public static ReadVarNode createRaw(int var, int slotIndex) {
    return ReadVarNodeGen.create(var, slotIndex, true);
  }

  @Specialization(rewriteOn = FrameSlotTypeException.class)
  protected int readInt(VirtualFrame frame) throws FrameSlotTypeException {
    Profiler.inc("var_int");
    return frame.getInt(slotIndex);
  }

  @Specialization(rewriteOn = FrameSlotTypeException.class, replaces = "readInt")
  protected boolean readBoolean(VirtualFrame frame) throws FrameSlotTypeException {
    Profiler.inc("var_boolean");
    return frame.getBoolean(slotIndex);
  }

  @Specialization(replaces = {"readInt", "readBoolean"})
  protected Object readObject(VirtualFrame frame) {
    Profiler.inc("var_object");
    Object value = frame.getValue(slotIndex);
    if (value == null) {
      throw new EvalException(ErrorMessages.variableNotInitialized("x" + var), this);
    }
    if (!raw && value instanceof RecursiveCell cell) {
      return cell.get(this);
    }
    return value;
  }
}
