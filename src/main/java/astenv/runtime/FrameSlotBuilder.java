package astenv.runtime;

import com.oracle.truffle.api.frame.FrameDescriptor;
import com.oracle.truffle.api.frame.FrameSlotKind;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Frame 槽位分配器，管理变量编号到槽位索引的映射。
 *
 * 分配策略：
 * - 参数：索引 0（函数参数），随后是闭包捕获的变量
 * - 局部变量：紧随参数，按 let/fix 出现顺序
 */
public final class FrameSlotBuilder {
  private static final Logger logger = Logger.getLogger(FrameSlotBuilder.class.getName());

  private final FrameDescriptor.Builder descriptorBuilder;
  private final Map<Integer, Integer> variableToSlot = new HashMap<>();
  private int nextSlotIndex = 0;

  public FrameSlotBuilder() {
    this.descriptorBuilder = FrameDescriptor.newBuilder();
  }

  /**
   * 为参数分配槽位（必须先于局部变量调用）
   */
  public int addParameter(int var) {
    if (variableToSlot.containsKey(var)) {
      throw new IllegalStateException("Duplicate variable: x" + var);
    }
    return allocate(var);
  }

  /**
   * 为局部变量分配槽位；同一编号再次绑定时分配新槽位并覆盖映射
   */
  public int addLocal(int var) {
    if (variableToSlot.containsKey(var)) {
      logger.warning("Re-binding variable: x" + var);
    }
    return allocate(var);
  }

  private int allocate(int var) {
    int slotIndex = nextSlotIndex++;
    descriptorBuilder.addSlot(FrameSlotKind.Illegal, "x" + var, null);
    variableToSlot.put(var, slotIndex);
    return slotIndex;
  }

  /**
   * 构建最终的 FrameDescriptor
   */
  public FrameDescriptor build() {
    return descriptorBuilder.build();
  }

  /**
   * 获取符号表（用于调试）
   */
  public Map<Integer, Integer> getSymbolTable() {
    return new HashMap<>(variableToSlot);
  }
}
