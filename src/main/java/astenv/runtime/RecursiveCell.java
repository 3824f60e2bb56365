package astenv.runtime;

import com.oracle.truffle.api.interop.TruffleObject;
import com.oracle.truffle.api.nodes.Node;

/**
 * fix 绑定变量的可变单元：先放入帧槽位供闭包捕获，函数体求值完成后再填入自身的值。
 */
public final class RecursiveCell implements TruffleObject {
  private final int var;
  private Object value;

  public RecursiveCell(int var) {
    this.var = var;
  }

  public void set(Object v) {
    this.value = v;
  }

  /**
   * @throws EvalException 单元尚未填充
   */
  public Object get(Node location) {
    if (value == null) {
      throw new EvalException(ErrorMessages.fixpointNotReady(var), location);
    }
    return value;
  }
}
