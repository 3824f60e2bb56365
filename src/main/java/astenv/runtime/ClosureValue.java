package astenv.runtime;

import com.oracle.truffle.api.CallTarget;
import com.oracle.truffle.api.interop.ArityException;
import com.oracle.truffle.api.interop.InteropLibrary;
import com.oracle.truffle.api.interop.TruffleObject;
import com.oracle.truffle.api.library.ExportLibrary;
import com.oracle.truffle.api.library.ExportMessage;

/**
 * 单参数闭包，实现 Truffle InteropLibrary 使其可从 Polyglot 调用。
 *
 * 调用约定：arguments[0] 为参数，arguments[1..] 为按变量编号升序排列的捕获值。
 */
@ExportLibrary(InteropLibrary.class)
public final class ClosureValue implements TruffleObject {
  private final String name;
  private final CallTarget callTarget;
  private final Object[] capturedValues;

  public ClosureValue(String name, CallTarget callTarget, Object[] capturedValues) {
    this.name = name;
    this.callTarget = callTarget;
    this.capturedValues = capturedValues != null ? capturedValues : new Object[0];
  }

  public CallTarget getCallTarget() {
    return callTarget;
  }

  public Object[] getCapturedValues() {
    return capturedValues;
  }

  /**
   * 打包调用参数：[argument, capture0, capture1, ...]
   */
  public Object[] pack(Object argument) {
    Object[] callArgs = new Object[1 + capturedValues.length];
    callArgs[0] = argument;
    System.arraycopy(capturedValues, 0, callArgs, 1, capturedValues.length);
    return callArgs;
  }

  // ==================== Truffle InteropLibrary 实现 ====================

  @ExportMessage
  boolean isExecutable() {
    return true;
  }

  /**
   * Polyglot 调用入口，宿主侧调用不消耗求值步数。
   */
  @ExportMessage
  Object execute(Object[] arguments) throws ArityException {
    if (arguments.length != 1) {
      throw ArityException.create(1, 1, arguments.length);
    }
    if (AstEnvConfig.DEBUG) {
      System.err.println("DEBUG: closure " + name + " called from host with " + arguments[0]);
    }
    return callTarget.call(pack(arguments[0]));
  }

  @Override
  public String toString() {
    return "<fun " + name + ">";
  }
}
