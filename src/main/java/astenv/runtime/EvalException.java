package astenv.runtime;

import com.oracle.truffle.api.exception.AbstractTruffleException;
import com.oracle.truffle.api.nodes.Node;

/**
 * 求值错误：除零、到达 Hole、对非函数值应用、步数耗尽等。
 *
 * 作为客语言异常抛出，宿主侧表现为 {@code PolyglotException}，单元测试运行器将其记为一次失败。
 */
public final class EvalException extends AbstractTruffleException {
  private static final long serialVersionUID = 1L;

  public EvalException(String message, Node location) {
    super(message, location);
  }
}
