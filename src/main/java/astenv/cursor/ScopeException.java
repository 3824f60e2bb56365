package astenv.cursor;

/**
 * 作用域错误：作用域列表中的变量在类型上下文中找不到绑定。
 */
public class ScopeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ScopeException(String message) {
    super(message);
  }
}
