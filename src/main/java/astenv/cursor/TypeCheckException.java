package astenv.cursor;

/**
 * 类型错误：在快照逻辑假定类型必然存在的位置，综合或分析失败。
 *
 * 树由合法动作构造时不应出现，因此作为内部不变量被破坏的致命错误抛给调用方。
 */
public class TypeCheckException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public TypeCheckException(String message) {
    super(message);
  }
}
