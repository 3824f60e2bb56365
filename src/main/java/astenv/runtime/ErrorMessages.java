package astenv.runtime;

/**
 * 错误消息统一生成工具。
 *
 * <p>所有错误消息均提供中英文双语描述，多数附带恢复提示。英文部分保留关键词，便于测试断言。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息。
   *
   * @param zh 中文描述
   * @param en 英文描述
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加恢复提示，提示部分同样采用中英文双语。
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  // ==================== 类型与作用域 ====================

  /**
   * 类型无法推导：树本应由合法动作构造，出现即说明此前的动作应用存在缺陷。
   *
   * @param term 出错子树的文本形式
   */
  public static String typeCannotBeInferred(String term) {
    String message = bilingual("类型无法推导：" + term, "Type cannot be inferred: " + term);
    return withHint(message, "检查产生该树的编辑动作是否由动作枚举器给出",
        "Check that every applied action came from the action enumerator");
  }

  /**
   * 期望类型的形状不符合所在结构的要求。
   */
  public static String typeExpectedShape(String shape, String actual) {
    return bilingual("期望 " + shape + " 类型，实际为 " + actual, "Expected a " + shape + " type, got " + actual);
  }

  /**
   * if 分支类型与期望类型冲突。
   */
  public static String conflictingBranchTypes(String expected, String branch) {
    return bilingual("期望类型 " + expected + " 与另一分支类型 " + branch + " 冲突",
        "Conflicting types between expected type " + expected + " and branch type " + branch);
  }

  /**
   * 作用域中引用的变量不在类型上下文中。
   */
  public static String variableNotInScope(int var) {
    String message = bilingual("变量不在类型上下文中：x" + var, "Not in typing context: x" + var);
    return withHint(message, "确认变量在光标路径上由 let/fun/fix 绑定", "Ensure the variable is bound by a let/fun/fix on the cursor path");
  }

  // ==================== 求值 ====================

  /**
   * 构造除零算术错误消息。
   */
  public static String arithmeticDivisionByZero() {
    String message = bilingual("算术错误：除数为 0", "division by zero");
    return withHint(message, "检查输入参数，确保除数非 0", "Check the divisor and ensure it is non-zero");
  }

  /**
   * 求值到达未填充的 Hole。
   */
  public static String holeReached() {
    return bilingual("求值到达未完成的 Hole", "evaluation reached a hole");
  }

  /**
   * 构造操作类型不匹配的错误消息。
   */
  public static String operationExpectedType(String operation, String expected, String actual) {
    String english = operation + ": expected " + expected + ", got " + actual;
    String message = bilingual("操作 " + operation + " 期望类型 " + expected + "，实际为 " + actual, english);
    return withHint(message, "核对参数或调用结果，确保类型匹配", "Verify arguments or results to ensure type compatibility");
  }

  /**
   * 求值步数耗尽（疑似不终止）。
   */
  public static String fuelExhausted(int fuel) {
    String message = bilingual("求值步数耗尽：上限 " + fuel, "evaluation fuel exhausted after " + fuel + " applications");
    return withHint(message, "检查递归是否有终止条件，或调大 ASTENV_EVAL_FUEL",
        "Check the recursion terminates, or raise ASTENV_EVAL_FUEL");
  }

  /**
   * fix 在自身值构造完成前读取了自身。
   */
  public static String fixpointNotReady(int var) {
    return bilingual("fix 变量 x" + var + " 在定义完成前被读取", "fixpoint x" + var + " read before it was defined");
  }

  /**
   * 构造变量未初始化的错误消息。
   */
  public static String variableNotInitialized(String name) {
    String english = "Variable not initialized: " + name;
    String message = bilingual("变量未初始化：" + name, english);
    return withHint(message, "确保在首次读取前进行赋值", "Assign the variable before first read");
  }

  // ==================== 作业文件与外部接口 ====================

  /**
   * 作业文件格式错误。
   *
   * @param path 文件路径
   * @param detail 具体原因
   */
  public static String assignmentMalformed(String path, String detail) {
    String message = bilingual("作业文件格式错误：" + path + "，" + detail, "malformed assignment file " + path + ": " + detail);
    return withHint(message, "检查 JSON 结构与 kind 字段", "Check the JSON structure and the kind fields");
  }

  /**
   * 作业文件不存在。
   */
  public static String assignmentMissing(String path) {
    return bilingual("作业文件不存在：" + path, "assignment file not found: " + path);
  }

  /**
   * 动作编号超出范围。
   */
  public static String actionTagOutOfRange(int tag, int count) {
    return bilingual("动作编号越界：" + tag + "（共 " + count + " 个）", "action tag out of range: " + tag + " (count=" + count + ")");
  }

  /**
   * 扁平编码中的节点或边无效。
   */
  public static String invalidFlatEncoding(String detail) {
    return bilingual("扁平编码无效：" + detail, "invalid flat encoding: " + detail);
  }

  /**
   * 在尚未加载初始代码时调用会话操作。
   */
  public static String noProgramLoaded() {
    String message = bilingual("尚未加载程序", "no program loaded");
    return withHint(message, "先调用 loadStarterCode", "Call loadStarterCode first");
  }
}
