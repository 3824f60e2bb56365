package astenv.runtime;

import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;

/**
 * astenv 运行时配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次，避免热路径中的 System.getenv 调用。
 * 使用 @CompilationFinal 标记，Truffle 可以将这些字段视为编译时常量进行优化。
 */
public final class AstEnvConfig {
  private AstEnvConfig() {}

  /**
   * 调试模式开关
   * 环境变量：ASTENV_DEBUG
   * 启用时会在各个执行节点打印调试信息
   */
  @CompilationFinal
  public static final boolean DEBUG = System.getenv("ASTENV_DEBUG") != null;

  /**
   * 整棵树允许的最大节点数
   * 环境变量：ASTENV_MAX_NODES
   */
  @CompilationFinal
  public static final int MAX_NODES = getIntOrDefault("ASTENV_MAX_NODES", 50);

  /**
   * 同时存在的变量编号上限
   * 环境变量：ASTENV_MAX_VARS
   */
  @CompilationFinal
  public static final int MAX_VARS = getIntOrDefault("ASTENV_MAX_VARS", 10);

  /**
   * 单次求值允许的函数调用次数，用于截断不终止的递归
   * 环境变量：ASTENV_EVAL_FUEL
   */
  @CompilationFinal
  public static final int EVAL_FUEL = getIntOrDefault("ASTENV_EVAL_FUEL", 100);

  /**
   * 作业目录
   * 环境变量：ASTENV_DATA_DIR
   * 如果未指定，默认为 "data"
   */
  @CompilationFinal
  public static final String DATA_DIR = getEnvOrDefault("ASTENV_DATA_DIR", "data");

  /**
   * 辅助方法：读取环境变量或返回默认值
   */
  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null ? value : defaultValue;
  }

  private static int getIntOrDefault(String key, int defaultValue) {
    String value = System.getenv(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      System.err.println("WARN: ignoring non-numeric " + key + "=" + value);
      return defaultValue;
    }
  }
}
