package astenv.runtime;

import java.nio.file.Path;

/**
 * 单个编辑会话的配置快照。
 *
 * 默认值来自 {@link AstEnvConfig}，测试与宿主可以为每个会话单独指定。
 *
 * @param maxNodes 整棵树允许的最大节点数
 * @param maxVars 变量编号上限，同时决定变量/参数引用动作的数量
 * @param evalFuel 单元测试求值的调用次数上限
 * @param dataDir 作业目录
 */
public record EditorConfig(int maxNodes, int maxVars, int evalFuel, Path dataDir) {

  public EditorConfig {
    if (maxNodes <= 0 || maxVars < 0 || evalFuel <= 0) {
      throw new IllegalArgumentException("Invalid editor limits: maxNodes=" + maxNodes
          + ", maxVars=" + maxVars + ", evalFuel=" + evalFuel);
    }
  }

  public static EditorConfig fromEnvironment() {
    return new EditorConfig(AstEnvConfig.MAX_NODES, AstEnvConfig.MAX_VARS, AstEnvConfig.EVAL_FUEL,
        Path.of(AstEnvConfig.DATA_DIR));
  }

  public EditorConfig withDataDir(Path dir) {
    return new EditorConfig(maxNodes, maxVars, evalFuel, dir);
  }

  public EditorConfig withMaxNodes(int nodes) {
    return new EditorConfig(nodes, maxVars, evalFuel, dataDir);
  }
}
