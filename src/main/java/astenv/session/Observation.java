package astenv.session;

/**
 * 交给驱动方的定长观测。所有表按配置上限补齐，空位填 -1。
 *
 * @param nodes 节点字表，长度 maxNodes
 * @param edges 边表 (parent, child, slot)，maxNodes 行
 * @param starter starter 标记 0/1，长度 maxNodes
 * @param permittedActions 合法动作掩码 0/1，长度为动作编号总数
 * @param cursorPosition 光标所在节点下标
 * @param varsInScope let 变量绑定节点的下标，最近绑定的在前，长度 maxVars
 * @param argsInScope 参数的 (函数序号, 参数位置)，maxVars 行
 * @param assignment 当前作业编号，未加载时为 -1
 */
public record Observation(
    int[] nodes,
    int[][] edges,
    int[] starter,
    int[] permittedActions,
    int cursorPosition,
    int[] varsInScope,
    int[][] argsInScope,
    int assignment) {
}
