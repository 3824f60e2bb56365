package astenv.flat;

/**
 * 与宿主交换的扁平表示。
 *
 * @param nodes 前序节点表，每项为 {@code payload << 6 | kind}
 * @param edges 边表，每行 {@code (parent, child, slot)}
 * @param starter 每个节点是否来自初始代码（1/0）
 * @param root 根节点下标
 * @param cursor 光标节点下标
 */
public record FlatTree(int[] nodes, int[][] edges, int[] starter, int root, int cursor) {

  public int nodeCount() {
    return nodes.length;
  }

  public int edgeCount() {
    return edges.length;
  }
}
