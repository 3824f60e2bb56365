package astenv.action;

/**
 * 变量编号分配器：单调递增，受最大变量数约束。
 *
 * 每个编辑会话持有自己的分配器，仅在会话边界重置。
 */
public final class VarAllocator {
  private final int maxVars;
  private int next;

  public VarAllocator(int maxVars) {
    this(maxVars, 0);
  }

  private VarAllocator(int maxVars, int next) {
    if (maxVars < 0) {
      throw new IllegalArgumentException("maxVars must be non-negative: " + maxVars);
    }
    this.maxVars = maxVars;
    this.next = next;
  }

  public boolean canAllocate() {
    return next < maxVars;
  }

  /**
   * 分配下一个编号。
   *
   * @throws IllegalStateException 编号已用尽
   */
  public int allocate() {
    if (!canAllocate()) {
      throw new IllegalStateException("Variable budget exhausted: max=" + maxVars);
    }
    return next++;
  }

  /**
   * 保留 0..id 的编号（加载初始代码后调用，避免与程序中已有变量冲突）。
   */
  public void reserveThrough(int id) {
    next = Math.max(next, id + 1);
  }

  /** 供预演动作使用的独立副本。 */
  public VarAllocator copy() {
    return new VarAllocator(maxVars, next);
  }

  public void reset() {
    next = 0;
  }

  public int allocated() {
    return next;
  }

  public int maxVars() {
    return maxVars;
  }
}
