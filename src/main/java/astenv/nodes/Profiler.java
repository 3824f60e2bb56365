package astenv.nodes;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 节点执行计数器，通过 {@code -Dastenv.profiler.enabled=true} 开启。
 */
public final class Profiler {
  private static final Map<String, Long> COUNTERS = new ConcurrentHashMap<>();
  private static final boolean ENABLED = Boolean.getBoolean("astenv.profiler.enabled");
  private Profiler() {}

  public static void inc(String key) {
    if (!ENABLED) {
      return;
    }
    COUNTERS.merge(key, 1L, Long::sum);
    COUNTERS.merge("total", 1L, Long::sum);
  }

  public static String dump() {
    var sb = new StringBuilder();
    sb.append("Truffle profile (counts):\n");
    COUNTERS.forEach((k, v) -> sb.append(k).append(": ").append(v).append('\n'));
    return sb.toString();
  }

  /**
   * 获取所有计数器的副本（用于测试和分析）
   */
  public static Map<String, Long> getCounters() {
    return new HashMap<>(COUNTERS);
  }

  public static void reset() {
    COUNTERS.clear();
  }
}
