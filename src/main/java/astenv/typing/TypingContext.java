package astenv.typing;

import astenv.types.Typ;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 不可变的类型上下文：变量编号到类型的有序映射。
 *
 * 进入绑定结构的主体时压入新绑定；查找返回最近压入的绑定。
 * 由于不存在变量遮蔽，同一编号最多只有一个绑定处于活动状态。
 */
public final class TypingContext {
  private static final TypingContext EMPTY = new TypingContext(List.of());

  /** 按压入先后倒序保存，下标 0 为最近的绑定。 */
  private final List<Binding> bindings;

  public record Binding(int var, Typ type) {}

  private TypingContext(List<Binding> bindings) {
    this.bindings = bindings;
  }

  public static TypingContext empty() {
    return EMPTY;
  }

  public TypingContext extend(int var, Typ type) {
    List<Binding> next = new ArrayList<>(bindings.size() + 1);
    next.add(new Binding(var, type));
    next.addAll(bindings);
    return new TypingContext(Collections.unmodifiableList(next));
  }

  public Optional<Typ> lookup(int var) {
    for (Binding binding : bindings) {
      if (binding.var() == var) {
        return Optional.of(binding.type());
      }
    }
    return Optional.empty();
  }

  public boolean contains(int var) {
    return lookup(var).isPresent();
  }

  /**
   * 所有绑定，最近压入的在前。
   */
  public List<Binding> bindings() {
    return bindings;
  }

  public int size() {
    return bindings.size();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TypingContext other && bindings.equals(other.bindings);
  }

  @Override
  public int hashCode() {
    return bindings.hashCode();
  }

  @Override
  public String toString() {
    return "TypingContext" + bindings;
  }
}
