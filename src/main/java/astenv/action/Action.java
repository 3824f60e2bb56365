package astenv.action;

/**
 * 编辑动作。动作只是数据，合法性由 {@link ActionEnumerator} 结合光标快照判断。
 */
public sealed interface Action {

  record MoveParent() implements Action {}

  record MoveChild(int child) implements Action {}

  record Construct(Shape shape) implements Action {}

  /** 用第 child 个结构子节点替换当前节点。 */
  record Unwrap(int child) implements Action {}
}
