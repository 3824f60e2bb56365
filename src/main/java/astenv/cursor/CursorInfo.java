package astenv.cursor;

import astenv.core.CoreModel;
import astenv.types.Typ;
import astenv.typing.TypingContext;
import astenv.zipper.Frame;
import astenv.zipper.Zipper;
import java.util.List;

/**
 * 光标处的只读快照，每一步都从头重新计算，不做缓存。
 *
 * @param currentTerm 光标处子树
 * @param parent 父节点所在 frame（仅用于判断能否向上移动），光标在根时为 null
 * @param varsInScope let 引入的变量，最近绑定的在前
 * @param argsInScope fun/fix 引入的参数，最近绑定的在前
 * @param typingContext 光标处的类型上下文
 * @param expectedType 外层结构下推的期望类型；光标在类型标注内时为 null
 * @param actualType 光标处子树综合出的类型；光标在类型标注内时为 null
 * @param cursorPosition 光标在前序线性化中的下标
 * @param numNodes 整棵树的节点数
 * @param zipper 快照所依据的拉链
 */
public record CursorInfo(
    CoreModel.Term currentTerm,
    Frame parent,
    List<ScopedVar> varsInScope,
    List<ScopedArg> argsInScope,
    TypingContext typingContext,
    Typ expectedType,
    Typ actualType,
    int cursorPosition,
    int numNodes,
    Zipper zipper) {

  /** let 绑定的变量及其绑定节点的线性下标。 */
  public record ScopedVar(int var, int index) {}

  /** 函数参数：变量、所属函数序号、在柯里化参数列表中的位置。 */
  public record ScopedArg(int var, int function, int argument) {}

  public boolean inType() {
    return currentTerm instanceof CoreModel.Type;
  }
}
