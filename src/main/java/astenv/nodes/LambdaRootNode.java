package astenv.nodes;

import astenv.AstEnvLanguage;
import astenv.runtime.AstEnvConfig;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.FrameDescriptor;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import com.oracle.truffle.api.nodes.RootNode;

/**
 * fun/fix 函数体的 RootNode
 *
 * 每个函数都有独立的 RootNode 和 CallTarget：
 * 1. 槽位 0 存放唯一参数
 * 2. 槽位 1..captureCount 存放闭包捕获值
 * 3. 其后是函数体内 let/fix 的局部变量
 */
public final class LambdaRootNode extends RootNode {
  @CompilationFinal private final String name;
  @CompilationFinal private final int captureCount;
  @Child private AstEnvExpressionNode bodyNode;

  public LambdaRootNode(
      AstEnvLanguage language,
      FrameDescriptor frameDescriptor,
      String name,
      int captureCount,
      AstEnvExpressionNode bodyNode) {
    super(language, frameDescriptor);
    this.name = name;
    this.captureCount = captureCount;
    this.bodyNode = bodyNode;
  }

  @Override
  public Object execute(VirtualFrame frame) {
    Profiler.inc("lambda_execute");
    Object[] args = frame.getArguments();
    if (AstEnvConfig.DEBUG) {
      System.err.println("DEBUG: lambda_execute name=" + name
          + ", captureCount=" + captureCount
          + ", args.length=" + args.length);
    }
    bindArguments(frame, args);
    return bodyNode.executeGeneric(frame);
  }

  /**
   * 将参数与闭包变量绑定到 Frame 槽位
   * @ExplodeLoop 展开循环以优化 JIT 编译
   */
  @ExplodeLoop
  private void bindArguments(VirtualFrame frame, Object[] args) {
    int expectedLength = 1 + captureCount;
    if (args.length < expectedLength) {
      throw new IllegalArgumentException(
          "Lambda " + name + " expects " + expectedLength
          + " arguments (captures=" + captureCount + "), but got " + args.length);
    }
    for (int i = 0; i < expectedLength; i++) {
      frame.setObject(i, args[i]);
    }
  }

  @Override
  public String getName() {
    return name;
  }
}
