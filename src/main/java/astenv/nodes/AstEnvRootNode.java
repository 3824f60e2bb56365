package astenv.nodes;

import astenv.AstEnvContext;
import astenv.AstEnvLanguage;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.FrameDescriptor;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.RootNode;

/**
 * 顶层程序入口：重置求值步数后执行程序主体。
 */
public final class AstEnvRootNode extends RootNode {
  @CompilationFinal private final int fuel;
  @Child private AstEnvExpressionNode body;

  public AstEnvRootNode(AstEnvLanguage language, FrameDescriptor descriptor, AstEnvExpressionNode body, int fuel) {
    super(language, descriptor);
    this.body = body;
    this.fuel = fuel;
  }

  @Override
  public Object execute(VirtualFrame frame) {
    AstEnvContext.get(this).resetFuel(fuel);
    return body.executeGeneric(frame);
  }

  @Override
  public String getName() {
    return "program";
  }
}
