package astenv;

import astenv.core.CoreModel;
import astenv.nodes.AstEnvRootNode;
import com.oracle.truffle.api.CallTarget;
import com.oracle.truffle.api.TruffleLanguage;
import com.oracle.truffle.api.source.Source;

/**
 * 编辑器语言的 Truffle 求值器，用于单元测试打分。
 * <p>
 * 输入为 JSON：
 * <ul>
 *   <li>带 {@code kind} 字段的对象：单个表达式，步数上限取 {@code ASTENV_EVAL_FUEL}</li>
 *   <li>{@code {"fuel": n, "body": expr}}：指定步数上限的程序</li>
 * </ul>
 */
@TruffleLanguage.Registration(id = AstEnvLanguage.ID, name = "AstEnv", version = "0.1")
public final class AstEnvLanguage extends TruffleLanguage<AstEnvContext> {
  public static final String ID = "astenv";

  @Override
  protected AstEnvContext createContext(Env env) {
    return new AstEnvContext(env);
  }

  @Override
  protected CallTarget parse(ParsingRequest request) throws Exception {
    Source source = request.getSource();
    CoreModel.Program program = Loader.readProgram(source.getCharacters().toString());
    AstEnvRootNode rootNode = new Loader(this).buildProgram(program);
    return rootNode.getCallTarget();
  }
}
