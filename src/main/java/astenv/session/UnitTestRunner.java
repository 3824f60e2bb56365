package astenv.session;

import astenv.AstEnvLanguage;
import astenv.core.CoreModel;
import astenv.core.CoreModel.*;
import astenv.core.Terms;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

/**
 * 用 Truffle 求值器对完成的程序打分。
 *
 * 程序必须形如 {@code let f = <fun|fix> in ?}；每个测试求值 {@code let f = <fun|fix> in f input}，
 * 结果必须恰为期望的整数。求值失败（除零、步数耗尽等）记为该测试失败，不向外抛出。
 */
public final class UnitTestRunner {
  private static final Logger logger = Logger.getLogger(UnitTestRunner.class.getName());

  private final int fuel;
  private final ObjectMapper mapper = new ObjectMapper();

  public UnitTestRunner(int fuel) {
    this.fuel = fuel;
  }

  /**
   * 全部测试通过时返回 true；测试列表为空时同样返回 true。
   */
  public boolean run(Expr program, List<UnitTest> tests) {
    if (!isTestable(program)) {
      logger.warning("program is not of the form let f = fun/fix in ?: " + Terms.show(program));
      return false;
    }
    Let let = (Let) program;
    try (Context context = Context.newBuilder(AstEnvLanguage.ID)
        .option("engine.WarnInterpreterOnly", "false")
        .build()) {
      for (UnitTest test : tests) {
        if (!passes(context, let, test)) {
          return false;
        }
      }
      return true;
    }
  }

  public static boolean isTestable(Expr program) {
    return program instanceof Let let
        && (let.definition() instanceof Fun || let.definition() instanceof Fix)
        && let.body() instanceof Hole;
  }

  /**
   * 构造单个测试的调用程序：{@code let f = def in f input}。
   */
  public static Expr applicationFor(Let program, int input) {
    Expr call = new BinOp(new Var(program.binder()), BinOpKind.AP, new IntE(input));
    return new Let(program.binder(), program.definition(), call);
  }

  private boolean passes(Context context, Let program, UnitTest test) {
    String json;
    try {
      json = mapper.writeValueAsString(new CoreModel.Program(fuel, applicationFor(program, test.input())));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize program " + Terms.show(program), e);
    }
    try {
      Value result = context.eval(Source.create(AstEnvLanguage.ID, json));
      boolean ok = result.fitsInInt() && result.asInt() == test.output();
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("test " + test + " => " + result + (ok ? " ok" : " FAILED"));
      }
      return ok;
    } catch (PolyglotException e) {
      logger.log(Level.FINE, "test " + test + " raised: " + e.getMessage(), e);
      return false;
    }
  }
}
