package astenv;

import astenv.runtime.AstEnvConfig;
import astenv.runtime.ErrorMessages;
import astenv.runtime.EvalException;
import com.oracle.truffle.api.TruffleLanguage;
import com.oracle.truffle.api.TruffleLanguage.ContextReference;
import com.oracle.truffle.api.nodes.Node;
import java.util.Objects;

/**
 * 求值器运行时上下文。
 *
 * 封装 Truffle 环境与当前求值的剩余步数；每次 {@code eval} 开始时由根节点重置步数。
 */
public final class AstEnvContext {
  private static final ContextReference<AstEnvContext> REF = ContextReference.create(AstEnvLanguage.class);

  private final TruffleLanguage.Env env;
  private int fuelLimit = AstEnvConfig.EVAL_FUEL;
  private int remainingFuel = AstEnvConfig.EVAL_FUEL;

  public AstEnvContext(TruffleLanguage.Env env) {
    this.env = Objects.requireNonNull(env, "env");
  }

  /**
   * 获取当前线程的上下文
   */
  public static AstEnvContext get(Node node) {
    return REF.get(node);
  }

  public TruffleLanguage.Env getEnv() {
    return env;
  }

  /**
   * 重置剩余步数，{@code fuel <= 0} 时使用 {@link AstEnvConfig#EVAL_FUEL}。
   */
  public void resetFuel(int fuel) {
    this.fuelLimit = fuel > 0 ? fuel : AstEnvConfig.EVAL_FUEL;
    this.remainingFuel = fuelLimit;
  }

  /**
   * 消耗一步。
   *
   * @throws EvalException 步数已耗尽
   */
  public void consumeFuel(Node location) {
    if (remainingFuel <= 0) {
      throw new EvalException(ErrorMessages.fuelExhausted(fuelLimit), location);
    }
    remainingFuel--;
  }
}
