package astenv.nodes;

import astenv.types.AstEnvTypes;
import com.oracle.truffle.api.dsl.TypeSystemReference;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.Node;
import com.oracle.truffle.api.nodes.UnexpectedResultException;

/**
 * 表达式节点的抽象基类
 *
 * 运算类节点使用 @NodeChild + @Specialization 进行整数/布尔特化，
 * 绑定与调用类节点直接覆写 {@link #executeGeneric}。
 */
@TypeSystemReference(AstEnvTypes.class)
public abstract class AstEnvExpressionNode extends Node {

  /**
   * 执行此节点并返回结果（通用版本）
   *
   * @param frame 当前执行帧
   * @return 节点的执行结果（任意类型）
   */
  public abstract Object executeGeneric(VirtualFrame frame);

  /**
   * 执行此节点并返回 int 结果
   *
   * @throws UnexpectedResultException 如果结果不是 int 类型
   */
  public int executeInt(VirtualFrame frame) throws UnexpectedResultException {
    Object result = executeGeneric(frame);
    if (result instanceof Integer) {
      return (int) result;
    }
    throw new UnexpectedResultException(result);
  }

  /**
   * 执行此节点并返回 boolean 结果
   *
   * @throws UnexpectedResultException 如果结果不是 boolean 类型
   */
  public boolean executeBoolean(VirtualFrame frame) throws UnexpectedResultException {
    Object result = executeGeneric(frame);
    if (result instanceof Boolean) {
      return (boolean) result;
    }
    throw new UnexpectedResultException(result);
  }
}
