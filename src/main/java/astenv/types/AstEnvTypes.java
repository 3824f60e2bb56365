package astenv.types;

import com.oracle.truffle.api.dsl.TypeSystem;

/**
 * 求值器的类型系统定义
 *
 * 只有整数与布尔值需要特化；列表、二元组与闭包均以对象形式流转。
 * Truffle DSL 处理器会自动生成类型检查和转换方法。
 */
@TypeSystem({
    int.class,
    boolean.class
})
public abstract class AstEnvTypes {
  // 构造函数必须是 protected，以便 Truffle DSL 生成的子类可以访问
  protected AstEnvTypes() {}
}
