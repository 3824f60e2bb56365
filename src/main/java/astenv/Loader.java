package astenv;

import astenv.core.CoreModel;
import astenv.core.CoreModel.*;
import astenv.core.Terms;
import astenv.nodes.*;
import astenv.runtime.AstEnvConfig;
import astenv.runtime.ErrorMessages;
import astenv.runtime.FrameSlotBuilder;
import astenv.runtime.ListValue;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 把表达式树编译为 Truffle 节点树。
 *
 * 每个 fun/fix 函数体拥有独立的 FrameDescriptor：参数在槽位 0，
 * 随后是按编号升序排列的捕获变量，再之后是函数体内 let/fix 的局部变量。
 */
public final class Loader {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final AstEnvLanguage language;
  private int lambdaCounter;

  public Loader(AstEnvLanguage language) {
    this.language = language;
  }

  /**
   * 解析求值器输入：裸表达式或 {@code {"fuel", "body"}} 包装。
   */
  public static CoreModel.Program readProgram(String json) throws IOException {
    JsonNode tree = MAPPER.readTree(json);
    if (tree == null || !tree.isObject()) {
      throw new IOException("Expected a JSON object, got: " + json);
    }
    if (tree.has("kind")) {
      return new CoreModel.Program(AstEnvConfig.EVAL_FUEL, MAPPER.treeToValue(tree, Expr.class));
    }
    CoreModel.Program program = MAPPER.treeToValue(tree, CoreModel.Program.class);
    if (program.body() == null) {
      throw new IOException("Program has no body: " + json);
    }
    return program;
  }

  public AstEnvRootNode buildProgram(CoreModel.Program program) {
    FrameSlotBuilder slots = new FrameSlotBuilder();
    AstEnvExpressionNode body = build(program.body(), new Scope(slots, Map.of()));
    return new AstEnvRootNode(language, slots.build(), body, program.fuel());
  }

  /** 当前函数的槽位分配器与可见变量到槽位的映射。 */
  private record Scope(FrameSlotBuilder slots, Map<Integer, Integer> visible) {
    Scope bind(int var, int slot) {
      Map<Integer, Integer> next = new HashMap<>(visible);
      next.put(var, slot);
      return new Scope(slots, next);
    }

    int slotOf(int var) {
      Integer slot = visible.get(var);
      if (slot == null) {
        throw new IllegalArgumentException(ErrorMessages.variableNotInScope(var));
      }
      return slot;
    }
  }

  private AstEnvExpressionNode build(Expr expr, Scope scope) {
    if (expr instanceof IntE i) return LiteralNode.create(i.value());
    if (expr instanceof Bool b) return LiteralNode.create(b.value());
    if (expr instanceof Nil) return LiteralNode.create(ListValue.EMPTY);
    if (expr instanceof Hole) return new HoleNode();
    if (expr instanceof Var v) return ReadVarNode.create(v.id(), scope.slotOf(v.id()));
    if (expr instanceof UnOp u) return NegateNode.create(build(u.arg(), scope));
    if (expr instanceof BinOp b) return buildBinOp(b, scope);
    if (expr instanceof If i) {
      return IfNode.create(build(i.cond(), scope), build(i.thenExpr(), scope), build(i.elseExpr(), scope));
    }
    if (expr instanceof Pair p) return PairNode.create(build(p.left(), scope), build(p.right(), scope));
    if (expr instanceof Let l) {
      AstEnvExpressionNode value = build(l.definition(), scope);
      int slot = scope.slots().addLocal(l.binder());
      return LetNode.create(l.binder(), slot, value, build(l.body(), scope.bind(l.binder(), slot)));
    }
    if (expr instanceof Fix f) {
      int slot = scope.slots().addLocal(f.binder());
      return new FixNode(f.binder(), slot, build(f.body(), scope.bind(f.binder(), slot)));
    }
    Fun fun = (Fun) expr;
    return buildLambda(fun, scope);
  }

  private AstEnvExpressionNode buildBinOp(BinOp b, Scope scope) {
    AstEnvExpressionNode left = build(b.left(), scope);
    AstEnvExpressionNode right = build(b.right(), scope);
    if (b.op().isArithmetic()) return ArithmeticNode.create(b.op(), left, right);
    if (b.op().isComparison()) return ComparisonNode.create(b.op(), left, right);
    if (b.op() == BinOpKind.CONS) return ConsNode.create(left, right);
    return ApplyNode.create(left, right);
  }

  private AstEnvExpressionNode buildLambda(Fun fun, Scope outer) {
    String name = "lambda_" + (lambdaCounter++) + "_x" + fun.binder();
    List<Integer> captures = Terms.freeVars(fun).stream().toList();

    // Build FrameDescriptor: parameter first, then captures, then locals
    FrameSlotBuilder slots = new FrameSlotBuilder();
    Scope inner = new Scope(slots, Map.of()).bind(fun.binder(), slots.addParameter(fun.binder()));
    ReadVarNode[] captureExprs = new ReadVarNode[captures.size()];
    for (int i = 0; i < captures.size(); i++) {
      int var = captures.get(i);
      captureExprs[i] = ReadVarNode.createRaw(var, outer.slotOf(var));
      inner = inner.bind(var, slots.addParameter(var));
    }
    AstEnvExpressionNode body = build(fun.body(), inner);

    LambdaRootNode rootNode = new LambdaRootNode(language, slots.build(), name, captures.size(), body);
    if (AstEnvConfig.DEBUG) {
      System.err.println("DEBUG: built " + name + " captures=" + captures + " slots=" + slots.getSymbolTable());
    }
    return LambdaNode.create(name, captureExprs, rootNode.getCallTarget());
  }
}
