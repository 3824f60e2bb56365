package astenv.session;

import astenv.action.Action;
import astenv.action.ActionApplicator;
import astenv.action.ActionCodec;
import astenv.action.ActionEnumerator;
import astenv.action.VarAllocator;
import astenv.core.CoreModel.Expr;
import astenv.core.CoreModel.UnitTest;
import astenv.core.Terms;
import astenv.cursor.CursorInfo;
import astenv.cursor.CursorInfoBuilder;
import astenv.flat.FlatCodec;
import astenv.flat.FlatTree;
import astenv.runtime.EditorConfig;
import astenv.runtime.ErrorMessages;
import astenv.zipper.Zipper;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * 一个编辑会话：当前扁平树、变量分配器与已加载的单元测试。
 *
 * 对外提供四个宿主操作（加载初始代码、加载单元测试、应用动作、运行单元测试），
 * 以及驱动方构造观测所需的光标信息与动作掩码。会话不是线程安全的。
 */
public final class EditorSession {
  private static final Logger logger = Logger.getLogger(EditorSession.class.getName());

  private final EditorConfig config;
  private final AssignmentStore store;
  private final VarAllocator allocator;
  private final ActionEnumerator enumerator;
  private final ActionCodec codec;
  private final UnitTestRunner testRunner;

  private FlatTree state;
  private List<UnitTest> unitTests = List.of();
  private int assignment = -1;

  public EditorSession(EditorConfig config) {
    this.config = config;
    this.store = new AssignmentStore(config.dataDir());
    this.allocator = new VarAllocator(config.maxVars());
    this.enumerator = new ActionEnumerator(config.maxNodes());
    this.codec = new ActionCodec(config.maxVars());
    this.testRunner = new UnitTestRunner(config.evalFuel());
  }

  public EditorConfig config() {
    return config;
  }

  public ActionCodec codec() {
    return codec;
  }

  // ==================== 宿主操作 ====================

  /**
   * 加载初始代码，光标置于前序第一个 Hole（没有则为根）。
   *
   * @return 根节点下标
   * @throws AssignmentFormatException 文件缺失、格式错误、不可类型化或超出节点上限
   */
  public int loadStarterCode(int assignment, int variant) throws AssignmentFormatException {
    Expr program = store.loadStarterCode(assignment, variant);
    int size = Terms.size(program);
    if (size > config.maxNodes()) {
      throw new AssignmentFormatException(ErrorMessages.assignmentMalformed(
          store.starterPath(assignment, variant).toString(),
          size + " nodes exceed the limit of " + config.maxNodes()));
    }
    int maxVar = Terms.maxVarId(program);
    if (maxVar >= config.maxVars()) {
      throw new AssignmentFormatException(ErrorMessages.assignmentMalformed(
          store.starterPath(assignment, variant).toString(),
          "variable x" + maxVar + " exceeds the limit of " + config.maxVars()));
    }
    allocator.reset();
    allocator.reserveThrough(maxVar);

    int hole = Terms.firstHoleIndex(program);
    Zipper zipper = hole >= 0 ? Zipper.at(program, hole) : Zipper.at(program);
    this.state = FlatCodec.flatten(zipper);
    this.assignment = assignment;
    logger.info("loaded assignment " + assignment + " variant " + variant
        + " (" + size + " nodes, cursor " + state.cursor() + ")");
    return state.root();
  }

  /**
   * @throws AssignmentFormatException 测试文件缺失或格式错误
   */
  public void loadUnitTests(int assignment) throws AssignmentFormatException {
    this.unitTests = store.loadUnitTests(assignment);
  }

  /**
   * 解码动作编号并应用到当前树。调用方应只提交 {@link #permittedActions()} 中为 1 的编号。
   *
   * @return 新的根节点下标
   * @throws IllegalArgumentException 编号越界或根下标与当前树不符
   */
  public int applyAction(int root, int tag) {
    FlatTree current = requireState(root);
    Action action = codec.decode(tag);
    Zipper next = new ActionApplicator(allocator).apply(FlatCodec.unflatten(current), action);
    this.state = FlatCodec.flatten(next);
    logger.fine(() -> "applied " + action + " => cursor " + state.cursor() + ", " + state.nodeCount() + " nodes");
    return state.root();
  }

  public boolean checkUnitTests(int root) {
    Expr program = FlatCodec.unflatten(requireState(root)).unzip();
    boolean passed = testRunner.run(program, unitTests);
    logger.fine(() -> "unit tests " + (passed ? "passed" : "failed") + " for " + Terms.show(program));
    return passed;
  }

  // ==================== 观测 ====================

  public FlatTree state() {
    if (state == null) {
      throw new IllegalStateException(ErrorMessages.noProgramLoaded());
    }
    return state;
  }

  public Zipper zipper() {
    return FlatCodec.unflatten(state());
  }

  public CursorInfo cursorInfo() {
    return CursorInfoBuilder.build(zipper());
  }

  public List<Action> legalActions() {
    return enumerator.legalActions(zipper(), allocator);
  }

  /** 合法动作掩码，长度为 {@link ActionCodec#size()}。 */
  public int[] permittedActions() {
    return codec.mask(legalActions());
  }

  /** 已加载的单元测试表，每行 (input, output)。 */
  public int[][] unitTestTable() {
    int[][] table = new int[unitTests.size()][];
    for (int i = 0; i < table.length; i++) {
      table[i] = new int[] {unitTests.get(i).input(), unitTests.get(i).output()};
    }
    return table;
  }

  public Observation observe() {
    FlatTree tree = state();
    CursorInfo info = cursorInfo();
    int maxNodes = config.maxNodes();
    int maxVars = config.maxVars();

    int[] nodes = pad(tree.nodes(), maxNodes);
    int[] starter = pad(tree.starter(), maxNodes);
    int[][] edges = new int[maxNodes][];
    for (int i = 0; i < maxNodes; i++) {
      edges[i] = i < tree.edgeCount() ? tree.edges()[i].clone() : new int[] {-1, -1, -1};
    }

    int[] vars = new int[maxVars];
    Arrays.fill(vars, -1);
    for (int i = 0; i < Math.min(maxVars, info.varsInScope().size()); i++) {
      vars[i] = info.varsInScope().get(i).index();
    }
    int[][] args = new int[maxVars][];
    for (int i = 0; i < maxVars; i++) {
      if (i < info.argsInScope().size()) {
        CursorInfo.ScopedArg arg = info.argsInScope().get(i);
        args[i] = new int[] {arg.function(), arg.argument()};
      } else {
        args[i] = new int[] {-1, -1};
      }
    }
    return new Observation(nodes, edges, starter, permittedActions(), tree.cursor(), vars, args, assignment);
  }

  private static int[] pad(int[] values, int length) {
    int[] out = new int[length];
    Arrays.fill(out, -1);
    System.arraycopy(values, 0, out, 0, Math.min(values.length, length));
    return out;
  }

  private FlatTree requireState(int root) {
    FlatTree current = state();
    if (root != current.root()) {
      throw new IllegalArgumentException("Unknown root index " + root + ", current root is " + current.root());
    }
    return current;
  }
}
