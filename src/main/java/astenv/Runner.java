package astenv;

import astenv.action.Action;
import astenv.core.Terms;
import astenv.cursor.CursorInfo;
import astenv.nodes.Profiler;
import astenv.runtime.AstEnvConfig;
import astenv.runtime.EditorConfig;
import astenv.session.AssignmentFormatException;
import astenv.session.EditorSession;
import astenv.types.Types;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * 命令行入口：加载作业，打印光标上下文与合法动作，并报告初始代码能否通过单元测试。
 */
public final class Runner {
  private Runner() {}

  public static void main(String[] args) throws Exception {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length != 3) {
      err.println("Usage: Runner <data-dir> <assignment> <variant>");
      err.println("");
      err.println("Examples:");
      err.println("  Runner data 0 0");
      return 2;
    }
    int assignment;
    int variant;
    try {
      assignment = Integer.parseInt(args[1]);
      variant = Integer.parseInt(args[2]);
    } catch (NumberFormatException e) {
      err.println("assignment and variant must be integers: " + e.getMessage());
      return 2;
    }

    EditorSession session = new EditorSession(EditorConfig.fromEnvironment().withDataDir(Path.of(args[0])));
    int root;
    try {
      root = session.loadStarterCode(assignment, variant);
      session.loadUnitTests(assignment);
    } catch (AssignmentFormatException e) {
      err.println(e.getMessage());
      return 1;
    }
    if (AstEnvConfig.DEBUG) {
      err.println("DEBUG: data-dir=" + Path.of(args[0]).toAbsolutePath());
    }

    CursorInfo info = session.cursorInfo();
    out.println("program:  " + Terms.show(session.zipper().unzip()));
    out.println("cursor:   " + info.cursorPosition() + "/" + info.numNodes() + " at " + Terms.show(info.currentTerm()));
    if (!info.inType()) {
      out.println("expected: " + Types.show(info.expectedType()));
      out.println("actual:   " + Types.show(info.actualType()));
    }
    List<Action> actions = session.legalActions();
    out.println("actions:  " + actions.size());
    for (Action action : actions) {
      out.println("  [" + session.codec().encode(action) + "] " + action);
    }
    out.println("tests:    " + (session.checkUnitTests(root) ? "pass" : "fail"));

    if (Boolean.getBoolean("astenv.profiler.enabled")) {
      out.print(Profiler.dump());
    }
    return 0;
  }
}
