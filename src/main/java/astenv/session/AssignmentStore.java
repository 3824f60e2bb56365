package astenv.session;

import astenv.core.CoreModel.Expr;
import astenv.core.CoreModel.UnitTest;
import astenv.core.Terms;
import astenv.flat.FlatCodec;
import astenv.runtime.ErrorMessages;
import astenv.typing.Typing;
import astenv.typing.TypingContext;
import astenv.zipper.Zipper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 磁盘上的作业目录：
 * <pre>
 * &lt;dataDir&gt;/&lt;assignment&gt;/&lt;variant&gt;.json   初始代码（表达式 JSON）
 * &lt;dataDir&gt;/&lt;assignment&gt;/tests.json         单元测试 [{"input": i, "output": o}, ...]
 * </pre>
 */
public final class AssignmentStore {
  private static final Logger logger = Logger.getLogger(AssignmentStore.class.getName());
  private static final TypeReference<List<UnitTest>> TESTS_TYPE = new TypeReference<>() {};

  private final Path dataDir;
  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public AssignmentStore(Path dataDir) {
    this.dataDir = dataDir;
  }

  public Path dataDir() {
    return dataDir;
  }

  public Path starterPath(int assignment, int variant) {
    return dataDir.resolve(Integer.toString(assignment)).resolve(variant + ".json");
  }

  public Path testsPath(int assignment) {
    return dataDir.resolve(Integer.toString(assignment)).resolve("tests.json");
  }

  /**
   * 读取初始代码并把所有节点标记为 starter。
   *
   * @throws AssignmentFormatException 文件缺失、JSON 无法解析、绑定变量重复、字面量无法扁平编码，
   *     或程序无法综合出类型
   */
  public Expr loadStarterCode(int assignment, int variant) throws AssignmentFormatException {
    Path path = starterPath(assignment, variant);
    Expr expr = read(path, mapper.constructType(Expr.class));
    if (expr == null) {
      throw new AssignmentFormatException(ErrorMessages.assignmentMalformed(path.toString(), "empty document"));
    }
    Set<Integer> seen = new HashSet<>();
    for (int binder : Terms.binders(expr)) {
      if (!seen.add(binder)) {
        throw new AssignmentFormatException(ErrorMessages.assignmentMalformed(path.toString(),
            "binder x" + binder + " is bound more than once"));
      }
    }
    try {
      FlatCodec.flatten(Zipper.at(expr));
    } catch (IllegalArgumentException e) {
      throw new AssignmentFormatException(ErrorMessages.assignmentMalformed(path.toString(), e.getMessage()), e);
    }
    if (Typing.synthesize(TypingContext.empty(), expr).isEmpty()) {
      throw new AssignmentFormatException(ErrorMessages.assignmentMalformed(path.toString(),
          "starter program is ill-typed: " + Terms.show(expr)));
    }
    logger.fine(() -> "loaded starter " + path + ": " + Terms.show(expr));
    return Terms.markStarter(expr);
  }

  /**
   * @throws AssignmentFormatException 文件缺失、JSON 无法解析或测试列表为空
   */
  public List<UnitTest> loadUnitTests(int assignment) throws AssignmentFormatException {
    Path path = testsPath(assignment);
    List<UnitTest> tests = read(path, mapper.getTypeFactory().constructType(TESTS_TYPE));
    if (tests == null || tests.isEmpty()) {
      throw new AssignmentFormatException(ErrorMessages.assignmentMalformed(path.toString(), "no unit tests"));
    }
    logger.fine(() -> "loaded " + tests.size() + " unit tests from " + path);
    return List.copyOf(tests);
  }

  private <T> T read(Path path, JavaType type) throws AssignmentFormatException {
    if (!Files.isRegularFile(path)) {
      throw new AssignmentFormatException(ErrorMessages.assignmentMissing(path.toString()));
    }
    try {
      return mapper.readValue(path.toFile(), type);
    } catch (JsonProcessingException e) {
      throw new AssignmentFormatException(ErrorMessages.assignmentMalformed(path.toString(), e.getOriginalMessage()), e);
    } catch (IOException e) {
      throw new AssignmentFormatException(ErrorMessages.assignmentMalformed(path.toString(), e.getMessage()), e);
    }
  }
}
