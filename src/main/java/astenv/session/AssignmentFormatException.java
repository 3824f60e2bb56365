package astenv.session;

import java.io.IOException;

/**
 * 作业文件缺失、JSON 格式错误或初始代码不可类型化。
 */
public final class AssignmentFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  public AssignmentFormatException(String message) {
    super(message);
  }

  public AssignmentFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
