package astenv.runtime;

import com.oracle.truffle.api.interop.InteropLibrary;
import com.oracle.truffle.api.interop.InvalidArrayIndexException;
import com.oracle.truffle.api.interop.TruffleObject;
import com.oracle.truffle.api.library.ExportLibrary;
import com.oracle.truffle.api.library.ExportMessage;

/**
 * 二元组值，对宿主表现为长度为 2 的数组。
 */
@ExportLibrary(InteropLibrary.class)
public final class PairValue implements TruffleObject {
  private final Object left;
  private final Object right;

  public PairValue(Object left, Object right) {
    this.left = left;
    this.right = right;
  }

  public Object getLeft() {
    return left;
  }

  public Object getRight() {
    return right;
  }

  @ExportMessage
  boolean hasArrayElements() {
    return true;
  }

  @ExportMessage
  long getArraySize() {
    return 2;
  }

  @ExportMessage
  boolean isArrayElementReadable(long index) {
    return index == 0 || index == 1;
  }

  @ExportMessage
  Object readArrayElement(long index) throws InvalidArrayIndexException {
    if (!isArrayElementReadable(index)) {
      throw InvalidArrayIndexException.create(index);
    }
    return index == 0 ? left : right;
  }

  @Override
  public String toString() {
    return "(" + left + ", " + right + ")";
  }
}
