package astenv.runtime;

import com.oracle.truffle.api.CompilerDirectives.TruffleBoundary;
import com.oracle.truffle.api.interop.InteropLibrary;
import com.oracle.truffle.api.interop.InvalidArrayIndexException;
import com.oracle.truffle.api.interop.TruffleObject;
import com.oracle.truffle.api.library.ExportLibrary;
import com.oracle.truffle.api.library.ExportMessage;

/**
 * 不可变单链表：{@link #EMPTY} 或 head :: tail，对宿主表现为只读数组。
 */
@ExportLibrary(InteropLibrary.class)
public final class ListValue implements TruffleObject {
  public static final ListValue EMPTY = new ListValue(null, null, 0);

  private final Object head;
  private final ListValue tail;
  private final int size;

  private ListValue(Object head, ListValue tail, int size) {
    this.head = head;
    this.tail = tail;
    this.size = size;
  }

  public static ListValue cons(Object head, ListValue tail) {
    return new ListValue(head, tail, tail.size + 1);
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public Object getHead() {
    return head;
  }

  public ListValue getTail() {
    return tail;
  }

  public int size() {
    return size;
  }

  @TruffleBoundary
  public Object get(int index) {
    ListValue current = this;
    for (int i = 0; i < index; i++) {
      current = current.tail;
    }
    return current.head;
  }

  @ExportMessage
  boolean hasArrayElements() {
    return true;
  }

  @ExportMessage
  long getArraySize() {
    return size;
  }

  @ExportMessage
  boolean isArrayElementReadable(long index) {
    return index >= 0 && index < size;
  }

  @ExportMessage
  Object readArrayElement(long index) throws InvalidArrayIndexException {
    if (!isArrayElementReadable(index)) {
      throw InvalidArrayIndexException.create(index);
    }
    return get((int) index);
  }

  @Override
  @TruffleBoundary
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (ListValue current = this; !current.isEmpty(); current = current.tail) {
      if (current != this) {
        sb.append("; ");
      }
      sb.append(current.head);
    }
    return sb.append(']').toString();
  }
}
