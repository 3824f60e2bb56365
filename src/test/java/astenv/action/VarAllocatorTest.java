package astenv.action;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VarAllocatorTest {

  @Test
  public void testAllocatesUntilExhausted() {
    VarAllocator allocator = new VarAllocator(2);

    assertEquals(0, allocator.allocate());
    assertEquals(1, allocator.allocate());
    assertFalse(allocator.canAllocate());
    assertThrows(IllegalStateException.class, allocator::allocate);
  }

  @Test
  public void testReserveAndReset() {
    VarAllocator allocator = new VarAllocator(10);
    allocator.reserveThrough(4);
    assertEquals(5, allocator.allocate());

    allocator.reserveThrough(2);
    assertEquals(6, allocator.allocate());

    allocator.reset();
    assertEquals(0, allocator.allocated());
    assertTrue(allocator.canAllocate());
  }

  @Test
  public void testCopyIsIndependent() {
    VarAllocator allocator = new VarAllocator(3);
    allocator.allocate();

    VarAllocator copy = allocator.copy();
    copy.allocate();
    copy.allocate();

    assertFalse(copy.canAllocate());
    assertEquals(1, allocator.allocated());
  }

  @Test
  public void testNegativeBudgetRejected() {
    assertThrows(IllegalArgumentException.class, () -> new VarAllocator(-1));
  }
}
