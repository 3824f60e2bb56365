package astenv.runtime;

import com.oracle.truffle.api.frame.FrameDescriptor;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FrameSlotBuilderTest {

  @Test
  public void testParameterAllocation() {
    FrameSlotBuilder builder = new FrameSlotBuilder();

    assertEquals(0, builder.addParameter(3));
    assertEquals(1, builder.addParameter(1));

    assertEquals(Map.of(3, 0, 1, 1), builder.getSymbolTable());
  }

  @Test
  public void testLocalVariableAllocation() {
    FrameSlotBuilder builder = new FrameSlotBuilder();

    builder.addParameter(0);
    builder.addLocal(4);
    builder.addLocal(5);

    assertEquals(Map.of(0, 0, 4, 1, 5, 2), builder.getSymbolTable());
  }

  @Test
  public void testRebindingLocalGetsFreshSlot() {
    FrameSlotBuilder builder = new FrameSlotBuilder();

    int first = builder.addLocal(2);
    int second = builder.addLocal(2);

    assertEquals(0, first);
    assertEquals(1, second);
    assertEquals(Map.of(2, 1), builder.getSymbolTable());
    assertEquals(2, builder.build().getNumberOfSlots());
  }

  @Test
  public void testDuplicateParameterRejected() {
    FrameSlotBuilder builder = new FrameSlotBuilder();
    builder.addParameter(0);

    assertThrows(IllegalStateException.class, () -> builder.addParameter(0));
  }

  @Test
  public void testBuildFrameDescriptor() {
    FrameSlotBuilder builder = new FrameSlotBuilder();

    builder.addParameter(0);
    builder.addLocal(1);

    FrameDescriptor descriptor = builder.build();
    assertEquals(2, descriptor.getNumberOfSlots());
    assertEquals("x1", descriptor.getSlotName(1));
    assertFalse(builder.getSymbolTable().containsKey(9));
  }
}
