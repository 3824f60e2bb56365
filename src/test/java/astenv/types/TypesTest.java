package astenv.types;

import astenv.core.CoreModel;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TypesTest {

  @Test
  public void testHoleIsConsistentWithEverything() {
    assertTrue(Types.consistent(Typ.HOLE, Typ.INT));
    assertTrue(Types.consistent(new Typ.Arrow(Typ.INT, Typ.BOOL), Typ.HOLE));
    assertTrue(Types.consistent(Typ.HOLE, Typ.HOLE));
  }

  @Test
  public void testConstructorsMustAgree() {
    assertFalse(Types.consistent(Typ.INT, Typ.BOOL));
    assertFalse(Types.consistent(new Typ.ListOf(Typ.INT), new Typ.Prod(Typ.INT, Typ.INT)));
    assertTrue(Types.consistent(new Typ.ListOf(Typ.HOLE), new Typ.ListOf(Typ.INT)));
    assertFalse(Types.consistent(new Typ.Arrow(Typ.INT, Typ.INT), new Typ.Arrow(Typ.BOOL, Typ.HOLE)));
  }

  @Test
  public void testCommonTypeFillsHoles() {
    Typ left = new Typ.Prod(Typ.HOLE, Typ.BOOL);
    Typ right = new Typ.Prod(Typ.INT, Typ.HOLE);

    assertEquals(Optional.of(new Typ.Prod(Typ.INT, Typ.BOOL)), Types.commonType(left, right));
    assertEquals(Optional.of(Typ.INT), Types.commonType(Typ.HOLE, Typ.INT));
    assertEquals(Optional.empty(), Types.commonType(Typ.INT, Typ.BOOL));
  }

  @Test
  public void testCommonTypeExistsExactlyWhenConsistent() {
    Typ[] samples = {
        Typ.INT, Typ.BOOL, Typ.HOLE,
        new Typ.ListOf(Typ.HOLE), new Typ.ListOf(Typ.INT),
        new Typ.Arrow(Typ.INT, Typ.HOLE), new Typ.Arrow(Typ.HOLE, Typ.BOOL),
        new Typ.Prod(Typ.BOOL, Typ.HOLE)
    };
    for (Typ a : samples) {
      for (Typ b : samples) {
        assertEquals(Types.consistent(a, b), Types.commonType(a, b).isPresent(), a + " / " + b);
        assertEquals(Types.consistent(a, b), Types.consistent(b, a), a + " / " + b);
      }
    }
  }

  @Test
  public void testStripAnnotation() {
    CoreModel.Type annotation = new CoreModel.ArrowT(new CoreModel.ListT(new CoreModel.IntT()), new CoreModel.HoleT());

    assertEquals(new Typ.Arrow(new Typ.ListOf(Typ.INT), Typ.HOLE), Types.strip(annotation));
    assertEquals("(List(Int) -> ?)", Types.show(Types.strip(annotation)));
  }
}
