package verilogast.graph;

import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import verilogast.ast.AstContractException;

class AstOrErrorTest {

  @Test
  void testDefaultIsInvalid() {
    AstOrError none = new AstOrError();
    Assertions.assertFalse(none.valid());
    Assertions.assertEquals(0, none.raw());
    Assertions.assertFalse(AstOrError.error().valid());
    Assertions.assertEquals(none, AstOrError.error());
    Assertions.assertThrows(AstContractException.class, () -> none.id());
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 0x7FFF, 0x12345678, AstOrError.MAX_ID})
  void testRoundTrip(int id) {
    AstOrError wrapped = AstOrError.of(id);
    Assertions.assertTrue(wrapped.valid());
    Assertions.assertEquals(id, wrapped.id());
    // validity lives in the top bit
    Assertions.assertEquals(id | 0x80000000, wrapped.raw());
  }

  @RepeatedTest(64)
  void testRoundTrip_random() {
    int id = new Random().nextInt(AstOrError.MAX_ID + 1);
    try {
      testRoundTrip(id);
    } catch (Throwable t) {
      System.err.println("FAILED testRoundTrip with id " + id);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(ints = {-1, Integer.MIN_VALUE, Integer.MAX_VALUE})
  void testOutOfRangeIdsAreRejected(int id) {
    Assertions.assertThrows(AstContractException.class, () -> AstOrError.of(id));
  }

  @Test
  void testIfValid() {
    int[] seen = {-1};
    AstOrError.error().ifValid(id -> seen[0] = id);
    Assertions.assertEquals(-1, seen[0]);
    AstOrError.of(17).ifValid(id -> seen[0] = id);
    Assertions.assertEquals(17, seen[0]);
  }

  @Test
  void testEquality() {
    Assertions.assertEquals(AstOrError.of(5), AstOrError.of(5));
    Assertions.assertNotEquals(AstOrError.of(5), AstOrError.of(6));
    Assertions.assertNotEquals(AstOrError.of(0), AstOrError.error());
    Assertions.assertEquals(AstOrError.of(5).hashCode(), AstOrError.of(5).hashCode());
  }
}
