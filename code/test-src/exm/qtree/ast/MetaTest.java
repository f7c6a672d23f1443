package exm.qtree.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class MetaTest {

  @Test
  public void testBoxedTypesNormalized() {
    assertEquals(Meta.of(Meta.LINE, 3L), Meta.of(Meta.LINE, 3));
    assertEquals(Meta.of("x", 1.5d), Meta.of("x", 1.5f));
    assertEquals(Long.valueOf(7), Meta.EMPTY.with(Meta.COUNTER, 7).get(Meta.COUNTER));
  }

  @Test
  public void testLineAndCounter() {
    Meta m = Meta.of(Meta.LINE, 12, Meta.COUNTER, 4);
    assertEquals(12, m.line());
    assertEquals(Long.valueOf(4), m.counter());
    assertEquals(0, Meta.EMPTY.line());
    assertNull(Meta.EMPTY.counter());
  }

  @Test
  public void testWithReplacesInPlace() {
    Meta m = Meta.of("a", 1, "b", 2, "c", 3).with("b", 20);
    List<String> keys = new ArrayList<String>(m.keys());
    assertEquals(Arrays.asList("a", "b", "c"), keys);
    assertEquals(Long.valueOf(20), m.get("b"));
  }

  @Test
  public void testWithNewKeepsExisting() {
    Meta m = Meta.of(Meta.COUNTER, 1);
    assertSame(m, m.withNew(Meta.COUNTER, 2));
    assertEquals(Long.valueOf(1), m.counter());
    assertTrue(Meta.EMPTY.withNew(Meta.COUNTER, 2).has(Meta.COUNTER));
  }

  @Test
  public void testTakeAndWithout() {
    Meta m = Meta.of(Meta.LINE, 1, Meta.COLUMN, 2, Meta.NO_PARENS, true);
    Meta pruned = m.take(Meta.NO_PARENS, Meta.LINE);
    assertEquals(Arrays.asList(Meta.LINE, Meta.NO_PARENS),
                 new ArrayList<String>(pruned.keys()));
    assertFalse(m.without(Meta.COLUMN).has(Meta.COLUMN));
    assertSame(Meta.EMPTY, Meta.EMPTY.without(Meta.LINE));
  }

  @Test
  public void testIsTrue() {
    Meta m = Meta.of(Meta.GENERATED, true, Meta.NO_PARENS, "true");
    assertTrue(m.isTrue(Meta.GENERATED));
    assertFalse(m.isTrue(Meta.NO_PARENS));
    assertFalse(m.isTrue(Meta.FROM_BRACKETS));
  }

  @Test(expected=NullPointerException.class)
  public void testNullValue() {
    Meta.EMPTY.with(Meta.LINE, null);
  }
}
