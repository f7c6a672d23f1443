package exm.qtree.lang;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class SpecialFormsTest {

  @Test
  public void testFixedArity() {
    assertTrue(SpecialForms.isSpecialForm("case", 2));
    assertFalse(SpecialForms.isSpecialForm("case", 3));
    assertTrue(SpecialForms.isSpecialForm("alias", 1));
    assertTrue(SpecialForms.isSpecialForm("alias", 2));
    assertTrue(SpecialForms.isSpecialForm("__MODULE__", 0));
  }

  @Test
  public void testAnyArity() {
    assertTrue(SpecialForms.isSpecialForm("{}", 0));
    assertTrue(SpecialForms.isSpecialForm("fn", 5));
    assertTrue(SpecialForms.isSpecialForm("__block__", 3));
  }

  @Test
  public void testOrdinaryCalls() {
    assertFalse(SpecialForms.isSpecialForm("foo", 1));
    assertFalse(SpecialForms.isSpecialForm("+", 2));
  }
}
