package exm.qtree.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import exm.qtree.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @After
  public void reset() {
    Settings.reset(Settings.EXPAND_MAX_ITERATIONS);
    Settings.reset(Settings.LOG_TRACE);
    Settings.reset(Settings.UNPARSE_INDENT);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertEquals(10000, Settings.getLong(Settings.EXPAND_MAX_ITERATIONS));
    assertEquals(2, Settings.getInt(Settings.UNPARSE_INDENT));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals("Macro", Settings.get(Settings.DBG_HELPER_MODULE));
    assertTrue(Settings.getKeys().contains(Settings.LOG_FILE));
  }

  @Test
  public void testOverride() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, " TRUE ");
    assertTrue(Settings.getBoolean(Settings.LOG_TRACE));
    Settings.set(Settings.EXPAND_MAX_ITERATIONS, "7");
    assertEquals(7, Settings.getLong(Settings.EXPAND_MAX_ITERATIONS));
    Settings.reset(Settings.EXPAND_MAX_ITERATIONS);
    assertEquals(10000, Settings.getLong(Settings.EXPAND_MAX_ITERATIONS));
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadLong() throws InvalidOptionException {
    Settings.set(Settings.EXPAND_MAX_ITERATIONS, "many");
    Settings.getLong(Settings.EXPAND_MAX_ITERATIONS);
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "yes");
    Settings.getBoolean(Settings.LOG_TRACE);
  }

  @Test(expected=InvalidOptionException.class)
  public void testIntRange() throws InvalidOptionException {
    Settings.set(Settings.UNPARSE_INDENT, "99999999999");
    Settings.getInt(Settings.UNPARSE_INDENT);
  }

  @Test(expected=InvalidOptionException.class)
  public void testValidation() throws InvalidOptionException {
    Settings.set(Settings.EXPAND_MAX_ITERATIONS, "0");
    Settings.initQTreeProperties();
  }
}
