package plainscript.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import plainscript.common.exceptions.InvalidOptionException;
import plainscript.common.exceptions.PSCRuntimeError;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void reset() {
    System.clearProperty(Settings.OPT_NOOP_ASSIGN);
    System.clearProperty(Settings.CODEGEN_INDENT_WIDTH);
    Settings.reset(Settings.OPT_NOOP_ASSIGN);
    Settings.reset(Settings.CODEGEN_INDENT_WIDTH);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertFalse(Settings.getBoolean(Settings.OPTIMIZE));
    assertTrue(Settings.getBoolean(Settings.OPT_CONSTANT_FOLD));
    assertEquals(2, Settings.getLong(Settings.CODEGEN_INDENT_WIDTH));
  }

  @Test
  public void testSystemPropertyOverride() throws InvalidOptionException {
    System.setProperty(Settings.OPT_NOOP_ASSIGN, "false");
    Settings.initPSCProperties();
    assertFalse(Settings.getBoolean(Settings.OPT_NOOP_ASSIGN));
  }

  @Test
  public void testResetRestoresDefault() throws InvalidOptionException {
    Settings.set(Settings.OPT_NOOP_ASSIGN, "false");
    Settings.reset(Settings.OPT_NOOP_ASSIGN);
    assertTrue(Settings.getBoolean(Settings.OPT_NOOP_ASSIGN));
  }

  @Test
  public void testInvalidBoolean() throws InvalidOptionException {
    System.setProperty(Settings.OPT_NOOP_ASSIGN, "maybe");
    exception.expect(InvalidOptionException.class);
    Settings.initPSCProperties();
  }

  @Test
  public void testNegativeIndent() throws InvalidOptionException {
    System.setProperty(Settings.CODEGEN_INDENT_WIDTH, "-1");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("must not be negative");
    Settings.initPSCProperties();
  }

  @Test
  public void testUncheckedBadValue() {
    Settings.set(Settings.CODEGEN_INDENT_WIDTH, "wide");
    exception.expect(PSCRuntimeError.class);
    Settings.getLongUnchecked(Settings.CODEGEN_INDENT_WIDTH);
  }
}
