package com.onkiup.linker.merge.util;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

import org.apache.log4j.Layout;
import org.apache.log4j.spi.LoggingEvent;
import org.junit.Test;

import com.google.common.base.Strings;
import com.onkiup.linker.merge.Merger;

public class LoggerLayoutTest {

  @Test
  public void testFormat() {
    LoggingEvent event = mock(LoggingEvent.class);
    when(event.getMDC(Merger.MDC_TOKEN)).thenReturn("hover:p-4");
    when(event.getLoggerName()).thenReturn("com.onkiup.linker.merge.Merger");
    when(event.getMessage()).thenReturn("Dropping shorthand");

    String line = new LoggerLayout().format(event);

    assertEquals("'" + Strings.repeat(" ", 39) + "hover:p-4' || " +
        Strings.repeat(" ", 20) + "com.onkiup.linker.merge.Merger :: Dropping shorthand\n", line);
  }

  @Test
  public void testFormatWithoutToken() {
    LoggingEvent event = mock(LoggingEvent.class);
    when(event.getLoggerName()).thenReturn("x");
    when(event.getMessage()).thenReturn("line\nbreak");

    String line = new LoggerLayout().format(event);

    assertTrue(line.startsWith("'" + Strings.repeat(" ", 48) + "' || "));
    assertTrue(line.endsWith(" :: line\nbreak\n"));
  }

  @Test
  public void testRalign() {
    assertEquals("  abc", LoggerLayout.ralign("abc", 5));
    assertEquals("def", LoggerLayout.ralign("abcdef", 3));
    assertEquals("abc", LoggerLayout.ralign("abc", 3));
  }

  @Test
  public void testDelegatesToParent() {
    Layout parent = mock(Layout.class);
    when(parent.ignoresThrowable()).thenReturn(true);
    LoggerLayout layout = new LoggerLayout(parent);

    assertTrue(layout.ignoresThrowable());
    layout.activateOptions();
    verify(parent).activateOptions();
    assertSame(parent, layout.parent());
  }
}
