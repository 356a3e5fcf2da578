package com.onkiup.linker.merge.util;

import org.apache.log4j.Layout;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.spi.LoggingEvent;

import com.onkiup.linker.merge.Merger;

/**
 * Prints the token being merged (taken from MDC) next to the logger name and the message
 */
public class LoggerLayout extends Layout {

  private Layout parent;

  public LoggerLayout() {
    this(new PatternLayout());
  }

  public LoggerLayout(Layout parent) {
    this.parent = parent;
  }

  @Override
  public String format(LoggingEvent event) {
    Object token = event.getMDC(Merger.MDC_TOKEN);
    String tokenVal = String.format("'%s'", ralign(token == null ? "" : TextUtils.sanitize(token), 48));
    return String.format("%50.50s || %s :: %s\n", tokenVal, ralign(event.getLoggerName(), 50), event.getMessage());
  }

  @Override
  public boolean ignoresThrowable() {
    return parent.ignoresThrowable();
  }

  @Override
  public void activateOptions() {
    parent.activateOptions();
  }

  public Layout parent() {
    return parent;
  }

  public static String ralign(CharSequence what, int len) {
    if (what.length() >= len) {
      what = what.subSequence(what.length() - len, what.length());
      return what.toString();
    }
    String format = String.format("%%%1$d.%1$ds%%2$s", len - what.length());
    return String.format(format, "", what);
  }
}
