package exm.quint.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.quint.ast.Construct;
import exm.quint.ast.SourceSpan;
import exm.quint.common.Logging;

public class LogHelper {
  static final Logger logger = Logging.getQuintLogger();

  /**
   * Log a reduction
   * @param c
   */
  public static void traceExit(Construct c) {
    if (logger.isTraceEnabled()) {
      log(0, Level.TRACE, c.span() + ": ",
          c.getClass().getSimpleName() + " " + c.text());
    }
  }

  public static void debug(SourceSpan span, String msg) {
    log(0, Level.DEBUG, span + ": ", msg);
  }

  /**
    WARN-level with source location
   */
  public static void warn(SourceSpan span, String msg) {
    log(0, Level.WARN, span + ": ", msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, "", msg);
  }

  public static void log(int indent, Level level, String location,
                         String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}
