package org.redlist.maps.util.log4j;

import java.time.Duration;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.lookup.StrLookup;

/**
 * Log4j lookup for time since startup, so a log pattern can show how long a map has been rendering.
 * <p>
 * {@code $${uptime:clock}} gives {@code H:MM:SS} and {@code $${uptime:seconds}} gives whole seconds. Other keys are
 * left unresolved. The properties file must list {@code packages=org.redlist.maps.util.log4j}.
 */
@Plugin(name = "uptime", category = StrLookup.CATEGORY)
public class UptimeLookup implements StrLookup {

  static final String CLOCK = "clock";
  static final String SECONDS = "seconds";

  // approximates process start: first use of this class by log4j
  private static final long START_NANOS = System.nanoTime();

  static String clock(Duration elapsed) {
    return String.format("%d:%02d:%02d", elapsed.toHours(), elapsed.toMinutesPart(), elapsed.toSecondsPart());
  }

  @Override
  public String lookup(String key) {
    Duration elapsed = Duration.ofNanos(System.nanoTime() - START_NANOS);
    if (CLOCK.equals(key)) {
      return clock(elapsed);
    } else if (SECONDS.equals(key)) {
      return Long.toString(elapsed.toSeconds());
    }
    return null;
  }

  @Override
  public String lookup(LogEvent event, String key) {
    return lookup(key);
  }
}
