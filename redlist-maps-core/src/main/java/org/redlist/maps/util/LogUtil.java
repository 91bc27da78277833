package org.redlist.maps.util;

import org.slf4j.MDC;

/**
 * Tracks the pipeline stage of the current thread in the SLF4J {@link MDC} so log lines read
 * {@code [resolve:boundaries] ...}.
 */
public class LogUtil {

  static final String STAGE_KEY = "stage";

  private LogUtil() {}

  /** Prefixes subsequent log lines from this thread with {@code [stage]}. */
  public static void setStage(String stage) {
    MDC.put(STAGE_KEY, "[" + stage + "] ");
  }

  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the stage of this thread without its brackets, or {@code null} outside of any stage. */
  public static String getStage() {
    String prefix = MDC.get(STAGE_KEY);
    return prefix == null ? null : prefix.substring(1, prefix.length() - 2);
  }

  /**
   * Appends {@code :child} to the stage of this thread until the returned handle is closed, or uses {@code child} on
   * its own when there is no stage.
   */
  public static SubStage enterSubStage(String child) {
    String parent = getStage();
    setStage(parent == null ? child : parent + ":" + child);
    return new SubStage(parent);
  }

  /** Restores the enclosing stage when closed. */
  public record SubStage(String parent) implements AutoCloseable {

    @Override
    public void close() {
      if (parent == null) {
        clearStage();
      } else {
        setStage(parent);
      }
    }
  }
}
