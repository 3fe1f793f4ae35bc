package com.mineralink.harvester.util;

import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.MDC;

/**
 * Tags log lines with the layer they were written for, through the {@code layer} MDC key that the log pattern prints.
 * <p>
 * A layer's work is spread over the layer thread and the fetch threads it starts, so {@link #carry(Callable)} hands the
 * submitting thread's context over to whichever pool thread runs the task.
 */
public final class LayerLogContext {

  static final String LAYER_KEY = "layer";

  private LayerLogContext() {}

  /** Tags subsequent log lines from this thread with {@code layer}. */
  public static void enter(String layer) {
    MDC.put(LAYER_KEY, "[" + layer + "] ");
  }

  /** Stops tagging log lines from this thread. */
  public static void exit() {
    MDC.remove(LAYER_KEY);
  }

  /** Returns the layer this thread is working for, or {@code null} outside of one. */
  public static String current() {
    String tag = MDC.get(LAYER_KEY);
    return tag == null ? null : tag.substring(1, tag.length() - 2);
  }

  /**
   * Returns {@code task} wrapped to run with the log context of the calling thread and to leave the context of the
   * thread that runs it as it found it.
   */
  public static <T> Callable<T> carry(Callable<T> task) {
    Map<String, String> submitted = MDC.getCopyOfContextMap();
    return () -> {
      Map<String, String> previous = MDC.getCopyOfContextMap();
      restore(submitted);
      try {
        return task.call();
      } finally {
        restore(previous);
      }
    };
  }

  private static void restore(Map<String, String> context) {
    if (context == null) {
      MDC.clear();
    } else {
      MDC.setContextMap(context);
    }
  }
}
