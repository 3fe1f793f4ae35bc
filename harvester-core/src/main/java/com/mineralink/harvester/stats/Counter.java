package com.mineralink.harvester.stats;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A {@code long} count that layer and fetch threads bump concurrently.
 * <p>
 * Each thread increments a cell of its own and {@link #get()} adds the cells up, so increments never contend.
 */
@ThreadSafe
public final class Counter {

  private final List<AtomicLong> cells = new CopyOnWriteArrayList<>();
  private final ThreadLocal<AtomicLong> cell = ThreadLocal.withInitial(() -> {
    AtomicLong result = new AtomicLong();
    cells.add(result);
    return result;
  });

  public void inc() {
    incBy(1);
  }

  public void incBy(long value) {
    cell.get().addAndGet(value);
  }

  public long get() {
    return cells.stream().mapToLong(AtomicLong::get).sum();
  }
}
