/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.Clock;
import brave.internal.Nullable;
import java.io.Closeable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static brave.internal.Throwables.propagateIfFatal;
import static io.zipkin.contrib.flow.FlowTags.ERROR;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Periodically closes traces whose node spans have all ended. This is what finishes the root span
 * of a successful trace, up to one interval after its last node span ended.
 *
 * <p>When a maximum trace age is configured, traces older than that are expired instead of waiting
 * forever for a node span that will never end.
 */
public final class QuiescenceSweeper implements Runnable, Closeable {
  static final String THREAD_NAME = "flow-tracing-sweeper";
  static final String EXPIRED = "trace expired";

  final TraceTable table;
  final Clock clock;
  final long intervalMillis, maxTraceAgeMicros;

  @Nullable ScheduledExecutorService scheduler; // guarded by this
  boolean closed; // guarded by this

  QuiescenceSweeper(FlowTracing flowTracing) {
    this.table = flowTracing.table;
    this.clock = flowTracing.clock;
    this.intervalMillis = flowTracing.sweepIntervalMillis;
    this.maxTraceAgeMicros = flowTracing.maxTraceAgeMicros;
  }

  /**
   * Schedules sweeping on a daemon thread. Returns false if already started or closed, so it is
   * safe to call each time the pipeline reports it started.
   */
  public synchronized boolean start() {
    if (closed || scheduler != null) return false;
    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread thread = new Thread(r, THREAD_NAME);
      thread.setDaemon(true);
      return thread;
    });
    scheduler.scheduleWithFixedDelay(this, intervalMillis, intervalMillis, MILLISECONDS);
    return true;
  }

  public synchronized boolean isRunning() {
    return scheduler != null && !closed;
  }

  /** Runs one sweep, logging instead of throwing so later runs stay scheduled. */
  @Override public void run() {
    try {
      sweep();
    } catch (Throwable t) {
      propagateIfFatal(t);
      FlowTracing.log(t, "error sweeping {0}", table, null);
    }
  }

  /**
   * Closes every quiescent trace and expires traces over the maximum age.
   *
   * @return count of traces closed or expired
   */
  public int sweep() {
    int closed = 0;
    synchronized (table) {
      long now = maxTraceAgeMicros > 0 ? clock.currentTimeMicroseconds() : 0L;
      for (MessageTrace trace : table.snapshot()) {
        if (trace.isQuiescent()) {
          if (!table.remove(trace)) continue;
          trace.root.finish();
          closed++;
        } else if (maxTraceAgeMicros > 0 && now - trace.startTimestamp >= maxTraceAgeMicros) {
          if (!table.remove(trace)) continue;
          expire(trace);
          closed++;
        }
      }
    }
    return closed;
  }

  static void expire(MessageTrace trace) {
    FlowTracing.log(null, "Expiring trace of message {0} with {1} active node spans",
      trace.messageId, trace.activeCount);
    for (NodeSpan active : trace.activeSpans()) {
      trace.deactivate(active);
      active.span.tag(ERROR, EXPIRED);
      active.span.finish();
    }
    trace.root.tag(ERROR, EXPIRED);
    trace.root.finish();
  }

  /** Stops sweeping. In-flight traces are left in the table. */
  @Override public synchronized void close() {
    if (closed) return;
    closed = true;
    if (scheduler != null) scheduler.shutdown();
  }

  @Override public String toString() {
    return "QuiescenceSweeper{intervalMillis=" + intervalMillis
      + ", maxTraceAgeMicros=" + maxTraceAgeMicros + "}";
  }
}
