/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.internal.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-wide mapping of message identifiers to their in-flight {@link MessageTrace}.
 *
 * <p>This is the single lock of flow tracing: {@link TraceCorrelator} and {@link
 * QuiescenceSweeper} read or mutate trace state only while holding this object's monitor. Methods
 * here are synchronized as well, so compound operations simply nest.
 *
 * <p>Messages derived by a split are aliases: they resolve to the trace of the message that was
 * split, by indirection through the identifier that started it. Mutating a trace through any alias
 * is visible through all of them.
 */
final class TraceTable {
  final Map<String, MessageTrace> traces = new LinkedHashMap<>(); // guarded by this
  final Map<String, String> aliases = new LinkedHashMap<>(); // guarded by this

  @Nullable synchronized MessageTrace get(String messageId) {
    MessageTrace trace = traces.get(messageId);
    if (trace != null) return trace;
    String canonical = aliases.get(messageId);
    return canonical != null ? traces.get(canonical) : null;
  }

  synchronized boolean contains(String messageId) {
    return get(messageId) != null;
  }

  synchronized void put(MessageTrace trace) {
    if (contains(trace.messageId)) {
      throw new IllegalStateException("Bug: " + trace.messageId + " already has a trace");
    }
    traces.put(trace.messageId, trace);
  }

  /** Makes the message identifier resolve to an existing trace. */
  synchronized void alias(String messageId, MessageTrace trace) {
    if (contains(messageId)) {
      throw new IllegalStateException("Bug: " + messageId + " already has a trace");
    }
    if (traces.get(trace.messageId) != trace) {
      throw new IllegalStateException("Bug: " + trace + " is not in the table");
    }
    aliases.put(messageId, trace.messageId);
    trace.aliases.add(messageId);
  }

  /** Removes the trace and all of its aliases. Returns false if it was already removed. */
  synchronized boolean remove(MessageTrace trace) {
    if (traces.get(trace.messageId) != trace) return false;
    traces.remove(trace.messageId);
    for (String alias : trace.aliases) aliases.remove(alias);
    return true;
  }

  /** Each trace once, no matter how many identifiers resolve to it. */
  synchronized List<MessageTrace> snapshot() {
    return new ArrayList<>(traces.values());
  }

  /** Empties the table, returning the traces it held. */
  synchronized List<MessageTrace> clear() {
    List<MessageTrace> result = snapshot();
    traces.clear();
    aliases.clear();
    return result;
  }

  /** Count of distinct traces. */
  synchronized int size() {
    return traces.size();
  }

  synchronized boolean isEmpty() {
    return traces.isEmpty();
  }

  @Override public synchronized String toString() {
    return "TraceTable{traces=" + traces.keySet() + ", aliases=" + aliases + "}";
  }
}
