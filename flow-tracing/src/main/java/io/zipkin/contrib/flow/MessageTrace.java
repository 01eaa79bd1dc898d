/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.Span;
import brave.internal.Nullable;
import brave.propagation.TraceContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-flight trace state of one message and, after a split, of every message derived from it. All
 * fields are guarded by the owning {@link TraceTable}.
 */
final class MessageTrace {
  final String messageId;
  final Span root;
  final long startTimestamp;
  final Set<String> aliases = new LinkedHashSet<>();
  final Map<String, List<NodeSpan>> nodeSpans = new LinkedHashMap<>();
  int activeCount, visitCount;
  /** Deliveries handed to a traced destination that did not receive them yet. */
  int inTransit;

  MessageTrace(String messageId, Span root, long startTimestamp) {
    this.messageId = messageId;
    this.root = root;
    this.startTimestamp = startTimestamp;
  }

  /** The identifier of the message that started this trace. */
  String messageId() {
    return messageId;
  }

  /** Parent of every node span in this trace. */
  TraceContext context() {
    return root.context();
  }

  NodeSpan open(String nodeId, Span span) {
    NodeSpan result = new NodeSpan(nodeId, visitCount++, span);
    nodeSpans.computeIfAbsent(nodeId, k -> new ArrayList<>(1)).add(result);
    activeCount++;
    return result;
  }

  /** Returns the earliest visit to the node that is still active. */
  @Nullable NodeSpan firstActive(String nodeId) {
    List<NodeSpan> visits = nodeSpans.get(nodeId);
    if (visits == null) return null;
    for (NodeSpan visit : visits) {
      if (visit.active) return visit;
    }
    return null;
  }

  /** Returns true if this call made the visit inactive. */
  boolean deactivate(NodeSpan visit) {
    if (!visit.deactivate()) return false;
    activeCount--;
    return true;
  }

  List<NodeSpan> activeSpans() {
    List<NodeSpan> result = new ArrayList<>(activeCount);
    for (List<NodeSpan> visits : nodeSpans.values()) {
      for (NodeSpan visit : visits) {
        if (visit.active) result.add(visit);
      }
    }
    return result;
  }

  List<NodeSpan> visits(String nodeId) {
    List<NodeSpan> visits = nodeSpans.get(nodeId);
    return visits != null ? visits : Collections.<NodeSpan>emptyList();
  }

  /** True when no node span of this trace is active and no delivery is on its way. */
  boolean isQuiescent() {
    return activeCount == 0 && inTransit == 0;
  }

  @Override public String toString() {
    return "MessageTrace{messageId=" + messageId + ", aliases=" + aliases
      + ", activeCount=" + activeCount + ", visitCount=" + visitCount
      + ", inTransit=" + inTransit + "}";
  }
}
