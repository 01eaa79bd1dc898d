/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.Span;

/**
 * One visit of a message to a node. A node visited twice by the same message, for example inside a
 * loop, has two instances distinguished by {@link #visit()}.
 */
final class NodeSpan {
  final String nodeId;
  final int visit;
  final Span span;
  boolean active = true; // guarded by TraceTable

  NodeSpan(String nodeId, int visit, Span span) {
    this.nodeId = nodeId;
    this.visit = visit;
    this.span = span;
  }

  String nodeId() {
    return nodeId;
  }

  /** Sequence number of this visit within its trace, starting at zero. */
  int visit() {
    return visit;
  }

  boolean isActive() {
    return active;
  }

  /** Returns true only for the call that made this visit inactive. */
  boolean deactivate() {
    if (!active) return false;
    active = false;
    return true;
  }

  @Override public String toString() {
    return "NodeSpan{nodeId=" + nodeId + ", visit=" + visit + ", active=" + active + "}";
  }
}
