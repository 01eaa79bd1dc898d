/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.Tracing;
import brave.internal.Nullable;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Maps flow identifiers to {@link Flow flows}, each with its own {@link Tracing}. Populated when
 * the pipeline reports it started, and read by the correlator for every delivery event.
 */
public final class FlowRegistry implements Closeable {
  final Function<String, Tracing> tracingFactory;
  final ConcurrentMap<String, Flow> flows = new ConcurrentHashMap<>();

  FlowRegistry(Function<String, Tracing> tracingFactory) {
    if (tracingFactory == null) throw new NullPointerException("tracingFactory == null");
    this.tracingFactory = tracingFactory;
  }

  /**
   * Registers a flow node (tab or subflow instance), naming the flow after the node's name, else
   * its label, else its id.
   */
  public Flow register(PipelineNode flowNode) {
    if (flowNode == null) throw new NullPointerException("flowNode == null");
    return register(flowNode.id(), flowName(flowNode));
  }

  /**
   * Idempotently registers a flow. Registering the same id and name again returns the existing
   * flow. When a redeploy renamed the flow, the entry is replaced and the previous tracing closed.
   */
  public synchronized Flow register(String id, String name) {
    if (id == null) throw new NullPointerException("id == null");
    if (name == null || name.isEmpty()) throw new IllegalArgumentException("name is empty");
    Flow existing = flows.get(id);
    if (existing != null && existing.name.equals(name)) return existing;

    Tracing tracing = tracingFactory.apply(name);
    if (tracing == null) throw new NullPointerException("tracingFactory returned null for " + name);
    Flow flow = new Flow(id, name, tracing);
    flows.put(id, flow);
    if (existing != null) existing.tracing.close();
    return flow;
  }

  /**
   * Returns the flow registered under the identifier.
   *
   * @throws UnknownFlowException if the flow was never registered
   */
  public Flow lookup(@Nullable String flowId) {
    Flow flow = flowId != null ? flows.get(flowId) : null;
    if (flow == null) throw new UnknownFlowException(flowId);
    return flow;
  }

  /** Returns true if a flow is registered under the identifier. */
  public boolean contains(@Nullable String flowId) {
    return flowId != null && flows.containsKey(flowId);
  }

  public int size() {
    return flows.size();
  }

  /** Closes the tracing of every flow and forgets them. */
  @Override public synchronized void close() {
    List<Flow> toClose = new ArrayList<>(flows.values());
    flows.clear();
    for (Flow flow : toClose) flow.tracing.close();
  }

  static String flowName(PipelineNode flowNode) {
    String name = flowNode.name();
    if (name != null && !name.isEmpty()) return name;
    String label = flowNode.label();
    if (label != null && !label.isEmpty()) return label;
    return flowNode.id();
  }

  @Override public String toString() {
    return "FlowRegistry{flows=" + flows.values() + "}";
  }
}
