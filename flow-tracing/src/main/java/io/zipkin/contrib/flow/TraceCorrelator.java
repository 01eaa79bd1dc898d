/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.Span;
import brave.Tracer;
import brave.internal.Nullable;
import java.util.List;

import static io.zipkin.contrib.flow.FlowTags.ERROR;
import static io.zipkin.contrib.flow.FlowTags.FLOW_ID;
import static io.zipkin.contrib.flow.FlowTags.FLOW_MESSAGE_ID;
import static io.zipkin.contrib.flow.FlowTags.FLOW_NODE_ID;
import static io.zipkin.contrib.flow.FlowTags.FLOW_NODE_TYPE;

/**
 * Correlates message delivery events into traces: one root span per message journey, and one child
 * span per node visit. Roots are closed by the {@link QuiescenceSweeper} once no node span is
 * active, or immediately by {@link #markError} when a node fails.
 *
 * <p>All methods run synchronously on the caller's thread and only perform in-memory updates while
 * holding the {@link TraceTable} lock.
 */
public final class TraceCorrelator {
  final FlowTracing flowTracing;
  final FlowRegistry registry;
  final TraceTable table;
  final FlowTags tags;

  TraceCorrelator(FlowTracing flowTracing) {
    this.flowTracing = flowTracing;
    this.registry = flowTracing.registry;
    this.table = flowTracing.table;
    this.tags = flowTracing.tags;
  }

  /**
   * Opens a span for the node's visit, creating the message's trace first if this is the first
   * time the message is seen.
   *
   * <p>When {@code sourceNode} is a split node and the message carries the parent message
   * identifier stamped by that split, the message joins the parent's trace instead of starting a
   * new one. Calling this again for a message that has a trace never starts another root.
   *
   * @param sourceNode the node that sent the message, or null when there is no internal origin
   * @throws UnknownFlowException if the node's flow is not registered. No state is changed.
   */
  public void ensureTrace(PipelineNode node, PipelineMessage message,
    @Nullable PipelineNode sourceNode) {
    if (flowTracing.isUntraced(node)) return;
    Flow flow = registry.lookup(node.flowId());

    // Downstream messages of the split find the shared trace via this identifier
    if (flowTracing.isSplit(node)) message.parentMessageId(message.messageId());

    synchronized (table) {
      MessageTrace trace = resolveTrace(flow, message, sourceNode);
      if (trace.inTransit > 0) trace.inTransit--;
      openNodeSpan(flow, trace, node);
    }
  }

  /**
   * Ends the span of the node that just handed the message to a destination. A message first seen
   * here, such as one created mid-pipeline, gets its trace with the source node as the implicit
   * origin.
   *
   * @throws UnknownFlowException if a trace must be created and the source's flow is not
   * registered. No state is changed.
   */
  public void closeSourceSpan(PipelineNode sourceNode, PipelineMessage message) {
    closeSourceSpan(sourceNode, null, message);
  }

  /**
   * Like {@link #closeSourceSpan(PipelineNode, PipelineMessage)}, also counting the delivery to a
   * traced destination of a registered flow as in transit until the destination receives it. This
   * keeps the trace from looking quiescent between the source's span ending and the destination's
   * span starting.
   *
   * @param destination the node the message was handed to, or null if unknown
   */
  public void closeSourceSpan(PipelineNode sourceNode, @Nullable PipelineNode destination,
    PipelineMessage message) {
    if (flowTracing.isUntraced(sourceNode)) return;
    String nodeId = sourceNode.id();
    synchronized (table) {
      MessageTrace trace = table.get(message.messageId());
      NodeSpan visit;
      if (trace == null) {
        Flow flow = registry.lookup(sourceNode.flowId());
        trace = resolveTrace(flow, message, sourceNode);
        visit = trace.firstActive(nodeId);
        // a brand-new trace has no span yet: the source is the implicit origin
        if (visit == null && trace.visitCount == 0) {
          visit = openNodeSpan(flow, trace, sourceNode);
        }
      } else {
        visit = trace.firstActive(nodeId);
      }
      if (willReceive(destination)) trace.inTransit++;
      // null when a send to several destinations already closed it
      if (visit != null) end(trace, visit);
    }
  }

  /**
   * Fails the node's span and the whole trace. The root is finished now, without waiting for
   * other node spans. Those are flushed unfinished and the trace leaves the table.
   */
  public void markError(PipelineNode node, PipelineMessage message, @Nullable Object error) {
    String messageId = message.messageId();
    synchronized (table) {
      MessageTrace trace = table.get(messageId);
      if (trace == null) {
        FlowTracing.log(null, "No trace for message {0} failing at node {1}", messageId,
          node.id());
        return;
      }
      NodeSpan visit = trace.firstActive(node.id());
      if (visit != null && trace.deactivate(visit)) {
        tags.error(visit.span, error);
        visit.span.finish();
      }
      if (!table.remove(trace)) return;
      flushActive(trace);
      tags.tag(trace.root, ERROR, FlowTags.errorMessage(error));
      trace.root.finish();
    }
  }

  /**
   * Ends the node's span when the host knows the node finished with the message, for example a
   * node that sends the response of an HTTP flow. Returns false when there was no active span.
   */
  public boolean completeNode(PipelineNode node, PipelineMessage message) {
    synchronized (table) {
      MessageTrace trace = table.get(message.messageId());
      if (trace == null) return false;
      NodeSpan visit = trace.firstActive(node.id());
      return visit != null && end(trace, visit);
    }
  }

  /**
   * Forgets all in-flight traces, reporting their spans unfinished. Used when the pipeline stops.
   *
   * @return count of traces that were in flight
   */
  public int clear() {
    synchronized (table) {
      List<MessageTrace> traces = table.clear();
      for (MessageTrace trace : traces) {
        flushActive(trace);
        trace.root.flush();
      }
      return traces.size();
    }
  }

  /** Count of in-flight traces. Messages derived by a split count with their parent. */
  public int inFlight() {
    return table.size();
  }

  /** True when the destination's receive will open a span, so the delivery is awaited. */
  boolean willReceive(@Nullable PipelineNode destination) {
    return destination != null
      && !flowTracing.isUntraced(destination)
      && registry.contains(destination.flowId());
  }

  MessageTrace resolveTrace(Flow flow, PipelineMessage message, @Nullable PipelineNode sourceNode) {
    String messageId = message.messageId();
    MessageTrace trace = table.get(messageId);
    if (trace != null) return trace;

    MessageTrace parent = splitParent(message, sourceNode);
    if (parent != null) {
      table.alias(messageId, parent);
      return parent;
    }

    Span root = flow.tracer().newTrace().name(flow.name);
    tags.tag(root, FLOW_ID, flow.id);
    tags.tag(root, FLOW_MESSAGE_ID, messageId);
    root.start();
    trace = new MessageTrace(messageId, root, flowTracing.clock.currentTimeMicroseconds());
    table.put(trace);
    return trace;
  }

  @Nullable MessageTrace splitParent(PipelineMessage message, @Nullable PipelineNode sourceNode) {
    if (sourceNode == null || !flowTracing.isSplit(sourceNode)) return null;
    String parentId = message.parentMessageId();
    if (parentId == null || parentId.equals(message.messageId())) return null;
    MessageTrace parent = table.get(parentId);
    if (parent == null) {
      FlowTracing.log(null, "Trace of split message {0} closed before {1}; starting a new trace",
        parentId, message.messageId());
    }
    return parent;
  }

  NodeSpan openNodeSpan(Flow flow, MessageTrace trace, PipelineNode node) {
    Tracer tracer = flow.tracer();
    Span span = tracer.newChild(trace.context()).name(spanName(node));
    tags.tag(span, FLOW_NODE_ID, node.id());
    tags.tag(span, FLOW_NODE_TYPE, node.type());
    span.start();
    return trace.open(node.id(), span);
  }

  static boolean end(MessageTrace trace, NodeSpan visit) {
    if (!trace.deactivate(visit)) return false;
    visit.span.finish();
    return true;
  }

  static void flushActive(MessageTrace trace) {
    for (NodeSpan active : trace.activeSpans()) {
      trace.deactivate(active);
      active.span.flush();
    }
  }

  static String spanName(PipelineNode node) {
    String name = node.name();
    return name != null && !name.isEmpty() ? name : node.type();
  }

  @Override public String toString() {
    return "TraceCorrelator{" + table + "}";
  }
}
