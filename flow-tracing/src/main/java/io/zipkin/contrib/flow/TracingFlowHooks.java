/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.internal.Nullable;

import static brave.internal.Throwables.propagateIfFatal;

/**
 * Entry points for the pipeline host's events, in the order the host fires them for one delivery:
 * {@link #onPreRoute}, {@link #onPostDeliver}, {@link #onReceive} then {@link #onComplete}.
 *
 * <p>Tracing must never break message delivery: every hook logs and drops what fails, including
 * events that reference an unregistered flow.
 */
public final class TracingFlowHooks {
  final FlowTracing flowTracing;
  final FlowRegistry registry;
  final TraceCorrelator correlator;
  final QuiescenceSweeper sweeper;

  TracingFlowHooks(FlowTracing flowTracing) {
    this.flowTracing = flowTracing;
    this.registry = flowTracing.registry;
    this.correlator = flowTracing.correlator;
    this.sweeper = flowTracing.sweeper;
  }

  /**
   * Registers each flow node (tab or subflow instance) among the deployed nodes and starts the
   * sweeper if not already running. Hosts fire this again on each redeploy.
   *
   * @return count of flows registered
   */
  public int onFlowsStarted(Iterable<? extends PipelineNode> nodes) {
    if (nodes == null) throw new NullPointerException("nodes == null");
    int registered = 0;
    for (PipelineNode node : nodes) {
      if (!flowTracing.isFlow(node)) continue;
      try {
        registry.register(node);
        registered++;
      } catch (Throwable t) {
        propagateIfFatal(t);
        FlowTracing.log(t, "error registering flow {0}", node, null);
      }
    }
    sweeper.start();
    return registered;
  }

  /** Reports in-flight spans unfinished and forgets them, as no more events will arrive. */
  public void onFlowsStopped() {
    try {
      correlator.clear();
    } catch (Throwable t) {
      propagateIfFatal(t);
      FlowTracing.log(t, "error clearing traces on stop", null, null);
    }
  }

  /**
   * Fired before a message is routed out of a node. Only ingress nodes, whose messages don't come
   * from another node, start traces here.
   */
  public void onPreRoute(PipelineNode source, PipelineMessage message) {
    if (!flowTracing.isIngress(source)) return;
    try {
      correlator.ensureTrace(source, message, null);
    } catch (Throwable t) {
      dropped(t, "preRoute", source, message);
    }
  }

  /**
   * Fired after the message was handed from the source to the destination: the source's work on
   * the message is done.
   */
  public void onPostDeliver(PipelineNode source, PipelineNode destination,
    PipelineMessage message) {
    try {
      correlator.closeSourceSpan(source, destination, message);
    } catch (Throwable t) {
      dropped(t, "postDeliver", source, message);
    }
  }

  /** Fired when a node receives a message: opens the node's span. */
  public void onReceive(PipelineNode destination, PipelineMessage message) {
    try {
      correlator.ensureTrace(destination, message, null);
    } catch (Throwable t) {
      dropped(t, "onReceive", destination, message);
    }
  }

  /**
   * Fired when a node finished with a message. An error fails the trace. Terminal nodes, which
   * never send the message on, end their span here.
   */
  public void onComplete(PipelineNode node, PipelineMessage message, @Nullable Object error) {
    try {
      if (error != null) {
        correlator.markError(node, message, error);
      } else if (flowTracing.isTerminal(node)) {
        correlator.completeNode(node, message);
      }
    } catch (Throwable t) {
      dropped(t, "onComplete", node, message);
    }
  }

  static void dropped(Throwable t, String event, PipelineNode node, PipelineMessage message) {
    propagateIfFatal(t);
    if (t instanceof UnknownFlowException) {
      FlowTracing.log(null, "dropping " + event + " of {0}: unknown flow {1}", node,
        String.valueOf(((UnknownFlowException) t).flowId()));
      return;
    }
    FlowTracing.log(t, "error tracing " + event + " of {0} at {1}", message, node);
  }

  @Override public String toString() {
    return "TracingFlowHooks{" + flowTracing + "}";
  }
}
