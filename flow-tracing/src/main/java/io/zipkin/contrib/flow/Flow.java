/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.Tracer;
import brave.Tracing;

/**
 * A named sub-graph of the pipeline, such as a tab or a subflow instance, with a dedicated {@link
 * Tracing} whose local service name is the flow name. Spans of nodes in this flow are recorded with
 * {@link #tracer()}.
 */
public final class Flow {
  final String id, name;
  final Tracing tracing;

  Flow(String id, String name, Tracing tracing) {
    this.id = id;
    this.name = name;
    this.tracing = tracing;
  }

  public String id() {
    return id;
  }

  /** Used as the root span name of traces that start in this flow. */
  public String name() {
    return name;
  }

  public Tracing tracing() {
    return tracing;
  }

  public Tracer tracer() {
    return tracing.tracer();
  }

  @Override public String toString() {
    return "Flow{id=" + id + ", name=" + name + "}";
  }
}
