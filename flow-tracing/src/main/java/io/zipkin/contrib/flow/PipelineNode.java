/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.internal.Nullable;

/**
 * Abstract node of a flow-based pipeline, such as a Node-RED node. Hosts adapt their own node type
 * by extending this class, keeping their own object available via {@link #unwrap()}.
 *
 * <p>Flows themselves are nodes, too: a tab or a subflow instance is a node whose {@link #id()}
 * other nodes reference with {@link #flowId()}.
 */
public abstract class PipelineNode {
  /** Unique identifier of this node in the deployed pipeline. */
  public abstract String id();

  /**
   * The node type, ex. "http in", "split" or "subflow:3f2a". Node type drives which nodes are
   * traced, which start traces and which fan out.
   */
  public abstract String type();

  /** Human readable name, or null if the user never set one. */
  @Nullable public abstract String name();

  /** Secondary display name, used by flow tabs. Defaults to null. */
  @Nullable public String label() {
    return null;
  }

  /** Identifier of the flow (tab or subflow instance) that contains this node. */
  @Nullable public abstract String flowId();

  /** Returns the host's node object. */
  public abstract Object unwrap();

  @Override public String toString() {
    return getClass().getSimpleName() + "{id=" + id() + ", type=" + type() + "}";
  }
}
