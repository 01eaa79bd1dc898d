/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.internal.Nullable;

/**
 * Thrown when a delivery event references a flow that was never registered. This is an ordering or
 * configuration problem: {@link TracingFlowHooks} logs it and drops the event.
 */
public final class UnknownFlowException extends RuntimeException {
  static final long serialVersionUID = 1L;

  final String flowId;

  UnknownFlowException(@Nullable String flowId) {
    super("Unknown flow: " + flowId);
    this.flowId = flowId;
  }

  /** The identifier that had no registered flow, possibly null. */
  @Nullable public String flowId() {
    return flowId;
  }
}
