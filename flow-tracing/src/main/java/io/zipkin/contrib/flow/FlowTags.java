/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.Span;
import brave.internal.Nullable;

/**
 * Tag keys added to flow spans. Values longer than the configured length are truncated with a
 * {@link #TRUNCATED_SUFFIX}. Node errors are recorded with {@link Span#error(Throwable)} when they
 * are throwables and as the {@link #ERROR} tag otherwise.
 */
final class FlowTags {
  /** Added to the root span: identifier of the flow the trace started in. */
  static final String FLOW_ID = "flow.id";
  /** Added to the root span: identifier of the message that started the trace. */
  static final String FLOW_MESSAGE_ID = "flow.message.id";
  /** Added to each node span. */
  static final String FLOW_NODE_ID = "flow.node.id";
  /** Added to each node span. */
  static final String FLOW_NODE_TYPE = "flow.node.type";
  /** Same key Brave uses for {@link Span#error(Throwable)}. */
  static final String ERROR = "error";

  static final String TRUNCATED_SUFFIX = "...";

  final int maxValueLength;

  FlowTags(int maxValueLength) {
    this.maxValueLength = maxValueLength;
  }

  /** Adds the tag unless the value is null, truncating values over the configured length. */
  void tag(Span span, String key, @Nullable String value) {
    if (value == null) return;
    span.tag(key, truncate(value));
  }

  String truncate(String value) {
    if (value.length() <= maxValueLength) return value;
    if (maxValueLength <= TRUNCATED_SUFFIX.length()) return value.substring(0, maxValueLength);
    return value.substring(0, maxValueLength - TRUNCATED_SUFFIX.length()) + TRUNCATED_SUFFIX;
  }

  /**
   * Records an error on the span. Throwables go through {@link Span#error(Throwable)} so span
   * handlers see them, anything else becomes the {@link #ERROR} tag.
   */
  void error(Span span, @Nullable Object error) {
    if (error instanceof Throwable) {
      span.error((Throwable) error);
      return;
    }
    tag(span, ERROR, errorMessage(error));
  }

  /** The string form of an error, used on the root span when a node failed. */
  static String errorMessage(@Nullable Object error) {
    if (error instanceof Throwable) {
      Throwable t = (Throwable) error;
      String message = t.getMessage();
      return message != null ? message : t.getClass().getSimpleName();
    }
    String message = error != null ? error.toString() : null;
    return message == null || message.isEmpty() ? "unknown" : message;
  }
}
