/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.internal.Nullable;

/**
 * Abstract message travelling through a pipeline. Only the envelope fields used for correlation are
 * exposed: the message identifier and the parent message identifier a split node stamps on a
 * message before it fans out.
 */
public abstract class PipelineMessage {
  /** Identifier unique to this message instance, ex. Node-RED's {@code msg._msgid}. */
  public abstract String messageId();

  /**
   * Identifier of the message a split node derived this one from, or null if this message was not
   * produced by a split.
   */
  @Nullable public abstract String parentMessageId();

  /**
   * Stamps the parent message identifier on the envelope. The host must carry the field over to
   * every message the split node derives from this one.
   */
  public abstract void parentMessageId(String parentMessageId);

  /** Returns the host's message object. */
  public abstract Object unwrap();

  @Override public String toString() {
    return getClass().getSimpleName() + "{messageId=" + messageId() + "}";
  }
}
