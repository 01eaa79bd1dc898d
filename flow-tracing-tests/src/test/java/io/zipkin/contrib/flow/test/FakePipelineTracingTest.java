/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow.test;

import brave.handler.MutableSpan;
import brave.test.TestSpanHandler;
import io.zipkin.contrib.flow.FlowTracing;
import java.util.Arrays;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/** Drives whole flows through {@link FakePipeline}, checking the traces they produce. */
class FakePipelineTracingTest {
  TestSpanHandler spans = new TestSpanHandler();
  FlowTracing flowTracing = FlowTracing.newBuilder().addSpanHandler(spans).build();
  FakePipeline pipeline = new FakePipeline(flowTracing.hooks());

  FakeNode httpIn, save, response;

  @BeforeEach void addFlow() {
    pipeline.tab("t1", "orders");
    httpIn = pipeline.node("in", "http in", "POST /orders", "t1");
    save = pipeline.node("save", "function", "save order", "t1");
    response = pipeline.node("out", "http response", "reply", "t1");
  }

  @AfterEach void close() {
    flowTracing.close();
  }

  int sweep() {
    return flowTracing.sweeper().sweep();
  }

  @Test void requestResponse() {
    httpIn.wireTo(save).wireTo(response);
    pipeline.start();

    pipeline.inject(httpIn, pipeline.newMessage("order"));

    assertThat(sweep()).isOne();
    assertThat(spans.spans())
      .extracting(MutableSpan::name)
      .containsExactly("POST /orders", "save order", "reply", "orders");
    assertThat(spans.spans())
      .extracting(MutableSpan::traceId)
      .containsOnly(spans.get(3).traceId());
    assertThat(spans.get(3).tags())
      .containsEntry("flow.id", "t1")
      .containsEntry("flow.message.id", "msg-1");
    assertThat(spans.spans())
      .extracting(MutableSpan::localServiceName)
      .containsOnly("orders");
  }

  @Test void eachMessageGetsItsOwnTrace() {
    httpIn.wireTo(save).wireTo(response);
    pipeline.start();

    pipeline.inject(httpIn, pipeline.newMessage("first"));
    pipeline.inject(httpIn, pipeline.newMessage("second"));

    assertThat(sweep()).isEqualTo(2);
    assertThat(spans.spans())
      .filteredOn(s -> s.parentId() == null)
      .extracting(s -> s.tag("flow.message.id"))
      .containsExactly("msg-1", "msg-2");
  }

  @Test void lastNodeNotTerminal_traceStaysOpen() {
    httpIn.wireTo(save);
    pipeline.start();

    pipeline.inject(httpIn, pipeline.newMessage("order"));

    assertThat(sweep()).isZero();
    assertThat(flowTracing.correlator().inFlight()).isOne();
    assertThat(spans.spans())
      .extracting(MutableSpan::name)
      .containsExactly("POST /orders");
  }

  @Test void debugNodesAreNotTraced() {
    httpIn.wireTo(save).wireTo(response);
    save.wireTo(pipeline.node("log", "debug", "log order", "t1"));
    pipeline.start();

    pipeline.inject(httpIn, pipeline.newMessage("order"));

    assertThat(sweep()).isOne();
    assertThat(spans.spans())
      .extracting(MutableSpan::name)
      .doesNotContain("log order");
  }

  @Test void fanOutOnWiresSharesTrace() {
    FakeNode audit = pipeline.node("audit", "http response", "audit", "t1");
    httpIn.wireTo(response);
    httpIn.wireTo(audit);
    pipeline.start();

    pipeline.inject(httpIn, pipeline.newMessage("order"));

    assertThat(sweep()).isOne();
    assertThat(spans.spans())
      .extracting(MutableSpan::name)
      .containsExactly("POST /orders", "reply", "audit", "orders");
  }

  @Test void splitPartsShareTrace() {
    FakeNode split = pipeline.node("split", "split", null, "t1");
    FakeNode worker = pipeline.node("worker", "function", "worker", "t1");
    httpIn.wireTo(split).wireTo(worker).wireTo(response);
    pipeline.start();

    pipeline.inject(httpIn, pipeline.newMessage(Arrays.asList("a", "b", "c")));

    assertThat(flowTracing.correlator().inFlight()).isOne();
    assertThat(sweep()).isOne();
    assertThat(flowTracing.correlator().inFlight()).isZero();

    assertThat(spans.spans())
      .filteredOn(s -> s.parentId() == null)
      .extracting(MutableSpan::name, s -> s.tag("flow.message.id"))
      .containsExactly(tuple("orders", "msg-1"));
    assertThat(spans.spans())
      .extracting(MutableSpan::name)
      .filteredOn("worker"::equals)
      .hasSize(3);
    assertThat(spans.spans())
      .extracting(MutableSpan::name)
      .filteredOn("split"::equals)
      .hasSize(1);
    assertThat(spans.spans())
      .hasSize(9)
      .extracting(MutableSpan::traceId)
      .containsOnly(spans.get(0).traceId());
  }

  @Test void nodeFailure() {
    IllegalStateException error = new IllegalStateException("database down");
    httpIn.wireTo(save).wireTo(response);
    save.failWith(error);
    pipeline.start();

    pipeline.inject(httpIn, pipeline.newMessage("order"));

    assertThat(flowTracing.correlator().inFlight()).isZero();
    assertThat(spans.spans())
      .extracting(MutableSpan::name)
      .containsExactly("POST /orders", "save order", "orders");
    assertThat(spans.get(1).error()).isSameAs(error);
    assertThat(spans.get(2).tag("error")).isEqualTo("database down");
    assertThat(sweep()).isZero();
  }

  /** The node's span under the message it consumed is never ended by a send. */
  @Test void replacedMessageStartsItsOwnTrace() {
    httpIn.wireTo(save).wireTo(response);
    save.behavior(FakeNode.Behavior.REPLACE);
    pipeline.start();

    pipeline.inject(httpIn, pipeline.newMessage("order"));

    assertThat(sweep()).isOne();
    assertThat(flowTracing.correlator().inFlight()).isOne();
    assertThat(spans.spans())
      .extracting(MutableSpan::name)
      .containsExactly("POST /orders", "save order", "reply", "orders");
    assertThat(spans.get(0).traceId()).isNotEqualTo(spans.get(3).traceId());
    assertThat(spans.get(3).tag("flow.message.id")).isEqualTo("msg-2");
  }

  @Test void subflowNodesReportAsSubflow() {
    pipeline.subflow("s1", "retry-def", "retry", "t1");
    FakeNode attempt = pipeline.node("attempt", "function", "attempt", "s1");
    FakeNode done = pipeline.node("done", "http response", "done", "s1");
    httpIn.wireTo(attempt).wireTo(done);
    pipeline.start();

    pipeline.inject(httpIn, pipeline.newMessage("order"));

    assertThat(sweep()).isOne();
    assertThat(spans.spans())
      .extracting(MutableSpan::name, MutableSpan::localServiceName)
      .containsExactly(
        tuple("POST /orders", "orders"),
        tuple("attempt", "retry"),
        tuple("done", "retry"),
        tuple("orders", "orders"));
  }

  @Test void unregisteredFlowIsIgnored() {
    FakeNode stray = pipeline.node("stray", "inject", "tick", "gone");
    stray.wireTo(save);
    pipeline.start();

    pipeline.inject(stray, pipeline.newMessage("tick"));

    assertThat(flowTracing.correlator().inFlight()).isOne(); // save still traced in t1
    assertThat(spans.spans()).isEmpty();
  }

  @Test void deliveryIntoUnregisteredFlowClosesTrace() {
    httpIn.wireTo(pipeline.node("remote", "function", "remote", "gone"));
    pipeline.start();

    pipeline.inject(httpIn, pipeline.newMessage("order"));

    assertThat(sweep()).isOne();
    assertThat(flowTracing.correlator().inFlight()).isZero();
    assertThat(spans.spans())
      .extracting(MutableSpan::name)
      .containsExactly("POST /orders", "orders");
  }

  @Test void stopReportsInFlightUnfinished() {
    httpIn.wireTo(save);
    pipeline.start();
    pipeline.send(httpIn, pipeline.newMessage("order"));

    pipeline.stop();

    assertThat(pipeline.pending()).isZero();
    assertThat(flowTracing.correlator().inFlight()).isZero();
    assertThat(spans.spans())
      .extracting(MutableSpan::name)
      .containsExactly("POST /orders", "orders");
    assertThat(spans.get(0).finishTimestamp()).isNotZero(); // ended when sent
    assertThat(spans.get(1).finishTimestamp()).isZero();
  }
}
