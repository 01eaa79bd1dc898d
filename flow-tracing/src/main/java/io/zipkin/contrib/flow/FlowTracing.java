/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.contrib.flow;

import brave.Clock;
import brave.Tracing;
import brave.handler.SpanHandler;
import brave.internal.Nullable;
import brave.internal.Platform;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Traces messages through a flow-based pipeline, such as Node-RED. Each message journey through a
 * flow becomes a root span named after the flow, and each node the message visits a child span.
 *
 * <p>Wire the pipeline's delivery events to {@link #hooks()}:
 * <pre>{@code
 * flowTracing = FlowTracing.newBuilder()
 *   .addSpanHandler(AsyncZipkinSpanHandler.create(sender))
 *   .build();
 * hooks = flowTracing.hooks();
 *
 * // when the pipeline started
 * hooks.onFlowsStarted(allNodes);
 * // when a node receives a message
 * hooks.onReceive(destination, message);
 * }</pre>
 *
 * <p>Each flow gets its own {@link Tracing} whose local service name is the flow name. Closing
 * this stops the sweeper, reports in-flight spans unfinished and closes every flow's tracing.
 */
public final class FlowTracing implements Closeable {
  /** Type of a flow tab node. */
  static final String FLOW_TYPE_TAB = "tab";
  /** Type prefix of subflow instance nodes, ex. "subflow:3f2a". */
  static final String FLOW_TYPE_SUBFLOW_PREFIX = "subflow:";

  public static FlowTracing create(SpanHandler spanHandler) {
    return newBuilder().addSpanHandler(spanHandler).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    final List<SpanHandler> spanHandlers = new ArrayList<>();
    @Nullable Function<String, Tracing> tracingFactory;
    long sweepIntervalMillis = TimeUnit.SECONDS.toMillis(5);
    long maxTraceAgeMicros; // zero means traces never expire
    @Nullable Clock clock;
    Set<String> untracedTypes = new LinkedHashSet<>(Collections.singletonList("debug"));
    Set<String> ingressTypes = new LinkedHashSet<>(Arrays.asList("http in", "inject"));
    Set<String> terminalTypes = new LinkedHashSet<>(Collections.singletonList("http response"));
    String splitType = "split";
    int maxTagValueLength = 2048;

    Builder() {
    }

    Builder(FlowTracing source) {
      this.spanHandlers.addAll(source.spanHandlers);
      this.tracingFactory = source.customTracingFactory;
      this.sweepIntervalMillis = source.sweepIntervalMillis;
      this.maxTraceAgeMicros = source.maxTraceAgeMicros;
      this.clock = source.clock;
      this.untracedTypes = new LinkedHashSet<>(source.untracedTypes);
      this.ingressTypes = new LinkedHashSet<>(source.ingressTypes);
      this.terminalTypes = new LinkedHashSet<>(source.terminalTypes);
      this.splitType = source.splitType;
      this.maxTagValueLength = source.tags.maxValueLength;
    }

    /**
     * Receives spans of every flow when the default tracing factory is in use. Ignored when {@link
     * #tracingFactory(Function)} is set.
     */
    public Builder addSpanHandler(SpanHandler spanHandler) {
      if (spanHandler == null) throw new NullPointerException("spanHandler == null");
      this.spanHandlers.add(spanHandler);
      return this;
    }

    /**
     * Creates the tracing of a flow given its name. Defaults to a {@link Tracing} with that local
     * service name, reporting to the {@link #addSpanHandler(SpanHandler) span handlers}.
     */
    public Builder tracingFactory(Function<String, Tracing> tracingFactory) {
      if (tracingFactory == null) throw new NullPointerException("tracingFactory == null");
      this.tracingFactory = tracingFactory;
      return this;
    }

    /**
     * How often the sweeper closes traces whose node spans all ended. This bounds the delay before
     * a finished trace is reported. Defaults to 5 seconds.
     */
    public Builder sweepInterval(long interval, TimeUnit unit) {
      if (unit == null) throw new NullPointerException("unit == null");
      if (interval <= 0) throw new IllegalArgumentException("interval <= 0");
      this.sweepIntervalMillis = Math.max(1L, unit.toMillis(interval));
      return this;
    }

    /**
     * Traces older than this are expired by the sweeper: their open spans are finished with an
     * error. Zero, the default, keeps a trace until its node spans all end.
     */
    public Builder maxTraceAge(long age, TimeUnit unit) {
      if (unit == null) throw new NullPointerException("unit == null");
      if (age < 0) throw new IllegalArgumentException("age < 0");
      this.maxTraceAgeMicros = unit.toMicros(age);
      return this;
    }

    /** Used to age traces. Defaults to the platform clock. */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    /** Node types that never get a span, such as sinks. Defaults to "debug". */
    public Builder untracedTypes(String... types) {
      this.untracedTypes = typeSet("untracedTypes", types);
      return this;
    }

    /** Node types whose outgoing messages start traces. Defaults to "http in" and "inject". */
    public Builder ingressTypes(String... types) {
      this.ingressTypes = typeSet("ingressTypes", types);
      return this;
    }

    /**
     * Node types whose span ends when they complete without error, as they never send the message
     * on. Defaults to "http response".
     */
    public Builder terminalTypes(String... types) {
      this.terminalTypes = typeSet("terminalTypes", types);
      return this;
    }

    /** Node type that fans a message out into several messages. Defaults to "split". */
    public Builder splitType(String splitType) {
      if (splitType == null) throw new NullPointerException("splitType == null");
      this.splitType = splitType;
      return this;
    }

    /** Tag values longer than this are truncated. Defaults to 2048. */
    public Builder maxTagValueLength(int maxTagValueLength) {
      if (maxTagValueLength <= 0) throw new IllegalArgumentException("maxTagValueLength <= 0");
      this.maxTagValueLength = maxTagValueLength;
      return this;
    }

    public FlowTracing build() {
      return new FlowTracing(this);
    }

    static Set<String> typeSet(String name, String... types) {
      if (types == null) throw new NullPointerException(name + " == null");
      Set<String> result = new LinkedHashSet<>();
      for (String type : types) {
        if (type == null) throw new NullPointerException(name + " contains null");
        result.add(type);
      }
      return result;
    }
  }

  final List<SpanHandler> spanHandlers;
  @Nullable final Function<String, Tracing> customTracingFactory;
  final long sweepIntervalMillis, maxTraceAgeMicros;
  final Clock clock;
  final Set<String> untracedTypes, ingressTypes, terminalTypes;
  final String splitType;
  final FlowTags tags;
  final FlowRegistry registry;
  final TraceTable table = new TraceTable();
  final TraceCorrelator correlator;
  final QuiescenceSweeper sweeper;
  final TracingFlowHooks hooks;

  FlowTracing(Builder builder) { // intentionally hidden constructor
    this.spanHandlers = Collections.unmodifiableList(new ArrayList<>(builder.spanHandlers));
    this.customTracingFactory = builder.tracingFactory;
    this.sweepIntervalMillis = builder.sweepIntervalMillis;
    this.maxTraceAgeMicros = builder.maxTraceAgeMicros;
    this.clock = builder.clock != null ? builder.clock : Platform.get().clock();
    this.untracedTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.untracedTypes));
    this.ingressTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.ingressTypes));
    this.terminalTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.terminalTypes));
    this.splitType = builder.splitType;
    this.tags = new FlowTags(builder.maxTagValueLength);
    this.registry = new FlowRegistry(customTracingFactory != null
      ? customTracingFactory
      : defaultTracingFactory(spanHandlers));
    // components below read the fields above
    this.correlator = new TraceCorrelator(this);
    this.sweeper = new QuiescenceSweeper(this);
    this.hooks = new TracingFlowHooks(this);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public FlowRegistry registry() {
    return registry;
  }

  public TraceCorrelator correlator() {
    return correlator;
  }

  public QuiescenceSweeper sweeper() {
    return sweeper;
  }

  /** Entry points for the pipeline host's delivery events. */
  public TracingFlowHooks hooks() {
    return hooks;
  }

  boolean isFlow(PipelineNode node) {
    String type = node.type();
    return type != null
      && (type.equals(FLOW_TYPE_TAB) || type.startsWith(FLOW_TYPE_SUBFLOW_PREFIX));
  }

  boolean isUntraced(PipelineNode node) {
    return untracedTypes.contains(node.type());
  }

  boolean isIngress(PipelineNode node) {
    return ingressTypes.contains(node.type());
  }

  boolean isTerminal(PipelineNode node) {
    return terminalTypes.contains(node.type());
  }

  boolean isSplit(PipelineNode node) {
    return splitType.equals(node.type());
  }

  /** Stops sweeping, reports in-flight spans unfinished, then closes each flow's tracing. */
  @Override public void close() {
    sweeper.close();
    correlator.clear();
    registry.close();
  }

  @Override public String toString() {
    return "FlowTracing{registry=" + registry + ", sweeper=" + sweeper + "}";
  }

  static Function<String, Tracing> defaultTracingFactory(List<SpanHandler> spanHandlers) {
    return flowName -> {
      Tracing.Builder builder = Tracing.newBuilder().localServiceName(flowName);
      for (SpanHandler spanHandler : spanHandlers) builder.addSpanHandler(spanHandler);
      return builder.build();
    };
  }

  // Use nested class to ensure logger isn't initialized unless it is accessed once.
  static final class LoggerHolder {
    static final Logger LOG = Logger.getLogger(FlowTracing.class.getName());
  }

  /**
   * Avoids array allocation when logging a parameterized message when fine level is disabled. The
   * second parameter is optional.
   *
   * @param thrown the exception that was caught, if any
   * @param msg the format string
   * @param zero will end up as {@code {0}} in the format string
   * @param one if present, will end up as {@code {1}} in the format string
   */
  static void log(@Nullable Throwable thrown, String msg, Object zero, @Nullable Object one) {
    Logger logger = LoggerHolder.LOG;
    if (!logger.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LogRecord lr = new LogRecord(Level.FINE, msg);
    Object[] params = one != null ? new Object[] {zero, one} : new Object[] {zero};
    lr.setParameters(params);
    lr.setThrown(thrown);
    logger.log(lr);
  }
}
