/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.elastic.apm.opentracingshim;

import io.opentelemetry.api.baggage.Baggage;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentracing.References;
import io.opentracing.SpanContext;
import io.opentracing.tag.Tag;
import io.opentracing.tag.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public class SpanBuilderShim implements io.opentracing.Tracer.SpanBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SpanBuilderShim.class);

    private final Tracer tracer;
    private final ScopeManagerShim scopeManager;
    private final ShimConfiguration configuration;
    private final String operationName;
    private final Map<String, Object> tags = new LinkedHashMap<>();
    private final List<SpanContextShim> followsFrom = new ArrayList<>();

    private boolean ignoreActiveSpan = false;
    @Nullable
    private Long startTimestampMicros;
    @Nullable
    private SpanContextShim parentContext;
    private boolean parentIsChildOf = false;

    SpanBuilderShim(Tracer tracer, ScopeManagerShim scopeManager, ShimConfiguration configuration, String operationName) {
        this.tracer = tracer;
        this.scopeManager = scopeManager;
        this.configuration = configuration;
        this.operationName = operationName;
    }

    @Override
    public SpanBuilderShim asChildOf(@Nullable SpanContext parent) {
        return addReference(References.CHILD_OF, parent);
    }

    @Override
    public SpanBuilderShim asChildOf(@Nullable io.opentracing.Span parent) {
        if (parent != null) {
            asChildOf(parent.context());
        }
        return this;
    }

    /**
     * The first {@code child_of} reference becomes the parent of the span.
     * Without such a reference, the first {@code follows_from} reference becomes the parent.
     * All {@code follows_from} references are recorded as links.
     */
    @Override
    public SpanBuilderShim addReference(String referenceType, @Nullable SpanContext referencedContext) {
        if (!(referencedContext instanceof SpanContextShim)) {
            if (referencedContext != null) {
                logger.debug("Ignoring reference to a span context which has not been created by the OpenTracing shim: {}", referencedContext);
            }
            return this;
        }
        final SpanContextShim context = (SpanContextShim) referencedContext;
        if (References.CHILD_OF.equals(referenceType)) {
            if (!parentIsChildOf) {
                parentContext = context;
                parentIsChildOf = true;
            }
        } else if (References.FOLLOWS_FROM.equals(referenceType)) {
            followsFrom.add(context);
            if (parentContext == null) {
                parentContext = context;
            }
        } else {
            logger.debug("Ignoring unknown reference type {}", referenceType);
        }
        return this;
    }

    @Override
    public SpanBuilderShim ignoreActiveSpan() {
        this.ignoreActiveSpan = true;
        return this;
    }

    @Override
    public SpanBuilderShim withTag(String key, String value) {
        tags.put(key, value);
        return this;
    }

    @Override
    public SpanBuilderShim withTag(String key, boolean value) {
        tags.put(key, value);
        return this;
    }

    @Override
    public SpanBuilderShim withTag(String key, Number value) {
        tags.put(key, value);
        return this;
    }

    @Override
    public <T> SpanBuilderShim withTag(Tag<T> tag, T value) {
        tags.put(tag.getKey(), value);
        return this;
    }

    @Override
    public SpanBuilderShim withStartTimestamp(long microseconds) {
        this.startTimestampMicros = microseconds;
        return this;
    }

    @Override
    public SpanShim start() {
        SpanContextShim parent = parentContext;
        if (parent == null && !ignoreActiveSpan) {
            final SpanShim active = scopeManager.activeSpan();
            if (active != null) {
                parent = active.context();
            }
        }

        final SpanBuilder builder = tracer.spanBuilder(operationName);
        final Baggage baggage;
        if (parent != null) {
            builder.setParent(Context.root().with(Span.wrap(parent.getSpanContext())));
            baggage = parent.getBaggage();
        } else {
            builder.setNoParent();
            baggage = ignoreActiveSpan ? Baggage.empty() : Baggage.current();
        }
        for (SpanContextShim link : followsFrom) {
            builder.addLink(link.getSpanContext());
        }
        if (configuration.isSpanKindFromTag() && tags.containsKey(ShimTags.SPAN_KIND)) {
            builder.setSpanKind(toSpanKind(tags.get(ShimTags.SPAN_KIND)));
        }
        if (startTimestampMicros != null) {
            builder.setStartTimestamp(startTimestampMicros, TimeUnit.MICROSECONDS);
        }

        final Span span = builder.startSpan();
        final SpanShim spanShim = new SpanShim(span, new SpanContextShim(span.getSpanContext(), baggage));
        for (Map.Entry<String, Object> tag : tags.entrySet()) {
            spanShim.handleTag(tag.getKey(), tag.getValue());
        }
        return spanShim;
    }

    static SpanKind toSpanKind(@Nullable Object spanKindTag) {
        final String kind = ValueConverter.stringFromValue(spanKindTag);
        if (Tags.SPAN_KIND_CLIENT.equals(kind)) {
            return SpanKind.CLIENT;
        } else if (Tags.SPAN_KIND_SERVER.equals(kind)) {
            return SpanKind.SERVER;
        } else if (Tags.SPAN_KIND_PRODUCER.equals(kind)) {
            return SpanKind.PRODUCER;
        } else if (Tags.SPAN_KIND_CONSUMER.equals(kind)) {
            return SpanKind.CONSUMER;
        }
        return SpanKind.INTERNAL;
    }
}
