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
import io.opentelemetry.context.Context;
import io.opentelemetry.context.ContextKey;
import io.opentracing.ScopeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

/**
 * Activates spans in the OpenTelemetry {@link Context}, so that OpenTracing and OpenTelemetry instrumentations
 * see the same active span.
 */
public class ScopeManagerShim implements ScopeManager {

    private static final Logger logger = LoggerFactory.getLogger(ScopeManagerShim.class);

    // lets activeSpan() return the very instance which has been activated, including its baggage
    private static final ContextKey<SpanShim> SPAN_SHIM_KEY = ContextKey.named("opentracing-shim-span");

    ScopeManagerShim() {
    }

    @Override
    public ScopeShim activate(@Nullable io.opentracing.Span span) {
        if (!(span instanceof SpanShim)) {
            logger.debug("Ignoring activation of a span which has not been created by the OpenTracing shim: {}", span);
            return ScopeShim.noop();
        }
        final SpanShim spanShim = (SpanShim) span;
        final Context context = Context.current()
            .with(spanShim.getSpan())
            .with(spanShim.context().getBaggage())
            .with(SPAN_SHIM_KEY, spanShim);
        return new ScopeShim(context, context.makeCurrent(), spanShim);
    }

    @Override
    @Nullable
    public SpanShim activeSpan() {
        final Context context = Context.current();
        final Span span = Span.fromContext(context);
        // spans of a closed tracer are activated like any other, although their context is invalid
        final SpanShim spanShim = context.get(SPAN_SHIM_KEY);
        if (spanShim != null && spanShim.getSpan() == span) {
            return spanShim;
        }
        if (!span.getSpanContext().isValid()) {
            return null;
        }
        // activated by OpenTelemetry code
        return new SpanShim(span, new SpanContextShim(span.getSpanContext(), Baggage.fromContext(context)));
    }
}
