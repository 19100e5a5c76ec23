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
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapSetter;
import io.opentracing.SpanContext;
import io.opentracing.propagation.Format;
import io.opentracing.propagation.TextMapExtract;
import io.opentracing.propagation.TextMapInject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * An OpenTracing {@link io.opentracing.Tracer} which records all spans with an OpenTelemetry {@link Tracer}.
 * <p>
 * Use {@link OpenTracingShim} to create instances.
 * </p>
 */
public class TracerShim implements io.opentracing.Tracer {

    private static final Logger logger = LoggerFactory.getLogger(TracerShim.class);

    private final Tracer tracer;
    private final ContextPropagators propagators;
    private final ShimConfiguration configuration;
    private final ScopeManagerShim scopeManager;
    private volatile boolean closed;

    TracerShim(Tracer tracer, ContextPropagators propagators, ShimConfiguration configuration) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.propagators = Objects.requireNonNull(propagators, "propagators");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.scopeManager = new ScopeManagerShim();
    }

    @Override
    public ScopeManagerShim scopeManager() {
        return scopeManager;
    }

    @Override
    @Nullable
    public SpanShim activeSpan() {
        return scopeManager.activeSpan();
    }

    @Override
    public ScopeShim activateSpan(io.opentracing.Span span) {
        return scopeManager.activate(span);
    }

    @Override
    public SpanBuilderShim buildSpan(String operationName) {
        final Tracer spanTracer = closed ? TracerProvider.noop().get(configuration.getInstrumentationName()) : tracer;
        return new SpanBuilderShim(spanTracer, scopeManager, configuration, operationName);
    }

    @Override
    public <C> void inject(SpanContext spanContext, Format<C> format, C carrier) {
        if (!(spanContext instanceof SpanContextShim)) {
            logger.debug("Not injecting a span context which has not been created by the OpenTracing shim: {}", spanContext);
            return;
        }
        if (!isTextMapFormat(format) || !(carrier instanceof TextMapInject)) {
            logger.debug("Injecting format {} is not supported", format);
            return;
        }
        final SpanContextShim contextShim = (SpanContextShim) spanContext;
        final Context context = Context.root()
            .with(Span.wrap(contextShim.getSpanContext()))
            .with(contextShim.getBaggage());
        propagators.getTextMapPropagator().inject(context, (TextMapInject) carrier, TextMapInjectSetter.INSTANCE);
    }

    /**
     * @return the extracted context, or {@code null} if the carrier contains neither a valid span context nor baggage
     */
    @Override
    @Nullable
    public <C> SpanContextShim extract(Format<C> format, C carrier) {
        if (!isTextMapFormat(format) || !(carrier instanceof TextMapExtract)) {
            logger.debug("Extracting format {} is not supported", format);
            return null;
        }
        final boolean httpHeaders = format == Format.Builtin.HTTP_HEADERS;
        final Map<String, String> headers = new HashMap<>();
        for (Map.Entry<String, String> entry : (TextMapExtract) carrier) {
            final String key = entry.getKey();
            if (key == null) {
                continue;
            }
            // header names are case-insensitive while propagators look them up in lower case
            headers.put(httpHeaders ? key.toLowerCase(Locale.ROOT) : key, entry.getValue());
        }
        final Context context = propagators.getTextMapPropagator().extract(Context.root(), headers, MapGetter.INSTANCE);
        final io.opentelemetry.api.trace.SpanContext spanContext = Span.fromContext(context).getSpanContext();
        final Baggage baggage = Baggage.fromContext(context);
        if (!spanContext.isValid() && baggage.isEmpty()) {
            return null;
        }
        return new SpanContextShim(spanContext, baggage);
    }

    private static boolean isTextMapFormat(Format<?> format) {
        return format == Format.Builtin.TEXT_MAP
            || format == Format.Builtin.HTTP_HEADERS
            || format == Format.Builtin.TEXT_MAP_INJECT
            || format == Format.Builtin.TEXT_MAP_EXTRACT;
    }

    /**
     * Spans created after closing are not recorded.
     * The lifecycle of the underlying OpenTelemetry SDK is not affected.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            logger.debug("Closed OpenTracing shim {}", this);
        }
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return "TracerShim[" + configuration.getInstrumentationName() + "]";
    }

    private enum TextMapInjectSetter implements TextMapSetter<TextMapInject> {
        INSTANCE;

        @Override
        public void set(@Nullable TextMapInject carrier, String key, String value) {
            if (carrier != null) {
                carrier.put(key, value);
            }
        }
    }

    private enum MapGetter implements TextMapGetter<Map<String, String>> {
        INSTANCE;

        @Override
        public Iterable<String> keys(Map<String, String> carrier) {
            return carrier.keySet();
        }

        @Nullable
        @Override
        public String get(@Nullable Map<String, String> carrier, String key) {
            return carrier != null ? carrier.get(key) : null;
        }
    }
}
