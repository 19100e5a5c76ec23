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

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.semconv.trace.attributes.SemanticAttributes;
import io.opentracing.tag.Tag;

import javax.annotation.Nullable;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * An OpenTracing {@link io.opentracing.Span} which translates every call to the wrapped OpenTelemetry {@link Span}.
 * <p>
 * OpenTracing timestamps are microseconds since the epoch.
 * </p>
 */
public class SpanShim implements io.opentracing.Span {

    private final Span span;
    private final Object contextLock = new Object();
    // guarded by contextLock
    private SpanContextShim context;

    public SpanShim(Span span, SpanContextShim context) {
        this.span = Objects.requireNonNull(span, "span");
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public SpanContextShim context() {
        synchronized (contextLock) {
            return context;
        }
    }

    @Override
    public SpanShim setTag(String key, String value) {
        handleTag(key, value);
        return this;
    }

    @Override
    public SpanShim setTag(String key, boolean value) {
        handleTag(key, value);
        return this;
    }

    @Override
    public SpanShim setTag(String key, Number value) {
        handleTag(key, value);
        return this;
    }

    @Override
    public <T> SpanShim setTag(Tag<T> tag, T value) {
        handleTag(tag.getKey(), value);
        return this;
    }

    void handleTag(String key, @Nullable Object value) {
        if (ShimTags.ERROR.equals(key)) {
            handleError(value);
        } else {
            ValueConverter.setAttribute(span, key, value);
        }
    }

    /**
     * Maps the error tag to the span status.
     * Only the literals {@code true} and {@code false} map to {@link StatusCode#ERROR} and {@link StatusCode#OK},
     * every other value maps to {@link StatusCode#UNSET}.
     */
    private void handleError(@Nullable Object value) {
        final String stringValue = ValueConverter.stringFromValue(value);
        StatusCode statusCode = StatusCode.UNSET;
        if (ShimTags.TRUE.equals(stringValue)) {
            statusCode = StatusCode.ERROR;
        } else if (ShimTags.FALSE.equals(stringValue)) {
            statusCode = StatusCode.OK;
        }
        span.setStatus(statusCode);
    }

    @Override
    public SpanShim setOperationName(String operationName) {
        span.updateName(operationName);
        return this;
    }

    @Override
    public SpanShim setBaggageItem(String key, String value) {
        synchronized (contextLock) {
            context = context.newWithKeyValue(key, value);
        }
        return this;
    }

    /**
     * @return the value of the baggage item or an empty string if there is no such item
     */
    @Override
    public String getBaggageItem(String key) {
        final String value;
        synchronized (contextLock) {
            value = context.getBaggageItem(key);
        }
        return value != null ? value : "";
    }

    @Override
    public SpanShim log(@Nullable Map<String, ?> fields) {
        logInternal(null, fields);
        return this;
    }

    @Override
    public SpanShim log(long timestampMicroseconds, @Nullable Map<String, ?> fields) {
        logInternal(timestampMicroseconds, fields);
        return this;
    }

    @Override
    public SpanShim log(String event) {
        logInternal(null, Collections.singletonMap(ShimTags.EVENT, event));
        return this;
    }

    @Override
    public SpanShim log(long timestampMicroseconds, String event) {
        logInternal(timestampMicroseconds, Collections.singletonMap(ShimTags.EVENT, event));
        return this;
    }

    /**
     * @param timestampMicroseconds the explicit timestamp of the event, {@code null} to let OpenTelemetry use the current time
     */
    private void logInternal(@Nullable Long timestampMicroseconds, @Nullable Map<String, ?> logFields) {
        final Map<String, ?> fields = logFields != null ? logFields : Collections.<String, Object>emptyMap();
        String name = ShimTags.DEFAULT_EVENT_NAME;
        if (fields.containsKey(ShimTags.EVENT)) {
            name = ValueConverter.stringFromValue(fields.get(ShimTags.EVENT));
        }
        final boolean isError = ShimTags.ERROR.equals(name);
        if (isError) {
            name = ShimTags.EXCEPTION_EVENT_NAME;
        }

        final AttributesBuilder attributes = Attributes.builder();
        for (Map.Entry<String, ?> field : fields.entrySet()) {
            String key = field.getKey();
            if (isError) {
                AttributeKey<String> exceptionKey = ShimTags.exceptionAttributeKey(key);
                if (exceptionKey != null) {
                    key = exceptionKey.getKey();
                }
            }
            ValueConverter.putAttribute(attributes, key, field.getValue());
        }
        if (isError && fields.get(ShimTags.ERROR_OBJECT) instanceof Throwable) {
            addThrowableAttributes(attributes, fields, (Throwable) fields.get(ShimTags.ERROR_OBJECT));
        }

        if (timestampMicroseconds != null) {
            span.addEvent(name, attributes.build(), timestampMicroseconds, TimeUnit.MICROSECONDS);
        } else {
            span.addEvent(name, attributes.build());
        }
    }

    /**
     * Fills in the exception attributes from the {@code error.object} field, unless they have been provided explicitly.
     */
    private static void addThrowableAttributes(AttributesBuilder attributes, Map<String, ?> fields, Throwable throwable) {
        if (!fields.containsKey(ShimTags.ERROR_KIND)) {
            attributes.put(SemanticAttributes.EXCEPTION_TYPE, throwable.getClass().getName());
        }
        if (!fields.containsKey(ShimTags.MESSAGE) && throwable.getMessage() != null) {
            attributes.put(SemanticAttributes.EXCEPTION_MESSAGE, throwable.getMessage());
        }
        if (!fields.containsKey(ShimTags.STACK)) {
            StringWriter stackTrace = new StringWriter();
            throwable.printStackTrace(new PrintWriter(stackTrace));
            attributes.put(SemanticAttributes.EXCEPTION_STACKTRACE, stackTrace.toString());
        }
    }

    @Override
    public void finish() {
        span.end();
    }

    @Override
    public void finish(long finishMicros) {
        span.end(finishMicros, TimeUnit.MICROSECONDS);
    }

    public Span getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return "SpanShim[" + span + "]";
    }
}
