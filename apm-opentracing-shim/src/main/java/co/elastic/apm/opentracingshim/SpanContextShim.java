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
import io.opentelemetry.api.baggage.BaggageEntry;
import io.opentelemetry.api.trace.SpanContext;

import javax.annotation.Nullable;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * An OpenTracing {@link io.opentracing.SpanContext} backed by an OpenTelemetry {@link SpanContext} and {@link Baggage}.
 * <p>
 * Instances are immutable.
 * Setting a baggage item never changes an existing instance but derives a new one via {@link #newWithKeyValue(String, String)},
 * so that the {@link Baggage} can be shared between all the contexts which have been derived from each other.
 * </p>
 */
public class SpanContextShim implements io.opentracing.SpanContext {

    private final SpanContext spanContext;
    private final Baggage baggage;

    public SpanContextShim(SpanContext spanContext, Baggage baggage) {
        this.spanContext = Objects.requireNonNull(spanContext, "spanContext");
        this.baggage = Objects.requireNonNull(baggage, "baggage");
    }

    /**
     * Creates a new context with the same span context and a baggage which contains all entries of this context's baggage,
     * plus the provided entry.
     * An existing entry with the same key is overwritten in the new context only.
     */
    public SpanContextShim newWithKeyValue(String key, String value) {
        return new SpanContextShim(spanContext, baggage.toBuilder().put(key, value).build());
    }

    /**
     * @return the value of the baggage item, or {@code null} if there is no such item
     */
    @Nullable
    public String getBaggageItem(String key) {
        return baggage.getEntryValue(key);
    }

    /**
     * Calls the visitor for each baggage item until it returns {@code false}.
     * The order of the items is the iteration order of the underlying {@link Baggage} and not guaranteed.
     */
    public void forEachBaggageItem(BiPredicate<String, String> visitor) {
        for (Map.Entry<String, BaggageEntry> entry : baggage.asMap().entrySet()) {
            if (!visitor.test(entry.getKey(), entry.getValue().getValue())) {
                return;
            }
        }
    }

    @Override
    public Iterable<Map.Entry<String, String>> baggageItems() {
        if (baggage.isEmpty()) {
            return Collections.emptyList();
        }
        final List<Map.Entry<String, String>> items = new ArrayList<>(baggage.size());
        forEachBaggageItem(new BiPredicate<String, String>() {
            @Override
            public boolean test(String key, String value) {
                items.add(new AbstractMap.SimpleImmutableEntry<>(key, value));
                return true;
            }
        });
        return Collections.unmodifiableList(items);
    }

    @Override
    public String toTraceId() {
        return HexUtils.bytesToHex(spanContext.getTraceIdBytes());
    }

    @Override
    public String toSpanId() {
        return HexUtils.bytesToHex(spanContext.getSpanIdBytes());
    }

    /**
     * Creates a copy of this context which shares the (immutable) baggage and span context with this instance.
     */
    public SpanContextShim copy() {
        return new SpanContextShim(spanContext, baggage);
    }

    public SpanContext getSpanContext() {
        return spanContext;
    }

    public Baggage getBaggage() {
        return baggage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SpanContextShim that = (SpanContextShim) o;
        return spanContext.equals(that.spanContext) && baggage.equals(that.baggage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spanContext, baggage);
    }

    @Override
    public String toString() {
        return "SpanContextShim[" + spanContext + ", " + baggage + "]";
    }
}
