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
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.semconv.trace.attributes.SemanticAttributes;
import io.opentracing.log.Fields;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SpanShimEventTest extends AbstractShimTest {

    @Test
    void testErrorEventIsMappedToException() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event", "error");
        fields.put("error.kind", "Timeout");
        fields.put("message", "boom");
        fields.put("stack", "at foo");

        SpanShim span = tracer.buildSpan("test").start();
        span.log(fields);
        span.finish();

        List<EventData> events = getFirstSpan().getEvents();
        assertThat(events).hasSize(1);
        EventData event = events.get(0);
        assertThat(event.getName()).isEqualTo("exception");

        Attributes attributes = event.getAttributes();
        assertThat(attributes.get(SemanticAttributes.EXCEPTION_TYPE)).isEqualTo("Timeout");
        assertThat(attributes.get(SemanticAttributes.EXCEPTION_MESSAGE)).isEqualTo("boom");
        assertThat(attributes.get(SemanticAttributes.EXCEPTION_STACKTRACE)).isEqualTo("at foo");
        assertThat(attributes.get(AttributeKey.stringKey("event"))).isEqualTo("error");
        assertThat(attributes.asMap().keySet())
            .extracting(AttributeKey::getKey)
            .doesNotContain("error.kind", "message", "stack")
            .hasSize(4);
    }

    @Test
    void testLogWithoutEventField() {
        SpanShim span = tracer.buildSpan("test").start();
        span.log(Map.of("foo", "bar"));
        span.finish();

        List<EventData> events = getFirstSpan().getEvents();
        assertThat(events).hasSize(1);
        assertThat(events.get(0).getName()).isEqualTo("log");
        assertThat(events.get(0).getAttributes()).isEqualTo(Attributes.of(AttributeKey.stringKey("foo"), "bar"));
    }

    @Test
    void testNonErrorEventKeepsKeys() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event", "retry");
        fields.put("message", "second attempt");
        fields.put("attempt", 2);

        SpanShim span = tracer.buildSpan("test").start();
        span.log(fields);
        span.finish();

        EventData event = getFirstSpan().getEvents().get(0);
        assertThat(event.getName()).isEqualTo("retry");
        assertThat(event.getAttributes().get(AttributeKey.stringKey("message"))).isEqualTo("second attempt");
        assertThat(event.getAttributes().get(AttributeKey.longKey("attempt"))).isEqualTo(2L);
        assertThat(event.getAttributes().get(SemanticAttributes.EXCEPTION_MESSAGE)).isNull();
    }

    @Test
    void testErrorObject() {
        IllegalStateException exception = new IllegalStateException("broken");
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Fields.EVENT, "error");
        fields.put(Fields.ERROR_OBJECT, exception);

        SpanShim span = tracer.buildSpan("test").start();
        span.log(fields);
        span.finish();

        EventData event = getFirstSpan().getEvents().get(0);
        assertThat(event.getName()).isEqualTo("exception");
        Attributes attributes = event.getAttributes();
        assertThat(attributes.get(SemanticAttributes.EXCEPTION_TYPE)).isEqualTo(IllegalStateException.class.getName());
        assertThat(attributes.get(SemanticAttributes.EXCEPTION_MESSAGE)).isEqualTo("broken");
        assertThat(attributes.get(SemanticAttributes.EXCEPTION_STACKTRACE)).contains("broken").contains("SpanShimEventTest");
        assertThat(attributes.get(AttributeKey.stringKey("error.object"))).isEqualTo(exception.toString());
    }

    @Test
    void testErrorObjectDoesNotOverrideExplicitFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Fields.EVENT, "error");
        fields.put(Fields.ERROR_OBJECT, new RuntimeException("from throwable"));
        fields.put(Fields.ERROR_KIND, "CustomKind");
        fields.put(Fields.MESSAGE, "explicit");

        SpanShim span = tracer.buildSpan("test").start();
        span.log(fields);
        span.finish();

        Attributes attributes = getFirstSpan().getEvents().get(0).getAttributes();
        assertThat(attributes.get(SemanticAttributes.EXCEPTION_TYPE)).isEqualTo("CustomKind");
        assertThat(attributes.get(SemanticAttributes.EXCEPTION_MESSAGE)).isEqualTo("explicit");
        assertThat(attributes.get(SemanticAttributes.EXCEPTION_STACKTRACE)).contains("from throwable");
    }

    @Test
    void testLogWithExplicitTimestamp() {
        long startMicros = TimeUnit.SECONDS.toMicros(1_600_000_000L);
        SpanShim span = tracer.buildSpan("test").withStartTimestamp(startMicros).start();
        span.log(startMicros + 5, "first");
        span.log(startMicros + 7, Map.of("event", "second"));
        span.finish(startMicros + 10);

        SpanData spanData = getFirstSpan();
        assertThat(spanData.getStartEpochNanos()).isEqualTo(TimeUnit.MICROSECONDS.toNanos(startMicros));
        assertThat(spanData.getEndEpochNanos()).isEqualTo(TimeUnit.MICROSECONDS.toNanos(startMicros + 10));
        assertThat(spanData.getEvents()).extracting(EventData::getName).containsExactly("first", "second");
        assertThat(spanData.getEvents()).extracting(EventData::getEpochNanos)
            .containsExactly(TimeUnit.MICROSECONDS.toNanos(startMicros + 5), TimeUnit.MICROSECONDS.toNanos(startMicros + 7));
    }

    @Test
    void testFinishTimestampsPreserveOrder() {
        long startMicros = TimeUnit.SECONDS.toMicros(1_700_000_000L);
        SpanShim first = tracer.buildSpan("first").withStartTimestamp(startMicros).start();
        SpanShim second = tracer.buildSpan("second").withStartTimestamp(startMicros).start();
        second.finish(startMicros + 2);
        first.finish(startMicros + 1);

        List<SpanData> spans = getFinishedSpans();
        assertThat(spans).hasSize(2);
        SpanData secondData = spans.get(0);
        SpanData firstData = spans.get(1);
        assertThat(firstData.getName()).isEqualTo("first");
        assertThat(firstData.getEndEpochNanos()).isLessThan(secondData.getEndEpochNanos());
    }

    @Test
    void testLogWithoutTimestampUsesCurrentTime() {
        long beforeNanos = TimeUnit.MILLISECONDS.toNanos(System.currentTimeMillis()) - TimeUnit.SECONDS.toNanos(1);
        SpanShim span = tracer.buildSpan("test").start();
        span.log("now");
        span.finish();

        EventData event = getFirstSpan().getEvents().get(0);
        assertThat(event.getEpochNanos()).isGreaterThan(beforeNanos);
    }

    @Test
    void testErrorTagSetsStatus() {
        tracer.buildSpan("error").start().setTag("error", true).finish();
        tracer.buildSpan("ok").start().setTag("error", "false").finish();
        tracer.buildSpan("unset").start().setTag("error", "maybe").finish();

        List<SpanData> spans = getFinishedSpans();
        assertThat(spans).extracting(SpanData::getName).containsExactly("error", "ok", "unset");
        assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(spans.get(1).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        assertThat(spans.get(2).getStatus().getStatusCode()).isEqualTo(StatusCode.UNSET);
        assertThat(spans.get(0).getAttributes().get(AttributeKey.booleanKey("error"))).isNull();
    }

    @Test
    void testOperationsAfterFinish() {
        SpanShim span = tracer.buildSpan("test").start();
        span.finish();

        // subsequent calls have undefined behavior but must not throw exceptions
        span.setOperationName("renamed");
        span.setTag("foo", "bar");
        span.setTag("error", true);
        span.setBaggageItem("foo", "bar");
        span.log("foo");
        span.finish();

        assertThat(span.getBaggageItem("foo")).isEqualTo("bar");
        assertThat(getFinishedSpans()).hasSize(1);
        SpanData spanData = getFirstSpan();
        assertThat(spanData.getName()).isEqualTo("test");
        assertThat(spanData.getEvents()).isEmpty();
        assertThat(spanData.getStatus().getStatusCode()).isEqualTo(StatusCode.UNSET);
    }
}
