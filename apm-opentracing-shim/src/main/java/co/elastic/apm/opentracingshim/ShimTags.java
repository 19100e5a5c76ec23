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
import io.opentelemetry.semconv.trace.attributes.SemanticAttributes;
import io.opentracing.log.Fields;
import io.opentracing.tag.Tags;

import javax.annotation.Nullable;

/**
 * The OpenTracing tag names, log field keys and literals which get a special treatment when translated to OpenTelemetry.
 * All comparisons against these values are exact and case-sensitive.
 */
public class ShimTags {

    /**
     * The reserved tag name which is mapped to the OpenTelemetry span status instead of an attribute.
     * A log event with this name is recorded as an exception event.
     */
    public static final String ERROR = Tags.ERROR.getKey();

    /**
     * The log field which holds the name of the event.
     */
    public static final String EVENT = Fields.EVENT;

    /**
     * Name of events which don't have an {@link #EVENT} field.
     */
    public static final String DEFAULT_EVENT_NAME = "log";

    /**
     * Name of the event an {@code event=error} log is recorded as.
     */
    public static final String EXCEPTION_EVENT_NAME = "exception";

    public static final String ERROR_KIND = Fields.ERROR_KIND;
    public static final String MESSAGE = Fields.MESSAGE;
    public static final String STACK = Fields.STACK;
    public static final String ERROR_OBJECT = Fields.ERROR_OBJECT;

    public static final String SPAN_KIND = Tags.SPAN_KIND.getKey();

    static final String TRUE = "true";
    static final String FALSE = "false";

    private ShimTags() {
    }

    /**
     * Translates the key of a field of an exception event to the corresponding exception semantic convention.
     *
     * @param fieldKey the key of the OpenTracing log field
     * @return the semantic convention key, or {@code null} if the key is not renamed
     */
    @Nullable
    static AttributeKey<String> exceptionAttributeKey(String fieldKey) {
        if (ERROR_KIND.equals(fieldKey)) {
            return SemanticAttributes.EXCEPTION_TYPE;
        } else if (MESSAGE.equals(fieldKey)) {
            return SemanticAttributes.EXCEPTION_MESSAGE;
        } else if (STACK.equals(fieldKey)) {
            return SemanticAttributes.EXCEPTION_STACKTRACE;
        }
        return null;
    }
}
