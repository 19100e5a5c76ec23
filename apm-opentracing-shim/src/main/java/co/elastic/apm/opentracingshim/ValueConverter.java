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

import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

/**
 * Converts the dynamically typed values of OpenTracing tags and log fields.
 * <p>
 * Every value is classified into exactly one {@link ValueType}.
 * Values which don't have a typed OpenTelemetry counterpart are recorded as their string representation,
 * so that no tag or log field is ever rejected.
 * </p>
 */
public class ValueConverter {

    private static final Logger logger = LoggerFactory.getLogger(ValueConverter.class);

    private ValueConverter() {
    }

    public enum ValueType {
        STRING,
        BOOLEAN,
        LONG,
        DOUBLE,
        OTHER;

        public static ValueType of(@Nullable Object value) {
            if (value instanceof String) {
                return STRING;
            } else if (value instanceof Boolean) {
                return BOOLEAN;
            } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return LONG;
            } else if (value instanceof Double || value instanceof Float) {
                return DOUBLE;
            }
            return OTHER;
        }
    }

    /**
     * Sets {@code value} as a typed attribute on the OpenTelemetry span.
     */
    public static void setAttribute(Span span, String key, @Nullable Object value) {
        switch (ValueType.of(value)) {
            case STRING:
                span.setAttribute(key, (String) value);
                break;
            case BOOLEAN:
                span.setAttribute(key, (Boolean) value);
                break;
            case LONG:
                span.setAttribute(key, ((Number) value).longValue());
                break;
            case DOUBLE:
                span.setAttribute(key, ((Number) value).doubleValue());
                break;
            default:
                span.setAttribute(key, stringOfUnsupported(key, value));
        }
    }

    /**
     * Adds {@code value} as a typed attribute to the attributes of an event.
     */
    public static void putAttribute(AttributesBuilder builder, String key, @Nullable Object value) {
        switch (ValueType.of(value)) {
            case STRING:
                builder.put(key, (String) value);
                break;
            case BOOLEAN:
                builder.put(key, (Boolean) value);
                break;
            case LONG:
                builder.put(key, ((Number) value).longValue());
                break;
            case DOUBLE:
                builder.put(key, ((Number) value).doubleValue());
                break;
            default:
                builder.put(key, stringOfUnsupported(key, value));
        }
    }

    /**
     * Renders a value as string, so that it can be compared with literals like {@code "true"}.
     * Never throws, {@code null} is rendered as {@code "null"}.
     */
    public static String stringFromValue(@Nullable Object value) {
        switch (ValueType.of(value)) {
            case STRING:
                return (String) value;
            case BOOLEAN:
            case LONG:
            case DOUBLE:
                return value.toString();
            default:
                return safeToString(value);
        }
    }

    private static String stringOfUnsupported(String key, @Nullable Object value) {
        final String string = safeToString(value);
        if (logger.isDebugEnabled()) {
            logger.debug("Recording value of type {} for key '{}' as string",
                value != null ? value.getClass().getName() : null, key);
        }
        return string;
    }

    private static String safeToString(@Nullable Object value) {
        try {
            return String.valueOf(value);
        } catch (RuntimeException e) {
            logger.debug("toString() of a tag or log value threw an exception", e);
            return value.getClass().getName();
        }
    }
}
