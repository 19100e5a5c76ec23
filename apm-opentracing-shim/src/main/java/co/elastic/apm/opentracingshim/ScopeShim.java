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

import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

public class ScopeShim implements io.opentracing.Scope {

    private static final Logger logger = LoggerFactory.getLogger(ScopeShim.class);

    @Nullable
    private final Context context;
    private final Scope scope;
    @Nullable
    private final SpanShim span;
    private boolean closed;

    ScopeShim(@Nullable Context context, Scope scope, @Nullable SpanShim span) {
        this.context = context;
        this.scope = scope;
        this.span = span;
    }

    static ScopeShim noop() {
        return new ScopeShim(null, Scope.noop(), null);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (context != null && Context.current() != context) {
            logger.warn("Closing an OpenTracing scope which is not the active one: {}", this);
        }
        scope.close();
    }

    /**
     * @return the activated span, {@code null} if a span of another tracer has been activated
     */
    @Nullable
    public SpanShim span() {
        return span;
    }

    @Override
    public String toString() {
        return String.format("ScopeShim(%s)", span);
    }
}
