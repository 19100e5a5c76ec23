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

import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;

import javax.annotation.Nullable;

public class ShimConfiguration extends ConfigurationOptionProvider {

    public static final String INSTRUMENTATION_NAME = "opentracing_shim_instrumentation_name";
    public static final String INSTRUMENTATION_VERSION = "opentracing_shim_instrumentation_version";
    public static final String SPAN_KIND_FROM_TAG = "opentracing_shim_span_kind_from_tag";

    private static final String OPENTRACING_CATEGORY = "OpenTracing";

    private final ConfigurationOption<String> instrumentationName = ConfigurationOption.stringOption()
        .key(INSTRUMENTATION_NAME)
        .configurationCategory(OPENTRACING_CATEGORY)
        .description("The instrumentation scope name of the OpenTelemetry tracer which records the spans created via the OpenTracing API.")
        .dynamic(false)
        .buildWithDefault("opentracingshim");

    private final ConfigurationOption<String> instrumentationVersion = ConfigurationOption.stringOption()
        .key(INSTRUMENTATION_VERSION)
        .configurationCategory(OPENTRACING_CATEGORY)
        .description("The instrumentation scope version of the OpenTelemetry tracer which records the spans created via the OpenTracing API.\n" +
            "\n" +
            "If not set, the tracer has no version.")
        .dynamic(false)
        .build();

    private final ConfigurationOption<Boolean> spanKindFromTag = ConfigurationOption.booleanOption()
        .key(SPAN_KIND_FROM_TAG)
        .configurationCategory(OPENTRACING_CATEGORY)
        .description("If set to `true`, the `span.kind` tag of a span builder determines the OpenTelemetry span kind.\n" +
            "`client`, `server`, `producer` and `consumer` are mapped to the respective kinds, all other values to `INTERNAL`.\n" +
            "\n" +
            "The tag is recorded as an attribute in any case.")
        .dynamic(true)
        .buildWithDefault(true);

    public String getInstrumentationName() {
        return instrumentationName.get();
    }

    @Nullable
    public String getInstrumentationVersion() {
        return instrumentationVersion.get();
    }

    public boolean isSpanKindFromTag() {
        return spanKindFromTag.get();
    }
}
