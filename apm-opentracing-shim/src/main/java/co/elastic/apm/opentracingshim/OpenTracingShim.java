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

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.TracerBuilder;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.EnvironmentVariableConfigurationSource;
import org.stagemonitor.configuration.source.SystemPropertyConfigurationSource;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Entry point for creating OpenTracing {@link io.opentracing.Tracer}s which are backed by OpenTelemetry.
 * <pre>
 * io.opentracing.Tracer tracer = OpenTracingShim.createTracerShim(openTelemetry);
 * </pre>
 * Registering the tracer, for example with {@code io.opentracing.util.GlobalTracer}, is up to the caller.
 */
public class OpenTracingShim {

    private OpenTracingShim() {
    }

    /**
     * Creates a tracer shim which is configured via system properties and environment variables.
     */
    public static TracerShim createTracerShim(OpenTelemetry openTelemetry) {
        return createTracerShim(openTelemetry, ConfigurationRegistry.builder()
            .optionProviders(ServiceLoader.load(ConfigurationOptionProvider.class, OpenTracingShim.class.getClassLoader()))
            .addConfigSource(new SystemPropertyConfigurationSource())
            .addConfigSource(new EnvironmentVariableConfigurationSource())
            .build());
    }

    /**
     * Creates a tracer shim with the {@link ShimConfiguration} of the provided registry.
     */
    public static TracerShim createTracerShim(OpenTelemetry openTelemetry, ConfigurationRegistry configurationRegistry) {
        Objects.requireNonNull(openTelemetry, "openTelemetry");
        final ShimConfiguration configuration = Objects.requireNonNull(configurationRegistry.getConfig(ShimConfiguration.class),
            "ShimConfiguration is not registered");

        final TracerBuilder tracerBuilder = openTelemetry.tracerBuilder(configuration.getInstrumentationName());
        final String version = configuration.getInstrumentationVersion();
        if (version != null) {
            tracerBuilder.setInstrumentationVersion(version);
        }
        return new TracerShim(tracerBuilder.build(), openTelemetry.getPropagators(), configuration);
    }
}
