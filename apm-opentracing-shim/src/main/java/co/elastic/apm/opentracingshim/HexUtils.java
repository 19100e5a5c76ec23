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

public class HexUtils {

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    private HexUtils() {
        // only static utility methods, don't instantiate
    }

    /**
     * Converts a byte array to a lower case hex encoded (aka base 16 encoded) string
     * without any separator or prefix.
     * <p>
     * Trace ids and span ids are both rendered through this method,
     * so that the result matches {@link io.opentelemetry.api.trace.SpanContext#getTraceId()}
     * and {@link io.opentelemetry.api.trace.SpanContext#getSpanId()}.
     * </p>
     *
     * @param bytes The input byte array.
     * @return A hex encoded string representation of the byte array, twice as long as the input.
     */
    public static String bytesToHex(byte[] bytes) {
        final char[] hex = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int unsigned = bytes[i] & 0xFF;
            hex[2 * i] = HEX_DIGITS[unsigned >>> 4];
            hex[2 * i + 1] = HEX_DIGITS[unsigned & 0x0F];
        }
        return new String(hex);
    }
}
