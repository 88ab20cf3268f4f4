// SPDX-License-Identifier: Apache-2.0
package org.apimon.example.crud;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

/**
 * Writes JSON response bodies.
 */
final class JsonResponses {

    static final String CONTENT_TYPE = "application/json";

    private JsonResponses() {}

    static void send(ObjectMapper mapper, HttpExchange exchange, int status, Object body) throws IOException {
        final byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", CONTENT_TYPE);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static void sendDetail(ObjectMapper mapper, HttpExchange exchange, int status, String detail)
            throws IOException {
        send(mapper, exchange, status, Map.of("detail", detail));
    }
}
