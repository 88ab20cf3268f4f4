// SPDX-License-Identifier: Apache-2.0
package org.apimon.example.crud;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Liveness check that also verifies the database answers a trivial query.
 */
public final class HealthHandler implements HttpHandler {

    private static final Logger logger = LogManager.getLogger(HealthHandler.class);

    public static final String PATH = "/health";

    private final UserDataStore store;
    private final ObjectMapper mapper;

    public HealthHandler(@NonNull UserDataStore store, @NonNull ObjectMapper mapper) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mapper = Objects.requireNonNull(mapper, "object mapper must not be null");
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "GET");
            JsonResponses.sendDetail(mapper, exchange, 405, "Method Not Allowed");
            return;
        }

        final Map<String, String> body = new LinkedHashMap<>();
        try {
            store.ping();
        } catch (DataAccessException e) {
            logger.warn("Health check failed", e);
            body.put("status", "error");
            body.put("database", "unreachable");
            body.put("detail", e.getMessage());
            JsonResponses.send(mapper, exchange, 500, body);
            return;
        }
        body.put("status", "ok");
        body.put("database", "reachable");
        JsonResponses.send(mapper, exchange, 200, body);
    }
}
