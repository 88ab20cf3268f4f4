// SPDX-License-Identifier: Apache-2.0
package org.apimon.example.crud;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Handles the {@code /data} resource.
 * <ul>
 *   <li>{@code POST /data} creates an item, 201</li>
 *   <li>{@code GET /data?skip=0&limit=100} lists items in id order</li>
 *   <li>{@code PUT /data/{id}} replaces an item</li>
 *   <li>{@code DELETE /data/{id}} deletes an item and returns it</li>
 * </ul>
 * Unknown items are answered with 404, malformed input with 422. Failures of the store propagate to the caller.
 */
public final class UserDataHandler implements HttpHandler {

    private static final Logger logger = LogManager.getLogger(UserDataHandler.class);

    public static final String PATH = "/data";

    static final int DEFAULT_LIMIT = 100;

    private final UserDataStore store;
    private final ObjectMapper mapper;

    public UserDataHandler(@NonNull UserDataStore store, @NonNull ObjectMapper mapper) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mapper = Objects.requireNonNull(mapper, "object mapper must not be null");
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        final String method = exchange.getRequestMethod();
        final String path = exchange.getRequestURI().getPath();

        if (path.equals(PATH) || path.equals(PATH + "/")) {
            switch (method) {
                case "GET" -> list(exchange);
                case "POST" -> create(exchange);
                default -> methodNotAllowed(exchange, "GET, POST");
            }
            return;
        }

        final String idText = path.startsWith(PATH + "/") ? path.substring(PATH.length() + 1) : "";
        if (idText.isEmpty() || idText.contains("/")) {
            JsonResponses.sendDetail(mapper, exchange, 404, "Not Found");
            return;
        }
        final long id;
        try {
            id = Long.parseLong(idText);
        } catch (NumberFormatException e) {
            JsonResponses.sendDetail(mapper, exchange, 422, "Item id must be an integer: " + idText);
            return;
        }

        switch (method) {
            case "PUT" -> update(exchange, id);
            case "DELETE" -> delete(exchange, id);
            default -> methodNotAllowed(exchange, "PUT, DELETE");
        }
    }

    private void create(HttpExchange exchange) throws IOException {
        final Optional<UserDataCreate> data = readBody(exchange);
        if (data.isPresent()) {
            final UserData created = store.create(data.get());
            logger.debug("Created user data. id={}", created.id());
            JsonResponses.send(mapper, exchange, 201, created);
        }
    }

    private void list(HttpExchange exchange) throws IOException {
        final Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
        final int skip;
        final int limit;
        try {
            skip = Integer.parseInt(query.getOrDefault("skip", "0"));
            limit = Integer.parseInt(query.getOrDefault("limit", String.valueOf(DEFAULT_LIMIT)));
        } catch (NumberFormatException e) {
            JsonResponses.sendDetail(mapper, exchange, 422, "skip and limit must be integers");
            return;
        }
        if (skip < 0 || limit < 0) {
            JsonResponses.sendDetail(mapper, exchange, 422, "skip and limit must not be negative");
            return;
        }
        JsonResponses.send(mapper, exchange, 200, store.list(skip, limit));
    }

    private void update(HttpExchange exchange, long id) throws IOException {
        final Optional<UserDataCreate> data = readBody(exchange);
        if (data.isPresent()) {
            respondWithItem(exchange, store.update(id, data.get()));
        }
    }

    private void delete(HttpExchange exchange, long id) throws IOException {
        respondWithItem(exchange, store.delete(id));
    }

    private void respondWithItem(HttpExchange exchange, Optional<UserData> item) throws IOException {
        if (item.isPresent()) {
            JsonResponses.send(mapper, exchange, 200, item.get());
        } else {
            JsonResponses.sendDetail(mapper, exchange, 404, "Item not found");
        }
    }

    /**
     * Reads and validates the request body. On failure a 422 response is sent and an empty result returned.
     */
    private Optional<UserDataCreate> readBody(HttpExchange exchange) throws IOException {
        final UserDataCreate data;
        try (InputStream is = exchange.getRequestBody()) {
            data = mapper.readValue(is, UserDataCreate.class);
        } catch (JsonProcessingException e) {
            logger.debug("Rejected malformed request body", e);
            JsonResponses.sendDetail(mapper, exchange, 422, "Malformed request body");
            return Optional.empty();
        }
        final String violation = data == null ? "request body is required" : data.validate();
        if (violation != null) {
            JsonResponses.sendDetail(mapper, exchange, 422, violation);
            return Optional.empty();
        }
        return Optional.of(data);
    }

    private void methodNotAllowed(HttpExchange exchange, String allowed) throws IOException {
        exchange.getResponseHeaders().set("Allow", allowed);
        JsonResponses.sendDetail(mapper, exchange, 405, "Method Not Allowed");
    }

    static Map<String, String> parseQuery(String rawQuery) {
        final Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            final int eq = pair.indexOf('=');
            if (eq > 0) {
                params.putIfAbsent(pair.substring(0, eq), pair.substring(eq + 1));
            }
        }
        return params;
    }
}
