// SPDX-License-Identifier: Apache-2.0
package org.apimon.instrumentation.db;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Point-in-time connection counts of a pool.
 *
 * @param idle       connections available in the pool
 * @param checkedOut connections currently in use
 * @param waiters    callers waiting for a connection
 */
public record PoolStatus(int idle, int checkedOut, int waiters) {

    private static final Pattern IDLE = Pattern.compile("Connections in pool:\\s*(\\d+)");
    private static final Pattern CHECKED_OUT = Pattern.compile("Checked out connections:\\s*(\\d+)");
    private static final Pattern WAITERS = Pattern.compile("Waiters:\\s*(\\d+)");

    public PoolStatus {
        if (idle < 0 || checkedOut < 0 || waiters < 0) {
            throw new IllegalArgumentException("Connection counts must not be negative");
        }
    }

    /**
     * Parses a status text such as
     * {@code Pool size: 5  Connections in pool: 3 Current Overflow: -2 Current Checked out connections: 2}.
     * {@code Connections in pool} and {@code Checked out connections} are required, {@code Waiters} is optional
     * and defaults to 0. Other fields are ignored.
     *
     * @param status the status text
     * @return the parsed status
     * @throws IllegalArgumentException if a required field is missing
     */
    @NonNull
    public static PoolStatus parse(@NonNull String status) {
        Objects.requireNonNull(status, "status must not be null");
        return new PoolStatus(
                required(IDLE, status, "Connections in pool"),
                required(CHECKED_OUT, status, "Checked out connections"),
                find(WAITERS, status, 0));
    }

    private static int required(Pattern pattern, String status, String field) {
        int value = find(pattern, status, -1);
        if (value < 0) {
            throw new IllegalArgumentException("Field '" + field + "' not found in pool status: " + status);
        }
        return value;
    }

    private static int find(Pattern pattern, String status, int defaultValue) {
        Matcher matcher = pattern.matcher(status);
        if (!matcher.find()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Value out of range in pool status: " + matcher.group(), e);
        }
    }
}
