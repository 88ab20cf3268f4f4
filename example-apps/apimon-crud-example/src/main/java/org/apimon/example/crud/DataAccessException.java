// SPDX-License-Identifier: Apache-2.0
package org.apimon.example.crud;

/**
 * Thrown when the data store can't serve a statement.
 */
public class DataAccessException extends RuntimeException {

    public DataAccessException(String message) {
        super(message);
    }

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
