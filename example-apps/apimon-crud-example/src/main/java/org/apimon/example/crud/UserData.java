// SPDX-License-Identifier: Apache-2.0
package org.apimon.example.crud;

/**
 * A stored user data item.
 */
public record UserData(long id, String name, String email, String message) {

    static UserData of(long id, UserDataCreate data) {
        return new UserData(id, data.name(), data.email(), data.message());
    }
}
