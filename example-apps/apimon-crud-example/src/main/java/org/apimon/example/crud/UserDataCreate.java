// SPDX-License-Identifier: Apache-2.0
package org.apimon.example.crud;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Request body of create and update calls. {@code message} is optional.
 */
public record UserDataCreate(String name, String email, @Nullable String message) {

    /**
     * @return a description of the first invalid field, or {@code null} if the data is valid
     */
    @Nullable
    String validate() {
        if (name == null || name.isBlank()) {
            return "name is required";
        }
        if (email == null || email.isBlank()) {
            return "email is required";
        }
        return null;
    }
}
