// SPDX-License-Identifier: Apache-2.0
package org.apimon.example.crud;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Configuration of the CRUD example application, mapped from properties under {@value #PREFIX}.
 */
// spotless:off
@ConfigMapping(prefix = CrudExampleConfig.PREFIX, namingStrategy = ConfigMapping.NamingStrategy.VERBATIM)
public interface CrudExampleConfig {

    String PREFIX = "apimon.example";

    @WithDefault("0.0.0.0")
    String hostname();

    /**
     * @return the port to listen on, 0 picks a free port
     */
    @WithDefault("8000") @Min(0) @Max(65535)
    int port();

    /**
     * @return number of request handling threads
     */
    @WithDefault("4") @Min(1) @Max(64)
    int threads();

    /**
     * @return number of simulated database connections
     */
    @WithDefault("5") @Min(1) @Max(100)
    int poolSize();
}
// spotless:on
