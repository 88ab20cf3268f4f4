// SPDX-License-Identifier: Apache-2.0
package org.apimon.example.crud;

import com.google.auto.service.AutoService;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.SmallRyeConfigBuilderCustomizer;
import io.smallrye.config.validator.BeanValidationConfigValidatorImpl;

/**
 * Registers {@link CrudExampleConfig} with configurations built with discovered customizers.
 */
@AutoService(SmallRyeConfigBuilderCustomizer.class)
public final class CrudExampleConfigCustomizer implements SmallRyeConfigBuilderCustomizer {

    @Override
    public void configBuilder(SmallRyeConfigBuilder builder) {
        builder.withMapping(CrudExampleConfig.class).withValidator(new BeanValidationConfigValidatorImpl());
    }
}
