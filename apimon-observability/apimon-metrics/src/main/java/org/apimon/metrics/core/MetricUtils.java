// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Utility class for metrics-related operations.
 */
public final class MetricUtils {

    /** Regex for validating metric and label names. */
    public static final String NAME_REGEX = "^[a-zA-Z_][a-zA-Z0-9_]*$";

    private static final Pattern NAME_PATTERN = Pattern.compile(NAME_REGEX);

    private MetricUtils() {}

    /**
     * Validates that the provided metric name adheres to the required character set. <br>
     * Pattern to validate is: {@value #NAME_REGEX} <br>
     * Definition in ABNF (Augmented Backus-Naur Form):
     * <pre>
     *   name = name-initial-char *name-char
     *   name-initial-char = ALPHA / "_"
     *   name-char = name-initial-char / DIGIT
     * </pre>
     * @param metricName the name to validate
     * @return the validated name
     * @throws NullPointerException if metric name is {@code null}
     * @throws IllegalArgumentException if metric name is blank or contains invalid characters
     */
    @NonNull
    public static String validateMetricName(String metricName) {
        return validateNameCharacters(metricName, "metric name");
    }

    /**
     * Validates that the provided label name adheres to the required character set,
     * the same as for metric names: {@value #NAME_REGEX}.
     *
     * @param labelName the label name to validate
     * @return the validated name
     * @throws NullPointerException if label name is {@code null}
     * @throws IllegalArgumentException if label name is blank or contains invalid characters
     */
    @NonNull
    public static String validateLabelName(String labelName) {
        return validateNameCharacters(labelName, "label name");
    }

    private static String validateNameCharacters(String name, String argumentName) {
        throwArgBlank(name, argumentName);
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Name contains illegal character: " + name + ". Required pattern is " + NAME_REGEX);
        }
        return name;
    }

    /**
     * Loads implementations of the specified class using Java's ServiceLoader mechanism.
     *
     * @param serviceType   the class of the implementations to load
     * @param <T>           the type of the implementation
     * @return a list of loaded implementations
     */
    @NonNull
    public static <T> List<T> load(@NonNull Class<T> serviceType) {
        ServiceLoader<T> serviceLoader = ServiceLoader.load(serviceType);
        return serviceLoader.stream().map(ServiceLoader.Provider::get).collect(Collectors.toList());
    }

    /**
     * Validates that provided argument is not null or blank.
     *
     * @param argument     the argument checked
     * @param argumentName the name of the argument
     * @return the argument
     * @throws NullPointerException of passed argument is {@code null}
     * @throws IllegalArgumentException of passed argument is blank using {@link String#isBlank()}
     */
    @NonNull
    public static String throwArgBlank(final String argument, @NonNull final String argumentName)
            throws NullPointerException, IllegalArgumentException {
        Objects.requireNonNull(argument, argumentName + " cannot be null");
        if (argument.isBlank()) {
            throw new IllegalArgumentException(argumentName + " cannot be blank");
        }
        return argument;
    }

    /**
     * Converts elapsed nanoseconds to seconds, the base unit of every duration metric.
     *
     * @param nanos elapsed nanoseconds
     * @return elapsed seconds
     */
    public static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }
}
