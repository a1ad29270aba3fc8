// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.regex.Pattern;

/**
 * Utility class for metrics-related operations.
 */
public final class MetricUtils {

    /** Regex for validating metric names. */
    public static final String METRIC_NAME_REGEX = "^[a-zA-Z_:][a-zA-Z0-9_:]*$";

    /** Regex for validating label names. */
    public static final String LABEL_NAME_REGEX = "^[a-zA-Z_][a-zA-Z0-9_]*$";

    private static final Pattern METRIC_NAME_PATTERN = Pattern.compile(METRIC_NAME_REGEX);
    private static final Pattern LABEL_NAME_PATTERN = Pattern.compile(LABEL_NAME_REGEX);

    // doubles with a larger magnitude lose integer precision, so they are printed in scientific notation
    private static final double MAX_PLAIN_INTEGRAL = 1e15;

    private MetricUtils() {}

    /**
     * Validates that the provided metric name adheres to the required character set. <br>
     * Pattern to validate is: {@value #METRIC_NAME_REGEX}
     *
     * @param metricName the name to validate
     * @return the validated name
     * @throws NullPointerException if metric name is {@code null}
     * @throws IllegalArgumentException if metric name is blank or contains invalid characters
     */
    @NonNull
    public static String validateMetricNameCharacters(String metricName) {
        return validateNameCharacters(METRIC_NAME_PATTERN, metricName);
    }

    /**
     * Validates that the provided label name adheres to the required character set. <br>
     * Pattern to validate is: {@value #LABEL_NAME_REGEX}
     *
     * @param labelName the label name to validate
     * @return the validated name
     * @throws NullPointerException if label name is {@code null}
     * @throws IllegalArgumentException if label name is blank or contains invalid characters
     */
    @NonNull
    public static String validateLabelNameCharacters(String labelName) {
        return validateNameCharacters(LABEL_NAME_PATTERN, labelName);
    }

    private static String validateNameCharacters(Pattern pattern, String name) {
        throwArgBlank(name, "name");
        if (!pattern.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Name contains illegal character: " + name + ". Required pattern is " + pattern.pattern());
        }
        return name;
    }

    /**
     * Validates that provided argument is not null or blank.
     *
     * @param argument     the argument checked
     * @param argumentName the name of the argument
     * @return the argument
     * @throws NullPointerException if passed argument is {@code null}
     * @throws IllegalArgumentException if passed argument is blank using {@link String#isBlank()}
     */
    @NonNull
    public static String throwArgBlank(final String argument, @NonNull final String argumentName) {
        Objects.requireNonNull(argument, argumentName + " cannot be null");
        if (argument.isBlank()) {
            throw new IllegalArgumentException(argumentName + " cannot be blank");
        }
        return argument;
    }

    /**
     * Escape backslash {@code \}, double quote {@code "} and newline {@code \n} characters in a label value.
     *
     * @param value the label value to escape
     * @return the escaped value
     */
    @NonNull
    public static String escapeLabelValue(@NonNull String value) {
        if (value.indexOf('\\') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0) {
            return value;
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    /**
     * Escape backslash {@code \} and newline {@code \n} characters in help text.
     *
     * @param help the help text to escape
     * @return the escaped text
     */
    @NonNull
    public static String escapeHelp(@NonNull String help) {
        if (help.indexOf('\\') < 0 && help.indexOf('\n') < 0) {
            return help;
        }
        return help.replace("\\", "\\\\").replace("\n", "\\n");
    }

    /**
     * Formats a {@code double} sample value. Integral values are printed without a fraction,
     * infinities as {@code +Inf}/{@code -Inf}.
     *
     * @param value the value to format
     * @return the textual value
     */
    @NonNull
    public static String formatValue(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        } else if (value == Double.POSITIVE_INFINITY) {
            return "+Inf";
        } else if (value == Double.NEGATIVE_INFINITY) {
            return "-Inf";
        } else if (value == Math.rint(value) && Math.abs(value) < MAX_PLAIN_INTEGRAL) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Loads implementations of the specified class using Java's ServiceLoader mechanism.
     *
     * @param serviceType the class of the implementations to load
     * @param <T>         the type of the implementation
     * @return a list of loaded implementations
     */
    @NonNull
    public static <T> List<T> load(@NonNull Class<T> serviceType) {
        ServiceLoader<T> serviceLoader = ServiceLoader.load(serviceType);
        return serviceLoader.stream().map(ServiceLoader.Provider::get).toList();
    }
}
