/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import io.syncbase.annotation.Immutable;
import io.syncbase.config.Field.ValidationOutput;

/**
 * An immutable representation of a configuration, with typed accessors driven by {@link Field} definitions.
 *
 * @author Syncbase Authors
 */
@Immutable
public interface Configuration {

    Pattern PASSWORD_PATTERN = Pattern.compile(".*password$", Pattern.CASE_INSENSITIVE);

    /**
     * A builder of Configuration objects.
     */
    class Builder {
        private final Properties props = new Properties();

        protected Builder() {
        }

        protected Builder(Properties props) {
            this.props.putAll(props);
        }

        public Builder with(String key, String value) {
            props.setProperty(key, value);
            return this;
        }

        public Builder with(String key, Object value) {
            return with(key, value != null ? value.toString() : null);
        }

        public Builder with(Field field, String value) {
            return with(field.name(), value);
        }

        public Builder with(Field field, Object value) {
            return with(field.name(), value);
        }

        public Builder withDefault(String key, String value) {
            if (!props.containsKey(key)) {
                props.setProperty(key, value);
            }
            return this;
        }

        public Configuration build() {
            return Configuration.from(props);
        }
    }

    static Builder create() {
        return new Builder();
    }

    /**
     * @param config the configuration to copy; may be null
     * @return a builder starting with a copy of the configuration; never null
     */
    static Builder copy(Configuration config) {
        return config != null ? new Builder(config.asProperties()) : new Builder();
    }

    static Configuration empty() {
        return from(new Properties());
    }

    /**
     * Create a configuration backed by a copy of the given properties.
     *
     * @param properties the properties; may be null
     * @return the configuration; never null
     */
    static Configuration from(Properties properties) {
        final Properties props = new Properties();
        if (properties != null) {
            props.putAll(properties);
        }
        return new Configuration() {
            @Override
            public String getString(String key) {
                return props.getProperty(key);
            }

            @Override
            public Set<String> keys() {
                return props.stringPropertyNames();
            }

            @Override
            public String toString() {
                return withMaskedPasswords().asProperties().toString();
            }
        };
    }

    /**
     * Create a configuration from a map, converting every non-null value to a string.
     *
     * @param properties the key/value pairs; may not be null
     * @return the configuration; never null
     */
    static Configuration from(Map<String, ?> properties) {
        final Properties props = new Properties();
        properties.forEach((key, value) -> {
            if (value != null) {
                props.setProperty(key, value.toString());
            }
        });
        return from(props);
    }

    static Configuration load(File file) throws IOException {
        try (InputStream stream = new FileInputStream(file)) {
            return load(stream);
        }
    }

    /**
     * Load a configuration from a stream in {@link Properties} format. The stream is not closed.
     *
     * @param stream the stream; may not be null
     * @return the configuration; never null
     * @throws IOException if the stream could not be read
     */
    static Configuration load(InputStream stream) throws IOException {
        Properties properties = new Properties();
        properties.load(stream);
        return from(properties);
    }

    /**
     * @param key the key
     * @return the value, or null if there is no such key
     */
    String getString(String key);

    /**
     * @return the keys of this configuration; never null
     */
    Set<String> keys();

    default boolean hasKey(String key) {
        return getString(key) != null;
    }

    default boolean hasKey(Field field) {
        return hasKey(field.name());
    }

    default String getString(String key, String defaultValue) {
        final String value = getString(key);
        return value != null ? value : defaultValue;
    }

    /**
     * @param field the field
     * @return the configured value, or the field's default value; may be null
     */
    default String getString(Field field) {
        return getString(field.name(), field.defaultValueAsString());
    }

    /**
     * Get the comma separated values of the field, trimmed and with empty entries removed.
     *
     * @param field the field
     * @return the values; never null but possibly empty
     */
    default List<String> getList(Field field) {
        final String value = getString(field);
        if (value == null || value.trim().isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * @param field the field
     * @return the integer value, or the field's default value
     * @throws NumberFormatException if the value or the default cannot be parsed
     */
    default int getInteger(Field field) {
        return Integer.parseInt(getString(field).trim());
    }

    /**
     * @param field the field
     * @return the long value, or the field's default value
     * @throws NumberFormatException if the value or the default cannot be parsed
     */
    default long getLong(Field field) {
        return Long.parseLong(getString(field).trim());
    }

    default boolean getBoolean(Field field) {
        final String value = getString(field);
        return value != null && Boolean.parseBoolean(value.trim());
    }

    /**
     * Get a duration from a field holding a number of milliseconds.
     *
     * @param field the field
     * @return the duration; never null
     */
    default Duration getDuration(Field field) {
        return getDuration(field, ChronoUnit.MILLIS);
    }

    default Duration getDuration(Field field, ChronoUnit unit) {
        return Duration.of(getLong(field), unit);
    }

    /**
     * Return the subset of this configuration whose keys start with the prefix.
     *
     * @param prefix the prefix, with or without a trailing {@code .}
     * @param removePrefix whether the prefix is stripped from the keys of the result
     * @return the subset; never null
     */
    default Configuration subset(String prefix, boolean removePrefix) {
        final String prefixWithSeparator = prefix.endsWith(".") ? prefix : prefix + ".";
        final Properties props = new Properties();
        for (String key : keys()) {
            if (key.startsWith(prefixWithSeparator)) {
                final String newKey = removePrefix ? key.substring(prefixWithSeparator.length()) : key;
                props.setProperty(newKey, getString(key));
            }
        }
        return from(props);
    }

    /**
     * @return a view of this configuration that masks the values of every key ending in "password"
     */
    default Configuration withMaskedPasswords() {
        final Configuration original = this;
        return new Configuration() {
            @Override
            public String getString(String key) {
                return PASSWORD_PATTERN.matcher(key).matches() ? "********" : original.getString(key);
            }

            @Override
            public Set<String> keys() {
                return original.keys();
            }

            @Override
            public String toString() {
                return asProperties().toString();
            }
        };
    }

    default Properties asProperties() {
        final Properties props = new Properties();
        for (String key : new HashSet<>(keys())) {
            final String value = getString(key);
            if (value != null) {
                props.setProperty(key, value);
            }
        }
        return props;
    }

    /**
     * Validate the supplied fields in this configuration.
     *
     * @param fields the fields
     * @param problems the consumer of problems; never null
     * @return {@code true} if all values are valid
     */
    default boolean validate(Iterable<Field> fields, ValidationOutput problems) {
        boolean valid = true;
        for (Field field : fields) {
            if (!field.validate(this, problems)) {
                valid = false;
            }
        }
        return valid;
    }

    /**
     * Validate the supplied fields in this configuration, reporting each problem as a message. Values of password
     * fields are masked in the messages.
     *
     * @param fields the fields
     * @param problems the consumer of problem messages; never null
     * @return {@code true} if all values are valid
     */
    default boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        return validate(fields, (f, v, problem) -> {
            if (v == null) {
                problems.accept(Field.validationOutput(f, problem));
            }
            else {
                String valueStr = PASSWORD_PATTERN.matcher(f.name()).matches() ? "********" : "'" + v + "'";
                problems.accept("The '" + f.name() + "' value " + valueStr + " is invalid: " + problem);
            }
        });
    }
}
