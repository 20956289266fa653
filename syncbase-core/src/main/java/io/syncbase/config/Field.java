/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.syncbase.annotation.Immutable;

/**
 * An immutable definition of a field that may appear within a {@link Configuration} instance.
 * <p>
 * A field carries its name, a human readable display name and description, its Kafka {@link ConfigDef} type, width and
 * importance, an optional default value and an optional {@link Validator}. Fields are created with
 * {@link #create(String)} and refined with the {@code with...} methods, each of which returns a new instance.
 */
@Immutable
public final class Field {

    /**
     * Create a set of fields.
     *
     * @param fields the fields to include
     * @return the field set; never null
     */
    public static Set setOf(Field... fields) {
        return new Set(List.of(fields));
    }

    /**
     * A set of fields, keyed and iterated in definition order.
     */
    @Immutable
    public static final class Set implements Iterable<Field> {
        private final Map<String, Field> fieldsByName;

        private Set(Iterable<Field> fields) {
            Map<String, Field> all = new LinkedHashMap<>();
            fields.forEach(field -> {
                if (field != null) {
                    all.put(field.name(), field);
                }
            });
            this.fieldsByName = Collections.unmodifiableMap(all);
        }

        /**
         * @param name the field name
         * @return the field with the given name, or null if there is none
         */
        public Field fieldWithName(String name) {
            return fieldsByName.get(name);
        }

        /**
         * Get a new set that contains the fields of this set and the supplied fields.
         *
         * @param fields the additional fields; may be empty
         * @return the new set; never null
         */
        public Set with(Field... fields) {
            List<Field> all = new ArrayList<>(fieldsByName.values());
            Collections.addAll(all, fields);
            return new Set(all);
        }

        public java.util.Set<String> allFieldNames() {
            return fieldsByName.keySet();
        }

        @Override
        public Iterator<Field> iterator() {
            return fieldsByName.values().iterator();
        }
    }

    /**
     * Accepts validation problems.
     */
    @FunctionalInterface
    public interface ValidationOutput {
        /**
         * Accept a problem with the given value for the field.
         *
         * @param field the field with the value; never null
         * @param value the value that is not valid
         * @param problemMessage the message describing the problem; never null
         */
        void accept(Field field, Object value, String problemMessage);
    }

    /**
     * Validates the value of a field within a configuration.
     */
    @FunctionalInterface
    public interface Validator {

        /**
         * Validate the value of the field, reporting each problem to the output.
         *
         * @param config the configuration containing the field; never null
         * @param field the field being validated; never null
         * @param problems the consumer of problems; never null
         * @return the number of problems found, or 0 if the value is valid
         */
        int validate(Configuration config, Field field, ValidationOutput problems);

        /**
         * @param other the validator to apply after this one; may be null
         * @return a validator applying both; this validator if {@code other} is null or this validator
         */
        default Validator and(Validator other) {
            if (other == null || other == this) {
                return this;
            }
            return (config, field, problems) -> validate(config, field, problems) + other.validate(config, field, problems);
        }
    }

    public static Field create(String name) {
        return new Field(name, null, null, null, null, null, null, null, false);
    }

    public static Field create(String name, String displayName, String description, String defaultValue) {
        return create(name).withType(Type.STRING).withDisplayName(displayName).withDescription(description).withDefault(defaultValue);
    }

    public static Field create(String name, String displayName, String description, int defaultValue) {
        return create(name).withType(Type.INT).withDisplayName(displayName).withDescription(description).withDefault(defaultValue);
    }

    public static Field create(String name, String displayName, String description, long defaultValue) {
        return create(name).withType(Type.LONG).withDisplayName(displayName).withDescription(description).withDefault(defaultValue);
    }

    public static Field create(String name, String displayName, String description, boolean defaultValue) {
        return create(name).withType(Type.BOOLEAN).withDisplayName(displayName).withDescription(description).withDefault(defaultValue);
    }

    /**
     * Add the fields to the given Kafka configuration definition as one group.
     *
     * @param configDef the definition to add to; may not be null
     * @param groupName the name of the group; may be null
     * @param fields the fields to add
     * @return the updated definition; never null
     */
    public static ConfigDef group(ConfigDef configDef, String groupName, Field... fields) {
        for (int i = 0; i != fields.length; ++i) {
            Field f = fields[i];
            configDef.define(f.name(), f.type(), f.defaultValue(), null, f.importance(), f.description(),
                    groupName, i + 1, f.width(), f.displayName(), Collections.emptyList(), null);
        }
        return configDef;
    }

    private final String name;
    private final String displayName;
    private final String description;
    private final Type type;
    private final Width width;
    private final Importance importance;
    private final Supplier<Object> defaultValueGenerator;
    private final Validator validator;
    private final boolean required;

    private Field(String name, String displayName, String description, Type type, Width width, Importance importance,
                  Supplier<Object> defaultValueGenerator, Validator validator, boolean required) {
        this.name = Objects.requireNonNull(name, "The field name is required");
        this.displayName = displayName;
        this.description = description;
        this.type = type != null ? type : Type.STRING;
        this.width = width != null ? width : Width.NONE;
        this.importance = importance != null ? importance : Importance.MEDIUM;
        this.defaultValueGenerator = defaultValueGenerator != null ? defaultValueGenerator : () -> null;
        this.validator = validator;
        this.required = required;
    }

    public String name() {
        return name;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public Type type() {
        return type;
    }

    public Width width() {
        return width;
    }

    public Importance importance() {
        return importance;
    }

    /**
     * @return the default value of the field; may be null
     */
    public Object defaultValue() {
        return defaultValueGenerator.get();
    }

    public String defaultValueAsString() {
        final Object defaultValue = defaultValue();
        return defaultValue != null ? defaultValue.toString() : null;
    }

    public Validator validator() {
        return validator;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Validate the value of this field in the configuration.
     *
     * @param config the configuration; may not be null
     * @param problems the consumer of problems; may not be null
     * @return {@code true} if the value is valid
     */
    public boolean validate(Configuration config, ValidationOutput problems) {
        int errors = 0;
        final Validator typeValidator = validatorForType(type);
        if (typeValidator != null) {
            errors += typeValidator.validate(config, this, problems);
        }
        if (validator != null) {
            errors += validator.validate(config, this, problems);
        }
        return errors == 0;
    }

    public Field withDisplayName(String displayName) {
        return new Field(name, displayName, description, type, width, importance, defaultValueGenerator, validator, required);
    }

    public Field withDescription(String description) {
        return new Field(name, displayName, description, type, width, importance, defaultValueGenerator, validator, required);
    }

    public Field withType(Type type) {
        return new Field(name, displayName, description, type, width, importance, defaultValueGenerator, validator, required);
    }

    public Field withWidth(Width width) {
        return new Field(name, displayName, description, type, width, importance, defaultValueGenerator, validator, required);
    }

    public Field withImportance(Importance importance) {
        return new Field(name, displayName, description, type, width, importance, defaultValueGenerator, validator, required);
    }

    public Field withDefault(String defaultValue) {
        return new Field(name, displayName, description, type, width, importance, () -> defaultValue, validator, required);
    }

    public Field withDefault(int defaultValue) {
        return new Field(name, displayName, description, type, width, importance, () -> defaultValue, validator, required);
    }

    public Field withDefault(long defaultValue) {
        return new Field(name, displayName, description, type, width, importance, () -> defaultValue, validator, required);
    }

    public Field withDefault(boolean defaultValue) {
        return new Field(name, displayName, description, type, width, importance, () -> defaultValue, validator, required);
    }

    /**
     * @param validators the validators to add; they are applied after any existing validator
     * @return the new field; never null
     */
    public Field withValidation(Validator... validators) {
        Validator combined = validator;
        for (Validator v : validators) {
            combined = combined == null ? v : combined.and(v);
        }
        return new Field(name, displayName, description, type, width, importance, defaultValueGenerator, combined, required);
    }

    /**
     * @return a copy of this field that fails validation when no value is present
     */
    public Field required() {
        return new Field(name, displayName, description, type, width, importance, defaultValueGenerator, validator, true)
                .withValidation(Field::isRequired);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Field) {
            return this.name.equals(((Field) obj).name);
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }

    static Validator validatorForType(Type type) {
        switch (type) {
            case BOOLEAN:
                return Field::isBoolean;
            case INT:
                return Field::isInteger;
            case LONG:
                return Field::isLong;
            default:
                return null;
        }
    }

    public static int isRequired(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value != null && !value.trim().isEmpty()) {
            return 0;
        }
        problems.accept(field, value, "A value is required");
        return 1;
    }

    public static int isBoolean(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null
                || value.trim().equalsIgnoreCase(Boolean.TRUE.toString())
                || value.trim().equalsIgnoreCase(Boolean.FALSE.toString())) {
            return 0;
        }
        problems.accept(field, value, "Either 'true' or 'false' is expected");
        return 1;
    }

    public static int isInteger(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            problems.accept(field, value, "An integer is expected");
            return 1;
        }
        return 0;
    }

    public static int isPositiveInteger(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            if (Integer.parseInt(value.trim()) > 0) {
                return 0;
            }
        }
        catch (NumberFormatException e) {
            // reported below
        }
        problems.accept(field, value, "A positive, non-zero integer value is expected");
        return 1;
    }

    public static int isLong(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            Long.parseLong(value.trim());
        }
        catch (NumberFormatException e) {
            problems.accept(field, value, "A long value is expected");
            return 1;
        }
        return 0;
    }

    public static int isPositiveLong(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            if (Long.parseLong(value.trim()) > 0) {
                return 0;
            }
        }
        catch (NumberFormatException e) {
            // reported below
        }
        problems.accept(field, value, "A positive, non-zero long value is expected");
        return 1;
    }

    public static int isNonNegativeLong(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            if (Long.parseLong(value.trim()) >= 0) {
                return 0;
            }
        }
        catch (NumberFormatException e) {
            // reported below
        }
        problems.accept(field, value, "A non-negative long value is expected");
        return 1;
    }

    public static String validationOutput(Field field, String problem) {
        return String.format("The '%s' value is invalid: %s", field.name(), problem);
    }
}
