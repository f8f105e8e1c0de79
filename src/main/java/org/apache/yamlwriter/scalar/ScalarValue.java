/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.yamlwriter.scalar;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A typed YAML scalar. Instances are immutable.
 * <p>
 * Real numbers keep the text they were created from, so that a value read
 * from a document is written back exactly as it was (for example
 * {@code 1.50} or {@code -.Inf}).
 */
public final class ScalarValue {

    /**
     * The kind of a scalar.
     */
    public enum Type {
        REAL,
        STRING,
        BOOLEAN,
        INTEGER,
        NULL,
        /**
         * An explicit type tag did not match the text.
         */
        BAD_VALUE
    }

    private static final ScalarValue NULL = new ScalarValue(Type.NULL, null, 0L);
    private static final ScalarValue BAD_VALUE = new ScalarValue(Type.BAD_VALUE, null, 0L);
    private static final ScalarValue TRUE = new ScalarValue(Type.BOOLEAN, null, 1L);
    private static final ScalarValue FALSE = new ScalarValue(Type.BOOLEAN, null, 0L);

    private final Type type;

    /**
     * The text of REAL and STRING values, null otherwise.
     */
    private final String text;

    /**
     * The value of INTEGER values; 1 or 0 for BOOLEAN values.
     */
    private final long number;

    private ScalarValue(Type type, String text, long number) {
        this.type = type;
        this.text = text;
        this.number = number;
    }

    public static ScalarValue ofString(@NotNull String text) {
        return new ScalarValue(Type.STRING, checkNotNull(text), 0L);
    }

    public static ScalarValue ofInteger(long value) {
        return new ScalarValue(Type.INTEGER, null, value);
    }

    public static ScalarValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Create a real number from its textual form.
     *
     * @param text the text, which must be a core schema float
     * @return the value
     * @throws IllegalArgumentException if the text is not a float
     */
    public static ScalarValue ofReal(@NotNull String text) {
        checkArgument(CoreSchema.parseFloat(checkNotNull(text)) != null, "Not a float: %s", text);
        return new ScalarValue(Type.REAL, text, 0L);
    }

    /**
     * Create a real number. Infinities and NaN use the YAML spelling
     * ({@code .inf}, {@code -.inf}, {@code .nan}).
     *
     * @param value the value
     * @return the scalar
     */
    public static ScalarValue ofReal(double value) {
        String text;
        if (Double.isNaN(value)) {
            text = ".nan";
        } else if (value == Double.POSITIVE_INFINITY) {
            text = ".inf";
        } else if (value == Double.NEGATIVE_INFINITY) {
            text = "-.inf";
        } else {
            text = Double.toString(value);
        }
        return new ScalarValue(Type.REAL, text, 0L);
    }

    public static ScalarValue nullValue() {
        return NULL;
    }

    public static ScalarValue badValue() {
        return BAD_VALUE;
    }

    /**
     * Resolve the type of untagged plain text. Conversion never fails: text
     * that is nothing else is a string.
     * <p>
     * The order is: {@code 0x} hexadecimal, {@code 0o} octal and
     * {@code +} prefixed decimal integers, then {@code ~} and {@code null},
     * {@code true} and {@code false}, decimal integers, floats. Text that
     * looks like an integer is never a real number.
     *
     * @param text the text
     * @return the value
     */
    public static ScalarValue fromString(@NotNull String text) {
        checkNotNull(text);
        Long prefixed = null;
        if (text.startsWith("0x")) {
            prefixed = CoreSchema.parseLong(text.substring(2), 16);
        } else if (text.startsWith("0o")) {
            prefixed = CoreSchema.parseLong(text.substring(2), 8);
        } else if (text.startsWith("+")) {
            prefixed = CoreSchema.parseLong(text.substring(1), 10);
        }
        if (prefixed != null) {
            return ofInteger(prefixed);
        }
        switch (text) {
            case "~":
            case "null":
                return NULL;
            case "true":
                return TRUE;
            case "false":
                return FALSE;
            default:
                Long integer = CoreSchema.parseLong(text, 10);
                if (integer != null) {
                    return ofInteger(integer);
                }
                if (CoreSchema.parseFloat(text) != null) {
                    return new ScalarValue(Type.REAL, text, 0L);
                }
                return new ScalarValue(Type.STRING, text, 0L);
        }
    }

    /**
     * Convert the data of a parsed scalar. Quoted and block scalars are
     * always strings. A plain scalar with a core schema tag is converted to
     * the tagged type, or to {@link Type#BAD_VALUE} if the text does not
     * match it. Untagged plain scalars are resolved with
     * {@link #fromString(String)}.
     *
     * @param text the scalar text
     * @param style the style of the scalar in the source
     * @param tag the resolved tag, or null
     * @return the value
     */
    public static ScalarValue fromScalarEvent(@NotNull String text, @NotNull ScalarStyle style,
            @Nullable String tag) {
        checkNotNull(text);
        if (!style.isPlain()) {
            return ofString(text);
        }
        if (tag == null) {
            return fromString(text);
        }
        if (!CoreSchema.isCoreTag(tag)) {
            return ofString(text);
        }
        switch (tag.substring(CoreSchema.TAG_PREFIX.length())) {
            case "bool":
                if ("true".equals(text)) {
                    return TRUE;
                } else if ("false".equals(text)) {
                    return FALSE;
                }
                return BAD_VALUE;
            case "int": {
                Long value = CoreSchema.parseLong(text, 10);
                return value == null ? BAD_VALUE : ofInteger(value);
            }
            case "float":
                return CoreSchema.parseFloat(text) == null
                        ? BAD_VALUE : new ScalarValue(Type.REAL, text, 0L);
            case "null":
                return "~".equals(text) || "null".equals(text) ? NULL : BAD_VALUE;
            default:
                return ofString(text);
        }
    }

    @NotNull
    public Type getType() {
        return type;
    }

    /**
     * The text of a string or real number.
     *
     * @return the text
     * @throws IllegalStateException for other types
     */
    @NotNull
    public String getText() {
        checkState(text != null, "No text for %s value", type);
        return text;
    }

    /**
     * @throws IllegalStateException if this is not an integer
     */
    public long getLong() {
        checkState(type == Type.INTEGER, "Not an integer: %s", type);
        return number;
    }

    /**
     * @throws IllegalStateException if this is not a boolean
     */
    public boolean getBoolean() {
        checkState(type == Type.BOOLEAN, "Not a boolean: %s", type);
        return number != 0;
    }

    /**
     * @throws IllegalStateException if this is not a real number
     */
    public double getDouble() {
        checkState(type == Type.REAL, "Not a real number: %s", type);
        return CoreSchema.parseFloat(text);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ScalarValue)) {
            return false;
        }
        ScalarValue other = (ScalarValue) obj;
        return type == other.type && number == other.number && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, number);
    }

    /**
     * The canonical rendering: the text of strings and real numbers,
     * {@code true}/{@code false}, decimal integers, and {@code ~} for null
     * and bad values.
     */
    @Override
    public String toString() {
        switch (type) {
            case REAL:
            case STRING:
                return text;
            case BOOLEAN:
                return number != 0 ? "true" : "false";
            case INTEGER:
                return Long.toString(number);
            case NULL:
            case BAD_VALUE:
                return "~";
            default:
                throw new IllegalStateException("Unknown scalar type " + type);
        }
    }

}
