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

import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.google.common.base.CharMatcher;

/**
 * Number parsing rules of the YAML core schema.
 */
public final class CoreSchema {

    /**
     * The tag prefix of the core schema types ({@code !!int}, {@code !!bool}
     * and so on, once resolved by a parser).
     */
    public static final String TAG_PREFIX = "tag:yaml.org,2002:";

    private static final Pattern DECIMAL_FLOAT =
            Pattern.compile("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    private CoreSchema() {
        // no instances for you
    }

    /**
     * Parse a float the way the core schema does: the special YAML forms
     * ({@code .inf}, {@code -.Inf}, {@code .nan}, ...) first, then a plain
     * decimal float.
     *
     * @param text the text
     * @return the value, or null if the text is not a float
     */
    @Nullable
    public static Double parseFloat(@NotNull String text) {
        switch (text) {
            case ".inf":
            case ".Inf":
            case ".INF":
            case "+.inf":
            case "+.Inf":
            case "+.INF":
                return Double.POSITIVE_INFINITY;
            case "-.inf":
            case "-.Inf":
            case "-.INF":
                return Double.NEGATIVE_INFINITY;
            case ".nan":
            case "NaN":
            case ".NAN":
                return Double.NaN;
            default:
                return parseDecimalFloat(text);
        }
    }

    /**
     * Parse a decimal float with an optional sign and exponent. The words
     * {@code inf}, {@code infinity} and {@code nan} are accepted in any case.
     * Unlike {@link Double#parseDouble(String)}, surrounding whitespace, hex
     * floats and type suffixes are rejected.
     *
     * @param text the text
     * @return the value, or null if the text is not a float
     */
    @Nullable
    public static Double parseDecimalFloat(@NotNull String text) {
        if (text.isEmpty()) {
            return null;
        }
        String unsigned = text;
        boolean negative = false;
        char first = text.charAt(0);
        if (first == '+' || first == '-') {
            unsigned = text.substring(1);
            negative = first == '-';
        }
        if ("inf".equalsIgnoreCase(unsigned) || "infinity".equalsIgnoreCase(unsigned)) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if ("nan".equalsIgnoreCase(unsigned)) {
            return Double.NaN;
        }
        if (!DECIMAL_FLOAT.matcher(text).matches()) {
            return null;
        }
        return Double.parseDouble(text);
    }

    /**
     * Parse a signed 64-bit integer. An optional leading sign is accepted,
     * whitespace and digit separators are not. Only ASCII digits count:
     * other Unicode digits (Arabic-Indic, fullwidth, ...) are rejected.
     *
     * @param text the digits
     * @param radix the radix
     * @return the value, or null if the text is not a 64-bit integer
     */
    @Nullable
    public static Long parseLong(@NotNull String text, int radix) {
        if (!CharMatcher.ascii().matchesAllOf(text)) {
            return null;
        }
        try {
            return Long.parseLong(text, radix);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Check whether a tag belongs to the core schema.
     *
     * @param tag the resolved tag, may be null
     * @return true for {@code tag:yaml.org,2002:} tags
     */
    public static boolean isCoreTag(@Nullable String tag) {
        return tag != null && tag.startsWith(TAG_PREFIX);
    }

}
