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
package org.apache.yamlwriter.emitter;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.Function;
import java.util.function.Predicate;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Output settings of a {@link YamlWriter}.
 * <p>
 * The defaults can be changed with system properties:
 * <ul>
 * <li>{@value #INDENT}: spaces per indentation level (default 2)
 * <li>{@value #COMPACT}: compact inline notation for nested collections
 * (default true)
 * <li>{@value #MULTILINE_STRINGS}: literal block style for multi-line
 * strings (default true)
 * <li>{@value #OMIT_FIRST_DOC_SEPARATOR}: no {@code ---} before the first
 * document (default true)
 * </ul>
 */
public class WriterSettings {

    private static final Logger LOG = LoggerFactory.getLogger(WriterSettings.class);

    public static final String INDENT = "yamlwriter.indent";
    public static final String COMPACT = "yamlwriter.compact";
    public static final String MULTILINE_STRINGS = "yamlwriter.multilineStrings";
    public static final String OMIT_FIRST_DOC_SEPARATOR = "yamlwriter.omitFirstDocSeparator";

    static final int DEFAULT_INDENT = 2;

    private int indent = DEFAULT_INDENT;
    private boolean compact = true;
    private boolean multilineStrings = true;
    private boolean omitFirstDocSeparator = true;

    /**
     * Settings with the built-in defaults, ignoring system properties.
     */
    public WriterSettings() {
    }

    public WriterSettings(@NotNull WriterSettings other) {
        checkNotNull(other);
        this.indent = other.indent;
        this.compact = other.compact;
        this.multilineStrings = other.multilineStrings;
        this.omitFirstDocSeparator = other.omitFirstDocSeparator;
    }

    /**
     * Settings with the defaults, overridden by system properties where set.
     *
     * @return new settings
     */
    public static WriterSettings defaults() {
        return defaults(System::getProperty);
    }

    static WriterSettings defaults(@NotNull Function<String, String> propertyReader) {
        WriterSettings s = new WriterSettings();
        s.indent = read(propertyReader, INDENT, DEFAULT_INDENT, Integer::valueOf, i -> i > 0);
        s.compact = read(propertyReader, COMPACT, s.compact, Boolean::valueOf, b -> true);
        s.multilineStrings = read(propertyReader, MULTILINE_STRINGS, s.multilineStrings, Boolean::valueOf, b -> true);
        s.omitFirstDocSeparator = read(propertyReader, OMIT_FIRST_DOC_SEPARATOR, s.omitFirstDocSeparator,
                Boolean::valueOf, b -> true);
        return s;
    }

    private static <T> T read(Function<String, String> propertyReader, String name, T defaultValue,
            Function<String, T> parser, Predicate<T> validator) {
        String value = propertyReader.apply(name);
        if (value == null) {
            LOG.trace("System property {} not set", name);
            return defaultValue;
        }
        LOG.trace("System property {} set to '{}'", name, value);
        T result = defaultValue;
        try {
            T v = parser.apply(value.trim());
            if (validator.test(v)) {
                result = v;
            } else {
                LOG.error("Ignoring invalid value '{}' for system property {}", value, name);
            }
        } catch (NumberFormatException e) {
            LOG.error("Ignoring malformed value '{}' for system property {}", value, name);
        }
        if (!result.equals(defaultValue)) {
            LOG.info("System property {} found to be '{}'", name, result);
        }
        return result;
    }

    public int getIndent() {
        return indent;
    }

    /**
     * Set the number of spaces per indentation level.
     *
     * @param indent the width, at least 1
     * @return this
     */
    public WriterSettings setIndent(int indent) {
        checkArgument(indent > 0, "Indentation must be positive: %s", indent);
        this.indent = indent;
        return this;
    }

    public boolean isCompact() {
        return compact;
    }

    /**
     * Use compact inline notation: a collection nested directly in a
     * sequence item (or a complex key) starts on the line of its parent's
     * indicator ({@code - - a}) instead of on a new line.
     *
     * @param compact whether to use compact notation
     * @return this
     */
    public WriterSettings setCompact(boolean compact) {
        this.compact = compact;
        return this;
    }

    public boolean isMultilineStrings() {
        return multilineStrings;
    }

    /**
     * Write strings containing line feeds in literal block style
     * ({@code |}) where possible.
     *
     * @param multilineStrings whether to use literal blocks
     * @return this
     */
    public WriterSettings setMultilineStrings(boolean multilineStrings) {
        this.multilineStrings = multilineStrings;
        return this;
    }

    public boolean isOmitFirstDocSeparator() {
        return omitFirstDocSeparator;
    }

    /**
     * Do not write the document start marker ({@code ---}) for the first
     * document of the stream.
     *
     * @param omitFirstDocSeparator whether to omit the first marker
     * @return this
     */
    public WriterSettings setOmitFirstDocSeparator(boolean omitFirstDocSeparator) {
        this.omitFirstDocSeparator = omitFirstDocSeparator;
        return this;
    }

    @Override
    public String toString() {
        return "WriterSettings{indent=" + indent + ", compact=" + compact + ", multilineStrings=" + multilineStrings
                + ", omitFirstDocSeparator=" + omitFirstDocSeparator + "}";
    }

}
