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

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;

import org.apache.yamlwriter.scalar.CoreSchema;
import org.apache.yamlwriter.scalar.ScalarValue;
import org.jetbrains.annotations.NotNull;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;

/**
 * Decides how scalars are written: bare, double-quoted, or as a literal
 * block.
 */
public final class ScalarFormatter {

    /**
     * Characters that may not start a plain scalar.
     */
    private static final CharMatcher INDICATOR = CharMatcher.anyOf("&*?|-<>=!%@");

    /**
     * Characters that may not appear anywhere in a plain scalar.
     */
    private static final CharMatcher SPECIAL = CharMatcher.anyOf(":{}[],#`\"'\\")
            .or(CharMatcher.inRange('\u0000', '\u0006'))
            .or(CharMatcher.anyOf("\t\n\r"))
            .or(CharMatcher.inRange('\u000e', '\u001a'))
            .or(CharMatcher.inRange('\u001c', '\u001f'))
            .precomputed();

    /**
     * Words that a YAML 1.1 or 1.2 reader may take as a boolean or null.
     * The single letters y, Y, n and N are not listed: like libyaml and
     * PyYAML, readers treat them as strings.
     */
    private static final ImmutableSet<String> RESERVED = ImmutableSet.of(
            "yes", "Yes", "YES", "no", "No", "NO",
            "True", "TRUE", "true", "False", "FALSE", "false",
            "on", "On", "ON", "off", "Off", "OFF",
            "null", "Null", "NULL", "~");

    private ScalarFormatter() {
        // no instances for you
    }

    /**
     * Check whether a string has to be quoted to be read back as the same
     * string: because it is empty, has surrounding spaces, starts with an
     * indicator, contains a flow or comment character, a quote or a control
     * character, or would be read as a boolean, null or number.
     *
     * @param s the string
     * @return true if the string must be quoted
     */
    public static boolean needsQuoting(@NotNull String s) {
        return s.isEmpty()
                || s.charAt(0) == ' '
                || s.charAt(s.length() - 1) == ' '
                || INDICATOR.matches(s.charAt(0))
                || SPECIAL.matchesAnyOf(s)
                || RESERVED.contains(s)
                || s.startsWith(".")
                || s.startsWith("0x")
                || s.startsWith("0o")
                || CoreSchema.parseLong(s, 10) != null
                || CoreSchema.parseDecimalFloat(s) != null;
    }

    /**
     * Write a string in double quotes. Quotes, backslashes, C0 control
     * characters and DEL are escaped; everything else is copied as is.
     *
     * @param out the output
     * @param s the string
     * @throws IOException if the output fails
     */
    public static void writeQuoted(@NotNull Appendable out, @NotNull String s) throws IOException {
        out.append('"');
        int start = 0;
        int length = s.length();
        for (int i = 0; i < length; i++) {
            char ch = s.charAt(i);
            String escaped;
            switch (ch) {
                case '"':
                    escaped = "\\\"";
                    break;
                case '\\':
                    escaped = "\\\\";
                    break;
                case '\b':
                    escaped = "\\b";
                    break;
                case '\t':
                    escaped = "\\t";
                    break;
                case '\n':
                    escaped = "\\n";
                    break;
                case '\f':
                    escaped = "\\f";
                    break;
                case '\r':
                    escaped = "\\r";
                    break;
                default:
                    if (ch < ' ' || ch == '\u007f') {
                        escaped = String.format("\\u%04x", (int) ch);
                    } else {
                        continue;
                    }
            }
            if (start < i) {
                out.append(s, start, i);
            }
            out.append(escaped);
            start = i + 1;
        }
        if (start < length) {
            out.append(s, start, length);
        }
        out.append('"');
    }

    /**
     * Check whether a string can be written as a literal block scalar
     * ({@code |} or {@code |-}) and read back unchanged. The characters must
     * all be printable (CR, NEL, the Unicode line separators and the byte
     * order mark are not allowed), no line may consist of whitespace only,
     * the first non-empty line may not start with a space (the reader would
     * take it as indentation), and the string may not end with more than one
     * line feed.
     *
     * @param s the string
     * @return true if a literal block can represent the string
     */
    public static boolean isValidLiteralBlock(@NotNull String s) {
        if (s.endsWith("\n\n")) {
            return false;
        }
        int length = s.length();
        boolean hasText = false;
        boolean lineHasText = false;
        int lineLength = 0;
        for (int i = 0; i < length; i++) {
            char ch = s.charAt(i);
            if (ch == '\n') {
                if (lineLength > 0 && !lineHasText) {
                    return false;
                }
                lineLength = 0;
                lineHasText = false;
                continue;
            }
            if (Character.isHighSurrogate(ch)) {
                if (i + 1 >= length || !Character.isLowSurrogate(s.charAt(i + 1))) {
                    return false;
                }
                i++;
            } else if (!isPrintable(ch)) {
                return false;
            }
            if (lineLength == 0 && ch == ' ' && !hasText) {
                return false;
            }
            lineLength++;
            if (ch != ' ' && ch != '\t') {
                lineHasText = true;
                hasText = true;
            }
        }
        if (lineLength > 0 && !lineHasText) {
            return false;
        }
        return hasText;
    }

    private static boolean isPrintable(char ch) {
        return ch == '\t'
                || (ch >= 0x20 && ch <= 0x7e)
                || (ch >= 0xa0 && ch <= 0xd7ff && ch != 0x2028 && ch != 0x2029)
                || (ch >= 0xe000 && ch <= 0xfffd && ch != 0xfeff);
    }

    /**
     * Write a scalar at the current position of the writer.
     *
     * @param writer the writer
     * @param value the value
     * @param key whether the scalar is a mapping key (keys are never written
     *            as literal blocks)
     * @throws IOException if the output fails
     */
    static void writeScalar(@NotNull YamlWriter writer, @NotNull ScalarValue value, boolean key)
            throws IOException {
        checkNotNull(value);
        switch (value.getType()) {
            case STRING:
                String s = value.getText();
                if (!key && writer.isMultilineStrings() && s.indexOf('\n') >= 0 && isValidLiteralBlock(s)) {
                    writeLiteralBlock(writer, s);
                } else if (needsQuoting(s)) {
                    writeQuoted(writer.out(), s);
                } else {
                    writer.write(s);
                }
                break;
            case REAL:
            case BOOLEAN:
            case INTEGER:
            case NULL:
            case BAD_VALUE:
                writer.write(value.toString());
                break;
            default:
                throw new IllegalStateException("Unknown scalar type " + value.getType());
        }
    }

    private static void writeLiteralBlock(YamlWriter writer, String s) throws IOException {
        writer.write(s.endsWith("\n") ? "|" : "|-");
        writer.indentMore();
        int start = 0;
        int length = s.length();
        while (start < length) {
            int end = s.indexOf('\n', start);
            if (end < 0) {
                end = length;
            }
            writer.newline();
            if (start < end) {
                writer.writeIndent();
                writer.out().append(s, start, end);
            }
            start = end + 1;
        }
        writer.indentLess();
    }

}
