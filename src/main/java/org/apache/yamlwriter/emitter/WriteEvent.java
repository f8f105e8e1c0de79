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
import static com.google.common.base.Preconditions.checkState;

import java.util.Objects;

import org.apache.yamlwriter.scalar.ScalarValue;
import org.jetbrains.annotations.NotNull;

/**
 * One unit of the structure of a YAML stream, as consumed by the
 * {@link YamlWriter}. Events carry no anchor or tag information.
 */
public final class WriteEvent {

    /**
     * The event kinds.
     */
    public enum Type {
        /**
         * Reserved for internal use; never accepted by the writer.
         */
        NOTHING("Nothing"),
        STREAM_START("StreamStart"),
        STREAM_END("StreamEnd"),
        DOCUMENT_START("DocumentStart"),
        DOCUMENT_END("DocumentEnd"),
        SEQUENCE_START("SequenceStart"),
        SEQUENCE_END("SequenceEnd"),
        MAPPING_START("MappingStart"),
        MAPPING_END("MappingEnd"),
        SCALAR("Scalar");

        private final String displayName;

        Type(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    public static final WriteEvent NOTHING = new WriteEvent(Type.NOTHING, null);
    public static final WriteEvent STREAM_START = new WriteEvent(Type.STREAM_START, null);
    public static final WriteEvent STREAM_END = new WriteEvent(Type.STREAM_END, null);
    public static final WriteEvent DOCUMENT_START = new WriteEvent(Type.DOCUMENT_START, null);
    public static final WriteEvent DOCUMENT_END = new WriteEvent(Type.DOCUMENT_END, null);
    public static final WriteEvent SEQUENCE_START = new WriteEvent(Type.SEQUENCE_START, null);
    public static final WriteEvent SEQUENCE_END = new WriteEvent(Type.SEQUENCE_END, null);
    public static final WriteEvent MAPPING_START = new WriteEvent(Type.MAPPING_START, null);
    public static final WriteEvent MAPPING_END = new WriteEvent(Type.MAPPING_END, null);

    private final Type type;
    private final ScalarValue value;

    private WriteEvent(Type type, ScalarValue value) {
        this.type = type;
        this.value = value;
    }

    public static WriteEvent scalar(@NotNull ScalarValue value) {
        return new WriteEvent(Type.SCALAR, checkNotNull(value));
    }

    /**
     * A string scalar, written as is (never type-resolved).
     */
    public static WriteEvent string(@NotNull String text) {
        return scalar(ScalarValue.ofString(text));
    }

    /**
     * A scalar whose type is resolved from the text, the way an untagged
     * plain scalar would be.
     */
    public static WriteEvent plain(@NotNull String text) {
        return scalar(ScalarValue.fromString(text));
    }

    @NotNull
    public Type getType() {
        return type;
    }

    /**
     * @return the scalar value
     * @throws IllegalStateException if this is not a scalar event
     */
    @NotNull
    public ScalarValue getValue() {
        checkState(type == Type.SCALAR, "Not a scalar event: %s", type);
        return value;
    }

    /**
     * Whether this event opens a node: a collection start or a scalar.
     */
    public boolean isNodeStart() {
        return type == Type.SEQUENCE_START || type == Type.MAPPING_START || type == Type.SCALAR;
    }

    /**
     * Whether this event opens a sequence or a mapping.
     */
    public boolean isCollectionStart() {
        return type == Type.SEQUENCE_START || type == Type.MAPPING_START;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof WriteEvent)) {
            return false;
        }
        WriteEvent other = (WriteEvent) obj;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    /**
     * The event name, or the rendered value for scalar events.
     */
    @Override
    public String toString() {
        return type == Type.SCALAR ? value.toString() : type.getDisplayName();
    }

}
