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

import java.io.IOException;

import org.jetbrains.annotations.NotNull;

import com.google.common.base.Strings;

/**
 * A state of the writer: what it is waiting for at one level of nesting.
 * <p>
 * The writer keeps a stack of frames instead of recursing over the document
 * structure, so that it can be driven one event at a time. A frame is popped
 * before it runs, and running it may push zero, one or two frames. Frames
 * are immutable; the ones without state are shared.
 * <p>
 * Each frame accepts a fixed set of events and rejects everything else with
 * a {@link WriterStateException}.
 */
abstract class StackFrame {

    private static final StackFrame START = new Start();
    private static final StackFrame END = new End();
    private static final StackFrame DOCUMENT = new Document();
    private static final StackFrame DOCUMENT_END = new DocumentEnd();

    private StackFrame() {
    }

    /**
     * Process an event.
     *
     * @param writer the writer, to write output and push frames
     * @param event the event
     * @throws IOException if the output fails
     * @throws WriterStateException if the event is not valid here
     */
    abstract void run(@NotNull YamlWriter writer, @NotNull WriteEvent event)
            throws IOException, WriterStateException;

    /**
     * @return the frame of a new writer
     */
    static StackFrame start() {
        return START;
    }

    /**
     * @return true for the frame after the end of the stream
     */
    boolean isEnd() {
        return false;
    }

    /**
     * Write a node in document or mapping key position. A scalar is written
     * at the current position.
     */
    private static void runNode(YamlWriter writer, WriteEvent event, boolean key) throws IOException {
        switch (event.getType()) {
            case SEQUENCE_START:
                writer.push(Sequence.FIRST);
                break;
            case MAPPING_START:
                writer.push(Mapping.FIRST);
                break;
            case SCALAR:
                ScalarFormatter.writeScalar(writer, event.getValue(), key);
                break;
            default:
                // callers only pass node events
                throw new IllegalArgumentException("Not a node event: " + event);
        }
    }

    /**
     * Write a node after an indicator ({@code -}, {@code ?} or {@code :}).
     * Whether a collection starts on the same line is decided by the
     * collection's first event.
     */
    private static void runValue(YamlWriter writer, WriteEvent event, boolean inline) throws IOException {
        switch (event.getType()) {
            case SEQUENCE_START:
                writer.push(inline ? ValueSequence.INLINE : ValueSequence.BLOCK);
                break;
            case MAPPING_START:
                writer.push(inline ? ValueMapping.INLINE : ValueMapping.BLOCK);
                break;
            case SCALAR:
                writer.write(" ");
                ScalarFormatter.writeScalar(writer, event.getValue(), false);
                break;
            default:
                // callers only pass node events
                throw new IllegalArgumentException("Not a node event: " + event);
        }
    }

    /**
     * Write the separator before the first entry of a nested collection.
     * A collection placed inline after {@code -} or {@code ?} is padded so
     * that its first entry starts at the column of the entries that follow
     * it; with an indent of 1 there is no room for that, and it starts on a
     * new line instead.
     */
    private static void startNested(YamlWriter writer, boolean inline, boolean empty) throws IOException {
        int indent = writer.getIndent();
        if (empty) {
            writer.write(" ");
        } else if (inline && writer.isCompact() && indent > 1) {
            writer.write(Strings.repeat(" ", indent - 1));
        } else {
            writer.newline();
            writer.indentMore();
            writer.writeIndent();
            writer.indentLess();
        }
    }

    private static final class Start extends StackFrame {

        @Override
        void run(YamlWriter writer, WriteEvent event) throws WriterStateException {
            switch (event.getType()) {
                case STREAM_START:
                    writer.push(DocumentList.FIRST);
                    break;
                default:
                    throw new WriterStateException(WriterState.START, event);
            }
        }

        @Override
        public String toString() {
            return "Start";
        }
    }

    private static final class End extends StackFrame {

        @Override
        void run(YamlWriter writer, WriteEvent event) throws WriterStateException {
            throw new WriterStateException(WriterState.END, event);
        }

        @Override
        boolean isEnd() {
            return true;
        }

        @Override
        public String toString() {
            return "End";
        }
    }

    private static final class DocumentList extends StackFrame {

        static final DocumentList FIRST = new DocumentList(true);
        static final DocumentList NEXT = new DocumentList(false);

        private final boolean first;

        private DocumentList(boolean first) {
            this.first = first;
        }

        @Override
        void run(YamlWriter writer, WriteEvent event) throws IOException, WriterStateException {
            switch (event.getType()) {
                case DOCUMENT_START:
                    if (!first) {
                        writer.newline();
                    }
                    if (!first || !writer.isOmitFirstDocSeparator()) {
                        writer.write("---");
                        writer.newline();
                    }
                    writer.push(NEXT);
                    writer.push(DOCUMENT);
                    break;
                case STREAM_END:
                    writer.push(END);
                    break;
                default:
                    throw new WriterStateException(WriterState.DOCUMENT_LIST, event);
            }
        }

        @Override
        public String toString() {
            return "DocumentList(first=" + first + ")";
        }
    }

    private static final class Document extends StackFrame {

        @Override
        void run(YamlWriter writer, WriteEvent event) throws IOException, WriterStateException {
            switch (event.getType()) {
                case SEQUENCE_START:
                case MAPPING_START:
                case SCALAR:
                    writer.push(DOCUMENT_END);
                    runNode(writer, event, false);
                    break;
                case DOCUMENT_END:
                    // empty document
                    break;
                default:
                    throw new WriterStateException(WriterState.DOCUMENT, event);
            }
        }

        @Override
        public String toString() {
            return "Document";
        }
    }

    private static final class DocumentEnd extends StackFrame {

        @Override
        void run(YamlWriter writer, WriteEvent event) throws WriterStateException {
            switch (event.getType()) {
                case DOCUMENT_END:
                    break;
                default:
                    throw new WriterStateException(WriterState.DOCUMENT_END, event);
            }
        }

        @Override
        public String toString() {
            return "DocumentEnd";
        }
    }

    private static final class Sequence extends StackFrame {

        static final Sequence FIRST = new Sequence(true);
        static final Sequence NEXT = new Sequence(false);

        private final boolean first;

        private Sequence(boolean first) {
            this.first = first;
        }

        @Override
        void run(YamlWriter writer, WriteEvent event) throws IOException, WriterStateException {
            switch (event.getType()) {
                case SEQUENCE_START:
                case MAPPING_START:
                case SCALAR:
                    if (first) {
                        writer.indentMore();
                    } else {
                        writer.newline();
                        writer.writeIndent();
                    }
                    writer.write("-");
                    writer.push(NEXT);
                    runValue(writer, event, true);
                    break;
                case SEQUENCE_END:
                    if (first) {
                        writer.write("[]");
                    } else {
                        writer.indentLess();
                    }
                    break;
                default:
                    throw new WriterStateException(WriterState.SEQUENCE, event);
            }
        }

        @Override
        public String toString() {
            return "Sequence(first=" + first + ")";
        }
    }

    private static final class Mapping extends StackFrame {

        static final Mapping FIRST = new Mapping(true);
        static final Mapping NEXT = new Mapping(false);

        private final boolean first;

        private Mapping(boolean first) {
            this.first = first;
        }

        @Override
        void run(YamlWriter writer, WriteEvent event) throws IOException, WriterStateException {
            switch (event.getType()) {
                case SEQUENCE_START:
                case MAPPING_START:
                case SCALAR:
                    if (first) {
                        writer.indentMore();
                    } else {
                        writer.newline();
                        writer.writeIndent();
                    }
                    boolean complexKey = event.isCollectionStart();
                    writer.push(complexKey ? MappingValue.COMPLEX_KEY : MappingValue.SIMPLE_KEY);
                    if (complexKey) {
                        writer.write("?");
                        runValue(writer, event, true);
                    } else {
                        runNode(writer, event, true);
                    }
                    break;
                case MAPPING_END:
                    if (first) {
                        writer.write("{}");
                    } else {
                        writer.indentLess();
                    }
                    break;
                default:
                    throw new WriterStateException(WriterState.MAPPING, event);
            }
        }

        @Override
        public String toString() {
            return "Mapping(first=" + first + ")";
        }
    }

    private static final class MappingValue extends StackFrame {

        static final MappingValue SIMPLE_KEY = new MappingValue(false);
        static final MappingValue COMPLEX_KEY = new MappingValue(true);

        private final boolean complexKey;

        private MappingValue(boolean complexKey) {
            this.complexKey = complexKey;
        }

        @Override
        void run(YamlWriter writer, WriteEvent event) throws IOException, WriterStateException {
            if (!event.isNodeStart()) {
                throw new WriterStateException(WriterState.MAPPING_ENTRY_VALUE, event);
            }
            if (complexKey) {
                writer.newline();
                writer.writeIndent();
            }
            writer.write(":");
            writer.push(Mapping.NEXT);
            runValue(writer, event, complexKey);
        }

        @Override
        public String toString() {
            return "MappingValue(complexKey=" + complexKey + ")";
        }
    }

    private static final class ValueSequence extends StackFrame {

        static final ValueSequence INLINE = new ValueSequence(true);
        static final ValueSequence BLOCK = new ValueSequence(false);

        private final boolean inline;

        private ValueSequence(boolean inline) {
            this.inline = inline;
        }

        @Override
        void run(YamlWriter writer, WriteEvent event) throws IOException, WriterStateException {
            boolean empty = event.getType() == WriteEvent.Type.SEQUENCE_END;
            if (!empty && !event.isNodeStart()) {
                throw new WriterStateException(WriterState.SEQUENCE, event);
            }
            startNested(writer, inline, empty);
            Sequence.FIRST.run(writer, event);
        }

        @Override
        public String toString() {
            return "ValueSequence(inline=" + inline + ")";
        }
    }

    private static final class ValueMapping extends StackFrame {

        static final ValueMapping INLINE = new ValueMapping(true);
        static final ValueMapping BLOCK = new ValueMapping(false);

        private final boolean inline;

        private ValueMapping(boolean inline) {
            this.inline = inline;
        }

        @Override
        void run(YamlWriter writer, WriteEvent event) throws IOException, WriterStateException {
            boolean empty = event.getType() == WriteEvent.Type.MAPPING_END;
            if (!empty && !event.isNodeStart()) {
                throw new WriterStateException(WriterState.MAPPING, event);
            }
            startNested(writer, inline, empty);
            Mapping.FIRST.run(writer, event);
        }

        @Override
        public String toString() {
            return "ValueMapping(inline=" + inline + ")";
        }
    }

}
