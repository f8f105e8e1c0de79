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
import java.util.ArrayDeque;
import java.util.Deque;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a YAML stream from a sequence of {@link WriteEvent}s.
 * <p>
 * Events are passed one at a time with {@link #event(WriteEvent)}. The
 * writer only accepts event sequences that form a valid stream: a
 * {@code StreamStart}, any number of documents each holding at most one
 * node, and a {@code StreamEnd}. An invalid event is rejected with a
 * {@link WriterStateException}.
 * <pre>
 * StringBuilder buff = new StringBuilder();
 * YamlWriter writer = new YamlWriter(buff);
 * writer.event(WriteEvent.STREAM_START);
 * writer.event(WriteEvent.DOCUMENT_START);
 * writer.event(WriteEvent.MAPPING_START);
 * writer.event(WriteEvent.string("name"));
 * writer.event(WriteEvent.string("oak"));
 * writer.event(WriteEvent.MAPPING_END);
 * writer.event(WriteEvent.DOCUMENT_END);
 * writer.event(WriteEvent.STREAM_END);
 * // buff: "name: oak"
 * </pre>
 * There is no recovery: once an event fails, for an invalid event or
 * because the output threw an exception, every further event fails too.
 * Output written before the failure is left as it is.
 * <p>
 * This class is not thread-safe.
 */
public class YamlWriter {

    private static final Logger LOG = LoggerFactory.getLogger(YamlWriter.class);

    private final Appendable out;
    private final WriterSettings settings;

    /**
     * The indentation level; -1 before the first collection of a document.
     */
    private int level = -1;

    private final Deque<StackFrame> stack = new ArrayDeque<>();

    /**
     * Create a writer with the default settings (see
     * {@link WriterSettings#defaults()}).
     *
     * @param out the output
     */
    public YamlWriter(@NotNull Appendable out) {
        this(out, WriterSettings.defaults());
    }

    /**
     * Create a writer.
     *
     * @param out the output
     * @param settings the settings, which are copied
     */
    public YamlWriter(@NotNull Appendable out, @NotNull WriterSettings settings) {
        this.out = checkNotNull(out);
        this.settings = new WriterSettings(settings);
        stack.push(StackFrame.start());
    }

    /**
     * Write an event.
     *
     * @param event the event
     * @throws WriterStateException if the event is not valid in the current
     *             state, or the writer has failed before
     * @throws WriteException if the output failed
     */
    public void event(@NotNull WriteEvent event) throws WriteException {
        checkNotNull(event);
        StackFrame frame = stack.poll();
        if (frame == null) {
            throw new WriterStateException(WriterState.EXISTING_ERROR, event);
        }
        try {
            frame.run(this, event);
        } catch (WriterStateException e) {
            stack.clear();
            LOG.debug("Rejected event {} in state {}: {}", event, frame, e.getMessage());
            throw e;
        } catch (IOException e) {
            stack.clear();
            LOG.debug("Failed to write event {} in state {}", event, frame, e);
            throw WriteException.formatError(e);
        } catch (RuntimeException e) {
            stack.clear();
            throw e;
        }
        if (isFinished()) {
            LOG.trace("End of stream");
        }
    }

    /**
     * Write events in order, up to the first failure.
     *
     * @param events the events
     * @throws WriteException if an event failed
     */
    public void events(@NotNull Iterable<WriteEvent> events) throws WriteException {
        for (WriteEvent e : events) {
            event(e);
        }
    }

    /**
     * @return true once {@code StreamEnd} has been written
     */
    public boolean isFinished() {
        StackFrame top = stack.peek();
        return top != null && top.isEnd();
    }

    /**
     * @return true if an event failed; the writer can not be used any more
     */
    public boolean isFailed() {
        return stack.isEmpty();
    }

    /**
     * @return the current indentation level, -1 outside of any collection
     */
    public int getLevel() {
        return level;
    }

    public int getIndent() {
        return settings.getIndent();
    }

    /**
     * Set the number of spaces per indentation level.
     *
     * @param indent the width, at least 1
     */
    public void setIndent(int indent) {
        settings.setIndent(indent);
    }

    public boolean isCompact() {
        return settings.isCompact();
    }

    /**
     * Set compact inline notation on or off, see
     * {@link WriterSettings#setCompact(boolean)}.
     *
     * @param compact whether to use compact notation
     */
    public void setCompact(boolean compact) {
        settings.setCompact(compact);
    }

    public boolean isMultilineStrings() {
        return settings.isMultilineStrings();
    }

    /**
     * Write multi-line strings as literal blocks where possible.
     *
     * @param multilineStrings whether to use literal blocks
     */
    public void setMultilineStrings(boolean multilineStrings) {
        settings.setMultilineStrings(multilineStrings);
    }

    public boolean isOmitFirstDocSeparator() {
        return settings.isOmitFirstDocSeparator();
    }

    /**
     * Do not write {@code ---} before the first document.
     *
     * @param omitFirstDocSeparator whether to omit the first marker
     */
    public void setOmitFirstDocSeparator(boolean omitFirstDocSeparator) {
        settings.setOmitFirstDocSeparator(omitFirstDocSeparator);
    }

    //------------------------------------------< frame support >---

    Appendable out() {
        return out;
    }

    void push(StackFrame frame) {
        stack.push(frame);
    }

    void write(String s) throws IOException {
        out.append(s);
    }

    void newline() throws IOException {
        out.append('\n');
    }

    void indentMore() {
        level++;
    }

    void indentLess() {
        level--;
    }

    void writeIndent() throws IOException {
        if (level <= 0) {
            return;
        }
        int count = level * settings.getIndent();
        for (int i = 0; i < count; i++) {
            out.append(' ');
        }
    }

}
