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

import static org.apache.yamlwriter.emitter.WriteEvent.DOCUMENT_END;
import static org.apache.yamlwriter.emitter.WriteEvent.DOCUMENT_START;
import static org.apache.yamlwriter.emitter.WriteEvent.MAPPING_END;
import static org.apache.yamlwriter.emitter.WriteEvent.MAPPING_START;
import static org.apache.yamlwriter.emitter.WriteEvent.NOTHING;
import static org.apache.yamlwriter.emitter.WriteEvent.SEQUENCE_END;
import static org.apache.yamlwriter.emitter.WriteEvent.SEQUENCE_START;
import static org.apache.yamlwriter.emitter.WriteEvent.STREAM_END;
import static org.apache.yamlwriter.emitter.WriteEvent.STREAM_START;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import java.io.IOException;

import org.apache.yamlwriter.junit.LogCustomizer;
import org.junit.Test;

import ch.qos.logback.classic.Level;

import com.google.common.collect.ImmutableList;

/**
 * Tests that {@link YamlWriter} rejects invalid event sequences and output
 * failures, and stays failed afterwards.
 */
public class YamlWriterErrorTest {

    @Test
    public void mappingEndAfterStreamStart() throws WriteException {
        StringBuilder buff = new StringBuilder();
        YamlWriter writer = new YamlWriter(buff, new WriterSettings());
        writer.event(STREAM_START);
        try {
            writer.event(MAPPING_END);
            fail("exception expected");
        } catch (WriterStateException e) {
            assertEquals(WriterState.DOCUMENT_LIST, e.getState());
            assertEquals(WriteException.Kind.STATE, e.getKind());
            assertSame(MAPPING_END, e.getEvent());
            assertEquals("invalid YAML write event, expecting document (DocumentStart, StreamEnd), got: MappingEnd",
                    e.getMessage());
        }
        assertTrue(writer.isFailed());
        assertFalse(writer.isFinished());
        try {
            writer.event(DOCUMENT_START);
            fail("exception expected");
        } catch (WriterStateException e) {
            assertEquals(WriterState.EXISTING_ERROR, e.getState());
            assertEquals("invalid YAML write event, expecting no more events due to previous error, "
                    + "got: DocumentStart", e.getMessage());
        }
        assertEquals("", buff.toString());
    }

    @Test
    public void streamMustStartFirst() {
        assertRejected(WriterState.START, DOCUMENT_START);
        assertRejected(WriterState.START, YamlWriterTest.s("a"));
    }

    @Test
    public void noEventsAfterStreamEnd() {
        assertRejected(WriterState.END, STREAM_START, STREAM_END, DOCUMENT_START);
        assertRejected(WriterState.END, STREAM_START, STREAM_END, STREAM_END);
    }

    @Test
    public void documentHoldsOneNode() {
        WriterStateException e = assertRejected(WriterState.DOCUMENT_END,
                STREAM_START, DOCUMENT_START, YamlWriterTest.s("a"), YamlWriterTest.s("b"));
        assertEquals("invalid YAML write event, expecting end of document (DocumentEnd), got: b", e.getMessage());
        assertRejected(WriterState.DOCUMENT_END,
                STREAM_START, DOCUMENT_START, SEQUENCE_START, SEQUENCE_END, STREAM_END);
    }

    @Test
    public void documentValue() {
        assertRejected(WriterState.DOCUMENT, STREAM_START, DOCUMENT_START, STREAM_END);
        assertRejected(WriterState.DOCUMENT, STREAM_START, DOCUMENT_START, MAPPING_END);
        assertRejected(WriterState.DOCUMENT, STREAM_START, DOCUMENT_START, NOTHING);
    }

    @Test
    public void sequenceItems() {
        assertRejected(WriterState.SEQUENCE, STREAM_START, DOCUMENT_START, SEQUENCE_START, MAPPING_END);
        assertRejected(WriterState.SEQUENCE,
                STREAM_START, DOCUMENT_START, SEQUENCE_START, YamlWriterTest.s("a"), DOCUMENT_END);
        assertRejected(WriterState.SEQUENCE,
                STREAM_START, DOCUMENT_START, SEQUENCE_START, SEQUENCE_START, MAPPING_END);
        assertRejected(WriterState.SEQUENCE,
                STREAM_START, DOCUMENT_START, SEQUENCE_START, SEQUENCE_START, NOTHING);
        assertRejected(WriterState.SEQUENCE,
                STREAM_START, DOCUMENT_START, MAPPING_START, YamlWriterTest.s("a"), SEQUENCE_START, DOCUMENT_END);
    }

    @Test
    public void mappingEntries() {
        assertRejected(WriterState.MAPPING, STREAM_START, DOCUMENT_START, MAPPING_START, SEQUENCE_END);
        assertRejected(WriterState.MAPPING,
                STREAM_START, DOCUMENT_START, SEQUENCE_START, MAPPING_START, SEQUENCE_END);
        assertRejected(WriterState.MAPPING,
                STREAM_START, DOCUMENT_START, SEQUENCE_START, MAPPING_START, NOTHING);
        assertRejected(WriterState.MAPPING_ENTRY_VALUE,
                STREAM_START, DOCUMENT_START, MAPPING_START, YamlWriterTest.s("a"), NOTHING);
        assertRejected(WriterState.MAPPING_ENTRY_VALUE,
                STREAM_START, DOCUMENT_START, MAPPING_START, SEQUENCE_START, SEQUENCE_END, STREAM_END);
        WriterStateException e = assertRejected(WriterState.MAPPING_ENTRY_VALUE,
                STREAM_START, DOCUMENT_START, MAPPING_START, YamlWriterTest.s("a"), MAPPING_END);
        assertEquals("invalid YAML write event, expecting mapping entry value "
                + "(SequenceStart, MappingStart, Scalar), got: MappingEnd", e.getMessage());
    }

    @Test
    public void outputFailure() throws IOException {
        Appendable out = mock(Appendable.class);
        doThrow(new IOException("disk full")).when(out).append(any(CharSequence.class));
        YamlWriter writer = new YamlWriter(out, new WriterSettings());
        try {
            writer.event(STREAM_START);
            writer.event(DOCUMENT_START);
        } catch (WriteException e) {
            fail("nothing written yet: " + e);
        }
        try {
            writer.event(YamlWriterTest.s("a"));
            fail("exception expected");
        } catch (WriteException e) {
            assertEquals(WriteException.Kind.FORMAT, e.getKind());
            assertTrue(e.getCause() instanceof IOException);
            assertEquals("failed to write YAML output: disk full", e.getMessage());
        }
        assertTrue(writer.isFailed());
        try {
            writer.event(DOCUMENT_END);
            fail("exception expected");
        } catch (WriteException e) {
            assertEquals(WriteException.Kind.STATE, e.getKind());
            assertEquals(WriterState.EXISTING_ERROR, ((WriterStateException) e).getState());
        }
    }

    @Test
    public void eventsStopAtFirstFailure() {
        StringBuilder buff = new StringBuilder();
        YamlWriter writer = new YamlWriter(buff, new WriterSettings());
        try {
            writer.events(ImmutableList.of(STREAM_START, DOCUMENT_START, YamlWriterTest.s("a"),
                    YamlWriterTest.s("b"), DOCUMENT_END, STREAM_END));
            fail("exception expected");
        } catch (WriteException e) {
            assertEquals(WriterState.DOCUMENT_END, ((WriterStateException) e).getState());
        }
        assertEquals("a", buff.toString());
        assertTrue(writer.isFailed());
    }

    @Test
    public void rejectedEventIsLogged() {
        LogCustomizer logs = LogCustomizer.forLogger(YamlWriter.class)
                .enable(Level.DEBUG).contains("Rejected event").create();
        logs.starting();
        try {
            assertRejected(WriterState.START, MAPPING_START);
            assertEquals(1, logs.getLogs().size());
            assertTrue(logs.getLogs().get(0), logs.getLogs().get(0).contains("MappingStart"));
        } finally {
            logs.finished();
        }
    }

    private static WriterStateException assertRejected(WriterState expected, WriteEvent... events) {
        YamlWriter writer = new YamlWriter(new StringBuilder(), new WriterSettings());
        WriteEvent last = events[events.length - 1];
        try {
            for (int i = 0; i < events.length - 1; i++) {
                writer.event(events[i]);
            }
        } catch (WriteException e) {
            throw new AssertionError("unexpected failure before " + last, e);
        }
        try {
            writer.event(last);
            fail("exception expected");
            return null;
        } catch (WriterStateException e) {
            assertEquals(expected, e.getState());
            assertSame(last, e.getEvent());
            assertTrue(writer.isFailed());
            return e;
        } catch (WriteException e) {
            throw new AssertionError("state failure expected", e);
        }
    }

}
