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
package org.apache.yamlwriter.snakeyaml;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.StringReader;
import java.util.List;

import org.apache.yamlwriter.emitter.WriteEvent;
import org.apache.yamlwriter.scalar.ScalarStyle;
import org.apache.yamlwriter.scalar.ScalarValue;
import org.junit.Test;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.comments.CommentType;
import org.yaml.snakeyaml.events.CommentEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.StreamEndEvent;
import org.yaml.snakeyaml.events.StreamStartEvent;

import com.google.common.collect.ImmutableList;

public class ParserEventsTest {

    @Test
    public void scalarsAndCollections() {
        List<WriteEvent> events = parse("- 1\n- 'x'\n- !!str 2\n- ~\n- {a: 1.5}\n");
        assertEquals(ImmutableList.of(
                WriteEvent.STREAM_START,
                WriteEvent.DOCUMENT_START,
                WriteEvent.SEQUENCE_START,
                WriteEvent.scalar(ScalarValue.ofInteger(1)),
                WriteEvent.string("x"),
                WriteEvent.string("2"),
                WriteEvent.scalar(ScalarValue.nullValue()),
                WriteEvent.MAPPING_START,
                WriteEvent.string("a"),
                WriteEvent.scalar(ScalarValue.ofReal("1.5")),
                WriteEvent.MAPPING_END,
                WriteEvent.SEQUENCE_END,
                WriteEvent.DOCUMENT_END,
                WriteEvent.STREAM_END), events);
    }

    @Test
    public void quotedScalarsAreStrings() {
        List<WriteEvent> events = parse("- \"true\"\n- '42'\n- |\n  text\n- >\n  folded\n");
        assertEquals(WriteEvent.string("true"), events.get(3));
        assertEquals(WriteEvent.string("42"), events.get(4));
        assertEquals(WriteEvent.string("text\n"), events.get(5));
        assertEquals(WriteEvent.string("folded\n"), events.get(6));
    }

    @Test
    public void taggedScalars() {
        List<WriteEvent> events = parse("- !!bool yes\n- !!int 42\n- !!null null\n- !custom 7\n");
        assertEquals(WriteEvent.scalar(ScalarValue.badValue()), events.get(3));
        assertEquals(WriteEvent.scalar(ScalarValue.ofInteger(42)), events.get(4));
        assertEquals(WriteEvent.scalar(ScalarValue.nullValue()), events.get(5));
        assertEquals(WriteEvent.string("7"), events.get(6));
    }

    @Test
    public void commentsAreSkipped() {
        CommentEvent comment = new CommentEvent(CommentType.BLOCK, " note", null, null);
        assertEquals(WriteEvent.NOTHING, ParserEvents.toWriteEvent(comment));
        List<Event> events = ImmutableList.of(new StreamStartEvent(null, null), comment, new StreamEndEvent(null, null));
        assertEquals(ImmutableList.of(WriteEvent.STREAM_START, WriteEvent.STREAM_END),
                ImmutableList.copyOf(ParserEvents.convert(events)));
    }

    @Test
    public void aliasesAreNotSupported() {
        try {
            parse("a: &x 1\nb: *x\n");
            fail("exception expected");
        } catch (UnsupportedOperationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("*x"));
        }
    }

    @Test
    public void styles() {
        assertEquals(ScalarStyle.PLAIN, ParserEvents.toStyle(DumperOptions.ScalarStyle.PLAIN));
        assertEquals(ScalarStyle.SINGLE_QUOTED, ParserEvents.toStyle(DumperOptions.ScalarStyle.SINGLE_QUOTED));
        assertEquals(ScalarStyle.DOUBLE_QUOTED, ParserEvents.toStyle(DumperOptions.ScalarStyle.DOUBLE_QUOTED));
        assertEquals(ScalarStyle.LITERAL, ParserEvents.toStyle(DumperOptions.ScalarStyle.LITERAL));
        assertEquals(ScalarStyle.FOLDED, ParserEvents.toStyle(DumperOptions.ScalarStyle.FOLDED));
    }

    static List<WriteEvent> parse(String yaml) {
        Iterable<Event> events = new Yaml(new LoaderOptions()).parse(new StringReader(yaml));
        return ImmutableList.copyOf(ParserEvents.convert(events));
    }

}
