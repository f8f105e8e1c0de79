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

import static com.google.common.base.Preconditions.checkNotNull;

import org.apache.yamlwriter.emitter.WriteEvent;
import org.apache.yamlwriter.scalar.ScalarStyle;
import org.apache.yamlwriter.scalar.ScalarValue;
import org.jetbrains.annotations.NotNull;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.events.AliasEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.ScalarEvent;

import com.google.common.collect.Iterables;

/**
 * Converts SnakeYAML parser events to {@link WriteEvent}s.
 * <p>
 * Anchors and tags of collections are dropped. Aliases are not supported.
 */
public final class ParserEvents {

    private ParserEvents() {
        // no instances for you
    }

    /**
     * Convert a parser event.
     *
     * @param event the parser event
     * @return the write event; {@link WriteEvent#NOTHING} for comments
     * @throws UnsupportedOperationException for an alias
     */
    @NotNull
    public static WriteEvent toWriteEvent(@NotNull Event event) {
        switch (checkNotNull(event).getEventId()) {
            case StreamStart:
                return WriteEvent.STREAM_START;
            case StreamEnd:
                return WriteEvent.STREAM_END;
            case DocumentStart:
                return WriteEvent.DOCUMENT_START;
            case DocumentEnd:
                return WriteEvent.DOCUMENT_END;
            case SequenceStart:
                return WriteEvent.SEQUENCE_START;
            case SequenceEnd:
                return WriteEvent.SEQUENCE_END;
            case MappingStart:
                return WriteEvent.MAPPING_START;
            case MappingEnd:
                return WriteEvent.MAPPING_END;
            case Scalar:
                ScalarEvent scalar = (ScalarEvent) event;
                return WriteEvent.scalar(ScalarValue.fromScalarEvent(
                        scalar.getValue(), toStyle(scalar.getScalarStyle()), scalar.getTag()));
            case Alias:
                throw new UnsupportedOperationException(
                        "Aliases are not supported: *" + ((AliasEvent) event).getAnchor());
            case Comment:
                return WriteEvent.NOTHING;
            default:
                throw new IllegalArgumentException("Unknown event " + event);
        }
    }

    /**
     * Convert parser events lazily, skipping comments.
     *
     * @param events the parser events
     * @return the write events
     */
    @NotNull
    public static Iterable<WriteEvent> convert(@NotNull Iterable<Event> events) {
        return Iterables.transform(
                Iterables.filter(checkNotNull(events), e -> !e.is(Event.ID.Comment)),
                ParserEvents::toWriteEvent);
    }

    static ScalarStyle toStyle(DumperOptions.ScalarStyle style) {
        switch (style) {
            case PLAIN:
                return ScalarStyle.PLAIN;
            case SINGLE_QUOTED:
                return ScalarStyle.SINGLE_QUOTED;
            case DOUBLE_QUOTED:
                return ScalarStyle.DOUBLE_QUOTED;
            case LITERAL:
                return ScalarStyle.LITERAL;
            case FOLDED:
                return ScalarStyle.FOLDED;
            default:
                // any other style is quoted in some way
                return ScalarStyle.DOUBLE_QUOTED;
        }
    }

}
