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

/**
 * What the writer was waiting for when it received an event it could not
 * accept.
 */
public enum WriterState {

    /**
     * The writer has been created. Waiting for: StreamStart.
     */
    START("start of stream (StreamStart)"),

    /**
     * The stream has ended. No more events are accepted.
     */
    END("no more events due to end of stream"),

    /**
     * Between documents. Waiting for: DocumentStart, StreamEnd.
     */
    DOCUMENT_LIST("document (DocumentStart, StreamEnd)"),

    /**
     * After the root node. Waiting for: DocumentEnd.
     */
    DOCUMENT_END("end of document (DocumentEnd)"),

    /**
     * Waiting for the root node: SequenceStart, MappingStart, Scalar.
     */
    DOCUMENT("document value (SequenceStart, MappingStart, Scalar)"),

    /**
     * Inside a sequence. Waiting for: SequenceStart, MappingStart, Scalar,
     * SequenceEnd.
     */
    SEQUENCE("sequence item (SequenceStart, MappingStart, Scalar, SequenceEnd)"),

    /**
     * Inside a mapping, before a key. Waiting for: SequenceStart,
     * MappingStart, Scalar, MappingEnd.
     */
    MAPPING("mapping entry key (SequenceStart, MappingStart, Scalar, MappingEnd)"),

    /**
     * Inside a mapping entry, after the key. Waiting for: SequenceStart,
     * MappingStart, Scalar.
     */
    MAPPING_ENTRY_VALUE("mapping entry value (SequenceStart, MappingStart, Scalar)"),

    /**
     * A previous event failed; the writer cannot continue.
     */
    EXISTING_ERROR("no more events due to previous error");

    private final String expecting;

    WriterState(String expecting) {
        this.expecting = expecting;
    }

    /**
     * @return a description of the events accepted in this state
     */
    public String getExpecting() {
        return expecting;
    }

}
