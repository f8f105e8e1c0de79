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

import org.jetbrains.annotations.NotNull;

/**
 * An event was not valid in the state the writer was in.
 */
public class WriterStateException extends WriteException {

    private static final long serialVersionUID = 1L;

    private final WriterState state;
    private final transient WriteEvent event;

    public WriterStateException(@NotNull WriterState state, @NotNull WriteEvent event) {
        super(Kind.STATE, "invalid YAML write event, expecting " + state.getExpecting() + ", got: " + event, null);
        this.state = state;
        this.event = event;
    }

    /**
     * @return the state the writer was in
     */
    @NotNull
    public WriterState getState() {
        return state;
    }

    /**
     * @return the rejected event
     */
    public WriteEvent getEvent() {
        return event;
    }

}
