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
 * Thrown when the {@link YamlWriter} cannot accept an event. After this
 * exception the writer is failed, and every further event is rejected.
 */
public class WriteException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * The cause of a write failure.
     */
    public enum Kind {
        /**
         * The output rejected a write.
         */
        FORMAT,
        /**
         * The event is not valid in the current writer state.
         */
        STATE
    }

    private final Kind kind;

    protected WriteException(@NotNull Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Create an exception for an output failure.
     *
     * @param cause the exception thrown by the output
     * @return the exception
     */
    static WriteException formatError(@NotNull Exception cause) {
        return new WriteException(Kind.FORMAT, "failed to write YAML output: " + cause.getMessage(), cause);
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

}
