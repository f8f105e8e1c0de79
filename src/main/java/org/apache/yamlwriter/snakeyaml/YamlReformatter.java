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

import java.io.Reader;
import java.io.StringReader;

import org.apache.yamlwriter.emitter.WriteEvent;
import org.apache.yamlwriter.emitter.WriteException;
import org.apache.yamlwriter.emitter.WriterSettings;
import org.apache.yamlwriter.emitter.YamlWriter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads YAML text with SnakeYAML and writes it again with a
 * {@link YamlWriter}, giving it the writer's canonical layout.
 * Comments, anchors and scalar styles are not kept.
 */
public final class YamlReformatter {

    private static final Logger LOG = LoggerFactory.getLogger(YamlReformatter.class);

    private YamlReformatter() {
        // no instances for you
    }

    /**
     * Reformat a YAML stream.
     *
     * @param in the YAML text
     * @param out the output
     * @param settings the writer settings
     * @throws WriteException if writing failed
     * @throws org.yaml.snakeyaml.error.YAMLException if the input is not valid YAML
     * @throws UnsupportedOperationException if the input contains an alias
     */
    public static void reformat(@NotNull Reader in, @NotNull Appendable out, @NotNull WriterSettings settings)
            throws WriteException {
        YamlWriter writer = new YamlWriter(out, settings);
        Yaml yaml = new Yaml(new LoaderOptions());
        int count = 0;
        for (WriteEvent event : ParserEvents.convert(yaml.parse(checkNotNull(in)))) {
            writer.event(event);
            count++;
        }
        LOG.debug("Reformatted {} events", count);
    }

    /**
     * Reformat a YAML stream with the default settings.
     *
     * @param yaml the YAML text
     * @return the reformatted text
     * @throws WriteException if writing failed
     */
    public static String reformat(@NotNull String yaml) throws WriteException {
        StringBuilder buff = new StringBuilder();
        reformat(new StringReader(yaml), buff, WriterSettings.defaults());
        return buff.toString();
    }

}
