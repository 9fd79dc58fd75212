/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.episim.graph;

import io.episim.api.InvalidParameterException;

import java.nio.file.Path;
import java.util.Locale;

/// File formats understood by [GraphLoader].
public enum GraphFormat {
    /// Graph Modelling Language, as written by igraph and networkx
    GML("gml"),
    /// One whitespace separated vertex pair per line
    EDGELIST("edgelist", "txt", "edges", "el");

    private final String[] extensions;

    GraphFormat(String... extensions) {
        this.extensions = extensions;
    }

    /// Chooses a format from the file extension, defaulting to [#EDGELIST].
    public static GraphFormat forPath(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        if (dot >= 0) {
            String extension = fileName.substring(dot + 1);
            for (GraphFormat format : values()) {
                for (String candidate : format.extensions) {
                    if (candidate.equals(extension)) {
                        return format;
                    }
                }
            }
        }
        return EDGELIST;
    }

    public static GraphFormat fromName(String name) {
        for (GraphFormat format : values()) {
            if (format.name().equalsIgnoreCase(name) || format.extensions[0].equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw InvalidParameterException.unknownName("graph format", name, values());
    }
}
