/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.vclpp;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nonnull;
import org.apache.commons.io.FileUtils;

/**
 * A {@link Source} which reads a file from the local filesystem.
 */
public class FileSource extends Source {

    private final String name;

    /**
     * Opens the given file for reading.
     *
     * @param name the name used in diagnostics, usually as the user wrote it.
     * @throws IOException if the file does not exist or cannot be read.
     */
    public FileSource(@Nonnull File file, @Nonnull String name)
            throws IOException {
        super(FileUtils.lineIterator(file, StandardCharsets.UTF_8.name()));
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }
}
