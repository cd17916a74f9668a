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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * An in-memory filesystem for tests.
 */
public class MemoryFileSystem implements VirtualFileSystem {

    private final Map<String, String> files = new HashMap<String, String>();

    private class MemoryFile implements VirtualFile {

        private final String path;

        MemoryFile(@Nonnull String path) {
            this.path = path;
        }

        @Override
        public boolean isFile() {
            return files.containsKey(path);
        }

        @Override
        public String getPath() {
            return path;
        }

        @Override
        public String getName() {
            return path.substring(path.lastIndexOf('/') + 1);
        }

        @Override
        public Source getSource() throws IOException {
            String text = files.get(path);
            if (text == null)
                throw new FileNotFoundException(path);
            return new StringSource(path, text);
        }
    }

    @Nonnull
    public MemoryFileSystem addFile(@Nonnull String path, @Nonnull String text) {
        files.put(path, text);
        return this;
    }

    @Override
    public VirtualFile getFile(String path) {
        return new MemoryFile(path);
    }

    @Override
    public VirtualFile getFile(String dir, String name) {
        return new MemoryFile(dir + "/" + name);
    }
}
