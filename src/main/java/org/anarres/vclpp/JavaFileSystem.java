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
import javax.annotation.Nonnull;

/**
 * A virtual filesystem implementation using java.io.
 */
public class JavaFileSystem implements VirtualFileSystem {

    private class JavaFile extends File implements VirtualFile {

        private static final long serialVersionUID = 1L;

        private final String requested;

        public JavaFile(@Nonnull String path) {
            super(path);
            this.requested = path;
        }

        public JavaFile(@Nonnull String dir, @Nonnull String name) {
            super(dir, name);
            this.requested = getPath();
        }

        @Override
        public Source getSource() throws IOException {
            return new FileSource(this, requested);
        }
    }

    @Override
    public VirtualFile getFile(String path) {
        return new JavaFile(path);
    }

    @Override
    public VirtualFile getFile(String dir, String name) {
        return new JavaFile(dir, name);
    }
}
