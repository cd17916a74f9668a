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

import java.io.Closeable;
import java.io.IOException;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.apache.commons.io.LineIterator;

/**
 * An input to the Preprocessor, read one line at a time.
 *
 * Sources are single-use: once drained they are closed and never
 * rewound.
 *
 * @see FileSource
 * @see StringSource
 */
public abstract class Source implements Closeable {

    private final LineIterator lines;
    private int line;

    protected Source(@Nonnull LineIterator lines) {
        this.lines = lines;
        this.line = 0;
    }

    /**
     * Returns the next line without its terminator, or null at end of input.
     */
    @CheckForNull
    public String line() {
        if (!lines.hasNext())
            return null;
        line++;
        return lines.next();
    }

    /**
     * Returns the 1-based number of the line most recently returned by
     * {@link #line()}, or 0 if nothing has been read yet.
     */
    public int getLine() {
        return line;
    }

    /**
     * Returns the human-readable name of this Source, used in diagnostics.
     */
    @Nonnull
    public abstract String getName();

    @Override
    public void close() throws IOException {
        lines.close();
    }

    @Override
    public String toString() {
        return getName() + ":" + line;
    }
}
