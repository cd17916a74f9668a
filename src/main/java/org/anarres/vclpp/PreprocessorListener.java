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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A handler for preprocessor events, primarily errors and warnings.
 *
 * The listener only reports. Whatever it does, an error still
 * terminates the run once the listener returns.
 */
public interface PreprocessorListener {

    /**
     * Handles a warning.
     *
     * @param source the file being processed, or null if the warning is not tied to one.
     * @param line the 1-based line number, or 0 if not applicable.
     */
    public void handleWarning(@CheckForNull String source, int line, @Nonnull String msg);

    /**
     * Handles an error.
     *
     * @param source the file being processed, or null if the error is not tied to one.
     * @param line the 1-based line number, or 0 if not applicable.
     */
    public void handleError(@CheckForNull String source, int line, @Nonnull String msg);

    public enum SourceChangeEvent {

        PUSH, POP;
    }

    public void handleSourceChange(@Nonnull String source, @Nonnull SourceChangeEvent event);
}
