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
 * A preprocessor exception.
 *
 * Every error in this preprocessor is fatal, so an instance of this
 * exception always terminates the current run.
 */
public class PreprocessorException extends Exception {

    private static final long serialVersionUID = 1L;

    public PreprocessorException(@Nonnull String msg) {
        super(msg);
    }

    public PreprocessorException(@Nonnull String msg, @CheckForNull Throwable cause) {
        super(msg, cause);
    }

    public PreprocessorException(@Nonnull Throwable cause) {
        super(cause);
    }
}
