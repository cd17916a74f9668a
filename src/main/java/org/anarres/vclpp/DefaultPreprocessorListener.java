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
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A handler for preprocessor events which logs and counts errors
 * and warnings.
 */
public class DefaultPreprocessorListener implements PreprocessorListener {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultPreprocessorListener.class);

    private int errors;
    private int warnings;

    public DefaultPreprocessorListener() {
        clear();
    }

    public void clear() {
        errors = 0;
        warnings = 0;
    }

    @Nonnegative
    public int getErrors() {
        return errors;
    }

    @Nonnegative
    public int getWarnings() {
        return warnings;
    }

    @Nonnull
    protected static String format(@CheckForNull String source, int line, @Nonnull String msg) {
        if (source == null)
            return msg;
        if (line <= 0)
            return "File " + source + ": " + msg;
        return source + "(" + line + "): " + msg;
    }

    @Override
    public void handleWarning(String source, int line, String msg) {
        warnings++;
        LOG.warn(format(source, line, msg));
    }

    @Override
    public void handleError(String source, int line, String msg) {
        errors++;
        LOG.error(format(source, line, msg));
    }

    @Override
    public void handleSourceChange(String source, SourceChangeEvent event) {
        LOG.debug(event + " " + source);
    }
}
