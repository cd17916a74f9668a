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

import java.util.ArrayList;
import java.util.List;

/**
 * Records errors and warnings, for assertions.
 */
public class CollectingListener extends DefaultPreprocessorListener {

    public final List<String> errors = new ArrayList<String>();
    public final List<String> warnings = new ArrayList<String>();
    public final List<String> sources = new ArrayList<String>();

    @Override
    public void handleWarning(String source, int line, String msg) {
        super.handleWarning(source, line, msg);
        warnings.add(format(source, line, msg));
    }

    @Override
    public void handleError(String source, int line, String msg) {
        super.handleError(source, line, msg);
        errors.add(format(source, line, msg));
    }

    @Override
    public void handleSourceChange(String source, SourceChangeEvent event) {
        super.handleSourceChange(source, event);
        sources.add(event + " " + source);
    }
}
