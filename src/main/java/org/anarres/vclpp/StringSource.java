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

import java.io.StringReader;
import javax.annotation.Nonnull;
import org.apache.commons.io.IOUtils;

/**
 * A {@link Source} which reads its lines from a String.
 */
public class StringSource extends Source {

    private final String name;

    public StringSource(@Nonnull String name, @Nonnull String text) {
        super(IOUtils.lineIterator(new StringReader(text)));
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }
}
