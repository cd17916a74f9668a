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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the '#include' directives of the root file.
 *
 * All includes are opened before any is parsed, and every file which
 * fails to open is reported before the run is aborted. An included
 * file may not include anything itself.
 */
public class IncludeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(IncludeResolver.class);

    private final Preprocessor pp;

    public IncludeResolver(@Nonnull Preprocessor pp) {
        this.pp = pp;
    }

    /**
     * Looks the name up as given, then in each directory of the include path.
     *
     * @return the file, or null if not found.
     */
    @CheckForNull
    protected VirtualFile find(@Nonnull String name) {
        VirtualFileSystem filesystem = pp.getFileSystem();
        VirtualFile file = filesystem.getFile(name);
        if (file.isFile())
            return file;
        for (String dir : pp.getIncludePath()) {
            file = filesystem.getFile(dir, name);
            if (file.isFile())
                return file;
        }
        return null;
    }

    /**
     * Parses every file included by root.
     *
     * @return one directive set per include, in include order.
     * @throws PreprocessorException if any include fails to open or parse.
     */
    @Nonnull
    public PVector<Directives> resolve(@Nonnull ParsedSource root)
            throws IOException,
            PreprocessorException {
        List<Source> sources = new ArrayList<Source>();
        try {
            int failed = 0;
            for (String name : root.getDirectives().getIncludes()) {
                VirtualFile file = find(name);
                if (file == null) {
                    pp.report(name, 0, "Unable to open file \"" + name + "\" for reading.");
                    failed++;
                    continue;
                }
                try {
                    sources.add(file.getSource());
                } catch (IOException e) {
                    LOG.debug("Failed to open " + file.getPath(), e);
                    pp.report(name, 0, "Unable to open file \"" + name + "\" for reading.");
                    failed++;
                }
            }

            if (failed != 0)
                pp.error(root.getName(), 0, "Failed to open include file(s).");

            PVector<Directives> result = TreePVector.empty();
            for (Source source : sources) {
                ParsedSource parsed = pp.parse(source, true);
                if (!parsed.getDirectives().getIncludes().isEmpty())
                    pp.error(source.getName(), 0, "Include directives are not allowed inside #included files!");
                result = result.plus(parsed.getDirectives());
            }
            return result;
        } finally {
            for (Source source : sources)
                source.close();
        }
    }
}
