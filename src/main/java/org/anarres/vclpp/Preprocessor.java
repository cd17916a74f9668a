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
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.apache.commons.io.FileUtils;
import org.pcollections.PVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.anarres.vclpp.PreprocessorListener.SourceChangeEvent;

/**
 * A VCL source preprocessor.
 *
 * The root file is parsed into a directive set and a list of code lines,
 * each '#include' is parsed into a further directive set, and the code
 * lines are then passed through macro expansion, define substitution
 * and output composition, in that order:
 * <pre>
 * Preprocessor pp = new Preprocessor();
 * pp.setListener(new DefaultPreprocessorListener());
 * pp.preprocess(new File("prog.vcl"), new File("prog.vsm"));
 * </pre>
 * The whole result is computed in memory before any output is written,
 * so a failed run never leaves a partial output file.
 */
public class Preprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(Preprocessor.class);

    private final Set<Feature> features;
    private final Set<Warning> warnings;
    private final List<String> includepath;
    private VirtualFileSystem filesystem;
    private PreprocessorListener listener;

    public Preprocessor() {
        this.features = EnumSet.noneOf(Feature.class);
        this.warnings = EnumSet.of(Warning.PROGRAM_MARKERS);
        this.includepath = new ArrayList<String>();
        this.filesystem = new JavaFileSystem();
        this.listener = null;
    }

    /**
     * Sets the VirtualFileSystem used by this Preprocessor.
     */
    public void setFileSystem(@Nonnull VirtualFileSystem filesystem) {
        this.filesystem = filesystem;
    }

    /**
     * Returns the VirtualFileSystem used by this Preprocessor.
     */
    @Nonnull
    public VirtualFileSystem getFileSystem() {
        return filesystem;
    }

    /**
     * Sets the PreprocessorListener which handles events for
     * this Preprocessor.
     *
     * The listener is notified of warnings, errors and source
     * changes.
     */
    public void setListener(@CheckForNull PreprocessorListener listener) {
        this.listener = listener;
    }

    public void addFeature(@Nonnull Feature f) {
        features.add(f);
    }

    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    /**
     * Returns the warning-set for this Preprocessor.
     *
     * This set may be freely modified by user code.
     */
    @Nonnull
    public Set<Warning> getWarnings() {
        return warnings;
    }

    public void addWarning(@Nonnull Warning w) {
        warnings.add(w);
    }

    public void addWarnings(@Nonnull Collection<Warning> w) {
        warnings.addAll(w);
    }

    /**
     * Returns the include path of this Preprocessor.
     *
     * This list may be freely modified by user code.
     */
    @Nonnull
    public List<String> getIncludePath() {
        return includepath;
    }

    /**
     * Reports an error without terminating.
     *
     * Used where several failures are collected before the run is
     * aborted with {@link #error(String, int, String)}.
     */
    protected void report(@CheckForNull String source, int line, @Nonnull String msg) {
        if (listener != null)
            listener.handleError(source, line, msg);
        else
            LOG.error(DefaultPreprocessorListener.format(source, line, msg));
    }

    /**
     * Handles an error.
     *
     * If a PreprocessorListener is installed, it receives the
     * error. An exception is thrown in either case.
     *
     * @throws PreprocessorException always.
     */
    protected void error(@CheckForNull String source, int line, @Nonnull String msg, @CheckForNull Throwable cause)
            throws PreprocessorException {
        if (listener != null)
            listener.handleError(source, line, msg);
        throw new PreprocessorException(DefaultPreprocessorListener.format(source, line, msg), cause);
    }

    /**
     * @see #error(String, int, String, Throwable)
     */
    protected void error(@CheckForNull String source, int line, @Nonnull String msg)
            throws PreprocessorException {
        error(source, line, msg, null);
    }

    /**
     * Handles a warning of the given class.
     *
     * Nothing happens if the class is not enabled. If
     * {@link Warning#ERROR} is enabled the warning becomes an error.
     */
    protected void warning(@Nonnull Warning w, @CheckForNull String source, int line, @Nonnull String msg)
            throws PreprocessorException {
        if (!warnings.contains(w))
            return;
        if (warnings.contains(Warning.ERROR))
            error(source, line, msg);
        else if (listener != null)
            listener.handleWarning(source, line, msg);
        else
            LOG.warn(DefaultPreprocessorListener.format(source, line, msg));
    }

    /**
     * Parses the directives of one file, then closes it.
     *
     * @param include true if the source was named by an '#include'.
     */
    @Nonnull
    public ParsedSource parse(@Nonnull Source source, boolean include)
            throws IOException,
            PreprocessorException {
        if (listener != null)
            listener.handleSourceChange(source.getName(), SourceChangeEvent.PUSH);
        try {
            return new DirectiveParser(this, source, include).parse();
        } finally {
            source.close();
            if (listener != null)
                listener.handleSourceChange(source.getName(), SourceChangeEvent.POP);
        }
    }

    /**
     * Runs the whole pipeline on the given root source.
     *
     * @return the output lines, without line terminators.
     */
    @Nonnull
    public PVector<String> preprocess(@Nonnull Source root)
            throws IOException,
            PreprocessorException {
        ParsedSource parsed = parse(root, false);

        /* Includes first, then the root itself. */
        PVector<Directives> directives = new IncludeResolver(this).resolve(parsed)
                .plus(parsed.getDirectives());

        PVector<String> lines = new MacroExpander(this, parsed.getName())
                .expand(parsed.getCodeLines(), parsed.getCodeLineNumbers(), directives);
        lines = new DefineExpander(this).expand(lines, directives);
        return new OutputComposer(getFeature(Feature.BOILERPLATE)).compose(lines);
    }

    /**
     * Opens the named root file through the VirtualFileSystem and
     * preprocesses it.
     */
    @Nonnull
    public PVector<String> preprocess(@Nonnull String name)
            throws IOException,
            PreprocessorException {
        VirtualFile file = filesystem.getFile(name);
        if (!file.isFile())
            error(name, 0, "Unable to open file \"" + name + "\" for reading.");
        Source source;
        try {
            source = file.getSource();
        } catch (IOException e) {
            error(name, 0, "Unable to open file \"" + name + "\" for reading.", e);
            throw e;
        }
        return preprocess(source);
    }

    /**
     * Preprocesses input and writes the result to output.
     *
     * The output file is not touched unless preprocessing succeeds.
     */
    public void preprocess(@Nonnull File input, @Nonnull File output)
            throws IOException,
            PreprocessorException {
        PVector<String> lines = preprocess(input.getPath());
        try {
            FileUtils.writeLines(output, StandardCharsets.UTF_8.name(), lines, "\n");
        } catch (IOException e) {
            error(output.getPath(), 0, "Unable to open file \"" + output.getPath() + "\" for writing.", e);
        }
        if (getFeature(Feature.DEBUG))
            LOG.info("Wrote " + lines.size() + " lines to " + output);
    }

    @Override
    public String toString() {
        return "Preprocessor(features=" + features + ", warnings=" + warnings
                + ", includepath=" + includepath + ")";
    }
}
