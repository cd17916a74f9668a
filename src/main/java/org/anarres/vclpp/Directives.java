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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import javax.annotation.Nonnull;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * The includes, defines and macro blocks declared by one file.
 *
 * A directive set is a persistent value: the plus methods return a new
 * set and never modify this one. Names are neither deduplicated nor
 * validated, and lookups take the first match in declaration order.
 */
public final class Directives {

    private static final Directives EMPTY = new Directives(
            TreePVector.<String>empty(),
            TreePVector.<Definition>empty(),
            TreePVector.<MacroBlock>empty());

    private final PVector<String> includes;
    private final PVector<Definition> defines;
    private final PVector<MacroBlock> macros;

    private Directives(@Nonnull PVector<String> includes,
            @Nonnull PVector<Definition> defines,
            @Nonnull PVector<MacroBlock> macros) {
        this.includes = includes;
        this.defines = defines;
        this.macros = macros;
    }

    @Nonnull
    public static Directives empty() {
        return EMPTY;
    }

    @Nonnull
    public PVector<String> getIncludes() {
        return includes;
    }

    @Nonnull
    public PVector<Definition> getDefines() {
        return defines;
    }

    @Nonnull
    public PVector<MacroBlock> getMacros() {
        return macros;
    }

    @Nonnull
    public Directives plusInclude(@Nonnull String path) {
        return new Directives(includes.plus(path), defines, macros);
    }

    @Nonnull
    public Directives plusDefine(@Nonnull Definition definition) {
        return new Directives(includes, defines.plus(definition), macros);
    }

    @Nonnull
    public Directives plusMacro(@Nonnull MacroBlock macro) {
        return new Directives(includes, defines, macros.plus(macro));
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        JsonArray incs = new JsonArray();
        for (String include : includes)
            incs.add(include);
        if (incs.size() > 0)
            result.add("includes", incs);
        JsonArray defs = new JsonArray();
        for (Definition def : defines)
            defs.add(def.toJson());
        if (defs.size() > 0)
            result.add("defines", defs);
        JsonArray macs = new JsonArray();
        for (MacroBlock macro : macros)
            macs.add(macro.toJson());
        if (macs.size() > 0)
            result.add("macros", macs);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Directives))
            return false;
        Directives o = (Directives) obj;
        return includes.equals(o.includes)
                && defines.equals(o.defines)
                && macros.equals(o.macros);
    }

    @Override
    public int hashCode() {
        return (includes.hashCode() * 31 + defines.hashCode()) * 31 + macros.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
