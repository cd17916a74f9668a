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
import java.util.List;
import javax.annotation.Nonnull;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * A named, optionally parameterized, multi-line text template
 * delimited by '#macro' and '#endmacro'.
 *
 * Instances are immutable. The parser grows a block one body line at a
 * time with {@link #withLine(String)}.
 */
public final class MacroBlock {

    private final String name;
    private final PVector<String> params;
    private final PVector<String> body;

    public MacroBlock(@Nonnull String name, @Nonnull List<String> params, @Nonnull List<String> body) {
        this.name = name;
        this.params = TreePVector.from(params);
        this.body = TreePVector.from(body);
    }

    public MacroBlock(@Nonnull String name, @Nonnull List<String> params) {
        this(name, params, TreePVector.<String>empty());
    }

    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Returns the declared parameter names, in declaration order.
     * Empty for a parameterless macro.
     */
    @Nonnull
    public PVector<String> getParams() {
        return params;
    }

    /**
     * Returns the verbatim lines between '#macro' and '#endmacro'.
     */
    @Nonnull
    public PVector<String> getBody() {
        return body;
    }

    public boolean isParameterized() {
        return !params.isEmpty();
    }

    @Nonnull
    public MacroBlock withLine(@Nonnull String line) {
        return new MacroBlock(name, params, body.plus(line));
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("name", name);
        JsonArray p = new JsonArray();
        for (String param : params)
            p.add(param);
        result.add("params", p);
        JsonArray b = new JsonArray();
        for (String line : body)
            b.add(line);
        result.add("body", b);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof MacroBlock))
            return false;
        MacroBlock o = (MacroBlock) obj;
        return name.equals(o.name) && params.equals(o.params) && body.equals(o.body);
    }

    @Override
    public int hashCode() {
        return (name.hashCode() * 31 + params.hashCode()) * 31 + body.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
