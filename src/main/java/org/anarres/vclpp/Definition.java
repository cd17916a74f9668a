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

import com.google.gson.JsonObject;
import javax.annotation.Nonnull;

/**
 * A single-line text substitution registered by '#define'.
 *
 * The value may be empty, in which case every standalone use of the
 * name is erased.
 */
public final class Definition {

    private final String name;
    private final String value;

    public Definition(@Nonnull String name, @Nonnull String value) {
        this.name = name;
        this.value = value;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public String getValue() {
        return value;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("name", name);
        result.addProperty("value", value);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Definition))
            return false;
        Definition o = (Definition) obj;
        return name.equals(o.name) && value.equals(o.value);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + value.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
