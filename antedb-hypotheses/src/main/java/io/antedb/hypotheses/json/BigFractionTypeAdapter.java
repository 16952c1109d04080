package io.antedb.hypotheses.json;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.antedb.hypotheses.Fractions;
import org.apache.commons.math3.fraction.BigFraction;

import java.io.IOException;

/// Writes [BigFraction] values as exact `"p/q"` strings.
///
/// Reading also accepts a bare JSON integer. Decimal numbers are rejected,
/// since they would silently lose exactness.
///
/// ```json
/// {"k": "1/6", "l": "2/3"}
/// ```
public final class BigFractionTypeAdapter extends TypeAdapter<BigFraction> {

    @Override
    public void write(JsonWriter out, BigFraction value) throws IOException {
        if (value == null) {
            out.nullValue();
            return;
        }
        out.value(Fractions.format(value));
    }

    @Override
    public BigFraction read(JsonReader in) throws IOException {
        JsonToken token = in.peek();
        if (token == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        String text = in.nextString();
        try {
            return Fractions.parse(text);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("Expected an exact fraction at " + in.getPath() + ", got '" + text + "'", e);
        }
    }
}
