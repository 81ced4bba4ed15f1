/*-
 * #%L
 * Not HDF5
 * %%
 * Copyright (C) 2019 - 2025 Stephan Saalfeld
 * %%
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 * 1. Redistributions of source code must retain the above copyright notice,
 *    this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright notice,
 *    this list of conditions and the following disclaimer in the documentation
 *    and/or other materials provided with the distribution.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDERS OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 * #L%
 */
package org.janelia.saalfeldlab.n5.backend.serialization;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Conversion of free-form JSON option values to plain Java values.
 */
public final class JsonValues {

	private JsonValues() {}

	/**
	 * Integral numbers become {@link Long}, other numbers {@link Double},
	 * arrays {@link List} and objects insertion ordered {@link Map}.
	 *
	 * @param json the element
	 * @return the Java value, {@code null} for JSON null
	 */
	public static Object toJava(final JsonElement json) {

		if (json == null || json.isJsonNull())
			return null;

		if (json.isJsonPrimitive()) {
			final JsonPrimitive primitive = json.getAsJsonPrimitive();
			if (primitive.isBoolean())
				return primitive.getAsBoolean();
			if (primitive.isNumber()) {
				final String text = primitive.getAsString();
				if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
					final BigInteger integer = new BigInteger(text);
					if (integer.bitLength() < Long.SIZE)
						return integer.longValue();
				}
				return primitive.getAsDouble();
			}
			return primitive.getAsString();
		}

		if (json.isJsonArray()) {
			final JsonArray array = json.getAsJsonArray();
			final List<Object> list = new ArrayList<>(array.size());
			for (final JsonElement element : array)
				list.add(toJava(element));
			return list;
		}

		final JsonObject object = json.getAsJsonObject();
		final Map<String, Object> map = new LinkedHashMap<>();
		for (final Map.Entry<String, JsonElement> entry : object.entrySet())
			map.put(entry.getKey(), toJava(entry.getValue()));
		return map;
	}

	@SuppressWarnings("unchecked")
	public static Map<String, Object> toMap(final JsonElement json) {

		if (json == null || json.isJsonNull())
			return new LinkedHashMap<>();
		if (!json.isJsonObject())
			throw new IllegalArgumentException("Expected a JSON object but found " + json);
		return (Map<String, Object>)toJava(json);
	}
}
