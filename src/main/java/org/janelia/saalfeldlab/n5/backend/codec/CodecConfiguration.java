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
package org.janelia.saalfeldlab.n5.backend.codec;

import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.Deflater;

import org.janelia.saalfeldlab.n5.Bzip2Compression;
import org.janelia.saalfeldlab.n5.Compression;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.Lz4Compression;
import org.janelia.saalfeldlab.n5.RawCompression;
import org.janelia.saalfeldlab.n5.XzCompression;
import org.janelia.saalfeldlab.n5.backend.serialization.JsonValues;

import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

/**
 * A codec id with its parameters, serialized the way zarr stores compressors
 * and filters, e.g. <code>{"id": "gzip", "level": 5}</code>.
 */
public final class CodecConfiguration implements Codec {

	public static final String ID_KEY = "id";

	/* codec ids that n5 implements, see getCompression() */
	public static final List<String> N5_CODEC_IDS = Collections.unmodifiableList(
			Arrays.asList(CompressionCatalog.NONE, "gzip", "zlib", "bz2", "lz4", "lzma"));

	private final String id;
	private final Map<String, Object> configuration;

	public CodecConfiguration(final String id) {

		this(id, Collections.<String, Object>emptyMap());
	}

	public CodecConfiguration(final String id, final Map<String, ?> configuration) {

		this.id = Objects.requireNonNull(id, "id");
		final LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
		if (configuration != null)
			copy.putAll(configuration);
		this.configuration = Collections.unmodifiableMap(copy);
	}

	@Override
	public String getId() {

		return id;
	}

	@Override
	public Map<String, Object> getConfiguration() {

		return configuration;
	}

	/**
	 * The n5 {@link Compression} implementing this codec, or {@code null} if
	 * n5 has none.
	 *
	 * @return the compression
	 */
	public Compression getCompression() {

		switch (id) {
		case CompressionCatalog.NONE:
			return new RawCompression();
		case "gzip":
			return new GzipCompression(intParameter("level", Deflater.DEFAULT_COMPRESSION));
		case "zlib":
			return new GzipCompression(intParameter("level", Deflater.DEFAULT_COMPRESSION), true);
		case "bz2":
			return new Bzip2Compression(intParameter("level", 9));
		case "lz4":
			return new Lz4Compression();
		case "lzma":
			return new XzCompression(intParameter("preset", 6));
		default:
			return null;
		}
	}

	private int intParameter(final String key, final int defaultValue) {

		final Object value = configuration.get(key);
		if (value instanceof Number)
			return ((Number)value).intValue();
		if (value instanceof String) {
			try {
				return Integer.parseInt((String)value);
			} catch (final NumberFormatException e) {
				throw new IllegalArgumentException("Parameter '" + key + "' of codec '" + id + "' is not an integer: " + value, e);
			}
		}
		return defaultValue;
	}

	@Override
	public boolean equals(final Object other) {

		if (this == other)
			return true;
		if (!(other instanceof CodecConfiguration))
			return false;
		final CodecConfiguration that = (CodecConfiguration)other;
		return id.equals(that.id) && configuration.equals(that.configuration);
	}

	@Override
	public int hashCode() {

		return Objects.hash(id, configuration);
	}

	@Override
	public String toString() {

		return configuration.isEmpty() ? id : id + configuration;
	}

	public static JsonAdapter jsonAdapter = new JsonAdapter();

	public static class JsonAdapter implements JsonDeserializer<CodecConfiguration>, JsonSerializer<CodecConfiguration> {

		@Override
		public CodecConfiguration deserialize(
				final JsonElement json,
				final Type typeOfT,
				final JsonDeserializationContext context) throws JsonParseException {

			if (!json.isJsonObject())
				throw new JsonParseException("Codec configuration must be an object: " + json);

			final JsonObject jsonObject = json.getAsJsonObject();
			final JsonElement jsonId = jsonObject.get(ID_KEY);
			if (jsonId == null || !jsonId.isJsonPrimitive())
				throw new JsonParseException("Codec configuration without '" + ID_KEY + "': " + json);

			final LinkedHashMap<String, Object> parameters = new LinkedHashMap<>();
			for (final Map.Entry<String, JsonElement> entry : jsonObject.entrySet())
				if (!ID_KEY.equals(entry.getKey()))
					parameters.put(entry.getKey(), JsonValues.toJava(entry.getValue()));

			return new CodecConfiguration(jsonId.getAsString(), parameters);
		}

		@Override
		public JsonElement serialize(
				final CodecConfiguration src,
				final Type typeOfSrc,
				final JsonSerializationContext context) {

			final JsonObject json = new JsonObject();
			json.addProperty(ID_KEY, src.getId());
			for (final Map.Entry<String, Object> entry : src.getConfiguration().entrySet())
				json.add(entry.getKey(), context.serialize(entry.getValue()));
			return json;
		}
	}
}
