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

import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.janelia.saalfeldlab.n5.backend.Backend;
import org.janelia.saalfeldlab.n5.backend.BackendConfiguration;
import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.codec.Codec;
import org.janelia.saalfeldlab.n5.backend.codec.CodecConfiguration;
import org.janelia.saalfeldlab.n5.backend.codec.CodecProvider;
import org.janelia.saalfeldlab.n5.backend.codec.CompressionCatalog;
import org.janelia.saalfeldlab.n5.backend.dataset.DatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.dataset.DatasetInfo;
import org.janelia.saalfeldlab.n5.backend.dataset.Hdf5DatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.dataset.ZarrDatasetIOConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

/**
 * JSON form of a {@link BackendConfiguration} for editing outside of code:
 *
 * <pre>
 * {
 *   "backend": "zarr",
 *   "number_of_jobs": 3,
 *   "data_io_configurations": {
 *     "acquisition/ElectricalSeries/data": {
 *       "object_id": "...",
 *       "dtype": "&lt;i2",
 *       "full_shape": [1000000, 384],
 *       "chunk_shape": [26042, 384],
 *       "buffer_shape": [1302100, 384],
 *       "compression_method": "gzip",
 *       "compression_options": {"level": 4},
 *       "filter_methods": ["delta"],
 *       "filter_options": [{"dtype": "&lt;i2"}]
 *     }
 *   }
 * }
 * </pre>
 *
 * Instantiated codecs cannot be restored from JSON.  They are written under
 * {@value #COMPRESSION_CODEC_KEY} for reference only and reading such a
 * dataset fails until the codec is replaced by a {@value #COMPRESSION_METHOD_KEY}.
 */
public class BackendConfigurationJson {

	private static final Logger LOG = LoggerFactory.getLogger(BackendConfigurationJson.class);

	public static final String BACKEND_KEY = "backend";
	public static final String NUMBER_OF_JOBS_KEY = "number_of_jobs";
	public static final String DATA_IO_CONFIGURATIONS_KEY = "data_io_configurations";
	public static final String OBJECT_ID_KEY = "object_id";
	public static final String DTYPE_KEY = "dtype";
	public static final String FULL_SHAPE_KEY = "full_shape";
	public static final String CHUNK_SHAPE_KEY = "chunk_shape";
	public static final String BUFFER_SHAPE_KEY = "buffer_shape";
	public static final String COMPRESSION_METHOD_KEY = "compression_method";
	public static final String COMPRESSION_OPTIONS_KEY = "compression_options";
	public static final String COMPRESSION_CODEC_KEY = "compression_codec";
	public static final String CODEC_ID_KEY = "id";
	public static final String FILTER_METHODS_KEY = "filter_methods";
	public static final String FILTER_OPTIONS_KEY = "filter_options";

	private final Collection<? extends CodecProvider> providers;
	private final Gson gson;

	public BackendConfigurationJson() {

		this(Collections.<CodecProvider>emptyList());
	}

	/**
	 * @param providers codec providers for the catalogs that resolve names when reading
	 */
	public BackendConfigurationJson(final Collection<? extends CodecProvider> providers) {

		this.providers = providers;
		this.gson = registerTypeAdapters(new GsonBuilder(), providers)
				.setPrettyPrinting()
				.create();
	}

	public static GsonBuilder registerTypeAdapters(final GsonBuilder gsonBuilder, final Collection<? extends CodecProvider> providers) {

		gsonBuilder.registerTypeAdapter(DType.class, new DType.JsonAdapter());
		gsonBuilder.registerTypeAdapter(CodecConfiguration.class, CodecConfiguration.jsonAdapter);
		gsonBuilder.registerTypeAdapter(BackendConfiguration.class, new JsonAdapter(providers));
		gsonBuilder.disableHtmlEscaping();
		return gsonBuilder;
	}

	public Gson getGson() {

		return gson;
	}

	public Collection<? extends CodecProvider> getProviders() {

		return providers;
	}

	public String toJson(final BackendConfiguration configuration) {

		return gson.toJson(configuration, BackendConfiguration.class);
	}

	public void toJson(final BackendConfiguration configuration, final Writer writer) {

		gson.toJson(configuration, BackendConfiguration.class, writer);
	}

	/**
	 * @throws JsonParseException if the JSON is malformed
	 * @throws org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException if a configuration is invalid
	 */
	public BackendConfiguration fromJson(final String json) {

		return gson.fromJson(json, BackendConfiguration.class);
	}

	public BackendConfiguration fromJson(final Reader reader) {

		return gson.fromJson(reader, BackendConfiguration.class);
	}

	public static class JsonAdapter implements JsonDeserializer<BackendConfiguration>, JsonSerializer<BackendConfiguration> {

		private final Collection<? extends CodecProvider> providers;

		public JsonAdapter(final Collection<? extends CodecProvider> providers) {

			this.providers = providers;
		}

		@Override
		public BackendConfiguration deserialize(
				final JsonElement json,
				final Type typeOfT,
				final JsonDeserializationContext context) throws JsonParseException {

			if (!json.isJsonObject())
				throw new JsonParseException("Backend configuration must be an object: " + json);
			final JsonObject obj = json.getAsJsonObject();

			final Backend backend;
			try {
				backend = Backend.fromId(requireString(obj, BACKEND_KEY));
			} catch (final IllegalArgumentException e) {
				throw new JsonParseException(e);
			}

			final CompressionCatalog catalog = CompressionCatalog.forBackend(backend, providers);
			BackendConfiguration configuration = new BackendConfiguration(catalog);
			if (obj.has(NUMBER_OF_JOBS_KEY) && !obj.get(NUMBER_OF_JOBS_KEY).isJsonNull())
				configuration = configuration.withNumberOfJobs(obj.get(NUMBER_OF_JOBS_KEY).getAsInt());

			final JsonElement datasets = obj.get(DATA_IO_CONFIGURATIONS_KEY);
			if (datasets != null && !datasets.isJsonNull()) {
				if (!datasets.isJsonObject())
					throw new JsonParseException("'" + DATA_IO_CONFIGURATIONS_KEY + "' must be an object: " + datasets);
				for (final Map.Entry<String, JsonElement> entry : datasets.getAsJsonObject().entrySet()) {
					final DatasetIOConfiguration datasetConfiguration = deserializeDataset(catalog, entry.getKey(), entry.getValue(), context);
					configuration.set(entry.getKey(), datasetConfiguration);
				}
			}
			return configuration;
		}

		private static DatasetIOConfiguration deserializeDataset(
				final CompressionCatalog catalog,
				final String location,
				final JsonElement json,
				final JsonDeserializationContext context) {

			if (!json.isJsonObject())
				throw new JsonParseException("Configuration of '" + location + "' must be an object: " + json);
			final JsonObject obj = json.getAsJsonObject();

			final DType dtype = context.deserialize(require(obj, DTYPE_KEY), DType.class);
			final DatasetInfo datasetInfo = new DatasetInfo(
					requireString(obj, OBJECT_ID_KEY),
					location,
					dtype,
					context.<long[]>deserialize(require(obj, FULL_SHAPE_KEY), long[].class));
			if (obj.has(COMPRESSION_CODEC_KEY) && !obj.get(COMPRESSION_CODEC_KEY).isJsonNull())
				throw new JsonParseException(String.format(
						"Configuration of '%s' uses the codec instance %s which cannot be read back, replace '%s' by a '%s'.",
						location,
						obj.get(COMPRESSION_CODEC_KEY),
						COMPRESSION_CODEC_KEY,
						COMPRESSION_METHOD_KEY));

			final long[] chunkShape = context.deserialize(require(obj, CHUNK_SHAPE_KEY), long[].class);
			final long[] bufferShape = context.deserialize(require(obj, BUFFER_SHAPE_KEY), long[].class);
			final String compressionMethod = obj.has(COMPRESSION_METHOD_KEY) && !obj.get(COMPRESSION_METHOD_KEY).isJsonNull()
					? obj.get(COMPRESSION_METHOD_KEY).getAsString()
					: DatasetIOConfiguration.DEFAULT_COMPRESSION_METHOD;
			final Map<String, Object> compressionOptions = JsonValues.toMap(obj.get(COMPRESSION_OPTIONS_KEY));

			switch (catalog.getBackend()) {
			case HDF5:
				return new Hdf5DatasetIOConfiguration(catalog, datasetInfo, chunkShape, bufferShape, compressionMethod, compressionOptions);
			default:
				return new ZarrDatasetIOConfiguration(
						catalog,
						datasetInfo,
						chunkShape,
						bufferShape,
						compressionMethod,
						compressionOptions,
						filterMethods(obj.get(FILTER_METHODS_KEY)),
						filterOptions(obj.get(FILTER_OPTIONS_KEY)));
			}
		}

		private static List<String> filterMethods(final JsonElement json) {

			if (json == null || json.isJsonNull())
				return null;
			final List<String> methods = new ArrayList<>();
			for (final JsonElement element : json.getAsJsonArray())
				methods.add(element.getAsString());
			return methods;
		}

		private static List<Map<String, Object>> filterOptions(final JsonElement json) {

			if (json == null || json.isJsonNull())
				return null;
			final List<Map<String, Object>> options = new ArrayList<>();
			for (final JsonElement element : json.getAsJsonArray())
				options.add(JsonValues.toMap(element));
			return options;
		}

		private static JsonElement require(final JsonObject obj, final String key) {

			final JsonElement element = obj.get(key);
			if (element == null || element.isJsonNull())
				throw new JsonParseException("Missing '" + key + "' in " + obj);
			return element;
		}

		private static String requireString(final JsonObject obj, final String key) {

			return require(obj, key).getAsString();
		}

		@Override
		public JsonElement serialize(
				final BackendConfiguration src,
				final Type typeOfSrc,
				final JsonSerializationContext context) {

			final JsonObject json = new JsonObject();
			json.addProperty(BACKEND_KEY, src.getBackend().getId());
			if (src.getNumberOfJobs() != null)
				json.addProperty(NUMBER_OF_JOBS_KEY, src.getNumberOfJobs());

			final JsonObject datasets = new JsonObject();
			for (final Map.Entry<String, DatasetIOConfiguration> entry : src.getDatasetConfigurations().entrySet())
				datasets.add(entry.getKey(), serializeDataset(entry.getValue(), context));
			json.add(DATA_IO_CONFIGURATIONS_KEY, datasets);
			return json;
		}

		private static JsonObject serializeDataset(final DatasetIOConfiguration configuration, final JsonSerializationContext context) {

			final JsonObject json = new JsonObject();
			json.addProperty(OBJECT_ID_KEY, configuration.getObjectId());
			json.add(DTYPE_KEY, context.serialize(configuration.getDType(), DType.class));
			json.add(FULL_SHAPE_KEY, context.serialize(configuration.getFullShape()));
			json.add(CHUNK_SHAPE_KEY, context.serialize(configuration.getChunkShape()));
			json.add(BUFFER_SHAPE_KEY, context.serialize(configuration.getBufferShape()));

			final Codec codec = configuration.getCompressionCodec();
			if (codec != null) {
				LOG.warn("Codec {} of '{}' is written for reference only and cannot be read back", codec.getId(), configuration.getLocation());
				final JsonObject codecJson = new JsonObject();
				codecJson.addProperty(CODEC_ID_KEY, codec.getId());
				for (final Map.Entry<String, Object> parameter : codec.getConfiguration().entrySet())
					codecJson.add(parameter.getKey(), context.serialize(parameter.getValue()));
				json.add(COMPRESSION_CODEC_KEY, codecJson);
			} else {
				json.addProperty(COMPRESSION_METHOD_KEY, configuration.getCompressionMethod());
				if (!configuration.getCompressionOptions().isEmpty())
					json.add(COMPRESSION_OPTIONS_KEY, context.serialize(configuration.getCompressionOptions()));
			}

			if (configuration instanceof ZarrDatasetIOConfiguration) {
				final ZarrDatasetIOConfiguration zarrConfiguration = (ZarrDatasetIOConfiguration)configuration;
				if (zarrConfiguration.getFilterMethods() != null) {
					final JsonArray methods = new JsonArray();
					for (final String method : zarrConfiguration.getFilterMethods())
						methods.add(method);
					json.add(FILTER_METHODS_KEY, methods);
				}
				if (zarrConfiguration.getFilterOptions() != null)
					json.add(FILTER_OPTIONS_KEY, context.serialize(zarrConfiguration.getFilterOptions()));
			}
			return json;
		}
	}
}
