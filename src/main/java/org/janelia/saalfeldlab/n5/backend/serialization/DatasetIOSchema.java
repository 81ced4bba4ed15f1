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

import static org.janelia.saalfeldlab.n5.backend.serialization.BackendConfigurationJson.BUFFER_SHAPE_KEY;
import static org.janelia.saalfeldlab.n5.backend.serialization.BackendConfigurationJson.CHUNK_SHAPE_KEY;
import static org.janelia.saalfeldlab.n5.backend.serialization.BackendConfigurationJson.COMPRESSION_METHOD_KEY;
import static org.janelia.saalfeldlab.n5.backend.serialization.BackendConfigurationJson.COMPRESSION_OPTIONS_KEY;
import static org.janelia.saalfeldlab.n5.backend.serialization.BackendConfigurationJson.FILTER_METHODS_KEY;
import static org.janelia.saalfeldlab.n5.backend.serialization.BackendConfigurationJson.FILTER_OPTIONS_KEY;

import org.janelia.saalfeldlab.n5.backend.Backend;
import org.janelia.saalfeldlab.n5.backend.codec.CompressionCatalog;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * JSON schema of the user editable part of a dataset configuration as found
 * in the JSON form written by {@link BackendConfigurationJson}.  Instantiated
 * codecs have no JSON form and do not appear.
 */
public final class DatasetIOSchema {

	public static final String SCHEMA_VERSION = "http://json-schema.org/draft-07/schema#";

	private DatasetIOSchema() {}

	public static JsonObject forBackend(final Backend backend) {

		return forCatalog(CompressionCatalog.forBackend(backend));
	}

	/**
	 * @param catalog the catalog that provides the valid compression names
	 * @return the schema
	 */
	public static JsonObject forCatalog(final CompressionCatalog catalog) {

		final JsonObject schema = new JsonObject();
		schema.addProperty("$schema", SCHEMA_VERSION);
		schema.addProperty("title", catalog.getBackend() + " dataset configuration");
		schema.addProperty("type", "object");

		final JsonObject properties = new JsonObject();
		properties.add(CHUNK_SHAPE_KEY, shape("Shape of the chunks stored on disk."));
		properties.add(BUFFER_SHAPE_KEY, shape("Shape of the pieces held in memory while writing, a multiple of the chunk shape."));

		final JsonArray methods = names(catalog);
		methods.add(CompressionCatalog.NONE);
		final JsonObject compressionMethod = new JsonObject();
		compressionMethod.addProperty("type", "string");
		compressionMethod.add("enum", methods);
		compressionMethod.addProperty("description", "Name of the compression method, \"" + CompressionCatalog.NONE + "\" to disable compression.");
		properties.add(COMPRESSION_METHOD_KEY, compressionMethod);

		final JsonObject compressionOptions = new JsonObject();
		compressionOptions.add("type", strings("object", "null"));
		compressionOptions.addProperty("description", "Parameters of the compression method.");
		properties.add(COMPRESSION_OPTIONS_KEY, compressionOptions);

		if (catalog.getBackend() == Backend.ZARR) {
			final JsonObject filterName = new JsonObject();
			filterName.addProperty("type", "string");
			filterName.add("enum", names(catalog));
			final JsonObject filterMethods = new JsonObject();
			filterMethods.add("type", strings("array", "null"));
			filterMethods.add("items", filterName);
			filterMethods.addProperty("description", "Filters applied to each chunk before compression, in order.");
			properties.add(FILTER_METHODS_KEY, filterMethods);

			final JsonObject filterOption = new JsonObject();
			filterOption.addProperty("type", "object");
			final JsonObject filterOptions = new JsonObject();
			filterOptions.add("type", strings("array", "null"));
			filterOptions.add("items", filterOption);
			filterOptions.addProperty("description", "Parameters of each filter, requires " + FILTER_METHODS_KEY + " of the same length.");
			properties.add(FILTER_OPTIONS_KEY, filterOptions);
		}

		schema.add("properties", properties);
		schema.add("required", strings(CHUNK_SHAPE_KEY, BUFFER_SHAPE_KEY, COMPRESSION_METHOD_KEY));
		return schema;
	}

	private static JsonObject shape(final String description) {

		final JsonObject extent = new JsonObject();
		extent.addProperty("type", "integer");
		extent.addProperty("minimum", 1);

		final JsonObject shape = new JsonObject();
		shape.addProperty("type", "array");
		shape.add("items", extent);
		shape.addProperty("minItems", 1);
		shape.addProperty("description", description);
		return shape;
	}

	private static JsonArray names(final CompressionCatalog catalog) {

		final JsonArray names = new JsonArray();
		for (final String name : catalog.getAvailableNames())
			names.add(name);
		return names;
	}

	private static JsonArray strings(final String... values) {

		final JsonArray array = new JsonArray();
		for (final String value : values)
			array.add(value);
		return array;
	}
}
