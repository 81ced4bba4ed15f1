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
package org.janelia.saalfeldlab.n5.backend.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.janelia.saalfeldlab.n5.backend.BackendConfiguration;
import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.NoWritableDatasetsException;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.UnsupportedDtypeException;
import org.janelia.saalfeldlab.n5.backend.codec.CompressionCatalog;
import org.janelia.saalfeldlab.n5.backend.dataset.DatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.dataset.DatasetInfo;
import org.janelia.saalfeldlab.n5.backend.dataset.Hdf5DatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.dataset.ZarrDatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.io.DataIO;
import org.janelia.saalfeldlab.n5.backend.shape.ShapeEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds every array of an object graph that will become a dataset and
 * creates its default configuration.
 */
public class ConfigurationBuilder {

	private static final Logger LOG = LoggerFactory.getLogger(ConfigurationBuilder.class);

	/* fields that hold dataset arrays, in the order they are configured */
	public static final List<String> DATASET_FIELDS = Collections.unmodifiableList(
			Arrays.asList(DatasetInfo.DATA, DatasetInfo.TIMESTAMPS));

	private final CompressionCatalog catalog;
	private final long chunkTargetBytes;
	private final long bufferTargetBytes;

	public ConfigurationBuilder(final CompressionCatalog catalog) {

		this(catalog, ShapeEstimator.DEFAULT_CHUNK_TARGET_BYTES, ShapeEstimator.DEFAULT_BUFFER_TARGET_BYTES);
	}

	public ConfigurationBuilder(final CompressionCatalog catalog, final long chunkTargetBytes, final long bufferTargetBytes) {

		if (chunkTargetBytes <= 0 || bufferTargetBytes <= 0)
			throw new IllegalArgumentException(
					"Target sizes must be positive but are " + chunkTargetBytes + " and " + bufferTargetBytes + " bytes.");

		this.catalog = Objects.requireNonNull(catalog, "catalog");
		this.chunkTargetBytes = chunkTargetBytes;
		this.bufferTargetBytes = bufferTargetBytes;
	}

	public CompressionCatalog getCatalog() {

		return catalog;
	}

	/**
	 * @param root the root of the object graph
	 * @return default configurations of all writable datasets in traversal order, possibly empty
	 * @throws IllegalStateException if two objects share an id or two datasets share a location
	 * @throws UnsupportedDtypeException if an object array holds anything but strings
	 */
	public List<DatasetIOConfiguration> discover(final Container root) {

		final List<DatasetIOConfiguration> configurations = new ArrayList<>();
		final Map<String, String> owners = new HashMap<>();
		ContainerTraversal.traverse(root, (container, path) -> {
			final Map<String, ?> fields = container.getFields();
			for (final String field : DATASET_FIELDS) {
				final String location = ContainerTraversal.childPath(path, field);
				final DatasetIOConfiguration configuration = configure(container.getObjectId(), location, fields.get(field));
				if (configuration != null) {
					final String owner = owners.putIfAbsent(location, container.getObjectId());
					if (owner != null)
						throw new IllegalStateException(String.format(
								"Objects '%s' and '%s' both write a dataset at location '%s'.",
								owner,
								container.getObjectId(),
								location));
					configurations.add(configuration);
				}
			}
		});
		return configurations;
	}

	/**
	 * @param root the root of the object graph
	 * @return a configuration of all writable datasets
	 * @throws NoWritableDatasetsException if there are none
	 */
	public BackendConfiguration build(final Container root) {

		final List<DatasetIOConfiguration> configurations = discover(root);
		if (configurations.isEmpty())
			throw new NoWritableDatasetsException(
					"No datasets that can be configured were found below '" + root.getName() + "'.");

		final BackendConfiguration backendConfiguration = new BackendConfiguration(catalog);
		for (final DatasetIOConfiguration configuration : configurations)
			backendConfiguration.set(configuration.getLocation(), configuration);
		return backendConfiguration;
	}

	/**
	 * @return the default configuration or {@code null} if the field is not written as a configurable dataset
	 */
	protected DatasetIOConfiguration configure(final String objectId, final String location, final Object value) {

		if (value == null)
			return null;
		if (value instanceof Container) {
			LOG.debug("Skipping '{}', it links to '{}'", location, ((Container)value).getName());
			return null;
		}
		if (value instanceof DataIO) {
			LOG.debug("Skipping '{}', it is already wrapped in a DataIO", location);
			return null;
		}
		if (!(value instanceof ArraySource)) {
			LOG.debug("Skipping '{}', {} is not an array source", location, value.getClass().getName());
			return null;
		}

		final ArraySource source = (ArraySource)value;
		if (source.isWrittenToFile()) {
			LOG.debug("Skipping '{}', it is already written to the file", location);
			return null;
		}

		final long[] shape = source.getShape();
		if (ShapeEstimator.isEmpty(shape)) {
			LOG.debug("Skipping '{}', shape {} has no elements", location, Arrays.toString(shape));
			return null;
		}

		final DType dtype = source.getDType();
		if (dtype.isObject() && !holdsStrings(location, source))
			return null;

		final DatasetInfo datasetInfo = new DatasetInfo(objectId, location, dtype, shape);
		final DatasetIOConfiguration configuration;
		if (source instanceof ChunkedArraySource) {
			final ChunkedArraySource chunked = (ChunkedArraySource)source;
			configuration = fromShapes(datasetInfo, chunked.getChunkShape(), chunked.getBufferShape());
		} else
			configuration = fromDefaults(datasetInfo);

		LOG.debug("Configured '{}' with chunk shape {}", location, Arrays.toString(configuration.getChunkShape()));
		return configuration;
	}

	/**
	 * Object arrays are written as variable length UTF-8 strings.  Arrays that
	 * reference containers are written as references by the writer and are
	 * not configurable.
	 *
	 * @return false if the array references containers
	 * @throws UnsupportedDtypeException if the elements are anything else
	 */
	private static boolean holdsStrings(final String location, final ArraySource source) {

		if (!(source instanceof InMemoryArray) || ((InMemoryArray)source).getElements() == null)
			throw new UnsupportedDtypeException(
					"Cannot inspect the elements of object array '" + location + "', only in-memory string arrays are supported.");

		final List<Object> elements = ((InMemoryArray)source).getElements();
		for (final Object element : elements) {
			if (element instanceof Container) {
				LOG.debug("Skipping '{}', it references containers", location);
				return false;
			}
		}
		for (final Object element : elements) {
			if (!(element instanceof CharSequence))
				throw new UnsupportedDtypeException(String.format(
						"Object array '%s' holds %s, only strings are supported for object arrays.",
						location,
						element == null ? "null" : element.getClass().getName()));
		}
		return true;
	}

	private DatasetIOConfiguration fromDefaults(final DatasetInfo datasetInfo) {

		switch (catalog.getBackend()) {
		case HDF5:
			return Hdf5DatasetIOConfiguration.fromDefaults(catalog, datasetInfo, chunkTargetBytes, bufferTargetBytes);
		default:
			return ZarrDatasetIOConfiguration.fromDefaults(catalog, datasetInfo, chunkTargetBytes, bufferTargetBytes);
		}
	}

	private DatasetIOConfiguration fromShapes(final DatasetInfo datasetInfo, final long[] chunkShape, final long[] bufferShape) {

		switch (catalog.getBackend()) {
		case HDF5:
			return Hdf5DatasetIOConfiguration.fromShapes(catalog, datasetInfo, chunkShape, bufferShape);
		default:
			return ZarrDatasetIOConfiguration.fromShapes(catalog, datasetInfo, chunkShape, bufferShape);
		}
	}
}
