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
package org.janelia.saalfeldlab.n5.backend.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.janelia.saalfeldlab.n5.backend.Backend;
import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.UnknownCompressionMethodException;
import org.janelia.saalfeldlab.n5.backend.codec.Codec;
import org.janelia.saalfeldlab.n5.backend.codec.CompressionCatalog;
import org.janelia.saalfeldlab.n5.backend.shape.ShapeEstimator;

/**
 * Configuration of a dataset that will be written to a Zarr store.  In
 * addition to the compressor, zarr applies an ordered list of filters to
 * every chunk before compression.  Filters are resolved by name against the
 * same catalog as the compressor.
 */
public final class ZarrDatasetIOConfiguration extends DatasetIOConfiguration {

	private final List<String> filterMethods;
	private final List<Map<String, Object>> filterOptions;

	public ZarrDatasetIOConfiguration(
			final CompressionCatalog catalog,
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape,
			final String compressionMethod,
			final Map<String, ?> compressionOptions,
			final List<String> filterMethods,
			final List<? extends Map<String, ?>> filterOptions) {

		this(catalog, datasetInfo, chunkShape, bufferShape, compressionMethod, compressionOptions, null, filterMethods, filterOptions);
	}

	public ZarrDatasetIOConfiguration(
			final CompressionCatalog catalog,
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape,
			final String compressionMethod,
			final Map<String, ?> compressionOptions) {

		this(catalog, datasetInfo, chunkShape, bufferShape, compressionMethod, compressionOptions, null, null, null);
	}

	public ZarrDatasetIOConfiguration(
			final CompressionCatalog catalog,
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape,
			final Codec compressionCodec) {

		this(catalog, datasetInfo, chunkShape, bufferShape, null, null, compressionCodec, null, null);
	}

	public ZarrDatasetIOConfiguration(
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape,
			final String compressionMethod,
			final Map<String, ?> compressionOptions) {

		this(CompressionCatalog.forBackend(Backend.ZARR), datasetInfo, chunkShape, bufferShape, compressionMethod, compressionOptions);
	}

	private ZarrDatasetIOConfiguration(
			final CompressionCatalog catalog,
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape,
			final String compressionMethod,
			final Map<String, ?> compressionOptions,
			final Codec compressionCodec,
			final List<String> filterMethods,
			final List<? extends Map<String, ?>> filterOptions) {

		super(Backend.ZARR, catalog, datasetInfo, chunkShape, bufferShape, compressionMethod, compressionOptions, compressionCodec);

		this.filterMethods = filterMethods == null ? null : Collections.unmodifiableList(new ArrayList<>(filterMethods));
		if (filterOptions == null)
			this.filterOptions = null;
		else {
			final List<Map<String, Object>> options = new ArrayList<>(filterOptions.size());
			for (final Map<String, ?> option : filterOptions)
				options.add(Collections.unmodifiableMap(option == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<String, Object>(option)));
			this.filterOptions = Collections.unmodifiableList(options);
		}

		validateFilters();
	}

	/**
	 * @throws IllegalArgumentException if options are given without methods or the counts differ
	 * @throws UnknownCompressionMethodException if a filter is not in the catalog
	 */
	private void validateFilters() {

		if (filterMethods == null) {
			if (filterOptions != null)
				throw new IllegalArgumentException(
						"Filter options " + filterOptions + " given without filter methods for dataset at location '" + getLocation() + "'.");
			return;
		}

		if (filterOptions != null && filterOptions.size() != filterMethods.size())
			throw new IllegalArgumentException(String.format(
					"Length mismatch between filter methods (%d methods specified) and filter options (%d options found) for dataset at location '%s'.",
					filterMethods.size(), filterOptions.size(), getLocation()));

		for (final String filterMethod : filterMethods) {
			if (filterMethod == null || CompressionCatalog.NONE.equals(filterMethod))
				throw new UnknownCompressionMethodException(
						"'" + filterMethod + "' is not a filter method, valid methods are " + catalog.getAvailableNames() + ".",
						catalog.getAvailableNames());
			catalog.resolve(filterMethod);
		}
	}

	public static ZarrDatasetIOConfiguration fromDefaults(
			final String objectId,
			final String location,
			final long[] fullShape,
			final DType dtype) {

		return fromDefaults(CompressionCatalog.forBackend(Backend.ZARR), new DatasetInfo(objectId, location, dtype, fullShape));
	}

	public static ZarrDatasetIOConfiguration fromDefaults(final CompressionCatalog catalog, final DatasetInfo datasetInfo) {

		return fromDefaults(
				catalog,
				datasetInfo,
				ShapeEstimator.DEFAULT_CHUNK_TARGET_BYTES,
				ShapeEstimator.DEFAULT_BUFFER_TARGET_BYTES);
	}

	public static ZarrDatasetIOConfiguration fromDefaults(
			final CompressionCatalog catalog,
			final DatasetInfo datasetInfo,
			final long chunkTargetBytes,
			final long bufferTargetBytes) {

		final ShapeEstimator.Shapes shapes = ShapeEstimator.estimate(
				datasetInfo.getFullShape(),
				datasetInfo.getDType().getItemSize(),
				chunkTargetBytes,
				bufferTargetBytes);
		return fromShapes(catalog, datasetInfo, shapes.getChunkShape(), shapes.getBufferShape());
	}

	public static ZarrDatasetIOConfiguration fromShapes(
			final CompressionCatalog catalog,
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape) {

		return new ZarrDatasetIOConfiguration(catalog, datasetInfo, chunkShape, bufferShape, DEFAULT_COMPRESSION_METHOD, null);
	}

	/**
	 * @return the filter names in order of application or {@code null} if no filters are applied
	 */
	public List<String> getFilterMethods() {

		return filterMethods;
	}

	/**
	 * @return the options of each filter or {@code null} if all filters use their defaults
	 */
	public List<Map<String, Object>> getFilterOptions() {

		return filterOptions;
	}

	@Override
	protected ZarrDatasetIOConfiguration copy(
			final long[] chunkShape,
			final long[] bufferShape,
			final String compressionMethod,
			final Map<String, ?> compressionOptions,
			final Codec compressionCodec) {

		return new ZarrDatasetIOConfiguration(
				catalog,
				datasetInfo,
				chunkShape,
				bufferShape,
				compressionMethod,
				compressionOptions,
				compressionCodec,
				filterMethods,
				filterOptions);
	}

	/**
	 * Replaces the filters, the previous filter options are dropped.
	 *
	 * @param filterMethods filter names in order of application, {@code null} for none
	 */
	public ZarrDatasetIOConfiguration withFilterMethods(final List<String> filterMethods) {

		return withFilters(filterMethods, null);
	}

	public ZarrDatasetIOConfiguration withFilterOptions(final List<? extends Map<String, ?>> filterOptions) {

		return withFilters(filterMethods, filterOptions);
	}

	public ZarrDatasetIOConfiguration withFilters(final List<String> filterMethods, final List<? extends Map<String, ?>> filterOptions) {

		return new ZarrDatasetIOConfiguration(
				catalog,
				datasetInfo,
				chunkShape,
				bufferShape,
				compressionMethod,
				compressionOptions,
				compressionCodec,
				filterMethods,
				filterOptions);
	}

	@Override
	public ZarrDatasetIOConfiguration withChunkShape(final long[] chunkShape) {

		return (ZarrDatasetIOConfiguration)super.withChunkShape(chunkShape);
	}

	@Override
	public ZarrDatasetIOConfiguration withBufferShape(final long[] bufferShape) {

		return (ZarrDatasetIOConfiguration)super.withBufferShape(bufferShape);
	}

	@Override
	public ZarrDatasetIOConfiguration withShapes(final long[] chunkShape, final long[] bufferShape) {

		return (ZarrDatasetIOConfiguration)super.withShapes(chunkShape, bufferShape);
	}

	@Override
	public ZarrDatasetIOConfiguration withCompressionMethod(final String compressionMethod) {

		return (ZarrDatasetIOConfiguration)super.withCompressionMethod(compressionMethod);
	}

	@Override
	public ZarrDatasetIOConfiguration withCompressionMethod(final String compressionMethod, final Map<String, ?> compressionOptions) {

		return (ZarrDatasetIOConfiguration)super.withCompressionMethod(compressionMethod, compressionOptions);
	}

	@Override
	public ZarrDatasetIOConfiguration withCompressionOptions(final Map<String, ?> compressionOptions) {

		return (ZarrDatasetIOConfiguration)super.withCompressionOptions(compressionOptions);
	}

	@Override
	public ZarrDatasetIOConfiguration withCompressionCodec(final Codec compressionCodec) {

		return (ZarrDatasetIOConfiguration)super.withCompressionCodec(compressionCodec);
	}

	@Override
	public boolean equals(final Object other) {

		if (!super.equals(other))
			return false;
		final ZarrDatasetIOConfiguration that = (ZarrDatasetIOConfiguration)other;
		return Objects.equals(filterMethods, that.filterMethods) && Objects.equals(filterOptions, that.filterOptions);
	}

	@Override
	public int hashCode() {

		return 31 * super.hashCode() + Objects.hash(filterMethods, filterOptions);
	}

	@Override
	public String toString() {

		final StringBuilder string = new StringBuilder(super.toString());
		if (filterMethods != null)
			string.append("\n  filter methods : ").append(filterMethods);
		if (filterOptions != null)
			string.append("\n  filter options : ").append(filterOptions);
		if (filterMethods != null || filterOptions != null)
			string.append("\n");
		return string.toString();
	}
}
