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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.janelia.saalfeldlab.n5.backend.Backend;
import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.BackendCompressionMismatchException;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.ShapeMismatchException;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.UnknownCompressionMethodException;
import org.janelia.saalfeldlab.n5.backend.codec.Codec;
import org.janelia.saalfeldlab.n5.backend.codec.CompressionCatalog;
import org.janelia.saalfeldlab.n5.backend.shape.ShapeEstimator;

/**
 * How one array is chunked, buffered and compressed when it is written.
 *
 * Instances are immutable and always valid.  Every {@code with...} method
 * returns a new, fully validated copy and leaves the receiver untouched when
 * validation fails.  For every axis
 * <pre>
 * 0 &lt; chunkShape[i] &lt;= bufferShape[i] &lt;= fullShape[i]
 * </pre>
 * and the buffer shape is a multiple of the chunk shape on every axis that
 * does not span the whole array.
 *
 * There is exactly one subclass per {@link Backend}.
 */
public abstract class DatasetIOConfiguration {

	/* lossless and available for both backends */
	public static final String DEFAULT_COMPRESSION_METHOD = "gzip";

	protected final CompressionCatalog catalog;
	protected final DatasetInfo datasetInfo;
	protected final long[] chunkShape;
	protected final long[] bufferShape;
	protected final String compressionMethod;
	protected final Map<String, Object> compressionOptions;
	protected final Codec compressionCodec;

	DatasetIOConfiguration(
			final Backend backend,
			final CompressionCatalog catalog,
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape,
			final String compressionMethod,
			final Map<String, ?> compressionOptions,
			final Codec compressionCodec) {

		Objects.requireNonNull(catalog, "catalog");
		if (catalog.getBackend() != backend)
			throw new BackendCompressionMismatchException(
					"A " + backend + " dataset configuration cannot use the " + catalog.getBackend() + " compression catalog.");

		this.catalog = catalog;
		this.datasetInfo = Objects.requireNonNull(datasetInfo, "datasetInfo");
		this.chunkShape = Objects.requireNonNull(chunkShape, "chunkShape").clone();
		this.bufferShape = Objects.requireNonNull(bufferShape, "bufferShape").clone();
		this.compressionCodec = compressionCodec;
		if (compressionCodec != null)
			this.compressionMethod = compressionCodec.getId();
		else
			this.compressionMethod = compressionMethod == null ? CompressionCatalog.NONE : compressionMethod;

		final LinkedHashMap<String, Object> options = new LinkedHashMap<>();
		if (compressionOptions != null)
			options.putAll(compressionOptions);
		this.compressionOptions = Collections.unmodifiableMap(options);

		validateShapes(datasetInfo.getLocation(), datasetInfo.getFullShape(), this.chunkShape, this.bufferShape);
		validateCompression();
	}

	/**
	 * Checks rank agreement, bounds and divisibility of the three shapes.
	 *
	 * @param location for the error message
	 * @param fullShape the whole array
	 * @param chunkShape the chunk shape
	 * @param bufferShape the buffer shape
	 * @throws ShapeMismatchException naming the offending axis and shapes
	 */
	public static void validateShapes(
			final String location,
			final long[] fullShape,
			final long[] chunkShape,
			final long[] bufferShape) {

		if (chunkShape.length != bufferShape.length)
			throw new ShapeMismatchException(String.format(
					"Rank of chunk shape %s does not match rank of buffer shape %s for dataset at location '%s'.",
					Arrays.toString(chunkShape), Arrays.toString(bufferShape), location));
		if (bufferShape.length != fullShape.length)
			throw new ShapeMismatchException(String.format(
					"Rank of buffer shape %s does not match rank of full shape %s for dataset at location '%s'.",
					Arrays.toString(bufferShape), Arrays.toString(fullShape), location));

		for (int i = 0; i < fullShape.length; ++i) {
			if (chunkShape[i] <= 0)
				throw new ShapeMismatchException(String.format(
						"Axis %d of chunk shape %s is not positive for dataset at location '%s'.",
						i, Arrays.toString(chunkShape), location));
			if (chunkShape[i] > bufferShape[i])
				throw new ShapeMismatchException(String.format(
						"Axis %d of chunk shape %s exceeds buffer shape %s for dataset at location '%s'.",
						i, Arrays.toString(chunkShape), Arrays.toString(bufferShape), location));
			if (bufferShape[i] > fullShape[i])
				throw new ShapeMismatchException(String.format(
						"Axis %d of buffer shape %s exceeds full shape %s for dataset at location '%s'.",
						i, Arrays.toString(bufferShape), Arrays.toString(fullShape), location));
			if (bufferShape[i] != fullShape[i] && bufferShape[i] % chunkShape[i] != 0)
				throw new ShapeMismatchException(String.format(
						"Axis %d of chunk shape %s does not evenly divide buffer shape %s for dataset at location '%s'.",
						i, Arrays.toString(chunkShape), Arrays.toString(bufferShape), location));
		}
	}

	/**
	 * @throws UnknownCompressionMethodException if the method is not in the catalog
	 */
	private void validateCompression() {

		if (compressionCodec == null) {
			catalog.resolve(compressionMethod);
			if (CompressionCatalog.NONE.equals(compressionMethod) && !compressionOptions.isEmpty())
				throw new IllegalArgumentException(
						"Compression options " + compressionOptions + " given without a compression method for dataset at location '" + getLocation() + "'.");
		} else if (!compressionOptions.isEmpty())
			throw new IllegalArgumentException(
					"Compression options " + compressionOptions + " cannot be combined with the instantiated codec " + compressionCodec + " for dataset at location '" + getLocation() + "'.");
	}

	/**
	 * Creates a validated copy with the given mutable fields, the identity of
	 * the dataset is carried over.
	 */
	protected abstract DatasetIOConfiguration copy(
			long[] chunkShape,
			long[] bufferShape,
			String compressionMethod,
			Map<String, ?> compressionOptions,
			Codec compressionCodec);

	public DatasetIOConfiguration withChunkShape(final long[] chunkShape) {

		return copy(chunkShape, bufferShape, compressionMethod, compressionOptions, compressionCodec);
	}

	public DatasetIOConfiguration withBufferShape(final long[] bufferShape) {

		return copy(chunkShape, bufferShape, compressionMethod, compressionOptions, compressionCodec);
	}

	/**
	 * Replaces chunk and buffer shape together, needed whenever the new chunk
	 * shape does not fit the old buffer shape or vice versa.
	 */
	public DatasetIOConfiguration withShapes(final long[] chunkShape, final long[] bufferShape) {

		return copy(chunkShape, bufferShape, compressionMethod, compressionOptions, compressionCodec);
	}

	/**
	 * Selects a compression method by name and drops the previous options.
	 *
	 * @param compressionMethod a name in the catalog, {@code null} or "none" to disable compression
	 */
	public DatasetIOConfiguration withCompressionMethod(final String compressionMethod) {

		return copy(chunkShape, bufferShape, compressionMethod, null, null);
	}

	public DatasetIOConfiguration withCompressionMethod(final String compressionMethod, final Map<String, ?> compressionOptions) {

		return copy(chunkShape, bufferShape, compressionMethod, compressionOptions, null);
	}

	public DatasetIOConfiguration withCompressionOptions(final Map<String, ?> compressionOptions) {

		return copy(chunkShape, bufferShape, compressionMethod, compressionOptions, compressionCodec);
	}

	/**
	 * Uses an instantiated codec instead of a named method, bypassing the
	 * catalog.  This is how lossy codecs are opted into.
	 */
	public DatasetIOConfiguration withCompressionCodec(final Codec compressionCodec) {

		return copy(chunkShape, bufferShape, null, null, Objects.requireNonNull(compressionCodec, "compressionCodec"));
	}

	public Backend getBackend() {

		return catalog.getBackend();
	}

	public CompressionCatalog getCatalog() {

		return catalog;
	}

	public DatasetInfo getDatasetInfo() {

		return datasetInfo;
	}

	public String getObjectId() {

		return datasetInfo.getObjectId();
	}

	public String getLocation() {

		return datasetInfo.getLocation();
	}

	public String getDatasetName() {

		return datasetInfo.getDatasetName();
	}

	public DType getDType() {

		return datasetInfo.getDType();
	}

	public long[] getFullShape() {

		return datasetInfo.getFullShape();
	}

	public long[] getChunkShape() {

		return chunkShape.clone();
	}

	public long[] getBufferShape() {

		return bufferShape.clone();
	}

	/**
	 * @return the catalog name, the codec id if an instantiated codec is used, or "none"
	 */
	public String getCompressionMethod() {

		return compressionMethod;
	}

	public Map<String, Object> getCompressionOptions() {

		return compressionOptions;
	}

	/**
	 * @return the instantiated codec or {@code null} if the compression method is resolved by name
	 */
	public Codec getCompressionCodec() {

		return compressionCodec;
	}

	public boolean isCompressed() {

		return compressionCodec != null || !CompressionCatalog.NONE.equals(compressionMethod);
	}

	public long getSourceSizeInBytes() {

		return datasetInfo.getSourceSizeInBytes();
	}

	/**
	 * @return the largest amount of RAM held per write iteration
	 */
	public long getBufferSizeInBytes() {

		return ShapeEstimator.sizeInBytes(bufferShape, getDType().getItemSize());
	}

	/**
	 * @return the uncompressed size of one chunk on disk
	 */
	public long getChunkSizeInBytes() {

		return ShapeEstimator.sizeInBytes(chunkShape, getDType().getItemSize());
	}

	/**
	 * The keyword arguments the backend's writer expects for this dataset.
	 *
	 * @return backend specific I/O arguments
	 */
	public Map<String, Object> getDataIOArguments() {

		return catalog.buildIOArguments(this);
	}

	@Override
	public boolean equals(final Object other) {

		if (this == other)
			return true;
		if (other == null || getClass() != other.getClass())
			return false;
		final DatasetIOConfiguration that = (DatasetIOConfiguration)other;
		return datasetInfo.equals(that.datasetInfo) &&
				Arrays.equals(chunkShape, that.chunkShape) &&
				Arrays.equals(bufferShape, that.bufferShape) &&
				compressionMethod.equals(that.compressionMethod) &&
				compressionOptions.equals(that.compressionOptions) &&
				Objects.equals(compressionCodec, that.compressionCodec);
	}

	@Override
	public int hashCode() {

		return Objects.hash(
				getClass(),
				datasetInfo,
				Arrays.hashCode(chunkShape),
				Arrays.hashCode(bufferShape),
				compressionMethod,
				compressionOptions,
				compressionCodec);
	}

	/**
	 * A multi-line report meant for printing, not a machine readable form.
	 */
	@Override
	public String toString() {

		final StringBuilder string = new StringBuilder(datasetInfo.toString());
		string.append("\n");
		string.append("\n  buffer shape : ").append(Arrays.toString(bufferShape));
		string.append("\n  expected RAM usage : ").append(ByteSize.format(getBufferSizeInBytes()));
		string.append("\n");
		string.append("\n  chunk shape : ").append(Arrays.toString(chunkShape));
		string.append("\n  disk space usage per chunk : ").append(ByteSize.format(getChunkSizeInBytes()));
		string.append("\n");
		if (compressionCodec != null)
			string.append("\n  compression codec : ").append(compressionCodec);
		else
			string.append("\n  compression method : ").append(compressionMethod);
		if (!compressionOptions.isEmpty())
			string.append("\n  compression options : ").append(compressionOptions);
		string.append("\n");
		return string.toString();
	}
}
