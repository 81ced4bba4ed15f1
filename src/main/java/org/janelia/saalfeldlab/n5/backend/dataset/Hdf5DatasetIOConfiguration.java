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

import java.util.Map;

import org.janelia.saalfeldlab.n5.backend.Backend;
import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.codec.Codec;
import org.janelia.saalfeldlab.n5.backend.codec.CompressionCatalog;
import org.janelia.saalfeldlab.n5.backend.shape.ShapeEstimator;

/**
 * Configuration of a dataset that will be written to an HDF5 file.  The
 * compression method is an HDF5 filter, either one built into the library or
 * a dynamically loaded plugin filter known to the catalog.
 */
public final class Hdf5DatasetIOConfiguration extends DatasetIOConfiguration {

	public Hdf5DatasetIOConfiguration(
			final CompressionCatalog catalog,
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape,
			final String compressionMethod,
			final Map<String, ?> compressionOptions) {

		super(Backend.HDF5, catalog, datasetInfo, chunkShape, bufferShape, compressionMethod, compressionOptions, null);
	}

	public Hdf5DatasetIOConfiguration(
			final CompressionCatalog catalog,
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape,
			final Codec compressionCodec) {

		super(Backend.HDF5, catalog, datasetInfo, chunkShape, bufferShape, null, null, compressionCodec);
	}

	public Hdf5DatasetIOConfiguration(
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape,
			final String compressionMethod,
			final Map<String, ?> compressionOptions) {

		this(CompressionCatalog.forBackend(Backend.HDF5), datasetInfo, chunkShape, bufferShape, compressionMethod, compressionOptions);
	}

	private Hdf5DatasetIOConfiguration(
			final CompressionCatalog catalog,
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape,
			final String compressionMethod,
			final Map<String, ?> compressionOptions,
			final Codec compressionCodec) {

		super(Backend.HDF5, catalog, datasetInfo, chunkShape, bufferShape, compressionMethod, compressionOptions, compressionCodec);
	}

	public static Hdf5DatasetIOConfiguration fromDefaults(
			final String objectId,
			final String location,
			final long[] fullShape,
			final DType dtype) {

		return fromDefaults(CompressionCatalog.forBackend(Backend.HDF5), new DatasetInfo(objectId, location, dtype, fullShape));
	}

	public static Hdf5DatasetIOConfiguration fromDefaults(final CompressionCatalog catalog, final DatasetInfo datasetInfo) {

		return fromDefaults(
				catalog,
				datasetInfo,
				ShapeEstimator.DEFAULT_CHUNK_TARGET_BYTES,
				ShapeEstimator.DEFAULT_BUFFER_TARGET_BYTES);
	}

	/**
	 * Estimates chunk and buffer shape for the given targets and compresses
	 * with {@value DatasetIOConfiguration#DEFAULT_COMPRESSION_METHOD}.
	 */
	public static Hdf5DatasetIOConfiguration fromDefaults(
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

	/**
	 * Adopts chunk and buffer shape as given, e.g. from a source that is
	 * already iterated in chunks, with the default compression.
	 */
	public static Hdf5DatasetIOConfiguration fromShapes(
			final CompressionCatalog catalog,
			final DatasetInfo datasetInfo,
			final long[] chunkShape,
			final long[] bufferShape) {

		return new Hdf5DatasetIOConfiguration(catalog, datasetInfo, chunkShape, bufferShape, DEFAULT_COMPRESSION_METHOD, null);
	}

	@Override
	protected Hdf5DatasetIOConfiguration copy(
			final long[] chunkShape,
			final long[] bufferShape,
			final String compressionMethod,
			final Map<String, ?> compressionOptions,
			final Codec compressionCodec) {

		return new Hdf5DatasetIOConfiguration(catalog, datasetInfo, chunkShape, bufferShape, compressionMethod, compressionOptions, compressionCodec);
	}

	@Override
	public Hdf5DatasetIOConfiguration withChunkShape(final long[] chunkShape) {

		return (Hdf5DatasetIOConfiguration)super.withChunkShape(chunkShape);
	}

	@Override
	public Hdf5DatasetIOConfiguration withBufferShape(final long[] bufferShape) {

		return (Hdf5DatasetIOConfiguration)super.withBufferShape(bufferShape);
	}

	@Override
	public Hdf5DatasetIOConfiguration withShapes(final long[] chunkShape, final long[] bufferShape) {

		return (Hdf5DatasetIOConfiguration)super.withShapes(chunkShape, bufferShape);
	}

	@Override
	public Hdf5DatasetIOConfiguration withCompressionMethod(final String compressionMethod) {

		return (Hdf5DatasetIOConfiguration)super.withCompressionMethod(compressionMethod);
	}

	@Override
	public Hdf5DatasetIOConfiguration withCompressionMethod(final String compressionMethod, final Map<String, ?> compressionOptions) {

		return (Hdf5DatasetIOConfiguration)super.withCompressionMethod(compressionMethod, compressionOptions);
	}

	@Override
	public Hdf5DatasetIOConfiguration withCompressionOptions(final Map<String, ?> compressionOptions) {

		return (Hdf5DatasetIOConfiguration)super.withCompressionOptions(compressionOptions);
	}

	@Override
	public Hdf5DatasetIOConfiguration withCompressionCodec(final Codec compressionCodec) {

		return (Hdf5DatasetIOConfiguration)super.withCompressionCodec(compressionCodec);
	}
}
