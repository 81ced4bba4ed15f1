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
package org.janelia.saalfeldlab.n5.backend.io;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.janelia.saalfeldlab.n5.Compression;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.InvalidShapeException;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.UnknownCompressionMethodException;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.UnsupportedDtypeException;
import org.janelia.saalfeldlab.n5.backend.codec.Codec;
import org.janelia.saalfeldlab.n5.backend.codec.CodecConfiguration;
import org.janelia.saalfeldlab.n5.backend.codec.CompressionCatalog;
import org.janelia.saalfeldlab.n5.backend.graph.ArraySource;
import org.janelia.saalfeldlab.n5.backend.graph.Container;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the datasets of an object graph through an {@link N5Writer}.
 * Configuring a target creates its dataset with the configured block size and
 * the n5 {@link Compression} matching the configured codec.
 */
public class N5WriterHandle extends AbstractWriterHandle<N5WriterHandle.Target> {

	private static final Logger LOG = LoggerFactory.getLogger(N5WriterHandle.class);

	private final N5Writer n5;

	public N5WriterHandle(final N5Writer n5, final Container root) {

		super(root);
		this.n5 = Objects.requireNonNull(n5, "n5");
	}

	public N5Writer getWriter() {

		return n5;
	}

	@Override
	protected Target createTarget(final Container container, final String datasetName, final String location, final ArraySource source) {

		return new Target(container, datasetName, location, source);
	}

	/**
	 * The dataset attributes for a source and its write instructions.
	 *
	 * @param location for error messages
	 * @param source the data
	 * @param dataIO the instructions
	 * @return the attributes
	 * @throws UnsupportedDtypeException if n5 cannot store the data type
	 * @throws UnknownCompressionMethodException if n5 does not implement the codec
	 */
	public static DatasetAttributes createDatasetAttributes(final String location, final ArraySource source, final DataIO dataIO) {

		final DType dtype = source.getDType();
		final DataType dataType = dtype.getDataType();
		if (dataType == null || dtype.isObject())
			throw new UnsupportedDtypeException("Data type " + dtype + " of '" + location + "' cannot be written with n5.");

		final long[] chunks = (long[])dataIO.getArgument(CompressionCatalog.CHUNKS_KEY);
		final int[] blockSize = new int[chunks.length];
		for (int i = 0; i < chunks.length; ++i) {
			if (chunks[i] > Integer.MAX_VALUE)
				throw new InvalidShapeException(
						"Chunk shape " + Arrays.toString(chunks) + " of '" + location + "' exceeds the n5 block size limit.");
			blockSize[i] = (int)chunks[i];
		}

		return new DatasetAttributes(source.getShape(), blockSize, dataType, createCompression(location, dataIO));
	}

	static Compression createCompression(final String location, final DataIO dataIO) {

		final CodecConfiguration codec;
		switch (dataIO.getBackend()) {
		case HDF5:
			codec = hdf5Codec(
					dataIO.getArgument(CompressionCatalog.COMPRESSION_KEY),
					dataIO.getArgument(CompressionCatalog.COMPRESSION_OPTS_KEY));
			break;
		default:
			codec = zarrCodec(dataIO.getArgument(CompressionCatalog.COMPRESSOR_KEY));
			if (dataIO.getArgument(CompressionCatalog.FILTERS_KEY) != null)
				LOG.warn("Filters {} of '{}' are not applied by n5", dataIO.getArgument(CompressionCatalog.FILTERS_KEY), location);
		}

		final Compression compression = codec.getCompression();
		if (compression == null)
			throw new UnknownCompressionMethodException(
					"Codec '" + codec.getId() + "' of '" + location + "' has no n5 implementation, n5 can use " + CodecConfiguration.N5_CODEC_IDS + ".",
					CodecConfiguration.N5_CODEC_IDS);
		return compression;
	}

	private static CodecConfiguration hdf5Codec(final Object compression, final Object options) {

		if (compression == null || Boolean.FALSE.equals(compression))
			return new CodecConfiguration(CompressionCatalog.NONE);

		final Map<String, Object> parameters = new LinkedHashMap<>();
		// the only built-in filter with an n5 counterpart takes the level
		if (options instanceof Number)
			parameters.put("level", options);
		else if (options instanceof Collection && ((Collection<?>)options).size() == 1)
			parameters.put("level", ((Collection<?>)options).iterator().next());
		return new CodecConfiguration(compression.toString(), parameters);
	}

	private static CodecConfiguration zarrCodec(final Object compressor) {

		if (compressor == null || Boolean.FALSE.equals(compressor))
			return new CodecConfiguration(CompressionCatalog.NONE);
		if (compressor instanceof CodecConfiguration)
			return (CodecConfiguration)compressor;
		if (compressor instanceof Codec)
			return new CodecConfiguration(((Codec)compressor).getId(), ((Codec)compressor).getConfiguration());
		throw new IllegalArgumentException("Unexpected compressor " + compressor + ".");
	}

	public class Target extends AbstractWriterHandle.Target {

		protected Target(final Container container, final String datasetName, final String location, final ArraySource source) {

			super(container, datasetName, location, source);
		}

		@Override
		public void check(final DataIO dataIO) {

			super.check(dataIO);
			createDatasetAttributes(location, source, dataIO);
		}

		@Override
		protected DataIO attach(final DataIO dataIO) {

			final DatasetAttributes attributes = createDatasetAttributes(location, source, dataIO);
			n5.createDataset(location, attributes);
			LOG.debug("Created dataset '{}' with block size {} and {}", location, Arrays.toString(attributes.getBlockSize()), attributes.getCompression().getType());
			return dataIO;
		}
	}
}
