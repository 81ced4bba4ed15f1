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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Collections;

import org.janelia.saalfeldlab.n5.Bzip2Compression;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.RawCompression;
import org.janelia.saalfeldlab.n5.backend.Backend;
import org.janelia.saalfeldlab.n5.backend.BackendConfiguration;
import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.UnknownCompressionMethodException;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.UnsupportedDtypeException;
import org.janelia.saalfeldlab.n5.backend.codec.CompressionCatalog;
import org.janelia.saalfeldlab.n5.backend.dataset.DatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.graph.Group;
import org.janelia.saalfeldlab.n5.backend.graph.InMemoryArray;
import org.junit.Test;

public class N5WriterHandleTest {

	private static final DType uint16 = new DType("<u2");

	private static N5Writer createN5Writer() throws IOException {

		return new N5FSWriter(Files.createTempDirectory("n5-backend-test").toString());
	}

	@Test
	public void testCreateDatasets() throws IOException {

		final Group root = new Group("root", "root")
				.addChild(new Group("series", "Series")
						.setField("data", new InMemoryArray(uint16, 1_000, 64))
						.setField("timestamps", new InMemoryArray(new DType("<f8"), 1_000)));

		final BackendConfiguration configuration = BackendConfiguration.fromObjectGraph(root, Backend.ZARR);
		final DatasetIOConfiguration data = configuration.get("Series/data").withShapes(new long[]{100, 64}, new long[]{500, 64});
		configuration.set(data.getLocation(), data.withCompressionMethod("bz2"));
		final DatasetIOConfiguration timestamps = configuration.get("Series/timestamps");
		configuration.set(timestamps.getLocation(), timestamps.withCompressionMethod(CompressionCatalog.NONE));

		final N5Writer n5 = createN5Writer();
		try {
			final N5WriterHandle handle = new N5WriterHandle(n5, root);
			BackendApplier.apply(configuration, handle);

			assertTrue(n5.datasetExists("Series/data"));
			final DatasetAttributes attributes = n5.getDatasetAttributes("Series/data");
			assertArrayEquals(new long[]{1_000, 64}, attributes.getDimensions());
			assertArrayEquals(new int[]{100, 64}, attributes.getBlockSize());
			assertEquals(DataType.UINT16, attributes.getDataType());
			assertTrue(attributes.getCompression() instanceof Bzip2Compression);

			final DatasetAttributes timestampAttributes = n5.getDatasetAttributes("Series/timestamps");
			assertEquals(DataType.FLOAT64, timestampAttributes.getDataType());
			assertTrue(timestampAttributes.getCompression() instanceof RawCompression);
		} finally {
			n5.remove();
		}
	}

	@Test
	public void testRejectedBeforeCreation() throws IOException {

		final Group root = new Group("root", "root")
				.addChild(new Group("series", "Series")
						.setField("data", new InMemoryArray(uint16, 1_000, 64))
						.setField("timestamps", new InMemoryArray(new DType("<f8"), 1_000)));

		final BackendConfiguration configuration = BackendConfiguration.fromObjectGraph(root, Backend.ZARR);
		final DatasetIOConfiguration timestamps = configuration.get("Series/timestamps");
		configuration.set(timestamps.getLocation(), timestamps.withCompressionMethod("zstd"));

		final N5Writer n5 = createN5Writer();
		try {
			final N5WriterHandle handle = new N5WriterHandle(n5, root);
			assertThrows(UnknownCompressionMethodException.class, () -> BackendApplier.apply(configuration, handle));
			assertFalse(handle.isConfigured());
			assertFalse(handle.getTarget("series", "data").isConfigured());
			assertFalse(n5.datasetExists("Series/data"));

			/* the same handle accepts a corrected configuration */
			configuration.set(timestamps.getLocation(), timestamps.withCompressionMethod("gzip"));
			BackendApplier.apply(configuration, handle);
			assertTrue(handle.isConfigured());
			assertTrue(n5.datasetExists("Series/data"));
			assertTrue(n5.datasetExists("Series/timestamps"));
		} finally {
			n5.remove();
		}
	}

	@Test
	public void testHdf5Compression() {

		final Group root = new Group("root").setField("data", new InMemoryArray(uint16, 1_000));
		final BackendConfiguration configuration = BackendConfiguration.fromObjectGraph(root, Backend.HDF5);
		final DatasetIOConfiguration data = configuration.get("data");
		final InMemoryArray source = (InMemoryArray)root.getField("data");

		final DatasetAttributes gzip = N5WriterHandle.createDatasetAttributes(
				"data",
				source,
				new DataIO(Backend.HDF5, data.withCompressionOptions(Collections.singletonMap("level", 9)).getDataIOArguments()));
		assertTrue(gzip.getCompression() instanceof GzipCompression);

		final UnknownCompressionMethodException e = assertThrows(
				UnknownCompressionMethodException.class,
				() -> N5WriterHandle.createDatasetAttributes("data", source, new DataIO(Backend.HDF5, data.withCompressionMethod("szip").getDataIOArguments())));
		assertTrue(e.getValidNames().contains("gzip"));
	}

	@Test
	public void testStrings() throws IOException {

		final Group root = new Group("root").setField("data", InMemoryArray.ofObjects(new long[]{2}, "a", "b"));
		final BackendConfiguration configuration = BackendConfiguration.fromObjectGraph(root, Backend.ZARR);

		final N5Writer n5 = createN5Writer();
		try {
			final N5WriterHandle handle = new N5WriterHandle(n5, root);
			assertThrows(UnsupportedDtypeException.class, () -> BackendApplier.apply(configuration, handle));
			assertFalse(handle.isConfigured());
			assertFalse(n5.datasetExists("data"));
		} finally {
			n5.remove();
		}
	}
}
