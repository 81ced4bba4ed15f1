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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.janelia.saalfeldlab.n5.backend.Backend;
import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.UnknownCompressionMethodException;
import org.janelia.saalfeldlab.n5.backend.dataset.DatasetInfo;
import org.janelia.saalfeldlab.n5.backend.dataset.Hdf5DatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.dataset.ZarrDatasetIOConfiguration;
import org.junit.Test;

public class CompressionCatalogTest {

	private static final DatasetInfo info = new DatasetInfo("id", "series/data", new DType("<u2"), new long[]{100, 10});

	@Test
	public void testDenied() {

		final CompressionCatalog zarr = CompressionCatalog.forBackend(Backend.ZARR);
		for (final String name : CompressionCatalog.ZARR_EXCLUDED_CODECS) {
			assertTrue(name, zarr.isDenied(name));
			assertFalse(name, zarr.getAvailableNames().contains(name));
			assertThrows(name, UnknownCompressionMethodException.class, () -> zarr.resolve(name));
		}
		for (final String name : CompressionCatalog.ZARR_LOSSY_CODECS)
			assertThrows(name, UnknownCompressionMethodException.class, () -> zarr.resolve(name));

		final CompressionCatalog hdf5 = CompressionCatalog.forBackend(Backend.HDF5);
		for (final String name : CompressionCatalog.HDF5_EXCLUDED_FILTERS)
			assertThrows(name, UnknownCompressionMethodException.class, () -> hdf5.resolve(name));
		assertEquals(Arrays.asList("gzip", "lzf", "szip"), new ArrayList<>(hdf5.getAvailableNames()));
	}

	@Test
	public void testAvailable() {

		final CompressionCatalog zarr = CompressionCatalog.forBackend(Backend.ZARR);
		assertEquals(
				Arrays.asList("blosc", "bz2", "categorize", "delta", "gzip", "lz4", "lzma", "packbits", "zlib", "zstd"),
				new ArrayList<>(zarr.getAvailableNames()));
		assertThrows(UnsupportedOperationException.class, () -> zarr.getAvailableNames().add("pickle"));

		assertSame(CompressionMethod.NONE, zarr.resolve(CompressionCatalog.NONE));
		assertTrue(zarr.isAvailable(CompressionCatalog.NONE));
		assertFalse(zarr.getAvailableNames().contains(CompressionCatalog.NONE));
		assertSame(zarr, CompressionCatalog.forBackend(Backend.ZARR));
		assertSame(zarr, CompressionCatalog.forBackend(Backend.ZARR, Collections.<CodecProvider>emptyList()));

		final UnknownCompressionMethodException e = assertThrows(UnknownCompressionMethodException.class, () -> zarr.resolve("szip"));
		assertEquals(zarr.getAvailableNames(), e.getValidNames());
	}

	@Test
	public void testProviders() {

		final CompressionCatalog zarr = CompressionCatalog.forBackend(Backend.ZARR, Arrays.asList(new TestCodecProvider()));
		assertTrue(zarr.isAvailable(TestCodecProvider.ZARR_CODEC));
		assertEquals(CompressionMethod.Origin.PLUGIN, zarr.resolve(TestCodecProvider.ZARR_CODEC).getOrigin());
		assertFalse(zarr.isAvailable("shuffle"));
		assertFalse(zarr.isAvailable("test-lossy"));
		assertFalse(zarr.isAvailable(TestCodecProvider.HDF5_FILTER));

		final CompressionCatalog hdf5 = CompressionCatalog.forBackend(Backend.HDF5, Arrays.asList(new TestCodecProvider(), new Hdf5PluginFilters()));
		assertTrue(hdf5.isAvailable(TestCodecProvider.HDF5_FILTER));
		assertTrue(hdf5.isAvailable("Zstd"));
		assertFalse(hdf5.isAvailable("Zfp"));
		assertEquals(Integer.valueOf(32015), hdf5.resolve("Zstd").getFilterId());

		assertTrue(CompressionCatalog.forBackend(Backend.ZARR, Arrays.asList(new Hdf5PluginFilters())).getAvailableNames()
				.equals(CompressionCatalog.forBackend(Backend.ZARR).getAvailableNames()));
	}

	@Test
	public void testInstalledProviders() {

		final List<CodecProvider> providers = CodecProviders.installed();
		boolean found = false;
		for (final CodecProvider provider : providers)
			found |= provider instanceof TestCodecProvider;
		assertTrue(found);
	}

	@Test
	public void testHdf5Arguments() {

		final CompressionCatalog catalog = CompressionCatalog.forBackend(Backend.HDF5, Arrays.asList(new TestCodecProvider()));
		final Hdf5DatasetIOConfiguration gzip = new Hdf5DatasetIOConfiguration(
				catalog, info, new long[]{50, 10}, new long[]{100, 10}, "gzip", Collections.singletonMap("level", 4));

		Map<String, Object> arguments = gzip.getDataIOArguments();
		assertEquals(Arrays.asList("chunks", "compression", "compression_opts"), new ArrayList<>(arguments.keySet()));
		assertArrayEquals(new long[]{50, 10}, (long[])arguments.get("chunks"));
		assertEquals("gzip", arguments.get("compression"));
		assertEquals(4, arguments.get("compression_opts"));

		arguments = gzip.withCompressionMethod("szip").getDataIOArguments();
		assertEquals("szip", arguments.get("compression"));
		assertNull(arguments.get("compression_opts"));

		arguments = gzip.withCompressionMethod(CompressionCatalog.NONE).getDataIOArguments();
		assertEquals(false, arguments.get("compression"));

		arguments = gzip.withCompressionMethod(TestCodecProvider.HDF5_FILTER, Collections.singletonMap("clevel", 3)).getDataIOArguments();
		assertEquals(TestCodecProvider.HDF5_FILTER_ID, arguments.get("compression"));
		assertEquals(Arrays.asList(3), arguments.get("compression_opts"));
		assertEquals(true, arguments.get("allow_plugin_filters"));

		arguments = gzip.withCompressionCodec(new CodecConfiguration("Zfp", Collections.singletonMap("rate", 8))).getDataIOArguments();
		assertEquals("Zfp", arguments.get("compression"));
		assertEquals(Arrays.asList(8), arguments.get("compression_opts"));
		assertEquals(true, arguments.get("allow_plugin_filters"));
	}

	@Test
	public void testZarrArguments() {

		final CompressionCatalog catalog = CompressionCatalog.forBackend(Backend.ZARR);
		final ZarrDatasetIOConfiguration configuration = new ZarrDatasetIOConfiguration(
				catalog,
				info,
				new long[]{50, 10},
				new long[]{100, 10},
				"blosc",
				Collections.singletonMap("cname", "zstd"),
				Arrays.asList("delta"),
				null);

		Map<String, Object> arguments = configuration.getDataIOArguments();
		assertEquals(Arrays.asList("chunks", "compressor", "filters"), new ArrayList<>(arguments.keySet()));
		assertEquals(new CodecConfiguration("blosc", Collections.singletonMap("cname", "zstd")), arguments.get("compressor"));
		assertEquals(Arrays.asList(new CodecConfiguration("delta")), arguments.get("filters"));

		arguments = configuration.withCompressionMethod(CompressionCatalog.NONE).withFilterMethods(null).getDataIOArguments();
		assertEquals(false, arguments.get("compressor"));
		assertNull(arguments.get("filters"));
	}

	@Test
	public void testNameRoundTrip() {

		for (final Backend backend : Backend.values()) {
			final CompressionCatalog catalog = CompressionCatalog.forBackend(backend);
			for (final String name : catalog.getAvailableNames()) {
				final Map<String, Object> arguments;
				final Object compression;
				if (backend == Backend.HDF5) {
					arguments = new Hdf5DatasetIOConfiguration(catalog, info, new long[]{10, 10}, new long[]{100, 10}, name, null).getDataIOArguments();
					compression = arguments.get("compression");
				} else {
					arguments = new ZarrDatasetIOConfiguration(catalog, info, new long[]{10, 10}, new long[]{100, 10}, name, null).getDataIOArguments();
					compression = ((CodecConfiguration)arguments.get("compressor")).getId();
				}
				assertEquals(name, compression);
			}
		}
	}
}
