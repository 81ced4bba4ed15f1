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
package org.janelia.saalfeldlab.n5.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.BackendCompressionMismatchException;
import org.janelia.saalfeldlab.n5.backend.codec.CompressionCatalog;
import org.janelia.saalfeldlab.n5.backend.codec.TestCodecProvider;
import org.janelia.saalfeldlab.n5.backend.dataset.DatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.dataset.Hdf5DatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.dataset.ZarrDatasetIOConfiguration;
import org.junit.Test;

public class BackendConfigurationTest {

	private static final DType int16 = new DType("<i2");

	private static ZarrDatasetIOConfiguration zarr(final String location) {

		return ZarrDatasetIOConfiguration.fromDefaults("id-" + location, location, new long[]{1_000_000, 384}, int16);
	}

	@Test
	public void testSetAndGet() {

		final BackendConfiguration configuration = new BackendConfiguration(Backend.ZARR);
		final ZarrDatasetIOConfiguration data = zarr("acquisition/ElectricalSeries/data");
		final ZarrDatasetIOConfiguration timestamps = zarr("acquisition/ElectricalSeries/timestamps");
		configuration.set(data.getLocation(), data);
		configuration.set(timestamps.getLocation(), timestamps);

		assertEquals(Arrays.asList(data.getLocation(), timestamps.getLocation()), Arrays.asList(configuration.getLocations().toArray()));
		assertSame(data, configuration.get(data.getLocation()));
		assertThrows(UnsupportedOperationException.class, () -> configuration.getDatasetConfigurations().clear());

		final ZarrDatasetIOConfiguration lz4 = data.withCompressionMethod("lz4");
		configuration.set(data.getLocation(), lz4);
		assertSame(lz4, configuration.get(data.getLocation()));
		assertEquals(2, configuration.size());

		final IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> configuration.get("nowhere/data"));
		assertTrue(e.getMessage(), e.getMessage().contains(data.getLocation()));
	}

	@Test
	public void testRejectedSetChangesNothing() {

		final BackendConfiguration configuration = new BackendConfiguration(Backend.ZARR);
		final ZarrDatasetIOConfiguration data = zarr("data");
		configuration.set("data", data);

		assertThrows(IllegalArgumentException.class, () -> configuration.set("timestamps", data));

		final Hdf5DatasetIOConfiguration hdf5 = Hdf5DatasetIOConfiguration.fromDefaults("id-data", "data", new long[]{1_000_000, 384}, int16);
		assertThrows(BackendCompressionMismatchException.class, () -> configuration.set("data", hdf5));

		// a codec of another catalog that this configuration does not know
		final CompressionCatalog withPlugin = CompressionCatalog.forBackend(Backend.ZARR, Arrays.asList(new TestCodecProvider()));
		final ZarrDatasetIOConfiguration plugin = ZarrDatasetIOConfiguration.fromDefaults(withPlugin, data.getDatasetInfo())
				.withCompressionMethod(TestCodecProvider.ZARR_CODEC);
		assertThrows(BackendCompressionMismatchException.class, () -> configuration.set("data", plugin));

		assertSame(data, configuration.get("data"));
		assertEquals(1, configuration.size());
	}

	@Test
	public void testNumberOfJobs() {

		final int cpus = Runtime.getRuntime().availableProcessors();
		final BackendConfiguration zarr = new BackendConfiguration(Backend.ZARR);
		assertEquals(Integer.valueOf(Math.max(1, cpus - 1)), zarr.getNumberOfJobs());

		final BackendConfiguration all = zarr.withNumberOfJobs(-1);
		assertEquals(cpus, all.resolveNumberOfJobs());
		assertEquals(1, zarr.withNumberOfJobs(1).resolveNumberOfJobs());
		assertEquals(Integer.valueOf(0), zarr.withNumberOfJobs(0).getNumberOfJobs());
		assertEquals(1, zarr.withNumberOfJobs(0).resolveNumberOfJobs());
		assertThrows(IllegalArgumentException.class, () -> zarr.withNumberOfJobs(cpus + 1));
		assertThrows(IllegalArgumentException.class, () -> zarr.withNumberOfJobs(-cpus - 1));

		assertEquals(7, BackendConfiguration.resolveNumberOfJobs(-2, 8));
		assertEquals(3, BackendConfiguration.resolveNumberOfJobs(3, 8));
		assertEquals(1, BackendConfiguration.resolveNumberOfJobs(0, 8));
		assertEquals(1, BackendConfiguration.resolveNumberOfJobs(-8, 8));
		BackendConfiguration.checkNumberOfJobs(0, 8);
		BackendConfiguration.checkNumberOfJobs(-8, 8);
		assertThrows(IllegalArgumentException.class, () -> BackendConfiguration.checkNumberOfJobs(9, 8));

		final BackendConfiguration hdf5 = new BackendConfiguration(Backend.HDF5);
		assertNull(hdf5.getNumberOfJobs());
		assertEquals(1, hdf5.resolveNumberOfJobs());
		assertThrows(IllegalStateException.class, () -> hdf5.withNumberOfJobs(2));
	}

	@Test
	public void testWithNumberOfJobsKeepsDatasets() {

		final BackendConfiguration configuration = new BackendConfiguration(Backend.ZARR);
		final ZarrDatasetIOConfiguration data = zarr("data");
		configuration.set("data", data);

		final BackendConfiguration copy = configuration.withNumberOfJobs(1);
		assertSame(data, copy.get("data"));
		copy.set("timestamps", zarr("timestamps"));
		assertFalse(configuration.contains("timestamps"));
	}

	@Test
	public void testSummary() {

		final BackendConfiguration configuration = new BackendConfiguration(Backend.HDF5);
		assertTrue(configuration.renderSummary().startsWith(
				"Configurable datasets identified using the hdf5 backend\n-------------------------------------------------------\n"));

		final DatasetIOConfiguration data = Hdf5DatasetIOConfiguration.fromDefaults("id", "acquisition/ElectricalSeries/data", new long[]{1_000_000, 384}, int16);
		configuration.set(data.getLocation(), data);
		final String summary = configuration.renderSummary();
		assertTrue(summary, summary.contains("acquisition/ElectricalSeries/data\n---------------------------------\n"));
		assertTrue(summary, summary.contains("full size of source array : 768.00 MB"));
		assertTrue(summary, summary.contains("compression method : gzip"));
	}
}
