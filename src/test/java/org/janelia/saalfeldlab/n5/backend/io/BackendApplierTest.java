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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashSet;

import org.janelia.saalfeldlab.n5.backend.Backend;
import org.janelia.saalfeldlab.n5.backend.BackendConfiguration;
import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.AlreadyConfiguredException;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.TargetNotFoundException;
import org.janelia.saalfeldlab.n5.backend.codec.CodecConfiguration;
import org.janelia.saalfeldlab.n5.backend.codec.CompressionCatalog;
import org.janelia.saalfeldlab.n5.backend.dataset.ZarrDatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.graph.ArraySource;
import org.janelia.saalfeldlab.n5.backend.graph.ConfigurationBuilder;
import org.janelia.saalfeldlab.n5.backend.graph.Group;
import org.janelia.saalfeldlab.n5.backend.graph.InMemoryArray;
import org.junit.Test;

public class BackendApplierTest {

	private static final DType int16 = new DType("<i2");

	private static Group createGraph() {

		return new Group("root", "root")
				.addChild(new Group("series", "Series")
						.setField("data", new InMemoryArray(int16, 10_000, 64))
						.setField("timestamps", new InMemoryArray(new DType("<f8"), 10_000)));
	}

	@Test
	public void testApply() {

		final Group root = createGraph();
		final ArraySource source = (ArraySource)((Group)root.getChildren().get(0)).getField("data");
		final BackendConfiguration configuration = BackendConfiguration.fromObjectGraph(root, Backend.ZARR).withNumberOfJobs(1);
		final ContainerWriter writer = new ContainerWriter(root);

		assertFalse(writer.isConfigured());
		BackendApplier.apply(configuration, writer);
		assertTrue(writer.isConfigured());
		assertEquals(1, writer.getNumberOfJobs());

		final ContainerWriter.Target target = writer.getTarget("series", "data");
		assertTrue(target.isConfigured());
		assertEquals("Series/data", target.getLocation());

		final DataIO dataIO = target.getDataIO();
		assertEquals(Backend.ZARR, dataIO.getBackend());
		assertSame(source, dataIO.getData());
		assertArrayEquals(configuration.get("Series/data").getChunkShape(), (long[])dataIO.getArgument(CompressionCatalog.CHUNKS_KEY));
		assertEquals(new CodecConfiguration("gzip"), dataIO.getArgument(CompressionCatalog.COMPRESSOR_KEY));

		// the graph now holds the wrapped arrays
		assertSame(dataIO, ((Group)root.getChildren().get(0)).getField("data"));
		assertTrue(new ConfigurationBuilder(configuration.getCatalog()).discover(root).isEmpty());
	}

	@Test
	public void testApplyTwice() {

		final Group root = createGraph();
		final BackendConfiguration configuration = BackendConfiguration.fromObjectGraph(root, Backend.HDF5);
		final ContainerWriter writer = new ContainerWriter(root);
		BackendApplier.apply(configuration, writer);

		assertThrows(AlreadyConfiguredException.class, () -> BackendApplier.apply(configuration, writer));
	}

	@Test
	public void testConfiguredTarget() {

		final Group root = createGraph();
		final BackendConfiguration configuration = BackendConfiguration.fromObjectGraph(root, Backend.HDF5);
		final ContainerWriter writer = new ContainerWriter(root);
		writer.getTarget("series", "timestamps").configure(new DataIO(Backend.HDF5, configuration.get("Series/timestamps").getDataIOArguments()));

		assertThrows(AlreadyConfiguredException.class, () -> BackendApplier.apply(configuration, writer));
		assertFalse(writer.isConfigured());
		assertFalse(writer.getTarget("series", "data").isConfigured());
	}

	@Test
	public void testTargetNotFound() {

		final BackendConfiguration configuration = BackendConfiguration.fromObjectGraph(createGraph(), Backend.ZARR);
		configuration.set("Other/data", ZarrDatasetIOConfiguration.fromDefaults("other", "Other/data", new long[]{100}, int16));

		final ContainerWriter writer = new ContainerWriter(createGraph());
		final TargetNotFoundException e = assertThrows(TargetNotFoundException.class, () -> BackendApplier.apply(configuration, writer));

		assertEquals(new HashSet<>(Arrays.asList("series")), e.getKnownObjectIds());
		assertFalse(writer.isConfigured());
		assertNull(writer.getTarget("series", "data").getDataIO());
	}
}
