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

import org.janelia.saalfeldlab.n5.backend.graph.ArraySource;
import org.janelia.saalfeldlab.n5.backend.graph.Container;
import org.janelia.saalfeldlab.n5.backend.graph.Group;

/**
 * Configures an object graph in place.  Array fields of {@link Group}s are
 * replaced by a {@link DataIO} wrapping the array, the way a writer expects to
 * find them.
 */
public class ContainerWriter extends AbstractWriterHandle<ContainerWriter.Target> {

	public ContainerWriter(final Container root) {

		super(root);
	}

	@Override
	protected Target createTarget(final Container container, final String datasetName, final String location, final ArraySource source) {

		return new Target(container, datasetName, location, source);
	}

	public static class Target extends AbstractWriterHandle.Target {

		protected Target(final Container container, final String datasetName, final String location, final ArraySource source) {

			super(container, datasetName, location, source);
		}

		@Override
		protected DataIO attach(final DataIO dataIO) {

			final DataIO wrapped = new DataIO(dataIO.getBackend(), dataIO.getArguments(), source);
			if (container instanceof Group)
				((Group)container).setField(datasetName, wrapped);
			return wrapped;
		}
	}
}
