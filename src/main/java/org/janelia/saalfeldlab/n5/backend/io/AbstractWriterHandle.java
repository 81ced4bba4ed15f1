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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.AlreadyConfiguredException;
import org.janelia.saalfeldlab.n5.backend.graph.ArraySource;
import org.janelia.saalfeldlab.n5.backend.graph.ConfigurationBuilder;
import org.janelia.saalfeldlab.n5.backend.graph.Container;
import org.janelia.saalfeldlab.n5.backend.graph.ContainerTraversal;

/**
 * Writer handle over an object graph with one target per array field.
 *
 * @param <T> the target type
 */
public abstract class AbstractWriterHandle<T extends AbstractWriterHandle.Target> implements WriterHandle {

	private final Map<String, Map<String, T>> targets = new LinkedHashMap<>();
	private boolean configured = false;
	private int numberOfJobs = 1;

	protected AbstractWriterHandle(final Container root) {

		ContainerTraversal.traverse(root, (container, path) -> {
			for (final String field : ConfigurationBuilder.DATASET_FIELDS) {
				final Object value = container.getFields().get(field);
				if (value instanceof ArraySource) {
					final T target = createTarget(container, field, ContainerTraversal.childPath(path, field), (ArraySource)value);
					targets.computeIfAbsent(container.getObjectId(), k -> new LinkedHashMap<>()).put(field, target);
				}
			}
		});
	}

	protected abstract T createTarget(Container container, String datasetName, String location, ArraySource source);

	@Override
	public T getTarget(final String objectId, final String datasetName) {

		final Map<String, T> objectTargets = targets.get(objectId);
		return objectTargets == null ? null : objectTargets.get(datasetName);
	}

	@Override
	public Set<String> getObjectIds() {

		return Collections.unmodifiableSet(targets.keySet());
	}

	@Override
	public boolean isConfigured() {

		return configured;
	}

	@Override
	public void markConfigured() {

		if (configured)
			throw new AlreadyConfiguredException("The writer is already configured.");
		configured = true;
	}

	@Override
	public void setNumberOfJobs(final int numberOfJobs) {

		if (numberOfJobs < 1)
			throw new IllegalArgumentException("Number of jobs must be positive but is " + numberOfJobs + ".");
		this.numberOfJobs = numberOfJobs;
	}

	public int getNumberOfJobs() {

		return numberOfJobs;
	}

	/**
	 * A target that remembers its write instructions.
	 */
	public abstract static class Target implements WritableTarget {

		protected final Container container;
		protected final String datasetName;
		protected final String location;
		protected final ArraySource source;
		private DataIO dataIO;

		protected Target(final Container container, final String datasetName, final String location, final ArraySource source) {

			this.container = container;
			this.datasetName = datasetName;
			this.location = location;
			this.source = source;
		}

		@Override
		public String getObjectId() {

			return container.getObjectId();
		}

		@Override
		public String getDatasetName() {

			return datasetName;
		}

		@Override
		public String getLocation() {

			return location;
		}

		public ArraySource getSource() {

			return source;
		}

		/**
		 * @return the attached instructions or {@code null}
		 */
		public DataIO getDataIO() {

			return dataIO;
		}

		@Override
		public boolean isConfigured() {

			return dataIO != null;
		}

		@Override
		public void check(final DataIO dataIO) {

			if (isConfigured())
				throw new AlreadyConfiguredException("Dataset '" + location + "' is already configured.");
		}

		@Override
		public void configure(final DataIO dataIO) {

			if (isConfigured())
				throw new AlreadyConfiguredException("Dataset '" + location + "' is already configured.");
			this.dataIO = attach(dataIO);
		}

		/**
		 * Hands the instructions to the writer.
		 *
		 * @return the instructions to remember
		 */
		protected abstract DataIO attach(DataIO dataIO);

		@Override
		public String toString() {

			return getClass().getSimpleName() + "(" + location + ")";
		}
	}
}
