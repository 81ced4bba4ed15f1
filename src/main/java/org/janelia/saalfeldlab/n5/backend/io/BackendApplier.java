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

import java.util.ArrayList;
import java.util.List;

import org.janelia.saalfeldlab.n5.backend.Backend;
import org.janelia.saalfeldlab.n5.backend.BackendConfiguration;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.AlreadyConfiguredException;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.TargetNotFoundException;
import org.janelia.saalfeldlab.n5.backend.dataset.DatasetIOConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands a {@link BackendConfiguration} to a writer.  A writer is configured
 * at most once and either all of its targets are configured or none.
 */
public final class BackendApplier {

	private static final Logger LOG = LoggerFactory.getLogger(BackendApplier.class);

	private BackendApplier() {}

	/**
	 * @param configuration the configuration
	 * @param writerHandle the writer
	 * @throws AlreadyConfiguredException if the writer or one of the targets was configured before
	 * @throws TargetNotFoundException if the writer does not know a configured dataset
	 * @throws org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException if a target rejects its instructions, before any target is configured
	 */
	public static void apply(final BackendConfiguration configuration, final WriterHandle writerHandle) {

		if (writerHandle.isConfigured())
			throw new AlreadyConfiguredException("The writer was already configured, a writer can only be configured once.");

		final List<WritableTarget> targets = new ArrayList<>();
		final List<DataIO> dataIOs = new ArrayList<>();
		for (final DatasetIOConfiguration datasetConfiguration : configuration.getDatasetConfigurations().values()) {
			final WritableTarget target = writerHandle.getTarget(datasetConfiguration.getObjectId(), datasetConfiguration.getDatasetName());
			if (target == null)
				throw new TargetNotFoundException(String.format(
						"The writer has no dataset '%s' for object '%s' at location '%s', known objects are %s.",
						datasetConfiguration.getDatasetName(),
						datasetConfiguration.getObjectId(),
						datasetConfiguration.getLocation(),
						writerHandle.getObjectIds()),
						writerHandle.getObjectIds());
			if (target.isConfigured())
				throw new AlreadyConfiguredException("Dataset '" + target.getLocation() + "' was already configured.");

			targets.add(target);
			dataIOs.add(new DataIO(configuration.getBackend(), datasetConfiguration.getDataIOArguments()));
		}

		/* nothing is configured unless every target accepts its instructions */
		for (int i = 0; i < targets.size(); ++i)
			targets.get(i).check(dataIOs.get(i));

		if (configuration.getBackend() == Backend.ZARR)
			writerHandle.setNumberOfJobs(configuration.resolveNumberOfJobs());

		for (int i = 0; i < targets.size(); ++i) {
			targets.get(i).configure(dataIOs.get(i));
			LOG.debug("Configured '{}'", targets.get(i).getLocation());
		}
		writerHandle.markConfigured();

		LOG.info("Configured {} datasets for the {} backend", targets.size(), configuration.getBackend());
	}
}
