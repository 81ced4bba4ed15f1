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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.BackendCompressionMismatchException;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.NoWritableDatasetsException;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.UnknownCompressionMethodException;
import org.janelia.saalfeldlab.n5.backend.codec.CompressionCatalog;
import org.janelia.saalfeldlab.n5.backend.dataset.DatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.dataset.ZarrDatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.graph.ConfigurationBuilder;
import org.janelia.saalfeldlab.n5.backend.graph.Container;

/**
 * The configurations of all datasets of one container write, keyed by
 * location, for one backend.
 *
 * Not thread safe.
 */
public class BackendConfiguration {

	private final Backend backend;
	private final CompressionCatalog catalog;
	private final LinkedHashMap<String, DatasetIOConfiguration> datasetConfigurations = new LinkedHashMap<>();

	/* zarr only, null for HDF5 */
	private final Integer numberOfJobs;

	public BackendConfiguration(final CompressionCatalog catalog) {

		this(catalog, catalog.getBackend() == Backend.ZARR ? defaultNumberOfJobs() : null);
	}

	public BackendConfiguration(final Backend backend) {

		this(CompressionCatalog.forBackend(backend));
	}

	private BackendConfiguration(final CompressionCatalog catalog, final Integer numberOfJobs) {

		this.catalog = Objects.requireNonNull(catalog, "catalog");
		this.backend = catalog.getBackend();
		this.numberOfJobs = numberOfJobs;
	}

	/**
	 * Default configuration of all writable datasets of an object graph.
	 *
	 * @throws NoWritableDatasetsException if there are none
	 */
	public static BackendConfiguration fromObjectGraph(final Container root, final Backend backend) {

		return fromObjectGraph(root, CompressionCatalog.forBackend(backend));
	}

	public static BackendConfiguration fromObjectGraph(final Container root, final CompressionCatalog catalog) {

		return new ConfigurationBuilder(catalog).build(root);
	}

	public Backend getBackend() {

		return backend;
	}

	public CompressionCatalog getCatalog() {

		return catalog;
	}

	/**
	 * @param location the dataset location
	 * @return the configuration
	 * @throws IllegalArgumentException if there is no dataset at this location
	 */
	public DatasetIOConfiguration get(final String location) {

		final DatasetIOConfiguration configuration = datasetConfigurations.get(location);
		if (configuration == null)
			throw new IllegalArgumentException(
					"No dataset at location '" + location + "', known locations are " + datasetConfigurations.keySet() + ".");
		return configuration;
	}

	public boolean contains(final String location) {

		return datasetConfigurations.containsKey(location);
	}

	/**
	 * Adds or replaces the configuration of a dataset.  Nothing changes if the
	 * configuration is rejected.
	 *
	 * @param location the dataset location, must match the configuration's
	 * @param configuration the configuration
	 * @throws IllegalArgumentException if the locations differ
	 * @throws BackendCompressionMismatchException if the configuration is for another backend or uses names this backend does not know
	 */
	public void set(final String location, final DatasetIOConfiguration configuration) {

		Objects.requireNonNull(configuration, "configuration");
		if (!configuration.getLocation().equals(location))
			throw new IllegalArgumentException(
					"Configuration for location '" + configuration.getLocation() + "' cannot be set at location '" + location + "'.");

		if (configuration.getBackend() != backend)
			throw new BackendCompressionMismatchException(String.format(
					"Configuration of '%s' is for the %s backend but this is a %s configuration.",
					location, configuration.getBackend(), backend));

		try {
			if (configuration.getCompressionCodec() == null)
				catalog.resolve(configuration.getCompressionMethod());
			if (configuration instanceof ZarrDatasetIOConfiguration) {
				final List<String> filterMethods = ((ZarrDatasetIOConfiguration)configuration).getFilterMethods();
				if (filterMethods != null)
					for (final String filterMethod : filterMethods)
						catalog.resolve(filterMethod);
			}
		} catch (final UnknownCompressionMethodException e) {
			throw new BackendCompressionMismatchException(
					"Configuration of '" + location + "' is not compatible with the " + backend + " backend: " + e.getMessage(), e);
		}

		datasetConfigurations.put(location, configuration);
	}

	/**
	 * @return the locations in insertion order
	 */
	public Set<String> getLocations() {

		return Collections.unmodifiableSet(datasetConfigurations.keySet());
	}

	public Map<String, DatasetIOConfiguration> getDatasetConfigurations() {

		return Collections.unmodifiableMap(datasetConfigurations);
	}

	public int size() {

		return datasetConfigurations.size();
	}

	/**
	 * @return the number of parallel write jobs or {@code null} for backends that write serially
	 */
	public Integer getNumberOfJobs() {

		return numberOfJobs;
	}

	/**
	 * Copy with another number of parallel write jobs.  Negative values count
	 * back from all available CPUs, -1 uses all of them.  0 writes serially
	 * with a single job.
	 *
	 * @param numberOfJobs in [-cpus, cpus]
	 * @return a new configuration with the same datasets
	 * @throws IllegalStateException for backends that write serially
	 * @throws IllegalArgumentException if the value is out of bounds
	 */
	public BackendConfiguration withNumberOfJobs(final int numberOfJobs) {

		if (backend != Backend.ZARR)
			throw new IllegalStateException("The number of jobs only applies to the " + Backend.ZARR + " backend.");

		checkNumberOfJobs(numberOfJobs, availableCpus());
		final BackendConfiguration copy = new BackendConfiguration(catalog, numberOfJobs);
		copy.datasetConfigurations.putAll(datasetConfigurations);
		return copy;
	}

	/**
	 * @return the positive number of parallel write jobs, 1 for serial backends
	 */
	public int resolveNumberOfJobs() {

		return numberOfJobs == null ? 1 : resolveNumberOfJobs(numberOfJobs, availableCpus());
	}

	static int resolveNumberOfJobs(final int numberOfJobs, final int cpus) {

		if (numberOfJobs == 0)
			return 1;
		return numberOfJobs > 0 ? numberOfJobs : Math.max(1, cpus + 1 + numberOfJobs);
	}

	static void checkNumberOfJobs(final int numberOfJobs, final int cpus) {

		if (Math.abs(numberOfJobs) > cpus)
			throw new IllegalArgumentException(String.format(
					"Number of jobs must be in [%d, %d] but is %d.", -cpus, cpus, numberOfJobs));
	}

	static int defaultNumberOfJobs() {

		return Math.max(1, availableCpus() - 1);
	}

	private static int availableCpus() {

		return Runtime.getRuntime().availableProcessors();
	}

	/**
	 * A report of all dataset configurations meant for printing.
	 *
	 * @return the report
	 */
	public String renderSummary() {

		final String header = "Configurable datasets identified using the " + backend + " backend";
		final StringBuilder summary = new StringBuilder(header);
		summary.append("\n").append(StringUtils.repeat('-', header.length())).append("\n");
		if (numberOfJobs != null)
			summary.append("\nnumber of jobs : ").append(numberOfJobs).append("\n");
		for (final DatasetIOConfiguration configuration : datasetConfigurations.values())
			summary.append(configuration);
		return summary.toString();
	}

	@Override
	public boolean equals(final Object other) {

		if (this == other)
			return true;
		if (!(other instanceof BackendConfiguration))
			return false;
		final BackendConfiguration that = (BackendConfiguration)other;
		return backend == that.backend &&
				Objects.equals(numberOfJobs, that.numberOfJobs) &&
				datasetConfigurations.equals(that.datasetConfigurations);
	}

	@Override
	public int hashCode() {

		return Objects.hash(backend, numberOfJobs, datasetConfigurations);
	}

	@Override
	public String toString() {

		return renderSummary();
	}
}
