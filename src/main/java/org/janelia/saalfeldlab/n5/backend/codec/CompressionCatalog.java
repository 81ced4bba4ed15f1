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

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.janelia.saalfeldlab.n5.backend.Backend;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.UnknownCompressionMethodException;
import org.janelia.saalfeldlab.n5.backend.dataset.DatasetIOConfiguration;
import org.janelia.saalfeldlab.n5.backend.dataset.ZarrDatasetIOConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The compression methods a backend accepts by name.
 *
 * Each catalog starts from the codecs native to its backend and removes those
 * that the container applies by itself (string encodings, shuffling,
 * checksums), that do not reduce data, or that are lossy.  Codecs contributed
 * by {@link CodecProvider}s are merged in under their own names.  Refused
 * codecs, lossy ones in particular, can still be used by passing an
 * instantiated {@link Codec}.
 *
 * The catalog is also the only place that knows the keyword arguments the
 * writer of its backend expects, see {@link #buildIOArguments}.
 */
public class CompressionCatalog {

	private static final Logger LOG = LoggerFactory.getLogger(CompressionCatalog.class);

	/* the name that disables compression, accepted by every catalog */
	public static final String NONE = "none";

	public static final String CHUNKS_KEY = "chunks";
	public static final String COMPRESSION_KEY = "compression";
	public static final String COMPRESSION_OPTS_KEY = "compression_opts";
	public static final String ALLOW_PLUGIN_FILTERS_KEY = "allow_plugin_filters";
	public static final String COMPRESSOR_KEY = "compressor";
	public static final String FILTERS_KEY = "filters";

	/* built-in filters of the HDF5 library with their filter ids */
	public static final Map<String, Integer> HDF5_NATIVE_FILTERS = Collections.unmodifiableMap(Stream.of(
			new SimpleImmutableEntry<>("gzip", 1),
			new SimpleImmutableEntry<>("shuffle", 2),
			new SimpleImmutableEntry<>("fletcher32", 3),
			new SimpleImmutableEntry<>("szip", 4),
			new SimpleImmutableEntry<>("scaleoffset", 6),
			new SimpleImmutableEntry<>("lzf", 32000))
			.collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new)));

	public static final Set<String> HDF5_EXCLUDED_FILTERS = unmodifiableSet(
			"shuffle", // applied by the writer
			"fletcher32", // applied by the writer
			"scaleoffset"); // enforced by the data types

	/* codecs of the zarr codec registry */
	public static final Set<String> ZARR_NATIVE_CODECS = unmodifiableSet(
			"adler32", "astype", "base64", "bitround", "blosc", "bz2", "categorize", "crc32", "crc32c",
			"delta", "fixedscaleoffset", "fletcher32", "gzip", "jenkins_lookup3", "json2", "lz4", "lzma",
			"msgpack2", "n5_wrapper", "packbits", "pickle", "quantize", "shuffle", "vlen-array",
			"vlen-bytes", "vlen-utf8", "zlib", "zstd");

	public static final Set<String> ZARR_LOSSY_CODECS = unmodifiableSet("astype", "bitround", "quantize");

	public static final Set<String> ZARR_EXCLUDED_CODECS = unmodifiableSet(
			"json2", "pickle", "msgpack2", "base64", // no data reduction
			"vlen-utf8", "vlen-array", "vlen-bytes", // applied by the container
			"fixedscaleoffset", // enforced by the data types
			"shuffle", // applied by the container
			"adler32", "crc32", "crc32c", "fletcher32", "jenkins_lookup3", // checksums
			"n5_wrapper"); // different format

	private static final EnumMap<Backend, CompressionCatalog> defaults = new EnumMap<>(Backend.class);

	private final Backend backend;
	private final Map<String, CompressionMethod> methods = new TreeMap<>();
	private final Set<String> denied;

	protected CompressionCatalog(final Backend backend, final Collection<? extends CodecProvider> providers) {

		this.backend = backend;

		final Set<String> denied = new LinkedHashSet<>();
		switch (backend) {
		case HDF5:
			denied.addAll(HDF5_EXCLUDED_FILTERS);
			for (final Map.Entry<String, Integer> filter : HDF5_NATIVE_FILTERS.entrySet())
				if (!denied.contains(filter.getKey()))
					methods.put(filter.getKey(), CompressionMethod.nativeMethod(backend, filter.getKey(), filter.getValue(), false));
			break;
		case ZARR:
			denied.addAll(ZARR_EXCLUDED_CODECS);
			denied.addAll(ZARR_LOSSY_CODECS);
			for (final String codec : ZARR_NATIVE_CODECS)
				if (!denied.contains(codec))
					methods.put(codec, CompressionMethod.nativeMethod(backend, codec, null, false));
			break;
		}
		this.denied = Collections.unmodifiableSet(denied);

		for (final CodecProvider provider : providers)
			for (final CompressionMethod method : provider.getCompressionMethods(backend))
				merge(provider, method);
	}

	private void merge(final CodecProvider provider, final CompressionMethod method) {

		final String name = method.getName();
		if (method.getBackend() != backend)
			LOG.warn("Ignoring {} codec '{}' from {} for the {} catalog", method.getBackend(), name, provider.getClass().getName(), backend);
		else if (NONE.equals(name) || denied.contains(name))
			LOG.warn("Ignoring denied codec '{}' from {}", name, provider.getClass().getName());
		else if (method.isLossy())
			LOG.warn("Ignoring lossy codec '{}' from {}, pass an instantiated codec to use it", name, provider.getClass().getName());
		else if (methods.containsKey(name))
			LOG.debug("Codec '{}' from {} is already in the {} catalog", name, provider.getClass().getName(), backend);
		else
			methods.put(name, method);
	}

	/**
	 * The catalog of native codecs for a backend.
	 *
	 * @param backend the backend
	 * @return the shared catalog
	 */
	public static synchronized CompressionCatalog forBackend(final Backend backend) {

		CompressionCatalog catalog = defaults.get(backend);
		if (catalog == null) {
			catalog = new CompressionCatalog(backend, Collections.<CodecProvider>emptyList());
			defaults.put(backend, catalog);
		}
		return catalog;
	}

	/**
	 * A catalog of native codecs plus those of the given providers.
	 *
	 * @param backend the backend
	 * @param providers codec providers, e.g. {@link CodecProviders#installed()}
	 * @return a new catalog
	 */
	public static CompressionCatalog forBackend(final Backend backend, final Collection<? extends CodecProvider> providers) {

		if (providers == null || providers.isEmpty())
			return forBackend(backend);
		return new CompressionCatalog(backend, providers);
	}

	public Backend getBackend() {

		return backend;
	}

	/**
	 * @return the sorted names that {@link #resolve} accepts, without "none"
	 */
	public Set<String> getAvailableNames() {

		return Collections.unmodifiableSet(methods.keySet());
	}

	public boolean isAvailable(final String name) {

		return NONE.equals(name) || methods.containsKey(name);
	}

	/**
	 * @param name a codec name
	 * @return true if the name is deliberately refused by this catalog
	 */
	public boolean isDenied(final String name) {

		return denied.contains(name);
	}

	public Set<String> getDeniedNames() {

		return denied;
	}

	/**
	 * @param name a codec name or "none"
	 * @return the method
	 * @throws UnknownCompressionMethodException if the name is not available, listing the valid names
	 */
	public CompressionMethod resolve(final String name) {

		if (NONE.equals(name))
			return CompressionMethod.NONE;

		final CompressionMethod method = name == null ? null : methods.get(name);
		if (method == null) {
			final String reason = name != null && denied.contains(name) ? " is not allowed by" : " is not available in";
			throw new UnknownCompressionMethodException(
					"Compression method '" + name + "'" + reason + " the " + backend + " backend, valid methods are " + methods.keySet() + ".",
					methods.keySet());
		}
		return method;
	}

	/**
	 * Builds the keyword arguments that the writer of this backend expects for
	 * a dataset.
	 *
	 * HDF5: {@code chunks}, {@code compression}, {@code compression_opts} and
	 * {@code allow_plugin_filters} for plugin filters.  Zarr: {@code chunks},
	 * {@code compressor} and {@code filters}.
	 *
	 * @param configuration the dataset configuration
	 * @return insertion ordered arguments
	 * @throws UnknownCompressionMethodException if a name does not resolve in this catalog
	 */
	public Map<String, Object> buildIOArguments(final DatasetIOConfiguration configuration) {

		if (configuration.getBackend() != backend)
			throw new IllegalArgumentException(
					"Cannot build " + backend + " arguments for a " + configuration.getBackend() + " dataset configuration.");

		final Map<String, Object> arguments = new LinkedHashMap<>();
		arguments.put(CHUNKS_KEY, configuration.getChunkShape());

		switch (backend) {
		case HDF5:
			putHdf5Compression(configuration, arguments);
			break;
		case ZARR:
			putZarrCompression(configuration, arguments);
			break;
		}
		return arguments;
	}

	private void putHdf5Compression(final DatasetIOConfiguration configuration, final Map<String, Object> arguments) {

		final Codec codec = configuration.getCompressionCodec();
		if (codec != null) {
			arguments.put(COMPRESSION_KEY, codec.getId());
			arguments.put(COMPRESSION_OPTS_KEY, optionValues(codec.getConfiguration()));
			arguments.put(ALLOW_PLUGIN_FILTERS_KEY, true);
			return;
		}

		final CompressionMethod method = resolve(configuration.getCompressionMethod());
		final Map<String, Object> options = configuration.getCompressionOptions();
		if (method.isNone()) {
			arguments.put(COMPRESSION_KEY, false);
		} else if (method.getOrigin() == CompressionMethod.Origin.NATIVE) {
			// built-in filters take a single parameter
			arguments.put(COMPRESSION_KEY, method.getName());
			arguments.put(COMPRESSION_OPTS_KEY, options.isEmpty() ? null : options.values().iterator().next());
		} else {
			arguments.put(COMPRESSION_KEY, method.getFilterId() == null ? method.getName() : method.getFilterId());
			arguments.put(COMPRESSION_OPTS_KEY, optionValues(options));
			arguments.put(ALLOW_PLUGIN_FILTERS_KEY, true);
		}
	}

	private void putZarrCompression(final DatasetIOConfiguration configuration, final Map<String, Object> arguments) {

		final Codec codec = configuration.getCompressionCodec();
		if (codec != null)
			arguments.put(COMPRESSOR_KEY, codec);
		else {
			final CompressionMethod method = resolve(configuration.getCompressionMethod());
			if (method.isNone())
				arguments.put(COMPRESSOR_KEY, false);
			else
				arguments.put(COMPRESSOR_KEY, new CodecConfiguration(method.getName(), configuration.getCompressionOptions()));
		}

		List<CodecConfiguration> filters = null;
		if (configuration instanceof ZarrDatasetIOConfiguration) {
			final ZarrDatasetIOConfiguration zarrConfiguration = (ZarrDatasetIOConfiguration)configuration;
			final List<String> filterMethods = zarrConfiguration.getFilterMethods();
			final List<Map<String, Object>> filterOptions = zarrConfiguration.getFilterOptions();
			if (filterMethods != null && !filterMethods.isEmpty()) {
				filters = new ArrayList<>(filterMethods.size());
				for (int i = 0; i < filterMethods.size(); ++i) {
					final String name = resolve(filterMethods.get(i)).getName();
					filters.add(new CodecConfiguration(name, filterOptions == null ? null : filterOptions.get(i)));
				}
			}
		}
		arguments.put(FILTERS_KEY, filters);
	}

	private static List<Object> optionValues(final Map<String, Object> options) {

		return options.isEmpty() ? null : Collections.unmodifiableList(new ArrayList<>(options.values()));
	}

	private static Set<String> unmodifiableSet(final String... names) {

		return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(names)));
	}

	@Override
	public String toString() {

		return backend + " compression methods " + methods.keySet();
	}
}
