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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.janelia.saalfeldlab.n5.backend.Backend;

/**
 * The dynamically loaded HDF5 filters of the common filter plugin bundle,
 * addressed by their ids in the HDF Group filter registry.  Only contributes
 * to the HDF5 catalog.  Register it when the plugins are installed next to the
 * HDF5 library that does the writing.
 */
public class Hdf5PluginFilters implements CodecProvider {

	private static final List<CompressionMethod> filters = new ArrayList<>();
	static {
		filters.add(CompressionMethod.plugin(Backend.HDF5, "BZip2", 307, false));
		filters.add(CompressionMethod.plugin(Backend.HDF5, "Blosc", 32001, false));
		filters.add(CompressionMethod.plugin(Backend.HDF5, "LZ4", 32004, false));
		filters.add(CompressionMethod.plugin(Backend.HDF5, "Bitshuffle", 32008, false));
		filters.add(CompressionMethod.plugin(Backend.HDF5, "Zfp", 32013, true));
		filters.add(CompressionMethod.plugin(Backend.HDF5, "Zstd", 32015, false));
		filters.add(CompressionMethod.plugin(Backend.HDF5, "SZ", 32017, true));
		filters.add(CompressionMethod.plugin(Backend.HDF5, "FciDecomp", 32018, false));
		filters.add(CompressionMethod.plugin(Backend.HDF5, "SZ3", 32024, true));
		filters.add(CompressionMethod.plugin(Backend.HDF5, "Blosc2", 32026, false));
		filters.add(CompressionMethod.plugin(Backend.HDF5, "Sperr", 32028, true));
	}

	@Override
	public Collection<CompressionMethod> getCompressionMethods(final Backend backend) {

		if (backend != Backend.HDF5)
			return Collections.emptyList();
		return Collections.unmodifiableList(filters);
	}
}
