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
import java.util.List;

import org.janelia.saalfeldlab.n5.backend.Backend;

/**
 * Contributes one usable codec per backend, plus a denied and a lossy one for
 * zarr that the catalog has to ignore.
 */
public class TestCodecProvider implements CodecProvider {

	public static final String ZARR_CODEC = "test-zarr";
	public static final String HDF5_FILTER = "test-hdf5";
	public static final int HDF5_FILTER_ID = 40000;

	@Override
	public Collection<CompressionMethod> getCompressionMethods(final Backend backend) {

		final List<CompressionMethod> methods = new ArrayList<>();
		switch (backend) {
		case HDF5:
			methods.add(CompressionMethod.plugin(Backend.HDF5, HDF5_FILTER, HDF5_FILTER_ID, false));
			break;
		case ZARR:
			methods.add(CompressionMethod.plugin(Backend.ZARR, ZARR_CODEC));
			methods.add(CompressionMethod.plugin(Backend.ZARR, "shuffle"));
			methods.add(CompressionMethod.plugin(Backend.ZARR, "test-lossy", null, true));
			break;
		}
		return methods;
	}
}
