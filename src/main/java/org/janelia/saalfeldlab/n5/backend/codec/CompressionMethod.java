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

import java.util.Objects;

import org.janelia.saalfeldlab.n5.backend.Backend;

/**
 * A named compression method as resolved by a {@link CompressionCatalog}.
 *
 * Native methods are built into the backend, plugin methods are contributed
 * by a {@link CodecProvider} and, for HDF5, are addressed by their registered
 * numeric filter id.
 */
public final class CompressionMethod {

	public enum Origin {
		NATIVE,
		PLUGIN
	}

	public static final CompressionMethod NONE = new CompressionMethod(CompressionCatalog.NONE, null, Origin.NATIVE, null, false);

	private final String name;
	private final Backend backend;
	private final Origin origin;
	private final Integer filterId;
	private final boolean lossy;

	private CompressionMethod(
			final String name,
			final Backend backend,
			final Origin origin,
			final Integer filterId,
			final boolean lossy) {

		this.name = name;
		this.backend = backend;
		this.origin = origin;
		this.filterId = filterId;
		this.lossy = lossy;
	}

	public static CompressionMethod nativeMethod(final Backend backend, final String name, final Integer filterId, final boolean lossy) {

		return new CompressionMethod(Objects.requireNonNull(name), Objects.requireNonNull(backend), Origin.NATIVE, filterId, lossy);
	}

	public static CompressionMethod plugin(final Backend backend, final String name, final Integer filterId, final boolean lossy) {

		return new CompressionMethod(Objects.requireNonNull(name), Objects.requireNonNull(backend), Origin.PLUGIN, filterId, lossy);
	}

	public static CompressionMethod plugin(final Backend backend, final String name) {

		return plugin(backend, name, null, false);
	}

	public String getName() {

		return name;
	}

	/**
	 * @return the backend or {@code null} for {@link #NONE}, which every backend accepts
	 */
	public Backend getBackend() {

		return backend;
	}

	public Origin getOrigin() {

		return origin;
	}

	/**
	 * @return the registered HDF5 filter id or {@code null}
	 */
	public Integer getFilterId() {

		return filterId;
	}

	public boolean isLossy() {

		return lossy;
	}

	public boolean isNone() {

		return this == NONE;
	}

	@Override
	public boolean equals(final Object other) {

		if (this == other)
			return true;
		if (!(other instanceof CompressionMethod))
			return false;
		final CompressionMethod that = (CompressionMethod)other;
		return name.equals(that.name) &&
				backend == that.backend &&
				origin == that.origin &&
				Objects.equals(filterId, that.filterId) &&
				lossy == that.lossy;
	}

	@Override
	public int hashCode() {

		return Objects.hash(name, backend, origin, filterId, lossy);
	}

	@Override
	public String toString() {

		return filterId == null ? name : name + " (" + filterId + ")";
	}
}
