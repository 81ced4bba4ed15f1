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

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Root of all failures raised while configuring, validating or applying
 * dataset storage configurations.
 *
 * All of them are local and synchronous, the caller is expected to change its
 * input and try again.
 */
public class DatasetConfigurationException extends RuntimeException {

	private static final long serialVersionUID = 2916541397316547372L;

	public DatasetConfigurationException(final String message) {

		super(message);
	}

	public DatasetConfigurationException(final String message, final Throwable cause) {

		super(message, cause);
	}

	/**
	 * A shape that cannot be estimated or stored, e.g. negative extents.
	 */
	public static class InvalidShapeException extends DatasetConfigurationException {

		private static final long serialVersionUID = -1187023532478001262L;

		public InvalidShapeException(final String message) {

			super(message);
		}
	}

	/**
	 * Chunk, buffer and full shape of a dataset do not agree.
	 */
	public static class ShapeMismatchException extends DatasetConfigurationException {

		private static final long serialVersionUID = 6129750208133514411L;

		public ShapeMismatchException(final String message) {

			super(message);
		}
	}

	public static class UnknownCompressionMethodException extends DatasetConfigurationException {

		private static final long serialVersionUID = -4422397591230553117L;

		private final Set<String> validNames;

		public UnknownCompressionMethodException(final String message, final Collection<String> validNames) {

			super(message);
			this.validNames = Collections.unmodifiableSet(new TreeSet<>(validNames));
		}

		public Set<String> getValidNames() {

			return validNames;
		}
	}

	public static class TargetNotFoundException extends DatasetConfigurationException {

		private static final long serialVersionUID = 4476129839212480025L;

		private final Set<String> knownObjectIds;

		public TargetNotFoundException(final String message, final Collection<String> knownObjectIds) {

			super(message);
			this.knownObjectIds = Collections.unmodifiableSet(new TreeSet<>(knownObjectIds));
		}

		public Set<String> getKnownObjectIds() {

			return knownObjectIds;
		}
	}

	/**
	 * A dataset configuration built for one backend was handed to a
	 * configuration of the other backend.
	 */
	public static class BackendCompressionMismatchException extends DatasetConfigurationException {

		private static final long serialVersionUID = -7590014633823164019L;

		public BackendCompressionMismatchException(final String message) {

			super(message);
		}

		public BackendCompressionMismatchException(final String message, final Throwable cause) {

			super(message, cause);
		}
	}

	/**
	 * Object arrays whose elements are not all text. Compound object arrays are
	 * not supported.
	 */
	public static class UnsupportedDtypeException extends DatasetConfigurationException {

		private static final long serialVersionUID = 8305871290046110945L;

		public UnsupportedDtypeException(final String message) {

			super(message);
		}
	}

	public static class AlreadyConfiguredException extends DatasetConfigurationException {

		private static final long serialVersionUID = -2893304877450283161L;

		public AlreadyConfiguredException(final String message) {

			super(message);
		}
	}

	public static class NoWritableDatasetsException extends DatasetConfigurationException {

		private static final long serialVersionUID = 1590467282104418871L;

		public NoWritableDatasetsException(final String message) {

			super(message);
		}
	}
}
