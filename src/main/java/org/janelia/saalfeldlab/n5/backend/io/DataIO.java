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
import java.util.Objects;

import org.janelia.saalfeldlab.n5.backend.Backend;
import org.janelia.saalfeldlab.n5.backend.graph.ArraySource;

/**
 * Write instructions for one dataset: the backend and the keyword arguments
 * its writer understands, optionally wrapping the data to write.
 *
 * A {@link org.janelia.saalfeldlab.n5.backend.graph.Container} field holding a
 * {@code DataIO} has been configured by hand and is not configured again.
 */
public final class DataIO {

	private final Backend backend;
	private final Map<String, Object> arguments;
	private final ArraySource data;

	public DataIO(final Backend backend, final Map<String, ?> arguments) {

		this(backend, arguments, null);
	}

	public DataIO(final Backend backend, final Map<String, ?> arguments, final ArraySource data) {

		this.backend = Objects.requireNonNull(backend, "backend");
		this.arguments = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(Objects.requireNonNull(arguments, "arguments")));
		this.data = data;
	}

	public Backend getBackend() {

		return backend;
	}

	public Map<String, Object> getArguments() {

		return arguments;
	}

	public Object getArgument(final String key) {

		return arguments.get(key);
	}

	/**
	 * @return the wrapped data or {@code null}
	 */
	public ArraySource getData() {

		return data;
	}

	@Override
	public String toString() {

		return getClass().getSimpleName() + "(" + backend + ", " + arguments.keySet() + ")";
	}
}
