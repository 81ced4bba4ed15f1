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
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovery of {@link CodecProvider}s that are installed on the class path.
 * Meant to be called once by the embedding application at startup, the
 * catalogs themselves never probe the class path.
 */
public final class CodecProviders {

	private static final Logger LOG = LoggerFactory.getLogger(CodecProviders.class);

	private CodecProviders() {}

	public static List<CodecProvider> installed() {

		return installed(Thread.currentThread().getContextClassLoader());
	}

	public static List<CodecProvider> installed(final ClassLoader classLoader) {

		final List<CodecProvider> providers = new ArrayList<>();
		final ServiceLoader<CodecProvider> loader = ServiceLoader.load(CodecProvider.class, classLoader);
		try {
			for (final CodecProvider provider : loader) {
				LOG.debug("Found codec provider {}", provider.getClass().getName());
				providers.add(provider);
			}
		} catch (final ServiceConfigurationError e) {
			LOG.warn("Codec providers could not be loaded completely", e);
		}
		return providers;
	}
}
