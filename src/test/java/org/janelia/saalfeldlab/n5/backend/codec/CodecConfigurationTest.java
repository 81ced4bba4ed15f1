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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.saalfeldlab.n5.Bzip2Compression;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.Lz4Compression;
import org.janelia.saalfeldlab.n5.RawCompression;
import org.janelia.saalfeldlab.n5.XzCompression;
import org.junit.Test;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

public class CodecConfigurationTest {

	@Test
	public void testCompression() {

		assertTrue(new CodecConfiguration(CompressionCatalog.NONE).getCompression() instanceof RawCompression);
		assertTrue(new CodecConfiguration("gzip", Collections.singletonMap("level", 5)).getCompression() instanceof GzipCompression);
		assertTrue(new CodecConfiguration("zlib").getCompression() instanceof GzipCompression);
		assertTrue(new CodecConfiguration("bz2").getCompression() instanceof Bzip2Compression);
		assertTrue(new CodecConfiguration("lz4").getCompression() instanceof Lz4Compression);
		assertTrue(new CodecConfiguration("lzma", Collections.singletonMap("preset", "3")).getCompression() instanceof XzCompression);
		assertNull(new CodecConfiguration("zstd").getCompression());
		assertNull(new CodecConfiguration("szip").getCompression());

		assertThrows(IllegalArgumentException.class,
				() -> new CodecConfiguration("gzip", Collections.singletonMap("level", "high")).getCompression());
	}

	@Test
	public void testJson() {

		final Gson gson = new GsonBuilder().registerTypeAdapter(CodecConfiguration.class, CodecConfiguration.jsonAdapter).create();

		final Map<String, Object> parameters = new LinkedHashMap<>();
		parameters.put("cname", "zstd");
		parameters.put("clevel", 5L);
		parameters.put("shuffle", 1L);
		final CodecConfiguration blosc = new CodecConfiguration("blosc", parameters);

		final JsonElement json = gson.toJsonTree(blosc);
		assertEquals("blosc", json.getAsJsonObject().get("id").getAsString());
		assertEquals(5, json.getAsJsonObject().get("clevel").getAsInt());
		assertEquals(blosc, gson.fromJson(json, CodecConfiguration.class));

		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"level\": 1}", CodecConfiguration.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("[1]", CodecConfiguration.class));
	}
}
