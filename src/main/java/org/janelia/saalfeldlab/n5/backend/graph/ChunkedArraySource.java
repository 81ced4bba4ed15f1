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
package org.janelia.saalfeldlab.n5.backend.graph;

import java.util.Arrays;
import java.util.Objects;

import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.InvalidShapeException;

/**
 * A source that is read piecewise while writing, e.g. from a file that is too
 * large for memory.  The source knows the chunk and buffer shapes it is best
 * iterated in, these are adopted instead of estimating new ones.
 */
public class ChunkedArraySource implements ArraySource {

	private final DType dtype;
	private final long[] shape;
	private final long[] chunkShape;
	private final long[] bufferShape;

	public ChunkedArraySource(final DType dtype, final long[] shape, final long[] chunkShape, final long[] bufferShape) {

		this.dtype = Objects.requireNonNull(dtype, "dtype");
		this.shape = Objects.requireNonNull(shape, "shape").clone();
		this.chunkShape = Objects.requireNonNull(chunkShape, "chunkShape").clone();
		this.bufferShape = Objects.requireNonNull(bufferShape, "bufferShape").clone();

		if (chunkShape.length != shape.length || bufferShape.length != shape.length)
			throw new InvalidShapeException(String.format(
					"Chunk shape %s and buffer shape %s do not have the rank of shape %s.",
					Arrays.toString(chunkShape), Arrays.toString(bufferShape), Arrays.toString(shape)));
	}

	@Override
	public long[] getShape() {

		return shape.clone();
	}

	@Override
	public DType getDType() {

		return dtype;
	}

	public long[] getChunkShape() {

		return chunkShape.clone();
	}

	public long[] getBufferShape() {

		return bufferShape.clone();
	}

	@Override
	public String toString() {

		return getClass().getSimpleName() + "(" + dtype + ", " + Arrays.toString(shape) + ")";
	}
}
