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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.shape.ShapeEstimator;

/**
 * A materialized array.  Only object arrays keep their elements, the
 * configuration has to look at them to decide whether they can be stored.
 */
public class InMemoryArray implements ArraySource {

	public static final DType OBJECT = new DType("|O");

	private final DType dtype;
	private final long[] shape;
	private final List<Object> elements;
	private boolean writtenToFile = false;

	public InMemoryArray(final DType dtype, final long... shape) {

		this(dtype, shape, null);
	}

	private InMemoryArray(final DType dtype, final long[] shape, final List<Object> elements) {

		this.dtype = Objects.requireNonNull(dtype, "dtype");
		this.shape = Objects.requireNonNull(shape, "shape").clone();
		this.elements = elements;
	}

	/**
	 * An object array, elements in C order.
	 *
	 * @param shape the shape
	 * @param elements one element per position
	 * @return the array
	 */
	public static InMemoryArray ofObjects(final long[] shape, final Object... elements) {

		if (ShapeEstimator.volume(shape) != elements.length)
			throw new IllegalArgumentException(
					elements.length + " elements do not fill an array of shape " + Arrays.toString(shape) + ".");
		return new InMemoryArray(OBJECT, shape, Collections.unmodifiableList(Arrays.asList(elements.clone())));
	}

	@Override
	public long[] getShape() {

		return shape.clone();
	}

	@Override
	public DType getDType() {

		return dtype;
	}

	/**
	 * @return the elements of an object array or {@code null}
	 */
	public List<Object> getElements() {

		return elements;
	}

	@Override
	public boolean isWrittenToFile() {

		return writtenToFile;
	}

	public InMemoryArray setWrittenToFile(final boolean writtenToFile) {

		this.writtenToFile = writtenToFile;
		return this;
	}

	@Override
	public String toString() {

		return getClass().getSimpleName() + "(" + dtype + ", " + Arrays.toString(shape) + ")";
	}
}
