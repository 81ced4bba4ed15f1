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
package org.janelia.saalfeldlab.n5.backend.shape;

import java.util.Arrays;

import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.InvalidShapeException;

/**
 * Default chunk and buffer shapes for arrays of known full shape and item
 * size.
 *
 * Both shapes are grown from a seed by repeatedly doubling the axis with the
 * most remaining room relative to the full shape until the target size is met
 * or every axis is whole.  An overshoot is then trimmed back on the longest
 * axis.  Chunks are seeded with ones, buffers with the chunk shape, and
 * buffers are finally snapped up to multiples of the chunk shape on every axis
 * that does not cover the whole array.
 *
 * All volumes saturate at {@link Long#MAX_VALUE}.
 */
public final class ShapeEstimator {

	/* 10 MB */
	public static final long DEFAULT_CHUNK_TARGET_BYTES = 10_000_000L;

	/* 0.5 GB */
	public static final long DEFAULT_BUFFER_TARGET_BYTES = 500_000_000L;

	private ShapeEstimator() {}

	/**
	 * A chunk shape paired with a compatible buffer shape.
	 */
	public static final class Shapes {

		private final long[] chunkShape;
		private final long[] bufferShape;

		Shapes(final long[] chunkShape, final long[] bufferShape) {

			this.chunkShape = chunkShape;
			this.bufferShape = bufferShape;
		}

		public long[] getChunkShape() {

			return chunkShape.clone();
		}

		public long[] getBufferShape() {

			return bufferShape.clone();
		}

		@Override
		public String toString() {

			return "chunks " + Arrays.toString(chunkShape) + ", buffer " + Arrays.toString(bufferShape);
		}
	}

	public static Shapes estimate(final long[] fullShape, final int itemSize) {

		return estimate(fullShape, itemSize, DEFAULT_CHUNK_TARGET_BYTES, DEFAULT_BUFFER_TARGET_BYTES);
	}

	/**
	 * Estimates chunk and buffer shape together.  Arrays with an empty axis
	 * return the full shape for both, there is nothing to grow.
	 *
	 * @param fullShape the extent of the whole array
	 * @param itemSize bytes per element
	 * @param chunkTargetBytes minimum chunk size unless the array is smaller
	 * @param bufferTargetBytes minimum buffer size unless the array is smaller
	 * @return the shapes
	 * @throws InvalidShapeException for empty or negative shapes, non-positive item sizes or targets
	 */
	public static Shapes estimate(
			final long[] fullShape,
			final int itemSize,
			final long chunkTargetBytes,
			final long bufferTargetBytes) {

		final long[] chunkShape = estimateChunkShape(fullShape, itemSize, chunkTargetBytes);
		if (isEmpty(fullShape))
			return new Shapes(chunkShape, fullShape.clone());
		return new Shapes(chunkShape, estimateBufferShape(chunkShape, fullShape, itemSize, bufferTargetBytes));
	}

	public static long[] estimateChunkShape(final long[] fullShape, final int itemSize) {

		return estimateChunkShape(fullShape, itemSize, DEFAULT_CHUNK_TARGET_BYTES);
	}

	public static long[] estimateChunkShape(final long[] fullShape, final int itemSize, final long targetBytes) {

		checkFullShape(fullShape);
		checkPositive("item size", itemSize);
		checkPositive("chunk target", targetBytes);

		if (isEmpty(fullShape))
			return fullShape.clone();

		final long[] seed = new long[fullShape.length];
		Arrays.fill(seed, 1);
		return grow(seed, fullShape, itemSize, targetBytes);
	}

	public static long[] estimateBufferShape(final long[] chunkShape, final long[] fullShape, final int itemSize) {

		return estimateBufferShape(chunkShape, fullShape, itemSize, DEFAULT_BUFFER_TARGET_BYTES);
	}

	public static long[] estimateBufferShape(
			final long[] chunkShape,
			final long[] fullShape,
			final int itemSize,
			final long targetBytes) {

		checkFullShape(fullShape);
		checkPositive("item size", itemSize);
		checkPositive("buffer target", targetBytes);

		if (isEmpty(fullShape))
			return fullShape.clone();

		if (chunkShape == null || chunkShape.length != fullShape.length)
			throw new InvalidShapeException(
					"Chunk shape " + Arrays.toString(chunkShape) + " does not match the rank of full shape " + Arrays.toString(fullShape) + ".");
		for (int i = 0; i < fullShape.length; ++i)
			if (chunkShape[i] < 1 || chunkShape[i] > fullShape[i])
				throw new InvalidShapeException(
						"Chunk shape " + Arrays.toString(chunkShape) + " is outside of full shape " + Arrays.toString(fullShape) + " on axis " + i + ".");

		final long[] bufferShape = grow(chunkShape.clone(), fullShape, itemSize, targetBytes);

		for (int i = 0; i < bufferShape.length; ++i) {
			if (bufferShape[i] == fullShape[i])
				continue;
			final long multiple = ceilDiv(bufferShape[i], chunkShape[i]) * chunkShape[i];
			bufferShape[i] = multiple >= fullShape[i] ? fullShape[i] : multiple;
		}
		return bufferShape;
	}

	private static long[] grow(final long[] seed, final long[] fullShape, final int itemSize, final long targetBytes) {

		final long targetVolume = ceilDiv(targetBytes, itemSize);
		final long[] shape = seed.clone();

		long volume = volume(shape);
		while (volume < targetVolume) {
			final int axis = roomiestAxis(shape, fullShape);
			if (axis < 0)
				break;
			shape[axis] = shape[axis] > fullShape[axis] / 2 ? fullShape[axis] : shape[axis] * 2;
			volume = volume(shape);
		}

		if (volume > targetVolume)
			trim(shape, seed, targetVolume);

		return shape;
	}

	/* axis with the largest full / current ratio that is not yet whole, -1 if all are */
	private static int roomiestAxis(final long[] shape, final long[] fullShape) {

		int axis = -1;
		double room = 0;
		for (int i = 0; i < shape.length; ++i) {
			if (shape[i] >= fullShape[i])
				continue;
			final double r = (double)fullShape[i] / shape[i];
			if (axis < 0 || r > room) {
				axis = i;
				room = r;
			}
		}
		return axis;
	}

	/* shrink the longest axis above its seed to the smallest extent that still meets the target */
	private static void trim(final long[] shape, final long[] seed, final long targetVolume) {

		int axis = -1;
		for (int i = 0; i < shape.length; ++i)
			if (shape[i] > seed[i] && (axis < 0 || shape[i] > shape[axis]))
				axis = i;
		if (axis < 0)
			return;

		long others = 1;
		for (int i = 0; i < shape.length; ++i)
			if (i != axis)
				others = multiplySaturated(others, shape[i]);

		final long needed = Math.max(seed[axis], ceilDiv(targetVolume, others));
		if (needed < shape[axis])
			shape[axis] = needed;
	}

	/**
	 * Number of elements of a shape, saturating at {@link Long#MAX_VALUE}.
	 *
	 * @param shape the shape
	 * @return the volume
	 */
	public static long volume(final long[] shape) {

		long volume = 1;
		for (final long extent : shape)
			volume = multiplySaturated(volume, extent);
		return volume;
	}

	public static long sizeInBytes(final long[] shape, final int itemSize) {

		return multiplySaturated(volume(shape), itemSize);
	}

	public static boolean isEmpty(final long[] shape) {

		for (final long extent : shape)
			if (extent == 0)
				return true;
		return false;
	}

	static long multiplySaturated(final long a, final long b) {

		try {
			return Math.multiplyExact(a, b);
		} catch (final ArithmeticException e) {
			return Long.MAX_VALUE;
		}
	}

	static long ceilDiv(final long a, final long b) {

		return a / b + (a % b == 0 ? 0 : 1);
	}

	private static void checkFullShape(final long[] fullShape) {

		if (fullShape == null || fullShape.length == 0)
			throw new InvalidShapeException("Full shape must have at least one axis.");
		for (int i = 0; i < fullShape.length; ++i)
			if (fullShape[i] < 0)
				throw new InvalidShapeException(
						"Axis " + i + " of full shape " + Arrays.toString(fullShape) + " is negative.");
	}

	private static void checkPositive(final String name, final long value) {

		if (value <= 0)
			throw new InvalidShapeException("The " + name + " (" + value + ") must be greater than zero.");
	}
}
