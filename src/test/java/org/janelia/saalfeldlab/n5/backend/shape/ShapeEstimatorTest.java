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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.InvalidShapeException;
import org.junit.Test;

public class ShapeEstimatorTest {

	private static final long[][] fullShapes = {
			{1_000_000, 4},
			{1_000_000, 384},
			{30_000, 512, 512},
			{17},
			{3, 5, 7, 11},
			{100_000_000},
			{2, 1_000_000_000},
			{1, 1, 1}};

	@Test
	public void testLongNarrowFloat64() {

		final ShapeEstimator.Shapes shapes = ShapeEstimator.estimate(new long[]{1_000_000, 4}, 8);

		assertArrayEquals(new long[]{312_500, 4}, shapes.getChunkShape());
		assertArrayEquals(new long[]{1_000_000, 4}, shapes.getBufferShape());
		assertTrue(ShapeEstimator.sizeInBytes(shapes.getChunkShape(), 8) <= ShapeEstimator.DEFAULT_CHUNK_TARGET_BYTES);
	}

	@Test
	public void testShapeInvariants() {

		for (final long[] fullShape : fullShapes) {
			for (final int itemSize : new int[]{1, 2, 8}) {
				final ShapeEstimator.Shapes shapes = ShapeEstimator.estimate(fullShape, itemSize);
				final long[] chunkShape = shapes.getChunkShape();
				final long[] bufferShape = shapes.getBufferShape();
				final String message = Arrays.toString(fullShape) + " x " + itemSize + ": " + shapes;

				assertEquals(message, fullShape.length, chunkShape.length);
				assertEquals(message, fullShape.length, bufferShape.length);
				for (int i = 0; i < fullShape.length; ++i) {
					assertTrue(message, 0 < chunkShape[i]);
					assertTrue(message, chunkShape[i] <= bufferShape[i]);
					assertTrue(message, bufferShape[i] <= fullShape[i]);
					if (bufferShape[i] != fullShape[i])
						assertEquals(message, 0, bufferShape[i] % chunkShape[i]);
				}
			}
		}
	}

	@Test
	public void testChunkMeetsTargetUnlessWhole() {

		for (final long[] fullShape : fullShapes) {
			final long[] chunkShape = ShapeEstimator.estimateChunkShape(fullShape, 2, 1_000_000);
			if (!Arrays.equals(chunkShape, fullShape))
				assertTrue(Arrays.toString(fullShape), ShapeEstimator.sizeInBytes(chunkShape, 2) >= 1_000_000);
		}
	}

	@Test
	public void testSmallArrayIsOneChunk() {

		final long[] fullShape = {3, 5, 7};
		final ShapeEstimator.Shapes shapes = ShapeEstimator.estimate(fullShape, 4);

		assertArrayEquals(fullShape, shapes.getChunkShape());
		assertArrayEquals(fullShape, shapes.getBufferShape());
	}

	@Test
	public void testDeterministic() {

		final long[] fullShape = {30_000, 512, 512};
		assertArrayEquals(
				ShapeEstimator.estimateChunkShape(fullShape, 2),
				ShapeEstimator.estimateChunkShape(fullShape, 2));
	}

	@Test
	public void testBufferAdoptsChunkMultiples() {

		final long[] fullShape = {1_000, 1_000};
		final long[] chunkShape = {30, 70};
		final long[] bufferShape = ShapeEstimator.estimateBufferShape(chunkShape, fullShape, 1, 100_000);

		for (int i = 0; i < fullShape.length; ++i)
			assertTrue(bufferShape[i] == fullShape[i] || bufferShape[i] % chunkShape[i] == 0);
		assertTrue(ShapeEstimator.volume(bufferShape) >= 100_000);
	}

	@Test
	public void testEmptyAxis() {

		final long[] fullShape = {0, 10};
		final ShapeEstimator.Shapes shapes = ShapeEstimator.estimate(fullShape, 8);

		assertArrayEquals(fullShape, shapes.getChunkShape());
		assertArrayEquals(fullShape, shapes.getBufferShape());
		assertTrue(ShapeEstimator.isEmpty(fullShape));
		assertEquals(0, ShapeEstimator.volume(fullShape));
	}

	@Test
	public void testInvalidInput() {

		assertThrows(InvalidShapeException.class, () -> ShapeEstimator.estimate(new long[0], 8));
		assertThrows(InvalidShapeException.class, () -> ShapeEstimator.estimate(new long[]{10, -1}, 8));
		assertThrows(InvalidShapeException.class, () -> ShapeEstimator.estimate(new long[]{10}, 0));
		assertThrows(InvalidShapeException.class, () -> ShapeEstimator.estimateChunkShape(new long[]{10}, 1, 0));
		assertThrows(InvalidShapeException.class, () -> ShapeEstimator.estimateBufferShape(new long[]{11}, new long[]{10}, 1));
		assertThrows(InvalidShapeException.class, () -> ShapeEstimator.estimateBufferShape(new long[]{1, 1}, new long[]{10}, 1));
	}

	@Test
	public void testSaturatingArithmetic() {

		final long[] huge = {Long.MAX_VALUE / 2, 4};
		assertEquals(Long.MAX_VALUE, ShapeEstimator.volume(huge));
		assertEquals(Long.MAX_VALUE, ShapeEstimator.multiplySaturated(Long.MAX_VALUE, 2));
		assertEquals(3, ShapeEstimator.ceilDiv(7, 3));

		final long[] chunkShape = ShapeEstimator.estimateChunkShape(huge, 8);
		assertTrue(ShapeEstimator.sizeInBytes(chunkShape, 8) >= ShapeEstimator.DEFAULT_CHUNK_TARGET_BYTES);
	}
}
