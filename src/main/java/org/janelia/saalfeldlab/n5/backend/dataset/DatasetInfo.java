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
package org.janelia.saalfeldlab.n5.backend.dataset;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.janelia.saalfeldlab.n5.backend.DType;
import org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.InvalidShapeException;
import org.janelia.saalfeldlab.n5.backend.shape.ShapeEstimator;

/**
 * The immutable facts about an array that will become a dataset on write:
 * who owns it, where it will live in the container, what it holds and how
 * large it is.
 */
public final class DatasetInfo {

	public static final String DATA = "data";
	public static final String TIMESTAMPS = "timestamps";

	public static final Set<String> DATASET_NAMES = Collections.unmodifiableSet(
			new LinkedHashSet<>(Arrays.asList(DATA, TIMESTAMPS)));

	private final String objectId;
	private final String location;
	private final String datasetName;
	private final DType dtype;
	private final long[] fullShape;

	/**
	 * @param objectId id of the object owning the array
	 * @param location slash separated path inside the container, the last segment is the dataset name
	 * @param dtype element type
	 * @param fullShape extent of the whole array, all axes positive
	 */
	public DatasetInfo(final String objectId, final String location, final DType dtype, final long[] fullShape) {

		this.objectId = Objects.requireNonNull(objectId, "objectId");
		this.location = checkLocation(location);
		this.datasetName = location.substring(location.lastIndexOf('/') + 1);
		this.dtype = Objects.requireNonNull(dtype, "dtype");
		this.fullShape = checkFullShape(location, fullShape);

		if (!DATASET_NAMES.contains(datasetName))
			throw new IllegalArgumentException(
					"Dataset name '" + datasetName + "' of location '" + location + "' is not one of " + DATASET_NAMES + ".");
	}

	private static String checkLocation(final String location) {

		if (location == null || location.isEmpty())
			throw new IllegalArgumentException("Location must not be empty.");
		if (location.startsWith("/") || location.endsWith("/") || location.contains("//"))
			throw new IllegalArgumentException("Location '" + location + "' has empty path segments.");
		return location;
	}

	private static long[] checkFullShape(final String location, final long[] fullShape) {

		if (fullShape == null || fullShape.length == 0)
			throw new InvalidShapeException("Full shape of dataset at location '" + location + "' has no axes.");
		for (int i = 0; i < fullShape.length; ++i)
			if (fullShape[i] <= 0)
				throw new InvalidShapeException(
						"Axis " + i + " of full shape " + Arrays.toString(fullShape) + " of dataset at location '" + location + "' is not positive.");
		return fullShape.clone();
	}

	public String getObjectId() {

		return objectId;
	}

	public String getLocation() {

		return location;
	}

	public String getDatasetName() {

		return datasetName;
	}

	public DType getDType() {

		return dtype;
	}

	public long[] getFullShape() {

		return fullShape.clone();
	}

	public int getNumDimensions() {

		return fullShape.length;
	}

	public long getSourceSizeInBytes() {

		return ShapeEstimator.sizeInBytes(fullShape, dtype.getItemSize());
	}

	@Override
	public boolean equals(final Object other) {

		if (this == other)
			return true;
		if (!(other instanceof DatasetInfo))
			return false;
		final DatasetInfo that = (DatasetInfo)other;
		return objectId.equals(that.objectId) &&
				location.equals(that.location) &&
				dtype.equals(that.dtype) &&
				Arrays.equals(fullShape, that.fullShape);
	}

	@Override
	public int hashCode() {

		return Objects.hash(objectId, location, dtype, Arrays.hashCode(fullShape));
	}

	@Override
	public String toString() {

		return "\n" + location +
				"\n" + StringUtils.repeat('-', location.length()) +
				"\n  dtype : " + dtype +
				"\n  full shape of source array : " + Arrays.toString(fullShape) +
				"\n  full size of source array : " + ByteSize.format(getSourceSizeInBytes());
	}
}
