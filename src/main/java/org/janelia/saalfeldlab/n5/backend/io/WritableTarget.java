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

/**
 * One dataset of a pending write, identified by the id of its owning object
 * and its dataset name.
 */
public interface WritableTarget {

	String getObjectId();

	String getDatasetName();

	/**
	 * @return the location of the dataset in the container
	 */
	String getLocation();

	boolean isConfigured();

	/**
	 * Verifies that the writer can follow the instructions without
	 * attaching them or touching the container.
	 *
	 * @param dataIO the instructions
	 * @throws org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException if {@link #configure(DataIO)} would fail
	 */
	void check(DataIO dataIO);

	/**
	 * Attaches write instructions.
	 *
	 * @param dataIO the instructions
	 * @throws org.janelia.saalfeldlab.n5.backend.DatasetConfigurationException.AlreadyConfiguredException if already configured
	 */
	void configure(DataIO dataIO);
}
