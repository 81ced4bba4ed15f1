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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A mutable {@link Container}.
 */
public class Group implements Container {

	private final String objectId;
	private final String name;
	private final List<Container> children = new ArrayList<>();
	private final Map<String, Object> fields = new LinkedHashMap<>();

	public Group(final String objectId, final String name) {

		this.objectId = Objects.requireNonNull(objectId, "objectId");
		this.name = Objects.requireNonNull(name, "name");
	}

	public Group(final String name) {

		this(UUID.randomUUID().toString(), name);
	}

	@Override
	public String getObjectId() {

		return objectId;
	}

	@Override
	public String getName() {

		return name;
	}

	@Override
	public List<Container> getChildren() {

		return Collections.unmodifiableList(children);
	}

	@Override
	public Map<String, Object> getFields() {

		return Collections.unmodifiableMap(fields);
	}

	public Group addChild(final Container child) {

		children.add(Objects.requireNonNull(child, "child"));
		return this;
	}

	/**
	 * @param field the field name
	 * @param value the value, {@code null} removes the field
	 */
	public Group setField(final String field, final Object value) {

		if (value == null)
			fields.remove(field);
		else
			fields.put(field, value);
		return this;
	}

	public Object getField(final String field) {

		return fields.get(field);
	}

	@Override
	public String toString() {

		return getClass().getSimpleName() + "(" + name + ", " + objectId + ")";
	}
}
