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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-down walk over an object graph that tracks the container path of every
 * node.  The root does not contribute a path segment.
 */
public final class ContainerTraversal {

	@FunctionalInterface
	public interface Visitor {

		void visit(Container container, String path);
	}

	private ContainerTraversal() {}

	/**
	 * Visits every container before its children, children in order.
	 *
	 * @param root the root container
	 * @param visitor called with each container and its path, "" for the root
	 * @throws IllegalStateException if two containers share an object id
	 */
	public static void traverse(final Container root, final Visitor visitor) {

		final Map<String, String> pathsById = new HashMap<>();
		final Deque<Container> containers = new ArrayDeque<>();
		final Deque<String> paths = new ArrayDeque<>();
		containers.push(root);
		paths.push("");

		while (!containers.isEmpty()) {
			final Container container = containers.pop();
			final String path = paths.pop();

			final String previous = pathsById.put(container.getObjectId(), path);
			if (previous != null)
				throw new IllegalStateException(String.format(
						"Object id '%s' is used at '%s' and at '%s'.", container.getObjectId(), previous, path));

			visitor.visit(container, path);

			final List<? extends Container> children = container.getChildren();
			for (int i = children.size() - 1; i >= 0; --i) {
				final Container child = children.get(i);
				containers.push(child);
				paths.push(childPath(path, child.getName()));
			}
		}
	}

	public static String childPath(final String parentPath, final String name) {

		return parentPath.isEmpty() ? name : parentPath + "/" + name;
	}
}
