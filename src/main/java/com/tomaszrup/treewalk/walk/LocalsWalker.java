////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.treewalk.walk;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.treewalk.dispatch.DispatchEntry;
import com.tomaszrup.treewalk.dispatch.DispatchResolver;
import com.tomaszrup.treewalk.dispatch.HandlerSet;
import com.tomaszrup.treewalk.dispatch.VisitResult;
import com.tomaszrup.treewalk.node.TreeNode;

/**
 * Visits the graph formed by symbol tables instead of syntactic children:
 * from a node, every definition bound to every name of its locals mapping is
 * visited, in mapping order and then definition order.
 *
 * <p>Symbol tables may reference each other in cycles, so the walker keeps
 * the set of nodes it has visited for its whole lifetime. A node already
 * visited, by this call or an earlier one, is skipped silently. Use a new
 * walker for an independent visit.</p>
 *
 * @param <R> type of the value produced by leave callbacks
 */
public class LocalsWalker<R> {
	private static final Logger logger = LoggerFactory.getLogger(LocalsWalker.class);

	private final DispatchResolver<R> resolver;
	private final Set<TreeNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());

	public LocalsWalker(HandlerSet<R> handlers) {
		this(new DispatchResolver<>(handlers));
	}

	public LocalsWalker(DispatchResolver<R> resolver) {
		this.resolver = Objects.requireNonNull(resolver, "resolver");
	}

	/**
	 * Visits {@code node} and, unless its enter callback prunes, everything
	 * reachable through the locals mappings that has not been visited yet.
	 *
	 * @return the value of the node's leave callback, or {@code null} if the
	 *         node was visited before or has no leave callback
	 */
	public R visit(TreeNode node) {
		Objects.requireNonNull(node, "node");
		if (visited.contains(node)) {
			return null;
		}
		int before = visited.size();
		Deque<Frame<R>> stack = new ArrayDeque<>();
		stack.push(open(node));
		R result = null;
		while (!stack.isEmpty()) {
			Frame<R> frame = stack.peek();
			if (frame.definitions.hasNext()) {
				TreeNode definition = frame.definitions.next();
				if (!visited.contains(definition)) {
					stack.push(open(definition));
				}
			} else {
				stack.pop();
				R value = frame.entry.leave(frame.node);
				if (stack.isEmpty()) {
					result = value;
				}
			}
		}
		logger.debug("Visited {} new nodes through locals of {}", visited.size() - before, node);
		return result;
	}

	public boolean isVisited(TreeNode node) {
		return visited.contains(node);
	}

	public int getVisitedCount() {
		return visited.size();
	}

	private Frame<R> open(TreeNode node) {
		visited.add(node);
		DispatchEntry<R> entry = resolver.resolve(node.getKind());
		List<TreeNode> definitions = Collections.emptyList();
		if (entry.enter(node) != VisitResult.SKIP_CHILDREN && node.hasLocals()) {
			definitions = new ArrayList<>();
			for (List<TreeNode> bound : node.getLocals().values()) {
				definitions.addAll(bound);
			}
		}
		return new Frame<>(node, entry, definitions.iterator());
	}

	private static final class Frame<R> {
		private final TreeNode node;
		private final DispatchEntry<R> entry;
		private final Iterator<TreeNode> definitions;

		private Frame(TreeNode node, DispatchEntry<R> entry, Iterator<TreeNode> definitions) {
			this.node = node;
			this.entry = entry;
			this.definitions = definitions;
		}
	}
}
