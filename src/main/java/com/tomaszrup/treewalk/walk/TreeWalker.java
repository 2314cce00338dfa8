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
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.treewalk.dispatch.ContextListener;
import com.tomaszrup.treewalk.dispatch.DispatchEntry;
import com.tomaszrup.treewalk.dispatch.DispatchResolver;
import com.tomaszrup.treewalk.dispatch.HandlerSet;
import com.tomaszrup.treewalk.dispatch.VisitResult;
import com.tomaszrup.treewalk.node.TreeNode;

/**
 * Walks a tree in preorder, calling the enter callback of each node before
 * its children and the leave callback after them.
 *
 * <p>For every node: the node is entered; unless the enter callback returned
 * {@link VisitResult#SKIP_CHILDREN}, each child in turn is announced to the
 * {@link ContextListener} and walked completely; finally the node is left.
 * The leave callback runs exactly once per entered node, pruned or not.</p>
 *
 * <p>A node met twice in the same walk raises {@link TraversalException}.
 * Exceptions thrown by callbacks are not caught. The tree must not change
 * while it is walked.</p>
 *
 * @param <R> leave callback result type, discarded by this walker
 */
public class TreeWalker<R> {
	private static final Logger logger = LoggerFactory.getLogger(TreeWalker.class);

	private final DispatchResolver<R> resolver;
	private final TraversalStrategy strategy;

	public TreeWalker(HandlerSet<R> handlers) {
		this(handlers, TraversalStrategy.ITERATIVE);
	}

	public TreeWalker(HandlerSet<R> handlers, TraversalStrategy strategy) {
		this(new DispatchResolver<>(handlers), strategy);
	}

	public TreeWalker(DispatchResolver<R> resolver, TraversalStrategy strategy) {
		this.resolver = Objects.requireNonNull(resolver, "resolver");
		this.strategy = Objects.requireNonNull(strategy, "strategy");
	}

	public TraversalStrategy getStrategy() {
		return strategy;
	}

	public DispatchResolver<R> getResolver() {
		return resolver;
	}

	/**
	 * Walks the subtree rooted at {@code root}.
	 *
	 * @throws TraversalException if the subtree is not a tree
	 */
	public void walk(TreeNode root) {
		Objects.requireNonNull(root, "root");
		Set<TreeNode> done = Collections.newSetFromMap(new IdentityHashMap<>());
		if (strategy == TraversalStrategy.RECURSIVE) {
			walkRecursive(root, done);
		} else {
			walkIterative(root, done);
		}
		logger.debug("Walked {} nodes from {}", done.size(), root);
	}

	private void walkRecursive(TreeNode node, Set<TreeNode> done) {
		if (enter(node, done)) {
			for (TreeNode child : node.getChildren()) {
				descend(node, child);
				walkRecursive(child, done);
			}
		}
		leave(node);
	}

	private void walkIterative(TreeNode root, Set<TreeNode> done) {
		Deque<Frame> stack = new ArrayDeque<>();
		stack.push(open(root, done));
		while (!stack.isEmpty()) {
			Frame frame = stack.peek();
			if (frame.children.hasNext()) {
				TreeNode child = frame.children.next();
				descend(frame.node, child);
				stack.push(open(child, done));
			} else {
				stack.pop();
				leave(frame.node);
			}
		}
	}

	private Frame open(TreeNode node, Set<TreeNode> done) {
		Iterator<TreeNode> children = enter(node, done)
				? node.getChildren().iterator()
				: Collections.emptyIterator();
		return new Frame(node, children);
	}

	/**
	 * @return whether the children of the node should be walked
	 */
	private boolean enter(TreeNode node, Set<TreeNode> done) {
		if (!done.add(node)) {
			throw new TraversalException("Node visited twice", node);
		}
		DispatchEntry<R> entry = resolver.resolve(node.getKind());
		if (logger.isTraceEnabled()) {
			logger.trace("enter {} as {}", node, entry.getCanonicalKind());
		}
		return entry.enter(node) != VisitResult.SKIP_CHILDREN;
	}

	private void descend(TreeNode parent, TreeNode child) {
		ContextListener listener = resolver.getContextListener();
		if (listener != null) {
			listener.setContext(parent, child);
		}
		if (child == parent) {
			throw new TraversalException("Node is its own child", parent);
		}
	}

	private void leave(TreeNode node) {
		resolver.resolve(node.getKind()).leave(node);
		if (node.getParent() == node) {
			throw new TraversalException("Node is its own parent", node);
		}
	}

	private static final class Frame {
		private final TreeNode node;
		private final Iterator<TreeNode> children;

		private Frame(TreeNode node, Iterator<TreeNode> children) {
			this.node = node;
			this.children = children;
		}
	}
}
