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
package com.tomaszrup.treewalk.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.tomaszrup.treewalk.node.NodeKind;
import com.tomaszrup.treewalk.node.TreeNode;

/**
 * Mutable-at-build-time {@link TreeNode}. Parent links are assigned when a
 * child is attached, and a node can be attached to one parent only, so trees
 * assembled from this class always satisfy {@code child.getParent() == node}.
 *
 * <p>Trees must not be modified once a walk has started.</p>
 */
public class BaseNode implements TreeNode {
	private final NodeKind kind;
	private TreeNode parent;
	private final List<TreeNode> children = new ArrayList<>();
	private Map<String, List<TreeNode>> locals;

	public BaseNode(NodeKind kind) {
		this.kind = Objects.requireNonNull(kind, "kind");
	}

	@Override
	public NodeKind getKind() {
		return kind;
	}

	@Override
	public TreeNode getParent() {
		return parent;
	}

	@Override
	public List<TreeNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	/**
	 * Appends a child and makes this node its parent.
	 *
	 * @return the child, for chaining during construction
	 * @throws IllegalStateException if the child already has a parent
	 */
	public <T extends BaseNode> T addChild(T child) {
		adopt(child);
		children.add(child);
		return child;
	}

	/**
	 * Sets this node as the parent of {@code child} without recording it in
	 * the generic child list. Subclasses that keep structured child slots use
	 * this and override {@link #getChildren()}.
	 */
	protected void adopt(BaseNode child) {
		Objects.requireNonNull(child, "child");
		if (child == this) {
			throw new IllegalArgumentException("A node cannot be its own child: " + this);
		}
		if (child.parent != null) {
			throw new IllegalStateException("Node already attached to " + child.parent + ": " + child);
		}
		child.parent = this;
	}

	/**
	 * Gives this node an (initially empty) symbol table.
	 */
	public BaseNode withLocals() {
		if (locals == null) {
			locals = new LinkedHashMap<>();
		}
		return this;
	}

	/**
	 * Binds {@code name} to one more defining node. The definition is not
	 * attached as a child; symbol tables may point anywhere in the tree.
	 */
	public BaseNode defineLocal(String name, TreeNode definition) {
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(definition, "definition");
		withLocals();
		locals.computeIfAbsent(name, k -> new ArrayList<>()).add(definition);
		return this;
	}

	@Override
	public Map<String, List<TreeNode>> getLocals() {
		if (locals == null) {
			return Collections.emptyMap();
		}
		Map<String, List<TreeNode>> view = new LinkedHashMap<>();
		for (Map.Entry<String, List<TreeNode>> entry : locals.entrySet()) {
			view.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
		}
		return Collections.unmodifiableMap(view);
	}

	@Override
	public boolean hasLocals() {
		return locals != null;
	}

	@Override
	public String toString() {
		return kind + "@" + Integer.toHexString(System.identityHashCode(this));
	}
}
