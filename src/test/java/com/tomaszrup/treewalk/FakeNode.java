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
package com.tomaszrup.treewalk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.tomaszrup.treewalk.node.NodeKind;
import com.tomaszrup.treewalk.node.TreeNode;

/**
 * Unchecked {@link TreeNode} whose links can be wired arbitrarily, used to
 * build the malformed graphs the library must reject.
 */
public class FakeNode implements TreeNode {
	private final NodeKind kind;
	private final String label;
	private TreeNode parent;
	private final List<TreeNode> children = new ArrayList<>();

	public FakeNode(NodeKind kind, String label) {
		this.kind = kind;
		this.label = label;
	}

	public FakeNode link(TreeNode child) {
		children.add(child);
		if (child instanceof FakeNode && ((FakeNode) child).parent == null) {
			((FakeNode) child).parent = this;
		}
		return this;
	}

	public FakeNode setParent(TreeNode parent) {
		this.parent = parent;
		return this;
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

	@Override
	public Map<String, List<TreeNode>> getLocals() {
		return Collections.emptyMap();
	}

	@Override
	public boolean hasLocals() {
		return false;
	}

	@Override
	public String toString() {
		return label;
	}
}
