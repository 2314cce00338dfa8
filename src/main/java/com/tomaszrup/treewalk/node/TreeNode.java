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
package com.tomaszrup.treewalk.node;

import java.util.List;
import java.util.Map;

/**
 * Minimal shape every node handed to the walkers and the exclusivity oracle
 * must expose.
 *
 * <p>Ownership flows from the root to the children; {@link #getParent()} is a
 * back-link only. The locals mapping is a symbol table, not an ownership
 * relation, and may form cycles across the tree.</p>
 *
 * <p>Implementations are compared by identity throughout this library.</p>
 */
public interface TreeNode {

	NodeKind getKind();

	/**
	 * @return the parent node, or {@code null} for the root
	 */
	TreeNode getParent();

	/**
	 * @return the syntactic children in source order, never {@code null}
	 */
	List<TreeNode> getChildren();

	/**
	 * Returns the symbol table of this node: name to the ordered nodes that
	 * define it. Iteration order of the map is significant.
	 *
	 * @return the locals mapping, empty when the node has no symbol table
	 */
	Map<String, List<TreeNode>> getLocals();

	/**
	 * @return whether this node carries a symbol table at all
	 */
	boolean hasLocals();
}
