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

import com.tomaszrup.treewalk.TreeWalkException;
import com.tomaszrup.treewalk.node.TreeNode;

/**
 * Raised when a walk meets a node it has already entered, or a node that is
 * its own child or parent. The tree violates the acyclicity invariant and the
 * walk is abandoned.
 */
public class TraversalException extends TreeWalkException {
	private static final long serialVersionUID = 1L;

	private final transient TreeNode node;

	public TraversalException(String message, TreeNode node) {
		super(message + ": " + node + " (parent " + node.getParent() + ")");
		this.node = node;
	}

	public TreeNode getNode() {
		return node;
	}
}
