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
import java.util.List;
import java.util.Objects;

import com.tomaszrup.treewalk.node.ConditionalNode;
import com.tomaszrup.treewalk.node.NodeKind;
import com.tomaszrup.treewalk.node.TreeNode;

public class IfNode extends BaseNode implements ConditionalNode {
	private final BaseNode test;
	private final BaseNode thenBranch;
	private final BaseNode elseBranch;

	public IfNode(BaseNode test, BaseNode thenBranch) {
		this(test, thenBranch, null);
	}

	public IfNode(BaseNode test, BaseNode thenBranch, BaseNode elseBranch) {
		super(NodeKind.IF);
		this.test = Objects.requireNonNull(test, "test");
		this.thenBranch = Objects.requireNonNull(thenBranch, "thenBranch");
		this.elseBranch = elseBranch;
		adopt(test);
		adopt(thenBranch);
		if (elseBranch != null) {
			adopt(elseBranch);
		}
	}

	@Override
	public TreeNode getTest() {
		return test;
	}

	@Override
	public TreeNode getThenBranch() {
		return thenBranch;
	}

	@Override
	public TreeNode getElseBranch() {
		return elseBranch;
	}

	@Override
	public <T extends BaseNode> T addChild(T child) {
		throw new UnsupportedOperationException(getKind() + " children are set through the constructor");
	}

	@Override
	public List<TreeNode> getChildren() {
		List<TreeNode> result = new ArrayList<>(3);
		result.add(test);
		result.add(thenBranch);
		if (elseBranch != null) {
			result.add(elseBranch);
		}
		return Collections.unmodifiableList(result);
	}
}
