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

import com.tomaszrup.treewalk.node.HandlerClause;
import com.tomaszrup.treewalk.node.NodeKind;
import com.tomaszrup.treewalk.node.TreeNode;

public class ExceptHandlerNode extends BaseNode implements HandlerClause {
	private final BaseNode type;
	private final List<TreeNode> body = new ArrayList<>();

	public ExceptHandlerNode() {
		this(null);
	}

	/**
	 * @param type the caught exception expression, or {@code null} for a bare
	 *             {@code except}
	 */
	public ExceptHandlerNode(BaseNode type) {
		super(NodeKind.EXCEPT_HANDLER);
		this.type = type;
		if (type != null) {
			adopt(type);
		}
	}

	public ExceptHandlerNode addBody(BaseNode... statements) {
		for (BaseNode statement : statements) {
			adopt(statement);
			body.add(statement);
		}
		return this;
	}

	public TreeNode getType() {
		return type;
	}

	@Override
	public List<TreeNode> getBody() {
		return Collections.unmodifiableList(body);
	}

	@Override
	public <T extends BaseNode> T addChild(T child) {
		throw new UnsupportedOperationException(getKind() + " children are set through addBody");
	}

	@Override
	public List<TreeNode> getChildren() {
		List<TreeNode> result = new ArrayList<>(body.size() + 1);
		if (type != null) {
			result.add(type);
		}
		result.addAll(body);
		return Collections.unmodifiableList(result);
	}
}
