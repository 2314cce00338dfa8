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

import com.tomaszrup.treewalk.node.ExceptionNode;
import com.tomaszrup.treewalk.node.HandlerClause;
import com.tomaszrup.treewalk.node.NodeKind;
import com.tomaszrup.treewalk.node.TreeNode;

/**
 * {@code try}/{@code except}/{@code else}. Children are reported in source
 * order (body, handlers, else-clause) whatever order they were added in.
 */
public class TryExceptNode extends BaseNode implements ExceptionNode {
	private final List<TreeNode> body = new ArrayList<>();
	private final List<HandlerClause> handlers = new ArrayList<>();
	private final List<TreeNode> orElse = new ArrayList<>();

	public TryExceptNode() {
		super(NodeKind.TRY_EXCEPT);
	}

	public TryExceptNode addBody(BaseNode... statements) {
		for (BaseNode statement : statements) {
			adopt(statement);
			body.add(statement);
		}
		return this;
	}

	public TryExceptNode addHandler(ExceptHandlerNode handler) {
		adopt(handler);
		handlers.add(handler);
		return this;
	}

	public TryExceptNode addOrElse(BaseNode... statements) {
		for (BaseNode statement : statements) {
			adopt(statement);
			orElse.add(statement);
		}
		return this;
	}

	@Override
	public List<TreeNode> getBody() {
		return Collections.unmodifiableList(body);
	}

	@Override
	public List<HandlerClause> getHandlers() {
		return Collections.unmodifiableList(handlers);
	}

	@Override
	public List<TreeNode> getOrElse() {
		return Collections.unmodifiableList(orElse);
	}

	@Override
	public <T extends BaseNode> T addChild(T child) {
		throw new UnsupportedOperationException(getKind() + " children are set through addBody, addHandler and addOrElse");
	}

	@Override
	public List<TreeNode> getChildren() {
		List<TreeNode> result = new ArrayList<>(body.size() + handlers.size() + orElse.size());
		result.addAll(body);
		result.addAll(handlers);
		result.addAll(orElse);
		return Collections.unmodifiableList(result);
	}
}
