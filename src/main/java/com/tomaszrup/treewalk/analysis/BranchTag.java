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
package com.tomaszrup.treewalk.analysis;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.tomaszrup.treewalk.node.ExceptionNode;
import com.tomaszrup.treewalk.node.HandlerClause;
import com.tomaszrup.treewalk.node.TreeNode;

/**
 * Which part of an exception construct a direct child belongs to: the body,
 * the else-clause, or the handler at a given index.
 */
public final class BranchTag {

	public enum Branch {
		BODY,
		ELSE,
		EXCEPT
	}

	private static final BranchTag BODY = new BranchTag(Branch.BODY, 0);
	private static final BranchTag ELSE = new BranchTag(Branch.ELSE, 0);

	private final Branch branch;
	private final int index;

	private BranchTag(Branch branch, int index) {
		this.branch = branch;
		this.index = index;
	}

	public static BranchTag body() {
		return BODY;
	}

	public static BranchTag orElse() {
		return ELSE;
	}

	public static BranchTag handler(int index) {
		if (index < 0) {
			throw new IllegalArgumentException("Negative handler index: " + index);
		}
		return new BranchTag(Branch.EXCEPT, index);
	}

	/**
	 * Classifies a direct child of {@code construct}. A handler is matched
	 * either as the child itself or through one of its body statements.
	 *
	 * @throws BranchClassificationException if the child belongs to no part
	 */
	public static BranchTag classify(ExceptionNode construct, TreeNode child) {
		if (containsIdentical(construct.getBody(), child)) {
			return BODY;
		}
		if (containsIdentical(construct.getOrElse(), child)) {
			return ELSE;
		}
		List<HandlerClause> handlers = construct.getHandlers();
		for (int i = 0; i < handlers.size(); i++) {
			HandlerClause handler = handlers.get(i);
			if (handler == child || containsIdentical(handler.getBody(), child)) {
				return handler(i);
			}
		}
		throw new BranchClassificationException(construct, child);
	}

	private static boolean containsIdentical(List<? extends TreeNode> nodes, TreeNode node) {
		for (TreeNode candidate : nodes) {
			if (candidate == node) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Decides whether code in this branch and code in {@code other} can never
	 * both run for one execution of the construct.
	 */
	public boolean isExclusiveWith(BranchTag other, ExclusivityMode mode) {
		if (branch == other.branch) {
			return index != other.index;
		}
		if (branch == Branch.BODY || other.branch == Branch.BODY) {
			return true;
		}
		// one handler, one else-clause
		return mode == ExclusivityMode.STRICT;
	}

	public Branch getBranch() {
		return branch;
	}

	public int getIndex() {
		return index;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof BranchTag)) return false;
		BranchTag other = (BranchTag) o;
		return branch == other.branch && index == other.index;
	}

	@Override
	public int hashCode() {
		return Objects.hash(branch, index);
	}

	@Override
	public String toString() {
		return branch == Branch.EXCEPT ? "except[" + index + "]" : branch.name().toLowerCase(Locale.ROOT);
	}
}
