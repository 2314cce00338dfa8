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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.treewalk.node.ConditionalNode;
import com.tomaszrup.treewalk.node.ExceptionNode;
import com.tomaszrup.treewalk.node.TreeNode;
import com.tomaszrup.treewalk.walk.TraversalException;

/**
 * Decides whether two statements of one tree are mutually exclusive, i.e. no
 * execution can run both of them.
 *
 * <p>Algorithm:</p>
 * <ol>
 * <li>index the ancestors of the first statement, remembering for each one
 * the child the path from the statement enters it through;</li>
 * <li>climb the ancestors of the second statement until one is in the index:
 * that is the lowest common ancestor;</li>
 * <li>if the common ancestor is a conditional or an exception construct,
 * check whether the two entry children lie in exclusive branches.</li>
 * </ol>
 *
 * <p>Statements without a common ancestor are reported as not exclusive, as
 * are statements whose common ancestor is any other kind of node.</p>
 */
public class ExclusivityOracle {
	private static final Logger logger = LoggerFactory.getLogger(ExclusivityOracle.class);

	private final ExclusivityMode mode;

	public ExclusivityOracle() {
		this(ExclusivityMode.COMPATIBLE);
	}

	public ExclusivityOracle(ExclusivityMode mode) {
		this.mode = Objects.requireNonNull(mode, "mode");
	}

	public ExclusivityMode getMode() {
		return mode;
	}

	/**
	 * @return {@code true} if no execution path can reach both statements
	 * @throws BranchClassificationException
	 *         if parent links disagree with an exception construct's structure
	 */
	public boolean areExclusive(TreeNode first, TreeNode second) {
		Objects.requireNonNull(first, "first");
		Objects.requireNonNull(second, "second");

		Map<TreeNode, TreeNode> firstEntries = indexAncestors(first);

		Set<TreeNode> climbed = Collections.newSetFromMap(new IdentityHashMap<>());
		TreeNode previous = second;
		TreeNode node = second.getParent();
		while (node != null) {
			TreeNode firstEntry = firstEntries.get(node);
			if (firstEntry != null) {
				boolean exclusive = inExclusiveBranches(node, firstEntry, previous);
				logger.debug("{} and {} meet at {}: exclusive={}", first, second, node, exclusive);
				return exclusive;
			}
			if (!climbed.add(node)) {
				throw new TraversalException("Parent chain loops back", node);
			}
			previous = node;
			node = node.getParent();
		}
		logger.debug("{} and {} share no ancestor", first, second);
		return false;
	}

	/**
	 * Maps every ancestor of {@code statement} to the child through which the
	 * path from {@code statement} enters it.
	 */
	private static Map<TreeNode, TreeNode> indexAncestors(TreeNode statement) {
		Map<TreeNode, TreeNode> entries = new IdentityHashMap<>();
		TreeNode previous = statement;
		TreeNode node = statement.getParent();
		while (node != null) {
			if (entries.put(node, previous) != null) {
				throw new TraversalException("Parent chain loops back", node);
			}
			previous = node;
			node = node.getParent();
		}
		return entries;
	}

	private boolean inExclusiveBranches(TreeNode ancestor, TreeNode firstEntry, TreeNode secondEntry) {
		if (ancestor instanceof ConditionalNode) {
			ConditionalNode conditional = (ConditionalNode) ancestor;
			return isBranchOf(conditional, firstEntry, secondEntry)
					|| isBranchOf(conditional, secondEntry, firstEntry);
		}
		if (ancestor instanceof ExceptionNode) {
			if (firstEntry == secondEntry) {
				return false;
			}
			ExceptionNode construct = (ExceptionNode) ancestor;
			BranchTag firstTag = BranchTag.classify(construct, firstEntry);
			BranchTag secondTag = BranchTag.classify(construct, secondEntry);
			return firstTag.isExclusiveWith(secondTag, mode);
		}
		return false;
	}

	// children of the test are not in either branch
	private static boolean isBranchOf(ConditionalNode conditional, TreeNode thenEntry, TreeNode elseEntry) {
		return thenEntry == conditional.getThenBranch()
				&& elseEntry != null
				&& elseEntry == conditional.getElseBranch();
	}
}
