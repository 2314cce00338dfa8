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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.treewalk.analysis.ExclusivityOracle;
import com.tomaszrup.treewalk.config.TreeWalkOptions;
import com.tomaszrup.treewalk.config.TreeWalkOptionsParser;
import com.tomaszrup.treewalk.dispatch.HandlerSet;
import com.tomaszrup.treewalk.node.TreeNode;
import com.tomaszrup.treewalk.walk.LocalsWalker;
import com.tomaszrup.treewalk.walk.TreeWalker;

/**
 * Entry point for hosts: creates walkers and the exclusivity oracle
 * configured from one {@link TreeWalkOptions}.
 *
 * <p>Walkers keep per-walk state, so a new one is created for every request;
 * the oracle is stateless and shared.</p>
 */
public class TreeWalkFacade {
	private static final Logger logger = LoggerFactory.getLogger(TreeWalkFacade.class);

	private final TreeWalkOptions options;
	private final ExclusivityOracle oracle;

	public TreeWalkFacade() {
		this(TreeWalkOptionsParser.loadDefaults());
	}

	/**
	 * A log level in {@code options} is applied to the Logback root logger,
	 * which is shared by the whole process: the facade created last wins.
	 * Leave the level unset when the host configures logging itself.
	 */
	public TreeWalkFacade(TreeWalkOptions options) {
		this.options = Objects.requireNonNull(options, "options");
		this.oracle = new ExclusivityOracle(options.getExclusivityMode());
		if (options.getLogLevel() != null) {
			TreeWalkOptionsParser.applyLogLevel(options.getLogLevel());
		}
		logger.debug("Tree walking configured: {}", options);
	}

	public TreeWalkOptions getOptions() {
		return options;
	}

	public <R> TreeWalker<R> treeWalker(HandlerSet<R> handlers) {
		return new TreeWalker<>(handlers, options.getTraversalStrategy());
	}

	public <R> LocalsWalker<R> localsWalker(HandlerSet<R> handlers) {
		return new LocalsWalker<>(handlers);
	}

	/** Walks {@code root} once with a fresh walker. */
	public <R> void walk(TreeNode root, HandlerSet<R> handlers) {
		treeWalker(handlers).walk(root);
	}

	public ExclusivityOracle getOracle() {
		return oracle;
	}

	public boolean areExclusive(TreeNode first, TreeNode second) {
		return oracle.areExclusive(first, second);
	}
}
