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
package com.tomaszrup.treewalk.config;

import java.util.Objects;

import com.tomaszrup.treewalk.analysis.ExclusivityMode;
import com.tomaszrup.treewalk.walk.TraversalStrategy;

/** Immutable settings shared by the walkers and the exclusivity oracle. */
public final class TreeWalkOptions {
	private static final TreeWalkOptions DEFAULTS =
			new TreeWalkOptions(TraversalStrategy.ITERATIVE, ExclusivityMode.COMPATIBLE, null);

	private final TraversalStrategy traversalStrategy;
	private final ExclusivityMode exclusivityMode;
	private final String logLevel;

	public TreeWalkOptions(TraversalStrategy traversalStrategy, ExclusivityMode exclusivityMode, String logLevel) {
		this.traversalStrategy = Objects.requireNonNull(traversalStrategy, "traversalStrategy");
		this.exclusivityMode = Objects.requireNonNull(exclusivityMode, "exclusivityMode");
		this.logLevel = logLevel;
	}

	public static TreeWalkOptions defaults() {
		return DEFAULTS;
	}

	public TraversalStrategy getTraversalStrategy() {
		return traversalStrategy;
	}

	public ExclusivityMode getExclusivityMode() {
		return exclusivityMode;
	}

	/**
	 * @return the requested root log level, or {@code null} to leave logging
	 *         configuration alone
	 */
	public String getLogLevel() {
		return logLevel;
	}

	public TreeWalkOptions withTraversalStrategy(TraversalStrategy strategy) {
		return new TreeWalkOptions(strategy, exclusivityMode, logLevel);
	}

	public TreeWalkOptions withExclusivityMode(ExclusivityMode mode) {
		return new TreeWalkOptions(traversalStrategy, mode, logLevel);
	}

	@Override
	public String toString() {
		return "TreeWalkOptions{traversal=" + traversalStrategy
				+ ", exclusivity=" + exclusivityMode
				+ ", logLevel=" + logLevel + "}";
	}
}
