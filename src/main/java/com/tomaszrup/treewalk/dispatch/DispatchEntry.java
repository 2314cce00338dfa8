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
package com.tomaszrup.treewalk.dispatch;

import com.tomaszrup.treewalk.node.NodeKind;
import com.tomaszrup.treewalk.node.TreeNode;

/**
 * The resolved (enter, leave) pair for one concrete kind. Either slot may be
 * empty, in which case invoking it is a no-op.
 */
public final class DispatchEntry<R> {
	private final NodeKind canonicalKind;
	private final EnterCallback enter;
	private final LeaveCallback<R> leave;

	DispatchEntry(NodeKind canonicalKind, EnterCallback enter, LeaveCallback<R> leave) {
		this.canonicalKind = canonicalKind;
		this.enter = enter;
		this.leave = leave;
	}

	public NodeKind getCanonicalKind() {
		return canonicalKind;
	}

	public EnterCallback getEnter() {
		return enter;
	}

	public LeaveCallback<R> getLeave() {
		return leave;
	}

	public boolean hasEnter() {
		return enter != null;
	}

	public boolean hasLeave() {
		return leave != null;
	}

	/**
	 * Runs the enter slot. An empty slot, or a callback returning
	 * {@code null}, counts as {@link VisitResult#CONTINUE}.
	 */
	public VisitResult enter(TreeNode node) {
		if (enter == null) {
			return VisitResult.CONTINUE;
		}
		VisitResult result = enter.enter(node);
		return result != null ? result : VisitResult.CONTINUE;
	}

	public R leave(TreeNode node) {
		return leave != null ? leave.leave(node) : null;
	}
}
