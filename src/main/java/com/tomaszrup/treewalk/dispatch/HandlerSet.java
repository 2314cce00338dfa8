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

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.tomaszrup.treewalk.node.NodeKind;

/**
 * Sparse set of callbacks a walk dispatches to: enter and leave callbacks per
 * canonical kind, optional default enter/leave hooks for kinds without their
 * own callback, and an optional {@link ContextListener}.
 *
 * <p>Instances are immutable. Larger handlers are assembled from smaller ones
 * with {@link #compose(HandlerSet[])}, each delegate covering its own kinds.</p>
 *
 * @param <R> type returned by leave callbacks
 */
public final class HandlerSet<R> {
	private final Map<NodeKind, EnterCallback> enterCallbacks;
	private final Map<NodeKind, LeaveCallback<R>> leaveCallbacks;
	private final EnterCallback defaultEnter;
	private final LeaveCallback<R> defaultLeave;
	private final ContextListener contextListener;

	private HandlerSet(Builder<R> builder) {
		this.enterCallbacks = Collections.unmodifiableMap(new EnumMap<>(builder.enterCallbacks));
		this.leaveCallbacks = Collections.unmodifiableMap(new EnumMap<>(builder.leaveCallbacks));
		this.defaultEnter = builder.defaultEnter;
		this.defaultLeave = builder.defaultLeave;
		this.contextListener = builder.contextListener;
	}

	public static <R> Builder<R> builder() {
		return new Builder<>();
	}

	public static <R> HandlerSet<R> empty() {
		return new Builder<R>().build();
	}

	/**
	 * Merges delegates into one handler set.
	 *
	 * @throws IllegalArgumentException if two delegates register an enter or
	 *         leave callback for the same kind, or both supply a default hook
	 *         or a context listener
	 */
	@SafeVarargs
	public static <R> HandlerSet<R> compose(HandlerSet<R>... delegates) {
		Builder<R> merged = new Builder<>();
		for (HandlerSet<R> delegate : delegates) {
			Objects.requireNonNull(delegate, "delegate");
			delegate.enterCallbacks.forEach(merged::onEnter);
			delegate.leaveCallbacks.forEach(merged::onLeave);
			if (delegate.defaultEnter != null) {
				merged.onDefaultEnter(delegate.defaultEnter);
			}
			if (delegate.defaultLeave != null) {
				merged.onDefaultLeave(delegate.defaultLeave);
			}
			if (delegate.contextListener != null) {
				merged.onContext(delegate.contextListener);
			}
		}
		return merged.build();
	}

	/**
	 * @return the enter callback registered for exactly this canonical kind,
	 *         or {@code null}
	 */
	public EnterCallback getEnter(NodeKind canonicalKind) {
		return enterCallbacks.get(canonicalKind);
	}

	/**
	 * @return the leave callback registered for exactly this canonical kind,
	 *         or {@code null}
	 */
	public LeaveCallback<R> getLeave(NodeKind canonicalKind) {
		return leaveCallbacks.get(canonicalKind);
	}

	public EnterCallback getDefaultEnter() {
		return defaultEnter;
	}

	public LeaveCallback<R> getDefaultLeave() {
		return defaultLeave;
	}

	public ContextListener getContextListener() {
		return contextListener;
	}

	/**
	 * @return kinds with an enter or a leave callback of their own
	 */
	public Set<NodeKind> getRegisteredKinds() {
		Set<NodeKind> kinds = EnumSet.noneOf(NodeKind.class);
		kinds.addAll(enterCallbacks.keySet());
		kinds.addAll(leaveCallbacks.keySet());
		return kinds;
	}

	public static final class Builder<R> {
		private final Map<NodeKind, EnterCallback> enterCallbacks = new EnumMap<>(NodeKind.class);
		private final Map<NodeKind, LeaveCallback<R>> leaveCallbacks = new EnumMap<>(NodeKind.class);
		private EnterCallback defaultEnter;
		private LeaveCallback<R> defaultLeave;
		private ContextListener contextListener;

		private Builder() {
		}

		public Builder<R> onEnter(NodeKind kind, EnterCallback callback) {
			checkCanonical(kind);
			Objects.requireNonNull(callback, "callback");
			if (enterCallbacks.putIfAbsent(kind, callback) != null) {
				throw new IllegalArgumentException("Enter callback already registered for " + kind);
			}
			return this;
		}

		public Builder<R> onLeave(NodeKind kind, LeaveCallback<R> callback) {
			checkCanonical(kind);
			Objects.requireNonNull(callback, "callback");
			if (leaveCallbacks.putIfAbsent(kind, callback) != null) {
				throw new IllegalArgumentException("Leave callback already registered for " + kind);
			}
			return this;
		}

		public Builder<R> onDefaultEnter(EnterCallback callback) {
			Objects.requireNonNull(callback, "callback");
			if (defaultEnter != null) {
				throw new IllegalArgumentException("Default enter callback already set");
			}
			defaultEnter = callback;
			return this;
		}

		public Builder<R> onDefaultLeave(LeaveCallback<R> callback) {
			Objects.requireNonNull(callback, "callback");
			if (defaultLeave != null) {
				throw new IllegalArgumentException("Default leave callback already set");
			}
			defaultLeave = callback;
			return this;
		}

		public Builder<R> onContext(ContextListener listener) {
			Objects.requireNonNull(listener, "listener");
			if (contextListener != null) {
				throw new IllegalArgumentException("Context listener already set");
			}
			contextListener = listener;
			return this;
		}

		public HandlerSet<R> build() {
			return new HandlerSet<>(this);
		}

		// a callback on a redirected kind would never fire
		private static void checkCanonical(NodeKind kind) {
			Objects.requireNonNull(kind, "kind");
			if (!KindRedirects.isCanonical(kind)) {
				throw new IllegalArgumentException(kind + " is dispatched as "
						+ KindRedirects.canonicalize(kind) + "; register for that kind instead");
			}
		}
	}
}
