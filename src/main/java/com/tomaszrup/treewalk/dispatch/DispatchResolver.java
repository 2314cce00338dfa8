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
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.treewalk.node.NodeKind;

/**
 * Maps every concrete {@link NodeKind} to the callbacks of a
 * {@link HandlerSet}.
 *
 * <p>The table is built once, at construction, for all kinds: the kind is
 * canonicalized through {@link KindRedirects}, then the kind's own enter and
 * leave callbacks are looked up, each falling back independently to the
 * default hook of the handler set. Resolution never fails; a kind nobody
 * handles resolves to an entry with two empty slots.</p>
 *
 * <p>The resolver is bound to the handler set it was built from. A caller
 * that changes handlers builds a new resolver.</p>
 */
public class DispatchResolver<R> {
	private static final Logger logger = LoggerFactory.getLogger(DispatchResolver.class);

	private final HandlerSet<R> handlers;
	private final Map<NodeKind, DispatchEntry<R>> table;

	public DispatchResolver(HandlerSet<R> handlers) {
		this.handlers = Objects.requireNonNull(handlers, "handlers");
		Map<NodeKind, DispatchEntry<R>> entries = new EnumMap<>(NodeKind.class);
		Map<NodeKind, DispatchEntry<R>> byCanonical = new EnumMap<>(NodeKind.class);
		for (NodeKind kind : NodeKind.values()) {
			NodeKind canonical = KindRedirects.canonicalize(kind);
			entries.put(kind, byCanonical.computeIfAbsent(canonical, this::createEntry));
		}
		this.table = Collections.unmodifiableMap(entries);
		if (logger.isDebugEnabled()) {
			logger.debug("Dispatch table built: {} kinds, explicit callbacks for {}",
					table.size(), handlers.getRegisteredKinds());
		}
	}

	private DispatchEntry<R> createEntry(NodeKind canonical) {
		EnterCallback enter = handlers.getEnter(canonical);
		if (enter == null) {
			enter = handlers.getDefaultEnter();
		}
		LeaveCallback<R> leave = handlers.getLeave(canonical);
		if (leave == null) {
			leave = handlers.getDefaultLeave();
		}
		return new DispatchEntry<>(canonical, enter, leave);
	}

	/**
	 * @param kind the concrete kind reported by a node
	 * @return the callbacks to run for nodes of that kind, never {@code null}
	 */
	public DispatchEntry<R> resolve(NodeKind kind) {
		return table.get(Objects.requireNonNull(kind, "kind"));
	}

	/**
	 * @return the context listener of the handler set, or {@code null}
	 */
	public ContextListener getContextListener() {
		return handlers.getContextListener();
	}

	public HandlerSet<R> getHandlers() {
		return handlers;
	}
}
