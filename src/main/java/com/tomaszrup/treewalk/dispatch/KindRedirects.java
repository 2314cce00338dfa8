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

import com.tomaszrup.treewalk.node.NodeKind;

/**
 * Folds concrete node kinds onto the canonical kind handlers register for.
 * Kinds without an entry are their own canonical kind.
 */
public final class KindRedirects {
	private static final Map<NodeKind, NodeKind> REDIRECTS;

	static {
		Map<NodeKind, NodeKind> redirects = new EnumMap<>(NodeKind.class);
		redirects.put(NodeKind.EXPR, NodeKind.DISCARD);
		redirects.put(NodeKind.IMPORT_FROM, NodeKind.FROM);
		redirects.put(NodeKind.ATTRIBUTE, NodeKind.GETATTR);
		redirects.put(NodeKind.COMPREHENSION, NodeKind.LIST_COMP_FOR);

		redirects.put(NodeKind.ADD, NodeKind.BIN_OP);
		redirects.put(NodeKind.BITAND, NodeKind.BIN_OP);
		redirects.put(NodeKind.BITOR, NodeKind.BIN_OP);
		redirects.put(NodeKind.BITXOR, NodeKind.BIN_OP);
		redirects.put(NodeKind.DIV, NodeKind.BIN_OP);
		redirects.put(NodeKind.FLOOR_DIV, NodeKind.BIN_OP);
		redirects.put(NodeKind.LEFT_SHIFT, NodeKind.BIN_OP);
		redirects.put(NodeKind.MOD, NodeKind.BIN_OP);
		redirects.put(NodeKind.MUL, NodeKind.BIN_OP);
		redirects.put(NodeKind.POWER, NodeKind.BIN_OP);
		redirects.put(NodeKind.RIGHT_SHIFT, NodeKind.BIN_OP);
		redirects.put(NodeKind.SUB, NodeKind.BIN_OP);

		redirects.put(NodeKind.AND, NodeKind.BOOL_OP);
		redirects.put(NodeKind.OR, NodeKind.BOOL_OP);

		redirects.put(NodeKind.UNARY_ADD, NodeKind.UNARY_OP);
		redirects.put(NodeKind.UNARY_SUB, NodeKind.UNARY_OP);
		redirects.put(NodeKind.NOT, NodeKind.UNARY_OP);
		redirects.put(NodeKind.INVERT, NodeKind.UNARY_OP);
		REDIRECTS = Collections.unmodifiableMap(redirects);
	}

	private KindRedirects() {
		// utility class
	}

	public static NodeKind canonicalize(NodeKind kind) {
		Objects.requireNonNull(kind, "kind");
		return REDIRECTS.getOrDefault(kind, kind);
	}

	public static boolean isCanonical(NodeKind kind) {
		return !REDIRECTS.containsKey(kind);
	}

	/**
	 * @return the full redirection table, concrete kind to canonical kind
	 */
	public static Map<NodeKind, NodeKind> redirects() {
		return REDIRECTS;
	}
}
