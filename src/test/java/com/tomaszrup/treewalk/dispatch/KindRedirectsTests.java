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

import java.util.EnumSet;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.treewalk.node.NodeKind;

/**
 * Unit tests for {@link KindRedirects}.
 */
class KindRedirectsTests {

	@Test
	void testBinaryOperatorsCollapseToBinOp() {
		Set<NodeKind> binaryOperators = EnumSet.of(NodeKind.ADD, NodeKind.BITAND, NodeKind.BITOR,
				NodeKind.BITXOR, NodeKind.DIV, NodeKind.FLOOR_DIV, NodeKind.LEFT_SHIFT, NodeKind.MOD,
				NodeKind.MUL, NodeKind.POWER, NodeKind.RIGHT_SHIFT, NodeKind.SUB);
		for (NodeKind kind : binaryOperators) {
			Assertions.assertEquals(NodeKind.BIN_OP, KindRedirects.canonicalize(kind), kind.name());
		}
	}

	@Test
	void testBooleanAndUnaryOperators() {
		Assertions.assertEquals(NodeKind.BOOL_OP, KindRedirects.canonicalize(NodeKind.AND));
		Assertions.assertEquals(NodeKind.BOOL_OP, KindRedirects.canonicalize(NodeKind.OR));
		Assertions.assertEquals(NodeKind.UNARY_OP, KindRedirects.canonicalize(NodeKind.UNARY_ADD));
		Assertions.assertEquals(NodeKind.UNARY_OP, KindRedirects.canonicalize(NodeKind.UNARY_SUB));
		Assertions.assertEquals(NodeKind.UNARY_OP, KindRedirects.canonicalize(NodeKind.NOT));
		Assertions.assertEquals(NodeKind.UNARY_OP, KindRedirects.canonicalize(NodeKind.INVERT));
	}

	@Test
	void testRenamedStatementKinds() {
		Assertions.assertEquals(NodeKind.DISCARD, KindRedirects.canonicalize(NodeKind.EXPR));
		Assertions.assertEquals(NodeKind.FROM, KindRedirects.canonicalize(NodeKind.IMPORT_FROM));
		Assertions.assertEquals(NodeKind.GETATTR, KindRedirects.canonicalize(NodeKind.ATTRIBUTE));
		Assertions.assertEquals(NodeKind.LIST_COMP_FOR, KindRedirects.canonicalize(NodeKind.COMPREHENSION));
	}

	@Test
	void testUnlistedKindsAreTheirOwnCanonicalKind() {
		for (NodeKind kind : NodeKind.values()) {
			if (!KindRedirects.redirects().containsKey(kind)) {
				Assertions.assertSame(kind, KindRedirects.canonicalize(kind));
				Assertions.assertTrue(KindRedirects.isCanonical(kind));
			} else {
				Assertions.assertFalse(KindRedirects.isCanonical(kind));
			}
		}
	}

	@Test
	void testRedirectTargetsAreCanonical() {
		for (NodeKind target : KindRedirects.redirects().values()) {
			Assertions.assertTrue(KindRedirects.isCanonical(target), target.name());
		}
		Assertions.assertEquals(22, KindRedirects.redirects().size());
	}

	@Test
	void testRedirectTableIsReadOnly() {
		Assertions.assertThrows(UnsupportedOperationException.class,
				() -> KindRedirects.redirects().put(NodeKind.IF, NodeKind.WHILE));
	}
}
