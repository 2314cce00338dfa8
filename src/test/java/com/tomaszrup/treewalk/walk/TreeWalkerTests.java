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
package com.tomaszrup.treewalk.walk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.treewalk.FakeNode;
import com.tomaszrup.treewalk.LabeledNode;
import com.tomaszrup.treewalk.RecordingHandlers;
import com.tomaszrup.treewalk.dispatch.EnterCallback;
import com.tomaszrup.treewalk.dispatch.HandlerSet;
import com.tomaszrup.treewalk.dispatch.VisitResult;
import com.tomaszrup.treewalk.node.NodeKind;
import com.tomaszrup.treewalk.tree.BaseNode;
import com.tomaszrup.treewalk.tree.IfNode;
import com.tomaszrup.treewalk.tree.StatementBlock;

/**
 * Unit tests for {@link TreeWalker}, run against both traversal strategies:
 * callback order, pruning, context notification and corruption checks.
 */
class TreeWalkerTests {

	private static final List<String> FULL_WALK = Arrays.asList(
			"enter module",
			"context module>a", "enter a", "leave a",
			"context module>IF", "enter IF",
			"context IF>cond", "enter cond", "leave cond",
			"context IF>STMT", "enter STMT",
			"context STMT>b", "enter b", "leave b",
			"context STMT>c", "enter c", "leave c",
			"leave STMT",
			"context IF>STMT", "enter STMT",
			"context STMT>d", "enter d", "leave d",
			"leave STMT",
			"leave IF",
			"context module>e", "enter e", "leave e",
			"leave module");

	private IfNode ifNode;

	/**
	 * module: a; if cond: b; c else: d; e
	 */
	private BaseNode sampleTree() {
		BaseNode module = LabeledNode.of(NodeKind.MODULE, "module");
		module.addChild(LabeledNode.stmt("a"));
		ifNode = module.addChild(new IfNode(
				LabeledNode.of(NodeKind.NAME, "cond"),
				new StatementBlock().add(LabeledNode.stmt("b"), LabeledNode.stmt("c")),
				new StatementBlock().add(LabeledNode.stmt("d"))));
		module.addChild(LabeledNode.stmt("e"));
		return module;
	}

	// --- Ordering ---

	@Test
	void testRecursiveWalkOrder() {
		RecordingHandlers recorder = new RecordingHandlers();
		new TreeWalker<>(recorder.handlers(), TraversalStrategy.RECURSIVE).walk(sampleTree());
		Assertions.assertEquals(FULL_WALK, recorder.getEvents());
	}

	@Test
	void testIterativeWalkOrder() {
		RecordingHandlers recorder = new RecordingHandlers();
		new TreeWalker<>(recorder.handlers(), TraversalStrategy.ITERATIVE).walk(sampleTree());
		Assertions.assertEquals(FULL_WALK, recorder.getEvents());
	}

	@Test
	void testDefaultStrategyIsIterative() {
		TreeWalker<Void> walker = new TreeWalker<>(HandlerSet.<Void>empty());
		Assertions.assertEquals(TraversalStrategy.ITERATIVE, walker.getStrategy());
	}

	@Test
	void testWalkingSubtreeStartsAtGivenNode() {
		for (TraversalStrategy strategy : TraversalStrategy.values()) {
			RecordingHandlers recorder = new RecordingHandlers();
			sampleTree();
			new TreeWalker<>(recorder.handlers(), strategy).walk(ifNode.getElseBranch());
			Assertions.assertEquals(Arrays.asList("enter STMT", "context STMT>d", "enter d", "leave d", "leave STMT"),
					recorder.getEvents(), strategy.name());
		}
	}

	@Test
	void testSameTreeCanBeWalkedAgain() {
		BaseNode tree = sampleTree();
		RecordingHandlers recorder = new RecordingHandlers();
		TreeWalker<Void> walker = new TreeWalker<>(recorder.handlers());
		walker.walk(tree);
		walker.walk(tree);
		Assertions.assertEquals(FULL_WALK.size() * 2, recorder.getEvents().size());
	}

	// --- Pruning ---

	@Test
	void testSkipChildrenPrunesSubtreeButStillLeaves() {
		for (TraversalStrategy strategy : TraversalStrategy.values()) {
			BaseNode tree = sampleTree();
			RecordingHandlers recorder = new RecordingHandlers();
			new TreeWalker<>(recorder.handlersSkipping(ifNode), strategy).walk(tree);
			Assertions.assertEquals(Arrays.asList(
					"enter module",
					"context module>a", "enter a", "leave a",
					"context module>IF", "enter IF", "leave IF",
					"context module>e", "enter e", "leave e",
					"leave module"), recorder.getEvents(), strategy.name());
		}
	}

	@Test
	void testSkipChildrenOnRootLeavesOnlyRoot() {
		BaseNode tree = sampleTree();
		RecordingHandlers recorder = new RecordingHandlers();
		new TreeWalker<>(recorder.handlersSkipping(tree)).walk(tree);
		Assertions.assertEquals(Arrays.asList("enter module", "leave module"), recorder.getEvents());
	}

	@Test
	void testKindSpecificCallbacksAndRedirects() {
		List<String> seen = new ArrayList<>();
		BaseNode module = LabeledNode.of(NodeKind.MODULE, "module");
		BaseNode sum = module.addChild(LabeledNode.of(NodeKind.ADD, "x+y"));
		sum.addChild(LabeledNode.of(NodeKind.NAME, "x"));
		module.addChild(LabeledNode.of(NodeKind.MUL, "x*y"));
		HandlerSet<Void> handlers = HandlerSet.<Void>builder()
				.onEnter(NodeKind.BIN_OP, node -> {
					seen.add("binop " + node);
					return VisitResult.SKIP_CHILDREN;
				})
				.onLeave(NodeKind.MODULE, node -> {
					seen.add("done");
					return null;
				})
				.build();

		new TreeWalker<>(handlers).walk(module);

		Assertions.assertEquals(Arrays.asList("binop x+y", "binop x*y", "done"), seen);
	}

	// --- Errors ---

	@Test
	void testNodeReachedTwiceIsRejected() {
		for (TraversalStrategy strategy : TraversalStrategy.values()) {
			FakeNode shared = new FakeNode(NodeKind.NAME, "shared");
			FakeNode root = new FakeNode(NodeKind.MODULE, "root")
					.link(new FakeNode(NodeKind.DISCARD, "left").link(shared))
					.link(new FakeNode(NodeKind.DISCARD, "right").link(shared));
			RecordingHandlers recorder = new RecordingHandlers();

			TraversalException e = Assertions.assertThrows(TraversalException.class,
					() -> new TreeWalker<>(recorder.handlers(), strategy).walk(root));

			Assertions.assertSame(shared, e.getNode());
			Assertions.assertFalse(recorder.getEvents().contains("leave root"), strategy.name());
		}
	}

	@Test
	void testNodeThatIsItsOwnChildIsRejected() {
		for (TraversalStrategy strategy : TraversalStrategy.values()) {
			FakeNode loop = new FakeNode(NodeKind.STMT, "loop");
			loop.link(loop);
			RecordingHandlers recorder = new RecordingHandlers();

			TraversalException e = Assertions.assertThrows(TraversalException.class,
					() -> new TreeWalker<>(recorder.handlers(), strategy).walk(loop));

			Assertions.assertTrue(e.getMessage().contains("own child"), e.getMessage());
			Assertions.assertEquals(Arrays.asList("enter loop", "context loop>loop"), recorder.getEvents());
		}
	}

	@Test
	void testNodeThatIsItsOwnParentIsRejectedAfterLeave() {
		FakeNode node = new FakeNode(NodeKind.STMT, "self");
		node.setParent(node);
		RecordingHandlers recorder = new RecordingHandlers();
		Assertions.assertThrows(TraversalException.class,
				() -> new TreeWalker<>(recorder.handlers()).walk(node));
		Assertions.assertEquals(Arrays.asList("enter self", "leave self"), recorder.getEvents());
	}

	@Test
	void testHandlerExceptionPropagatesUnchanged() {
		IllegalStateException abort = new IllegalStateException("abort");
		HandlerSet<Void> handlers = HandlerSet.<Void>builder()
				.onEnter(NodeKind.IF, node -> {
					throw abort;
				})
				.build();
		for (TraversalStrategy strategy : TraversalStrategy.values()) {
			IllegalStateException thrown = Assertions.assertThrows(IllegalStateException.class,
					() -> new TreeWalker<>(handlers, strategy).walk(sampleTree()));
			Assertions.assertSame(abort, thrown);
		}
	}

	// --- Depth ---

	@Test
	void testIterativeWalkHandlesVeryDeepTrees() {
		BaseNode root = new BaseNode(NodeKind.MODULE);
		BaseNode current = root;
		for (int i = 0; i < 200_000; i++) {
			current = current.addChild(new BaseNode(NodeKind.STMT));
		}
		int[] counts = new int[2];
		HandlerSet<Void> handlers = HandlerSet.<Void>builder()
				.onDefaultEnter(EnterCallback.of(node -> counts[0]++))
				.onDefaultLeave(node -> {
					counts[1]++;
					return null;
				})
				.build();

		new TreeWalker<>(handlers, TraversalStrategy.ITERATIVE).walk(root);

		Assertions.assertEquals(200_001, counts[0]);
		Assertions.assertEquals(200_001, counts[1]);
	}
}
