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
package com.tomaszrup.treewalk.groovy;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.ClassCodeVisitorSupport;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.ConstructorNode;
import org.codehaus.groovy.ast.MethodNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.stmt.AssertStatement;
import org.codehaus.groovy.ast.stmt.BlockStatement;
import org.codehaus.groovy.ast.stmt.BreakStatement;
import org.codehaus.groovy.ast.stmt.CaseStatement;
import org.codehaus.groovy.ast.stmt.CatchStatement;
import org.codehaus.groovy.ast.stmt.ContinueStatement;
import org.codehaus.groovy.ast.stmt.DoWhileStatement;
import org.codehaus.groovy.ast.stmt.EmptyStatement;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.codehaus.groovy.ast.stmt.ForStatement;
import org.codehaus.groovy.ast.stmt.IfStatement;
import org.codehaus.groovy.ast.stmt.ReturnStatement;
import org.codehaus.groovy.ast.stmt.Statement;
import org.codehaus.groovy.ast.stmt.SwitchStatement;
import org.codehaus.groovy.ast.stmt.SynchronizedStatement;
import org.codehaus.groovy.ast.stmt.ThrowStatement;
import org.codehaus.groovy.ast.stmt.TryCatchStatement;
import org.codehaus.groovy.ast.stmt.WhileStatement;
import org.codehaus.groovy.control.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.treewalk.node.NodeKind;
import com.tomaszrup.treewalk.node.TreeNode;
import com.tomaszrup.treewalk.tree.BaseNode;
import com.tomaszrup.treewalk.tree.ExceptHandlerNode;
import com.tomaszrup.treewalk.tree.IfNode;
import com.tomaszrup.treewalk.tree.StatementBlock;
import com.tomaszrup.treewalk.tree.TryExceptNode;

/**
 * Builds a {@link TreeNode} tree from a compiled Groovy {@link ModuleNode},
 * down to statement level. Expressions are not converted: an expression
 * statement becomes a {@link NodeKind#DISCARD} leaf.
 *
 * <p>Modules and classes carry symbol tables: a module binds class names to
 * their class nodes, a class binds method names to its method nodes (one
 * definition per overload).</p>
 *
 * <p>Every produced node that stands for a Groovy node can be mapped back
 * with {@link #getSource(TreeNode)}, and the other way round with
 * {@link #getTreeNode(ASTNode)}. A builder instance builds one module.</p>
 */
public class GroovyTreeBuilder extends ClassCodeVisitorSupport {
	private static final Logger logger = LoggerFactory.getLogger(GroovyTreeBuilder.class);

	private SourceUnit sourceUnit;

	@Override
	protected SourceUnit getSourceUnit() {
		return sourceUnit;
	}

	private final Deque<BaseNode> stack = new ArrayDeque<>();
	private final Map<TreeNode, ASTNode> sources = new IdentityHashMap<>();
	// Groovy nodes like ClassNode override equals() loosely; identity is needed
	private final Map<ASTNode, TreeNode> treeNodes = new IdentityHashMap<>();
	private BaseNode root;

	/**
	 * @return the module tree; calling again returns the same tree
	 */
	public BaseNode build(ModuleNode module) {
		Objects.requireNonNull(module, "module");
		if (root != null) {
			if (sources.get(root) != module) {
				throw new IllegalStateException("Builder already used for another module");
			}
			return root;
		}
		sourceUnit = module.getContext();
		root = record(new BaseNode(NodeKind.MODULE).withLocals(), module);
		stack.addLast(root);
		try {
			for (ClassNode classNode : module.getClasses()) {
				visitClass(classNode);
			}
		} finally {
			stack.removeLast();
		}
		logger.debug("Built {} tree nodes for module {}", sources.size(), module.getDescription());
		return root;
	}

	public ASTNode getSource(TreeNode node) {
		return sources.get(node);
	}

	public TreeNode getTreeNode(ASTNode node) {
		return treeNodes.get(node);
	}

	private <T extends BaseNode> T record(T node, ASTNode source) {
		sources.put(node, source);
		treeNodes.put(source, node);
		return node;
	}

	private <T extends BaseNode> T attach(T node, ASTNode source) {
		record(node, source);
		stack.peekLast().addChild(node);
		return node;
	}

	private void visitInside(BaseNode container, Statement statement) {
		stack.addLast(container);
		try {
			statement.visit(this);
		} finally {
			stack.removeLast();
		}
	}

	/**
	 * Converts a branch of a compound statement into a statement block. A
	 * Groovy block becomes the block itself; a single statement is wrapped.
	 */
	private StatementBlock branch(Statement statement) {
		StatementBlock block = new StatementBlock();
		if (statement instanceof BlockStatement) {
			record(block, statement);
			stack.addLast(block);
			try {
				for (Statement nested : ((BlockStatement) statement).getStatements()) {
					nested.visit(this);
				}
			} finally {
				stack.removeLast();
			}
		} else {
			visitInside(block, statement);
		}
		return block;
	}

	// ClassCodeVisitorSupport

	@Override
	public void visitClass(ClassNode node) {
		BaseNode container = stack.peekLast();
		BaseNode classTree = attach(new BaseNode(NodeKind.CLASS).withLocals(), node);
		container.defineLocal(node.getNameWithoutPackage(), classTree);
		stack.addLast(classTree);
		try {
			for (ConstructorNode constructor : node.getDeclaredConstructors()) {
				visitConstructorOrMethod(constructor, true);
			}
			for (MethodNode method : node.getMethods()) {
				visitConstructorOrMethod(method, false);
			}
		} finally {
			stack.removeLast();
		}
	}

	@Override
	protected void visitConstructorOrMethod(MethodNode node, boolean isConstructor) {
		BaseNode container = stack.peekLast();
		BaseNode function = attach(new BaseNode(NodeKind.FUNCTION), node);
		container.defineLocal(node.getName(), function);
		Statement code = node.getCode();
		if (code != null) {
			visitInside(function, code);
		}
	}

	// GroovyCodeVisitor

	public void visitBlockStatement(BlockStatement node) {
		BaseNode block = attach(new StatementBlock(), node);
		stack.addLast(block);
		try {
			for (Statement statement : node.getStatements()) {
				statement.visit(this);
			}
		} finally {
			stack.removeLast();
		}
	}

	public void visitIfElse(IfStatement node) {
		BaseNode test = record(new BaseNode(NodeKind.DISCARD), node.getBooleanExpression());
		StatementBlock thenBlock = branch(node.getIfBlock());
		Statement elseStatement = node.getElseBlock();
		StatementBlock elseBlock = null;
		if (elseStatement != null && !(elseStatement instanceof EmptyStatement)) {
			elseBlock = branch(elseStatement);
		}
		attach(new IfNode(test, thenBlock, elseBlock), node);
	}

	public void visitTryCatchFinally(TryCatchStatement node) {
		List<CatchStatement> catches = node.getCatchStatements();
		Statement finallyStatement = node.getFinallyStatement();
		boolean hasFinally = finallyStatement != null && !finallyStatement.isEmpty();

		if (catches.isEmpty() && hasFinally) {
			BaseNode tryFinally = attach(new BaseNode(NodeKind.TRY_FINALLY), node);
			tryFinally.addChild(branch(node.getTryStatement()));
			tryFinally.addChild(branch(finallyStatement));
			return;
		}

		TryExceptNode tryExcept = new TryExceptNode();
		tryExcept.addBody(branch(node.getTryStatement()));
		for (CatchStatement catchStatement : catches) {
			ExceptHandlerNode handler = record(new ExceptHandlerNode(), catchStatement);
			handler.addBody(branch(catchStatement.getCode()));
			tryExcept.addHandler(handler);
		}
		if (hasFinally) {
			// try/catch/finally nests the try/catch in the finally construct
			BaseNode tryFinally = attach(new BaseNode(NodeKind.TRY_FINALLY), node);
			tryFinally.addChild(tryExcept);
			tryFinally.addChild(branch(finallyStatement));
		} else {
			attach(tryExcept, node);
		}
	}

	public void visitForLoop(ForStatement node) {
		visitInside(attach(new BaseNode(NodeKind.FOR), node), node.getLoopBlock());
	}

	public void visitWhileLoop(WhileStatement node) {
		visitInside(attach(new BaseNode(NodeKind.WHILE), node), node.getLoopBlock());
	}

	public void visitDoWhileLoop(DoWhileStatement node) {
		visitInside(attach(new BaseNode(NodeKind.WHILE), node), node.getLoopBlock());
	}

	public void visitSwitch(SwitchStatement node) {
		BaseNode switchTree = attach(new BaseNode(NodeKind.GENERIC), node);
		for (CaseStatement caseStatement : node.getCaseStatements()) {
			visitInside(switchTree, caseStatement.getCode());
		}
		Statement defaultStatement = node.getDefaultStatement();
		if (defaultStatement != null && !defaultStatement.isEmpty()) {
			visitInside(switchTree, defaultStatement);
		}
	}

	public void visitSynchronizedStatement(SynchronizedStatement node) {
		visitInside(attach(new BaseNode(NodeKind.GENERIC), node), node.getCode());
	}

	public void visitExpressionStatement(ExpressionStatement node) {
		attach(new BaseNode(NodeKind.DISCARD), node);
	}

	public void visitReturnStatement(ReturnStatement node) {
		attach(new BaseNode(NodeKind.RETURN), node);
	}

	public void visitThrowStatement(ThrowStatement node) {
		attach(new BaseNode(NodeKind.RAISE), node);
	}

	public void visitAssertStatement(AssertStatement node) {
		attach(new BaseNode(NodeKind.ASSERT), node);
	}

	public void visitBreakStatement(BreakStatement node) {
		attach(new BaseNode(NodeKind.BREAK), node);
	}

	public void visitContinueStatement(ContinueStatement node) {
		attach(new BaseNode(NodeKind.CONTINUE), node);
	}

	public void visitEmptyStatement(EmptyStatement node) {
		// EmptyStatement.INSTANCE is shared, so no reverse mapping
		BaseNode pass = stack.peekLast().addChild(new BaseNode(NodeKind.PASS));
		sources.put(pass, node);
	}
}
