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
package com.tomaszrup.treewalk.node;

/**
 * Concrete syntactic variants a {@link TreeNode} can report.
 *
 * <p>The set mixes canonical kinds (the ones handlers register for) with
 * concrete variants that {@link com.tomaszrup.treewalk.dispatch.KindRedirects}
 * folds onto a canonical kind before dispatch, e.g. {@link #ADD} and
 * {@link #SUB} both dispatch as {@link #BIN_OP}.</p>
 */
public enum NodeKind {
	// scopes
	MODULE,
	CLASS,
	FUNCTION,
	LAMBDA,

	// statements
	STMT,
	IF,
	TRY_EXCEPT,
	TRY_FINALLY,
	EXCEPT_HANDLER,
	FOR,
	WHILE,
	WITH,
	ASSIGN,
	AUG_ASSIGN,
	DISCARD,
	RETURN,
	RAISE,
	IMPORT,
	FROM,
	GLOBAL,
	PASS,
	BREAK,
	CONTINUE,
	ASSERT,
	DELETE,
	PRINT,

	// expressions
	NAME,
	CONST,
	CALL_FUNC,
	GETATTR,
	SUBSCRIPT,
	SLICE,
	COMPARE,
	TUPLE,
	LIST,
	DICT,
	LIST_COMP,
	LIST_COMP_FOR,
	GEN_EXPR,
	YIELD,
	KEYWORD,
	ARGUMENTS,
	BIN_OP,
	BOOL_OP,
	UNARY_OP,

	// redirected variants
	EXPR,
	IMPORT_FROM,
	ATTRIBUTE,
	COMPREHENSION,
	ADD,
	BITAND,
	BITOR,
	BITXOR,
	DIV,
	FLOOR_DIV,
	LEFT_SHIFT,
	MOD,
	MUL,
	POWER,
	RIGHT_SHIFT,
	SUB,
	AND,
	OR,
	UNARY_ADD,
	UNARY_SUB,
	NOT,
	INVERT,

	/** Statement produced by an adapter that has no dedicated kind. */
	GENERIC
}
