// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package pathsymex.util;

import static org.junit.jupiter.api.Assertions.*;
import static pathsymex.core.Syntax.*;

import java.util.Arrays;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import pathsymex.core.Namespace;
import pathsymex.core.SymbolTable;
import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;

public class SimplifierTest {
	private static final Type INT = SIGNED(32);
	private static final Type BYTE = SIGNED(8);
	private static final Type UBYTE = UNSIGNED(8);
	private static final Expr X = SSA_SYMBOL("x#0", "x", INT);
	private static final Expr B = SSA_SYMBOL("b#0", "b", Type.Bool);

	private final Simplifier simplifier = new Simplifier(new Namespace(new SymbolTable()));

	private static Stream<Arguments> folding() {
		return Stream.of(
				Arguments.of(ADD(CONST(2, INT), CONST(3, INT)), CONST(5, INT)),
				Arguments.of(SUB(CONST(2, INT), CONST(3, INT)), CONST(-1, INT)),
				Arguments.of(MUL(CONST(4, INT), CONST(3, INT)), CONST(12, INT)),
				Arguments.of(OP(Expr.Opcode.DIV, INT, Arrays.asList(CONST(-7, INT), CONST(2, INT))), CONST(-3, INT)),
				Arguments.of(OP(Expr.Opcode.MOD, INT, Arrays.asList(CONST(-7, INT), CONST(2, INT))), CONST(-1, INT)),
				Arguments.of(ADD(CONST(255, UBYTE), CONST(1, UBYTE)), CONST(0, UBYTE)),
				Arguments.of(ADD(CONST(127, BYTE), CONST(1, BYTE)), CONST(-128, BYTE)),
				Arguments.of(NEG(CONST(5, INT)), CONST(-5, INT)),
				Arguments.of(LT(CONST(1, INT), CONST(2, INT)), CONST(true)),
				Arguments.of(OP(Expr.Opcode.GTEQ, Type.Bool, Arrays.asList(CONST(1, INT), CONST(2, INT))), CONST(false)),
				Arguments.of(EQ(CONST(3, INT), CONST(3, INT)), CONST(true)),
				Arguments.of(EQ(X, X), CONST(true)),
				Arguments.of(NOT(CONST(true)), CONST(false)),
				Arguments.of(NOT(NOT(B)), B),
				Arguments.of(AND(B, CONST(false)), CONST(false)),
				Arguments.of(AND(B, CONST(true)), B),
				Arguments.of(OR(B, CONST(true)), CONST(true)),
				Arguments.of(TYPECAST(CONST(300, INT), UBYTE), CONST(44, UBYTE)),
				Arguments.of(TYPECAST(CONST(2, INT), Type.Bool), CONST(true)),
				Arguments.of(TYPECAST(X, INT), X),
				Arguments.of(ADD(X, ADD(CONST(1, INT), CONST(1, INT))), ADD(X, CONST(2, INT))));
	}

	@ParameterizedTest
	@MethodSource("folding")
	public void test_folding(Expr input, Expr expected) {
		assertEquals(expected, simplifier.simplify(input));
	}

	@Test
	public void test_divisionByZeroLeft() {
		Expr e = OP(Expr.Opcode.DIV, INT, Arrays.asList(CONST(1, INT), CONST(0, INT)));
		assertSame(e, simplifier.simplify(e));
	}

	@Test
	public void test_unchangedNotRebuilt() {
		Expr e = ADD(X, CONST(1, INT));
		assertSame(e, simplifier.simplify(e));
	}

	@Test
	public void test_ifPruning() {
		assertEquals(X, simplifier.simplify(IF(CONST(true), X, CONST(0, INT))));
		assertEquals(CONST(0, INT), simplifier.simplify(IF(CONST(false), X, CONST(0, INT))));
		assertEquals(X, simplifier.simplify(IF(B, X, X)));
	}

	@Test
	public void test_condPruning() {
		Expr first = COND(INT, Arrays.asList(CONST(true), X, B, CONST(1, INT)));
		assertEquals(X, simplifier.simplify(first));
		Expr skipped = COND(INT, Arrays.asList(CONST(false), X, B, CONST(1, INT), NOT(B), CONST(2, INT)));
		assertEquals(COND(INT, Arrays.asList(B, CONST(1, INT), NOT(B), CONST(2, INT))), simplifier.simplify(skipped));
		Expr uniform = COND(INT, Arrays.asList(B, X, NOT(B), X));
		assertEquals(X, simplifier.simplify(uniform));
	}

	@Test
	public void test_constructorProjection() {
		Type.Struct pair = STRUCT_TYPE(COMPONENT("a", INT), COMPONENT("b", INT));
		Expr s = STRUCT(pair, Arrays.asList(CONST(1, INT), X));
		assertEquals(X, simplifier.simplify(MEMBER(s, "b", INT)));
		Type.Array arr = ARRAY_TYPE(INT, 2);
		Expr a = ARRAY(arr, Arrays.asList(CONST(1, INT), X));
		assertEquals(X, simplifier.simplify(INDEX(a, CONST(1, INT), INT)));
		Expr outOfRange = INDEX(a, CONST(2, INT), INT);
		assertSame(outOfRange, simplifier.simplify(outOfRange));
		Expr zeros = ARRAY_OF(CONST(0, INT), ARRAY_TYPE(INT, 5000));
		assertEquals(CONST(0, INT), simplifier.simplify(INDEX(zeros, X, INT)));
	}

	@Test
	public void test_addressCancellation() {
		Expr p = SSA_SYMBOL("p#0", "p", POINTER(INT));
		assertEquals(p, simplifier.simplify(ADDRESS_OF(DEREF(p, INT))));
		Expr y = SSA_SYMBOL("y#0", "y", INT);
		assertEquals(y, simplifier.simplify(DEREF(ADDRESS_OF(y), INT)));
	}
}
