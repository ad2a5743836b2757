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
package pathsymex.core;

import static org.junit.jupiter.api.Assertions.*;
import static pathsymex.core.Syntax.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;

public class SyntaxTest {
	private static final Type INT = SIGNED(32);
	private static final Expr X = SYMBOL("x", INT);
	private static final Expr Y = SYMBOL("y", INT);

	@Test
	public void test_withSameOperands() {
		Expr e = ADD(X, CONST(1, INT));
		assertSame(e, e.withOperands(Arrays.asList(X, e.getOperands().get(1))));
	}

	@Test
	public void test_rebuildKeepsAttributes() {
		Expr e = ADD(X, CONST(1, INT), ATTRIBUTE("line 7"));
		Expr r = e.withOperands(Arrays.asList(Y, CONST(1, INT)));
		assertNotSame(e, r);
		assertEquals(ADD(Y, CONST(1, INT)), r);
		assertEquals("line 7", ((Syntax.AbstractItem) r).getAttribute(String.class));
		assertNull(((Syntax.AbstractItem) r).getAttribute(Integer.class));
	}

	@Test
	public void test_structuralEquality() {
		assertEquals(MEMBER(X, "f", INT), MEMBER(SYMBOL("x", INT), "f", INT));
		assertNotEquals(MEMBER(X, "f", INT), MEMBER(X, "g", INT));
		assertNotEquals(SYMBOL("x", INT), SSA_SYMBOL("x", "x", INT));
		assertNotEquals(CONST(0, INT), CONST(0, UNSIGNED(32)));
		assertEquals(ARRAY_TYPE(INT, 4), ARRAY_TYPE(SIGNED(32), 4));
		assertNotEquals(ARRAY_TYPE(INT, 4), VECTOR_TYPE(INT, 4));
	}

	@Test
	public void test_invalidArity() {
		assertThrows(IllegalArgumentException.class, () -> COND(INT, Arrays.asList(CONST(true))));
		assertThrows(IllegalArgumentException.class, () -> NOT(X).withOperands(Arrays.asList(X, Y)));
		assertThrows(IllegalArgumentException.class, () -> MEMBER(X, "f", INT).withOperands(Arrays.asList(X, Y)));
	}

	@Test
	public void test_namespaceFollowsTags() {
		SymbolTable table = new SymbolTable()
				.addType("a", TAG("b"))
				.addType("b", INT)
				.addType("loop", TAG("loop"));
		Namespace ns = new Namespace(table);
		assertEquals(INT, ns.follow(TAG("a")));
		assertEquals(INT, ns.follow(INT));
		assertThrows(SymexException.Configuration.class, () -> ns.follow(TAG("loop")));
		assertThrows(SymexException.Configuration.class, () -> ns.follow(TAG("missing")));
	}

	@Test
	public void test_accessPathSuffix() {
		AccessPath path = AccessPath.of("m", AccessPath.FIELD("f"), AccessPath.INDEX(3), AccessPath.ANY_INDEX);
		assertEquals(".f[3][*]", path.getSuffix());
		assertEquals("m.f[3][*]", path.getFullIdentifier());
		assertEquals(path, AccessPath.of("m", AccessPath.FIELD("f"), AccessPath.INDEX(3), AccessPath.ANY_INDEX));
		assertNotEquals(path, AccessPath.of("m", AccessPath.FIELD("f"), AccessPath.INDEX(4), AccessPath.ANY_INDEX));
	}
}
