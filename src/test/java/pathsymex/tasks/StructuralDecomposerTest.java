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
package pathsymex.tasks;

import static org.junit.jupiter.api.Assertions.*;
import static pathsymex.core.Syntax.*;

import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import pathsymex.core.Namespace;
import pathsymex.core.SymbolTable;
import pathsymex.core.SymexException;
import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;

public class StructuralDecomposerTest {
	private static final Type INT = SIGNED(32);
	private static final Type.Struct PAIR = STRUCT_TYPE(COMPONENT("a", INT), COMPONENT("b", INT));

	private SymexConfig config;
	private StructuralDecomposer decomposer;

	@BeforeEach
	public void setup() {
		SymbolTable table = new SymbolTable().addType("pair", PAIR);
		config = new SymexConfig(new Namespace(table));
		decomposer = new StructuralDecomposer(config);
	}

	@Test
	public void test_scalarUnchanged() {
		Expr x = SYMBOL("x", INT);
		assertSame(x, decomposer.expand(x));
	}

	@Test
	public void test_structIntoMembers() {
		Expr s = SYMBOL("s", TAG("pair"));
		Expr expected = STRUCT(TAG("pair"), Arrays.asList(MEMBER(s, "a", INT), MEMBER(s, "b", INT)));
		assertEquals(expected, decomposer.expand(s));
	}

	@Test
	public void test_nestedArrayOfStructs() {
		Type.Array type = ARRAY_TYPE(TAG("pair"), 2);
		Expr v = SYMBOL("v", type);
		Expr expanded = decomposer.expand(v);
		assertTrue(expanded instanceof Expr.ArrayConstructor);
		assertEquals(2, expanded.getOperands().size());
		Expr second = expanded.getOperands().get(1);
		Expr element = INDEX(v, CONST(1, SIZE_TYPE), TAG("pair"));
		assertEquals(STRUCT(TAG("pair"), Arrays.asList(MEMBER(element, "a", INT), MEMBER(element, "b", INT))),
				second);
	}

	@Test
	public void test_vectorIntoElements() {
		Expr v = SYMBOL("v", VECTOR_TYPE(INT, 2));
		Expr expanded = decomposer.expand(v);
		assertTrue(expanded instanceof Expr.VectorConstructor);
		assertEquals(INDEX(v, CONST(0, SIZE_TYPE), INT), expanded.getOperands().get(0));
	}

	@Test
	public void test_structConstructorOperandsUsed() {
		Expr c = STRUCT(PAIR, Arrays.asList(CONST(1, INT), CONST(2, INT)));
		assertEquals(c, decomposer.expand(c));
	}

	@Test
	public void test_arrayConstructorElementsSimplified() {
		Type.Array type = ARRAY_TYPE(INT, 2);
		Expr c = ARRAY(type, Arrays.asList(CONST(7, INT), CONST(8, INT)));
		assertEquals(c, decomposer.expand(c));
	}

	@Test
	public void test_unboundedArrayUnchanged() {
		Expr big = SYMBOL("big", ARRAY_TYPE(INT, 1000));
		assertSame(big, decomposer.expand(big));
		Expr open = SYMBOL("open", ARRAY_TYPE(INT, (Expr) null));
		assertSame(open, decomposer.expand(open));
		Expr variable = SYMBOL("vla", ARRAY_TYPE(INT, SYMBOL("n", SIZE_TYPE)));
		assertSame(variable, decomposer.expand(variable));
	}

	@Test
	public void test_invalidSizeFails() {
		Expr bad = SYMBOL("bad", ARRAY_TYPE(INT, -1));
		assertThrows(SymexException.Configuration.class, () -> decomposer.expand(bad));
	}
}
