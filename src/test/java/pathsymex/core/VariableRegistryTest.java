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

import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;

public class VariableRegistryTest {
	private static final Type INT = SIGNED(32);

	private VariableRegistry registry;

	@BeforeEach
	public void setup() {
		SymbolTable table = new SymbolTable()
				.add(SymbolTable.GLOBAL("g", INT))
				.add(SymbolTable.THREAD_LOCAL("t", INT))
				.add(SymbolTable.LOCAL("l", INT))
				.add(SymbolTable.GLOBAL("s", TAG("pair")))
				.addType("pair", STRUCT_TYPE(COMPONENT("a", INT)));
		registry = new VariableRegistry(new Namespace(table));
	}

	@Test
	public void test_numbering() {
		VariableInfo g = registry.get(SYMBOL("g", INT));
		VariableInfo l = registry.get(SYMBOL("l", INT));
		assertEquals(0, g.getNumber());
		assertEquals(1, l.getNumber());
		assertSame(g, registry.get(SYMBOL("g", INT)));
		assertEquals(2, registry.size());
	}

	@Test
	public void test_suffixesAreDistinct() {
		Expr.Symbol s = SYMBOL("s", TAG("pair"));
		VariableInfo whole = registry.get(s);
		VariableInfo field = registry.get(AccessPath.of("s", AccessPath.FIELD("a")), MEMBER(s, "a", INT));
		assertNotSame(whole, field);
		assertEquals("s.a", field.getFullIdentifier());
		assertEquals(".a", field.getSuffix());
		assertEquals("s", field.getSymbol());
		field.nextSsaSymbol();
		assertEquals(0, whole.getSsaCounter());
	}

	@Test
	public void test_kinds() {
		assertEquals(VariableInfo.Kind.SHARED, registry.get(SYMBOL("g", INT)).getKind());
		assertEquals(VariableInfo.Kind.THREAD_LOCAL, registry.get(SYMBOL("t", INT)).getKind());
		assertEquals(VariableInfo.Kind.PROCEDURE_LOCAL, registry.get(SYMBOL("l", INT)).getKind());
		assertEquals(VariableInfo.Kind.PROCEDURE_LOCAL, registry.get(registry.freshNondet(INT)).getKind());
		assertEquals(VariableInfo.Kind.SHARED, registry.get(registry.freshDynamicObject(INT)).getKind());
		assertTrue(registry.get(SYMBOL("g", INT)).isShared());
	}

	@Test
	public void test_unknownIdentifier() {
		assertThrows(SymexException.Configuration.class, () -> registry.get(SYMBOL("missing", INT)));
	}

	@Test
	public void test_auxiliaryCountersShared() {
		assertEquals("symex::nondet0", registry.freshNondet(INT).getIdentifier());
		assertEquals("symex::deref1", registry.freshDereference(INT).getIdentifier());
		assertEquals("symex::nondet2", registry.freshNondet(INT).getIdentifier());
		assertEquals("symex_dynamic::dynamic_object0", registry.freshDynamicObject(INT).getIdentifier());
		assertEquals(3, registry.getNondetCount());
		assertEquals(1, registry.getDynamicCount());
		assertNotNull(registry.getAuxiliarySymbols().getSymbol("symex::deref1"));
		assertEquals(4, registry.getAuxiliarySymbols().getSymbols().size());
	}

	@Test
	public void test_dereferenceSymbolsRecognised() {
		Expr.Symbol deref = registry.freshDereference(INT);
		assertTrue(registry.isDereference(deref));
		assertFalse(registry.isDereference(registry.freshNondet(INT)));
		assertFalse(registry.isDereference(SYMBOL("g", INT)));
		// not minted by this registry
		assertFalse(registry.isDereference(SYMBOL("symex::deref9", INT)));
	}

	@Test
	public void test_ssaVersionsIncrease() {
		VariableInfo g = registry.get(SYMBOL("g", INT));
		Expr.Symbol v0 = g.nextSsaSymbol();
		Expr.Symbol v1 = g.nextSsaSymbol();
		assertEquals("g#0", v0.getIdentifier());
		assertEquals("g#1", v1.getIdentifier());
		assertEquals("g", v1.getFullIdentifier());
		assertTrue(v1.isSsa());
		assertEquals(2, g.getSsaCounter());
	}

	@Test
	public void test_clear() {
		registry.get(SYMBOL("g", INT));
		registry.freshNondet(INT);
		registry.clear();
		assertEquals(0, registry.size());
		assertEquals(0, registry.getNondetCount());
		assertEquals(0, registry.get(SYMBOL("l", INT)).getNumber());
		assertEquals("symex::nondet0", registry.freshNondet(INT).getIdentifier());
	}

	private static Stream<Arguments> arrays() {
		return Stream.of(
				Arguments.of(ARRAY_TYPE(INT, 10), false),
				Arguments.of(ARRAY_TYPE(INT, 999), false),
				Arguments.of(ARRAY_TYPE(INT, 1000), true),
				Arguments.of(ARRAY_TYPE(INT, (Expr) null), true),
				Arguments.of(ARRAY_TYPE(INT, SYMBOL("n", SIZE_TYPE)), true),
				Arguments.of(VECTOR_TYPE(INT, 5000), false),
				Arguments.of(INT, false));
	}

	@ParameterizedTest
	@MethodSource("arrays")
	public void test_unboundedArrays(Type type, boolean unbounded) {
		assertEquals(unbounded, registry.isUnboundedArray(type));
	}

	@Test
	public void test_invalidBound() {
		assertThrows(IllegalArgumentException.class, () -> registry.setMaxFlattenedArraySize(0));
		registry.setMaxFlattenedArraySize(10);
		assertTrue(registry.isUnboundedArray(ARRAY_TYPE(INT, 10)));
	}
}
