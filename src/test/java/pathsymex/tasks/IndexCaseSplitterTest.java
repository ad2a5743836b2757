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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import pathsymex.core.Namespace;
import pathsymex.core.PathState;
import pathsymex.core.SymbolTable;
import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;

public class IndexCaseSplitterTest {
	private static final Type INT = SIGNED(32);
	private static final Expr.Symbol I = SYMBOL("i", INT);

	private StateReader reader;
	private IndexCaseSplitter splitter;

	@BeforeEach
	public void setup() {
		SymbolTable table = new SymbolTable().add(SymbolTable.LOCAL("i", INT));
		reader = new StateReader(new SymexConfig(new Namespace(table)), new PathState());
		splitter = reader.getSplitter();
	}

	@ParameterizedTest
	@ValueSource(ints = { 1, 2, 4, 7, 999 })
	public void test_oneCasePerElement(int size) {
		Expr a = SYMBOL("a", ARRAY_TYPE(INT, size));
		Expr result = splitter.split(INDEX(a, I, INT), false);
		assertTrue(result instanceof Expr.Cond);
		Expr.Cond cond = (Expr.Cond) result;
		assertEquals(size, cond.getCaseCount());
		for (int k = 0; k != size; ++k) {
			assertEquals(EQ(SSA_SYMBOL("i#0", "i", INT), CONST(k, INT)), cond.getGuard(k));
			assertEquals(INDEX(a, CONST(k, INT), INT), cond.getValue(k));
		}
	}

	@Test
	public void test_constantIndexUnchanged() {
		Expr e = INDEX(SYMBOL("a", ARRAY_TYPE(INT, 4)), CONST(1, INT), INT);
		assertSame(e, splitter.split(e, false));
	}

	@Test
	public void test_propagatedIndexUnchanged() {
		// i is zero on first read with propagation
		Expr e = INDEX(SYMBOL("a", ARRAY_TYPE(INT, 4)), I, INT);
		assertSame(e, splitter.split(e, true));
	}

	@Test
	public void test_unboundedArrayUnchanged() {
		Expr e = INDEX(SYMBOL("a", ARRAY_TYPE(INT, 1000)), I, INT);
		assertSame(e, splitter.split(e, false));
	}

	@Test
	public void test_nonIndexUnchanged() {
		assertSame(I, splitter.split(I, false));
	}
}
