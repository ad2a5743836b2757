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

import pathsymex.core.Namespace;
import pathsymex.core.PathState;
import pathsymex.core.SymbolTable;
import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;

public class InstantiationEngineTest {
	private static final Type INT = SIGNED(32);
	private static final Expr.Symbol X = SYMBOL("x", INT);
	private static final Expr.Symbol Y = SYMBOL("y", INT);

	private SymexConfig config;
	private StateReader reader;
	private InstantiationEngine engine;

	@BeforeEach
	public void setup() {
		SymbolTable table = new SymbolTable()
				.add(SymbolTable.GLOBAL("x", INT))
				.add(SymbolTable.LOCAL("y", INT));
		config = new SymexConfig(new Namespace(table));
		reader = new StateReader(config, new PathState());
		engine = reader.getEngine();
	}

	@Test
	public void test_operandsAreRewritten() {
		Expr result = engine.instantiate(ADD(X, MUL(Y, CONST(2, INT))), false);
		Expr.Symbol x0 = SSA_SYMBOL("x#0", "x", INT);
		Expr.Symbol y0 = SSA_SYMBOL("y#0", "y", INT);
		assertEquals(ADD(x0, MUL(y0, CONST(2, INT))), result);
	}

	@Test
	public void test_unchangedExpressionIsNotRebuilt() {
		Expr e = ADD(CONST(1, INT), CONST(2, INT));
		assertSame(e, engine.instantiate(e, true));
	}

	@Test
	public void test_addressOfIsLeftAlone() {
		Expr e = ADDRESS_OF(X);
		assertSame(e, engine.instantiate(e, true));
		assertEquals(0, config.getVariableRegistry().size());
	}

	@Test
	public void test_nondetsNumberedLeftToRight() {
		Expr result = engine.instantiate(ADD(NONDET(INT), NONDET(INT)), true);
		assertEquals(SSA_SYMBOL("symex::nondet0#0", "symex::nondet0", INT), result.getOperands().get(0));
		assertEquals(SSA_SYMBOL("symex::nondet1#0", "symex::nondet1", INT), result.getOperands().get(1));
	}

	@Test
	public void test_leftoverDereferenceIsUnconstrained() {
		Expr p = SSA_SYMBOL("p#0", "p", POINTER(INT));
		assertEquals(SYMBOL("symex::deref0", INT), engine.instantiate(DEREF(p, INT), false));
		assertEquals(SYMBOL("symex::deref1", INT), engine.instantiate(DEREF_FAILURE(INT), false));
		assertEquals(2, config.getVariableRegistry().getNondetCount());
	}

	@Test
	public void test_byteExtractOperandsAreRead() {
		Expr e = BYTE_EXTRACT(X, CONST(0, INT), false, UNSIGNED(8));
		Expr result = engine.instantiate(e, true);
		assertEquals(BYTE_EXTRACT(CONST(0, INT), CONST(0, INT), false, UNSIGNED(8)), result);
	}

	@Test
	public void test_deeplyNestedExpression() {
		final int depth = 20000;
		Expr e = X;
		for (int i = 0; i != depth; ++i) {
			e = ADD(e, CONST(1, INT));
		}
		Expr result = engine.instantiate(e, false);
		for (int i = 0; i != depth; ++i) {
			assertTrue(result instanceof Expr.Operator);
			result = result.getOperands().get(0);
		}
		assertEquals(SSA_SYMBOL("x#0", "x", INT), result);
	}
}
