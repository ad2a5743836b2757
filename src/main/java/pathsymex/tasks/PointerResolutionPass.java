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

import pathsymex.core.Syntax.Expr;
import pathsymex.util.AbstractExpressionTransform;

/**
 * Replaces every dereference in an expression by the object(s) the pointer may
 * refer to, and every address-of by its evaluated address. Pointers are read
 * before being resolved, so that nested dereferences such
 * as <code>**p</code> are resolved from the inside out.
 */
public class PointerResolutionPass extends AbstractExpressionTransform {
	private final StateReader reader;
	private final SymexConfig config;
	private final boolean propagate;

	public PointerResolutionPass(StateReader reader, boolean propagate) {
		this.reader = reader;
		this.config = reader.getConfig();
		this.propagate = propagate;
	}

	public Expr apply(Expr expr) {
		return visitExpression(expr);
	}

	@Override
	protected Expr visitDereference(Expr.Dereference expr) {
		Expr address = reader.read(expr.getPointer(), propagate);
		return config.getPointerResolver().resolve(address, config.getNamespace());
	}

	@Override
	protected Expr visitAddressOf(Expr.AddressOf expr) {
		return config.getAddressEvaluator().evaluate(expr, config.getNamespace());
	}
}
