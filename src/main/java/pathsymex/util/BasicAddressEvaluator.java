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

import pathsymex.core.Namespace;
import pathsymex.core.Syntax.Expr;

/**
 * An address evaluator which only cancels <code>&amp;*p</code> down to
 * <code>p</code>, leaving all other addresses as they are.
 */
public class BasicAddressEvaluator implements AddressEvaluator {

	@Override
	public Expr evaluate(Expr.AddressOf expr, Namespace ns) {
		if (expr.getObject() instanceof Expr.Dereference) {
			return ((Expr.Dereference) expr.getObject()).getPointer();
		}
		return expr;
	}
}
