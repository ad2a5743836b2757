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

import java.util.Optional;

import pathsymex.core.Syntax.Expr;

/**
 * The state of a variable on one execution path: the value known for it (if
 * any) and the SSA symbol naming its current version (if one was assigned).
 * Both can be present at once, in which case the symbol is the name under
 * which the value is visible when propagation is disabled.
 */
public class VariableState {
	private Expr value;
	private Expr.Symbol ssaSymbol;

	public VariableState() {

	}

	private VariableState(VariableState other) {
		this.value = other.value;
		this.ssaSymbol = other.ssaSymbol;
	}

	public Optional<Expr> getValue() {
		return Optional.ofNullable(value);
	}

	public void setValue(Expr value) {
		this.value = value;
	}

	public Optional<Expr.Symbol> getSsaSymbol() {
		return Optional.ofNullable(ssaSymbol);
	}

	public void setSsaSymbol(Expr.Symbol ssaSymbol) {
		this.ssaSymbol = ssaSymbol;
	}

	public VariableState copy() {
		return new VariableState(this);
	}
}
