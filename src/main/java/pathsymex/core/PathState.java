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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import pathsymex.core.Syntax.Expr;

/**
 * The variable states of a single execution path. Forking a path copies its
 * states, after which the two paths evolve independently whilst still sharing
 * variable identities through the {@link VariableRegistry}.
 */
public class PathState {
	private final Map<VariableInfo, VariableState> states;

	public PathState() {
		this.states = new HashMap<>();
	}

	private PathState(PathState other) {
		this.states = new HashMap<>();
		for (Map.Entry<VariableInfo, VariableState> e : other.states.entrySet()) {
			states.put(e.getKey(), e.getValue().copy());
		}
	}

	/**
	 * Get the state of a given variable on this path, creating an empty one if
	 * the variable was never touched on this path.
	 *
	 * @param info
	 * @return
	 */
	public VariableState getState(VariableInfo info) {
		return states.computeIfAbsent(info, k -> new VariableState());
	}

	public Optional<VariableState> findState(VariableInfo info) {
		return Optional.ofNullable(states.get(info));
	}

	public int size() {
		return states.size();
	}

	/**
	 * Record an assignment to a variable on this path. This gives the variable a
	 * fresh SSA version and remembers the assigned value for propagation. A
	 * <code>null</code> value means nothing is known about the new version.
	 *
	 * @param info
	 * @param value
	 * @return The SSA symbol of the new version.
	 */
	public Expr.Symbol assign(VariableInfo info, Expr value) {
		VariableState state = getState(info);
		Expr.Symbol symbol = info.nextSsaSymbol();
		state.setSsaSymbol(symbol);
		state.setValue(value);
		return symbol;
	}

	/**
	 * Fork this path, producing an independent copy of its state.
	 *
	 * @return
	 */
	public PathState fork() {
		return new PathState(this);
	}
}
