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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import pathsymex.core.AccessPath;
import pathsymex.core.Namespace;
import pathsymex.core.PathState;
import pathsymex.core.VariableInfo;
import pathsymex.core.VariableRegistry;
import pathsymex.core.VariableState;
import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;
import pathsymex.util.Util;

/**
 * Resolves a chain of member and index accesses rooted at a program variable
 * (e.g. <code>s.a[i].b</code>) into either the value propagated for that
 * variable on the current path, or its current SSA symbol. Composite accesses
 * are first decomposed into their parts, and reads at symbolic indices are
 * split into cases, so that every variable resolved here is a scalar or an
 * array which is not flattened.
 */
public class AccessResolver {
	private final StateReader reader;

	public AccessResolver(StateReader reader) {
		this.reader = reader;
	}

	/**
	 * Check whether a given expression is a chain of struct members and indices
	 * ending in a symbol which is not yet in SSA form.
	 *
	 * @param src
	 * @return
	 */
	public boolean isSymbolMemberIndex(Expr src) {
		Namespace ns = reader.getConfig().getNamespace();
		VariableRegistry registry = reader.getConfig().getVariableRegistry();
		if (Util.isFunction(ns.follow(src.getType()))) {
			return false;
		}
		Expr current = src;
		while (true) {
			if (current instanceof Expr.Symbol) {
				Expr.Symbol s = (Expr.Symbol) current;
				// stand-ins for failed dereferences stay unconstrained
				return !s.isSsa() && !registry.isDereference(s);
			} else if (current instanceof Expr.Member) {
				Expr compound = ((Expr.Member) current).getCompound();
				if (!(ns.follow(compound.getType()) instanceof Type.Struct)) {
					// includes unions
					return false;
				}
				current = compound;
			} else if (current instanceof Expr.Index) {
				current = ((Expr.Index) current).getArray();
			} else {
				return false;
			}
		}
	}

	/**
	 * Resolve a given access. This returns nothing when the access is not one
	 * this resolver handles, such as an access through a union, one which is
	 * already in SSA form, one rooted at a failed dereference or one of function
	 * type.
	 *
	 * @param src
	 * @param propagate
	 * @return
	 */
	public Optional<Expr> resolve(Expr src, boolean propagate) {
		SymexConfig config = reader.getConfig();
		Namespace ns = config.getNamespace();
		VariableRegistry registry = config.getVariableRegistry();
		if (Util.isFunction(ns.follow(src.getType()))) {
			return Optional.empty();
		}
		if (src instanceof Expr.Index && registry.isUnboundedArray(((Expr.Index) src).getArray().getType())) {
			Expr.Index e = (Expr.Index) src;
			Expr array = resolveOrInstantiate(e.getArray(), propagate);
			Expr index = reader.read(e.getIndex(), propagate);
			return Optional.of(e.withOperands(ImmutableList.of(array, index)));
		}
		Expr expanded = reader.getDecomposer().expand(src);
		if (expanded instanceof Expr.Constructor) {
			List<Expr> operands = new ArrayList<>();
			for (Expr operand : expanded.getOperands()) {
				operands.add(resolveOrInstantiate(operand, propagate));
			}
			return Optional.of(expanded.withOperands(operands));
		}
		Expr split = reader.getSplitter().split(expanded, propagate);
		if (split instanceof Expr.If || split instanceof Expr.Cond) {
			return Optional.of(reader.getEngine().instantiate(split, propagate));
		}
		// walk the chain back to its root
		List<AccessPath.Selector> selectors = new ArrayList<>();
		Expr current = src;
		while (!(current instanceof Expr.Symbol)) {
			if (current instanceof Expr.Member) {
				Expr.Member e = (Expr.Member) current;
				if (!(ns.follow(e.getCompound().getType()) instanceof Type.Struct)) {
					return Optional.empty();
				}
				selectors.add(AccessPath.FIELD(e.getField()));
				current = e.getCompound();
			} else if (current instanceof Expr.Index) {
				Expr.Index e = (Expr.Index) current;
				Expr index = reader.read(e.getIndex(), propagate);
				if (Util.isIntegerConstant(ns, index)) {
					selectors.add(AccessPath.INDEX(((Expr.Constant) index).getValue()));
				} else {
					selectors.add(AccessPath.ANY_INDEX);
				}
				current = e.getArray();
			} else {
				return Optional.empty();
			}
		}
		Expr.Symbol root = (Expr.Symbol) current;
		if (root.isSsa() || registry.isDereference(root)) {
			return Optional.empty();
		}
		Collections.reverse(selectors);
		return Optional.of(resolveRoot(new AccessPath(root.getIdentifier(), selectors), src, propagate));
	}

	/**
	 * Resolve the variable identified by a given access path on the current
	 * path. A variable read for the first time on this path is given a fresh
	 * SSA version and, when propagating, the zero value of its type.
	 *
	 * @param path
	 * @param original
	 * @param propagate
	 * @return
	 */
	private Expr resolveRoot(AccessPath path, Expr original, boolean propagate) {
		SymexConfig config = reader.getConfig();
		VariableInfo info = config.getVariableRegistry().get(path, original);
		PathState state = reader.getState();
		VariableState vs = state.getState(info);
		if (propagate && vs.getValue().isPresent()) {
			return vs.getValue().get();
		} else if (vs.getSsaSymbol().isPresent()) {
			return vs.getSsaSymbol().get();
		}
		Expr.Symbol symbol = info.nextSsaSymbol();
		vs.setSsaSymbol(symbol);
		if (propagate) {
			Optional<Expr> zero = config.getZeroInitializer().zero(symbol.getType());
			if (zero.isPresent()) {
				vs.setValue(zero.get());
				return zero.get();
			}
		}
		return symbol;
	}

	private Expr resolveOrInstantiate(Expr src, boolean propagate) {
		Optional<Expr> r = resolve(src, propagate);
		if (r.isPresent()) {
			return r.get();
		}
		return reader.getEngine().instantiate(src, propagate);
	}
}
