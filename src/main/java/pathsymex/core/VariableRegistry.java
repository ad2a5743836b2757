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

import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;

/**
 * Numbers the variables of a symbolic execution run. This assigns every
 * distinct access path read during the run a unique {@link VariableInfo}, and
 * mints the auxiliary symbols used for nondeterministic inputs, unresolvable
 * dereferences and dynamically allocated objects. The registry is shared by
 * all execution paths of a run and is append-only; it is not safe for use by
 * more than one thread at a time.
 */
public class VariableRegistry {
	private static final Logger LOG = LoggerFactory.getLogger(VariableRegistry.class);

	public static final String NONDET_PREFIX = "symex::nondet";
	public static final String DEREF_PREFIX = "symex::deref";
	public static final String DYNAMIC_PREFIX = "symex_dynamic::";
	public static final String DYNAMIC_OBJECT_PREFIX = DYNAMIC_PREFIX + "dynamic_object";

	/**
	 * Default bound at or above which arrays are no longer flattened into
	 * individual elements.
	 */
	public static final int DEFAULT_MAX_FLATTENED_ARRAY_SIZE = 1000;

	private final Namespace ns;
	/**
	 * Declarations for the auxiliary symbols minted by this registry.
	 */
	private final SymbolTable auxiliary = new SymbolTable();
	private final Map<AccessPath, VariableInfo> variables = new LinkedHashMap<>();
	private int maxFlattenedArraySize = DEFAULT_MAX_FLATTENED_ARRAY_SIZE;
	private int variableCount;
	/**
	 * Counts free inputs (and unresolvable dereferences).
	 */
	private int nondetCount;
	/**
	 * Counts dynamically allocated objects.
	 */
	private int dynamicCount;

	public VariableRegistry(Namespace ns) {
		this.ns = ns;
	}

	public Namespace getNamespace() {
		return ns;
	}

	public SymbolTable getAuxiliarySymbols() {
		return auxiliary;
	}

	public VariableRegistry setMaxFlattenedArraySize(int size) {
		Preconditions.checkArgument(size > 0, "invalid array size bound %s", size);
		this.maxFlattenedArraySize = size;
		return this;
	}

	public int getMaxFlattenedArraySize() {
		return maxFlattenedArraySize;
	}

	/**
	 * Get the variable for a given access path, creating (and numbering) it if it
	 * was not seen before.
	 *
	 * @param path
	 *            The access path identifying the variable.
	 * @param original
	 *            The access expression being read, retained for diagnostics.
	 * @return
	 */
	public VariableInfo get(AccessPath path, Expr original) {
		VariableInfo info = variables.get(path);
		if (info == null) {
			VariableInfo.Kind kind = classify(path.getRoot());
			info = new VariableInfo(kind, variableCount++, path, original);
			variables.put(path, info);
			LOG.debug("variable #{} {} ({})", info.getNumber(), path, kind);
		}
		return info;
	}

	public VariableInfo get(Expr.Symbol symbol) {
		return get(AccessPath.of(symbol.getIdentifier()), symbol);
	}

	public Optional<VariableInfo> find(AccessPath path) {
		return Optional.ofNullable(variables.get(path));
	}

	public Collection<VariableInfo> getVariables() {
		return Collections.unmodifiableCollection(variables.values());
	}

	public int size() {
		return variables.size();
	}

	public int getNondetCount() {
		return nondetCount;
	}

	public int getDynamicCount() {
		return dynamicCount;
	}

	/**
	 * Mint a fresh symbol standing for an unconstrained input of the given type.
	 *
	 * @param type
	 * @return
	 */
	public Expr.Symbol freshNondet(Type type) {
		return freshAuxiliary(NONDET_PREFIX + nondetCount++, type);
	}

	/**
	 * Mint a fresh symbol standing for the unknown result of a dereference which
	 * cannot be resolved. This shares its counter with nondeterministic inputs.
	 *
	 * @param type
	 * @return
	 */
	public Expr.Symbol freshDereference(Type type) {
		return freshAuxiliary(DEREF_PREFIX + nondetCount++, type);
	}

	/**
	 * Check whether a given symbol was minted by {@link #freshDereference(Type)}.
	 * Such symbols are never numbered as variables, hence never receive an SSA
	 * version or a value.
	 *
	 * @param symbol
	 * @return
	 */
	public boolean isDereference(Expr.Symbol symbol) {
		String name = symbol.getIdentifier();
		return !symbol.isSsa() && name.startsWith(DEREF_PREFIX) && auxiliary.getSymbol(name) != null;
	}

	/**
	 * Mint a fresh symbol naming a dynamically allocated object of the given
	 * type. Such objects are visible to all threads.
	 *
	 * @param type
	 * @return
	 */
	public Expr.Symbol freshDynamicObject(Type type) {
		String name = DYNAMIC_OBJECT_PREFIX + dynamicCount++;
		auxiliary.add(SymbolTable.GLOBAL(name, type));
		LOG.debug("dynamic object {}", name);
		return Syntax.SYMBOL(name, type);
	}

	private Expr.Symbol freshAuxiliary(String name, Type type) {
		auxiliary.add(SymbolTable.LOCAL(name, type));
		LOG.debug("auxiliary symbol {}", name);
		return Syntax.SYMBOL(name, type);
	}

	/**
	 * Determine whether an array is modelled as an (uninterpreted) array rather
	 * than being flattened into its elements. This is the case when it has no
	 * size, a size which is not constant, or a size which is too large.
	 *
	 * @param type
	 * @return
	 */
	public boolean isUnboundedArray(Type type) {
		type = ns.follow(type);
		if (!(type instanceof Type.Array)) {
			return false;
		}
		Expr size = ((Type.Array) type).getSize();
		if (!(size instanceof Expr.Constant)) {
			return true;
		}
		return ((Expr.Constant) size).getValue().compareTo(BigInteger.valueOf(maxFlattenedArraySize)) >= 0;
	}

	/**
	 * Reset this registry at the start of a run.
	 */
	public void clear() {
		variables.clear();
		auxiliary.clear();
		variableCount = 0;
		nondetCount = 0;
		dynamicCount = 0;
	}

	private VariableInfo.Kind classify(String root) {
		if (root.startsWith(DYNAMIC_PREFIX)) {
			return VariableInfo.Kind.SHARED;
		}
		SymbolTable.Symbol symbol = auxiliary.getSymbol(root);
		if (symbol == null) {
			symbol = ns.lookup(root).orElseThrow(
					() -> new SymexException.Configuration("identifier \"" + root + "\" not found in namespace"));
		}
		if (!symbol.isStaticLifetime()) {
			return VariableInfo.Kind.PROCEDURE_LOCAL;
		} else if (symbol.isThreadLocal()) {
			return VariableInfo.Kind.THREAD_LOCAL;
		} else {
			return VariableInfo.Kind.SHARED;
		}
	}
}
