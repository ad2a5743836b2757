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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Preconditions;

import pathsymex.core.Syntax.Type;

/**
 * The declarations of a program: its variables (including procedure locals and
 * auxiliary variables introduced during execution) and its named types.
 */
public class SymbolTable {
	/**
	 * Declared symbols, indexed by identifier.
	 */
	private final Map<String, Symbol> symbols = new LinkedHashMap<>();
	/**
	 * Named types (e.g. <code>struct tag-S</code>), indexed by name.
	 */
	private final Map<String, Type> types = new LinkedHashMap<>();

	public SymbolTable add(Symbol symbol) {
		Preconditions.checkArgument(!symbols.containsKey(symbol.getName()), "symbol %s already declared",
				symbol.getName());
		symbols.put(symbol.getName(), symbol);
		return this;
	}

	public SymbolTable addType(String name, Type type) {
		Preconditions.checkArgument(!types.containsKey(name), "type %s already declared", name);
		types.put(name, Objects.requireNonNull(type));
		return this;
	}

	public Symbol getSymbol(String name) {
		return symbols.get(name);
	}

	public Type getType(String name) {
		return types.get(name);
	}

	public Collection<Symbol> getSymbols() {
		return Collections.unmodifiableCollection(symbols.values());
	}

	public void clear() {
		symbols.clear();
		types.clear();
	}

	/**
	 * A declared variable. The lifetime flags determine how SSA versions of the
	 * variable are shared between execution contexts of the modelled program.
	 */
	public static class Symbol {
		private final String name;
		private final Type type;
		private final boolean staticLifetime;
		private final boolean threadLocal;

		public Symbol(String name, Type type, boolean staticLifetime, boolean threadLocal) {
			this.name = Objects.requireNonNull(name);
			this.type = Objects.requireNonNull(type);
			this.staticLifetime = staticLifetime;
			this.threadLocal = threadLocal;
		}

		public String getName() {
			return name;
		}

		public Type getType() {
			return type;
		}

		public boolean isStaticLifetime() {
			return staticLifetime;
		}

		public boolean isThreadLocal() {
			return threadLocal;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public static Symbol GLOBAL(String name, Type type) {
		return new Symbol(name, type, true, false);
	}

	public static Symbol THREAD_LOCAL(String name, Type type) {
		return new Symbol(name, type, true, true);
	}

	public static Symbol LOCAL(String name, Type type) {
		return new Symbol(name, type, false, true);
	}
}
