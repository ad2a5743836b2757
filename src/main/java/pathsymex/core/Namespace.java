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

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import pathsymex.core.Syntax.Type;

/**
 * Provides a read-only view over one or more symbol tables, which are searched
 * in order. This is responsible for resolving named types to their underlying
 * structural definition.
 */
public class Namespace {
	private final List<SymbolTable> tables;

	public Namespace(SymbolTable... tables) {
		this.tables = ImmutableList.copyOf(tables);
	}

	public Optional<SymbolTable.Symbol> lookup(String name) {
		for (SymbolTable table : tables) {
			SymbolTable.Symbol s = table.getSymbol(name);
			if (s != null) {
				return Optional.of(s);
			}
		}
		return Optional.empty();
	}

	/**
	 * Resolve a type through any number of named types to its structural
	 * definition. Types which are not named are returned as is.
	 *
	 * @param type
	 * @return
	 */
	public Type follow(Type type) {
		Set<String> visited = null;
		while (type instanceof Type.Tag) {
			String name = ((Type.Tag) type).getName();
			if (visited == null) {
				visited = new HashSet<>();
			}
			if (!visited.add(name)) {
				throw new SymexException.Configuration("cyclic type definition \"" + name + "\"");
			}
			type = lookupType(name);
		}
		return type;
	}

	private Type lookupType(String name) {
		for (SymbolTable table : tables) {
			Type t = table.getType(name);
			if (t != null) {
				return t;
			}
		}
		throw new SymexException.Configuration("unknown type \"" + name + "\"");
	}
}
