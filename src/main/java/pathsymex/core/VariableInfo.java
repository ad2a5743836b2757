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

import java.util.Objects;

import pathsymex.core.Syntax.Expr;

/**
 * Describes a single scalar variable of the program being executed, as
 * identified by its access path (e.g. <code>s.f[2]</code>). Every variable is
 * numbered on first sight, and maintains a counter from which fresh SSA
 * versions of it are minted. Variable information is shared between all
 * execution paths.
 */
public class VariableInfo {

	/**
	 * Determines the scope over which SSA versions of a variable are visible in
	 * the modelled program.
	 */
	public enum Kind {
		SHARED, THREAD_LOCAL, PROCEDURE_LOCAL
	}

	private final Kind kind;
	private final int number;
	private final AccessPath path;
	/**
	 * The symbol-member-index expression which first gave rise to this variable.
	 */
	private final Expr original;
	private int ssaCounter;

	VariableInfo(Kind kind, int number, AccessPath path, Expr original) {
		this.kind = Objects.requireNonNull(kind);
		this.number = number;
		this.path = Objects.requireNonNull(path);
		this.original = Objects.requireNonNull(original);
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isShared() {
		return kind == Kind.SHARED;
	}

	public int getNumber() {
		return number;
	}

	public AccessPath getPath() {
		return path;
	}

	public String getSymbol() {
		return path.getRoot();
	}

	public String getSuffix() {
		return path.getSuffix();
	}

	public String getFullIdentifier() {
		return path.getFullIdentifier();
	}

	public Expr getOriginal() {
		return original;
	}

	public int getSsaCounter() {
		return ssaCounter;
	}

	public String getSsaIdentifier() {
		return getFullIdentifier() + "#" + ssaCounter;
	}

	/**
	 * Get the SSA symbol for the current version of this variable.
	 *
	 * @return
	 */
	public Expr.Symbol getSsaSymbol() {
		return Syntax.SSA_SYMBOL(getSsaIdentifier(), getFullIdentifier(), original.getType());
	}

	/**
	 * Mint the SSA symbol for the current version of this variable, and advance
	 * the version counter so that no other symbol is ever minted with the same
	 * version.
	 *
	 * @return
	 */
	public Expr.Symbol nextSsaSymbol() {
		Expr.Symbol symbol = getSsaSymbol();
		ssaCounter = ssaCounter + 1;
		return symbol;
	}

	@Override
	public String toString() {
		return getFullIdentifier();
	}
}
