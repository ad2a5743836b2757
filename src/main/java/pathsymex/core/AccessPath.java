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
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * Identifies a scalar access into program state: a root symbol followed by a
 * sequence of field and index selectors (e.g. <code>s.f[3]</code>). Every
 * symbolic index is represented by the same selector, so that
 * <code>a[i]</code> and <code>a[j]</code> denote the same access path
 * <code>a[*]</code>.
 */
public final class AccessPath {
	private final String root;
	private final List<Selector> selectors;

	public AccessPath(String root, List<Selector> selectors) {
		this.root = Objects.requireNonNull(root);
		this.selectors = ImmutableList.copyOf(selectors);
	}

	public static AccessPath of(String root, Selector... selectors) {
		return new AccessPath(root, ImmutableList.copyOf(selectors));
	}

	public String getRoot() {
		return root;
	}

	public List<Selector> getSelectors() {
		return selectors;
	}

	/**
	 * Get the textual suffix of this path, such as <code>.f[3]</code> or
	 * <code>[*]</code>. The root symbol has the empty suffix.
	 *
	 * @return
	 */
	public String getSuffix() {
		StringBuilder sb = new StringBuilder();
		for (Selector s : selectors) {
			sb.append(s);
		}
		return sb.toString();
	}

	public String getFullIdentifier() {
		return root + getSuffix();
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof AccessPath) {
			AccessPath p = (AccessPath) o;
			return p.root.equals(root) && p.selectors.equals(selectors);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return root.hashCode() * 31 + selectors.hashCode();
	}

	@Override
	public String toString() {
		return getFullIdentifier();
	}

	// =========================================================================
	// Selectors
	// =========================================================================

	public interface Selector {

	}

	public static final class Field implements Selector {
		private final String name;

		public Field(String name) {
			this.name = Objects.requireNonNull(name);
		}

		public String getName() {
			return name;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Field && ((Field) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return "." + name;
		}
	}

	public static final class ConstantIndex implements Selector {
		private final BigInteger index;

		public ConstantIndex(BigInteger index) {
			this.index = Objects.requireNonNull(index);
		}

		public BigInteger getIndex() {
			return index;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof ConstantIndex && ((ConstantIndex) o).index.equals(index);
		}

		@Override
		public int hashCode() {
			return index.hashCode();
		}

		@Override
		public String toString() {
			return "[" + index + "]";
		}
	}

	public static final class SymbolicIndex implements Selector {
		private SymbolicIndex() {

		}

		@Override
		public String toString() {
			return "[*]";
		}
	}

	/**
	 * The selector shared by all symbolic indices.
	 */
	public static final Selector ANY_INDEX = new SymbolicIndex();

	public static Selector FIELD(String name) {
		return new Field(name);
	}

	public static Selector INDEX(BigInteger index) {
		return new ConstantIndex(index);
	}

	public static Selector INDEX(long index) {
		return new ConstantIndex(BigInteger.valueOf(index));
	}
}
