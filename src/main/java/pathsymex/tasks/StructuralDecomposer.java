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

import static pathsymex.core.Syntax.*;

import java.util.ArrayList;
import java.util.List;

import pathsymex.core.Namespace;
import pathsymex.core.VariableRegistry;
import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;
import pathsymex.util.Util;

/**
 * Expands an access to a structure, a bounded array or a vector into a
 * constructor over accesses to its individual members or elements, and does
 * so recursively. Accesses of any other type are returned unchanged, as are
 * arrays which are not flattened. Where the access is itself a constructor,
 * its operands are used directly rather than projected out of it.
 */
public class StructuralDecomposer {
	private final SymexConfig config;

	public StructuralDecomposer(SymexConfig config) {
		this.config = config;
	}

	public Expr expand(Expr src) {
		Namespace ns = config.getNamespace();
		VariableRegistry registry = config.getVariableRegistry();
		Type type = ns.follow(src.getType());
		if (type instanceof Type.Struct) {
			List<Type.Component> components = ((Type.Struct) type).getComponents();
			List<Expr> fields = new ArrayList<>();
			for (int i = 0; i != components.size(); ++i) {
				Type.Component c = components.get(i);
				Expr field;
				if (src instanceof Expr.StructConstructor && src.getOperands().size() == components.size()) {
					field = src.getOperands().get(i);
				} else {
					field = MEMBER(src, c.getName(), c.getType());
				}
				fields.add(expand(field));
			}
			return STRUCT(src.getType(), fields);
		} else if (type instanceof Type.Sequence) {
			Type.Sequence seq = (Type.Sequence) type;
			if (registry.isUnboundedArray(seq) || !Util.hasConstantSize(seq)) {
				return src;
			}
			int size = Util.constantSize(seq);
			Type indexType = seq.getSize().getType();
			List<Expr> elements = new ArrayList<>();
			for (int i = 0; i != size; ++i) {
				Expr element = INDEX(src, CONST(i, indexType), seq.getElement());
				if (src instanceof Expr.Constructor) {
					element = config.getSimplifier().simplify(element);
				}
				elements.add(expand(element));
			}
			if (seq instanceof Type.Array) {
				return ARRAY(src.getType(), elements);
			} else {
				return VECTOR(src.getType(), elements);
			}
		}
		return src;
	}
}
