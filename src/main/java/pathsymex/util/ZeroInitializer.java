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

import static pathsymex.core.Syntax.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import pathsymex.core.Namespace;
import pathsymex.core.VariableRegistry;
import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;

/**
 * Constructs the default (zero) value of a type. Arrays which are not
 * flattened are initialised with <code>array_of</code>. No zero value exists
 * for unions, code or mathematical functions.
 */
public class ZeroInitializer {
	private final VariableRegistry registry;

	public ZeroInitializer(VariableRegistry registry) {
		this.registry = registry;
	}

	public Optional<Expr> zero(Type type) {
		Namespace ns = registry.getNamespace();
		Type t = ns.follow(type);
		if (t instanceof Type.Bool) {
			return Optional.of(CONST(false));
		} else if (t instanceof Type.BitVector || t instanceof Type.Int) {
			return Optional.of(CONST(0, type));
		} else if (t instanceof Type.Pointer) {
			return Optional.of(NULL((Type.Pointer) t));
		} else if (t instanceof Type.Struct) {
			List<Expr> fields = new ArrayList<>();
			for (Type.Component c : ((Type.Struct) t).getComponents()) {
				Optional<Expr> field = zero(c.getType());
				if (!field.isPresent()) {
					return Optional.empty();
				}
				fields.add(field.get());
			}
			return Optional.of(STRUCT(type, fields));
		} else if (t instanceof Type.Sequence) {
			Type.Sequence seq = (Type.Sequence) t;
			Optional<Expr> element = zero(seq.getElement());
			if (!element.isPresent()) {
				return Optional.empty();
			} else if (registry.isUnboundedArray(t)) {
				return Optional.of(ARRAY_OF(element.get(), (Type.Array) t));
			} else if (!Util.hasConstantSize(seq)) {
				return Optional.empty();
			}
			List<Expr> elements = Collections.nCopies(Util.constantSize(seq), element.get());
			if (t instanceof Type.Array) {
				return Optional.of(ARRAY(type, elements));
			} else {
				return Optional.of(VECTOR(type, elements));
			}
		}
		return Optional.empty();
	}
}
