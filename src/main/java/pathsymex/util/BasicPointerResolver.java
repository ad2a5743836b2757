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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pathsymex.core.Namespace;
import pathsymex.core.SymexException;
import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;

/**
 * A pointer resolver which follows the structure of the pointer value. Taking
 * the address of an object gives that object, conditional pointers give
 * conditional objects and integer constants give integer dereferences (or a
 * failure for null). Anything else cannot be resolved.
 */
public class BasicPointerResolver implements PointerResolver {
	private static final Logger LOG = LoggerFactory.getLogger(BasicPointerResolver.class);

	@Override
	public Expr resolve(Expr address, Namespace ns) {
		Type type = ns.follow(address.getType());
		if (!(type instanceof Type.Pointer)) {
			throw new SymexException.Dereference("dereference of non-pointer " + address);
		}
		Type target = ((Type.Pointer) type).getTarget();
		if (address instanceof Expr.AddressOf) {
			return ((Expr.AddressOf) address).getObject();
		} else if (address instanceof Expr.If) {
			Expr.If e = (Expr.If) address;
			return IF(e.getCondition(), resolve(e.getTrueBranch(), ns), resolve(e.getFalseBranch(), ns));
		} else if (address instanceof Expr.Constant) {
			if (((Expr.Constant) address).getValue().signum() == 0) {
				LOG.debug("null dereference {}", address);
				return DEREF_FAILURE(target);
			}
			return INTEGER_DEREF(address, target);
		} else if (address instanceof Expr.Operator
				&& ((Expr.Operator) address).getOpcode() == Expr.Opcode.TYPECAST) {
			Type from = ns.follow(address.getOperands().get(0).getType());
			if (from instanceof Type.BitVector || from instanceof Type.Int) {
				return INTEGER_DEREF(address.getOperands().get(0), target);
			}
		}
		LOG.debug("unresolved pointer {}", address);
		return DEREF_FAILURE(target);
	}
}
