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

import java.math.BigInteger;

import pathsymex.core.Namespace;
import pathsymex.core.SymexException;
import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;

public class Util {

    /**
     * Check whether a given (resolved) type is that of code or of a mathematical
     * function. Symbols of such types never denote program state.
     *
     * @param type
     * @return
     */
    public static boolean isFunction(Type type) {
        return type instanceof Type.Code || type instanceof Type.MathematicalFunction;
    }

    /**
     * Check whether a given expression is a constant of an integral type. Named
     * types are followed, so a constant of e.g. <code>size_t</code> counts.
     *
     * @param ns
     * @param expr
     * @return
     */
    public static boolean isIntegerConstant(Namespace ns, Expr expr) {
        if (!(expr instanceof Expr.Constant)) {
            return false;
        }
        Type type = ns.follow(expr.getType());
        return type instanceof Type.BitVector || type instanceof Type.Int;
    }

    /**
     * Check whether the size of an array or vector type is statically known.
     *
     * @param type
     * @return
     */
    public static boolean hasConstantSize(Type.Sequence type) {
        return type.getSize() instanceof Expr.Constant;
    }

    /**
     * Evaluate the statically known size of an array or vector type. A size which
     * cannot be represented is a configuration error.
     *
     * @param type
     * @return
     */
    public static int constantSize(Type.Sequence type) {
        if (!hasConstantSize(type)) {
            throw new SymexException.Configuration("sequence has non-constant size");
        }
        BigInteger size = ((Expr.Constant) type.getSize()).getValue();
        if (size.signum() < 0 || size.bitLength() >= 32) {
            throw new SymexException.Configuration("failed to convert sequence size " + size);
        }
        return size.intValue();
    }
}
