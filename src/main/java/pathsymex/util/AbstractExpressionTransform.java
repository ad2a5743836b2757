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

import java.util.Arrays;
import java.util.List;

import pathsymex.core.Syntax.Expr;

/**
 * An expression visitor which rebuilds the expression being visited. Nodes
 * whose operands were left unchanged are not rebuilt, so that a transform which
 * changes nothing returns its input.
 */
public abstract class AbstractExpressionTransform extends AbstractExpressionVisitor<Expr> {

    @Override
    protected Expr constructSymbol(Expr.Symbol expr) {
        return expr;
    }

    @Override
    protected Expr constructConstant(Expr.Constant expr) {
        return expr;
    }

    @Override
    protected Expr constructSideEffect(Expr.SideEffect expr) {
        return expr;
    }

    @Override
    protected Expr constructDereferenceFailure(Expr.DereferenceFailure expr) {
        return expr;
    }

    @Override
    protected Expr constructMember(Expr.Member expr, Expr compound) {
        return expr.withOperands(Arrays.asList(compound));
    }

    @Override
    protected Expr constructIndex(Expr.Index expr, Expr array, Expr index) {
        return expr.withOperands(Arrays.asList(array, index));
    }

    @Override
    protected Expr constructDereference(Expr.Dereference expr, Expr pointer) {
        return expr.withOperands(Arrays.asList(pointer));
    }

    @Override
    protected Expr constructIntegerDereference(Expr.IntegerDereference expr, Expr address) {
        return expr.withOperands(Arrays.asList(address));
    }

    @Override
    protected Expr constructAddressOf(Expr.AddressOf expr, Expr object) {
        return expr.withOperands(Arrays.asList(object));
    }

    @Override
    protected Expr constructByteExtract(Expr.ByteExtract expr, Expr operand, Expr offset) {
        return expr.withOperands(Arrays.asList(operand, offset));
    }

    @Override
    protected Expr constructConstructor(Expr.Constructor expr, List<Expr> operands) {
        return expr.withOperands(operands);
    }

    @Override
    protected Expr constructIf(Expr.If expr, Expr condition, Expr trueBranch, Expr falseBranch) {
        return expr.withOperands(Arrays.asList(condition, trueBranch, falseBranch));
    }

    @Override
    protected Expr constructCond(Expr.Cond expr, List<Expr> operands) {
        return expr.withOperands(operands);
    }

    @Override
    protected Expr constructEquals(Expr.Equals expr, Expr lhs, Expr rhs) {
        return expr.withOperands(Arrays.asList(lhs, rhs));
    }

    @Override
    protected Expr constructOperator(Expr.Operator expr, List<Expr> operands) {
        return expr.withOperands(operands);
    }
}
