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

import pathsymex.core.Syntax.Expr;

import java.util.ArrayList;
import java.util.List;

public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if(expr instanceof Expr.Symbol) {
            return constructSymbol((Expr.Symbol) expr);
        } else if(expr instanceof Expr.Constant) {
            return constructConstant((Expr.Constant) expr);
        } else if(expr instanceof Expr.Member) {
            return visitMember((Expr.Member) expr);
        } else if(expr instanceof Expr.Index) {
            return visitIndex((Expr.Index) expr);
        } else if(expr instanceof Expr.Dereference) {
            return visitDereference((Expr.Dereference) expr);
        } else if(expr instanceof Expr.IntegerDereference) {
            return visitIntegerDereference((Expr.IntegerDereference) expr);
        } else if(expr instanceof Expr.AddressOf) {
            return visitAddressOf((Expr.AddressOf) expr);
        } else if(expr instanceof Expr.SideEffect) {
            return constructSideEffect((Expr.SideEffect) expr);
        } else if(expr instanceof Expr.DereferenceFailure) {
            return constructDereferenceFailure((Expr.DereferenceFailure) expr);
        } else if(expr instanceof Expr.ByteExtract) {
            return visitByteExtract((Expr.ByteExtract) expr);
        } else if(expr instanceof Expr.Constructor) {
            return visitConstructor((Expr.Constructor) expr);
        } else if(expr instanceof Expr.If) {
            return visitIf((Expr.If) expr);
        } else if(expr instanceof Expr.Cond) {
            return visitCond((Expr.Cond) expr);
        } else if(expr instanceof Expr.Equals) {
            return visitEquals((Expr.Equals) expr);
        } else if(expr instanceof Expr.Operator) {
            return visitOperator((Expr.Operator) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    protected E visitMember(Expr.Member expr) {
        E compound = visitExpression(expr.getCompound());
        return constructMember(expr, compound);
    }

    protected E visitIndex(Expr.Index expr) {
        E array = visitExpression(expr.getArray());
        E index = visitExpression(expr.getIndex());
        return constructIndex(expr, array, index);
    }

    protected E visitDereference(Expr.Dereference expr) {
        E pointer = visitExpression(expr.getPointer());
        return constructDereference(expr, pointer);
    }

    protected E visitIntegerDereference(Expr.IntegerDereference expr) {
        E address = visitExpression(expr.getAddress());
        return constructIntegerDereference(expr, address);
    }

    protected E visitAddressOf(Expr.AddressOf expr) {
        E object = visitExpression(expr.getObject());
        return constructAddressOf(expr, object);
    }

    protected E visitByteExtract(Expr.ByteExtract expr) {
        E operand = visitExpression(expr.getOperand());
        E offset = visitExpression(expr.getOffset());
        return constructByteExtract(expr, operand, offset);
    }

    protected E visitConstructor(Expr.Constructor expr) {
        List<E> operands = visitExpressions(expr.getOperands());
        return constructConstructor(expr, operands);
    }

    protected E visitIf(Expr.If expr) {
        E condition = visitExpression(expr.getCondition());
        E trueBranch = visitExpression(expr.getTrueBranch());
        E falseBranch = visitExpression(expr.getFalseBranch());
        return constructIf(expr, condition, trueBranch, falseBranch);
    }

    protected E visitCond(Expr.Cond expr) {
        List<E> operands = visitExpressions(expr.getOperands());
        return constructCond(expr, operands);
    }

    protected E visitEquals(Expr.Equals expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructEquals(expr, lhs, rhs);
    }

    protected E visitOperator(Expr.Operator expr) {
        List<E> operands = visitExpressions(expr.getOperands());
        return constructOperator(expr, operands);
    }

    protected abstract E constructSymbol(Expr.Symbol expr);

    protected abstract E constructConstant(Expr.Constant expr);

    protected abstract E constructSideEffect(Expr.SideEffect expr);

    protected abstract E constructDereferenceFailure(Expr.DereferenceFailure expr);

    protected abstract E constructMember(Expr.Member expr, E compound);

    protected abstract E constructIndex(Expr.Index expr, E array, E index);

    protected abstract E constructDereference(Expr.Dereference expr, E pointer);

    protected abstract E constructIntegerDereference(Expr.IntegerDereference expr, E address);

    protected abstract E constructAddressOf(Expr.AddressOf expr, E object);

    protected abstract E constructByteExtract(Expr.ByteExtract expr, E operand, E offset);

    protected abstract E constructConstructor(Expr.Constructor expr, List<E> operands);

    protected abstract E constructIf(Expr.If expr, E condition, E trueBranch, E falseBranch);

    protected abstract E constructCond(Expr.Cond expr, List<E> operands);

    protected abstract E constructEquals(Expr.Equals expr, E lhs, E rhs);

    protected abstract E constructOperator(Expr.Operator expr, List<E> operands);
}
