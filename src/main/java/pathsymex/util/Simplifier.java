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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import pathsymex.core.Namespace;
import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;

/**
 * A simple bottom-up simplifier. This folds constants, resolves accesses into
 * constructors and prunes conditionals whose guards are known. It never
 * changes the value of an expression.
 */
public class Simplifier extends AbstractExpressionTransform {
	private final Namespace ns;

	public Simplifier(Namespace ns) {
		this.ns = ns;
	}

	public Expr simplify(Expr expr) {
		return visitExpression(expr);
	}

	@Override
	protected Expr constructMember(Expr.Member expr, Expr compound) {
		if (compound instanceof Expr.StructConstructor) {
			Type type = ns.follow(compound.getType());
			if (type instanceof Type.Struct) {
				int i = ((Type.Struct) type).indexOf(expr.getField());
				if (i >= 0 && i < compound.getOperands().size()) {
					return compound.getOperands().get(i);
				}
			}
		}
		return super.constructMember(expr, compound);
	}

	@Override
	protected Expr constructIndex(Expr.Index expr, Expr array, Expr index) {
		if (array instanceof Expr.Operator && ((Expr.Operator) array).getOpcode() == Expr.Opcode.ARRAY_OF) {
			return array.getOperands().get(0);
		} else if (index instanceof Expr.Constant
				&& (array instanceof Expr.ArrayConstructor || array instanceof Expr.VectorConstructor)) {
			BigInteger i = ((Expr.Constant) index).getValue();
			List<Expr> elements = array.getOperands();
			if (i.signum() >= 0 && i.compareTo(BigInteger.valueOf(elements.size())) < 0) {
				return elements.get(i.intValue());
			}
		}
		return super.constructIndex(expr, array, index);
	}

	@Override
	protected Expr constructDereference(Expr.Dereference expr, Expr pointer) {
		if (pointer instanceof Expr.AddressOf) {
			return ((Expr.AddressOf) pointer).getObject();
		}
		return super.constructDereference(expr, pointer);
	}

	@Override
	protected Expr constructAddressOf(Expr.AddressOf expr, Expr object) {
		if (object instanceof Expr.Dereference) {
			return ((Expr.Dereference) object).getPointer();
		}
		return super.constructAddressOf(expr, object);
	}

	@Override
	protected Expr constructIf(Expr.If expr, Expr condition, Expr trueBranch, Expr falseBranch) {
		if (isTrue(condition) || trueBranch.equals(falseBranch)) {
			return trueBranch;
		} else if (isFalse(condition)) {
			return falseBranch;
		}
		return super.constructIf(expr, condition, trueBranch, falseBranch);
	}

	@Override
	protected Expr constructCond(Expr.Cond expr, List<Expr> operands) {
		List<Expr> cases = new ArrayList<>();
		for (int i = 0; i < operands.size(); i += 2) {
			Expr guard = operands.get(i);
			Expr value = operands.get(i + 1);
			if (isFalse(guard)) {
				continue;
			} else if (isTrue(guard) && cases.isEmpty()) {
				return value;
			}
			cases.add(guard);
			cases.add(value);
			if (isTrue(guard)) {
				// later cases are unreachable
				break;
			}
		}
		if (cases.isEmpty()) {
			return expr.withOperands(operands);
		}
		boolean uniform = true;
		for (int i = 3; i < cases.size() && uniform; i += 2) {
			uniform = cases.get(i).equals(cases.get(1));
		}
		if (uniform) {
			return cases.get(1);
		}
		return expr.withOperands(cases);
	}

	@Override
	protected Expr constructEquals(Expr.Equals expr, Expr lhs, Expr rhs) {
		if (lhs instanceof Expr.Constant && rhs instanceof Expr.Constant) {
			return CONST(((Expr.Constant) lhs).getValue().equals(((Expr.Constant) rhs).getValue()));
		} else if (lhs.equals(rhs)) {
			return CONST(true);
		}
		return super.constructEquals(expr, lhs, rhs);
	}

	@Override
	protected Expr constructOperator(Expr.Operator expr, List<Expr> operands) {
		switch (expr.getOpcode()) {
		case NOT:
			return simplifyNot(expr, operands);
		case AND:
		case OR:
			return simplifyLogical(expr, operands);
		case TYPECAST:
			return simplifyTypeCast(expr, operands);
		case ARRAY_OF:
			return super.constructOperator(expr, operands);
		default:
			return simplifyArithmetic(expr, operands);
		}
	}

	private Expr simplifyNot(Expr.Operator expr, List<Expr> operands) {
		Expr operand = operands.get(0);
		if (operand instanceof Expr.Constant) {
			return CONST(isFalse(operand));
		} else if (operand instanceof Expr.Operator && ((Expr.Operator) operand).getOpcode() == Expr.Opcode.NOT) {
			return operand.getOperands().get(0);
		}
		return super.constructOperator(expr, operands);
	}

	private Expr simplifyLogical(Expr.Operator expr, List<Expr> operands) {
		boolean and = expr.getOpcode() == Expr.Opcode.AND;
		List<Expr> remaining = new ArrayList<>();
		for (Expr operand : operands) {
			if (and ? isFalse(operand) : isTrue(operand)) {
				return CONST(!and);
			} else if (!(and ? isTrue(operand) : isFalse(operand))) {
				remaining.add(operand);
			}
		}
		if (remaining.isEmpty()) {
			return CONST(and);
		} else if (remaining.size() == 1) {
			return remaining.get(0);
		} else if (remaining.size() == operands.size()) {
			return super.constructOperator(expr, operands);
		}
		return expr.withOperands(remaining);
	}

	private Expr simplifyTypeCast(Expr.Operator expr, List<Expr> operands) {
		Expr operand = operands.get(0);
		Type target = ns.follow(expr.getType());
		if (ns.follow(operand.getType()).equals(target)) {
			return operand;
		} else if (operand instanceof Expr.Constant) {
			BigInteger value = ((Expr.Constant) operand).getValue();
			if (target instanceof Type.Bool) {
				return CONST(value.signum() != 0);
			} else if (target instanceof Type.BitVector || target instanceof Type.Int) {
				return CONST(normalise(value, target), expr.getType());
			} else if (target instanceof Type.Pointer && value.signum() == 0) {
				return CONST(BigInteger.ZERO, expr.getType());
			}
		}
		return super.constructOperator(expr, operands);
	}

	private Expr simplifyArithmetic(Expr.Operator expr, List<Expr> operands) {
		for (Expr operand : operands) {
			if (!(operand instanceof Expr.Constant)) {
				return super.constructOperator(expr, operands);
			}
		}
		BigInteger lhs = ((Expr.Constant) operands.get(0)).getValue();
		Type type = ns.follow(expr.getType());
		switch (expr.getOpcode()) {
		case NEG:
			return CONST(normalise(lhs.negate(), type), expr.getType());
		case ADD:
		case SUB:
		case MUL:
		case DIV:
		case MOD: {
			BigInteger result = lhs;
			for (int i = 1; i != operands.size(); ++i) {
				BigInteger rhs = ((Expr.Constant) operands.get(i)).getValue();
				result = apply(expr.getOpcode(), result, rhs);
				if (result == null) {
					return super.constructOperator(expr, operands);
				}
			}
			return CONST(normalise(result, type), expr.getType());
		}
		default: {
			if (operands.size() != 2) {
				return super.constructOperator(expr, operands);
			}
			int c = lhs.compareTo(((Expr.Constant) operands.get(1)).getValue());
			return CONST(compare(expr.getOpcode(), c));
		}
		}
	}

	private static BigInteger apply(Expr.Opcode opcode, BigInteger lhs, BigInteger rhs) {
		switch (opcode) {
		case ADD:
			return lhs.add(rhs);
		case SUB:
			return lhs.subtract(rhs);
		case MUL:
			return lhs.multiply(rhs);
		case DIV:
			return rhs.signum() == 0 ? null : lhs.divide(rhs);
		default:
			return rhs.signum() == 0 ? null : lhs.remainder(rhs);
		}
	}

	private static boolean compare(Expr.Opcode opcode, int c) {
		switch (opcode) {
		case NOTEQUAL:
			return c != 0;
		case LT:
			return c < 0;
		case LTEQ:
			return c <= 0;
		case GT:
			return c > 0;
		case GTEQ:
			return c >= 0;
		default:
			throw new IllegalArgumentException("unknown comparator encountered (" + opcode + ")");
		}
	}

	/**
	 * Wrap a given value into the range of a given bit-vector type. Values of
	 * other types are left alone.
	 *
	 * @param value
	 * @param type
	 * @return
	 */
	private static BigInteger normalise(BigInteger value, Type type) {
		if (!(type instanceof Type.BitVector)) {
			return value;
		}
		Type.BitVector bv = (Type.BitVector) type;
		BigInteger modulus = BigInteger.ONE.shiftLeft(bv.getWidth());
		BigInteger result = value.mod(modulus);
		if (bv.isSigned() && result.testBit(bv.getWidth() - 1)) {
			result = result.subtract(modulus);
		}
		return result;
	}

	private static boolean isTrue(Expr expr) {
		return expr instanceof Expr.Constant && ((Expr.Constant) expr).isTrue();
	}

	private static boolean isFalse(Expr expr) {
		return expr instanceof Expr.Constant && ((Expr.Constant) expr).isFalse();
	}
}
