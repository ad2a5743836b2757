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
package pathsymex.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.List;

import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;
import pathsymex.core.VariableInfo;
import pathsymex.core.VariableRegistry;

public class SyntaxPrinter {
	private final PrintWriter out;

	public SyntaxPrinter(OutputStream output) {
		this.out = new PrintWriter(output);
	}

	public void flush() {
		out.flush();
	}

	/**
	 * Write out the variables of a given registry, one per line, in the order
	 * they were numbered.
	 *
	 * @param registry
	 */
	public void write(VariableRegistry registry) {
		for (VariableInfo info : registry.getVariables()) {
			out.print("#");
			out.print(info.getNumber());
			out.print(" ");
			out.print(info.getKind());
			out.print(" ");
			out.print(info.getFullIdentifier());
			out.print(" : ");
			writeType(info.getOriginal().getType());
			out.print(" ssa=");
			out.print(info.getSsaCounter());
			out.print(" original=");
			writeExpression(info.getOriginal());
			out.println();
		}
		out.flush();
	}

	public void write(Expr e) {
		writeExpression(e);
		out.flush();
	}

	public void write(Type t) {
		writeType(t);
		out.flush();
	}

	private void writeType(Type t) {
		if (t instanceof Type.Bool) {
			out.print("bool");
		} else if (t instanceof Type.Int) {
			out.print("int");
		} else if (t instanceof Type.Empty) {
			out.print("void");
		} else if (t instanceof Type.SignedBv) {
			out.print("signedbv[" + ((Type.BitVector) t).getWidth() + "]");
		} else if (t instanceof Type.UnsignedBv) {
			out.print("unsignedbv[" + ((Type.BitVector) t).getWidth() + "]");
		} else if (t instanceof Type.Pointer) {
			writeType(((Type.Pointer) t).getTarget());
			out.print("*");
		} else if (t instanceof Type.Code) {
			Type.Code c = (Type.Code) t;
			out.print("code(");
			writeTypes(c.getParameters());
			out.print(") -> ");
			writeType(c.getReturns());
		} else if (t instanceof Type.MathematicalFunction) {
			Type.MathematicalFunction f = (Type.MathematicalFunction) t;
			out.print("mathematical_function(");
			writeTypes(f.getDomain());
			out.print(") -> ");
			writeType(f.getCodomain());
		} else if (t instanceof Type.Compound) {
			out.print(t instanceof Type.Struct ? "struct {" : "union {");
			for (Type.Component c : ((Type.Compound) t).getComponents()) {
				out.print(" ");
				writeType(c.getType());
				out.print(" " + c.getName() + ";");
			}
			out.print(" }");
		} else if (t instanceof Type.Sequence) {
			Type.Sequence s = (Type.Sequence) t;
			if (t instanceof Type.Vector) {
				out.print("vector ");
			}
			writeType(s.getElement());
			out.print("[");
			if (s.getSize() != null) {
				writeExpression(s.getSize());
			}
			out.print("]");
		} else if (t instanceof Type.Tag) {
			out.print("tag " + ((Type.Tag) t).getName());
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	private void writeTypes(List<Type> types) {
		for (int i = 0; i != types.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeType(types.get(i));
		}
	}

	private void writeExpressionWithBraces(Expr e) {
		if (e instanceof Expr.Operator || e instanceof Expr.Equals || e instanceof Expr.If) {
			out.print("(");
			writeExpression(e);
			out.print(")");
		} else {
			writeExpression(e);
		}
	}

	private void writeExpression(Expr e) {
		if (e instanceof Expr.Symbol) {
			out.print(((Expr.Symbol) e).getIdentifier());
		} else if (e instanceof Expr.Constant) {
			writeConstant((Expr.Constant) e);
		} else if (e instanceof Expr.Member) {
			Expr.Member m = (Expr.Member) e;
			writeExpressionWithBraces(m.getCompound());
			out.print("." + m.getField());
		} else if (e instanceof Expr.Index) {
			Expr.Index i = (Expr.Index) e;
			writeExpressionWithBraces(i.getArray());
			out.print("[");
			writeExpression(i.getIndex());
			out.print("]");
		} else if (e instanceof Expr.Dereference) {
			out.print("*");
			writeExpressionWithBraces(((Expr.Dereference) e).getPointer());
		} else if (e instanceof Expr.IntegerDereference) {
			out.print("integer_dereference(");
			writeExpression(((Expr.IntegerDereference) e).getAddress());
			out.print(")");
		} else if (e instanceof Expr.AddressOf) {
			out.print("&");
			writeExpressionWithBraces(((Expr.AddressOf) e).getObject());
		} else if (e instanceof Expr.SideEffect) {
			out.print(((Expr.SideEffect) e).getStatement() + "()");
		} else if (e instanceof Expr.DereferenceFailure) {
			out.print("dereference_failure");
		} else if (e instanceof Expr.ByteExtract) {
			Expr.ByteExtract b = (Expr.ByteExtract) e;
			out.print(b.isBigEndian() ? "byte_extract_big_endian(" : "byte_extract_little_endian(");
			writeExpressions(e.getOperands(), ", ");
			out.print(")");
		} else if (e instanceof Expr.Constructor) {
			out.print("{ ");
			writeExpressions(e.getOperands(), ", ");
			out.print(" }");
		} else if (e instanceof Expr.If) {
			Expr.If i = (Expr.If) e;
			writeExpressionWithBraces(i.getCondition());
			out.print(" ? ");
			writeExpressionWithBraces(i.getTrueBranch());
			out.print(" : ");
			writeExpressionWithBraces(i.getFalseBranch());
		} else if (e instanceof Expr.Cond) {
			writeCond((Expr.Cond) e);
		} else if (e instanceof Expr.Equals) {
			Expr.Equals eq = (Expr.Equals) e;
			writeExpressionWithBraces(eq.getLeftHandSide());
			out.print(" == ");
			writeExpressionWithBraces(eq.getRightHandSide());
		} else if (e instanceof Expr.Operator) {
			writeOperator((Expr.Operator) e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeConstant(Expr.Constant e) {
		if (e.getType() instanceof Type.Bool) {
			out.print(e.isTrue() ? "true" : "false");
		} else if (e.getType() instanceof Type.Pointer && e.getValue().signum() == 0) {
			out.print("NULL");
		} else {
			out.print(e.getValue());
		}
	}

	private void writeCond(Expr.Cond e) {
		out.print("cond(");
		for (int i = 0; i != e.getCaseCount(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpressionWithBraces(e.getGuard(i));
			out.print(" -> ");
			writeExpressionWithBraces(e.getValue(i));
		}
		out.print(")");
	}

	private void writeOperator(Expr.Operator e) {
		Expr.Opcode opcode = e.getOpcode();
		Expr operand = e.getOperands().get(0);
		switch (opcode) {
		case TYPECAST:
			out.print("(");
			writeType(e.getType());
			out.print(") ");
			writeExpressionWithBraces(operand);
			break;
		case ARRAY_OF:
			out.print("array_of(");
			writeExpression(operand);
			out.print(")");
			break;
		case NEG:
		case NOT:
			out.print(opcode.getSymbol());
			writeExpressionWithBraces(operand);
			break;
		default:
			List<Expr> operands = e.getOperands();
			for (int i = 0; i != operands.size(); ++i) {
				if (i != 0) {
					out.print(" " + opcode.getSymbol() + " ");
				}
				writeExpressionWithBraces(operands.get(i));
			}
		}
	}

	private void writeExpressions(List<Expr> exprs, String separator) {
		for (int i = 0; i != exprs.size(); ++i) {
			if (i != 0) {
				out.print(separator);
			}
			writeExpression(exprs.get(i));
		}
	}

	public static String toString(Expr expr) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		SyntaxPrinter p = new SyntaxPrinter(buf);
		p.write(expr);
		return buf.toString();
	}

	public static String toString(Type type) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		SyntaxPrinter p = new SyntaxPrinter(buf);
		p.write(type);
		return buf.toString();
	}

	public static String toString(VariableRegistry registry) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		SyntaxPrinter p = new SyntaxPrinter(buf);
		p.write(registry);
		return buf.toString();
	}
}
