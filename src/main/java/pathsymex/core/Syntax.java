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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import pathsymex.io.SyntaxPrinter;

/**
 * The types and expressions manipulated by the symbolic executor. Expressions
 * are immutable trees; rewriting a node means constructing a fresh node (see
 * {@link Expr#withOperands(List)}) whilst leaving the original intact.
 */
public class Syntax {

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		public boolean isFalse() {
			return (this instanceof Expr.Constant) && ((Expr.Constant) this).isFalse();
		}

		public boolean isTrue() {
			return (this instanceof Expr.Constant) && ((Expr.Constant) this).isTrue();
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int();
		public static final Type Empty = new Empty();

		public static class Bool extends AbstractItem implements Type {
			public Bool(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Bool;
			}

			@Override
			public int hashCode() {
				return 1;
			}
		}

		/**
		 * Unbounded mathematical integers.
		 */
		public static class Int extends AbstractItem implements Type {
			public Int(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Int;
			}

			@Override
			public int hashCode() {
				return 2;
			}
		}

		/**
		 * The type of expressions which produce no value (e.g. <code>void</code>).
		 */
		public static class Empty extends AbstractItem implements Type {
			public Empty(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Empty;
			}

			@Override
			public int hashCode() {
				return 3;
			}
		}

		public static abstract class BitVector extends AbstractItem implements Type {
			private final int width;

			public BitVector(int width, Attribute... attributes) {
				super(attributes);
				Preconditions.checkArgument(width > 0, "invalid bit-vector width %s", width);
				this.width = width;
			}

			public int getWidth() {
				return width;
			}

			public abstract boolean isSigned();

			@Override
			public boolean equals(Object o) {
				return o != null && o.getClass() == getClass() && ((BitVector) o).width == width;
			}

			@Override
			public int hashCode() {
				return getClass().hashCode() ^ width;
			}
		}

		public static class SignedBv extends BitVector {
			public SignedBv(int width, Attribute... attributes) {
				super(width, attributes);
			}

			@Override
			public boolean isSigned() {
				return true;
			}
		}

		public static class UnsignedBv extends BitVector {
			public UnsignedBv(int width, Attribute... attributes) {
				super(width, attributes);
			}

			@Override
			public boolean isSigned() {
				return false;
			}
		}

		public static class Pointer extends AbstractItem implements Type {
			private final Type target;

			public Pointer(Type target, Attribute... attributes) {
				super(attributes);
				this.target = Objects.requireNonNull(target);
			}

			public Type getTarget() {
				return target;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Pointer && ((Pointer) o).target.equals(target);
			}

			@Override
			public int hashCode() {
				return 31 * target.hashCode() + 4;
			}
		}

		/**
		 * The type of executable code, such as the symbol naming a procedure.
		 */
		public static class Code extends AbstractItem implements Type {
			private final List<Type> parameters;
			private final Type returns;

			public Code(List<Type> parameters, Type returns, Attribute... attributes) {
				super(attributes);
				this.parameters = ImmutableList.copyOf(parameters);
				this.returns = Objects.requireNonNull(returns);
			}

			public List<Type> getParameters() {
				return parameters;
			}

			public Type getReturns() {
				return returns;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Code) {
					Code c = (Code) o;
					return c.parameters.equals(parameters) && c.returns.equals(returns);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(parameters, returns, 5);
			}
		}

		public static class MathematicalFunction extends AbstractItem implements Type {
			private final List<Type> domain;
			private final Type codomain;

			public MathematicalFunction(List<Type> domain, Type codomain, Attribute... attributes) {
				super(attributes);
				this.domain = ImmutableList.copyOf(domain);
				this.codomain = Objects.requireNonNull(codomain);
			}

			public List<Type> getDomain() {
				return domain;
			}

			public Type getCodomain() {
				return codomain;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof MathematicalFunction) {
					MathematicalFunction f = (MathematicalFunction) o;
					return f.domain.equals(domain) && f.codomain.equals(codomain);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(domain, codomain, 6);
			}
		}

		/**
		 * A named field within a record or union.
		 */
		public static class Component {
			private final String name;
			private final Type type;

			public Component(String name, Type type) {
				this.name = Objects.requireNonNull(name);
				this.type = Objects.requireNonNull(type);
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Component) {
					Component c = (Component) o;
					return c.name.equals(name) && c.type.equals(type);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ type.hashCode();
			}
		}

		public static abstract class Compound extends AbstractItem implements Type {
			private final List<Component> components;

			public Compound(List<Component> components, Attribute... attributes) {
				super(attributes);
				this.components = ImmutableList.copyOf(components);
			}

			public List<Component> getComponents() {
				return components;
			}

			/**
			 * Determine the position of a given component, or <code>-1</code> if no
			 * such component exists.
			 *
			 * @param name
			 * @return
			 */
			public int indexOf(String name) {
				for (int i = 0; i != components.size(); ++i) {
					if (components.get(i).getName().equals(name)) {
						return i;
					}
				}
				return -1;
			}

			@Override
			public boolean equals(Object o) {
				return o != null && o.getClass() == getClass() && ((Compound) o).components.equals(components);
			}

			@Override
			public int hashCode() {
				return getClass().hashCode() ^ components.hashCode();
			}
		}

		public static class Struct extends Compound {
			public Struct(List<Component> components, Attribute... attributes) {
				super(components, attributes);
			}
		}

		public static class Union extends Compound {
			public Union(List<Component> components, Attribute... attributes) {
				super(components, attributes);
			}
		}

		public static abstract class Sequence extends AbstractItem implements Type {
			private final Type element;
			private final Expr size;

			public Sequence(Type element, Expr size, Attribute... attributes) {
				super(attributes);
				this.element = Objects.requireNonNull(element);
				this.size = size;
			}

			public Type getElement() {
				return element;
			}

			/**
			 * Get the declared size of this sequence, or <code>null</code> if none was
			 * declared.
			 *
			 * @return
			 */
			public Expr getSize() {
				return size;
			}

			@Override
			public boolean equals(Object o) {
				if (o != null && o.getClass() == getClass()) {
					Sequence s = (Sequence) o;
					return s.element.equals(element) && Objects.equals(s.size, size);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return getClass().hashCode() ^ Objects.hash(element, size);
			}
		}

		public static class Array extends Sequence {
			public Array(Type element, Expr size, Attribute... attributes) {
				super(element, size, attributes);
			}
		}

		public static class Vector extends Sequence {
			public Vector(Type element, Expr size, Attribute... attributes) {
				super(element, size, attributes);
				Objects.requireNonNull(size);
			}
		}

		/**
		 * A reference to a named type, which must be resolved through the
		 * {@link Namespace}.
		 */
		public static class Tag extends AbstractItem implements Type {
			private final String name;

			public Tag(String name, Attribute... attributes) {
				super(attributes);
				this.name = Objects.requireNonNull(name);
			}

			public String getName() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Tag && ((Tag) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public Type getType();

		/**
		 * Get the immediate children of this expression, in a fixed order.
		 *
		 * @return
		 */
		public List<Expr> getOperands();

		/**
		 * Construct an expression identical to this one, except that its children
		 * are replaced by those given. When every given operand is the same object
		 * as the current one, this expression itself is returned.
		 *
		 * @param operands
		 * @return
		 */
		public Expr withOperands(List<Expr> operands);

		/**
		 * Marker for the record, array and vector constructors.
		 */
		public interface Constructor extends Expr {

		}

		public static abstract class AbstractExpr extends AbstractItem implements Expr {
			private final Type type;
			private final List<Expr> operands;
			private int hash;

			public AbstractExpr(Type type, List<Expr> operands, Attribute[] attributes) {
				super(attributes);
				this.type = Objects.requireNonNull(type);
				this.operands = ImmutableList.copyOf(operands);
			}

			@Override
			public Type getType() {
				return type;
			}

			@Override
			public List<Expr> getOperands() {
				return operands;
			}

			@Override
			public Expr withOperands(List<Expr> nOperands) {
				Preconditions.checkArgument(acceptsArity(nOperands.size()), "invalid operand count %s for %s",
						nOperands.size(), getClass().getSimpleName());
				if (nOperands.size() == operands.size()) {
					boolean same = true;
					for (int i = 0; i != operands.size() && same; ++i) {
						same = operands.get(i) == nOperands.get(i);
					}
					if (same) {
						return this;
					}
				}
				return construct(nOperands);
			}

			protected boolean acceptsArity(int n) {
				return n == operands.size();
			}

			protected abstract Expr construct(List<Expr> operands);

			protected boolean sameFields(AbstractExpr other) {
				return true;
			}

			protected int fieldsHash() {
				return 0;
			}

			@Override
			public boolean equals(Object o) {
				if (this == o) {
					return true;
				} else if (o == null || o.getClass() != getClass()) {
					return false;
				}
				AbstractExpr e = (AbstractExpr) o;
				return sameFields(e) && type.equals(e.type) && operands.equals(e.operands);
			}

			@Override
			public int hashCode() {
				if (hash == 0) {
					hash = Objects.hash(getClass().getSimpleName(), type, operands) ^ fieldsHash();
				}
				return hash;
			}

			@Override
			public String toString() {
				return SyntaxPrinter.toString(this);
			}
		}

		/**
		 * A named variable. Symbols tagged as SSA carry a version in their
		 * identifier (e.g. <code>x.f#2</code>) and refer to a specific assignment,
		 * whereas untagged symbols refer to mutable program state.
		 */
		public static class Symbol extends AbstractExpr {
			private final String identifier;
			private final boolean ssa;
			private final String fullIdentifier;

			private Symbol(String identifier, Type type, boolean ssa, String fullIdentifier, Attribute[] attributes) {
				super(type, ImmutableList.of(), attributes);
				this.identifier = Objects.requireNonNull(identifier);
				this.ssa = ssa;
				this.fullIdentifier = fullIdentifier;
			}

			public String getIdentifier() {
				return identifier;
			}

			public boolean isSsa() {
				return ssa;
			}

			/**
			 * Get the identifier of the access path this SSA symbol is a version of.
			 * For symbols which are not SSA, this is simply the identifier.
			 *
			 * @return
			 */
			public String getFullIdentifier() {
				return fullIdentifier == null ? identifier : fullIdentifier;
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return this;
			}

			@Override
			protected boolean sameFields(AbstractExpr other) {
				Symbol s = (Symbol) other;
				return s.identifier.equals(identifier) && s.ssa == ssa;
			}

			@Override
			protected int fieldsHash() {
				return identifier.hashCode() + (ssa ? 1 : 0);
			}
		}

		public static class Member extends AbstractExpr {
			private final String field;

			private Member(Expr compound, String field, Type type, Attribute[] attributes) {
				super(type, ImmutableList.of(compound), attributes);
				this.field = Objects.requireNonNull(field);
			}

			public Expr getCompound() {
				return getOperands().get(0);
			}

			public String getField() {
				return field;
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new Member(operands.get(0), field, getType(), getAttributes());
			}

			@Override
			protected boolean sameFields(AbstractExpr other) {
				return ((Member) other).field.equals(field);
			}

			@Override
			protected int fieldsHash() {
				return field.hashCode();
			}
		}

		public static class Index extends AbstractExpr {
			private Index(Expr array, Expr index, Type type, Attribute[] attributes) {
				super(type, ImmutableList.of(array, index), attributes);
			}

			public Expr getArray() {
				return getOperands().get(0);
			}

			public Expr getIndex() {
				return getOperands().get(1);
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new Index(operands.get(0), operands.get(1), getType(), getAttributes());
			}
		}

		public static class Dereference extends AbstractExpr {
			private Dereference(Expr pointer, Type type, Attribute[] attributes) {
				super(type, ImmutableList.of(pointer), attributes);
			}

			public Expr getPointer() {
				return getOperands().get(0);
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new Dereference(operands.get(0), getType(), getAttributes());
			}
		}

		/**
		 * A dereference of a plain integer address, such as <code>*(int*)123</code>.
		 * These are produced by pointer resolution and cannot be resolved any
		 * further without a memory model.
		 */
		public static class IntegerDereference extends AbstractExpr {
			private IntegerDereference(Expr address, Type type, Attribute[] attributes) {
				super(type, ImmutableList.of(address), attributes);
			}

			public Expr getAddress() {
				return getOperands().get(0);
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new IntegerDereference(operands.get(0), getType(), getAttributes());
			}
		}

		public static class AddressOf extends AbstractExpr {
			private AddressOf(Expr object, Type type, Attribute[] attributes) {
				super(type, ImmutableList.of(object), attributes);
			}

			public Expr getObject() {
				return getOperands().get(0);
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new AddressOf(operands.get(0), getType(), getAttributes());
			}
		}

		public static class SideEffect extends AbstractExpr {
			public static final String NONDET = "nondet";

			private final String statement;

			private SideEffect(String statement, Type type, Attribute[] attributes) {
				super(type, ImmutableList.of(), attributes);
				this.statement = Objects.requireNonNull(statement);
			}

			public String getStatement() {
				return statement;
			}

			public boolean isNondet() {
				return statement.equals(NONDET);
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return this;
			}

			@Override
			protected boolean sameFields(AbstractExpr other) {
				return ((SideEffect) other).statement.equals(statement);
			}

			@Override
			protected int fieldsHash() {
				return statement.hashCode();
			}
		}

		/**
		 * Marks an access which was previously determined to be invalid (e.g. a
		 * dereference of a null pointer).
		 */
		public static class DereferenceFailure extends AbstractExpr {
			private DereferenceFailure(Type type, Attribute[] attributes) {
				super(type, ImmutableList.of(), attributes);
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return this;
			}
		}

		public static class ByteExtract extends AbstractExpr {
			private final boolean bigEndian;

			private ByteExtract(Expr operand, Expr offset, boolean bigEndian, Type type, Attribute[] attributes) {
				super(type, ImmutableList.of(operand, offset), attributes);
				this.bigEndian = bigEndian;
			}

			public Expr getOperand() {
				return getOperands().get(0);
			}

			public Expr getOffset() {
				return getOperands().get(1);
			}

			public boolean isBigEndian() {
				return bigEndian;
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new ByteExtract(operands.get(0), operands.get(1), bigEndian, getType(), getAttributes());
			}

			@Override
			protected boolean sameFields(AbstractExpr other) {
				return ((ByteExtract) other).bigEndian == bigEndian;
			}

			@Override
			protected int fieldsHash() {
				return bigEndian ? 1 : 0;
			}
		}

		public static class StructConstructor extends AbstractExpr implements Constructor {
			private StructConstructor(Type type, List<Expr> operands, Attribute[] attributes) {
				super(type, operands, attributes);
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new StructConstructor(getType(), operands, getAttributes());
			}
		}

		public static class ArrayConstructor extends AbstractExpr implements Constructor {
			private ArrayConstructor(Type type, List<Expr> operands, Attribute[] attributes) {
				super(type, operands, attributes);
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new ArrayConstructor(getType(), operands, getAttributes());
			}
		}

		public static class VectorConstructor extends AbstractExpr implements Constructor {
			private VectorConstructor(Type type, List<Expr> operands, Attribute[] attributes) {
				super(type, operands, attributes);
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new VectorConstructor(getType(), operands, getAttributes());
			}
		}

		public static class If extends AbstractExpr {
			private If(Expr condition, Expr trueBranch, Expr falseBranch, Type type, Attribute[] attributes) {
				super(type, ImmutableList.of(condition, trueBranch, falseBranch), attributes);
			}

			public Expr getCondition() {
				return getOperands().get(0);
			}

			public Expr getTrueBranch() {
				return getOperands().get(1);
			}

			public Expr getFalseBranch() {
				return getOperands().get(2);
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new If(operands.get(0), operands.get(1), operands.get(2), getType(), getAttributes());
			}
		}

		/**
		 * A flat multi-way conditional made of guard/value pairs. Its operands
		 * alternate between guards and values, i.e.
		 * <code>g<sub>0</sub>, v<sub>0</sub>, g<sub>1</sub>, v<sub>1</sub>,
		 * ...</code>. The value of the first case whose guard holds is the value of
		 * the whole conditional.
		 */
		public static class Cond extends AbstractExpr {
			private Cond(Type type, List<Expr> operands, Attribute[] attributes) {
				super(type, operands, attributes);
				Preconditions.checkArgument(operands.size() % 2 == 0, "unbalanced conditional cases");
			}

			public int getCaseCount() {
				return getOperands().size() / 2;
			}

			public Expr getGuard(int i) {
				return getOperands().get(i * 2);
			}

			public Expr getValue(int i) {
				return getOperands().get((i * 2) + 1);
			}

			@Override
			protected boolean acceptsArity(int n) {
				return n % 2 == 0;
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new Cond(getType(), operands, getAttributes());
			}
		}

		public static class Equals extends AbstractExpr {
			private Equals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(Type.Bool, ImmutableList.of(lhs, rhs), attributes);
			}

			public Expr getLeftHandSide() {
				return getOperands().get(0);
			}

			public Expr getRightHandSide() {
				return getOperands().get(1);
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new Equals(operands.get(0), operands.get(1), getAttributes());
			}
		}

		/**
		 * A constant of boolean, integer, bit-vector or pointer type. Booleans are
		 * represented by <code>0</code> and <code>1</code>, whilst the only pointer
		 * constant is the null pointer (<code>0</code>).
		 */
		public static class Constant extends AbstractExpr {
			private final BigInteger value;

			private Constant(BigInteger value, Type type, Attribute[] attributes) {
				super(type, ImmutableList.of(), attributes);
				this.value = Objects.requireNonNull(value);
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			public boolean isTrue() {
				return getType() instanceof Type.Bool && value.signum() != 0;
			}

			@Override
			public boolean isFalse() {
				return getType() instanceof Type.Bool && value.signum() == 0;
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return this;
			}

			@Override
			protected boolean sameFields(AbstractExpr other) {
				return ((Constant) other).value.equals(value);
			}

			@Override
			protected int fieldsHash() {
				return value.hashCode();
			}
		}

		public enum Opcode {
			NEG("-"), NOT("!"), ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"), AND("&&"), OR("||"),
			NOTEQUAL("!="), LT("<"), LTEQ("<="), GT(">"), GTEQ(">="), TYPECAST("(cast)"), ARRAY_OF("array_of");

			private final String symbol;

			Opcode(String symbol) {
				this.symbol = symbol;
			}

			public String getSymbol() {
				return symbol;
			}

			public boolean isUnary() {
				return this == NEG || this == NOT || this == TYPECAST || this == ARRAY_OF;
			}
		}

		/**
		 * Any other operator which has no bearing on state reads beyond needing its
		 * operands to be read.
		 */
		public static class Operator extends AbstractExpr {
			private final Opcode opcode;

			private Operator(Opcode opcode, Type type, List<Expr> operands, Attribute[] attributes) {
				super(type, operands, attributes);
				this.opcode = Objects.requireNonNull(opcode);
				Preconditions.checkArgument(!opcode.isUnary() || operands.size() == 1, "%s is unary", opcode);
			}

			public Opcode getOpcode() {
				return opcode;
			}

			@Override
			protected boolean acceptsArity(int n) {
				return opcode.isUnary() ? n == 1 : n >= 1;
			}

			@Override
			protected Expr construct(List<Expr> operands) {
				return new Operator(opcode, getType(), operands, getAttributes());
			}

			@Override
			protected boolean sameFields(AbstractExpr other) {
				return ((Operator) other).opcode == opcode;
			}

			@Override
			protected int fieldsHash() {
				return opcode.hashCode();
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return kind.cast(o);
				} else {
					return null;
				}
			}
			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	// Types

	public static Type.SignedBv SIGNED(int width) {
		return new Type.SignedBv(width);
	}

	public static Type.UnsignedBv UNSIGNED(int width) {
		return new Type.UnsignedBv(width);
	}

	public static Type.Pointer POINTER(Type target) {
		return new Type.Pointer(target);
	}

	public static Type.Struct STRUCT_TYPE(Type.Component... components) {
		return new Type.Struct(Arrays.asList(components));
	}

	public static Type.Union UNION_TYPE(Type.Component... components) {
		return new Type.Union(Arrays.asList(components));
	}

	public static Type.Component COMPONENT(String name, Type type) {
		return new Type.Component(name, type);
	}

	public static Type.Array ARRAY_TYPE(Type element, Expr size) {
		return new Type.Array(element, size);
	}

	public static Type.Array ARRAY_TYPE(Type element, long size) {
		return new Type.Array(element, CONST(size, SIZE_TYPE));
	}

	public static Type.Vector VECTOR_TYPE(Type element, long size) {
		return new Type.Vector(element, CONST(size, SIZE_TYPE));
	}

	public static Type.Tag TAG(String name) {
		return new Type.Tag(name);
	}

	/**
	 * The type used for array sizes and synthesized array indices.
	 */
	public static final Type SIZE_TYPE = new Type.UnsignedBv(64);

	// Symbols and accesses

	public static Expr.Symbol SYMBOL(String identifier, Type type, Attribute... attributes) {
		return new Expr.Symbol(identifier, type, false, null, attributes);
	}

	public static Expr.Symbol SSA_SYMBOL(String identifier, String fullIdentifier, Type type, Attribute... attributes) {
		return new Expr.Symbol(identifier, type, true, fullIdentifier, attributes);
	}

	public static Expr.Member MEMBER(Expr compound, String field, Type type, Attribute... attributes) {
		return new Expr.Member(compound, field, type, attributes);
	}

	public static Expr.Index INDEX(Expr array, Expr index, Type type, Attribute... attributes) {
		return new Expr.Index(array, index, type, attributes);
	}

	public static Expr.Dereference DEREF(Expr pointer, Type type, Attribute... attributes) {
		return new Expr.Dereference(pointer, type, attributes);
	}

	public static Expr.IntegerDereference INTEGER_DEREF(Expr address, Type type, Attribute... attributes) {
		return new Expr.IntegerDereference(address, type, attributes);
	}

	public static Expr.AddressOf ADDRESS_OF(Expr object, Attribute... attributes) {
		return new Expr.AddressOf(object, new Type.Pointer(object.getType()), attributes);
	}

	public static Expr.SideEffect NONDET(Type type, Attribute... attributes) {
		return new Expr.SideEffect(Expr.SideEffect.NONDET, type, attributes);
	}

	public static Expr.SideEffect SIDE_EFFECT(String statement, Type type, Attribute... attributes) {
		return new Expr.SideEffect(statement, type, attributes);
	}

	public static Expr.DereferenceFailure DEREF_FAILURE(Type type, Attribute... attributes) {
		return new Expr.DereferenceFailure(type, attributes);
	}

	public static Expr.ByteExtract BYTE_EXTRACT(Expr operand, Expr offset, boolean bigEndian, Type type,
			Attribute... attributes) {
		return new Expr.ByteExtract(operand, offset, bigEndian, type, attributes);
	}

	// Constructors

	public static Expr.StructConstructor STRUCT(Type type, List<Expr> operands, Attribute... attributes) {
		return new Expr.StructConstructor(type, operands, attributes);
	}

	public static Expr.ArrayConstructor ARRAY(Type type, List<Expr> operands, Attribute... attributes) {
		return new Expr.ArrayConstructor(type, operands, attributes);
	}

	public static Expr.VectorConstructor VECTOR(Type type, List<Expr> operands, Attribute... attributes) {
		return new Expr.VectorConstructor(type, operands, attributes);
	}

	// Conditionals

	public static Expr.If IF(Expr condition, Expr trueBranch, Expr falseBranch, Attribute... attributes) {
		return new Expr.If(condition, trueBranch, falseBranch, trueBranch.getType(), attributes);
	}

	public static Expr.Cond COND(Type type, List<Expr> cases, Attribute... attributes) {
		return new Expr.Cond(type, cases, attributes);
	}

	public static Expr.Equals EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Equals(lhs, rhs, attributes);
	}

	// Constants

	public static Expr.Constant CONST(boolean b, Attribute... attributes) {
		return new Expr.Constant(b ? BigInteger.ONE : BigInteger.ZERO, Type.Bool, attributes);
	}

	public static Expr.Constant CONST(long i, Type type, Attribute... attributes) {
		return new Expr.Constant(BigInteger.valueOf(i), type, attributes);
	}

	public static Expr.Constant CONST(BigInteger i, Type type, Attribute... attributes) {
		return new Expr.Constant(i, type, attributes);
	}

	public static Expr.Constant NULL(Type.Pointer type, Attribute... attributes) {
		return new Expr.Constant(BigInteger.ZERO, type, attributes);
	}

	// Operators

	public static Expr.Operator OP(Expr.Opcode opcode, Type type, List<Expr> operands, Attribute... attributes) {
		return new Expr.Operator(opcode, type, operands, attributes);
	}

	public static Expr.Operator NOT(Expr operand, Attribute... attributes) {
		return OP(Expr.Opcode.NOT, Type.Bool, ImmutableList.of(operand), attributes);
	}

	public static Expr.Operator NEG(Expr operand, Attribute... attributes) {
		return OP(Expr.Opcode.NEG, operand.getType(), ImmutableList.of(operand), attributes);
	}

	public static Expr.Operator ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return OP(Expr.Opcode.ADD, lhs.getType(), ImmutableList.of(lhs, rhs), attributes);
	}

	public static Expr.Operator SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return OP(Expr.Opcode.SUB, lhs.getType(), ImmutableList.of(lhs, rhs), attributes);
	}

	public static Expr.Operator MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return OP(Expr.Opcode.MUL, lhs.getType(), ImmutableList.of(lhs, rhs), attributes);
	}

	public static Expr.Operator AND(Expr lhs, Expr rhs, Attribute... attributes) {
		return OP(Expr.Opcode.AND, Type.Bool, ImmutableList.of(lhs, rhs), attributes);
	}

	public static Expr.Operator OR(Expr lhs, Expr rhs, Attribute... attributes) {
		return OP(Expr.Opcode.OR, Type.Bool, ImmutableList.of(lhs, rhs), attributes);
	}

	public static Expr.Operator LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return OP(Expr.Opcode.LT, Type.Bool, ImmutableList.of(lhs, rhs), attributes);
	}

	public static Expr.Operator TYPECAST(Expr operand, Type type, Attribute... attributes) {
		return OP(Expr.Opcode.TYPECAST, type, ImmutableList.of(operand), attributes);
	}

	public static Expr.Operator ARRAY_OF(Expr value, Type.Array type, Attribute... attributes) {
		return OP(Expr.Opcode.ARRAY_OF, type, ImmutableList.of(value), attributes);
	}
}
