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

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Verify;

import pathsymex.core.SymexException;
import pathsymex.core.VariableRegistry;
import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;
import pathsymex.util.Util;

/**
 * Rewrites every read of program state within an expression into SSA form.
 * Subexpressions are visited top-down: a node for which a rewrite rule applies
 * is replaced wholesale, otherwise its operands are rewritten and the node is
 * rebuilt over them. The traversal uses an explicit stack rather than
 * recursion, so arbitrarily deep expressions can be handled.
 */
public class InstantiationEngine {
	private static final Logger LOG = LoggerFactory.getLogger(InstantiationEngine.class);

	private final StateReader reader;

	public InstantiationEngine(StateReader reader) {
		this.reader = reader;
	}

	public Expr instantiate(Expr src, boolean propagate) {
		Frame root = new Frame(src, null, 0);
		Deque<Frame> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			Frame frame = stack.peek();
			if (frame.operands == null) {
				Optional<Expr> replacement = instantiateNode(frame.node, propagate);
				if (replacement.isPresent()) {
					stack.pop();
					frame.complete(replacement.get());
					continue;
				}
				int n = frame.node.getOperands().size();
				frame.operands = new Expr[n];
				// pushed in reverse so operands are processed left to right
				for (int i = n - 1; i >= 0; --i) {
					stack.push(new Frame(frame.node.getOperands().get(i), frame, i));
				}
			} else {
				stack.pop();
				frame.complete(frame.node.withOperands(Arrays.asList(frame.operands)));
			}
		}
		return root.result;
	}

	/**
	 * Apply the rewrite rule for a single node, if there is one. Returning
	 * nothing indicates the node's operands should be rewritten instead.
	 *
	 * @param src
	 * @param propagate
	 * @return
	 */
	private Optional<Expr> instantiateNode(Expr src, boolean propagate) {
		LOG.trace("instantiate {}", src);
		AccessResolver resolver = reader.getResolver();
		VariableRegistry registry = reader.getConfig().getVariableRegistry();
		if (resolver.isSymbolMemberIndex(src)) {
			Optional<Expr> r = resolver.resolve(src, propagate);
			Verify.verify(r.isPresent(), "failed to resolve access %s", src);
			return r;
		} else if (src instanceof Expr.AddressOf) {
			// already evaluated by pointer resolution
			return Optional.of(src);
		} else if (src instanceof Expr.SideEffect) {
			Expr.SideEffect e = (Expr.SideEffect) src;
			if (!e.isNondet()) {
				throw new SymexException.TypeError("unexpected side effect " + e.getStatement());
			}
			Expr.Symbol symbol = registry.freshNondet(src.getType());
			Optional<Expr> r = resolver.resolve(symbol, false);
			Verify.verify(r.isPresent(), "failed to resolve %s", symbol.getIdentifier());
			return r;
		} else if (src instanceof Expr.Dereference || src instanceof Expr.IntegerDereference) {
			Expr.Symbol symbol = registry.freshDereference(src.getType());
			LOG.warn("unresolved dereference {} replaced by {}", src, symbol.getIdentifier());
			return Optional.of(symbol);
		} else if (src instanceof Expr.Member) {
			Type type = reader.getConfig().getNamespace().follow(((Expr.Member) src).getCompound().getType());
			if (type instanceof Type.Union) {
				throw new SymexException.TypeError("unexpected union member " + src);
			} else if (!(type instanceof Type.Struct)) {
				throw new SymexException.TypeError("member expects struct or union type " + src);
			}
		} else if (src instanceof Expr.Symbol) {
			Expr.Symbol s = (Expr.Symbol) src;
			Type type = reader.getConfig().getNamespace().follow(s.getType());
			Verify.verify(s.isSsa() || registry.isDereference(s) || Util.isFunction(type),
					"unexpected non-SSA symbol %s", s.getIdentifier());
		} else if (src instanceof Expr.DereferenceFailure) {
			Expr.Symbol symbol = registry.freshDereference(src.getType());
			LOG.warn("failed dereference replaced by {}", symbol.getIdentifier());
			return Optional.of(symbol);
		}
		return Optional.empty();
	}

	/**
	 * A pending node in the traversal. Once all operands of a node are complete,
	 * the node itself is rebuilt and completed.
	 */
	private static class Frame {
		private final Expr node;
		private final Frame parent;
		private final int slot;
		private Expr[] operands;
		private Expr result;

		public Frame(Expr node, Frame parent, int slot) {
			this.node = node;
			this.parent = parent;
			this.slot = slot;
		}

		public void complete(Expr result) {
			this.result = result;
			if (parent != null) {
				parent.operands[slot] = result;
			}
		}
	}
}
