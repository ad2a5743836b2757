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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pathsymex.core.Syntax.Expr;
import pathsymex.core.Syntax.Type;
import pathsymex.util.Util;

/**
 * Rewrites a read of a bounded array at a symbolic index into a conditional
 * over all possible indices, i.e. <code>a[i]</code> becomes
 * <code>cond(i == 0 -&gt; a[0], i == 1 -&gt; a[1], ...)</code>. The guards
 * are over the index as already read, so it is evaluated only once. Reads at
 * constant indices, reads of arrays which are not flattened and everything
 * which is not an index are returned unchanged.
 */
public class IndexCaseSplitter {
	private static final Logger LOG = LoggerFactory.getLogger(IndexCaseSplitter.class);

	private final StateReader reader;

	public IndexCaseSplitter(StateReader reader) {
		this.reader = reader;
	}

	public Expr split(Expr src, boolean propagate) {
		if (!(src instanceof Expr.Index)) {
			return src;
		}
		SymexConfig config = reader.getConfig();
		Expr.Index e = (Expr.Index) src;
		Type type = config.getNamespace().follow(e.getArray().getType());
		if (!(type instanceof Type.Sequence)) {
			return src;
		}
		Type.Sequence seq = (Type.Sequence) type;
		if (config.getVariableRegistry().isUnboundedArray(seq) || !Util.hasConstantSize(seq)) {
			return src;
		}
		Expr index = config.getSimplifier().simplify(reader.read(e.getIndex(), propagate));
		if (index instanceof Expr.Constant) {
			return src;
		}
		int size = Util.constantSize(seq);
		Type indexType = e.getIndex().getType();
		List<Expr> cases = new ArrayList<>();
		for (int i = 0; i != size; ++i) {
			Expr k = CONST(i, indexType);
			cases.add(EQ(index, k));
			cases.add(INDEX(e.getArray(), k, e.getType()));
		}
		LOG.trace("split {} into {} cases", src, size);
		return COND(e.getType(), cases);
	}
}
