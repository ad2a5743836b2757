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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import pathsymex.core.PathState;
import pathsymex.core.Syntax.Expr;

/**
 * Translates reads of program state on a single execution path into SSA form.
 * A read proceeds in three phases: pointers are resolved (always with
 * propagation), accesses are instantiated to SSA symbols or propagated values,
 * and finally the result is simplified.
 */
public class StateReader {
	private static final Logger LOG = LoggerFactory.getLogger(StateReader.class);

	private final SymexConfig config;
	private final PathState state;
	private final StructuralDecomposer decomposer;
	private final IndexCaseSplitter splitter;
	private final AccessResolver resolver;
	private final InstantiationEngine engine;

	public StateReader(SymexConfig config, PathState state) {
		this.config = Preconditions.checkNotNull(config);
		this.state = Preconditions.checkNotNull(state);
		this.decomposer = new StructuralDecomposer(config);
		this.splitter = new IndexCaseSplitter(this);
		this.resolver = new AccessResolver(this);
		this.engine = new InstantiationEngine(this);
	}

	public Expr read(Expr src) {
		return read(src, true);
	}

	/**
	 * Read a given expression on this path.
	 *
	 * @param src
	 *            The expression to read, which may refer to mutable program
	 *            state.
	 * @param propagate
	 *            Whether known values should be substituted for variables, or
	 *            only SSA symbols used.
	 * @return An equivalent expression which no longer refers to mutable program
	 *         state.
	 */
	public Expr read(Expr src, boolean propagate) {
		Preconditions.checkNotNull(src);
		Expr dereferenced = new PointerResolutionPass(this, true).apply(src);
		Expr instantiated = engine.instantiate(dereferenced, propagate);
		Expr result = config.getSimplifier().simplify(instantiated);
		LOG.debug("read {} ==> {}", src, result);
		return result;
	}

	public SymexConfig getConfig() {
		return config;
	}

	public PathState getState() {
		return state;
	}

	public StructuralDecomposer getDecomposer() {
		return decomposer;
	}

	public IndexCaseSplitter getSplitter() {
		return splitter;
	}

	public AccessResolver getResolver() {
		return resolver;
	}

	public InstantiationEngine getEngine() {
		return engine;
	}
}
