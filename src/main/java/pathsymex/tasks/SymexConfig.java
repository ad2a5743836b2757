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

import com.google.common.base.Preconditions;

import pathsymex.core.Namespace;
import pathsymex.core.VariableRegistry;
import pathsymex.util.AddressEvaluator;
import pathsymex.util.BasicAddressEvaluator;
import pathsymex.util.BasicPointerResolver;
import pathsymex.util.PointerResolver;
import pathsymex.util.Simplifier;
import pathsymex.util.ZeroInitializer;

/**
 * Configuration of a symbolic execution run. This is shared by all paths of
 * the run.
 */
public class SymexConfig {
	/**
	 * Resolves the names and types of the program under execution.
	 */
	private final Namespace namespace;
	/**
	 * Numbering of variables for this run.
	 */
	private VariableRegistry registry;
	/**
	 * Oracle determining the objects a pointer may refer to.
	 */
	private PointerResolver pointerResolver = new BasicPointerResolver();
	/**
	 * Evaluator for address-of expressions.
	 */
	private AddressEvaluator addressEvaluator = new BasicAddressEvaluator();
	private Simplifier simplifier;
	private ZeroInitializer zeroInitializer;

	public SymexConfig(Namespace namespace) {
		this.namespace = Preconditions.checkNotNull(namespace);
		this.registry = new VariableRegistry(namespace);
		this.simplifier = new Simplifier(namespace);
		this.zeroInitializer = new ZeroInitializer(registry);
	}

	public SymexConfig setVariableRegistry(VariableRegistry registry) {
		Preconditions.checkArgument(registry.getNamespace() == namespace, "registry uses a different namespace");
		this.registry = registry;
		this.zeroInitializer = new ZeroInitializer(registry);
		return this;
	}

	public SymexConfig setPointerResolver(PointerResolver resolver) {
		this.pointerResolver = Preconditions.checkNotNull(resolver);
		return this;
	}

	public SymexConfig setAddressEvaluator(AddressEvaluator evaluator) {
		this.addressEvaluator = Preconditions.checkNotNull(evaluator);
		return this;
	}

	public SymexConfig setSimplifier(Simplifier simplifier) {
		this.simplifier = Preconditions.checkNotNull(simplifier);
		return this;
	}

	public SymexConfig setZeroInitializer(ZeroInitializer zeroInitializer) {
		this.zeroInitializer = Preconditions.checkNotNull(zeroInitializer);
		return this;
	}

	public SymexConfig setMaxFlattenedArraySize(int size) {
		registry.setMaxFlattenedArraySize(size);
		return this;
	}

	public Namespace getNamespace() {
		return namespace;
	}

	public VariableRegistry getVariableRegistry() {
		return registry;
	}

	public PointerResolver getPointerResolver() {
		return pointerResolver;
	}

	public AddressEvaluator getAddressEvaluator() {
		return addressEvaluator;
	}

	public Simplifier getSimplifier() {
		return simplifier;
	}

	public ZeroInitializer getZeroInitializer() {
		return zeroInitializer;
	}

	public int getMaxFlattenedArraySize() {
		return registry.getMaxFlattenedArraySize();
	}
}
