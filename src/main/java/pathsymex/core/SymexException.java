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

/**
 * Signals a fatal condition encountered whilst reading program state. Such a
 * condition indicates that the expression being read violates a contract
 * established by an earlier stage (e.g. unions which were not rewritten to
 * byte extraction), and terminates the current read.
 */
public class SymexException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public SymexException(String message) {
		super(message);
	}

	public SymexException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * An expression whose type does not permit the given form of access, such
	 * as a member access on something other than a record.
	 */
	public static class TypeError extends SymexException {
		private static final long serialVersionUID = 1L;

		public TypeError(String message) {
			super(message);
		}
	}

	/**
	 * A declaration which cannot be interpreted, such as an array whose size
	 * cannot be evaluated or a variable which was never declared.
	 */
	public static class Configuration extends SymexException {
		private static final long serialVersionUID = 1L;

		public Configuration(String message) {
			super(message);
		}
	}

	/**
	 * A pointer which could not be resolved to an object.
	 */
	public static class Dereference extends SymexException {
		private static final long serialVersionUID = 1L;

		public Dereference(String message) {
			super(message);
		}

		public Dereference(String message, Throwable cause) {
			super(message, cause);
		}
	}
}
