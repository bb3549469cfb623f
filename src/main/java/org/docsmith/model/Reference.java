package org.docsmith.model;

/**
 * A link from one documentation object to another. The target may not have been
 * parsed yet, in which case only its path is known.
 */
public sealed interface Reference permits Reference.Resolved, Reference.Unresolved {

	/**
	 * @return The path of the referenced object.
	 */
	String path();

	/**
	 * A reference to a known object.
	 * @param target The referenced object.
	 */
	record Resolved(DocObject target) implements Reference {
		@Override
		public String path() {
			return target.path();
		}
	}

	/**
	 * A placeholder for an object that has not been seen yet.
	 * @param path The expected path of the object.
	 * @param type The expected kind of object (e.g. "class"), used in diagnostics.
	 */
	record Unresolved(String path, String type) implements Reference {}

	/**
	 * @param target The referenced object.
	 * @return A resolved reference.
	 */
	static Reference to(DocObject target) {
		return new Resolved(target);
	}

	/**
	 * @param path The expected path.
	 * @param type The expected kind of object.
	 * @return A placeholder reference.
	 */
	static Reference unresolved(String path, String type) {
		return new Unresolved(path, type);
	}
}
