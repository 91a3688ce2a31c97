// This file is part of the Goal Clones tool (goalclones).
//
// The Goal Clones tool is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The Goal Clones tool is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the Goal Clones tool. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.

package goalclones.util;

/**
 * A Syntactic Element represents any part of a goal which was produced from
 * some piece of source text, and to which we may wish to attach information
 * (e.g. the span of characters it was parsed from). Attributes never take part
 * in the equality of terms.
 *
 * @author David Pearce
 */
public interface SyntacticElement {

	/**
	 * Get the list of attributes associated with this syntactic element.
	 *
	 * @return
	 */
	public Attribute[] attributes();

	/**
	 * Get the first attribute of the given class type, or <code>null</code> if
	 * there is none.
	 *
	 * @param c
	 * @return
	 */
	public <T extends Attribute> T attribute(Class<T> c);

	public class Impl implements SyntacticElement {

		private final Attribute[] attributes;

		public Impl(Attribute... attributes) {
			this.attributes = attributes;
		}

		@Override
		public Attribute[] attributes() {
			return attributes;
		}

		@Override
		@SuppressWarnings("unchecked")
		public <T extends Attribute> T attribute(Class<T> c) {
			for (Attribute a : attributes) {
				if (c.isInstance(a)) {
					return (T) a;
				}
			}
			return null;
		}
	}

	/**
	 * Represents an attribute that can be associated with a syntactic element.
	 *
	 * @author djp
	 *
	 */
	public interface Attribute {

		/**
		 * Identifies the (inclusive) range of characters in the original goal text
		 * from which an element was parsed.
		 */
		public static class Source implements Attribute {

			public final int start;
			public final int end;

			public Source(int start, int end) {
				this.start = start;
				this.end = end;
			}

			@Override
			public String toString() {
				return "@" + start + ":" + end;
			}
		}
	}
}
