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
package goalclones.clones;

/**
 * A pair of goals, from different theorems, which state the same thing up to
 * the naming of bound variables.
 *
 * @author David J. Pearce
 *
 */
public class Clone {
	private final Goal first;
	private final Goal second;

	public Clone(Goal first, Goal second) {
		this.first = first;
		this.second = second;
	}

	public Goal first() {
		return first;
	}

	public Goal second() {
		return second;
	}

	@Override
	public String toString() {
		return "(" + first + ", " + second + ")";
	}
}
