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

import java.util.Collections;
import java.util.List;

/**
 * A goal arising at some point in the proof of a theorem, along with the local
 * context in which it arose and the proof steps used to discharge it.
 *
 * @author David J. Pearce
 *
 */
public class Goal {
	private final String text;
	private final String theorem;
	private final String file;
	private final List<String> hypotheses;
	private final List<String> proof;

	public Goal(String text, String theorem, String file, List<String> hypotheses, List<String> proof) {
		if (text == null || theorem == null || file == null || hypotheses == null || proof == null) {
			throw new IllegalArgumentException("incomplete goal");
		}
		this.text = text;
		this.theorem = theorem;
		this.file = file;
		this.hypotheses = Collections.unmodifiableList(hypotheses);
		this.proof = Collections.unmodifiableList(proof);
	}

	/**
	 * The goal as printed by the prover.
	 *
	 * @return
	 */
	public String text() {
		return text;
	}

	public String theorem() {
		return theorem;
	}

	public String file() {
		return file;
	}

	/**
	 * The hypotheses of the local context, each as printed by the prover (e.g.
	 * <code>n m : nat</code>).
	 *
	 * @return
	 */
	public List<String> hypotheses() {
		return hypotheses;
	}

	/**
	 * The proof steps (tactics) used to discharge this goal.
	 *
	 * @return
	 */
	public List<String> proof() {
		return proof;
	}

	@Override
	public String toString() {
		return theorem + ": " + text;
	}
}
