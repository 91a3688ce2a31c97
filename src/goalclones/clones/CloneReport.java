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

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

/**
 * Responsible for writing out a list of clones in a human-readable form. Each
 * clone is reported as the two goals involved, along with the theorem and file
 * in which they arose and their proofs, followed by a separator line.
 *
 * @author David J. Pearce
 *
 */
public class CloneReport {
	private static final String SEPARATOR = "=".repeat(50);

	private final List<Clone> clones;

	public CloneReport(List<Clone> clones) {
		this.clones = clones;
	}

	/**
	 * Write this report to a given writer. The writer is not closed.
	 *
	 * @param out
	 * @throws IOException
	 */
	public void write(Writer out) throws IOException {
		for (Clone c : clones) {
			write(1, c.first(), out);
			out.write("\n");
			write(2, c.second(), out);
			out.write("\n");
			out.write(SEPARATOR);
			out.write("\n");
		}
		out.flush();
	}

	private static void write(int index, Goal goal, Writer out) throws IOException {
		out.write("Goal " + index + ": " + goal.text() + "\n");
		out.write("\t Inside theorem: " + goal.theorem() + "\n");
		out.write("\t Inside file: " + goal.file() + "\n");
		out.write("\t Proof:\n");
		List<String> proof = goal.proof();
		for (int i = 0; i != proof.size(); ++i) {
			if (i != 0) {
				out.write("\n");
			}
			out.write("\t\t" + proof.get(i));
		}
	}

	@Override
	public String toString() {
		StringWriter writer = new StringWriter();
		try {
			write(writer);
		} catch (IOException e) {
			// StringWriter never throws
			throw new IllegalStateException(e);
		}
		return writer.toString();
	}
}
