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
package goalclones.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import goalclones.clones.Goal;
import goalclones.util.SyntaxError;

/**
 * Responsible for reading a file of goals, as extracted from a proof
 * development. The file consists of zero or more records separated by lines of
 * <code>===</code>. For example:
 *
 * <pre>
 * Theorem: add_comm
 * File: theories/Arith.v
 * Hypotheses:
 *   n, m : nat
 * Goal: n + m = m + n
 * Proof:
 *   induction n.
 *   reflexivity.
 * ===
 * </pre>
 *
 * Each record must have a <code>Theorem</code>, <code>File</code> and
 * <code>Goal</code> field, whilst the <code>Hypotheses</code> and
 * <code>Proof</code> sections are optional. Entries of a section are indented.
 * An indented line following a <code>Goal</code> continues the goal. Blank
 * lines are ignored.
 *
 * @author David J. Pearce
 *
 */
public class GoalReader {
	private static final String THEOREM = "Theorem";
	private static final String FILE = "File";
	private static final String GOAL = "Goal";
	private static final String HYPOTHESES = "Hypotheses";
	private static final String PROOF = "Proof";

	private final String input;
	private int pos;

	public GoalReader(String input) {
		this.input = input;
	}

	public GoalReader(Reader reader) throws IOException {
		BufferedReader in = new BufferedReader(reader);
		StringBuilder text = new StringBuilder();
		String line;
		while ((line = in.readLine()) != null) {
			text.append(line);
			text.append("\n");
		}
		this.input = text.toString();
	}

	/**
	 * Read all goals from the input.
	 *
	 * @return
	 * @throws SyntaxError if the input is malformed.
	 */
	public List<Goal> read() {
		ArrayList<Goal> goals = new ArrayList<>();
		pos = 0;
		GoalRecord record = new GoalRecord(pos);
		while (pos < input.length()) {
			int start = pos;
			String line = readLine();
			if (line.trim().isEmpty()) {
				continue;
			} else if (isSeparator(line)) {
				if (!record.isEmpty()) {
					goals.add(record.toGoal());
				}
				record = new GoalRecord(pos);
			} else if (Character.isWhitespace(line.charAt(0))) {
				record.addEntry(line.trim(), start, start + line.length() - 1);
			} else {
				int colon = line.indexOf(':');
				if (colon < 0) {
					throw new SyntaxError("expecting field or separator", input, start, start + line.length() - 1);
				}
				String key = line.substring(0, colon).trim();
				String value = line.substring(colon + 1).trim();
				record.setField(key, value, start, start + colon - 1);
			}
		}
		if (!record.isEmpty()) {
			goals.add(record.toGoal());
		}
		return goals;
	}

	private String readLine() {
		int end = input.indexOf('\n', pos);
		if (end < 0) {
			end = input.length();
		}
		String line = input.substring(pos, end);
		pos = end + 1;
		// Strip carriage returns from files with Windows line endings
		return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
	}

	private static boolean isSeparator(String line) {
		String l = line.trim();
		if (l.length() < 3) {
			return false;
		}
		for (int i = 0; i != l.length(); ++i) {
			if (l.charAt(i) != '=') {
				return false;
			}
		}
		return true;
	}

	/**
	 * Accumulates the fields of a single record as they are read.
	 *
	 * @author David J. Pearce
	 *
	 */
	private class GoalRecord {
		private final int start;
		private String theorem;
		private String file;
		private String goal;
		private final ArrayList<String> hypotheses = new ArrayList<>();
		private final ArrayList<String> proof = new ArrayList<>();
		private String section;
		private boolean empty = true;

		public GoalRecord(int start) {
			this.start = start;
		}

		public boolean isEmpty() {
			return empty;
		}

		public void setField(String key, String value, int start, int end) {
			empty = false;
			switch (key) {
			case THEOREM:
				theorem = checkUnset(theorem, key, start, end, value);
				section = null;
				break;
			case FILE:
				file = checkUnset(file, key, start, end, value);
				section = null;
				break;
			case GOAL:
				goal = checkUnset(goal, key, start, end, value);
				section = GOAL;
				break;
			case HYPOTHESES:
			case PROOF:
				if (!value.isEmpty()) {
					throw new SyntaxError("entries of " + key + " must be indented", input, start, end);
				}
				section = key;
				break;
			default:
				throw new SyntaxError("unknown field " + key, input, start, end);
			}
		}

		public void addEntry(String entry, int start, int end) {
			if (section == null) {
				throw new SyntaxError("unexpected indentation", input, start, end);
			}
			switch (section) {
			case GOAL:
				goal = goal.isEmpty() ? entry : goal + " " + entry;
				break;
			case HYPOTHESES:
				hypotheses.add(entry);
				break;
			default:
				proof.add(entry);
			}
		}

		public Goal toGoal() {
			String missing = theorem == null ? THEOREM : file == null ? FILE : goal == null ? GOAL : null;
			if (missing != null) {
				throw new SyntaxError("missing field " + missing, input, start, start);
			}
			return new Goal(goal, theorem, file, hypotheses, proof);
		}

		private String checkUnset(String current, String key, int start, int end, String value) {
			if (current != null) {
				throw new SyntaxError("duplicate field " + key, input, start, end);
			}
			return value;
		}
	}
}
