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

import java.io.PrintStream;

import goalclones.util.SyntacticElement.Attribute;

/**
 * This exception is thrown when a goal (or a file of goals) cannot be read. It
 * records the text being read and the (inclusive) span of the offending
 * characters within it, so that the error can be reported against the line on
 * which it occurred.
 *
 * @author David Pearce
 */
public class SyntaxError extends RuntimeException {

	private final String msg;
	private final String input;
	private final int start;
	private final int end;

	/**
	 * Identify a syntax error at a particular point in some text.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param input
	 *            The text this error is referring to.
	 * @param start
	 *            Index of the first offending character.
	 * @param end
	 *            Index of the last offending character.
	 */
	public SyntaxError(String msg, String input, int start, int end) {
		this.msg = msg;
		this.input = input;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		return msg != null ? msg : "";
	}

	/**
	 * Get index of first character of offending location.
	 *
	 * @return
	 */
	public int start() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}

	/**
	 * Determine the (one-based) line containing the start of the offending
	 * location.
	 *
	 * @return
	 */
	public int line() {
		int line = 1;
		for (int i = 0; i < start && i < input.length(); ++i) {
			if (input.charAt(i) == '\n') {
				line = line + 1;
			}
		}
		return line;
	}

	/**
	 * Output the syntax error to a given output stream, followed by the offending
	 * line and a row of carets marking the offending characters.
	 */
	public void outputSourceError(PrintStream output) {
		if (input == null || start < 0) {
			output.println("syntax error: " + getMessage());
			return;
		}
		int lineStart = Math.min(start, input.length());
		while (lineStart > 0 && input.charAt(lineStart - 1) != '\n') {
			lineStart--;
		}
		int lineEnd = lineStart;
		while (lineEnd < input.length() && input.charAt(lineEnd) != '\n') {
			lineEnd++;
		}
		output.println("line " + line() + ": " + getMessage());
		output.println(input.substring(lineStart, lineEnd));
		String marker = "";
		for (int i = lineStart; i < start; ++i) {
			// NOTE: tabs are retained so the carets line up with the text above.
			marker += (input.charAt(i) == '\t') ? "\t" : " ";
		}
		for (int i = start; i <= Math.max(start, end); ++i) {
			marker += "^";
		}
		output.println(marker);
	}

	public static final long serialVersionUID = 1l;

	/**
	 * Raise a syntax error against a given element, using its source attribute
	 * (if present) to locate the error.
	 *
	 * @param msg
	 * @param input
	 * @param elem
	 */
	public static void syntaxError(String msg, String input, SyntacticElement elem) {
		int start = -1;
		int end = -1;

		Attribute.Source attr = elem.attribute(Attribute.Source.class);
		if (attr != null) {
			start = attr.start;
			end = attr.end;
		}

		throw new SyntaxError(msg, input, start, end);
	}
}
