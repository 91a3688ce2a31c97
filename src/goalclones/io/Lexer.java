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

import goalclones.util.SyntaxError;

/**
 * Responsible for turning the text of a goal into a sequence of tokens.
 *
 * @author Daivd J. Pearce
 *
 */
public class Lexer {

	private final String input;
	private int pos;

	public Lexer(String input) {
		this.input = input;
	}

	public Lexer(Reader reader) throws IOException {
		BufferedReader in = new BufferedReader(reader);

		StringBuilder text = new StringBuilder();
		String tmp;
		while ((tmp = in.readLine()) != null) {
			text.append(tmp);
			text.append("\n");
		}

		input = text.toString();
	}

	/**
	 * Get the text being scanned.
	 *
	 * @return
	 */
	public String input() {
		return input;
	}

	/**
	 * Scan all characters from the input and generate a corresponding list of
	 * tokens, whilst discarding all whitespace and comments.
	 *
	 * @return
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;

		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (Character.isDigit(c)) {
				tokens.add(scanNumericConstant());
			} else if (c == '(' && (pos + 1) < input.length() && input.charAt(pos + 1) == '*') {
				scanBlockComment();
			} else if (c == '?' && (pos + 1) < input.length() && isIdentifierStart(input.charAt(pos + 1))) {
				tokens.add(scanExistential());
			} else if (c == '@' && (pos + 1) < input.length() && input.charAt(pos + 1) == '{') {
				tokens.add(scanUniverse());
			} else if (c == '@' && (pos + 1) < input.length() && isIdentifierStart(input.charAt(pos + 1))) {
				tokens.add(scanExplicitIdentifier());
			} else if (isIdentifierStart(c)) {
				tokens.add(scanIdentifier());
			} else if (isPunctuation(c)) {
				tokens.add(scanPunctuation());
			} else if (isOperatorPart(c)) {
				tokens.add(scanOperator());
			} else if (Character.isWhitespace(c)) {
				skipWhitespace();
			} else {
				syntaxError("unknown character encountered: " + c);
			}
		}

		return tokens;
	}

	/**
	 * Scan a numeric constant. That is a sequence of digits.
	 *
	 * @return
	 */
	public Token scanNumericConstant() {
		int start = pos;
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos = pos + 1;
		}
		return new Int(input.substring(start, pos), start);
	}

	/**
	 * Scan an existential variable, such as <code>?x</code>.
	 *
	 * @return
	 */
	public Token scanExistential() {
		int start = pos++;
		Token ident = scanIdentifier();
		return new Existential("?" + ident.text, start);
	}

	/**
	 * Scan an identifier with explicit arguments, such as <code>@eq</code>. The
	 * marker is retained as part of the name.
	 *
	 * @return
	 */
	public Token scanExplicitIdentifier() {
		int start = pos++;
		Token ident = scanIdentifier();
		if (ident instanceof Keyword) {
			throw new SyntaxError("invalid identifier @" + ident.text, input, start, ident.end());
		}
		return new Identifier("@" + ident.text, start);
	}

	/**
	 * Scan a universe instance or annotation, such as <code>@{u v}</code>. This
	 * is kept as an opaque string, though nested braces are balanced.
	 *
	 * @return
	 */
	public Token scanUniverse() {
		int start = pos;
		int depth = 0;
		pos = pos + 1;
		do {
			char c = input.charAt(pos++);
			if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
			}
		} while (depth > 0 && pos < input.length());
		if (depth > 0) {
			throw new SyntaxError("unterminated universe annotation", input, start, pos - 1);
		}
		return new Universe(input.substring(start, pos), start);
	}

	static final char[] punctuation = { '(', ')', '{', '}', ',', '|', ':', '=', '-' };

	public boolean isPunctuation(char c) {
		for (char o : punctuation) {
			if (c == o) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Scan punctuation. Some punctuation (e.g. <code>=</code>, <code>|</code>)
	 * may also begin an operator (e.g. <code>=</code>, <code>||</code>). This
	 * is resolved by first scanning the longest operator possible and, if this
	 * is not an operator in its own right, falling back to punctuation.
	 *
	 * @return
	 */
	public Token scanPunctuation() {
		int start = pos;
		char c = input.charAt(pos);
		if (c == '(') {
			return new LeftBrace(pos++);
		} else if (c == ')') {
			return new RightBrace(pos++);
		} else if (c == '{') {
			return new LeftCurly(pos++);
		} else if (c == '}') {
			return new RightCurly(pos++);
		} else if (c == ',') {
			return new Comma(pos++);
		}
		// Remaining punctuation is formed from operator characters
		Token op = scanOperator();
		switch (op.text) {
		case "|":
			return new Bar(start);
		case ":":
			return new Colon(start);
		case ":=":
			return new ColonEquals(start);
		case "=>":
			return new DoubleArrow(start);
		case "->":
			return new Arrow(start);
		default:
			return op;
		}
	}

	static final String operatorChars = "+-*/<>=~&^!%\\|:$#.;";

	public boolean isOperatorPart(char c) {
		return operatorChars.indexOf(c) >= 0;
	}

	public Token scanOperator() {
		int start = pos;
		while (pos < input.length() && isOperatorPart(input.charAt(pos))) {
			pos++;
		}
		String text = input.substring(start, pos);
		if (text.indexOf('#') >= 0) {
			// NOTE: reserved for synthesized variables
			throw new SyntaxError("invalid operator " + text, input, start, pos - 1);
		}
		return new Operator(text, start);
	}

	public static final String[] keywords = { "forall", "fun", "let", "in", "fix", "struct", "if", "then", "else",
			"return", "as", "match", "with", "end", "Prop", "Set", "SProp", "Type" };

	public static final String[] sorts = { "Prop", "Set", "SProp", "Type" };

	public boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	public boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
	}

	/**
	 * Scan an identifier or keyword. Identifiers may be qualified, as in
	 * <code>Coq.Init.Nat.add</code>.
	 *
	 * @return
	 */
	public Token scanIdentifier() {
		int start = pos;
		while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
			pos++;
			// Allow qualified names
			if ((pos + 1) < input.length() && input.charAt(pos) == '.' && isIdentifierStart(input.charAt(pos + 1))) {
				pos++;
			}
		}
		String text = input.substring(start, pos);

		// now, check for keywords
		for (String keyword : keywords) {
			if (keyword.equals(text)) {
				return new Keyword(text, start);
			}
		}

		// otherwise, must be identifier
		return new Identifier(text, start);
	}

	public void scanBlockComment() {
		int start = pos;
		int depth = 0;
		do {
			if (input.startsWith("(*", pos)) {
				depth++;
				pos += 2;
			} else if (input.startsWith("*)", pos)) {
				depth--;
				pos += 2;
			} else {
				pos++;
			}
		} while (depth > 0 && pos < input.length());
		if (depth > 0) {
			throw new SyntaxError("unterminated comment", input, start, start + 1);
		}
	}

	/**
	 * Skip over any whitespace at the current index position in the input
	 * string.
	 */
	public void skipWhitespace() {
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	/**
	 * Raise a syntax error with a given message at the current index.
	 *
	 * @param msg
	 */
	private void syntaxError(String msg) {
		throw new SyntaxError(msg, input, pos, pos);
	}

	/**
	 * The base class for all tokens.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Token {

		public final String text;
		public final int start;

		public Token(String text, int pos) {
			this.text = text;
			this.start = pos;
		}

		public int end() {
			return start + text.length() - 1;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * Represents a numeral. That is, a sequence of 1 or more digits. Numerals are
	 * retained as text since they are only ever compared by name.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Int extends Token {

		public Int(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents a variable or constant name. That is, an alphabetic character
	 * (or '_'), followed by a sequence of zero or more alpha-numeric characters
	 * (or '_' or '\''), possibly qualified with dots.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Identifier extends Token {

		public Identifier(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents an existential variable, such as <code>?x</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Existential extends Token {

		public Existential(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents a universe instance or annotation, such as <code>@{u}</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Universe extends Token {

		public Universe(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents a known keyword. In essence, a keyword is a sequence of one or
	 * more alphabetic characters which is defined in advance.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Keyword extends Token {

		public Keyword(String text, int pos) {
			super(text, pos);
		}

		/**
		 * Check whether this keyword denotes a sort.
		 *
		 * @return
		 */
		public boolean isSort() {
			for (String sort : sorts) {
				if (sort.equals(text)) {
					return true;
				}
			}
			return false;
		}
	}

	/**
	 * Represents an operator symbol, such as <code>+</code> or <code>/\</code>.
	 * Operators are treated as variables by the parser.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Operator extends Token {

		public Operator(String text, int pos) {
			super(text, pos);
		}
	}

	public static class Comma extends Token {
		public Comma(int pos) {
			super(",", pos);
		}
	}

	public static class Bar extends Token {
		public Bar(int pos) {
			super("|", pos);
		}
	}

	public static class Colon extends Token {
		public Colon(int pos) {
			super(":", pos);
		}
	}

	public static class ColonEquals extends Token {
		public ColonEquals(int pos) {
			super(":=", pos);
		}
	}

	public static class DoubleArrow extends Token {
		public DoubleArrow(int pos) {
			super("=>", pos);
		}
	}

	public static class Arrow extends Token {
		public Arrow(int pos) {
			super("->", pos);
		}
	}

	public static class LeftBrace extends Token {

		public LeftBrace(int pos) {
			super("(", pos);
		}
	}

	public static class RightBrace extends Token {

		public RightBrace(int pos) {
			super(")", pos);
		}
	}

	public static class LeftCurly extends Token {

		public LeftCurly(int pos) {
			super("{", pos);
		}
	}

	public static class RightCurly extends Token {

		public RightCurly(int pos) {
			super("}", pos);
		}
	}
}
