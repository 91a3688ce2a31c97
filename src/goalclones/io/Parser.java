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

import java.util.ArrayList;
import java.util.List;

import goalclones.core.Syntax;
import goalclones.core.Syntax.Binder;
import goalclones.core.Syntax.CaseClause;
import goalclones.core.Syntax.Hypothesis;
import goalclones.core.Syntax.MatchSubject;
import goalclones.core.Syntax.Pattern;
import goalclones.core.Syntax.Term;
import goalclones.io.Lexer.*;
import goalclones.util.SyntacticElement.Attribute;
import goalclones.util.SyntaxError;

/**
 * Responsible for turning a sequence of tokens into a goal term. Binder groups
 * are desugared into nested abstractions as they are parsed, so that every
 * abstraction binds exactly one variable.
 *
 * @author David J. Pearce
 *
 */
public class Parser {
	private final String input;
	private final ArrayList<Token> tokens;
	private int index;

	public Parser(String input, List<Token> tokens) {
		this.input = input;
		this.tokens = new ArrayList<>(tokens);
	}

	/**
	 * Parse the text of a goal into a term.
	 *
	 * @param input
	 * @return
	 * @throws SyntaxError if the text is not a well-formed goal.
	 */
	public static Term parse(String input) {
		List<Token> tokens = new Lexer(input).scan();
		return new Parser(input, tokens).parseGoal();
	}

	/**
	 * Parse the text of a single hypothesis from the local context of a goal.
	 *
	 * @param input
	 * @return
	 * @throws SyntaxError if the text is not a well-formed hypothesis.
	 */
	public static Hypothesis parseHypothesis(String input) {
		List<Token> tokens = new Lexer(input).scan();
		Parser parser = new Parser(input, tokens);
		Hypothesis hypothesis = parser.parseHypothesis();
		parser.checkEof();
		return hypothesis;
	}

	/**
	 * Parse a complete goal. All tokens must be consumed.
	 *
	 * @return
	 */
	public Term parseGoal() {
		Term goal = parseTerm();
		checkEof();
		return goal;
	}

	/**
	 * Parse a hypothesis, of the form:
	 *
	 * <pre>
	 * Hypothesis ::= Name (',' Name)* ':' Term
	 *              | Name ':=' Term (':' Term)?
	 * </pre>
	 *
	 * An omitted type is represented by the wildcard.
	 *
	 * @return
	 */
	public Hypothesis parseHypothesis() {
		int start = index;
		ArrayList<Term.Variable> names = new ArrayList<>();
		names.add(parseBinderName());
		if (lookahead(ColonEquals.class)) {
			match(":=");
			Term definition = parseTerm();
			Term type = hole();
			if (lookahead(Colon.class)) {
				match(":");
				type = parseTerm();
			}
			return new Hypothesis(names, definition, type, sourceAttr(start, index - 1));
		}
		while (lookahead(Comma.class)) {
			match(",");
			names.add(parseBinderName());
		}
		match(":");
		Term type = parseTerm();
		return new Hypothesis(names, null, type, sourceAttr(start, index - 1));
	}

	/**
	 * Parse a term of the form:
	 *
	 * <pre>
	 * Term ::= 'forall' Binders ',' Term
	 *        | 'fun' Binders '=>' Term
	 *        | 'let' Name (':' Term)? ':=' Term 'in' Term
	 *        | 'fix' Name Binders ('{' 'struct' Name '}')? (':' Term)? ':=' Term
	 *        | 'if' Term ('as' Name)? ('return' Term)? 'then' Term 'else' Term
	 *        | Apply ('->' Term)?
	 * </pre>
	 *
	 * @return
	 */
	public Term parseTerm() {
		checkNotEof();
		Token lookahead = tokens.get(index);
		if (isKeyword(lookahead, "forall")) {
			return parseProduct();
		} else if (isKeyword(lookahead, "fun")) {
			return parseFunction();
		} else if (isKeyword(lookahead, "let")) {
			return parseLet();
		} else if (isKeyword(lookahead, "fix")) {
			return parseFixpoint();
		} else if (isKeyword(lookahead, "if")) {
			return parseConditional();
		} else {
			return parseArrow();
		}
	}

	public Term.Product parseProduct() {
		int start = index;
		matchKeyword("forall");
		List<Binder> binders = parseBinders(true);
		match(",");
		Term body = parseTerm();
		return Term.Product.build(binders, body, sourceAttr(start, index - 1));
	}

	public Term.Function parseFunction() {
		int start = index;
		matchKeyword("fun");
		List<Binder> binders = parseBinders(true);
		match("=>");
		Term body = parseTerm();
		return Term.Function.build(binders, body, sourceAttr(start, index - 1));
	}

	/**
	 * Parse a local definition, of the form:
	 *
	 * <pre>
	 * Let ::= 'let' Name (':' Term)? ':=' Term 'in' Term
	 * </pre>
	 *
	 * An omitted type is represented by the wildcard.
	 *
	 * @return
	 */
	public Term.Let parseLet() {
		int start = index;
		matchKeyword("let");
		Term.Variable variable = parseBinderName();
		Term type = hole();
		if (lookahead(Colon.class)) {
			match(":");
			type = parseTerm();
		}
		match(":=");
		Term definition = parseTerm();
		matchKeyword("in");
		Term body = parseTerm();
		return new Term.Let(variable, type, definition, body, sourceAttr(start, index - 1));
	}

	/**
	 * Parse a fixpoint, of the form:
	 *
	 * <pre>
	 * Fix ::= 'fix' Name Binders ('{' 'struct' Name '}')? (':' Term)? ':=' Term
	 * </pre>
	 *
	 * An omitted return type is represented by the wildcard.
	 *
	 * @return
	 */
	public Term.Fixpoint parseFixpoint() {
		int start = index;
		matchKeyword("fix");
		Term.Variable name = parseBinderName();
		List<Binder> parameters = parseBinders(false);
		Term.Variable struct = null;
		if (lookahead(LeftCurly.class)) {
			match("{");
			matchKeyword("struct");
			struct = parseBinderName();
			match("}");
		}
		Term returnType = hole();
		if (lookahead(Colon.class)) {
			match(":");
			returnType = parseTerm();
		}
		match(":=");
		Term body = parseTerm();
		if (struct != null && !parametersInclude(parameters, struct)) {
			SyntaxError.syntaxError("struct argument " + struct + " is not a parameter", input, struct);
		}
		return new Term.Fixpoint(name, parameters, struct, returnType, body, sourceAttr(start, index - 1));
	}

	/**
	 * Parse a conditional, of the form:
	 *
	 * <pre>
	 * If ::= 'if' Term ('as' Name)? ('return' Term)? 'then' Term 'else' Term
	 * </pre>
	 *
	 * @return
	 */
	public Term.Conditional parseConditional() {
		int start = index;
		matchKeyword("if");
		Term guard = parseTerm();
		Term.Variable alias = null;
		if (lookaheadKeyword("as")) {
			matchKeyword("as");
			alias = parseBinderName();
		}
		Term returnType = null;
		if (lookaheadKeyword("return")) {
			matchKeyword("return");
			returnType = parseTerm();
		}
		matchKeyword("then");
		Term trueBranch = parseTerm();
		matchKeyword("else");
		Term falseBranch = parseTerm();
		return new Term.Conditional(guard, alias, returnType, trueBranch, falseBranch, sourceAttr(start, index - 1));
	}

	/**
	 * Parse an application, possibly followed by an arrow. Arrows are right
	 * associative, and <code>A -> B</code> is a product over the wildcard.
	 *
	 * @return
	 */
	public Term parseArrow() {
		int start = index;
		Term lhs = parseApplication();
		if (lookahead(Arrow.class)) {
			match("->");
			Term rhs = parseTerm();
			return new Term.Product(new Term.Variable(Syntax.WILDCARD), lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	/**
	 * Parse a sequence of one or more atoms as a left-associative application. A
	 * binding form (e.g. <code>fun</code>) may appear as the final argument
	 * without brackets, in which case it extends as far as possible.
	 *
	 * @return
	 */
	public Term parseApplication() {
		int start = index;
		Term term = parseAtom();
		while (index < tokens.size()) {
			Token lookahead = tokens.get(index);
			if (isAtomStart(lookahead)) {
				Term argument = parseAtom();
				term = new Term.Application(term, argument, sourceAttr(start, index - 1));
			} else if (isBinderStart(lookahead)) {
				Term argument = parseTerm();
				return new Term.Application(term, argument, sourceAttr(start, index - 1));
			} else {
				break;
			}
		}
		return term;
	}

	public Term parseAtom() {
		checkNotEof();
		int start = index;
		Token lookahead = tokens.get(index);
		if (lookahead instanceof LeftBrace) {
			return parseBracketedExpression();
		} else if (isKeyword(lookahead, "match")) {
			return parseMatch();
		} else if (lookahead instanceof Keyword && ((Keyword) lookahead).isSort()) {
			index = index + 1;
			String annotation = null;
			if (adjacentUniverse()) {
				annotation = tokens.get(index++).text;
			}
			return new Term.Sort(lookahead.text, annotation, sourceAttr(start, index - 1));
		} else if (lookahead instanceof Existential) {
			index = index + 1;
			return new Term.Variable(lookahead.text, sourceAttr(start, index - 1));
		} else if (lookahead instanceof Identifier || lookahead instanceof Int || lookahead instanceof Operator) {
			index = index + 1;
			String name = lookahead.text;
			if (adjacentUniverse()) {
				name += tokens.get(index++).text;
			}
			return new Term.Variable(name, sourceAttr(start, index - 1));
		}
		syntaxError("unexpected '" + lookahead.text + "'", lookahead);
		return null; // unreachable
	}

	/**
	 * Parse a bracketed term or a cast, of the form:
	 *
	 * <pre>
	 * Bracketed ::= '(' Term (':' Term)? ')'
	 * </pre>
	 *
	 * @return
	 */
	public Term parseBracketedExpression() {
		int start = index;
		match("(");
		Term term = parseTerm();
		if (lookahead(Colon.class)) {
			match(":");
			Term type = parseTerm();
			match(")");
			return new Term.Cast(term, type, sourceAttr(start, index - 1));
		}
		match(")");
		return term;
	}

	/**
	 * Parse a pattern match, of the form:
	 *
	 * <pre>
	 * Match ::= 'match' Subject (',' Subject)* ('return' Term)? 'with'
	 *           '|'? (Clause ('|' Clause)*)? 'end'
	 * </pre>
	 *
	 * @return
	 */
	public Term.Match parseMatch() {
		int start = index;
		matchKeyword("match");
		ArrayList<MatchSubject> subjects = new ArrayList<>();
		subjects.add(parseSubject());
		while (lookahead(Comma.class)) {
			match(",");
			subjects.add(parseSubject());
		}
		Term returnType = null;
		if (lookaheadKeyword("return")) {
			matchKeyword("return");
			returnType = parseTerm();
		}
		matchKeyword("with");
		ArrayList<CaseClause> cases = new ArrayList<>();
		if (lookahead(Bar.class)) {
			match("|");
		}
		if (!lookaheadKeyword("end")) {
			cases.add(parseCaseClause());
			while (lookahead(Bar.class)) {
				match("|");
				cases.add(parseCaseClause());
			}
		}
		matchKeyword("end");
		return new Term.Match(subjects, cases, returnType, sourceAttr(start, index - 1));
	}

	public MatchSubject parseSubject() {
		int start = index;
		Term term = parseApplication();
		Term.Variable alias = null;
		if (lookaheadKeyword("as")) {
			matchKeyword("as");
			alias = parseBinderName();
		}
		Pattern pattern = null;
		if (lookaheadKeyword("in")) {
			matchKeyword("in");
			pattern = parsePattern();
		}
		return new MatchSubject(term, alias, pattern, sourceAttr(start, index - 1));
	}

	public CaseClause parseCaseClause() {
		int start = index;
		ArrayList<Pattern> patterns = new ArrayList<>();
		patterns.add(parsePattern());
		while (lookahead(Comma.class)) {
			match(",");
			patterns.add(parsePattern());
		}
		match("=>");
		Term body = parseTerm();
		return new CaseClause(patterns, body, sourceAttr(start, index - 1));
	}

	/**
	 * Parse a pattern, of the form:
	 *
	 * <pre>
	 * Pattern ::= Name+ ('as' Name)? | '(' Pattern ')'
	 * </pre>
	 *
	 * @return
	 */
	public Pattern parsePattern() {
		int start = index;
		if (lookahead(LeftBrace.class)) {
			match("(");
			Pattern pattern = parsePattern();
			match(")");
			return pattern;
		}
		ArrayList<Term.Variable> names = new ArrayList<>();
		do {
			Token t = match(Token.class, "a pattern");
			if (!(t instanceof Identifier || t instanceof Int)) {
				syntaxError("expecting a pattern, found '" + t.text + "'", t);
			}
			names.add(new Term.Variable(t.text, sourceAttr(index - 1, index - 1)));
		} while (lookahead(Identifier.class) || lookahead(Int.class));
		Term.Variable alias = null;
		if (lookaheadKeyword("as")) {
			matchKeyword("as");
			alias = parseBinderName();
		}
		return new Pattern(names, alias, sourceAttr(start, index - 1));
	}

	/**
	 * Parse one or more binders, of the form:
	 *
	 * <pre>
	 * Binders ::= Name+ (':' Term)? | ('(' Name+ ':' Term ')')+
	 * </pre>
	 *
	 * When the names are not bracketed and no type is given (or types are not
	 * permitted), their type is the wildcard.
	 *
	 * @param typed Indicates whether unbracketed names may be followed by a type.
	 * @return
	 */
	public List<Binder> parseBinders(boolean typed) {
		ArrayList<Binder> binders = new ArrayList<>();
		if (lookahead(LeftBrace.class)) {
			while (lookahead(LeftBrace.class)) {
				int start = index;
				match("(");
				List<Term.Variable> names = parseBinderNames();
				match(":");
				Term type = parseTerm();
				match(")");
				binders.add(new Binder(names, type, sourceAttr(start, index - 1)));
			}
		} else {
			int start = index;
			List<Term.Variable> names = parseBinderNames();
			Term type = hole();
			if (typed && lookahead(Colon.class)) {
				match(":");
				type = parseTerm();
			}
			binders.add(new Binder(names, type, sourceAttr(start, index - 1)));
		}
		return binders;
	}

	private List<Term.Variable> parseBinderNames() {
		ArrayList<Term.Variable> names = new ArrayList<>();
		do {
			names.add(parseBinderName());
		} while (lookahead(Identifier.class));
		return names;
	}

	private Term.Variable parseBinderName() {
		Identifier name = matchIdentifier();
		return new Term.Variable(name.text, sourceAttr(index - 1, index - 1));
	}

	private static boolean parametersInclude(List<Binder> parameters, Term.Variable name) {
		for (Binder b : parameters) {
			if (b.names().contains(name)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Construct a placeholder for an omitted type.
	 *
	 * @return
	 */
	private static Term hole() {
		return new Term.Variable(Syntax.WILDCARD);
	}

	private boolean isAtomStart(Token t) {
		return t instanceof Identifier || t instanceof Int || t instanceof Operator || t instanceof Existential
				|| t instanceof LeftBrace || isKeyword(t, "match") || (t instanceof Keyword && ((Keyword) t).isSort());
	}

	private boolean isBinderStart(Token t) {
		return isKeyword(t, "forall") || isKeyword(t, "fun") || isKeyword(t, "let") || isKeyword(t, "fix")
				|| isKeyword(t, "if");
	}

	/**
	 * Check whether the next token is a universe instance written immediately
	 * after the previous token (e.g. <code>Type@{u}</code>).
	 *
	 * @return
	 */
	private boolean adjacentUniverse() {
		if (index < tokens.size() && tokens.get(index) instanceof Universe) {
			Token previous = tokens.get(index - 1);
			return previous.end() + 1 == tokens.get(index).start;
		}
		return false;
	}

	private static boolean isKeyword(Token t, String keyword) {
		return t instanceof Keyword && t.text.equals(keyword);
	}

	private boolean lookahead(Class<? extends Token> kind) {
		return index < tokens.size() && kind.isInstance(tokens.get(index));
	}

	private boolean lookaheadKeyword(String keyword) {
		return index < tokens.size() && isKeyword(tokens.get(index), keyword);
	}

	private void checkNotEof() {
		if (index >= tokens.size()) {
			int end = Math.max(0, input.length() - 1);
			throw new SyntaxError("unexpected end-of-input", input, end, end);
		}
	}

	private void checkEof() {
		if (index < tokens.size()) {
			Token t = tokens.get(index);
			syntaxError("unexpected '" + t.text + "'", t);
		}
	}

	private Token match(String op) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!t.text.equals(op) || t instanceof Identifier || t instanceof Keyword) {
			syntaxError("expecting '" + op + "', found '" + t.text + "'", t);
		}
		index = index + 1;
		return t;
	}

	@SuppressWarnings("unchecked")
	private <T extends Token> T match(Class<T> c, String name) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!c.isInstance(t)) {
			syntaxError("expecting " + name + ", found '" + t.text + "'", t);
		}
		index = index + 1;
		return (T) t;
	}

	private Identifier matchIdentifier() {
		return match(Identifier.class, "an identifier");
	}

	private Keyword matchKeyword(String keyword) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!isKeyword(t, keyword)) {
			syntaxError("keyword " + keyword + " expected, found '" + t.text + "'", t);
		}
		index = index + 1;
		return (Keyword) t;
	}

	private Attribute.Source sourceAttr(int start, int end) {
		Token t1 = tokens.get(start);
		Token t2 = tokens.get(end);
		return new Attribute.Source(t1.start, t2.end());
	}

	private void syntaxError(String msg, Token t) {
		throw new SyntaxError(msg, input, t.start, t.end());
	}
}
