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
package goalclones.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import goalclones.util.SyntacticElement;

/**
 * The abstract syntax of goals. A goal is a term of the Gallina calculus:
 * variables, sorts, applications, casts, the abstraction family (functions,
 * dependent products and local definitions), guarded fixpoints, dependent
 * conditionals and dependent pattern matches. Every term is immutable once
 * constructed, and its <code>equals()</code> method implements name-sensitive
 * structural equality.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int TERM_variable = 0;
	public final static int TERM_sort = 1;
	public final static int TERM_application = 2;
	public final static int TERM_cast = 3;
	public final static int TERM_function = 4;
	public final static int TERM_product = 5;
	public final static int TERM_let = 6;
	public final static int TERM_fixpoint = 7;
	public final static int TERM_conditional = 8;
	public final static int TERM_match = 9;

	/**
	 * The name of a binder which binds nothing. This is also used to represent a
	 * type annotation which was omitted.
	 */
	public final static String WILDCARD = "_";

	public interface Term extends SyntacticElement {

		/**
		 * Get the opcode associated with the syntactic form of this term.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * An abstract term to be implemented by all other terms.
		 * @author David J. Pearce
		 *
		 */
		public static abstract class AbstractTerm extends SyntacticElement.Impl implements Term {
			private final int opcode;

			public AbstractTerm(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}
		}

		/**
		 * Represents a variable, such as <code>x</code>, <code>Nat.add</code>,
		 * <code>eq@{u}</code> or <code>?H</code>. Numerals and operator symbols are
		 * treated as variables as well. Two variables are the same iff their names
		 * are the same.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Variable extends AbstractTerm {
			private final String name;

			public Variable(String name, Attribute... attributes) {
				super(TERM_variable, attributes);
				this.name = requireNonNull(name, "variable name");
				if (name.isEmpty()) {
					throw new IllegalArgumentException("empty variable name");
				}
			}

			public String name() {
				return name;
			}

			/**
			 * Check whether this is the wildcard variable <code>_</code>.
			 *
			 * @return
			 */
			public boolean isWildcard() {
				return name.equals(WILDCARD);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * Represents a sort, such as <code>Prop</code> or <code>Type@{u}</code>. The
		 * universe annotation is retained as an opaque string. Sorts bind nothing.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Sort extends AbstractTerm {
			private final String keyword;
			private final String annotation;

			public Sort(String keyword, Attribute... attributes) {
				this(keyword, null, attributes);
			}

			public Sort(String keyword, String annotation, Attribute... attributes) {
				super(TERM_sort, attributes);
				this.keyword = requireNonNull(keyword, "sort keyword");
				this.annotation = annotation;
			}

			public String keyword() {
				return keyword;
			}

			public boolean hasAnnotation() {
				return annotation != null;
			}

			/**
			 * Get the universe annotation, or <code>null</code> if there is none.
			 *
			 * @return
			 */
			public String annotation() {
				return annotation;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Sort) {
					Sort s = (Sort) o;
					return keyword.equals(s.keyword) && Objects.equals(annotation, s.annotation);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return keyword.hashCode() ^ Objects.hashCode(annotation);
			}

			@Override
			public String toString() {
				return annotation == null ? keyword : keyword + annotation;
			}
		}

		/**
		 * Represents the application of a function to a single argument, such as
		 * <code>f x</code>. Application is left associative, hence
		 * <code>f x y</code> is <code>(f x) y</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Application extends AbstractTerm {
			private final Term function;
			private final Term argument;

			public Application(Term function, Term argument, Attribute... attributes) {
				super(TERM_application, attributes);
				this.function = requireNonNull(function, "function");
				this.argument = requireNonNull(argument, "argument");
			}

			public Term function() {
				return function;
			}

			public Term argument() {
				return argument;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Application) {
					Application a = (Application) o;
					return function.equals(a.function) && argument.equals(a.argument);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return 31 * function.hashCode() + argument.hashCode();
			}

			@Override
			public String toString() {
				return bracketApplication(function) + " " + bracketArgument(argument);
			}
		}

		/**
		 * Represents a type cast, such as <code>(x : nat)</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Cast extends AbstractTerm {
			private final Term term;
			private final Term type;

			public Cast(Term term, Term type, Attribute... attributes) {
				super(TERM_cast, attributes);
				this.term = requireNonNull(term, "term");
				this.type = requireNonNull(type, "type");
			}

			public Term term() {
				return term;
			}

			public Term type() {
				return type;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Cast) {
					Cast c = (Cast) o;
					return term.equals(c.term) && type.equals(c.type);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return 37 * term.hashCode() + type.hashCode();
			}

			@Override
			public String toString() {
				return "(" + term + " : " + type + ")";
			}
		}

		/**
		 * A term which binds exactly one variable over a body. The declared type of
		 * the variable is evaluated in the outer scope.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class Abstraction extends AbstractTerm {
			protected final Variable variable;
			protected final Term type;
			protected final Term body;

			public Abstraction(int opcode, Variable variable, Term type, Term body, Attribute... attributes) {
				super(opcode, attributes);
				this.variable = requireNonNull(variable, "bound variable");
				this.type = requireNonNull(type, "type");
				this.body = requireNonNull(body, "body");
			}

			/**
			 * Get the variable bound by this abstraction.
			 *
			 * @return
			 */
			public Variable variable() {
				return variable;
			}

			/**
			 * Get the declared type of the bound variable.
			 *
			 * @return
			 */
			public Term type() {
				return type;
			}

			/**
			 * Get the term over which the variable is bound.
			 *
			 * @return
			 */
			public Term body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Abstraction) {
					Abstraction a = (Abstraction) o;
					return getOpcode() == a.getOpcode() && variable.equals(a.variable) && type.equals(a.type)
							&& body.equals(a.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return getOpcode() ^ variable.hashCode() ^ (31 * type.hashCode()) ^ (37 * body.hashCode());
			}
		}

		/**
		 * Represents a function abstraction, such as <code>fun (x : nat) => x</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Function extends Abstraction {

			public Function(Variable variable, Term type, Term body, Attribute... attributes) {
				super(TERM_function, variable, type, body, attributes);
			}

			@Override
			public String toString() {
				return "fun (" + variable + " : " + type + ") => " + body;
			}

			/**
			 * Construct nested functions from one or more binder groups. For example,
			 * <code>fun (x y : A) (z : B) => e</code> becomes
			 * <code>fun x : A => fun y : A => fun z : B => e</code>, with the rightmost
			 * name innermost.
			 *
			 * @param binders
			 * @param body
			 * @return
			 */
			public static Function build(List<Binder> binders, Term body, Attribute... attributes) {
				if (binders.isEmpty()) {
					throw new IllegalArgumentException("function requires at least one binder");
				}
				Term fun = body;
				for (int i = binders.size() - 1; i >= 0; --i) {
					Binder binder = binders.get(i);
					List<Variable> names = binder.names();
					for (int j = names.size() - 1; j >= 0; --j) {
						fun = new Function(names.get(j), binder.type(), fun, attributes);
					}
				}
				return (Function) fun;
			}
		}

		/**
		 * Represents a dependent product, such as <code>forall (n : nat), n = n</code>.
		 * A non-dependent arrow <code>A -> B</code> is a product whose bound variable
		 * is the wildcard.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Product extends Abstraction {

			public Product(Variable variable, Term type, Term body, Attribute... attributes) {
				super(TERM_product, variable, type, body, attributes);
			}

			@Override
			public String toString() {
				if (variable.isWildcard()) {
					return bracketApplication(type) + " -> " + body;
				} else {
					return "forall (" + variable + " : " + type + "), " + body;
				}
			}

			/**
			 * Construct nested products from one or more binder groups, with the
			 * rightmost name innermost.
			 *
			 * @param binders
			 * @param body
			 * @return
			 */
			public static Product build(List<Binder> binders, Term body, Attribute... attributes) {
				if (binders.isEmpty()) {
					throw new IllegalArgumentException("product requires at least one binder");
				}
				Term product = body;
				for (int i = binders.size() - 1; i >= 0; --i) {
					Binder binder = binders.get(i);
					List<Variable> names = binder.names();
					for (int j = names.size() - 1; j >= 0; --j) {
						product = new Product(names.get(j), binder.type(), product, attributes);
					}
				}
				return (Product) product;
			}
		}

		/**
		 * Represents a local definition, such as <code>let x : nat := 1 in x + x</code>.
		 * The definition is evaluated in the outer scope.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Let extends Abstraction {
			private final Term definition;

			public Let(Variable variable, Term type, Term definition, Term body, Attribute... attributes) {
				super(TERM_let, variable, type, body, attributes);
				this.definition = requireNonNull(definition, "definition");
			}

			/**
			 * Return the term which the variable is defined as.
			 *
			 * @return
			 */
			public Term definition() {
				return definition;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Let && super.equals(o) && definition.equals(((Let) o).definition);
			}

			@Override
			public int hashCode() {
				return super.hashCode() ^ definition.hashCode();
			}

			@Override
			public String toString() {
				return "let " + variable + " : " + type + " := " + definition + " in " + body;
			}
		}

		/**
		 * Represents a guarded fixpoint, such as:
		 *
		 * <pre>
		 * fix f (n : nat) {struct n} : nat := match n with O => O | S m => f m end
		 * </pre>
		 *
		 * The name of the fixpoint and all of its parameters are in scope in the
		 * return type and the body.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Fixpoint extends AbstractTerm {
			private final Variable name;
			private final List<Binder> parameters;
			private final Variable struct;
			private final Term returnType;
			private final Term body;

			public Fixpoint(Variable name, List<Binder> parameters, Variable struct, Term returnType, Term body,
					Attribute... attributes) {
				super(TERM_fixpoint, attributes);
				this.name = requireNonNull(name, "fixpoint name");
				this.parameters = freeze(parameters, "fixpoint parameters");
				this.struct = struct;
				this.returnType = requireNonNull(returnType, "return type");
				this.body = requireNonNull(body, "body");
				if (struct != null && !parameterNames().contains(struct)) {
					throw new IllegalArgumentException("struct argument " + struct + " is not a parameter of " + name);
				}
			}

			/**
			 * Get the name by which the fixpoint refers to itself.
			 *
			 * @return
			 */
			public Variable name() {
				return name;
			}

			public List<Binder> parameters() {
				return parameters;
			}

			/**
			 * Get the names of all parameters across all binder groups, in declaration
			 * order.
			 *
			 * @return
			 */
			public List<Variable> parameterNames() {
				ArrayList<Variable> names = new ArrayList<>();
				for (Binder p : parameters) {
					names.addAll(p.names());
				}
				return names;
			}

			public boolean hasStruct() {
				return struct != null;
			}

			/**
			 * Get the designated structurally decreasing parameter, or
			 * <code>null</code> if none was given.
			 *
			 * @return
			 */
			public Variable struct() {
				return struct;
			}

			public Term returnType() {
				return returnType;
			}

			public Term body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Fixpoint) {
					Fixpoint f = (Fixpoint) o;
					return name.equals(f.name) && parameters.equals(f.parameters) && Objects.equals(struct, f.struct)
							&& returnType.equals(f.returnType) && body.equals(f.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ parameters.hashCode() ^ (31 * returnType.hashCode()) ^ (37 * body.hashCode());
			}

			@Override
			public String toString() {
				String r = "fix " + name;
				for (Binder p : parameters) {
					r += " " + p;
				}
				if (hasStruct()) {
					r += " {struct " + struct + "}";
				}
				return r + " : " + returnType + " := " + body;
			}
		}

		/**
		 * Represents a dependent conditional, such as:
		 *
		 * <pre>
		 * if b as c return P c then x else y
		 * </pre>
		 *
		 * The alias of the guard is in scope only in the return type (the
		 * "motive"). Both the alias and the motive are optional.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Conditional extends AbstractTerm {
			private final Term guard;
			private final Variable alias;
			private final Term returnType;
			private final Term trueBranch;
			private final Term falseBranch;

			public Conditional(Term guard, Variable alias, Term returnType, Term trueBranch, Term falseBranch,
					Attribute... attributes) {
				super(TERM_conditional, attributes);
				this.guard = requireNonNull(guard, "guard");
				this.alias = alias;
				this.returnType = returnType;
				this.trueBranch = requireNonNull(trueBranch, "true branch");
				this.falseBranch = requireNonNull(falseBranch, "false branch");
			}

			public Term guard() {
				return guard;
			}

			public boolean hasAlias() {
				return alias != null;
			}

			public Variable alias() {
				return alias;
			}

			public boolean hasReturnType() {
				return returnType != null;
			}

			public Term returnType() {
				return returnType;
			}

			public Term trueBranch() {
				return trueBranch;
			}

			public Term falseBranch() {
				return falseBranch;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Conditional) {
					Conditional c = (Conditional) o;
					return guard.equals(c.guard) && Objects.equals(alias, c.alias)
							&& Objects.equals(returnType, c.returnType) && trueBranch.equals(c.trueBranch)
							&& falseBranch.equals(c.falseBranch);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return guard.hashCode() ^ Objects.hashCode(returnType) ^ (31 * trueBranch.hashCode())
						^ (37 * falseBranch.hashCode());
			}

			@Override
			public String toString() {
				String r = "if " + guard;
				if (alias != null) {
					r += " as " + alias;
				}
				if (returnType != null) {
					r += " return " + returnType;
				}
				return r + " then " + trueBranch + " else " + falseBranch;
			}
		}

		/**
		 * Represents a dependent pattern match, such as:
		 *
		 * <pre>
		 * match n as m return P m with O => p0 | S k => pS k end
		 * </pre>
		 *
		 * The order of case clauses is irrelevant to equality.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Match extends AbstractTerm {
			private final List<MatchSubject> subjects;
			private final List<CaseClause> cases;
			private final Term returnType;

			public Match(List<MatchSubject> subjects, List<CaseClause> cases, Term returnType,
					Attribute... attributes) {
				super(TERM_match, attributes);
				this.subjects = freeze(subjects, "match subjects");
				this.cases = Collections.unmodifiableList(new ArrayList<>(requireNonNull(cases, "case clauses")));
				this.returnType = returnType;
			}

			public List<MatchSubject> subjects() {
				return subjects;
			}

			/**
			 * Get the case clauses of this match, in the order they were written.
			 *
			 * @return
			 */
			public List<CaseClause> cases() {
				return cases;
			}

			public boolean hasReturnType() {
				return returnType != null;
			}

			public Term returnType() {
				return returnType;
			}

			/**
			 * Get the variables bound by all subjects (i.e. their aliases and
			 * <code>in</code> patterns), in declaration order. These are in scope only in
			 * the return type.
			 *
			 * @return
			 */
			public List<Variable> boundVariables() {
				ArrayList<Variable> bvs = new ArrayList<>();
				for (MatchSubject s : subjects) {
					bvs.addAll(s.boundVariables());
				}
				return bvs;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Match) {
					Match m = (Match) o;
					return subjects.equals(m.subjects) && sameElements(cases, m.cases)
							&& Objects.equals(returnType, m.returnType);
				}
				return false;
			}

			@Override
			public int hashCode() {
				// NOTE: summation ensures clause order does not affect the hash
				int h = 0;
				for (CaseClause c : cases) {
					h += c.hashCode();
				}
				return subjects.hashCode() ^ h ^ Objects.hashCode(returnType);
			}

			@Override
			public String toString() {
				String r = "match ";
				for (int i = 0; i != subjects.size(); ++i) {
					if (i != 0) {
						r += ", ";
					}
					r += subjects.get(i);
				}
				if (returnType != null) {
					r += " return " + returnType;
				}
				r += " with";
				for (CaseClause c : cases) {
					r += " | " + c;
				}
				return r + " end";
			}
		}
	}

	/**
	 * Represents a group of names sharing one declared type, such as
	 * <code>(x y : nat)</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Binder extends SyntacticElement.Impl {
		private final List<Term.Variable> names;
		private final Term type;

		public Binder(List<Term.Variable> names, Term type, Attribute... attributes) {
			super(attributes);
			this.names = freeze(names, "binder names");
			this.type = requireNonNull(type, "binder type");
		}

		public List<Term.Variable> names() {
			return names;
		}

		public Term type() {
			return type;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Binder) {
				Binder b = (Binder) o;
				return names.equals(b.names) && type.equals(b.type);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return names.hashCode() ^ type.hashCode();
		}

		@Override
		public String toString() {
			String r = "(";
			for (Term.Variable n : names) {
				r += n + " ";
			}
			return r + ": " + type + ")";
		}
	}

	/**
	 * Represents a pattern such as <code>S k</code> or <code>cons h t as l</code>.
	 * The first name (the "head") identifies the constructor being matched,
	 * whilst the remaining names and the alias are bound by the pattern.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Pattern extends SyntacticElement.Impl {
		private final List<Term.Variable> names;
		private final Term.Variable alias;

		public Pattern(List<Term.Variable> names, Term.Variable alias, Attribute... attributes) {
			super(attributes);
			this.names = freeze(names, "pattern names");
			this.alias = alias;
		}

		public Term.Variable head() {
			return names.get(0);
		}

		public List<Term.Variable> names() {
			return names;
		}

		public boolean hasAlias() {
			return alias != null;
		}

		public Term.Variable alias() {
			return alias;
		}

		/**
		 * Get the variables bound by this pattern, excluding the head and any
		 * wildcards.
		 *
		 * @return
		 */
		public Set<Term.Variable> boundVariables() {
			LinkedHashSet<Term.Variable> bvs = new LinkedHashSet<>();
			for (int i = 1; i < names.size(); ++i) {
				bvs.add(names.get(i));
			}
			if (alias != null) {
				bvs.add(alias);
			}
			bvs.removeIf(Term.Variable::isWildcard);
			return bvs;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Pattern) {
				Pattern p = (Pattern) o;
				return names.equals(p.names) && Objects.equals(alias, p.alias);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return names.hashCode() ^ Objects.hashCode(alias);
		}

		@Override
		public String toString() {
			String r = "";
			for (int i = 0; i != names.size(); ++i) {
				if (i != 0) {
					r += " ";
				}
				r += names.get(i);
			}
			return alias == null ? r : r + " as " + alias;
		}
	}

	/**
	 * Represents a case clause, such as <code>S k => f k</code>. Multiple patterns
	 * arise when matching on multiple subjects. Two clauses are equal when their
	 * patterns have pairwise equal heads, and their bodies are equal.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class CaseClause extends SyntacticElement.Impl {
		private final List<Pattern> patterns;
		private final Term body;

		public CaseClause(List<Pattern> patterns, Term body, Attribute... attributes) {
			super(attributes);
			this.patterns = freeze(patterns, "clause patterns");
			this.body = requireNonNull(body, "clause body");
		}

		public List<Pattern> patterns() {
			return patterns;
		}

		public Term body() {
			return body;
		}

		/**
		 * Get the heads of all patterns, in order.
		 *
		 * @return
		 */
		public List<Term.Variable> heads() {
			ArrayList<Term.Variable> heads = new ArrayList<>();
			for (Pattern p : patterns) {
				heads.add(p.head());
			}
			return heads;
		}

		/**
		 * Get the variables bound by this clause's patterns, in declaration order.
		 * These are in scope in the body.
		 *
		 * @return
		 */
		public List<Term.Variable> boundVariables() {
			ArrayList<Term.Variable> bvs = new ArrayList<>();
			for (Pattern p : patterns) {
				bvs.addAll(p.boundVariables());
			}
			return bvs;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof CaseClause) {
				CaseClause c = (CaseClause) o;
				return heads().equals(c.heads()) && body.equals(c.body);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return heads().hashCode() ^ body.hashCode();
		}

		@Override
		public String toString() {
			String r = "";
			for (int i = 0; i != patterns.size(); ++i) {
				if (i != 0) {
					r += ", ";
				}
				r += patterns.get(i);
			}
			return r + " => " + body;
		}
	}

	/**
	 * Represents the subject of a match, such as <code>v as w in vec A n</code>.
	 * The alias and the variables bound by the pattern are in scope only in the
	 * return type of the match.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class MatchSubject extends SyntacticElement.Impl {
		private final Term term;
		private final Term.Variable alias;
		private final Pattern pattern;

		public MatchSubject(Term term, Term.Variable alias, Pattern pattern, Attribute... attributes) {
			super(attributes);
			this.term = requireNonNull(term, "subject term");
			this.alias = alias;
			this.pattern = pattern;
		}

		public Term term() {
			return term;
		}

		public boolean hasAlias() {
			return alias != null;
		}

		public Term.Variable alias() {
			return alias;
		}

		public boolean hasPattern() {
			return pattern != null;
		}

		public Pattern pattern() {
			return pattern;
		}

		/**
		 * Get the (non-wildcard) variables bound by this subject's alias and pattern.
		 *
		 * @return
		 */
		public Set<Term.Variable> boundVariables() {
			LinkedHashSet<Term.Variable> bvs = new LinkedHashSet<>();
			if (alias != null && !alias.isWildcard()) {
				bvs.add(alias);
			}
			if (pattern != null) {
				bvs.addAll(pattern.boundVariables());
			}
			return bvs;
		}

		/**
		 * Construct a new subject which differs only in its term.
		 *
		 * @param term
		 * @return
		 */
		public MatchSubject withTerm(Term term) {
			return term == this.term ? this : new MatchSubject(term, alias, pattern, attributes());
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof MatchSubject) {
				MatchSubject s = (MatchSubject) o;
				return term.equals(s.term) && Objects.equals(alias, s.alias) && Objects.equals(pattern, s.pattern);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return term.hashCode() ^ Objects.hashCode(alias) ^ Objects.hashCode(pattern);
		}

		@Override
		public String toString() {
			String r = bracketApplication(term);
			if (alias != null) {
				r += " as " + alias;
			}
			if (pattern != null) {
				r += " in " + pattern;
			}
			return r;
		}
	}

	/**
	 * Represents an entry in the local context of a goal, such as
	 * <code>x y : nat</code> or <code>z := x + y : nat</code>. The former declares
	 * one or more variables of a given type, whilst the latter defines a single
	 * variable.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Hypothesis extends SyntacticElement.Impl {
		private final List<Term.Variable> names;
		private final Term definition;
		private final Term type;

		public Hypothesis(List<Term.Variable> names, Term definition, Term type, Attribute... attributes) {
			super(attributes);
			this.names = freeze(names, "hypothesis names");
			this.definition = definition;
			this.type = requireNonNull(type, "hypothesis type");
			if (definition != null && names.size() != 1) {
				throw new IllegalArgumentException("definition must name exactly one variable");
			}
		}

		public List<Term.Variable> names() {
			return names;
		}

		public boolean isDefinition() {
			return definition != null;
		}

		public Term definition() {
			return definition;
		}

		public Term type() {
			return type;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Hypothesis) {
				Hypothesis h = (Hypothesis) o;
				return names.equals(h.names) && Objects.equals(definition, h.definition) && type.equals(h.type);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return names.hashCode() ^ Objects.hashCode(definition) ^ type.hashCode();
		}

		@Override
		public String toString() {
			String r = "";
			for (int i = 0; i != names.size(); ++i) {
				if (i != 0) {
					r += ", ";
				}
				r += names.get(i);
			}
			if (definition != null) {
				r += " := " + definition;
			}
			return r + " : " + type;
		}
	}

	// =============================================================
	// Helpers
	// =============================================================

	/**
	 * Check whether two lists contain the same elements the same number of times,
	 * irrespective of their order.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static <T> boolean sameElements(List<T> lhs, List<T> rhs) {
		if (lhs.size() != rhs.size()) {
			return false;
		}
		HashMap<T, Integer> counts = new HashMap<>();
		for (T t : lhs) {
			counts.merge(t, 1, Integer::sum);
		}
		for (T t : rhs) {
			Integer c = counts.get(t);
			if (c == null) {
				return false;
			} else if (c == 1) {
				counts.remove(t);
			} else {
				counts.put(t, c - 1);
			}
		}
		return counts.isEmpty();
	}

	/**
	 * Print a term so that it can appear as an argument of an application.
	 */
	private static String bracketArgument(Term t) {
		switch (t.getOpcode()) {
		case TERM_variable:
		case TERM_sort:
		case TERM_cast:
		case TERM_match:
			return t.toString();
		default:
			return "(" + t + ")";
		}
	}

	/**
	 * Print a term so that it can appear in function position, or on the left of
	 * an arrow.
	 */
	private static String bracketApplication(Term t) {
		if (t instanceof Term.Application) {
			return t.toString();
		}
		return bracketArgument(t);
	}

	private static <T> List<T> freeze(List<T> items, String what) {
		requireNonNull(items, what);
		if (items.isEmpty()) {
			throw new IllegalArgumentException(what + " cannot be empty");
		}
		for (T item : items) {
			requireNonNull(item, what);
		}
		return Collections.unmodifiableList(new ArrayList<>(items));
	}

	private static <T> T requireNonNull(T item, String what) {
		if (item == null) {
			throw new IllegalArgumentException("missing " + what);
		}
		return item;
	}

	/**
	 * Get the <code>i</code>th synthesized variable. These are used to give bound
	 * variables canonical names during comparison. The character <code>#</code>
	 * cannot appear in a parsed name, hence these never clash with source
	 * variables.
	 *
	 * @param i
	 * @return
	 */
	public static Term.Variable synthesized(int i) {
		return new Term.Variable("SynthesizedVar#" + i);
	}
}
