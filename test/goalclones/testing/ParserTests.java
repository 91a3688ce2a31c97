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
package goalclones.testing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import goalclones.core.Syntax.Binder;
import goalclones.core.Syntax.Hypothesis;
import goalclones.core.Syntax.Term;
import goalclones.io.Lexer;
import goalclones.io.Parser;
import goalclones.util.SyntacticElement.Attribute;
import goalclones.util.SyntaxError;

/**
 * Tests for reading goals and hypotheses. Valid goals are compared against the
 * term expected, and are also checked to read back from their printed form.
 *
 * @author David J. Pearce
 *
 */
public class ParserTests {
	private static final Term.Variable x = new Term.Variable("x");
	private static final Term.Variable y = new Term.Variable("y");
	private static final Term.Variable z = new Term.Variable("z");
	private static final Term.Variable f = new Term.Variable("f");
	private static final Term.Variable A = new Term.Variable("A");
	private static final Term.Variable B = new Term.Variable("B");
	private static final Term.Variable C = new Term.Variable("C");
	private static final Term.Variable HOLE = new Term.Variable("_");

	// ==============================================================
	// Atoms & Applications
	// ==============================================================

	@Test
	public void test_0x0001() {
		check("x", x);
	}

	@Test
	public void test_0x0002() {
		check("Coq.Init.Nat.add", new Term.Variable("Coq.Init.Nat.add"));
	}

	@Test
	public void test_0x0003() {
		check("f x y", app(app(f, x), y));
	}

	@Test
	public void test_0x0004() {
		check("f (x y)", app(f, app(x, y)));
	}

	@Test
	public void test_0x0005() {
		check("x + 1", app(app(x, new Term.Variable("+")), new Term.Variable("1")));
	}

	@Test
	public void test_0x0006() {
		check("Prop", new Term.Sort("Prop"));
	}

	@Test
	public void test_0x0007() {
		check("Type@{u+1}", new Term.Sort("Type", "@{u+1}"));
	}

	@Test
	public void test_0x0008() {
		check("eq@{u} x", app(new Term.Variable("eq@{u}"), x));
	}

	@Test
	public void test_0x0009() {
		check("?Goal x", app(new Term.Variable("?Goal"), x));
	}

	@Test
	public void test_0x000A() {
		check("@eq A x", app(app(new Term.Variable("@eq"), A), x));
	}

	@Test
	public void test_0x000B() {
		check("(x : A)", new Term.Cast(x, A));
	}

	@Test
	public void test_0x000C() {
		check("f (* a (* nested *) comment *) x", app(f, x));
	}

	@Test
	public void test_0x000D() {
		check("x'", new Term.Variable("x'"));
	}

	@Test
	public void test_0x000E() {
		// A binding form as the last argument extends as far as possible
		check("f fun x => x", app(f, new Term.Function(x, HOLE, x)));
	}

	@Test
	public void test_0x000F() {
		check("((x))", x);
	}

	// ==============================================================
	// Abstractions
	// ==============================================================

	@Test
	public void test_0x0101() {
		check("fun x : A => x", new Term.Function(x, A, x));
	}

	@Test
	public void test_0x0102() {
		check("fun x => x", new Term.Function(x, HOLE, x));
	}

	@Test
	public void test_0x0103() {
		// Rightmost name is innermost
		check("fun (x y : A) (z : B) => f", new Term.Function(x, A, new Term.Function(y, A, new Term.Function(z, B, f))));
	}

	@Test
	public void test_0x0104() {
		check("forall x y : A, f", new Term.Product(x, A, new Term.Product(y, A, f)));
	}

	@Test
	public void test_0x0105() {
		check("A -> B", new Term.Product(HOLE, A, B));
	}

	@Test
	public void test_0x0106() {
		// Arrows are right associative
		check("A -> B -> C", new Term.Product(HOLE, A, new Term.Product(HOLE, B, C)));
	}

	@Test
	public void test_0x0107() {
		check("(A -> B) -> C", new Term.Product(HOLE, new Term.Product(HOLE, A, B), C));
	}

	@Test
	public void test_0x0108() {
		check("forall x : A, A -> B", new Term.Product(x, A, new Term.Product(HOLE, A, B)));
	}

	@Test
	public void test_0x0109() {
		check("let x := y in x", new Term.Let(x, HOLE, y, x));
	}

	@Test
	public void test_0x010A() {
		check("let x : A := f y in f x", new Term.Let(x, A, app(f, y), app(f, x)));
	}

	// ==============================================================
	// Fixpoints, Conditionals & Matches
	// ==============================================================

	@Test
	public void test_0x0201() {
		List<Binder> params = Arrays.asList(new Binder(Arrays.asList(x), A));
		check("fix f (x : A) : B := f x", new Term.Fixpoint(f, params, null, B, app(f, x)));
	}

	@Test
	public void test_0x0202() {
		List<Binder> params = Arrays.asList(new Binder(Arrays.asList(x, y), A));
		check("fix f (x y : A) {struct y} := x", new Term.Fixpoint(f, params, y, HOLE, x));
	}

	@Test
	public void test_0x0203() {
		List<Binder> params = Arrays.asList(new Binder(Arrays.asList(x), HOLE));
		check("fix f x := x", new Term.Fixpoint(f, params, null, HOLE, x));
	}

	@Test
	public void test_0x0204() {
		check("if x then y else z", new Term.Conditional(x, null, null, y, z));
	}

	@Test
	public void test_0x0205() {
		check("if x as y return f y then y else z", new Term.Conditional(x, y, app(f, y), y, z));
	}

	@Test
	public void test_0x0206() {
		Term t = parse("match x with | O => y | S z => z end");
		Term.Match m = (Term.Match) t;
		assertEquals(1, m.subjects().size());
		assertEquals(2, m.cases().size());
		assertFalse(m.hasReturnType());
		assertEquals(Arrays.asList(z), m.cases().get(1).boundVariables());
		checkRoundTrip(t);
	}

	@Test
	public void test_0x0207() {
		// Leading bar is optional
		assertEquals(parse("match x with | O => y end"), parse("match x with O => y end"));
	}

	@Test
	public void test_0x0208() {
		Term.Match m = (Term.Match) parse("match x, y with | O, O => z | _, _ => x end");
		assertEquals(2, m.subjects().size());
		assertEquals(2, m.cases().get(0).patterns().size());
		checkRoundTrip(m);
	}

	@Test
	public void test_0x0209() {
		Term.Match m = (Term.Match) parse("match v as w in vec A n return P w n with nil => v end");
		assertTrue(m.hasReturnType());
		assertEquals(Arrays.asList(new Term.Variable("w"), A, new Term.Variable("n")), m.boundVariables());
		checkRoundTrip(m);
	}

	@Test
	public void test_0x020A() {
		Term.Match m = (Term.Match) parse("match x with end");
		assertEquals(0, m.cases().size());
	}

	@Test
	public void test_0x020B() {
		Term.Match m = (Term.Match) parse("match x with | (S k as p) => p end");
		assertEquals(new Term.Variable("p"), m.cases().get(0).patterns().get(0).alias());
	}

	@Test
	public void test_0x020C() {
		check("f (match x with end) y", app(app(f, parse("match x with end")), y));
	}

	// ==============================================================
	// Round Trips
	// ==============================================================

	@Test
	public void test_0x0301() {
		checkRoundTrip("forall (A : Type) (l : list A), rev (rev l) = l");
	}

	@Test
	public void test_0x0302() {
		checkRoundTrip("fun n : nat => fix f (m : nat) {struct m} : nat := match m with | O => n | S k => f k end");
	}

	@Test
	public void test_0x0303() {
		checkRoundTrip("f (fun x => x) (g x) (A -> B) (let x := 1 in x)");
	}

	@Test
	public void test_0x0304() {
		checkRoundTrip("if b as c return P c then (x : A) else forall y, y");
	}

	@Test
	public void test_0x0305() {
		checkRoundTrip("((A -> B) -> C) -> Type@{u}");
	}

	// ==============================================================
	// Hypotheses
	// ==============================================================

	@Test
	public void test_0x0401() {
		Hypothesis h = Parser.parseHypothesis("x, y : A");
		assertEquals(Arrays.asList(x, y), h.names());
		assertFalse(h.isDefinition());
		assertEquals(A, h.type());
	}

	@Test
	public void test_0x0402() {
		Hypothesis h = Parser.parseHypothesis("x := f y : A -> B");
		assertEquals(Arrays.asList(x), h.names());
		assertEquals(app(f, y), h.definition());
		assertEquals(new Term.Product(HOLE, A, B), h.type());
	}

	@Test
	public void test_0x0403() {
		Hypothesis h = Parser.parseHypothesis("x := y");
		assertEquals(HOLE, h.type());
	}

	@Test
	public void test_0x0404() {
		checkInvalidHypothesis("x y");
	}

	@Test
	public void test_0x0405() {
		checkInvalidHypothesis("x : A B )");
	}

	// ==============================================================
	// Source Attributes
	// ==============================================================

	@Test
	public void test_0x0501() {
		Attribute.Source s = parse("f  xy").attribute(Attribute.Source.class);
		assertEquals(0, s.start);
		assertEquals(4, s.end);
	}

	@Test
	public void test_0x0502() {
		Term.Application t = (Term.Application) parse("f (g x)");
		Attribute.Source s = t.argument().attribute(Attribute.Source.class);
		assertEquals(3, s.start);
		assertEquals(5, s.end);
	}

	// ==============================================================
	// Invalid
	// ==============================================================

	@Test
	public void test_0x0601() {
		checkInvalid("");
	}

	@Test
	public void test_0x0602() {
		checkInvalid("fun x =>");
	}

	@Test
	public void test_0x0603() {
		checkInvalid("(f x");
	}

	@Test
	public void test_0x0604() {
		checkInvalid("f x )", 4);
	}

	@Test
	public void test_0x0605() {
		checkInvalid("match x with | O => y");
	}

	@Test
	public void test_0x0606() {
		checkInvalid("let x := y x");
	}

	@Test
	public void test_0x0607() {
		checkInvalid("x # y", 2);
	}

	@Test
	public void test_0x0608() {
		checkInvalid("Type@{u");
	}

	@Test
	public void test_0x0609() {
		checkInvalid("f (* unterminated");
	}

	@Test
	public void test_0x060A() {
		checkInvalid("fix f (x : A) {struct y} := x", 22);
	}

	@Test
	public void test_0x060B() {
		// Universe instances must follow immediately
		checkInvalid("Type @{u}");
	}

	@Test
	public void test_0x060C() {
		checkInvalid("forall , x");
	}

	@Test
	public void test_0x060D() {
		checkInvalid("if x then y");
	}

	@Test
	public void test_0x060E() {
		checkInvalid("x § y");
	}

	@Test
	public void test_0x060F() {
		checkInvalid("fun (x : A => x");
	}

	@Test
	public void test_0x0610() {
		checkInvalid("match x with | (S k => k end");
	}

	@Test
	public void test_0x0611() {
		checkInvalid("@forall x");
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static Term app(Term function, Term argument) {
		return new Term.Application(function, argument);
	}

	private static Term parse(String input) {
		try {
			return new Parser(input, new Lexer(input).scan()).parseGoal();
		} catch (SyntaxError e) {
			e.outputSourceError(System.err);
			fail();
			return null;
		}
	}

	public static void check(String input, Term expected) {
		Term actual = parse(input);
		assertEquals(expected, actual);
		checkRoundTrip(actual);
	}

	public static void checkRoundTrip(String input) {
		checkRoundTrip(parse(input));
	}

	/**
	 * Check that a term reads back from its printed form.
	 *
	 * @param term
	 */
	public static void checkRoundTrip(Term term) {
		assertEquals(term, parse(term.toString()));
	}

	public static void checkInvalid(String input) {
		try {
			Parser.parse(input);
			fail("goal should not have parsed");
		} catch (SyntaxError e) {
			e.outputSourceError(System.out);
		}
	}

	public static void checkInvalid(String input, int start) {
		try {
			Parser.parse(input);
			fail("goal should not have parsed");
		} catch (SyntaxError e) {
			e.outputSourceError(System.out);
			assertEquals(start, e.start());
		}
	}

	public static void checkInvalidHypothesis(String input) {
		try {
			Parser.parseHypothesis(input);
			fail("hypothesis should not have parsed");
		} catch (SyntaxError e) {
			e.outputSourceError(System.out);
		}
	}
}
