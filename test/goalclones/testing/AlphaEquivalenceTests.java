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
import static org.junit.Assert.fail;

import org.junit.jupiter.api.Test;

import goalclones.core.AlphaEquivalence;
import goalclones.core.Syntax.Term;
import goalclones.io.Parser;
import goalclones.util.SyntaxError;

/**
 * Tests for deciding whether two goals are the same up to the naming of their
 * bound variables. Every check is made in both directions, and confirms that
 * neither goal is affected by the comparison.
 *
 * @author David J. Pearce
 *
 */
public class AlphaEquivalenceTests {

	// ==============================================================
	// Variables, Sorts, Applications & Casts
	// ==============================================================

	@Test
	public void test_0x0001() {
		checkEquivalent("x", "x");
	}

	@Test
	public void test_0x0002() {
		// Free variables are never renamed
		checkDistinct("x", "y");
	}

	@Test
	public void test_0x0003() {
		checkEquivalent("Prop", "Prop");
	}

	@Test
	public void test_0x0004() {
		checkDistinct("Prop", "Type");
	}

	@Test
	public void test_0x0005() {
		checkEquivalent("Type@{u}", "Type@{u}");
	}

	@Test
	public void test_0x0006() {
		checkDistinct("Type@{u}", "Type@{v}");
	}

	@Test
	public void test_0x0007() {
		checkEquivalent("f x y", "f x y");
	}

	@Test
	public void test_0x0008() {
		checkDistinct("f x y", "f y x");
	}

	@Test
	public void test_0x0009() {
		checkDistinct("f (g x)", "f g x");
	}

	@Test
	public void test_0x000A() {
		checkEquivalent("(x : nat)", "(x : nat)");
	}

	@Test
	public void test_0x000B() {
		checkDistinct("(x : nat)", "(x : bool)");
	}

	@Test
	public void test_0x000C() {
		checkEquivalent("f (fun x : A => x)", "f (fun y : A => y)");
	}

	@Test
	public void test_0x000D() {
		checkEquivalent("((fun x : A => x) : A -> A)", "((fun z : A => z) : A -> A)");
	}

	@Test
	public void test_0x000E() {
		// A sort is not a variable, even with the same name
		check(new Term.Variable("Prop"), new Term.Sort("Prop"), false);
	}

	// ==============================================================
	// Functions & Products
	// ==============================================================

	@Test
	public void test_0x0101() {
		checkEquivalent("fun x : Nat => x", "fun y : Nat => y");
	}

	@Test
	public void test_0x0102() {
		checkDistinct("fun x : Nat => x", "fun x : Bool => x");
	}

	@Test
	public void test_0x0103() {
		checkDistinct("fun x : Nat => x", "fun y : Nat => x");
	}

	@Test
	public void test_0x0104() {
		checkEquivalent("fun x : Nat => f x z", "fun y : Nat => f y z");
	}

	@Test
	public void test_0x0105() {
		checkDistinct("fun x : Nat => f x z", "fun z : Nat => f z z");
	}

	@Test
	public void test_0x0106() {
		checkEquivalent("forall n : nat, n = n", "forall m : nat, m = m");
	}

	@Test
	public void test_0x0107() {
		checkDistinct("forall n : nat, n = n", "fun n : nat => n = n");
	}

	@Test
	public void test_0x0108() {
		checkEquivalent("forall (A : Type) (x : A), x = x", "forall (B : Type) (x : B), x = x");
	}

	@Test
	public void test_0x0109() {
		checkEquivalent("forall (A : Type) (x : A), x = x", "forall (A : Type) (y : A), y = y");
	}

	@Test
	public void test_0x010A() {
		checkEquivalent("A -> B -> A", "A -> B -> A");
	}

	@Test
	public void test_0x010B() {
		checkDistinct("A -> B -> A", "(A -> B) -> A");
	}

	@Test
	public void test_0x010C() {
		// A non-dependent product is an arrow
		checkEquivalent("forall x : A, B", "A -> B");
	}

	@Test
	public void test_0x010D() {
		checkEquivalent("forall x : nat, (fun x : nat => x) x", "forall y : nat, (fun x : nat => x) y");
	}

	@Test
	public void test_0x010E() {
		checkEquivalent("fun x => x", "fun y => y");
	}

	@Test
	public void test_0x010F() {
		checkDistinct("fun x => x", "fun y : A => y");
	}

	// ==============================================================
	// Let
	// ==============================================================

	@Test
	public void test_0x0201() {
		checkEquivalent("let x := 1 in x + x", "let y := 1 in y + y");
	}

	@Test
	public void test_0x0202() {
		checkDistinct("let x := 1 in x + x", "let y := 2 in y + y");
	}

	@Test
	public void test_0x0203() {
		checkDistinct("let x : nat := 1 in x", "let y : bool := 1 in y");
	}

	@Test
	public void test_0x0204() {
		checkDistinct("let x := 1 in x", "fun x => x");
	}

	@Test
	public void test_0x0205() {
		// The definition is outside the scope of the bound variable
		checkDistinct("let x := x in x", "let y := y in y");
	}

	@Test
	public void test_0x0206() {
		checkEquivalent("let x := fun a => a in x", "let y := fun b => b in y");
	}

	// ==============================================================
	// Fixpoints
	// ==============================================================

	@Test
	public void test_0x0301() {
		checkEquivalent("fix f (x : Nat) : Nat := x", "fix g (y : Nat) : Nat := y");
	}

	@Test
	public void test_0x0302() {
		checkEquivalent("fix f (x : Nat) : Nat := f x", "fix g (y : Nat) : Nat := g y");
	}

	@Test
	public void test_0x0303() {
		checkDistinct("fix f (x : Nat) : Nat := x", "fix f (x : Bool) : Nat := x");
	}

	@Test
	public void test_0x0304() {
		checkDistinct("fix f (x : Nat) : Nat := x", "fix f (x : Nat) : Bool := x");
	}

	@Test
	public void test_0x0305() {
		checkDistinct("fix f (x : Nat) (y : Nat) : Nat := x", "fix f (x y : Nat) : Nat := x");
	}

	@Test
	public void test_0x0306() {
		checkDistinct("fix f (x : Nat) : Nat := x", "fix f (x : Nat) : Nat := f");
	}

	@Test
	public void test_0x0307() {
		// The structural argument plays no part
		checkEquivalent("fix f (x : Nat) {struct x} : Nat := x", "fix g (y : Nat) : Nat := y");
	}

	@Test
	public void test_0x0308() {
		checkEquivalent("fix f (x y : Nat) : Nat := f x y", "fix g (h i : Nat) : Nat := g h i");
	}

	@Test
	public void test_0x0309() {
		checkDistinct("fix f (x y : Nat) : Nat := f x y", "fix f (x y : Nat) : Nat := f y x");
	}

	@Test
	public void test_0x030A() {
		checkEquivalent("fix f (x : Nat) : Nat := z", "fix g (y : Nat) : Nat := z");
	}

	// ==============================================================
	// Conditionals
	// ==============================================================

	@Test
	public void test_0x0401() {
		checkEquivalent("if b then x else y", "if b then x else y");
	}

	@Test
	public void test_0x0402() {
		checkDistinct("if b then x else y", "if c then x else y");
	}

	@Test
	public void test_0x0403() {
		checkDistinct("if b then x else y", "if b then y else x");
	}

	@Test
	public void test_0x0404() {
		checkEquivalent("if b then fun x : A => x else y", "if b then fun z : A => z else y");
	}

	@Test
	public void test_0x0405() {
		checkEquivalent("if b as c return P c then x else y", "if b as d return P d then x else y");
	}

	@Test
	public void test_0x0406() {
		checkDistinct("if b as c return P c then x else y", "if b as d return P c then x else y");
	}

	@Test
	public void test_0x0407() {
		checkDistinct("if b as c return P then x else y", "if b return P then x else y");
	}

	@Test
	public void test_0x0408() {
		checkDistinct("if b return P then x else y", "if b then x else y");
	}

	@Test
	public void test_0x0409() {
		checkEquivalent("if b return P then x else y", "if b return P then x else y");
	}

	// ==============================================================
	// Matches
	// ==============================================================

	@Test
	public void test_0x0501() {
		checkEquivalent("match n with | O => 0 | S k => k end", "match m with | O => 0 | S j => j end");
	}

	@Test
	public void test_0x0502() {
		// Clause order is irrelevant
		checkEquivalent("match n with | O => 0 | S k => k end", "match n with | S k => k | O => 0 end");
	}

	@Test
	public void test_0x0503() {
		checkEquivalent("match n with | O => 0 | S k => k end", "match n with | S j => j | O => 0 end");
	}

	@Test
	public void test_0x0504() {
		checkDistinct("match n with | O => 0 | S k => k end", "match n with | O => 0 | S k => 0 end");
	}

	@Test
	public void test_0x0505() {
		checkDistinct("match n with | O => 0 | S k => k end", "match n with | Z => 0 | S k => k end");
	}

	@Test
	public void test_0x0506() {
		checkDistinct("match n with | O => 0 | S k => k end", "match n with | O => 0 end");
	}

	@Test
	public void test_0x0507() {
		checkDistinct("match n with | O => 0 end", "match n, m with | O, O => 0 end");
	}

	@Test
	public void test_0x0508() {
		checkEquivalent("match l with | cons h t => f h t | nil => z end",
				"match l with | nil => z | cons x xs => f x xs end");
	}

	@Test
	public void test_0x0509() {
		checkDistinct("match l with | cons h t => f h t | nil => z end",
				"match l with | nil => z | cons x xs => f xs x end");
	}

	@Test
	public void test_0x050A() {
		checkEquivalent("match n, m with | O, S k => k | _, _ => 0 end", "match n, m with | _, _ => 0 | O, S j => j end");
	}

	@Test
	public void test_0x050B() {
		checkEquivalent("match v as w in vec A n return P w n with | nil => 0 end",
				"match v as u in vec A m return P u m with | nil => 0 end");
	}

	@Test
	public void test_0x050C() {
		checkDistinct("match v as w in vec A n return P w n with | nil => 0 end",
				"match v as u in vec A m return P m u with | nil => 0 end");
	}

	@Test
	public void test_0x050D() {
		checkDistinct("match n return P with | O => 0 end", "match n with | O => 0 end");
	}

	@Test
	public void test_0x050E() {
		checkDistinct("match n as m return P m with | O => 0 end", "match n return P m with | O => 0 end");
	}

	@Test
	public void test_0x050F() {
		checkEquivalent("fun n : nat => match n with | O => 0 | S k => k end",
				"fun m : nat => match m with | O => 0 | S k => k end");
	}

	@Test
	public void test_0x0510() {
		checkEquivalent("match n with | S k as p => f p k end", "match n with | S j as q => f q j end");
	}

	@Test
	public void test_0x0511() {
		checkEquivalent("fun T : Type => match v in T n return P n with | c => 0 end",
				"fun U : Type => match v in U n return P n with | c => 0 end");
	}

	// ==============================================================
	// Larger goals
	// ==============================================================

	@Test
	public void test_0x0601() {
		checkEquivalent("forall (A : Type) (l : list A), rev (rev l) = l",
				"forall (B : Type) (l : list B), rev (rev l) = l");
	}

	@Test
	public void test_0x0602() {
		checkEquivalent("forall n : nat, (fix f (m : nat) : nat := match m with | O => n | S k => f k end) n = n",
				"forall x : nat, (fix f (m : nat) : nat := match m with | O => x | S k => f k end) x = x");
	}

	@Test
	public void test_0x0603() {
		checkDistinct("forall n : nat, (fix f (m : nat) : nat := match m with | O => n | S k => f k end) n = n",
				"forall x : nat, (fix f (m : nat) : nat := match m with | O => x | S k => f x end) x = x");
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	public static void checkEquivalent(String lhs, String rhs) {
		check(lhs, rhs, true);
	}

	public static void checkDistinct(String lhs, String rhs) {
		check(lhs, rhs, false);
	}

	public static void check(String lhs, String rhs, boolean expected) {
		try {
			check(Parser.parse(lhs), Parser.parse(rhs), expected);
		} catch (SyntaxError e) {
			e.outputSourceError(System.err);
			fail();
		}
	}

	public static void check(Term lhs, Term rhs, boolean expected) {
		String lhsBefore = lhs.toString();
		String rhsBefore = rhs.toString();
		// Reflexivity
		if (!AlphaEquivalence.equivalent(lhs, lhs) || !AlphaEquivalence.equivalent(rhs, rhs)) {
			fail("goal not equivalent to itself");
		}
		boolean forwards = AlphaEquivalence.equivalent(lhs, rhs);
		boolean backwards = AlphaEquivalence.equivalent(rhs, lhs);
		if (forwards != backwards) {
			fail("comparison is not symmetric: " + lhs + ", " + rhs);
		} else if (forwards != expected) {
			fail((expected ? "expected equivalent: " : "expected distinct: ") + lhs + ", " + rhs);
		}
		// Neither side should be affected
		assertEquals(lhsBefore, lhs.toString());
		assertEquals(rhsBefore, rhs.toString());
	}
}
