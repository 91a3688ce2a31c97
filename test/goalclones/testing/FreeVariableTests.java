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

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import goalclones.core.FreeVariables;
import goalclones.core.Syntax.Term;
import goalclones.io.Parser;

/**
 * Tests for determining the free variables of a goal.
 *
 * @author David J. Pearce
 *
 */
public class FreeVariableTests {

	@Test
	public void test_0x0001() {
		check("x", "x");
	}

	@Test
	public void test_0x0002() {
		check("Prop");
	}

	@Test
	public void test_0x0003() {
		check("f x (g y)", "f", "x", "g", "y");
	}

	@Test
	public void test_0x0004() {
		check("(x : A)", "x", "A");
	}

	@Test
	public void test_0x0005() {
		check("fun x : A => f x y", "A", "f", "y");
	}

	@Test
	public void test_0x0006() {
		// The type is outside the scope of the bound variable
		check("forall x : P x, x", "P", "x");
	}

	@Test
	public void test_0x0007() {
		check("A -> B", "A", "B");
	}

	@Test
	public void test_0x0008() {
		check("fun x => x");
	}

	@Test
	public void test_0x0009() {
		check("let x : T := v in g x", "T", "v", "g");
	}

	@Test
	public void test_0x000A() {
		check("let x := x in x", "x");
	}

	@Test
	public void test_0x000B() {
		check("fix f (n : nat) : P n := f n m", "nat", "P", "m");
	}

	@Test
	public void test_0x000C() {
		// Parameter types may refer to other parameters
		check("fix f (A : Type) (x : A) := x");
	}

	@Test
	public void test_0x000D() {
		check("if b as c return P c then x else y", "P", "b", "x", "y");
	}

	@Test
	public void test_0x000E() {
		check("if b then c else c", "b", "c");
	}

	@Test
	public void test_0x000F() {
		check("match n with | O => x | S k => g k end", "n", "x", "g");
	}

	@Test
	public void test_0x0010() {
		check("match v as w in vec A n return P w n with | nil => x | cons h t => g h t end", "P", "v", "vec", "x",
				"g");
	}

	@Test
	public void test_0x0011() {
		check("match n, m with | O, S k as p => f k p q end", "n", "m", "f", "q");
	}

	@Test
	public void test_0x0012() {
		check("match n return P n with end", "n", "P");
	}

	@Test
	public void test_0x0013() {
		check("?x y", "?x", "y");
	}

	@Test
	public void test_0x0014() {
		check("forall (A : Type) (l : list A), rev (rev l) = l", "list", "rev", "=");
	}

	public static void check(String input, String... expected) {
		Term t = Parser.parse(input);
		HashSet<Term.Variable> vars = new HashSet<>();
		for (String v : expected) {
			vars.add(new Term.Variable(v));
		}
		Set<Term.Variable> actual = FreeVariables.of(t);
		assertEquals(vars, actual);
	}
}
