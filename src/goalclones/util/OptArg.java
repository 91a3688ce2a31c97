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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A command-line option, which may either be a simple flag (e.g.
 * <code>--verbose</code>) or take an argument (e.g. <code>-s 10</code> or
 * <code>--min-proof-size=10</code>). Options have a long form and, optionally,
 * a short form.
 *
 * @author David J. Pearce
 *
 */
public class OptArg {
	/**
	 * The long name of this option (e.g. "verbose").
	 */
	public final String option;
	/**
	 * The short name of this option (e.g. "v"), or <code>null</code> if none.
	 */
	public final String shortForm;
	/**
	 * The kind of argument this option takes, or <code>null</code> for a flag.
	 */
	public final Kind argument;
	public final String description;
	public final Object defaultValue;

	public OptArg(String option, String shortForm, String description) {
		this(option, shortForm, null, description, null);
	}

	public OptArg(String option, String shortForm, Kind argument, String description, Object defaultValue) {
		this.option = option;
		this.shortForm = shortForm;
		this.argument = argument;
		this.description = description;
		this.defaultValue = defaultValue;
	}

	public boolean matches(String name) {
		return name.equals(option) || name.equals(shortForm);
	}

	@Override
	public String toString() {
		String r = "--" + option;
		if (shortForm != null) {
			r = "-" + shortForm + ", " + r;
		}
		if (argument != null) {
			r += " <" + argument + ">";
		}
		return r;
	}

	/**
	 * Responsible for converting the argument of an option into a value.
	 */
	public interface Kind {
		Object process(String option, String arg);
	}

	public static final Kind STRING = new Kind() {
		@Override
		public Object process(String option, String arg) {
			return arg;
		}

		@Override
		public String toString() {
			return "string";
		}
	};

	public static final Kind INT = new Kind() {
		@Override
		public Object process(String option, String arg) {
			try {
				return Integer.parseInt(arg);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("invalid integer for option " + option + ": " + arg, e);
			}
		}

		@Override
		public String toString() {
			return "int";
		}
	};

	/**
	 * Parse the options from a given list of command-line arguments. Recognised
	 * options (and their arguments) are removed from the list, leaving only the
	 * remaining arguments. Options not given which have a default value are mapped
	 * to that value, whilst flags which are given are mapped to
	 * <code>null</code>.
	 *
	 * @param args
	 * @param options
	 * @return
	 * @throws IllegalArgumentException if an option is not recognised, or is
	 *                                  missing its argument.
	 */
	public static Map<String, Object> parseOptions(List<String> args, OptArg... options) {
		HashMap<String, Object> result = new HashMap<>();
		for (OptArg opt : options) {
			if (opt.defaultValue != null) {
				result.put(opt.option, opt.defaultValue);
			}
		}
		int i = 0;
		while (i < args.size()) {
			String arg = args.get(i);
			if (!arg.startsWith("-") || arg.equals("-")) {
				i = i + 1;
				continue;
			}
			args.remove(i);
			String name = arg.startsWith("--") ? arg.substring(2) : arg.substring(1);
			String value = null;
			int eq = name.indexOf('=');
			if (eq >= 0) {
				value = name.substring(eq + 1);
				name = name.substring(0, eq);
			}
			OptArg opt = lookup(name, options);
			if (opt.argument == null) {
				if (value != null) {
					throw new IllegalArgumentException("option " + name + " does not take an argument");
				}
				result.put(opt.option, null);
			} else {
				if (value == null) {
					if (i >= args.size()) {
						throw new IllegalArgumentException("missing argument for option " + name);
					}
					value = args.remove(i);
				}
				result.put(opt.option, opt.argument.process(name, value));
			}
		}
		return result;
	}

	private static OptArg lookup(String name, OptArg... options) {
		for (OptArg opt : options) {
			if (opt.matches(name)) {
				return opt;
			}
		}
		throw new IllegalArgumentException("unrecognised option: " + name);
	}

	/**
	 * Print a description of each option to a given stream.
	 *
	 * @param out
	 * @param options
	 */
	public static void usage(PrintStream out, OptArg... options) {
		int width = 0;
		for (OptArg opt : options) {
			width = Math.max(width, opt.toString().length());
		}
		for (OptArg opt : options) {
			String r = opt.toString();
			out.print("  " + r);
			for (int i = r.length(); i < width + 2; ++i) {
				out.print(" ");
			}
			out.print(opt.description);
			if (opt.defaultValue != null) {
				out.print(" (default: " + opt.defaultValue + ")");
			}
			out.println();
		}
	}
}
