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
package goalclones;

import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import goalclones.clones.Clone;
import goalclones.clones.CloneFinder;
import goalclones.clones.CloneReport;
import goalclones.clones.Goal;
import goalclones.core.AlphaEquivalence;
import goalclones.core.Syntax.Term;
import goalclones.io.GoalReader;
import goalclones.io.Parser;
import goalclones.util.OptArg;
import goalclones.util.SyntaxError;

/**
 * Command-line entry point. This supports two commands:
 *
 * <pre>
 * compare &lt;goal&gt; &lt;goal&gt;
 * find [options] &lt;file&gt;
 * </pre>
 *
 * The former reports whether two goals are alpha-equivalent, whilst the latter
 * searches a file of goals for clones and writes them to a report.
 *
 * @author David J. Pearce
 *
 */
public class Main {
	/**
	 * Command-line options
	 */
	private static final OptArg[] OPTIONS = {
			new OptArg("min-proof-size", "s", OptArg.INT, "set minimum proof size", CloneFinder.DEFAULT_MIN_PROOF_SIZE),
			new OptArg("output", "o", OptArg.STRING, "set report file", null),
			new OptArg("time", "t", "report time taken by each phase"),
			new OptArg("verbose", "v", "set verbose output"),
	};

	public static void main(String[] _args) {
		List<String> args = new ArrayList<>(Arrays.asList(_args));
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * Run a given command, returning the exit status.
	 *
	 * @param args
	 * @param out
	 * @param err
	 * @return
	 */
	public static int run(List<String> args, PrintStream out, PrintStream err) {
		Map<String, Object> options;
		try {
			options = OptArg.parseOptions(args, OPTIONS);
		} catch (IllegalArgumentException e) {
			return usage(err, e.getMessage());
		}
		try {
			if (args.isEmpty()) {
				return usage(err, "missing command");
			}
			String command = args.remove(0);
			switch (command) {
			case "compare":
				if (args.size() != 2) {
					return usage(err, "compare requires two goals");
				}
				return compare(args.get(0), args.get(1), out);
			case "find":
				if (args.size() != 1) {
					return usage(err, "find requires one file");
				}
				return find(args.get(0), options, out, err);
			default:
				return usage(err, "unknown command " + command);
			}
		} catch (SyntaxError e) {
			e.outputSourceError(err);
			return 1;
		} catch (IllegalArgumentException | IOException e) {
			err.println("error: " + e.getMessage());
			return 1;
		}
	}

	private static int compare(String lhs, String rhs, PrintStream out) {
		Term t1 = Parser.parse(lhs);
		Term t2 = Parser.parse(rhs);
		out.println(AlphaEquivalence.equivalent(t1, t2) ? "equivalent" : "distinct");
		return 0;
	}

	private static int find(String filename, Map<String, Object> options, PrintStream out, PrintStream err)
			throws IOException {
		boolean verbose = options.containsKey("verbose");
		boolean time = options.containsKey("time");
		int minProofSize = (Integer) options.get("min-proof-size");
		String output = (String) options.get("output");
		if (output == null) {
			output = defaultReportName(filename, minProofSize);
		}
		CloneFinder finder;
		try {
			finder = new CloneFinder(minProofSize);
		} catch (IllegalArgumentException e) {
			return usage(err, e.getMessage());
		}
		//
		long start = System.currentTimeMillis();
		List<Goal> goals;
		try (FileReader reader = new FileReader(filename, StandardCharsets.UTF_8)) {
			goals = new GoalReader(reader).read();
		}
		List<Goal> selected = finder.select(goals);
		List<CloneFinder.Candidate> candidates = finder.reduce(finder.generalize(selected));
		long preparation = System.currentTimeMillis() - start;
		if (verbose) {
			out.println("Read " + goals.size() + " goals, " + selected.size() + " selected, " + candidates.size()
					+ " after reduction");
		}
		//
		start = System.currentTimeMillis();
		List<Clone> clones = finder.search(candidates);
		long search = System.currentTimeMillis() - start;
		if (verbose) {
			for (Clone c : clones) {
				out.println("Clone: " + c.first().theorem() + " ~ " + c.second().theorem());
			}
		}
		try (Writer writer = new FileWriter(output, StandardCharsets.UTF_8)) {
			new CloneReport(clones).write(writer);
		}
		out.println("Found " + clones.size() + " clones, written to " + output);
		if (time) {
			out.println(String.format("Goal preparation time: %.4f seconds", preparation / 1000.0));
			out.println(String.format("Clone finding time: %.4f seconds", search / 1000.0));
			out.println(String.format("Total time: %.4f seconds", (preparation + search) / 1000.0));
		}
		return 0;
	}

	/**
	 * Determine the default name of the report for a given file of goals, which
	 * is of the form <code>alpha-NAME-SIZE.txt</code> where <code>NAME</code> is
	 * the file name without its extension.
	 *
	 * @param filename
	 * @param minProofSize
	 * @return
	 */
	public static String defaultReportName(String filename, int minProofSize) {
		Path path = Paths.get(filename).getFileName();
		String name = path == null ? filename : path.toString();
		int dot = name.lastIndexOf('.');
		if (dot > 0) {
			name = name.substring(0, dot);
		}
		return "alpha-" + name + "-" + minProofSize + ".txt";
	}

	private static int usage(PrintStream err, String msg) {
		err.println("error: " + msg);
		err.println("usage: goalclones compare <goal> <goal>");
		err.println("       goalclones find [options] <file>");
		OptArg.usage(err, OPTIONS);
		return 1;
	}
}
