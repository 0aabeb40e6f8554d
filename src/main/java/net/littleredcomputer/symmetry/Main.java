package net.littleredcomputer.symmetry;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import net.littleredcomputer.symmetry.breaking.ConstraintSynthesizer;
import net.littleredcomputer.symmetry.breaking.SynthesisReport;
import net.littleredcomputer.symmetry.group.Components;
import net.littleredcomputer.symmetry.group.Orbits;
import net.littleredcomputer.symmetry.group.PermutationGroup;
import net.littleredcomputer.symmetry.group.RefinementOracle;
import net.littleredcomputer.symmetry.model.MipProblem;
import net.littleredcomputer.symmetry.model.Variable;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Main {
    private static Joiner spaceJoiner = Joiner.on(' ');
    private static Pattern binPackingRe = Pattern.compile("binpacking(\\d+),(\\d+)");
    private static Pattern pigeonholeRe = Pattern.compile("pigeonhole(\\d+),(\\d+)");
    private static Pattern sumRe = Pattern.compile("sum(\\d+)");

    private static Options options() {
        return SymmetryParameters.addOptions(new Options()
                .addOption("task", true, "what to do: detect")
                .addOption("problem", true, "canned problem: binpacking<items>,<bins>, pigeonhole<pigeons>,<holes> or sum<n>"));
    }

    static MipProblem problem(CommandLine cmd) {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        Matcher bm = binPackingRe.matcher(p);
        if (bm.matches()) return MipProblem.binPacking(Integer.parseInt(bm.group(1)), Integer.parseInt(bm.group(2)));
        Matcher pm = pigeonholeRe.matcher(p);
        if (pm.matches()) return MipProblem.pigeonhole(Integer.parseInt(pm.group(1)), Integer.parseInt(pm.group(2)));
        Matcher sm = sumRe.matcher(p);
        if (sm.matches()) return MipProblem.sum(Integer.parseInt(sm.group(1)));
        throw new IllegalArgumentException("unknown problem: " + p);
    }

    /** Detects symmetry, adds constraints as configured and prints what was found. */
    static void detect(MipProblem p, SymmetryParameters params, PrintStream out) {
        Stopwatch sw = Stopwatch.createStarted();
        Optional<PermutationGroup> og = new SymmetryDetector(params, new RefinementOracle()).detect(p);
        if (!og.isPresent()) {
            out.println("no symmetry handling for this problem");
            return;
        }
        PermutationGroup g = og.get();
        out.printf("%d generators, log10 group size %.4f%n", g.nGenerators(), g.log10GroupSize());
        for (int i = 0; i < g.nGenerators(); ++i) out.printf("  %d: %s%n", i, cycles(g, g.generator(i)));
        Orbits orbits = g.orbits();
        for (int i = 0; i < orbits.nOrbits(); ++i) {
            List<Variable> members = new ArrayList<>();
            for (int v : orbits.orbit(i)) members.add(g.variable(v));
            out.printf("orbit %d: %s%n", i, spaceJoiner.join(members));
        }
        if (params.usage().constraints() && g.nGenerators() > 0) {
            SynthesisReport r = new ConstraintSynthesizer(g, out::println, params).synthesize(params.usage().orbitalFixing());
            out.println(r);
        }
        Components c = g.components();
        out.printf("%d components, %d blocked%n", c.nComponents(), c.nBlocked());
        sw.stop();
        out.println("c " + sw);
    }

    private static String cycles(PermutationGroup g, int[] perm) {
        StringBuilder sb = new StringBuilder();
        boolean[] seen = new boolean[perm.length];
        for (int v = 0; v < perm.length; ++v) {
            if (seen[v] || perm[v] == v) continue;
            sb.append('(');
            for (int w = v; !seen[w]; w = perm[w]) {
                if (w != v) sb.append(' ');
                sb.append(g.variable(w));
                seen[w] = true;
            }
            sb.append(')');
        }
        return sb.toString();
    }

    public static void main(String[] args) throws ParseException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        switch (task) {
            case "detect":
                detect(problem(cmd), SymmetryParameters.fromCommandLine(cmd), System.out);
                break;
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }
}
