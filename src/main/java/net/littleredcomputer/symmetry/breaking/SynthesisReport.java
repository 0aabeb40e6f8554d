package net.littleredcomputer.symmetry.breaking;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;

/** What the constraint synthesizer did with each generator. */
public final class SynthesisReport {
    public enum Coverage { ORBITOPE, SUBGROUP, SYMRESACK, ORBITAL_FIXING, NONE }

    private final Coverage[] coverage;
    private final ImmutableList<SymmetryConstraint> constraints;

    SynthesisReport(Coverage[] coverage, List<SymmetryConstraint> constraints) {
        this.coverage = coverage.clone();
        this.constraints = ImmutableList.copyOf(constraints);
    }

    public Coverage coverage(int generator) { return coverage[generator]; }
    public int nGenerators() { return coverage.length; }
    /** The constraints emitted, in emission order. */
    public List<SymmetryConstraint> constraints() { return constraints; }

    public long count(Coverage c) { return Arrays.stream(coverage).filter(x -> x == c).count(); }

    public long count(SymmetryConstraint.Kind k) { return constraints.stream().filter(c -> c.kind() == k).count(); }

    public int nOrbitopes() { return (int) count(SymmetryConstraint.Kind.ORBITOPE); }
    public int nSymresacks() { return (int) count(SymmetryConstraint.Kind.SYMRESACK); }
    public int nWeakInequalities() { return (int) count(SymmetryConstraint.Kind.WEAK_ORDERING); }

    @Override
    public String toString() {
        return String.format("%d orbitopes, %d symresacks, %d weak inequalities; generators: %d orbitope, %d subgroup, %d symresack, %d orbital fixing, %d none",
                nOrbitopes(), nSymresacks(), nWeakInequalities(),
                count(Coverage.ORBITOPE), count(Coverage.SUBGROUP), count(Coverage.SYMRESACK),
                count(Coverage.ORBITAL_FIXING), count(Coverage.NONE));
    }
}
