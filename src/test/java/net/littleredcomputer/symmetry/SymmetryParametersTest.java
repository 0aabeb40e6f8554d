package net.littleredcomputer.symmetry;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SymmetryParametersTest {
    private static SymmetryParameters parse(String... args) throws ParseException {
        CommandLine cmd = new DefaultParser().parse(SymmetryParameters.options(), args);
        return SymmetryParameters.fromCommandLine(cmd);
    }

    @Test
    public void defaults() {
        SymmetryParameters p = SymmetryParameters.defaults();
        assertThat(p.usage(), is(SymmetryParameters.Usage.ORBITAL_FIXING));
        assertThat(p.maxGenerators(), is(1500));
        assertThat(p.checkSymmetries(), is(false));
        assertThat(p.detectOrbitopes(), is(true));
        assertThat(p.detectSubgroups(), is(true));
        assertThat(p.addSymresacks(), is(true));
        assertThat(p.compressSymmetries(), is(true));
        assertThat(p.compressThreshold(), is(0.5));
        assertThat(p.addConssTiming(), is(SymmetryParameters.Timing.AFTER));
        assertThat(p.ofSymCompTiming(), is(SymmetryParameters.Timing.AFTER));
        assertThat(p.performPresolving(), is(false));
        assertThat(p.recomputeRestart(), is(true));
    }

    @Test
    public void usageFlags() {
        assertThat(SymmetryParameters.Usage.NONE.constraints(), is(false));
        assertThat(SymmetryParameters.Usage.NONE.orbitalFixing(), is(false));
        assertThat(SymmetryParameters.Usage.CONSTRAINTS.constraints(), is(true));
        assertThat(SymmetryParameters.Usage.CONSTRAINTS.orbitalFixing(), is(false));
        assertThat(SymmetryParameters.Usage.ORBITAL_FIXING.orbitalFixing(), is(true));
        assertThat(SymmetryParameters.Usage.BOTH.constraints(), is(true));
        assertThat(SymmetryParameters.Usage.BOTH.orbitalFixing(), is(true));
    }

    @Test
    public void commandLine() throws ParseException {
        SymmetryParameters p = parse("-usage", "both", "-maxgenerators", "10", "-addconsstiming", "before",
                "-checksymmetries", "1", "-compressthreshold", "0.25", "-detectsubgroups", "false");
        assertThat(p.usage(), is(SymmetryParameters.Usage.BOTH));
        assertThat(p.maxGenerators(), is(10));
        assertThat(p.addConssTiming(), is(SymmetryParameters.Timing.BEFORE));
        assertThat(p.checkSymmetries(), is(true));
        assertThat(p.compressThreshold(), is(0.25));
        assertThat(p.detectSubgroups(), is(false));
        // unset options keep their defaults
        assertThat(p.ofSymCompTiming(), is(SymmetryParameters.Timing.AFTER));
    }

    @Test
    public void numericEnumValues() throws ParseException {
        SymmetryParameters p = parse("-usage", "1", "-ofsymcomptiming", "1");
        assertThat(p.usage(), is(SymmetryParameters.Usage.CONSTRAINTS));
        assertThat(p.ofSymCompTiming(), is(SymmetryParameters.Timing.DURING));
    }

    @Test
    public void toBuilderCopiesEverything() {
        SymmetryParameters p = SymmetryParameters.builder()
                .usage(SymmetryParameters.Usage.CONSTRAINTS)
                .maxGenerators(0)
                .recomputeRestart(false)
                .compressThreshold(0.75)
                .build();
        assertThat(p.toBuilder().build().toString(), is(p.toString()));
        assertThat(p.toBuilder().maxGenerators(7).build().maxGenerators(), is(7));
        assertThat(p.maxGenerators(), is(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownUsage() throws ParseException {
        parse("-usage", "sometimes");
    }

    @Test(expected = IllegalArgumentException.class)
    public void badBoolean() throws ParseException {
        parse("-detectorbitopes", "yes");
    }

    @Test(expected = IllegalArgumentException.class)
    public void badInteger() throws ParseException {
        parse("-maxgenerators", "many");
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeMaxGenerators() {
        SymmetryParameters.builder().maxGenerators(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void thresholdOutOfRange() {
        SymmetryParameters.builder().compressThreshold(1.5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullTiming() {
        SymmetryParameters.builder().addConssTiming(null);
    }
}
