package net.littleredcomputer.symmetry.propagate;

public final class PropagationResult {
    public enum Status { DID_NOT_RUN, DID_NOT_FIND, REDUCED_DOMAINS, CUTOFF }

    public static final PropagationResult DID_NOT_RUN = new PropagationResult(Status.DID_NOT_RUN, 0, 0);
    public static final PropagationResult DID_NOT_FIND = new PropagationResult(Status.DID_NOT_FIND, 0, 0);

    private final Status status;
    private final int nFixedZero;
    private final int nFixedOne;

    private PropagationResult(Status status, int nFixedZero, int nFixedOne) {
        this.status = status;
        this.nFixedZero = nFixedZero;
        this.nFixedOne = nFixedOne;
    }

    static PropagationResult cutoff(int nFixedZero, int nFixedOne) {
        return new PropagationResult(Status.CUTOFF, nFixedZero, nFixedOne);
    }

    static PropagationResult fixed(int nFixedZero, int nFixedOne) {
        return nFixedZero + nFixedOne == 0 ? DID_NOT_FIND : new PropagationResult(Status.REDUCED_DOMAINS, nFixedZero, nFixedOne);
    }

    public Status status() { return status; }
    public boolean infeasible() { return status == Status.CUTOFF; }
    public int nFixedZero() { return nFixedZero; }
    public int nFixedOne() { return nFixedOne; }
    public int nFixings() { return nFixedZero + nFixedOne; }

    @Override
    public String toString() { return String.format("%s (%d to 0, %d to 1)", status, nFixedZero, nFixedOne); }
}
