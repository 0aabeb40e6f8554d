package net.littleredcomputer.symmetry;

public enum SolverStage {
    PROBLEM, PRESOLVING, SOLVING, SOLVED
}
