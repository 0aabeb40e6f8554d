package net.littleredcomputer.symmetry.model;

public enum VarType {
    BINARY, INTEGER, IMPLINT, CONTINUOUS
}
