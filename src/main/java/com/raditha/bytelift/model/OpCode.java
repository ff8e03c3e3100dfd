package com.raditha.bytelift.model;

/**
 * Operation codes of the instruction tree. Every {@link Instruction} subclass is tagged with exactly one.
 */
public enum OpCode {
    FUNCTION,
    BLOCK,
    LD_LOC,
    ST_LOC,
    CALL,
    CALL_VIRT,
    NEW_OBJ,
    LDC_I4,
    LD_STR,
    LD_NULL,
    LD_TYPE_TOKEN,
    BINARY_NUMERIC,
    COMP,
    LOGIC_NOT,
    IF,
    BRANCH,
    RETURN,
    NOP,
    TYPE_OF,
    STRING_CONCAT,
    COMPOUND_ASSIGNMENT
}
