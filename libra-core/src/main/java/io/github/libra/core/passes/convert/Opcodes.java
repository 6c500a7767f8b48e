package io.github.libra.core.passes.convert;

import io.github.libra.core.error.EngineException;
import io.github.libra.core.error.Unsupported;
import io.github.libra.core.ir.Instruction;

/**
 * Maps adapter opcode strings onto the IR operator enums.
 */
final class Opcodes {
    private Opcodes() {
    }

    static Instruction.BinaryOperator parseBinary(String opcode) {
        switch (opcode) {
            case "add": return Instruction.BinaryOperator.ADD;
            case "sub": return Instruction.BinaryOperator.SUB;
            case "mul": return Instruction.BinaryOperator.MUL;
            case "udiv": return Instruction.BinaryOperator.UDIV;
            case "sdiv": return Instruction.BinaryOperator.SDIV;
            case "urem": return Instruction.BinaryOperator.UREM;
            case "srem": return Instruction.BinaryOperator.SREM;
            case "shl": return Instruction.BinaryOperator.SHL;
            case "lshr": return Instruction.BinaryOperator.LSHR;
            case "ashr": return Instruction.BinaryOperator.ASHR;
            case "and": return Instruction.BinaryOperator.AND;
            case "or": return Instruction.BinaryOperator.OR;
            case "xor": return Instruction.BinaryOperator.XOR;
            case "fadd":
            case "fsub":
            case "fmul":
            case "fdiv":
            case "frem":
                throw EngineException.unsupported(Unsupported.FLOATING_POINT);
            default:
                throw EngineException.invalidAssumption("unexpected binary opcode: %s", opcode);
        }
    }

    static Instruction.ComparePredicate parsePredicate(String predicate) {
        switch (predicate) {
            case "i_eq": return Instruction.ComparePredicate.EQ;
            case "i_ne": return Instruction.ComparePredicate.NE;
            case "i_ugt": return Instruction.ComparePredicate.UGT;
            case "i_uge": return Instruction.ComparePredicate.UGE;
            case "i_ult": return Instruction.ComparePredicate.ULT;
            case "i_ule": return Instruction.ComparePredicate.ULE;
            case "i_sgt": return Instruction.ComparePredicate.SGT;
            case "i_sge": return Instruction.ComparePredicate.SGE;
            case "i_slt": return Instruction.ComparePredicate.SLT;
            case "i_sle": return Instruction.ComparePredicate.SLE;
            default:
                if (predicate.startsWith("f_")) {
                    throw EngineException.unsupported(Unsupported.FLOATING_POINT);
                }
                throw EngineException.invalidAssumption("unexpected compare predicate: %s", predicate);
        }
    }

    static Instruction.CastOperator parseCast(String opcode) {
        switch (opcode) {
            case "trunc": return Instruction.CastOperator.TRUNC;
            case "zext": return Instruction.CastOperator.ZEXT;
            case "sext": return Instruction.CastOperator.SEXT;
            case "ptr_to_int": return Instruction.CastOperator.PTR_TO_INT;
            case "int_to_ptr": return Instruction.CastOperator.INT_TO_PTR;
            case "bitcast": return Instruction.CastOperator.BITCAST;
            case "address_space_cast":
                throw EngineException.unsupported(Unsupported.POINTER_ADDRESS_SPACE);
            case "fp_trunc":
            case "fp_ext":
            case "fp_to_ui":
            case "fp_to_si":
            case "ui_to_fp":
            case "si_to_fp":
                throw EngineException.unsupported(Unsupported.FLOATING_POINT);
            default:
                throw EngineException.invalidAssumption("unexpected cast opcode: %s", opcode);
        }
    }
}
