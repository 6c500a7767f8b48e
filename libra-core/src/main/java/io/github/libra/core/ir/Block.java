package io.github.libra.core.ir;

import java.util.List;
import java.util.Objects;

/**
 * A basic block: a sequence of {@link Instruction}s followed by exactly one {@link Terminator}.
 */
public final class Block {
    public final BlockLabel label;
    public final List<Instruction> body;
    public final Terminator terminator;

    public Block(BlockLabel label, List<Instruction> body, Terminator terminator) {
        this.label = label;
        this.body = body;
        this.terminator = terminator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Block block = (Block) o;
        return label.equals(block.label) && body.equals(block.body) && terminator.equals(block.terminator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, body, terminator);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(label).append(":\n");
        for (Instruction inst : body) {
            sb.append("  ").append(inst).append('\n');
        }
        sb.append("  ").append(terminator);
        return sb.toString();
    }
}
