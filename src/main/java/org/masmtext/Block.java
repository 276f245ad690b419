package org.masmtext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Basic block of a function listing, in the order the flow analysis visited it. */
public class Block {
    public final String reason;        // why the partitioner started a block here
    public final boolean staticData;
    public final List<Instruction> instructions;

    public Block(String reason, boolean staticData, List<Instruction> instructions) {
        this.reason = reason == null ? "" : reason;
        this.staticData = staticData;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
    }

    public Block(List<Instruction> instructions) {
        this("", false, instructions);
    }
}
