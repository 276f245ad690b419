package org.masmtext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** One function (or code range) of a lifted binary, as read from a listing file. */
public class Listing {
    public final String name;
    public final Architecture arch;
    public final List<Block> blocks;

    public Listing(String name, Architecture arch, List<Block> blocks) {
        this.name = name;
        this.arch = arch;
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
    }

    public List<Instruction> instructions() {
        List<Instruction> all = new ArrayList<>();
        for (Block b : blocks) all.addAll(b.instructions);
        return all;
    }
}
