package com.modflow.mf6io.io.parse.ast;

import java.util.List;

/** Parse result of one input file: its blocks in file order. */
public final class InputNode {
    private final String sourceName;
    private final List<BlockNode> blocks;

    public InputNode(String sourceName, List<BlockNode> blocks) {
        this.sourceName = sourceName;
        this.blocks = List.copyOf(blocks);
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<BlockNode> getBlocks() {
        return blocks;
    }
}
