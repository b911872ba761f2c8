package com.modflow.mf6io.io.parse.ast;

import com.modflow.mf6io.spec.SourceLocation;
import java.util.List;

/** A {@code BEGIN name [index]} ... {@code END name} section of an input file. */
public final class BlockNode {
    private final String name;
    private final Integer index;
    private final SourceLocation location;
    private final List<LineNode> lines;

    public BlockNode(String name, Integer index, SourceLocation location, List<LineNode> lines) {
        this.name = name;
        this.index = index;
        this.location = location;
        this.lines = List.copyOf(lines);
    }

    /** Lower-cased block name. */
    public String getName() {
        return name;
    }

    /** Index written after the name ({@code BEGIN PERIOD 2}), or {@code null}. */
    public Integer getIndex() {
        return index;
    }

    /** Location of the {@code BEGIN} keyword. */
    public SourceLocation getLocation() {
        return location;
    }

    public List<LineNode> getLines() {
        return lines;
    }

    @Override
    public String toString() {
        return index == null ? name : name + " " + index;
    }
}
