package com.modflow.mf6io.io.value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** A decoded input file: block instances in file order. */
public final class Document {
    private final String component;
    private final List<BlockValue> blocks;

    public Document(String component, List<BlockValue> blocks) {
        this.component = component;
        this.blocks = List.copyOf(blocks);
    }

    /** Name of the component specification the document was decoded against. */
    public String getComponent() {
        return component;
    }

    public List<BlockValue> getBlocks() {
        return blocks;
    }

    /** The first instance of a block, or {@code null} if the file has none. */
    public BlockValue block(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        for (BlockValue block : blocks) {
            if (block.getName().equals(key)) {
                return block;
            }
        }
        return null;
    }

    /** The instance of a repeating block with the given index, or {@code null}. */
    public BlockValue block(String name, int index) {
        for (BlockValue block : blocks(name)) {
            if (block.getIndex() != null && block.getIndex() == index) {
                return block;
            }
        }
        return null;
    }

    /** All instances of a block in file order. */
    public List<BlockValue> blocks(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        List<BlockValue> found = new ArrayList<>();
        for (BlockValue block : blocks) {
            if (block.getName().equals(key)) {
                found.add(block);
            }
        }
        return found;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Document)) {
            return false;
        }
        Document other = (Document) obj;
        return Objects.equals(component, other.component) && blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(component, blocks);
    }

    @Override
    public String toString() {
        return component + blocks;
    }
}
