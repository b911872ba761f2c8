package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.io.parse.ast.LineNode;
import java.util.List;
import java.util.NoSuchElementException;

/** Forward-only position over the lines of a block or of one parameter's line segment. */
final class LineCursor {
    private final List<LineNode> lines;
    private int position;

    LineCursor(List<LineNode> lines) {
        this.lines = lines;
    }

    boolean hasNext() {
        return position < lines.size();
    }

    LineNode peek() {
        return hasNext() ? lines.get(position) : null;
    }

    LineNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return lines.get(position++);
    }
}
