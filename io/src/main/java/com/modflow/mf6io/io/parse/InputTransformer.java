package com.modflow.mf6io.io.parse;

import com.modflow.mf6io.io.array.ConstantArray;
import com.modflow.mf6io.io.array.InternalArray;
import com.modflow.mf6io.io.parse.ast.BlockNode;
import com.modflow.mf6io.io.parse.ast.InputNode;
import com.modflow.mf6io.io.parse.ast.LineNode;
import com.modflow.mf6io.io.parse.ast.TokenKind;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a parsed input file into plain Java values without a component specification, given only
 * the parameter names and block names to look for.
 *
 * <p>Dictionary blocks become a map from lower-case parameter name to value: {@code TRUE} for a
 * bare keyword, a number or string for {@code NAME VALUE}, a {@link Path} for
 * {@code NAME FILEIN|FILEOUT path}, an array for {@code NAME INTERNAL ...} or
 * {@code NAME CONSTANT v}, and the remaining tokens joined by blanks otherwise. List blocks become a
 * list of lines, each a list of its tokens converted to numbers where they are numeric; they are
 * keyed {@code "period 1"} when the block carries an index. Other blocks and names are skipped.
 */
public final class InputTransformer {
    private static final Logger LOGGER = Logger.getLogger(InputTransformer.class.getName());

    private final Set<String> params;
    private final Set<String> dictBlocks;
    private final Set<String> listBlocks;

    public InputTransformer(Collection<String> params, Collection<String> dictBlocks, Collection<String> listBlocks) {
        this.params = lowerCase(params);
        this.dictBlocks = lowerCase(dictBlocks);
        this.listBlocks = lowerCase(listBlocks);
    }

    public Map<String, Object> transform(InputNode input) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (BlockNode block : input.getBlocks()) {
            if (dictBlocks.contains(block.getName())) {
                result.put(key(block), dictionary(block));
            } else if (listBlocks.contains(block.getName())) {
                result.put(key(block), list(block));
            } else {
                LOGGER.log(Level.FINE, "Skipping block {0} of {1}", new Object[] {block, input.getSourceName()});
            }
        }
        return result;
    }

    private static String key(BlockNode block) {
        return block.getIndex() == null ? block.getName() : block.getName() + " " + block.getIndex();
    }

    private Map<String, Object> dictionary(BlockNode block) {
        Map<String, Object> values = new LinkedHashMap<>();
        List<LineNode> lines = block.getLines();
        for (int i = 0; i < lines.size(); i++) {
            LineNode line = lines.get(i);
            if (!params.contains(line.key())) {
                if (!line.isNumeric()) {
                    LOGGER.log(Level.FINE, "Skipping unknown parameter {0}", line);
                }
                continue;
            }
            if (line.size() == 1) {
                values.put(line.key(), Boolean.TRUE);
                continue;
            }
            String second = line.token(1).toUpperCase(Locale.ROOT);
            if ("INTERNAL".equals(second)) {
                List<LineNode> data = new ArrayList<>();
                while (i + 1 < lines.size() && lines.get(i + 1).isNumeric()) {
                    data.add(lines.get(++i));
                }
                values.put(line.key(), internal(line, data));
            } else if ("CONSTANT".equals(second) && line.size() == 3) {
                values.put(line.key(), new ConstantArray(new int[0], NumberParser.parseDouble(line.token(2))));
            } else if (("FILEIN".equals(second) || "FILEOUT".equals(second)) && line.size() == 3) {
                values.put(line.key(), Path.of(line.token(2)));
            } else if (line.size() == 2) {
                values.put(line.key(), nativeValue(line.token(1), line.kind(1)));
            } else {
                values.put(line.key(), String.join(" ", line.getTokens().subList(1, line.size())));
            }
        }
        return values;
    }

    private static InternalArray internal(LineNode control, List<LineNode> data) {
        double factor = 1.0;
        List<Double> numbers = new ArrayList<>();
        for (int t = 2; t < control.size(); t++) {
            if ("FACTOR".equalsIgnoreCase(control.token(t)) && t + 1 < control.size()) {
                factor = NumberParser.parseDouble(control.token(++t));
            } else if ("IPRN".equalsIgnoreCase(control.token(t)) && t + 1 < control.size()) {
                t++;
            } else {
                numbers.add(NumberParser.parseDouble(control.token(t)));
            }
        }
        for (LineNode line : data) {
            for (String token : line.getTokens()) {
                numbers.add(NumberParser.parseDouble(token));
            }
        }
        double[] raw = new double[numbers.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = numbers.get(i);
        }
        return new InternalArray(new int[] {raw.length}, raw, factor, null);
    }

    private static List<List<Object>> list(BlockNode block) {
        List<List<Object>> rows = new ArrayList<>();
        for (LineNode line : block.getLines()) {
            List<Object> row = new ArrayList<>(line.size());
            for (int t = 0; t < line.size(); t++) {
                row.add(nativeValue(line.token(t), line.kind(t)));
            }
            rows.add(row);
        }
        return rows;
    }

    static Object nativeValue(String token, TokenKind kind) {
        if (kind == TokenKind.INTEGER) {
            try {
                return NumberParser.parseInt(token);
            } catch (NumberFormatException ex) {
                // too large for an int
                return NumberParser.parseDouble(token);
            }
        }
        if (kind == TokenKind.FLOAT) {
            return NumberParser.parseDouble(token);
        }
        return token;
    }

    private static Set<String> lowerCase(Collection<String> names) {
        Set<String> lowered = new TreeSet<>();
        for (String name : names) {
            lowered.add(name.toLowerCase(Locale.ROOT));
        }
        return lowered;
    }
}
