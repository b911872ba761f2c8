package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.io.array.MfArray;
import com.modflow.mf6io.io.parse.InputAstBuilder;
import com.modflow.mf6io.io.parse.NumberParser;
import com.modflow.mf6io.io.parse.ast.BlockNode;
import com.modflow.mf6io.io.parse.ast.InputNode;
import com.modflow.mf6io.io.parse.ast.LineNode;
import com.modflow.mf6io.io.value.BlockValue;
import com.modflow.mf6io.io.value.Document;
import com.modflow.mf6io.io.value.TableValue;
import com.modflow.mf6io.spec.BlockSpec;
import com.modflow.mf6io.spec.ComponentSpec;
import com.modflow.mf6io.spec.FileDirection;
import com.modflow.mf6io.spec.Mf6Exception;
import com.modflow.mf6io.spec.Mf6ParseException;
import com.modflow.mf6io.spec.ParamKind;
import com.modflow.mf6io.spec.ParamSpec;
import com.modflow.mf6io.spec.SourceLocation;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes MODFLOW 6 input text into a {@link Document}, guided by a {@link ComponentSpec}.
 *
 * <p>Each block is decoded in two passes. The first reads keywords, scalars, file names, records
 * and keystrings; integer scalars found there become dimensions. The second reads arrays and the
 * table, whose shapes may refer to those dimensions. Integer scalars of non-repeating blocks stay
 * visible to the blocks that follow, so {@code maxbound} from {@code DIMENSIONS} bounds the table
 * of each {@code PERIOD}.
 *
 * <p>Instances are immutable and can be shared between threads.
 */
public final class Mf6Decoder {
    private static final Logger LOGGER = Logger.getLogger(Mf6Decoder.class.getName());

    private final DecodeOptions options;
    private final InputAstBuilder astBuilder = new InputAstBuilder();

    public Mf6Decoder() {
        this(DecodeOptions.defaults());
    }

    public Mf6Decoder(DecodeOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public DecodeOptions getOptions() {
        return options;
    }

    public Document decode(String text, ComponentSpec spec, DimensionContext context) throws Mf6Exception {
        return decode("<input>", text, spec, context);
    }

    public Document decode(String sourceName, String text, ComponentSpec spec, DimensionContext context)
            throws Mf6Exception {
        return decodeWithMessages(sourceName, text, spec, context).getDocument();
    }

    /** Reads a file; its {@code OPEN/CLOSE} references are resolved against the file's directory. */
    public Document decode(Path file, ComponentSpec spec, DimensionContext context) throws Mf6Exception {
        Objects.requireNonNull(file, "file");
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new Mf6Exception("Failed to read input file " + file, ex);
        }
        Path directory = file.toAbsolutePath().getParent();
        DecodeOptions fileOptions = directory == null ? options : options.withBaseDirectory(directory);
        return new Mf6Decoder(fileOptions).decode(file.toString(), text, spec, context);
    }

    public Document decode(InputNode input, ComponentSpec spec, DimensionContext context) throws Mf6Exception {
        return decodeWithMessages(input, spec, context).getDocument();
    }

    public DecodeResult decodeWithMessages(String sourceName, String text, ComponentSpec spec, DimensionContext context)
            throws Mf6Exception {
        return decodeWithMessages(astBuilder.parse(sourceName, text), spec, context);
    }

    public DecodeResult decodeWithMessages(InputNode input, ComponentSpec spec, DimensionContext context)
            throws Mf6Exception {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(spec, "spec");
        List<DecodeMessage> messages = new ArrayList<>();
        List<BlockValue> blocks = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        DimensionContext fileContext = context == null ? DimensionContext.EMPTY : context;

        for (BlockNode node : input.getBlocks()) {
            String header = headerText(node);
            BlockSpec block = spec.block(node.getName());
            if (block == null) {
                unknown(messages, "Unknown block '" + node.getName() + "' in " + spec.getName(), node.getLocation(), header);
                continue;
            }
            checkIndex(block, node, header);
            if (!seen.add(node.toString())) {
                throw new Mf6ParseException("Block appears more than once", node.getLocation(), header);
            }
            BlockDecoder decoder = new BlockDecoder(block, node, fileContext, messages);
            blocks.add(decoder.decode());
            if (!block.isRepeating()) {
                fileContext = fileContext.withAll(decoder.dimensions);
            }
        }
        LOGGER.log(
                Level.FINE,
                "Decoded {0} blocks of {1} from {2} with {3} messages",
                new Object[] {blocks.size(), spec.getName(), input.getSourceName(), messages.size()});
        return new DecodeResult(new Document(spec.getName(), blocks), messages);
    }

    private void unknown(List<DecodeMessage> messages, String message, SourceLocation location, String text)
            throws UnknownParameterException {
        if (options.isFailOnUnknownParameter()) {
            throw new UnknownParameterException(message, location, text);
        }
        messages.add(new DecodeMessage(DecodeMessage.Level.WARNING, message + ", skipped", location));
        LOGGER.log(Level.WARNING, "{0} at {1}, skipped", new Object[] {message, location});
    }

    private static void checkIndex(BlockSpec block, BlockNode node, String header) throws Mf6ParseException {
        if (block.isRepeating() && node.getIndex() == null) {
            throw new Mf6ParseException(
                    "Block " + upper(block.getName()) + " needs an index", node.getLocation(), header);
        }
        if (!block.isRepeating() && node.getIndex() != null) {
            throw new Mf6ParseException(
                    "Block " + upper(block.getName()) + " does not take an index", node.getLocation(), header);
        }
    }

    private static String headerText(BlockNode node) {
        return "BEGIN " + upper(node.getName()) + (node.getIndex() == null ? "" : " " + node.getIndex());
    }

    private static String upper(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    /** Line keys of a block's parameters. Several records may share a key ({@code HEAD ...}). */
    private static Map<String, List<ParamSpec>> lineKeys(BlockSpec block) {
        Map<String, List<ParamSpec>> keys = new LinkedHashMap<>();
        for (ParamSpec param : block.getParams().values()) {
            if (param.isBlockVariable() || param.getKind() == ParamKind.TABLE) {
                continue;
            }
            if (param.getKind() == ParamKind.RECORD && !RecordReader.keyedByOwnName(param)) {
                addKey(keys, param.getComponents().get(0).getName(), param);
            } else if (param.getKind() == ParamKind.KEYSTRING) {
                for (ParamSpec alternative : param.getComponents()) {
                    addKey(keys, alternative.getName(), param);
                    if (alternative.getKind() == ParamKind.RECORD && !RecordReader.keyedByOwnName(alternative)) {
                        addKey(keys, alternative.getComponents().get(0).getName(), param);
                    }
                }
            } else {
                addKey(keys, param.getName(), param);
            }
        }
        return keys;
    }

    private static void addKey(Map<String, List<ParamSpec>> keys, String key, ParamSpec param) {
        List<ParamSpec> params = keys.computeIfAbsent(key, k -> new ArrayList<>());
        if (!params.contains(param)) {
            params.add(param);
        }
    }

    /** Picks the parameter whose fixed leading words agree with the line. */
    private static ParamSpec choose(List<ParamSpec> candidates, LineNode line) {
        if (candidates.size() > 1) {
            for (ParamSpec candidate : candidates) {
                if (matchesLeading(candidate, line)) {
                    return candidate;
                }
            }
        }
        return candidates.get(0);
    }

    private static boolean matchesLeading(ParamSpec param, LineNode line) {
        if (param.getKind() != ParamKind.RECORD) {
            return true;
        }
        int position = RecordReader.keyedByOwnName(param) ? 1 : 0;
        for (ParamSpec component : param.getComponents()) {
            boolean keyword = component.getKind() == ParamKind.KEYWORD;
            boolean taggedValue = component.isTagged()
                    && (component.getKind().isScalar() || component.getKind() == ParamKind.FILENAME);
            if (!keyword && !taggedValue) {
                return true;
            }
            if (position < line.size() && line.token(position).equalsIgnoreCase(component.getName())) {
                if (!keyword) {
                    return true;
                }
                position++;
            } else if (!component.isOptional()) {
                return false;
            }
        }
        return position == line.size();
    }

    private static Object defaultOf(ParamSpec param) {
        String text = param.getDefaultValue();
        if (text == null || param.isList()) {
            return null;
        }
        String trimmed = text.trim();
        switch (param.getKind()) {
            case INTEGER:
                return NumberParser.isInteger(trimmed) ? NumberParser.parseInt(trimmed) : null;
            case DOUBLE:
                return NumberParser.isNumber(trimmed) ? NumberParser.parseDouble(trimmed) : null;
            case STRING:
                return trimmed.isEmpty() ? null : trimmed;
            default:
                return null;
        }
    }

    /** Decoding state of one block instance. */
    private final class BlockDecoder {
        private final BlockSpec block;
        private final BlockNode node;
        private final DimensionContext outer;
        private final List<DecodeMessage> messages;
        private final ParamSpec table;
        private final Map<String, List<ParamSpec>> keys;

        private final Map<String, Object> values = new LinkedHashMap<>();
        private final Map<String, List<Object>> repeated = new LinkedHashMap<>();
        private final Map<String, Integer> dimensions = new LinkedHashMap<>();
        private final Map<ParamSpec, List<LineNode>> arrays = new LinkedHashMap<>();
        private final List<LineNode> rows = new ArrayList<>();

        BlockDecoder(BlockSpec block, BlockNode node, DimensionContext outer, List<DecodeMessage> messages) {
            this.block = block;
            this.node = node;
            this.outer = outer;
            this.messages = messages;
            this.table = block.table();
            this.keys = lineKeys(block);
        }

        BlockValue decode() throws Mf6Exception {
            LineCursor cursor = new LineCursor(node.getLines());
            while (cursor.hasNext()) {
                LineNode line = cursor.next();
                List<ParamSpec> candidates = keys.get(line.key());
                if (candidates == null) {
                    if (table != null) {
                        rows.add(line);
                        continue;
                    }
                    unknown(
                            messages,
                            "Unknown parameter '" + line.token(0) + "' in block " + upper(block.getName()),
                            line.getLocation(),
                            line.token(0));
                    segment(line, cursor);
                    continue;
                }
                ParamSpec param = choose(candidates, line);
                if (param.getKind() == ParamKind.ARRAY) {
                    List<LineNode> segment = segment(line, cursor);
                    if (arrays.putIfAbsent(param, segment) != null) {
                        throw duplicate(param, line);
                    }
                } else {
                    store(param, readLine(param, line), line);
                }
            }

            ParamSpec variable = block.blockVariable();
            if (variable != null && node.getIndex() != null) {
                values.put(variable.getName(), node.getIndex());
            }
            DimensionContext context = outer.withAll(dimensions);
            if (variable != null && node.getIndex() != null) {
                context = context.with(variable.getName(), node.getIndex());
            }

            ArrayReader arrayReader = new ArrayReader(options.getBaseDirectory());
            for (Map.Entry<ParamSpec, List<LineNode>> entry : arrays.entrySet()) {
                MfArray array = arrayReader.read(entry.getKey(), entry.getValue(), context);
                values.put(entry.getKey().getName(), array);
            }
            if (table != null) {
                TableValue rowsValue = options.getTableReader().read(table, rows, context);
                values.put(table.getName(), rowsValue);
            }
            return new BlockValue(block.getName(), node.getIndex(), collect());
        }

        private Object readLine(ParamSpec param, LineNode line) throws Mf6Exception {
            switch (param.getKind()) {
                case KEYWORD:
                    if (line.size() != 1) {
                        throw new Mf6ParseException(
                                "Unexpected text after keyword '" + param.getName() + "'",
                                line.getLocation(),
                                line.token(1));
                    }
                    return Boolean.TRUE;
                case INTEGER:
                case DOUBLE:
                case STRING:
                    if (param.isList()) {
                        return reader().readListLine(param, line);
                    }
                    if (line.size() != 2) {
                        throw new Mf6ParseException(
                                "Expected " + upper(param.getName()) + " followed by one value",
                                line.getLocation(),
                                line.text());
                    }
                    return RecordReader.convert(param, param.getKind(), line.token(1), line);
                case FILENAME:
                    if (line.size() != 3 || FileDirection.fromToken(line.token(1)) == null) {
                        throw new Mf6ParseException(
                                "Expected " + upper(param.getName()) + " FILEIN|FILEOUT followed by a path",
                                line.getLocation(),
                                line.text());
                    }
                    return Path.of(line.token(2));
                case RECORD:
                case KEYSTRING:
                    return reader().readLine(param, line);
                default:
                    throw new Mf6ParseException(
                            "'" + param.getName() + "' cannot be read from a single line",
                            line.getLocation(),
                            line.text());
            }
        }

        private RecordReader reader() {
            return new RecordReader(outer.withAll(dimensions));
        }

        private void store(ParamSpec param, Object value, LineNode line) throws Mf6ParseException {
            String name = param.getName();
            boolean composite = param.getKind() == ParamKind.RECORD || param.getKind() == ParamKind.KEYSTRING;
            if (param.isRepeating() || (composite && block.isRepeating())) {
                repeated.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
                return;
            }
            if (values.putIfAbsent(name, value) != null) {
                throw duplicate(param, line);
            }
            if (value instanceof Integer) {
                dimensions.put(name, (Integer) value);
            }
        }

        private Mf6ParseException duplicate(ParamSpec param, LineNode line) {
            return new Mf6ParseException(
                    "'" + param.getName() + "' is given more than once in block " + upper(block.getName()),
                    line.getLocation(),
                    line.token(0));
        }

        /**
         * The lines that belong to an array or to a skipped parameter: control lines, and the
         * numeric lines after an {@code INTERNAL} control. Blocks without a table have no rows, so
         * there every numeric line is taken.
         */
        private List<LineNode> segment(LineNode nameLine, LineCursor cursor) {
            List<LineNode> segment = new ArrayList<>();
            segment.add(nameLine);
            boolean internal = nameLine.getTokens().stream().anyMatch("internal"::equalsIgnoreCase);
            while (cursor.hasNext()) {
                LineNode next = cursor.peek();
                if (ArrayReader.CONTROL_WORDS.contains(next.key())) {
                    internal = "internal".equals(next.key());
                } else if (!next.isNumeric() || !(internal || table == null)) {
                    break;
                }
                segment.add(cursor.next());
            }
            return segment;
        }

        /** Values in declaration order, with keyword and default fill-ins. */
        private Map<String, Object> collect() throws Mf6ParseException {
            Map<String, Object> collected = new LinkedHashMap<>();
            for (ParamSpec param : block.getParams().values()) {
                String name = param.getName();
                Object value = values.get(name);
                if (value == null && repeated.containsKey(name)) {
                    value = List.copyOf(repeated.get(name));
                }
                if (value == null && param.getKind() == ParamKind.KEYWORD) {
                    value = Boolean.FALSE;
                }
                if (value == null && param.isOptional()) {
                    value = defaultOf(param);
                }
                if (value != null) {
                    collected.put(name, value);
                } else if (!param.isOptional()) {
                    throw new Mf6ParseException(
                            "Missing required parameter '" + name + "' in block " + upper(block.getName()),
                            node.getLocation(),
                            headerText(node));
                }
            }
            return collected;
        }
    }
}
