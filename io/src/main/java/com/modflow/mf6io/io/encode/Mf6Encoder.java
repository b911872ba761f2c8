package com.modflow.mf6io.io.encode;

import com.modflow.mf6io.io.array.ConstantArray;
import com.modflow.mf6io.io.array.InternalArray;
import com.modflow.mf6io.io.array.LayeredArray;
import com.modflow.mf6io.io.array.MfArray;
import com.modflow.mf6io.io.value.BlockValue;
import com.modflow.mf6io.io.value.Document;
import com.modflow.mf6io.io.value.RecordValue;
import com.modflow.mf6io.io.value.TableValue;
import com.modflow.mf6io.spec.BlockSpec;
import com.modflow.mf6io.spec.ComponentSpec;
import com.modflow.mf6io.spec.Mf6Exception;
import com.modflow.mf6io.spec.ParamKind;
import com.modflow.mf6io.spec.ParamSpec;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a {@link Document} back to MODFLOW 6 input text. Parameters are written in the order
 * the block declares them. Arrays keep their representation: constants as {@code CONSTANT},
 * arrays read from a file as {@code OPEN/CLOSE} (the file itself is not written) and the rest as
 * {@code INTERNAL} with their stored factor.
 */
public final class Mf6Encoder {
    private static final Logger LOGGER = Logger.getLogger(Mf6Encoder.class.getName());

    private final EncoderOptions options;

    public Mf6Encoder() {
        this(EncoderOptions.defaults());
    }

    public Mf6Encoder(EncoderOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public String encode(Document document, ComponentSpec spec) throws Mf6Exception {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(spec, "spec");
        StringBuilder out = new StringBuilder();
        List<BlockValue> blocks = document.getBlocks();
        for (int i = 0; i < blocks.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            BlockValue block = blocks.get(i);
            BlockSpec blockSpec = spec.block(block.getName());
            if (blockSpec == null) {
                throw new Mf6Exception("Block '" + block.getName() + "' is not declared by " + spec.getName());
            }
            writeBlock(out, block, blockSpec);
        }
        LOGGER.log(Level.FINE, "Encoded {0} blocks of {1}", new Object[] {blocks.size(), spec.getName()});
        return out.toString();
    }

    public void encode(Document document, ComponentSpec spec, Writer writer) throws Mf6Exception, IOException {
        Objects.requireNonNull(writer, "writer");
        writer.write(encode(document, spec));
        writer.flush();
    }

    private void writeBlock(StringBuilder out, BlockValue block, BlockSpec spec) throws Mf6Exception {
        String name = upper(block.getName());
        out.append("BEGIN ").append(name);
        if (block.getIndex() != null) {
            out.append(' ').append(block.getIndex());
        }
        out.append('\n');
        for (String key : block.getValues().keySet()) {
            if (spec.param(key) == null) {
                throw new Mf6Exception("Parameter '" + key + "' is not declared in block " + name);
            }
        }
        for (ParamSpec param : spec.getParams().values()) {
            Object value = block.get(param.getName());
            if (value == null || param.isBlockVariable()) {
                continue;
            }
            writeParam(out, param, value);
        }
        out.append("END ").append(name).append('\n');
    }

    private void writeParam(StringBuilder out, ParamSpec param, Object value) throws Mf6Exception {
        String indent = options.getIndent();
        switch (param.getKind()) {
            case KEYWORD:
                if (Boolean.TRUE.equals(expect(param, value, Boolean.class))) {
                    out.append(indent).append(upper(param.getName())).append('\n');
                }
                break;
            case INTEGER:
            case DOUBLE:
            case STRING: {
                List<String> tokens = new ArrayList<>();
                tokens.add(upper(param.getName()));
                addScalar(tokens, param, value);
                line(out, indent, tokens);
                break;
            }
            case FILENAME:
                line(out, indent, List.of(
                        upper(param.getName()),
                        param.getFileDirection().name(),
                        quote(expect(param, value, Path.class).toString())));
                break;
            case RECORD:
            case KEYSTRING:
                for (RecordValue record : records(param, value)) {
                    List<String> tokens = new ArrayList<>();
                    addComposite(tokens, param, record);
                    line(out, indent, tokens);
                }
                break;
            case ARRAY:
                writeArray(out, param, expect(param, value, MfArray.class));
                break;
            case TABLE:
                for (RecordValue row : expect(param, value, TableValue.class).getRows()) {
                    List<String> tokens = new ArrayList<>();
                    addComponents(tokens, param, row);
                    line(out, indent, tokens);
                }
                break;
            default:
                throw new Mf6Exception("Cannot encode '" + param.getName() + "' of kind " + param.getKind());
        }
    }

    private static List<RecordValue> records(ParamSpec param, Object value) throws Mf6Exception {
        if (value instanceof RecordValue) {
            return List.of((RecordValue) value);
        }
        if (value instanceof List) {
            List<RecordValue> records = new ArrayList<>();
            for (Object item : (List<?>) value) {
                records.add(expect(param, item, RecordValue.class));
            }
            return records;
        }
        throw mismatch(param, value, RecordValue.class);
    }

    /** A top-level record or keystring, or one nested as a component. */
    private void addComposite(List<String> tokens, ParamSpec param, RecordValue value) throws Mf6Exception {
        if (param.getKind() == ParamKind.KEYSTRING) {
            String selected = value.selected();
            ParamSpec alternative = selected == null ? null : param.component(selected);
            if (alternative == null || value.size() != 1) {
                throw new Mf6Exception(
                        "Keystring '" + param.getName() + "' needs exactly one of " + names(param) + ", got "
                                + value.names());
            }
            addAlternative(tokens, alternative, value.get(selected));
            return;
        }
        if (firstIsValue(param)) {
            tokens.add(upper(param.getName()));
        }
        addComponents(tokens, param, value);
    }

    private void addAlternative(List<String> tokens, ParamSpec alternative, Object value) throws Mf6Exception {
        switch (alternative.getKind()) {
            case KEYWORD:
                tokens.add(upper(alternative.getName()));
                break;
            case RECORD:
                if (!firstIsValue(alternative)) {
                    addComponents(tokens, alternative, expect(alternative, value, RecordValue.class));
                    break;
                }
                addComposite(tokens, alternative, expect(alternative, value, RecordValue.class));
                break;
            case INTEGER:
            case DOUBLE:
            case STRING:
                tokens.add(upper(alternative.getName()));
                addScalar(tokens, alternative, value);
                break;
            default:
                addComponent(tokens, alternative, value);
                break;
        }
    }

    private void addComponents(List<String> tokens, ParamSpec composite, RecordValue value) throws Mf6Exception {
        for (ParamSpec component : composite.getComponents()) {
            Object item = value.get(component.getName());
            if (item == null) {
                if (!component.isOptional()) {
                    throw new Mf6Exception(
                            "'" + composite.getName() + "' has no value for '" + component.getName() + "'");
                }
                continue;
            }
            addComponent(tokens, component, item);
        }
    }

    private void addComponent(List<String> tokens, ParamSpec component, Object value) throws Mf6Exception {
        switch (component.getKind()) {
            case KEYWORD:
                if (Boolean.TRUE.equals(expect(component, value, Boolean.class))) {
                    tokens.add(upper(component.getName()));
                }
                break;
            case INTEGER:
            case DOUBLE:
            case STRING:
                if (component.isTagged()) {
                    tokens.add(upper(component.getName()));
                }
                addScalar(tokens, component, value);
                break;
            case FILENAME:
                if (component.isTagged()) {
                    tokens.add(upper(component.getName()));
                }
                tokens.add(quote(expect(component, value, Path.class).toString()));
                break;
            case RECORD:
            case KEYSTRING:
                addComposite(tokens, component, expect(component, value, RecordValue.class));
                break;
            default:
                throw new Mf6Exception("Cannot encode '" + component.getName() + "' inside a line");
        }
    }

    private void addScalar(List<String> tokens, ParamSpec param, Object value) throws Mf6Exception {
        if (param.isList()) {
            if (!(value instanceof List)) {
                throw mismatch(param, value, List.class);
            }
            for (Object item : (List<?>) value) {
                tokens.add(scalar(param, param.getElementKind(), item));
            }
            return;
        }
        tokens.add(scalar(param, param.getKind(), value));
    }

    private static String scalar(ParamSpec param, ParamKind kind, Object value) throws Mf6Exception {
        switch (kind) {
            case INTEGER:
                return expect(param, value, Integer.class).toString();
            case DOUBLE:
                return Double.toString(expect(param, value, Number.class).doubleValue());
            default:
                return quote(expect(param, value, String.class));
        }
    }

    private void writeArray(StringBuilder out, ParamSpec param, MfArray array) throws Mf6Exception {
        String indent = options.getIndent();
        if (array instanceof LayeredArray) {
            line(out, indent, List.of(upper(param.getName()), "LAYERED"));
            for (MfArray layer : ((LayeredArray) array).layers()) {
                writeControl(out, param, layer);
            }
            return;
        }
        line(out, indent, List.of(upper(param.getName())));
        writeControl(out, param, array);
    }

    private void writeControl(StringBuilder out, ParamSpec param, MfArray array) throws Mf6Exception {
        String indent = options.getIndent().repeat(2);
        if (array instanceof ConstantArray) {
            line(out, indent, List.of("CONSTANT", number(param, ((ConstantArray) array).value())));
            return;
        }
        double[] data = array.values();
        double factor = 1.0;
        if (array instanceof InternalArray) {
            InternalArray internal = (InternalArray) array;
            factor = internal.factor();
            if (internal.externalPath() != null) {
                List<String> tokens = new ArrayList<>(List.of("OPEN/CLOSE", quote(internal.externalPath().toString())));
                addFactor(tokens, param, factor);
                line(out, indent, tokens);
                return;
            }
            data = internal.raw();
        }
        List<String> control = new ArrayList<>(List.of("INTERNAL"));
        addFactor(control, param, factor);
        line(out, indent, control);
        writeData(out, param, array.shape(), data);
    }

    private void addFactor(List<String> tokens, ParamSpec param, double factor) {
        if (factor != 1.0) {
            tokens.add("FACTOR");
            tokens.add(number(param, factor));
        }
    }

    /** One line for rank 0 and 1, a line per row for rank 2, blank-line separated planes for rank 3. */
    private void writeData(StringBuilder out, ParamSpec param, int[] shape, double[] data) {
        String indent = options.getIndent().repeat(3);
        int rowLength = shape.length < 2 ? data.length : shape[shape.length - 1];
        int planeLength = shape.length < 3 ? data.length : shape[shape.length - 1] * shape[shape.length - 2];
        List<String> row = new ArrayList<>();
        for (int i = 0; i < data.length; i++) {
            row.add(number(param, data[i]));
            if (row.size() == rowLength || i == data.length - 1) {
                line(out, indent, row);
                row.clear();
                if (shape.length >= 3 && (i + 1) % planeLength == 0 && i < data.length - 1) {
                    out.append('\n');
                }
            }
        }
    }

    private static String number(ParamSpec param, double value) {
        if (param.getElementKind() == ParamKind.INTEGER && value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private void line(StringBuilder out, String indent, List<String> tokens) {
        out.append(indent).append(String.join(options.getSeparator(), tokens)).append('\n');
    }

    /** Records whose first component is a value start with their own name. */
    private static boolean firstIsValue(ParamSpec record) {
        return record.getKind() == ParamKind.RECORD
                && record.getComponents().get(0).getKind() != ParamKind.KEYWORD;
    }

    static String quote(String text) throws Mf6Exception {
        if (!text.isEmpty()
                && !text.contains("//")
                && text.chars().noneMatch(c -> Character.isWhitespace(c) || ",'\"#!".indexOf(c) >= 0)) {
            return text;
        }
        if (text.indexOf('\'') < 0) {
            return "'" + text + "'";
        }
        if (text.indexOf('"') < 0) {
            return "\"" + text + "\"";
        }
        throw new Mf6Exception("Cannot quote text containing both ' and \": " + text);
    }

    private static String names(ParamSpec composite) {
        List<String> names = new ArrayList<>();
        for (ParamSpec component : composite.getComponents()) {
            names.add(component.getName());
        }
        return names.toString();
    }

    private static String upper(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    private static <T> T expect(ParamSpec param, Object value, Class<T> type) throws Mf6Exception {
        if (!type.isInstance(value)) {
            throw mismatch(param, value, type);
        }
        return type.cast(value);
    }

    private static Mf6Exception mismatch(ParamSpec param, Object value, Class<?> type) {
        return new Mf6Exception(
                "'" + param.getName() + "' needs a " + type.getSimpleName() + ", got "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
    }
}
