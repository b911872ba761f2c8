package com.modflow.mf6io.io.decode;

import com.modflow.mf6io.io.array.ArrayShapeException;
import com.modflow.mf6io.io.array.ConstantArray;
import com.modflow.mf6io.io.array.InternalArray;
import com.modflow.mf6io.io.array.LayeredArray;
import com.modflow.mf6io.io.array.MfArray;
import com.modflow.mf6io.io.parse.NumberParser;
import com.modflow.mf6io.io.parse.ast.LineNode;
import com.modflow.mf6io.io.parse.ast.TokenKind;
import com.modflow.mf6io.spec.Mf6Exception;
import com.modflow.mf6io.spec.Mf6ParseException;
import com.modflow.mf6io.spec.ParamKind;
import com.modflow.mf6io.spec.ParamSpec;
import com.modflow.mf6io.spec.SourceLocation;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a grid array from the lines that follow its name: a {@code CONSTANT}, {@code INTERNAL} or
 * {@code OPEN/CLOSE} control, once per layer when the name line says {@code LAYERED}.
 */
final class ArrayReader {
    private static final Logger LOGGER = Logger.getLogger(ArrayReader.class.getName());

    /** First words of the lines that belong to an array after its name line. */
    static final Set<String> CONTROL_WORDS = Set.of("constant", "internal", "open/close", "external");

    private final Path baseDirectory;

    ArrayReader(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    /**
     * @param segment the name line followed by the control and data lines of the array
     */
    MfArray read(ParamSpec param, List<LineNode> segment, DimensionContext context) throws Mf6Exception {
        LineNode nameLine = segment.get(0);
        int[] shape = context.resolve(param.getShape(), nameLine.getLocation(), param.getName());
        LineCursor cursor = new LineCursor(segment.subList(1, segment.size()));

        List<String> inline = new ArrayList<>(nameLine.getTokens().subList(1, nameLine.size()));
        List<TokenKind> inlineKinds = new ArrayList<>(nameLine.getKinds().subList(1, nameLine.size()));
        boolean layered = !inline.isEmpty() && "LAYERED".equalsIgnoreCase(inline.get(0));
        if (layered) {
            if (!param.isLayered()) {
                throw new Mf6ParseException(
                        "'" + param.getName() + "' cannot be read by layer", nameLine.getLocation(), inline.get(0));
            }
            inline.remove(0);
            inlineKinds.remove(0);
        }
        LineNode inlineControl = inline.isEmpty()
                ? null
                : new LineNode(inline, inlineKinds, nameLine.getLocation());

        MfArray array;
        if (layered) {
            int[] layering = layering(shape, context, nameLine, param);
            int[] layerShape = Arrays.copyOfRange(layering, 1, layering.length);
            List<MfArray> layers = new ArrayList<>(layering[0]);
            for (int k = 0; k < layering[0]; k++) {
                layers.add(readControl(param, k == 0 ? inlineControl : null, cursor, layerShape, nameLine));
            }
            try {
                array = new LayeredArray(layers);
            } catch (ArrayShapeException ex) {
                throw new ShapeMismatchException(ex.getMessage(), nameLine.getLocation(), param.getName(), ex);
            }
        } else {
            array = readControl(param, inlineControl, cursor, shape, nameLine);
        }
        if (cursor.hasNext()) {
            LineNode extra = cursor.next();
            throw new ShapeMismatchException(
                    "More values than the shape " + Arrays.toString(shape) + " of '" + param.getName() + "' holds",
                    extra.getLocation(),
                    extra.text());
        }
        return array;
    }

    /**
     * Layer count followed by the layer shape. The layer count is the first dimension, unless the
     * context knows {@code nlay} and the first dimension differs from it (a cell-count shape such
     * as {@code (nodes)}); then each of the {@code nlay} layers is a flat run of cells.
     */
    private static int[] layering(int[] shape, DimensionContext context, LineNode nameLine, ParamSpec param)
            throws ShapeMismatchException {
        Integer nlay = context.lookup("nlay");
        if (shape.length == 0) {
            throw new ShapeMismatchException(
                    "'" + param.getName() + "' has no dimension to layer over", nameLine.getLocation(), param.getName());
        }
        if (nlay == null || nlay == shape[0]) {
            return shape;
        }
        int total = 1;
        for (int extent : shape) {
            total = Math.multiplyExact(total, extent);
        }
        if (nlay <= 0 || total % nlay != 0) {
            throw new ShapeMismatchException(
                    Arrays.toString(shape) + " cannot be split into " + nlay + " layers",
                    nameLine.getLocation(),
                    param.getName());
        }
        return new int[] {nlay, total / nlay};
    }

    private MfArray readControl(
            ParamSpec param, LineNode inlineControl, LineCursor cursor, int[] shape, LineNode nameLine)
            throws Mf6Exception {
        LineNode control = inlineControl;
        if (control == null) {
            if (!cursor.hasNext()) {
                throw new Mf6ParseException(
                        "Missing CONSTANT, INTERNAL or OPEN/CLOSE for '" + param.getName() + "'",
                        nameLine.getLocation(),
                        nameLine.text());
            }
            control = cursor.next();
        }
        String how = control.key();
        switch (how) {
            case "constant":
                return readConstant(param, control, shape);
            case "internal":
                return readInternal(param, control, cursor, shape);
            case "open/close":
            case "external":
                return readExternal(param, control, shape);
            default:
                throw new Mf6ParseException(
                        "Expected CONSTANT, INTERNAL or OPEN/CLOSE for '" + param.getName() + "'",
                        control.getLocation(),
                        control.token(0));
        }
    }

    private static ConstantArray readConstant(ParamSpec param, LineNode control, int[] shape)
            throws Mf6ParseException {
        if (control.size() != 2) {
            throw new Mf6ParseException(
                    "CONSTANT takes exactly one value", control.getLocation(), control.text());
        }
        return new ConstantArray(shape, number(param, control.token(1), control.getLocation()));
    }

    private static InternalArray readInternal(ParamSpec param, LineNode control, LineCursor cursor, int[] shape)
            throws Mf6Exception {
        Options options = Options.parse(control, 1, param);
        List<String> tokens = new ArrayList<>(options.data);
        List<SourceLocation> locations = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            locations.add(control.getLocation());
        }
        int expected = sizeOf(shape);
        while (tokens.size() < expected && cursor.hasNext() && cursor.peek().isNumeric()) {
            LineNode data = cursor.next();
            for (String token : data.getTokens()) {
                tokens.add(token);
                locations.add(data.getLocation());
            }
        }
        if (tokens.size() != expected) {
            throw new ShapeMismatchException(
                    "Expected " + expected + " values for '" + param.getName() + "' of shape "
                            + Arrays.toString(shape) + ", found " + tokens.size(),
                    control.getLocation(),
                    control.text());
        }
        double[] raw = new double[expected];
        for (int i = 0; i < expected; i++) {
            raw[i] = number(param, tokens.get(i), locations.get(i));
        }
        return new InternalArray(shape, raw, options.factor, null);
    }

    private InternalArray readExternal(ParamSpec param, LineNode control, int[] shape) throws Mf6Exception {
        if (control.size() < 2) {
            throw new Mf6ParseException("Missing file name after OPEN/CLOSE", control.getLocation(), control.text());
        }
        String written = control.token(1);
        Options options = Options.parse(control, 2, param);
        if (!options.data.isEmpty()) {
            throw new Mf6ParseException(
                    "Unexpected text after OPEN/CLOSE file name", control.getLocation(), options.data.get(0));
        }
        Path file = baseDirectory.resolve(written);
        int expected = sizeOf(shape);
        double[] raw = new double[expected];
        int count = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String text;
            int lineNumber = 0;
            while ((text = reader.readLine()) != null) {
                lineNumber++;
                for (String token : stripComment(text).trim().split("[\\s,]+")) {
                    if (token.isEmpty()) {
                        continue;
                    }
                    SourceLocation location = new SourceLocation(file.toString(), lineNumber, 1);
                    if (count == expected) {
                        throw new ShapeMismatchException(
                                "External file holds more than " + expected + " values for '" + param.getName() + "'",
                                location,
                                token);
                    }
                    raw[count++] = number(param, token, location);
                }
            }
        } catch (IOException ex) {
            throw new Mf6Exception("Failed to read external array " + file, control.getLocation(), written, ex);
        }
        if (count != expected) {
            throw new ShapeMismatchException(
                    "External file holds " + count + " values, '" + param.getName() + "' of shape "
                            + Arrays.toString(shape) + " needs " + expected,
                    control.getLocation(),
                    written);
        }
        LOGGER.log(Level.FINE, "Read {0} values for {1} from {2}", new Object[] {count, param.getName(), file});
        return InternalArray.external(shape, raw, options.factor, Path.of(written));
    }

    private static String stripComment(String text) {
        int end = text.length();
        for (String marker : new String[] {"#", "!", "//"}) {
            int at = text.indexOf(marker);
            if (at >= 0 && at < end) {
                end = at;
            }
        }
        return text.substring(0, end);
    }

    private static double number(ParamSpec param, String token, SourceLocation location) throws Mf6ParseException {
        try {
            if (param.getElementKind() == ParamKind.INTEGER) {
                return NumberParser.parseInt(token);
            }
            return NumberParser.parseDouble(token);
        } catch (NumberFormatException ex) {
            String expected = param.getElementKind() == ParamKind.INTEGER ? "integer" : "numeric";
            throw new Mf6ParseException(
                    "Expected " + expected + " values for '" + param.getName() + "'", location, token);
        }
    }

    private static int sizeOf(int[] shape) {
        int size = 1;
        for (int extent : shape) {
            size = Math.multiplyExact(size, extent);
        }
        return size;
    }

    /** {@code FACTOR f}, {@code IPRN n} and {@code (BINARY)} after the control word; anything else is data. */
    private static final class Options {
        double factor = 1.0;
        final List<String> data = new ArrayList<>();

        static Options parse(LineNode control, int from, ParamSpec param) throws Mf6ParseException {
            Options options = new Options();
            for (int i = from; i < control.size(); i++) {
                String word = control.token(i).toUpperCase(Locale.ROOT);
                if ("FACTOR".equals(word) || "IPRN".equals(word)) {
                    if (i + 1 >= control.size()) {
                        throw new Mf6ParseException("Missing value after " + word, control.getLocation(), word);
                    }
                    String value = control.token(++i);
                    if ("FACTOR".equals(word)) {
                        options.factor = factor(param, value, control);
                    }
                } else if ("(BINARY)".equals(word) || "BINARY".equals(word)) {
                    throw new Mf6ParseException(
                            "Binary array files are not supported", control.getLocation(), control.token(i));
                } else {
                    options.data.add(control.token(i));
                }
            }
            return options;
        }

        private static double factor(ParamSpec param, String value, LineNode control) throws Mf6ParseException {
            try {
                return NumberParser.parseDouble(value);
            } catch (NumberFormatException ex) {
                throw new Mf6ParseException(
                        "Invalid FACTOR for '" + param.getName() + "'", control.getLocation(), value);
            }
        }
    }
}
