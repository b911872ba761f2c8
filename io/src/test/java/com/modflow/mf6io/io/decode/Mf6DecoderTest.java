package com.modflow.mf6io.io.decode;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.modflow.mf6io.io.array.ArrayHow;
import com.modflow.mf6io.io.array.ConstantArray;
import com.modflow.mf6io.io.array.InternalArray;
import com.modflow.mf6io.io.array.LayeredArray;
import com.modflow.mf6io.io.array.MfArray;
import com.modflow.mf6io.io.testing.TestResources;
import com.modflow.mf6io.io.value.BlockValue;
import com.modflow.mf6io.io.value.Document;
import com.modflow.mf6io.io.value.RecordValue;
import com.modflow.mf6io.io.value.TableValue;
import com.modflow.mf6io.spec.ComponentSpec;
import com.modflow.mf6io.spec.CompositeExpansionException;
import com.modflow.mf6io.spec.Mf6Exception;
import com.modflow.mf6io.spec.Mf6ParseException;
import com.modflow.mf6io.spec.SpecLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class Mf6DecoderTest {

    private static final String SCALARS_DFN = "block options\nname k\ntype keyword\n\n"
            + "block options\nname i\ntype integer\n\n"
            + "block options\nname d\ntype double precision\n\n"
            + "block options\nname s\ntype string\n\n"
            + "block options\nname f\ntype filename\n";

    private final Mf6Decoder decoder = new Mf6Decoder();

    @Test
    void decodesScalarKindsInOptionsBlock() throws Exception {
        String input = "BEGIN OPTIONS\n  K\n  I 1\n  D 1.0\n  S value\n  F FILEIN /tmp/x\nEND OPTIONS\n";

        Document document = decoder.decode("test", input, scalars(), DimensionContext.EMPTY);

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("k", true);
        expected.put("i", 1);
        expected.put("d", 1.0);
        expected.put("s", "value");
        expected.put("f", Path.of("/tmp/x"));
        assertEquals(expected, document.block("options").getValues());
        assertEquals("test-scalars", document.getComponent());
    }

    @Test
    void commentsGluedToValuesAreStripped() throws Exception {
        String input = "BEGIN OPTIONS\n  S value//note\n  K!note\n  F FILEIN /tmp/x#note\nEND OPTIONS\n";

        BlockValue options = decoder.decode("test", input, scalars(), null).block("options");

        assertEquals("value", options.get("s"));
        assertEquals(true, options.get("k"));
        assertEquals(Path.of("/tmp/x"), options.get("f"));
    }

    @Test
    void absentKeywordIsFalseAndKeywordsIgnoreCase() throws Exception {
        Document document = decoder.decode("test", "begin options\n  i 7\nend options\n", scalars(), null);

        BlockValue options = document.block("OPTIONS");
        assertEquals(false, options.get("k"));
        assertEquals(7, options.get("I"));
        assertFalse(options.contains("s"));
    }

    @Test
    void scalarAndFilenameLinesMustHaveExactTokenCounts() throws Exception {
        ComponentSpec spec = scalars();

        Mf6ParseException scalar = assertThrows(
                Mf6ParseException.class,
                () -> decoder.decode("test", "BEGIN OPTIONS\n  I 1 2\nEND OPTIONS\n", spec, null));
        assertEquals(2, scalar.getLocation().getLine());

        assertThrows(
                Mf6ParseException.class,
                () -> decoder.decode("test", "BEGIN OPTIONS\n  F FILEAT x\nEND OPTIONS\n", spec, null));
        assertThrows(
                Mf6ParseException.class,
                () -> decoder.decode("test", "BEGIN OPTIONS\n  I one\nEND OPTIONS\n", spec, null));
        assertThrows(
                Mf6ParseException.class,
                () -> decoder.decode("test", "BEGIN OPTIONS\n  K TRUE\nEND OPTIONS\n", spec, null));
    }

    @Test
    void repeatedParameterIsRejected() throws Exception {
        Mf6ParseException ex = assertThrows(
                Mf6ParseException.class,
                () -> decoder.decode("test", "BEGIN OPTIONS\n  I 1\n  I 2\nEND OPTIONS\n", scalars(), null));

        assertEquals(3, ex.getLocation().getLine());
    }

    @Test
    void unknownParametersAndBlocksAreSkippedWithWarnings() throws Exception {
        String input = "BEGIN OPTIONS\n  K\n  MYSTERY 1 2\nEND OPTIONS\nBEGIN EXTRA\n  X\nEND EXTRA\n";

        DecodeResult result = decoder.decodeWithMessages("test", input, scalars(), DimensionContext.EMPTY);

        assertEquals(1, result.getDocument().getBlocks().size());
        assertEquals(true, result.getDocument().block("options").get("k"));
        assertEquals(2, result.getMessages().size());
        assertEquals(DecodeMessage.Level.WARNING, result.getMessages().get(0).getLevel());
        assertTrue(result.getMessages().get(0).getMessage().contains("MYSTERY"));
        assertEquals(3, result.getMessages().get(0).getLocation().getLine());
    }

    @Test
    void strictModeRejectsUnknownParameters() throws Exception {
        Mf6Decoder strict = new Mf6Decoder(DecodeOptions.defaults().withFailOnUnknownParameter(true));

        UnknownParameterException ex = assertThrows(
                UnknownParameterException.class,
                () -> strict.decode("test", "BEGIN OPTIONS\n  MYSTERY 1\nEND OPTIONS\n", scalars(), null));

        assertEquals("MYSTERY", ex.getOffendingText());
    }

    @Test
    void internalArrayMustMatchDeclaredShape() throws Exception {
        String input = "BEGIN GRIDDATA\n  A\n    INTERNAL\n    1.0 2.0 3.0\nEND GRIDDATA\n";

        Document document = decoder.decode("test", input, array("(3)", false), null);

        MfArray a = (MfArray) document.block("griddata").get("a");
        assertArrayEquals(new int[] {3}, a.shape());
        assertArrayEquals(new double[] {1.0, 2.0, 3.0}, a.values());
        assertEquals(ArrayHow.INTERNAL, a.how());

        assertThrows(
                ShapeMismatchException.class,
                () -> decoder.decode("test", input, array("(2)", false), null));
    }

    @Test
    void layeredConstantsAreReadPerLayer() throws Exception {
        String input = "BEGIN GRIDDATA\n  A  LAYERED\n  CONSTANT 3.0\n  CONSTANT 2.0\n  CONSTANT 1.0\nEND GRIDDATA\n";

        Document document = decoder.decode("test", input, array("(3)", true), null);

        LayeredArray a = assertInstanceOf(LayeredArray.class, document.block("griddata").get("a"));
        assertEquals(3, a.layerCount());
        assertArrayEquals(new double[] {3.0, 2.0, 1.0}, a.values());
        for (MfArray layer : a.layers()) {
            assertEquals(ArrayHow.CONSTANT, layer.how());
        }
    }

    @Test
    void layeredKeywordOnUnlayeredArrayIsRejected() throws Exception {
        String input = "BEGIN GRIDDATA\n  A LAYERED\n  CONSTANT 3.0\nEND GRIDDATA\n";

        assertThrows(Mf6ParseException.class, () -> decoder.decode("test", input, array("(1)", false), null));
    }

    @Test
    void symbolicDimensionMustBeKnownBeforeTheArray() throws Exception {
        ComponentSpec spec = new SpecLoader().parse(
                "test-nodes",
                "block dimensions\nname nodes\ntype integer\n\n"
                        + "block griddata\nname a\ntype double precision\nshape (nodes)\nreader readarray\n");
        String dimensions = "BEGIN DIMENSIONS\n  NODES 2\nEND DIMENSIONS\n";
        String griddata = "BEGIN GRIDDATA\n  A\n    CONSTANT 5.0\nEND GRIDDATA\n";

        Document document = decoder.decode("test", dimensions + griddata, spec, null);
        assertEquals(new ConstantArray(new int[] {2}, 5.0), document.block("griddata").get("a"));

        UnresolvedDimensionException ex = assertThrows(
                UnresolvedDimensionException.class,
                () -> decoder.decode("test", griddata + dimensions, spec, null));
        assertTrue(ex.getMessage().contains("nodes"), ex.getMessage());
    }

    @Test
    void oversizedShapesAreRejectedAtTheArray() throws Exception {
        String input = "BEGIN GRIDDATA\n  A CONSTANT 1.0\nEND GRIDDATA\n";
        DimensionContext huge = DimensionContext.of(Map.of("ncol", 100000, "nrow", 100000));

        ShapeMismatchException product = assertThrows(
                ShapeMismatchException.class,
                () -> decoder.decode("test", input, array("(ncol*nrow)", false), huge));
        assertEquals(2, product.getLocation().getLine());
        assertEquals("a", product.getOffendingText());

        assertThrows(
                ShapeMismatchException.class,
                () -> decoder.decode("test", input, array("(nrow, ncol)", false), huge));
    }

    @Test
    void negativeDimensionsAreRejectedAtTheArray() throws Exception {
        ComponentSpec spec = new SpecLoader().parse(
                "test-ncol",
                "block dimensions\nname ncol\ntype integer\n\n"
                        + "block griddata\nname a\ntype double precision\nshape (ncol)\nreader readarray\n");
        String input = "BEGIN DIMENSIONS\n  NCOL -2\nEND DIMENSIONS\nBEGIN GRIDDATA\n  A CONSTANT 1.0\nEND GRIDDATA\n";

        ShapeMismatchException ex = assertThrows(
                ShapeMismatchException.class, () -> decoder.decode("test", input, spec, null));

        assertEquals(5, ex.getLocation().getLine());
        assertTrue(ex.getMessage().contains("negative"), ex.getMessage());
    }

    @Test
    void cellCountArrayIsLayeredByNlay() throws Exception {
        ComponentSpec ic = TestResources.spec("gwf-ic");
        String input = "BEGIN GRIDDATA\n  STRT LAYERED\n    CONSTANT 1.0\n    INTERNAL\n      1.0 2.0\nEND GRIDDATA\n";

        Document document = decoder.decode("gwf.ic", input, ic, DimensionContext.of(Map.of("nlay", 2, "nodes", 4)));

        LayeredArray strt = assertInstanceOf(LayeredArray.class, document.block("griddata").get("strt"));
        assertArrayEquals(new int[] {2}, strt.layerShape());
        assertArrayEquals(new double[] {1.0, 1.0, 1.0, 2.0}, strt.values());
        assertNull(document.block("options"));
    }

    @Test
    void missingCallerDimensionIsUnresolved() throws Exception {
        ComponentSpec ic = TestResources.spec("gwf-ic");

        assertThrows(
                UnresolvedDimensionException.class,
                () -> decoder.decode("gwf.ic", "BEGIN GRIDDATA\n  STRT\n  CONSTANT 1.0\nEND GRIDDATA\n", ic, null));
    }

    @Test
    void decodesDiscretization() throws Exception {
        String input = "BEGIN OPTIONS\n"
                + "  LENGTH_UNITS meters\n"
                + "END OPTIONS\n"
                + "BEGIN DIMENSIONS\n"
                + "  NLAY 2\n"
                + "  NROW 2\n"
                + "  NCOL 3\n"
                + "END DIMENSIONS\n"
                + "BEGIN GRIDDATA\n"
                + "  DELR\n"
                + "    CONSTANT 100.0\n"
                + "  DELC\n"
                + "    INTERNAL FACTOR 10.0 IPRN 1\n"
                + "      1.0 2.0\n"
                + "  TOP\n"
                + "    INTERNAL\n"
                + "      10 10 10\n"
                + "      9 9 9\n"
                + "  BOTM LAYERED\n"
                + "    CONSTANT 0.0\n"
                + "    CONSTANT -10.0\n"
                + "  IDOMAIN\n"
                + "    INTERNAL\n"
                + "      1 1 1\n"
                + "      1 0 1\n"
                + "\n"
                + "      1 1 1\n"
                + "      1 1 1\n"
                + "END GRIDDATA\n";

        Document document = decoder.decode("gwf.dis", input, TestResources.spec("gwf-dis"), null);

        BlockValue options = document.block("options");
        assertEquals("meters", options.get("length_units"));
        assertEquals(false, options.get("nogrb"));
        assertEquals(0.0, options.get("xorigin"));

        BlockValue griddata = document.block("griddata");
        assertEquals(new ConstantArray(new int[] {3}, 100.0), griddata.get("delr"));
        InternalArray delc = (InternalArray) griddata.get("delc");
        assertEquals(10.0, delc.factor());
        assertArrayEquals(new double[] {10.0, 20.0}, delc.values());
        assertArrayEquals(new int[] {2, 3}, ((MfArray) griddata.get("top")).shape());

        LayeredArray botm = (LayeredArray) griddata.get("botm");
        assertArrayEquals(new int[] {2, 2, 3}, botm.shape());
        assertEquals(-10.0, botm.get(11));

        MfArray idomain = (MfArray) griddata.get("idomain");
        assertArrayEquals(new int[] {2, 2, 3}, idomain.shape());
        assertEquals(0.0, idomain.get(4));
    }

    @Test
    void missingRequiredDimensionIsRejected() throws Exception {
        Mf6ParseException ex = assertThrows(
                Mf6ParseException.class,
                () -> decoder.decode(
                        "gwf.dis", "BEGIN DIMENSIONS\n  NLAY 1\nEND DIMENSIONS\n", TestResources.spec("gwf-dis"), null));

        assertTrue(ex.getMessage().contains("'nrow'"), ex.getMessage());
        assertEquals(1, ex.getLocation().getLine());
    }

    @Test
    void integerArraysRejectFractions() throws Exception {
        String input = "BEGIN GRIDDATA\n  IDOMAIN\n    INTERNAL\n      1 1.5\nEND GRIDDATA\n";

        Mf6ParseException ex = assertThrows(
                Mf6ParseException.class,
                () -> decoder.decode(
                        "gwf.dis",
                        input,
                        TestResources.spec("gwf-dis"),
                        DimensionContext.of(Map.of("nlay", 1, "nrow", 1, "ncol", 2))));

        assertEquals("1.5", ex.getOffendingText());
    }

    @Test
    void extraArrayValuesAreRejected() throws Exception {
        String input = "BEGIN GRIDDATA\n  DELR\n    CONSTANT 1.0\n    2.0 3.0\nEND GRIDDATA\n";

        assertThrows(
                ShapeMismatchException.class,
                () -> decoder.decode(
                        "gwf.dis", input, TestResources.spec("gwf-dis"), DimensionContext.of(Map.of("ncol", 2))));
    }

    @Test
    void readsExternalArraysRelativeToBaseDirectory() throws Exception {
        Path dir = Files.createTempDirectory("mf6io_external");
        Files.writeString(dir.resolve("top.txt"), "1.0 2.0\n# comment\n3.0, 4.0\n", StandardCharsets.UTF_8);
        Mf6Decoder external = new Mf6Decoder(DecodeOptions.defaults().withBaseDirectory(dir));
        String input = "BEGIN GRIDDATA\n  TOP\n    OPEN/CLOSE top.txt FACTOR 2.0\nEND GRIDDATA\n";

        Document document = external.decode(
                "gwf.dis", input, TestResources.spec("gwf-dis"), DimensionContext.of(Map.of("nrow", 2, "ncol", 2)));

        InternalArray top = (InternalArray) document.block("griddata").get("top");
        assertEquals(ArrayHow.EXTERNAL, top.how());
        assertEquals(Path.of("top.txt"), top.externalPath());
        assertEquals(2.0, top.factor());
        assertArrayEquals(new double[] {2.0, 4.0, 6.0, 8.0}, top.values());
    }

    @Test
    void decodingAFileResolvesExternalArraysNextToIt() throws Exception {
        Path dir = Files.createTempDirectory("mf6io_file");
        Files.writeString(dir.resolve("delr.txt"), "5 5 5\n", StandardCharsets.UTF_8);
        Path dis = dir.resolve("model.dis");
        Files.writeString(
                dis,
                "BEGIN DIMENSIONS\n  NLAY 1\n  NROW 1\n  NCOL 3\nEND DIMENSIONS\n"
                        + "BEGIN GRIDDATA\n  DELR\n    OPEN/CLOSE delr.txt\nEND GRIDDATA\n",
                StandardCharsets.UTF_8);

        Document document = decoder.decode(dis, TestResources.spec("gwf-dis"), DimensionContext.EMPTY);

        assertArrayEquals(new double[] {5, 5, 5}, ((MfArray) document.block("griddata").get("delr")).values());
    }

    @Test
    void externalFileProblemsAreReported() throws Exception {
        Path dir = Files.createTempDirectory("mf6io_bad_external");
        Files.writeString(dir.resolve("short.txt"), "1.0\n", StandardCharsets.UTF_8);
        Mf6Decoder external = new Mf6Decoder(DecodeOptions.defaults().withBaseDirectory(dir));
        ComponentSpec dis = TestResources.spec("gwf-dis");
        DimensionContext context = DimensionContext.of(Map.of("ncol", 2));

        assertThrows(
                ShapeMismatchException.class,
                () -> external.decode("gwf.dis", "BEGIN GRIDDATA\n  DELR\n  OPEN/CLOSE short.txt\nEND GRIDDATA\n", dis, context));
        Mf6Exception missing = assertThrows(
                Mf6Exception.class,
                () -> external.decode("gwf.dis", "BEGIN GRIDDATA\n  DELR\n  OPEN/CLOSE none.txt\nEND GRIDDATA\n", dis, context));
        assertEquals("none.txt", missing.getOffendingText());
        assertThrows(
                Mf6ParseException.class,
                () -> external.decode(
                        "gwf.dis", "BEGIN GRIDDATA\n  DELR\n  OPEN/CLOSE short.txt (BINARY)\nEND GRIDDATA\n", dis, context));
    }

    @Test
    void decodesOutputControlRecordsAndKeystrings() throws Exception {
        String input = "BEGIN OPTIONS\n"
                + "  BUDGET FILEOUT model.cbc\n"
                + "  HEAD FILEOUT 'model heads.hds'\n"
                + "END OPTIONS\n"
                + "BEGIN PERIOD 1\n"
                + "  SAVE HEAD ALL\n"
                + "  SAVE BUDGET LAST\n"
                + "  PRINT HEAD FREQUENCY 2\n"
                + "END PERIOD\n"
                + "BEGIN PERIOD 3\n"
                + "  SAVE HEAD STEPS 1 2 3\n"
                + "END PERIOD 3\n";

        Document document = decoder.decode("gwf.oc", input, TestResources.spec("gwf-oc"), null);

        BlockValue options = document.block("options");
        RecordValue budget = (RecordValue) options.get("budget_filerecord");
        assertEquals(Map.of("budget", true, "fileout", true, "budgetfile", "model.cbc"), budget.getValues());
        assertEquals("model heads.hds", ((RecordValue) options.get("head_filerecord")).get("headfile"));

        BlockValue first = document.block("period", 1);
        assertEquals(1, first.get("iper"));
        List<?> saves = (List<?>) first.get("saverecord");
        assertEquals(2, saves.size());
        RecordValue saveHead = (RecordValue) saves.get(0);
        assertEquals("HEAD", saveHead.get("rtype"));
        assertEquals(RecordValue.of("all", true), saveHead.get("ocsetting"));
        assertEquals(RecordValue.of("last", true), ((RecordValue) saves.get(1)).get("ocsetting"));
        RecordValue print = (RecordValue) ((List<?>) first.get("printrecord")).get(0);
        assertEquals(RecordValue.of("frequency", 2), print.get("ocsetting"));

        BlockValue third = document.block("period", 3);
        assertEquals(3, third.get("iper"));
        RecordValue steps = (RecordValue) ((List<?>) third.get("saverecord")).get(0);
        assertEquals(RecordValue.of("steps", List.of(1, 2, 3)), steps.get("ocsetting"));
        assertNull(third.get("printrecord"));
        assertNull(document.block("period", 2));
    }

    @Test
    void keystringTakesExactlyOneAlternative() throws Exception {
        ComponentSpec oc = TestResources.spec("gwf-oc");

        assertThrows(
                Mf6ParseException.class,
                () -> decoder.decode("gwf.oc", "BEGIN PERIOD 1\n  SAVE HEAD ALL LAST\nEND PERIOD\n", oc, null));
        assertThrows(
                CompositeExpansionException.class,
                () -> decoder.decode("gwf.oc", "BEGIN PERIOD 1\n  SAVE HEAD NONE\nEND PERIOD\n", oc, null));
    }

    @Test
    void blockIndexesAreChecked() throws Exception {
        ComponentSpec oc = TestResources.spec("gwf-oc");

        assertThrows(
                Mf6ParseException.class,
                () -> decoder.decode("gwf.oc", "BEGIN PERIOD\n  SAVE HEAD ALL\nEND PERIOD\n", oc, null));
        assertThrows(
                Mf6ParseException.class,
                () -> decoder.decode("gwf.oc", "BEGIN OPTIONS 1\nEND OPTIONS\n", oc, null));
        assertThrows(
                Mf6ParseException.class,
                () -> decoder.decode(
                        "gwf.oc", "BEGIN PERIOD 1\nEND PERIOD\nBEGIN PERIOD 1\nEND PERIOD\n", oc, null));
    }

    @Test
    void decodesConstantHeadTablesPerPeriod() throws Exception {
        String input = "BEGIN OPTIONS\n"
                + "  AUXILIARY conc temp\n"
                + "  PRINT_INPUT\n"
                + "  TS6 FILEIN heads.ts\n"
                + "END OPTIONS\n"
                + "BEGIN DIMENSIONS\n"
                + "  MAXBOUND 2\n"
                + "END DIMENSIONS\n"
                + "BEGIN PERIOD 1\n"
                + "  1 1 1 10.0\n"
                + "  1 2 3 9.5\n"
                + "END PERIOD\n"
                + "BEGIN PERIOD 2\n"
                + "END PERIOD\n";

        Document document = decoder.decode(
                "gwf.chd", input, TestResources.spec("gwf-chd"), DimensionContext.of(Map.of("ncelldim", 3)));

        BlockValue options = document.block("options");
        assertEquals(List.of("conc", "temp"), options.get("auxiliary"));
        assertEquals(true, options.get("print_input"));
        assertEquals("heads.ts", ((RecordValue) options.get("ts_filerecord")).get("ts6_filename"));
        assertEquals(2, document.block("dimensions").get("maxbound"));

        TableValue first = (TableValue) document.block("period", 1).get("stress_period_data");
        assertEquals(List.of("cellid", "head"), first.getColumns());
        assertEquals(2, first.size());
        assertEquals(List.of(1, 2, 3), first.row(1).get("cellid"));
        assertEquals(List.of(10.0, 9.5), first.column("head"));

        TableValue second = (TableValue) document.block("period", 2).get("stress_period_data");
        assertEquals(0, second.size());
    }

    @Test
    void tableRowsAreBoundedByMaxbound() throws Exception {
        String input = "BEGIN DIMENSIONS\n  MAXBOUND 1\nEND DIMENSIONS\n"
                + "BEGIN PERIOD 1\n  1 1 1 10.0\n  1 1 2 10.0\nEND PERIOD\n";

        ShapeMismatchException ex = assertThrows(
                ShapeMismatchException.class,
                () -> decoder.decode(
                        "gwf.chd", input, TestResources.spec("gwf-chd"), DimensionContext.of(Map.of("ncelldim", 3))));

        assertEquals(6, ex.getLocation().getLine());
    }

    @Test
    void tableColumnsNeedTheirDimension() throws Exception {
        String input = "BEGIN DIMENSIONS\n  MAXBOUND 1\nEND DIMENSIONS\nBEGIN PERIOD 1\n  1 1 1 10.0\nEND PERIOD\n";

        assertThrows(
                UnresolvedDimensionException.class,
                () -> decoder.decode("gwf.chd", input, TestResources.spec("gwf-chd"), null));
    }

    private static ComponentSpec scalars() throws Mf6Exception {
        return new SpecLoader().parse("test-scalars", SCALARS_DFN);
    }

    private static ComponentSpec array(String shape, boolean layered) throws Mf6Exception {
        return new SpecLoader().parse(
                "test-array",
                "block griddata\nname a\ntype double precision\nshape " + shape + "\nreader readarray\nlayered "
                        + layered + "\n");
    }
}
