package com.modflow.mf6io.io.parse;

import com.modflow.mf6io.io.grammar.Mf6BaseVisitor;
import com.modflow.mf6io.io.grammar.Mf6Lexer;
import com.modflow.mf6io.io.grammar.Mf6Parser;
import com.modflow.mf6io.io.parse.ast.BlockNode;
import com.modflow.mf6io.io.parse.ast.InputNode;
import com.modflow.mf6io.io.parse.ast.LineNode;
import com.modflow.mf6io.io.parse.ast.TokenKind;
import com.modflow.mf6io.spec.Mf6ParseException;
import com.modflow.mf6io.spec.SourceLocation;
import com.modflow.mf6io.spec.parse.DebugFlags;
import com.modflow.mf6io.spec.parse.ThrowingErrorListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

/**
 * Parses MODFLOW 6 input text into blocks of tokenized lines. Which line holds which parameter is
 * decided later, against a component specification.
 */
public final class InputAstBuilder {

    public InputNode parse(String sourceName, String input) throws Mf6ParseException {
        Objects.requireNonNull(input, "input");
        String terminated = input.isEmpty() || input.endsWith("\n") ? input : input + "\n";
        return parse(sourceName, CharStreams.fromString(terminated, sourceName));
    }

    public InputNode parse(String sourceName, CharStream input) throws Mf6ParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");

        Mf6Lexer lexer = new Mf6Lexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        Mf6Parser parser = new Mf6Parser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        if (DebugFlags.isParserTraceEnabled()) {
            parser.addErrorListener(DebugFlags.diagnosticListener(sourceName));
        }

        try {
            if (DebugFlags.isTokenDebugEnabled()) {
                tokens.fill();
                DebugFlags.logTokens(sourceName, tokens, lexer.getVocabulary());
                tokens.seek(0);
            }
            Mf6Parser.ComponentContext context = parser.component();
            return new AstBuildingVisitor(sourceName).build(context);
        } catch (ThrowingErrorListener.SyntaxErrorException ex) {
            throw new Mf6ParseException(
                    "Malformed input: " + ex.getDetail(),
                    new SourceLocation(sourceName, ex.getLine(), ex.getColumn()),
                    ex.getOffendingText());
        } catch (InvalidBlockException ex) {
            throw new Mf6ParseException(ex.getMessage(), ex.location, ex.text);
        }
    }

    private static final class AstBuildingVisitor extends Mf6BaseVisitor<Void> {
        private final String sourceName;
        private final List<BlockNode> blocks = new ArrayList<>();

        AstBuildingVisitor(String sourceName) {
            this.sourceName = sourceName;
        }

        InputNode build(Mf6Parser.ComponentContext context) {
            visitComponent(context);
            return new InputNode(sourceName, blocks);
        }

        @Override
        public Void visitComponent(Mf6Parser.ComponentContext ctx) {
            List<Mf6Parser.BlockContext> found = ctx.block();
            for (int i = 0; i < found.size(); i++) {
                Mf6Parser.BlockContext block = found.get(i);
                if (block.endLine() == null) {
                    String before = i + 1 < found.size()
                            ? "BEGIN " + found.get(i + 1).beginLine().name.getText().toUpperCase(Locale.ROOT)
                            : "end of file";
                    Token begin = block.beginLine().BEGIN().getSymbol();
                    throw new InvalidBlockException(
                            "Block " + block.beginLine().name.getText().toUpperCase(Locale.ROOT)
                                    + " is not closed before " + before,
                            toLocation(begin),
                            headerText(block.beginLine()));
                }
                visit(block);
            }
            return null;
        }

        @Override
        public Void visitBlock(Mf6Parser.BlockContext ctx) {
            Mf6Parser.BeginLineContext begin = ctx.beginLine();
            String name = begin.name.getText().toLowerCase(Locale.ROOT);
            if (!begin.value().isEmpty()) {
                throw new InvalidBlockException(
                        "Unexpected text after block header",
                        toLocation(begin.value(0).getStart()),
                        begin.value(0).getText());
            }
            Integer index = null;
            if (begin.index != null) {
                index = parseIndex(begin.index);
            }

            Mf6Parser.EndLineContext end = ctx.endLine();
            if (end.name != null && !end.name.getText().equalsIgnoreCase(name)) {
                throw new InvalidBlockException(
                        "END " + end.name.getText().toUpperCase(Locale.ROOT) + " does not close block "
                                + name.toUpperCase(Locale.ROOT),
                        toLocation(end.END().getSymbol()),
                        end.name.getText());
            }

            List<LineNode> lines = new ArrayList<>();
            for (Mf6Parser.BodyLineContext body : ctx.bodyLine()) {
                lines.add(toLine(body));
            }
            blocks.add(new BlockNode(name, index, toLocation(begin.BEGIN().getSymbol()), lines));
            return null;
        }

        private LineNode toLine(Mf6Parser.BodyLineContext body) {
            List<String> tokens = new ArrayList<>();
            List<TokenKind> kinds = new ArrayList<>();
            add(body.lead().getStart(), tokens, kinds);
            for (Mf6Parser.ValueContext value : body.value()) {
                add(value.getStart(), tokens, kinds);
            }
            return new LineNode(tokens, kinds, toLocation(body.getStart()));
        }

        private static void add(Token token, List<String> tokens, List<TokenKind> kinds) {
            String text = token.getText();
            switch (token.getType()) {
                case Mf6Lexer.INTEGER:
                    kinds.add(TokenKind.INTEGER);
                    break;
                case Mf6Lexer.FLOAT:
                    kinds.add(TokenKind.FLOAT);
                    break;
                case Mf6Lexer.QUOTED:
                    kinds.add(TokenKind.QUOTED);
                    text = text.substring(1, text.length() - 1);
                    break;
                default:
                    kinds.add(TokenKind.WORD);
                    break;
            }
            tokens.add(text);
        }

        private Integer parseIndex(Token token) {
            int value;
            try {
                value = Integer.parseInt(token.getText());
            } catch (NumberFormatException ex) {
                value = 0;
            }
            if (value <= 0) {
                throw new InvalidBlockException(
                        "Block index must be a positive integer", toLocation(token), token.getText());
            }
            return value;
        }

        private static String headerText(Mf6Parser.BeginLineContext line) {
            String text = "BEGIN " + line.name.getText();
            return line.index == null ? text : text + " " + line.index.getText();
        }

        private SourceLocation toLocation(Token token) {
            return new SourceLocation(sourceName, token.getLine(), token.getCharPositionInLine() + 1);
        }
    }

    private static final class InvalidBlockException extends RuntimeException {
        private final SourceLocation location;
        private final String text;

        InvalidBlockException(String message, SourceLocation location, String text) {
            super(message);
            this.location = location;
            this.text = text;
        }
    }
}
