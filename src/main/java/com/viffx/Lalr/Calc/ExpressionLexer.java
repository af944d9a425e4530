package com.viffx.Lalr.Calc;

import com.viffx.Lalr.Symbols.Location;
import com.viffx.Lalr.Symbols.Token;
import com.viffx.Lalr.Symbols.TokenSource;
import com.viffx.Lalr.Utils.LexicalCharacterBuffer;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

import static java.lang.Character.isDigit;

/**
 * Scanner for {@link ExpressionParser}: decimal numbers, operators and whitespace.
 * <p>
 * Any other character up to {@code 0xff}, except NUL, is returned as a character token of its
 * own, so the parser reports it as a syntax error instead of the scanner failing.
 */
public class ExpressionLexer implements TokenSource {
    private final LexicalCharacterBuffer buffer;

    public ExpressionLexer(Reader source) throws IOException {
        buffer = new LexicalCharacterBuffer(source);
    }

    public ExpressionLexer(String source) throws IOException {
        this(new StringReader(source));
    }

    @Override
    public Token nextToken() throws IOException {
        buffer.skipWhile(Character::isWhitespace);

        // Never process past the end of the source
        if (buffer.eof()) return Token.of(ExpressionParser.EOF, buffer.location());

        Location start = buffer.location();
        char c = buffer.crntChar();

        if (isDigit(c)) return nextNumber(start);

        // 0 would read as the end of the input
        if (c == 0 || c > 0xff) {
            throw new IOException("Unrecognized symbol: '" + c + "' at " + start + " " + buffer.buffer());
        }
        advance();
        return Token.of(c, start);
    }

    private Token nextNumber(Location start) throws IOException {
        StringBuilder builder = new StringBuilder();
        int lastColumn = start.firstColumn();
        do {
            builder.append(buffer.crntChar());
            lastColumn = buffer.column();
            advance();
        } while (!buffer.eof() && isDigit(buffer.crntChar()));

        long value;
        try {
            value = Long.parseLong(builder.toString());
        } catch (NumberFormatException e) {
            throw new IOException("Number too large: " + builder + " at " + start, e);
        }
        Location location = new Location(start.firstLine(), start.firstColumn(), start.lastLine(), lastColumn);
        return Token.of(ExpressionParser.NUMBER, ExpressionParser.LITERAL, value, location);
    }

    private void advance() throws IOException {
        if (!buffer.eof()) buffer.nextChar();
    }
}
