package io.github.eutro.glslmin.core.parse;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.NoViableAltException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Turns the first syntax error into a {@link ParseException}, instead of letting the parser recover.
 */
final class ParseErrorListener extends BaseErrorListener {
    static final ParseErrorListener INSTANCE = new ParseErrorListener();

    private ParseErrorListener() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer,
                            Object offendingSymbol,
                            int line,
                            int charPositionInLine,
                            String msg,
                            RecognitionException e) {
        if (recognizer instanceof Parser && offendingSymbol instanceof Token) {
            msg = describe((Parser) recognizer, (Token) offendingSymbol, e);
        }
        throw new ParseException(msg, line, charPositionInLine + 1);
    }

    private static String describe(Parser parser, Token found, RecognitionException e) {
        String expected;
        if (e instanceof NoViableAltException && e.getCtx() != null) {
            expected = words(parser.getRuleNames()[e.getCtx().getRuleIndex()]);
        } else {
            IntervalSet tokens = e == null ? parser.getExpectedTokens() : e.getExpectedTokens();
            expected = describe(tokens, parser.getVocabulary());
        }
        return "Expected " + expected + " but " + describe(found) + " found.";
    }

    private static String describe(IntervalSet tokens, Vocabulary vocabulary) {
        List<Integer> types = tokens.toList();
        if (types.size() == 1) return tokenName(types.get(0), vocabulary);
        StringJoiner joiner = new StringJoiner(", ", "one of ", "");
        for (int type : types) {
            joiner.add(tokenName(type, vocabulary));
        }
        return joiner.toString();
    }

    private static String describe(Token token) {
        return token.getType() == Token.EOF ? "end of input" : "\"" + token.getText() + "\"";
    }

    private static String tokenName(int type, Vocabulary vocabulary) {
        if (type == Token.EOF) return "end of input";
        String literal = vocabulary.getLiteralName(type);
        if (literal != null) return "\"" + literal.substring(1, literal.length() - 1) + "\"";
        return vocabulary.getSymbolicName(type).toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    // functionCall -> function call
    private static String words(String ruleName) {
        StringBuilder sb = new StringBuilder();
        for (char c : ruleName.toCharArray()) {
            if (Character.isUpperCase(c)) {
                sb.append(' ').append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
