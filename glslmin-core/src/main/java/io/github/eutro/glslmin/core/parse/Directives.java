package io.github.eutro.glslmin.core.parse;

/**
 * Helpers for the text of preprocessor directive tokens.
 */
final class Directives {
    private Directives() {
    }

    /**
     * Join line continuations, drop a trailing line comment and trim.
     */
    static String clean(String raw) {
        String text = raw.replace("\\\r\n", "").replace("\\\n", "");
        int comment = text.indexOf("//");
        if (comment >= 0) text = text.substring(0, comment);
        return text.trim();
    }

    /**
     * The directive name with its {@code #}, such as {@code #define}.
     */
    static String name(String text) {
        int i = skipSpace(text);
        int start = i;
        while (i < text.length() && Character.isLetter(text.charAt(i))) i++;
        return "#" + text.substring(start, i);
    }

    /**
     * Everything after the directive name.
     */
    static String rest(String text) {
        int i = skipSpace(text);
        while (i < text.length() && Character.isLetter(text.charAt(i))) i++;
        return text.substring(i).trim();
    }

    private static int skipSpace(String text) {
        int i = 1;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return i;
    }

    // called by the lexer for each directive
    static int tokenType(String raw) {
        switch (name(clean(raw))) {
            case "#if":
            case "#ifdef":
            case "#ifndef":
                return GlslEsParser.PP_IF;
            case "#elif":
                return GlslEsParser.PP_ELIF;
            case "#else":
                return GlslEsParser.PP_ELSE;
            case "#endif":
                return GlslEsParser.PP_ENDIF;
            default:
                return GlslEsLexer.DIRECTIVE;
        }
    }
}
