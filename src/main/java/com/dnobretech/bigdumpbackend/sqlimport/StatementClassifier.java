package com.dnobretech.bigdumpbackend.sqlimport;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifica statements por padrões de texto pré-compilados. Na dúvida devolve {@link StatementKind#OTHER}:
 * o statement passa intacto e nenhuma linha se perde.
 */
public final class StatementClassifier {

    private static final String IDENT = "(?:`[^`]+`|\"[^\"]+\"|[\\w$]+)";

    private static final Pattern INSERT_HEAD =
            Pattern.compile("^INSERT\\s", Pattern.CASE_INSENSITIVE);

    private static final Pattern INSERT_VALUES = Pattern.compile(
            "^(INSERT\\s+(IGNORE\\s+)?(?:INTO\\s+)?" + IDENT + "(?:\\." + IDENT + ")?"
                    + "\\s*(?:\\([^)]*\\)\\s*)?VALUES)\\s*(\\(.*\\))\\s*;?\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern ON_DUPLICATE =
            Pattern.compile("\\bON\\s+DUPLICATE\\s+KEY\\b", Pattern.CASE_INSENSITIVE);

    // "),(" entre tuplas. Strings com esse texto dão falso positivo; o custo é só não agrupar.
    private static final Pattern TUPLE_SEPARATOR = Pattern.compile("\\)\\s*,\\s*\\(");

    private StatementClassifier() {
    }

    public static ParsedStatement classify(String text) {
        if (text == null || text.isEmpty() || !INSERT_HEAD.matcher(text).find()) {
            return other(text);
        }
        if (ON_DUPLICATE.matcher(text).find()) {
            return other(text);
        }
        Matcher m = INSERT_VALUES.matcher(text);
        if (!m.matches()) {
            return other(text); // INSERT ... SELECT, SET, sintaxe não reconhecida
        }
        String prefix = m.group(1).replaceAll("\\s+", " ");
        boolean ignore = m.group(2) != null;
        String tuples = m.group(3);
        StatementKind kind;
        if (TUPLE_SEPARATOR.matcher(tuples).find()) {
            kind = StatementKind.EXTENDED_INSERT;
        } else {
            kind = ignore ? StatementKind.INSERT_IGNORE : StatementKind.INSERT;
        }
        return new ParsedStatement(text, kind, ignore, prefix, tuples);
    }

    private static ParsedStatement other(String text) {
        return new ParsedStatement(text, StatementKind.OTHER, false, null, null);
    }
}
