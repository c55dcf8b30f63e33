package com.dnobretech.bigdumpbackend.sqlimport;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Monta statements SQL completos a partir de linhas, respeitando aspas, escapes e o delimitador ativo.
 * <p>
 * Estados: NORMAL ou IN_STRING (com a aspa que abriu a string). Todo o estado cabe em
 * delimitador + texto pendente + inString + aspa ativa, e {@link #restore} volta exatamente para ele,
 * então um statement pode atravessar qualquer número de linhas e de invocações.
 */
@Slf4j
public class SqlStatementParser {

    public static final String DEFAULT_DELIMITER = ";";
    public static final int DEFAULT_MAX_STATEMENT_BYTES = 10 * 1024 * 1024;
    public static final int DEFAULT_MAX_STATEMENT_LINES = 10_000;

    private static final Pattern DELIMITER_DIRECTIVE =
            Pattern.compile("^DELIMITER(?:\\s+(.*))?$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern STATEMENT_START = Pattern.compile(
            "^\\s*(?:INSERT|UPDATE|DELETE|CREATE|ALTER|DROP|SET|LOCK|UNLOCK|START|COMMIT|ROLLBACK|REPLACE"
                    + "|TRUNCATE|USE|GRANT|REVOKE|SHOW|DESCRIBE|EXPLAIN|CALL)\\b|^\\s*(?:/\\*|--)",
            Pattern.CASE_INSENSITIVE);

    private final int maxStatementBytes;
    private final int maxStatementLines;

    private String delimiter = DEFAULT_DELIMITER;
    private final StringBuilder current = new StringBuilder();
    private long currentBytes;
    private int currentLines;
    private boolean inString;
    private char activeQuote;

    public SqlStatementParser() {
        this(DEFAULT_MAX_STATEMENT_BYTES, DEFAULT_MAX_STATEMENT_LINES);
    }

    public SqlStatementParser(int maxStatementBytes, int maxStatementLines) {
        this.maxStatementBytes = maxStatementBytes;
        this.maxStatementLines = maxStatementLines;
    }

    public ParseResult parseLine(String rawLine) {
        if (rawLine == null || rawLine.isEmpty()) return ParseResult.NOTHING;
        String line = normalizeLineEndings(rawLine);

        if (!inString) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || isCommentLine(trimmed)) {
                return ParseResult.NOTHING;
            }
            if (isBlank(current)) {
                Matcher d = DELIMITER_DIRECTIVE.matcher(trimmed);
                if (d.matches()) {
                    String newDelimiter = d.group(1) == null ? "" : d.group(1).strip();
                    if (newDelimiter.isEmpty()) {
                        return ParseResult.error("Diretiva DELIMITER sem valor: '" + trimmed + "'");
                    }
                    log.debug("Delimitador alterado: '{}' -> '{}'", delimiter, newDelimiter);
                    delimiter = newDelimiter;
                    current.setLength(0);
                    resetCounters();
                    return ParseResult.DELIMITER_CHANGED;
                }
            }
        }

        List<ParsedStatement> completed = new ArrayList<>(1);
        int segmentStart = 0;
        int len = line.length();
        int i = 0;
        while (i < len) {
            char c = line.charAt(i);

            if (inString) {
                if (c == '\\' && activeQuote != '`') {
                    i += 2;
                    continue;
                }
                if (c == activeQuote) {
                    if (i + 1 < len && line.charAt(i + 1) == activeQuote) {
                        i += 2; // aspa dobrada é conteúdo
                        continue;
                    }
                    inString = false;
                    activeQuote = 0;
                }
                i++;
                continue;
            }

            if (c == '\'' || c == '"' || c == '`') {
                inString = true;
                activeQuote = c;
                i++;
                continue;
            }

            if (c == '-' && isInlineDashComment(line, i)) {
                // comentário até o fim da linha: guarda o que veio antes e o terminador
                current.append(line, segmentStart, i);
                int nl = line.indexOf('\n', i);
                segmentStart = nl < 0 ? len : nl;
                i = segmentStart;
                continue;
            }

            if (line.startsWith(delimiter, i)) {
                current.append(line, segmentStart, i);
                String text = current.toString().strip();
                current.setLength(0);
                resetCounters();
                if (!text.isEmpty()) {
                    completed.add(StatementClassifier.classify(text));
                }
                i += delimiter.length();
                segmentStart = i;
                int next = skipWhitespace(line, i);
                if (next == len || isCommentAt(line, next)) {
                    segmentStart = len;
                    break;
                }
                continue;
            }
            i++;
        }
        if (segmentStart < len) {
            current.append(line, segmentStart, len);
        }

        if (isBlank(current)) {
            current.setLength(0);
            resetCounters();
            return completed.isEmpty() ? ParseResult.NOTHING : new ParseResult(completed, false, null);
        }

        currentBytes += utf8Length(line);
        if (!inString) currentLines++;
        String error = checkLimits();
        return new ParseResult(completed, false, error);
    }

    /** Texto acumulado ainda sem delimitador, ou null se não há statement em andamento. */
    public String getPendingStatement() {
        return isBlank(current) ? null : current.toString();
    }

    public boolean isInString() {
        return inString;
    }

    /** Aspa que abriu a string atual, ou null fora de string. */
    public Character getActiveQuote() {
        return inString ? activeQuote : null;
    }

    public String getDelimiter() {
        return delimiter;
    }

    /**
     * Restaura o estado salvo numa sessão. O próximo {@link #parseLine} continua exatamente de onde o
     * parser anterior parou.
     */
    public void restore(String delimiter, String pendingStatement, boolean inString, Character activeQuote) {
        this.delimiter = (delimiter == null || delimiter.isEmpty()) ? DEFAULT_DELIMITER : delimiter;
        current.setLength(0);
        resetCounters();
        if (pendingStatement != null) {
            current.append(pendingStatement);
            currentBytes = utf8Length(pendingStatement);
        }
        this.inString = inString && activeQuote != null;
        this.activeQuote = this.inString ? activeQuote : 0;
    }

    public void reset() {
        restore(DEFAULT_DELIMITER, null, false, null);
    }

    /** Descarta o statement pendente, mantendo o delimitador. */
    public void discardPending() {
        current.setLength(0);
        resetCounters();
        inString = false;
        activeQuote = 0;
    }

    /**
     * Um pendente restaurado ou sobrando no fim do arquivo só é aproveitado se começa com uma palavra-chave
     * SQL conhecida.
     */
    public static boolean looksLikeStatementStart(String text) {
        return text != null && STATEMENT_START.matcher(text).find();
    }

    // ===================== internos =====================

    private String checkLimits() {
        if (currentBytes > maxStatementBytes) {
            String msg = "Statement excede o limite de " + maxStatementBytes + " bytes; verifique se o dump tem "
                    + "uma string sem fechar";
            discardPending();
            return msg;
        }
        if (currentLines > maxStatementLines) {
            String msg = "Statement excede o limite de " + maxStatementLines + " linhas; verifique o delimitador";
            discardPending();
            return msg;
        }
        return null;
    }

    private void resetCounters() {
        currentBytes = 0;
        currentLines = 0;
    }

    static boolean isCommentLine(String trimmed) {
        if (trimmed.startsWith("#")) return true;
        if (trimmed.startsWith("--")) {
            return trimmed.length() == 2 || Character.isWhitespace(trimmed.charAt(2));
        }
        return false;
    }

    private static int skipWhitespace(String line, int from) {
        int i = from;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) i++;
        return i;
    }

    /** Mesmo critério de {@link #isCommentLine}, olhando a linha a partir de {@code i}. */
    private static boolean isCommentAt(String line, int i) {
        if (line.charAt(i) == '#') return true;
        return line.startsWith("--", i) && isInlineDashComment(line, i);
    }

    private static boolean isInlineDashComment(String line, int i) {
        if (i + 1 >= line.length() || line.charAt(i + 1) != '-') return false;
        return i + 2 >= line.length() || Character.isWhitespace(line.charAt(i + 2));
    }

    private static String normalizeLineEndings(String line) {
        if (line.indexOf('\r') < 0) return line;
        return line.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static boolean isBlank(CharSequence cs) {
        for (int i = 0; i < cs.length(); i++) {
            if (!Character.isWhitespace(cs.charAt(i))) return false;
        }
        return true;
    }

    static int utf8Length(CharSequence s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x80) n++;
            else if (c < 0x800) n += 2;
            else if (Character.isHighSurrogate(c)) {
                n += 4;
                i++;
            } else n += 3;
        }
        return n;
    }
}
