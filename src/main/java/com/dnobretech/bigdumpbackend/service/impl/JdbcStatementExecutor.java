package com.dnobretech.bigdumpbackend.service.impl;

import com.dnobretech.bigdumpbackend.exception.DumpImportException;
import com.dnobretech.bigdumpbackend.sqlimport.ExecutionResult;
import com.dnobretech.bigdumpbackend.sqlimport.StatementExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.StatementCallback;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Executa statements do dump numa conexão dedicada, com auto-commit desligado. Uma instância por
 * invocação: abre a conexão no construtor e devolve no {@link #close()}.
 */
@Slf4j
public class JdbcStatementExecutor implements StatementExecutor, AutoCloseable {

    private static final Pattern CREATE_TABLE = Pattern.compile(
            "^\\s*CREATE\\s+(?:TEMPORARY\\s+)?TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?"
                    + "((?:[`\"]?[\\w$]+[`\"]?\\.)?[`\"]?[\\w$]+[`\"]?)",
            Pattern.CASE_INSENSITIVE);

    private static final int MYSQL_TABLE_EXISTS = 1050;

    private final DataSource dataSource;
    private final Connection connection;
    private final boolean previousAutoCommit;
    private final JdbcTemplate jdbc;

    public JdbcStatementExecutor(DataSource dataSource) {
        this.dataSource = dataSource;
        this.connection = DataSourceUtils.getConnection(dataSource);
        try {
            this.previousAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            DataSourceUtils.releaseConnection(connection, dataSource);
            throw new DumpImportException("Não foi possível preparar a conexão do import", e);
        }
        this.jdbc = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    @Override
    public ExecutionResult execute(String statement) {
        final String sql = stripTrailingSemicolon(statement);
        try {
            Long rows = jdbc.execute((StatementCallback<Long>) st -> {
                st.setEscapeProcessing(false); // dado do dump vai como está, sem escapes JDBC {fn ...}
                boolean hasResultSet = st.execute(sql);
                return hasResultSet ? 0L : Math.max(0, st.getUpdateCount());
            });
            return ExecutionResult.ok(rows == null ? 0 : rows);
        } catch (DataAccessException e) {
            Throwable root = e.getMostSpecificCause();
            String message = root.getMessage() != null ? root.getMessage() : e.getMessage();
            Integer code = null;
            String state = null;
            if (root instanceof SQLException) {
                SQLException sqlEx = (SQLException) root;
                code = sqlEx.getErrorCode();
                state = sqlEx.getSQLState();
            }
            String existing = isTableExists(code, state, message) ? extractCreateTable(sql) : null;
            return ExecutionResult.failure(message, code, state, existing);
        }
    }

    @Override
    public void commit() {
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new DumpImportException("Falha no commit: " + e.getMessage(), e);
        }
    }

    @Override
    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Falha no rollback: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            connection.setAutoCommit(previousAutoCommit);
        } catch (SQLException e) {
            log.debug("Ignorando falha ao restaurar auto-commit: {}", e.toString());
        }
        DataSourceUtils.releaseConnection(connection, dataSource);
    }

    static boolean isTableExists(Integer code, String sqlState, String message) {
        if (code != null && code == MYSQL_TABLE_EXISTS) return true;
        if ("42S01".equals(sqlState) || "42P07".equals(sqlState)) return true;
        return message != null && message.toLowerCase(Locale.ROOT).contains("already exists");
    }

    /** Nome da tabela (sem aspas) de um CREATE TABLE, ou null. */
    static String extractCreateTable(String sql) {
        if (sql == null) return null;
        Matcher m = CREATE_TABLE.matcher(sql);
        if (!m.find()) return null;
        return m.group(1).replace("`", "").replace("\"", "");
    }

    private static String stripTrailingSemicolon(String sql) {
        String s = sql.strip();
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).stripTrailing();
        }
        return s;
    }
}
