package com.dnobretech.bigdumpbackend.service.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/** Uma conexão dedicada por invocação do import. */
@Component
@RequiredArgsConstructor
public class JdbcStatementExecutorFactory {

    private final DataSource dataSource;

    public JdbcStatementExecutor create() {
        return new JdbcStatementExecutor(dataSource);
    }
}
