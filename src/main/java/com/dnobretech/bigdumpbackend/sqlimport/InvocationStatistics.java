package com.dnobretech.bigdumpbackend.sqlimport;

public record InvocationStatistics(
        long linesThisInvocation,
        long queriesThisInvocation,
        long bytesThisInvocation,
        long linesDone,
        long queriesDone,
        boolean finished,
        String error
) {
}
