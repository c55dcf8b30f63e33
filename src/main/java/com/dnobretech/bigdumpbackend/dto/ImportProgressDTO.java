package com.dnobretech.bigdumpbackend.dto;

import com.dnobretech.bigdumpbackend.sqlimport.InvocationStatistics;

/** Resposta de uma invocação: estado da sessão + o que esta invocação fez. */
public record ImportProgressDTO(
        ImportStatusDTO status,
        InvocationStatistics invocation
) {}
