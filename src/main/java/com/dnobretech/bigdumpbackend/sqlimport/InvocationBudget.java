package com.dnobretech.bigdumpbackend.sqlimport;

import lombok.Builder;

/**
 * Limites de uma invocação. Valores {@code <= 0} em maxLines/maxTimeMillis significam sem limite
 * (modo CLI).
 *
 * @param maxOverrunLines  quantas linhas além do limite esperar por um ponto limpo (buffer de INSERTs
 *                         vazio) antes de forçar o flush
 * @param commitFrequency  statements entre commits
 * @param memoryCheckEvery a cada quantas linhas consultar a pressão de memória (com AutoTuner); sem
 *                         limite de linhas e de tempo a pressão de memória não pausa a invocação
 */
@Builder(toBuilder = true)
public record InvocationBudget(long maxLines, long maxTimeMillis, long maxOverrunLines, int commitFrequency,
                               long logEveryLines, long memoryCheckEvery) {

    public static InvocationBudget unlimited() {
        return InvocationBudget.builder()
                .maxLines(0)
                .maxTimeMillis(0)
                .maxOverrunLines(50_000)
                .commitFrequency(1)
                .logEveryLines(100_000)
                .memoryCheckEvery(1_000)
                .build();
    }

    /** Sem limite de linhas nem de tempo: a invocação vai até o fim do arquivo, parada ou erro. */
    public boolean isUnbounded() {
        return maxLines <= 0 && maxTimeMillis <= 0;
    }

    public static InvocationBudget lines(long maxLines) {
        return unlimited().toBuilder().maxLines(maxLines).build();
    }
}
