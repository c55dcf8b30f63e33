package com.dnobretech.bigdumpbackend.sqlimport;

/** Fonte das leituras de memória do {@link AutoTuner}; substituível em testes. */
public interface MemoryProbe {

    /** Heap em uso pela JVM. */
    long heapUsage();

    /** Limite do heap (-Xmx). */
    long heapLimit();

    /** RAM total do host, ou o limite do heap se não der para detectar. */
    long totalRam();

    /** RAM disponível no host, ou a folga do heap se não der para detectar. */
    long availableRam();

    String detectionMethod();
}
