package com.dnobretech.bigdumpbackend.sqlimport;

/**
 * @param cached a leitura veio do cache (TTL curto) em vez de uma chamada nova ao probe
 */
public record MemoryPressure(long usage, long limit, double ratio, int percentage, boolean cached) {
}
