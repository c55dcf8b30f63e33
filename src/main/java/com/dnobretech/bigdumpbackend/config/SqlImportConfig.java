package com.dnobretech.bigdumpbackend.config;

import com.dnobretech.bigdumpbackend.sqlimport.CodecCapabilities;
import com.dnobretech.bigdumpbackend.sqlimport.MemoryProbe;
import com.dnobretech.bigdumpbackend.sqlimport.RuntimeMemoryProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Beans do motor de import que não dependem de request: detecção de codecs e leitura de memória. */
@Slf4j
@Configuration
public class SqlImportConfig {

    @Bean
    public CodecCapabilities codecCapabilities() {
        CodecCapabilities caps = CodecCapabilities.probe();
        log.info("Codecs disponíveis: gzip=true bzip2={}", caps.bzip2Available());
        return caps;
    }

    @Bean
    public MemoryProbe memoryProbe() {
        return new RuntimeMemoryProbe();
    }
}
