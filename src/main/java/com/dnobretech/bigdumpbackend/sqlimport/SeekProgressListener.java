package com.dnobretech.bigdumpbackend.sqlimport;

/**
 * Progresso de um replay-seek (bzip2): chamado periodicamente enquanto o stream é relido do início.
 */
@FunctionalInterface
public interface SeekProgressListener {

    SeekProgressListener NONE = (bytesDone, targetOffset) -> { };

    void onProgress(long bytesDone, long targetOffset);
}
