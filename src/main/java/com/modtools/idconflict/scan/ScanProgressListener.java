package com.modtools.idconflict.scan;

/**
 * Receives the number of processed candidate files; called on the scanning thread.
 */
@FunctionalInterface
public interface ScanProgressListener {

    ScanProgressListener NONE = (processed, total) -> { };

    void onProgress(int processed, int total);
}
