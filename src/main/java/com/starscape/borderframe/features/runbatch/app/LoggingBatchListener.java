package com.starscape.borderframe.features.runbatch.app;

import com.starscape.borderframe.features.batch.app.BatchListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reports batch events to the log.
 */
public class LoggingBatchListener implements BatchListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingBatchListener.class);

    private final int totalCount;

    public LoggingBatchListener(int totalCount) {
        this.totalCount = totalCount;
    }

    @Override
    public void onProgress(int completedCount, String statusText) {
        log.info("[{}/{}] {}", completedCount, totalCount, statusText);
    }

    @Override
    public void onFatalError(String title, String message) {
        log.error("{}: {}", title, message);
    }

    @Override
    public void onFinished(List<String> errors) {
        if (errors.isEmpty()) {
            log.info("All {} images processed successfully", totalCount);
            return;
        }
        log.warn("Batch finished with {} error(s):", errors.size());
        for (String error : errors) {
            log.warn("  {}", error);
        }
    }
}
