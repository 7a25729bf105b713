package com.thesis.mlfq.trace;

import com.thesis.mlfq.model.ExecutionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every execution record to the log at DEBUG level.
 */
public class LoggingExecutionListener implements ExecutionListener {
    
    private static final Logger LOG = LoggerFactory.getLogger(LoggingExecutionListener.class);
    
    private long recordCount;
    
    @Override
    public void onExecuted(ExecutionRecord record) {
        recordCount++;
        if (LOG.isDebugEnabled()) {
            LOG.debug("[Trace #{}] {}", recordCount, record);
        }
    }
    
    public long getRecordCount() {
        return recordCount;
    }
}
