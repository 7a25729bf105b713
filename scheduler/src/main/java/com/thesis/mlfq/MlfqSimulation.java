package com.thesis.mlfq;

import com.thesis.mlfq.config.SchedulerConfig;
import com.thesis.mlfq.model.Process;
import com.thesis.mlfq.trace.LoggingExecutionListener;
import com.thesis.mlfq.trace.TierDump;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line driver for the MLFQ scheduler.
 * 
 * Builds a scheduler from the environment, loads the demo workload,
 * drains every tier from highest to lowest priority, advances the
 * clock by one boost interval and prints the final tiers.
 * 
 * @author Vicente (Thesis Project)
 */
public class MlfqSimulation {
    
    private static final Logger LOG = LoggerFactory.getLogger(MlfqSimulation.class);
    
    private final SchedulerConfig config;
    private final MlfqScheduler scheduler;
    
    public MlfqSimulation(SchedulerConfig config) {
        this.config = config;
        this.scheduler = new MlfqScheduler(config);
        this.scheduler.addListener(new LoggingExecutionListener());
    }
    
    /**
     * Load the demo processes, drain each tier in priority order, then
     * advance the clock by one boost interval.
     */
    public static void runScenario(MlfqScheduler scheduler) {
        scheduler.addProcess(new Process(1, 0, 10));
        scheduler.addProcess(new Process(2, 0, 3));
        scheduler.addProcess(new Process(3, 1, 5));
        
        for (int tierIndex = 0; tierIndex < scheduler.getNumLevels(); tierIndex++) {
            while (!scheduler.isTierEmpty(tierIndex)) {
                scheduler.executeProcess(tierIndex);
            }
        }
        
        scheduler.updateTime(scheduler.getBoostInterval());
    }
    
    public void run() {
        printBanner();
        runScenario(scheduler);
        
        System.out.println();
        System.out.println(TierDump.format(scheduler));
        System.out.println(scheduler.getStatistics().getStatisticsSummary());
        LOG.info("[Simulation] Finished at t={}", scheduler.getCurrentTime());
    }
    
    public MlfqScheduler getScheduler() {
        return scheduler;
    }
    
    private void printBanner() {
        System.out.println("========================================");
        System.out.println("  MLFQ Scheduler Simulation");
        System.out.println("========================================");
        config.print();
    }
    
    /**
     * Main entry point
     */
    public static void main(String[] args) {
        try {
            new MlfqSimulation(SchedulerConfig.fromEnv()).run();
        } catch (Exception e) {
            LOG.error("FATAL ERROR: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
