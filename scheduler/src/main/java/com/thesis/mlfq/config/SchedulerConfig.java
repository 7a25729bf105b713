package com.thesis.mlfq.config;

import com.thesis.mlfq.model.DispatchOrder;
import com.thesis.mlfq.model.ExhaustionPolicy;

import java.util.Arrays;
import java.util.Map;

/**
 * Scheduler configuration, read from the environment with defaults.
 * 
 * Variables:
 * - MLFQ_LEVELS             number of tiers (default 3)
 * - MLFQ_TIME_QUANTA        comma-separated quanta (default 2,4,8)
 * - MLFQ_BOOST_INTERVAL     boost interval (default 100)
 * - MLFQ_DISPATCH_ORDER     LIFO | FIFO (default LIFO)
 * - MLFQ_EXHAUSTION_POLICY  DROP | REQUEUE (default DROP)
 */
public class SchedulerConfig {
    
    public static final String ENV_LEVELS = "MLFQ_LEVELS";
    public static final String ENV_TIME_QUANTA = "MLFQ_TIME_QUANTA";
    public static final String ENV_BOOST_INTERVAL = "MLFQ_BOOST_INTERVAL";
    public static final String ENV_DISPATCH_ORDER = "MLFQ_DISPATCH_ORDER";
    public static final String ENV_EXHAUSTION_POLICY = "MLFQ_EXHAUSTION_POLICY";
    
    public static final int DEFAULT_LEVELS = 3;
    public static final long DEFAULT_BOOST_INTERVAL = 100;
    public static final int MAX_LEVELS = 32;
    
    public int numLevels = DEFAULT_LEVELS;
    public long[] timeQuanta = defaultQuanta(DEFAULT_LEVELS);
    public long boostInterval = DEFAULT_BOOST_INTERVAL;
    public DispatchOrder dispatchOrder = DispatchOrder.LIFO;
    public ExhaustionPolicy exhaustionPolicy = ExhaustionPolicy.DROP;
    
    public static SchedulerConfig fromEnv() {
        return fromEnv(System.getenv());
    }
    
    public static SchedulerConfig fromEnv(Map<String, String> env) {
        SchedulerConfig config = new SchedulerConfig();
        config.numLevels = EnvVars.getIntClamped(env, ENV_LEVELS, DEFAULT_LEVELS, 1, MAX_LEVELS);
        config.timeQuanta = EnvVars.getLongList(env, ENV_TIME_QUANTA, defaultQuanta(config.numLevels));
        config.boostInterval = EnvVars.getLongClamped(env, ENV_BOOST_INTERVAL,
            DEFAULT_BOOST_INTERVAL, 1, Long.MAX_VALUE);
        config.dispatchOrder = EnvVars.getEnum(env, ENV_DISPATCH_ORDER,
            DispatchOrder.class, DispatchOrder.LIFO);
        config.exhaustionPolicy = EnvVars.getEnum(env, ENV_EXHAUSTION_POLICY,
            ExhaustionPolicy.class, ExhaustionPolicy.DROP);
        return config;
    }
    
    /**
     * Quanta doubling from 2: 2, 4, 8, 16, ...
     */
    public static long[] defaultQuanta(int numLevels) {
        long[] quanta = new long[numLevels];
        for (int i = 0; i < numLevels; i++) {
            quanta[i] = 2L << i;
        }
        return quanta;
    }
    
    public void print() {
        System.out.println("==========================================");
        System.out.println("  MLFQ Configuration");
        System.out.println("==========================================");
        System.out.println("  Levels:          " + numLevels);
        System.out.println("  Time quanta:     " + Arrays.toString(timeQuanta));
        System.out.println("  Boost interval:  " + boostInterval);
        System.out.println("  Dispatch order:  " + dispatchOrder);
        System.out.println("  Lowest tier:     " + exhaustionPolicy);
        System.out.println("==========================================");
        System.out.println();
    }
}
