package com.eainde.verity.resolution;

/**
 * Iteration ceiling of the self-healing loop, kept apart from the loop decision so it can be swapped.
 */
public interface LoopCeilingPolicy {

    /**
     * @param loopCount passes completed before the current one
     * @return whether the current pass is the last one allowed
     */
    boolean isFinalPass(int loopCount, int maxLoops);

    /**
     * @param loopCount passes completed, including the one that just finished
     * @return whether the pipeline may enter the first stage again
     */
    boolean permitsReentry(int loopCount, int maxLoops);
}
