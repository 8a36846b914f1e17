package com.eainde.verity.resolution;

import org.springframework.stereotype.Component;

/**
 * Default ceiling: at most {@code maxLoops} passes.
 */
@Component
public class MaxLoopsCeiling implements LoopCeilingPolicy {

    @Override
    public boolean isFinalPass(int loopCount, int maxLoops) {
        return loopCount >= maxLoops - 1;
    }

    @Override
    public boolean permitsReentry(int loopCount, int maxLoops) {
        return loopCount < maxLoops;
    }
}
