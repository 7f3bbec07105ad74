package com.lobsim.simulation;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates EngineCommand slots when the Disruptor starts.
 */
public class EngineCommandFactory implements EventFactory<EngineCommand> {

    @Override
    public EngineCommand newInstance() {
        return new EngineCommand();
    }
}
