package com.lobsim.simulation;

import com.lmax.disruptor.EventTranslator;
import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.RingBuffer;
import com.lobsim.domain.OrderRequest;

/**
 * Copies producer-side data into a claimed EngineCommand slot.
 * Producers never touch the engine; they only publish through these translators.
 */
public final class EngineCommandTranslator {

    public static final EventTranslator<EngineCommand> TICK = (command, sequence) -> {
        command.type = EngineCommand.Type.TICK;
        command.receivedNanos = System.nanoTime();
    };

    public static final EventTranslatorOneArg<EngineCommand, OrderRequest> SUBMIT =
            (command, sequence, request) -> {
                command.type = EngineCommand.Type.SUBMIT;
                command.receivedNanos = System.nanoTime();
                command.side = request.getSide();
                command.orderType = request.getType();
                command.price = request.getPrice();
                command.quantity = request.getQuantity();
                command.owner = request.getOwner();
            };

    public static final EventTranslatorOneArg<EngineCommand, Long> CANCEL =
            (command, sequence, orderId) -> {
                command.type = EngineCommand.Type.CANCEL;
                command.receivedNanos = System.nanoTime();
                command.orderId = orderId;
            };

    private EngineCommandTranslator() {
    }

    public static void publishTick(RingBuffer<EngineCommand> ringBuffer) {
        ringBuffer.publishEvent(TICK);
    }

    public static void publishSubmit(RingBuffer<EngineCommand> ringBuffer, OrderRequest request) {
        ringBuffer.publishEvent(SUBMIT, request);
    }

    public static void publishCancel(RingBuffer<EngineCommand> ringBuffer, long orderId) {
        ringBuffer.publishEvent(CANCEL, orderId);
    }
}
