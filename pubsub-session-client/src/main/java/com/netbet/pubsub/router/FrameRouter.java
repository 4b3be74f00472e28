package com.netbet.pubsub.router;

import com.netbet.pubsub.error.ErrorCode;
import com.netbet.pubsub.error.ErrorReporter;
import com.netbet.pubsub.event.EventProcessor;
import com.netbet.pubsub.stream.Frame;
import com.netbet.pubsub.stream.FrameHandler;
import com.netbet.pubsub.subscription.SubscriptionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Centralized routing for inbound frames by type: suback, event, onsrc, error.
 */
@Component
public class FrameRouter implements FrameHandler {

    private static final Logger log = LoggerFactory.getLogger(FrameRouter.class);

    private final SubscriptionManager subscriptionManager;
    private final EventProcessor eventProcessor;
    private final ErrorReporter errorReporter;

    public FrameRouter(SubscriptionManager subscriptionManager,
                       EventProcessor eventProcessor,
                       ErrorReporter errorReporter) {
        this.subscriptionManager = subscriptionManager;
        this.eventProcessor = eventProcessor;
        this.errorReporter = errorReporter;
    }

    @Override
    public void handle(Frame frame) {
        switch (frame.type()) {
            case Frame.SUBACK -> subscriptionManager.handleSubAck((Frame.SubAck) frame);
            case Frame.EVENT -> eventProcessor.onEventFrame((Frame.EventBatch) frame);
            case Frame.ONSRC -> eventProcessor.onSourceChange((Frame.SourceChange) frame);
            case Frame.ERROR -> {
                Frame.ServerError error = (Frame.ServerError) frame;
                errorReporter.report(ErrorCode.SERVER_ERROR, error.code() + ": " + error.message());
            }
            default -> log.trace("Unhandled frame type: {}", frame.type());
        }
    }
}
