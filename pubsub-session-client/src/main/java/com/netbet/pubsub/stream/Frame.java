package com.netbet.pubsub.stream;

/**
 * Protocol envelope. Closed over the frame kinds the service exchanges; anything else decodes to {@link Unknown}.
 */
public sealed interface Frame
        permits Frame.Subscribe, Frame.Publish, Frame.SubAck, Frame.EventBatch,
        Frame.SourceChange, Frame.ServerError, Frame.Unknown {

    int VERSION = 3;

    String SUBSCRIBE = "subscribe";
    String PUBLISH = "publish";
    String SUBACK = "suback";
    String EVENT = "event";
    String ONSRC = "onsrc";
    String ERROR = "error";

    String type();

    /** Client to server. {@code sid}, {@code gid} and {@code cache} are optional. */
    record Subscribe(String destination, long cid, String sid, String gid, CacheMode cache) implements Frame {
        @Override
        public String type() {
            return SUBSCRIBE;
        }
    }

    /** Client to server. */
    record Publish(String destination, String data) implements Frame {
        @Override
        public String type() {
            return PUBLISH;
        }
    }

    /** Server to client. {@code cid} is null when the server does not echo the correlation id. */
    record SubAck(String sid, Long cid) implements Frame {
        @Override
        public String type() {
            return SUBACK;
        }
    }

    /** Server to client. */
    record EventBatch(int src, Batch batch, String sid) implements Frame {
        @Override
        public String type() {
            return EVENT;
        }
    }

    /** Server to client: the active upstream source for {@code sid} is now {@code src}. */
    record SourceChange(int src, String sid) implements Frame {
        @Override
        public String type() {
            return ONSRC;
        }
    }

    /** Server to client. */
    record ServerError(String code, String message) implements Frame {
        @Override
        public String type() {
            return ERROR;
        }
    }

    record Unknown(String type) implements Frame {
    }
}
