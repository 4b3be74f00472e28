package com.netbet.pubsub.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for protocol frames (wire version 3). Builds and reads the tree model directly so that
 * optional fields are omitted on the wire rather than sent as null.
 */
@Component
public class FrameCodec {

    private final ObjectMapper objectMapper;

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Frame frame) {
        ObjectNode root = objectMapper.createObjectNode();
        switch (frame.type()) {
            case Frame.SUBSCRIBE -> {
                Frame.Subscribe f = (Frame.Subscribe) frame;
                root.put("type", Frame.SUBSCRIBE);
                root.put("destination", f.destination());
                root.put("cid", f.cid());
                root.put("v", Frame.VERSION);
                putIfPresent(root, "sid", f.sid());
                putIfPresent(root, "gid", f.gid());
                if (f.cache() != null) {
                    root.put("cache", f.cache().wireValue());
                }
            }
            case Frame.PUBLISH -> {
                Frame.Publish f = (Frame.Publish) frame;
                root.put("v", Frame.VERSION);
                root.put("type", Frame.PUBLISH);
                root.put("destination", f.destination());
                root.put("data", f.data());
            }
            case Frame.SUBACK -> {
                Frame.SubAck f = (Frame.SubAck) frame;
                root.put("v", Frame.VERSION);
                root.put("type", Frame.SUBACK);
                root.put("sid", f.sid());
                if (f.cid() != null) {
                    root.put("cid", f.cid());
                }
            }
            case Frame.EVENT -> {
                Frame.EventBatch f = (Frame.EventBatch) frame;
                root.put("v", Frame.VERSION);
                root.put("type", Frame.EVENT);
                root.put("src", f.src());
                root.set("batch", batchNode(f.batch()));
                root.put("sid", f.sid());
            }
            case Frame.ONSRC -> {
                Frame.SourceChange f = (Frame.SourceChange) frame;
                root.put("v", Frame.VERSION);
                root.put("type", Frame.ONSRC);
                root.put("src", f.src());
                root.put("sid", f.sid());
            }
            case Frame.ERROR -> {
                Frame.ServerError f = (Frame.ServerError) frame;
                root.put("v", Frame.VERSION);
                root.put("type", Frame.ERROR);
                root.put("code", f.code());
                root.put("message", f.message());
            }
            default -> throw new IllegalArgumentException("Cannot encode frame type " + frame.type());
        }
        return root.toString();
    }

    public Frame decode(String text) throws InvalidFrameException {
        if (text == null || text.isBlank()) {
            throw new InvalidFrameException("Empty frame");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new InvalidFrameException("Malformed frame JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidFrameException("Frame is not a JSON object");
        }
        String type = root.path("type").asText(null);
        if (type == null || type.isBlank()) {
            throw new InvalidFrameException("Frame has no type");
        }
        return switch (type) {
            case Frame.SUBACK -> new Frame.SubAck(requiredText(root, "sid", type),
                    root.hasNonNull("cid") ? root.get("cid").asLong() : null);
            case Frame.EVENT -> new Frame.EventBatch(requiredInt(root, "src", type),
                    readBatch(root.path("batch")), requiredText(root, "sid", type));
            case Frame.ONSRC -> new Frame.SourceChange(requiredInt(root, "src", type), requiredText(root, "sid", type));
            case Frame.ERROR -> new Frame.ServerError(root.path("code").asText(""), root.path("message").asText(""));
            case Frame.SUBSCRIBE -> new Frame.Subscribe(requiredText(root, "destination", type),
                    root.path("cid").asLong(), root.path("sid").asText(null), root.path("gid").asText(null),
                    root.has("cache") ? CacheMode.fromConfig(root.path("cache").asText()) : null);
            case Frame.PUBLISH -> new Frame.Publish(requiredText(root, "destination", type), root.path("data").asText(null));
            default -> new Frame.Unknown(type);
        };
    }

    private ObjectNode batchNode(Batch batch) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("destination", batch.destination());
        node.put("gid", batch.gid());
        ArrayNode data = node.putArray("data");
        for (BatchEvent event : batch.data()) {
            ObjectNode e = data.addObject();
            e.put("gid", event.gid());
            e.set("data", event.data());
        }
        node.put("sid", batch.sid());
        return node;
    }

    private Batch readBatch(JsonNode node) throws InvalidFrameException {
        if (node == null || !node.isObject()) {
            throw new InvalidFrameException("Event frame has no batch");
        }
        List<BatchEvent> events = new ArrayList<>();
        JsonNode data = node.path("data");
        if (data.isArray()) {
            for (JsonNode e : data) {
                events.add(new BatchEvent(e.path("gid").asText(null), e.get("data")));
            }
        } else if (!data.isMissingNode() && !data.isNull()) {
            throw new InvalidFrameException("Batch data is not an array");
        }
        return new Batch(node.path("destination").asText(null), node.path("gid").asText(null),
                events, node.path("sid").asText(null));
    }

    private static String requiredText(JsonNode root, String field, String type) throws InvalidFrameException {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual()) {
            throw new InvalidFrameException("Frame " + type + " is missing '" + field + "'");
        }
        return value.asText();
    }

    private static int requiredInt(JsonNode root, String field, String type) throws InvalidFrameException {
        JsonNode value = root.get(field);
        if (value == null || !value.isNumber()) {
            throw new InvalidFrameException("Frame " + type + " is missing numeric '" + field + "'");
        }
        return value.asInt();
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
