package benor.messaging;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

public final class JsonMessageCodec implements MessageCodec {

    private final ObjectMapper objectMapper;

    public JsonMessageCodec() {
        this.objectMapper = createConfiguredObjectMapper();
    }

    /**
     * Creates an ObjectMapper for serializing payload records.
     * Jackson handles byte[] fields as Base64 in JSON.
     */
    public static ObjectMapper createConfiguredObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] encode(Object obj) {
        if (obj == null) {
            throw new MessageCodecException("Cannot encode null object");
        }
        try {
            // Message goes through a map so MessageType is written by id
            if (obj instanceof Message msg) {
                Map<String, Object> map = new HashMap<>();
                map.put("source", msg.source());
                map.put("destination", msg.destination());
                map.put("messageType", msg.messageType().getId());
                map.put("payload", msg.payload());
                map.put("correlationId", msg.correlationId());
                return objectMapper.writeValueAsBytes(map);
            }
            return objectMapper.writeValueAsBytes(obj);
        } catch (Exception e) {
            throw new MessageCodecException("Failed to encode " + obj.getClass().getSimpleName(), e);
        }
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) {
        if (data == null) {
            throw new MessageCodecException("Cannot decode null data");
        }
        try {
            if (type == Message.class) {
                return type.cast(decodeMessage(data));
            }
            return objectMapper.readValue(data, type);
        } catch (MessageCodecException e) {
            throw e;
        } catch (Exception e) {
            throw new MessageCodecException("Failed to decode to " + type.getSimpleName(), e);
        }
    }

    private Message decodeMessage(byte[] data) throws Exception {
        JsonNode node = objectMapper.readTree(data);
        NetworkAddress source = objectMapper.treeToValue(node.get("source"), NetworkAddress.class);
        NetworkAddress destination = objectMapper.treeToValue(node.get("destination"), NetworkAddress.class);
        String typeId = node.get("messageType").asText();
        MessageType msgType = MessageType.valueOf(typeId);
        if (msgType == null) {
            throw new MessageCodecException("Unknown message type: " + typeId);
        }
        byte[] payload = objectMapper.treeToValue(node.get("payload"), byte[].class);
        String correlationId = node.get("correlationId").asText();
        return new Message(source, destination, msgType, payload, correlationId);
    }

    /**
     * Renders any payload as a JSON string, used for console reports.
     */
    public String toJson(Object obj) {
        return new String(encode(obj), StandardCharsets.UTF_8);
    }
}
