package dev.mcpproxy.relay;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Reads and writes {@link Envelope}s as JSON text.
 */
public final class EnvelopeCodec {

    private final ObjectMapper mapper;
    private final ObjectReader reader;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        // one frame carries exactly one message
        this.reader = mapper.readerFor(JsonNode.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Parse a JSON-RPC 2.0 message.
     * @param json message text
     * @return the parsed envelope
     * @throws MalformedEnvelopeException when the text is not a single JSON object declaring
     * {@code "jsonrpc": "2.0"}, or carries anything after that object
     */
    public Envelope decode(String json) throws MalformedEnvelopeException {
        if (json == null) {
            throw new MalformedEnvelopeException("Payload is null");
        }
        JsonNode node;
        try {
            node = reader.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedEnvelopeException("Payload is not a JSON object");
        }
        JsonNode version = node.get("jsonrpc");
        if (version == null || !Envelope.JSONRPC_VERSION.equals(version.textValue())) {
            throw new MalformedEnvelopeException("Payload does not declare jsonrpc 2.0");
        }
        return new Envelope((ObjectNode) node);
    }

    public String encode(Envelope envelope) throws JsonProcessingException {
        return mapper.writeValueAsString(envelope.body());
    }
}
