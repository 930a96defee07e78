package io.github.drompincen.synapsehub.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WsMessageTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void ofFactoryCreatesMessage() {
        WsMessage msg = WsMessage.of(WsMessageType.TASK_UPDATE, new TextNode("payload"));

        assertThat(msg.type()).isEqualTo(WsMessageType.TASK_UPDATE);
        assertThat(msg.data().asText()).isEqualTo("payload");
        assertThat(msg.correlationId()).isNull();
        assertThat(msg.timestamp()).isNotNull();
    }

    @Test
    void errorFactoryKeepsCorrelationId() {
        WsMessage msg = WsMessage.error(new TextNode("something went wrong"), "c-1");

        assertThat(msg.type()).isEqualTo(WsMessageType.ERROR);
        assertThat(msg.correlationId()).isEqualTo("c-1");
    }

    @Test
    void typeIsWrittenAsWireValue() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(WsMessage.of(WsMessageType.CONNECTION_ESTABLISHED, null)));
        assertThat(json.get("type").asText()).isEqualTo("connection_established");
    }

    @Test
    void findResolvesKnownTypesOnly() {
        assertThat(WsMessageType.find("get_status")).contains(WsMessageType.GET_STATUS);
        assertThat(WsMessageType.find("teleport")).isEmpty();
        assertThat(WsMessageType.find(null)).isEmpty();
    }

    @Test
    void topicNarrowsToResourceId() {
        assertThat(WsMessage.topic("tasks", null)).isEqualTo("tasks");
        assertThat(WsMessage.topic("tasks", "T1")).isEqualTo("tasks:T1");
    }
}
