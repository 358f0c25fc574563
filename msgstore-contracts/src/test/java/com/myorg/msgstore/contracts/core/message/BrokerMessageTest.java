package com.myorg.msgstore.contracts.core.message;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class BrokerMessageTest {

    @Test
    void payloadCannotBeMutatedThroughTheMessage() {
        byte[] raw = "hello".getBytes(StandardCharsets.UTF_8);
        BrokerMessage m = new BrokerMessage("t", 0, 3L, null, raw);

        raw[0] = 'X';
        m.payload()[1] = 'Y';

        assertThat(new String(m.payload(), StandardCharsets.UTF_8)).isEqualTo("hello");
        assertThat(m.size()).isEqualTo(5);
    }

    @Test
    void equalityComparesPayloadContent() {
        BrokerMessage a = new BrokerMessage("t", 1, 9L, "k", new byte[] {1, 2});
        BrokerMessage b = new BrokerMessage("t", 1, 9L, "k", new byte[] {1, 2});

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a.toString()).contains("offset=9").doesNotContain("[B@");
    }

    @Test
    void outgoingMessageHasNoPosition() {
        BrokerMessage m = BrokerMessage.outgoing("t", null, null);
        assertThat(m.partition()).isEqualTo(BrokerMessage.UNASSIGNED);
        assertThat(m.offset()).isEqualTo(BrokerMessage.UNASSIGNED);
        assertThat(m.size()).isZero();
    }
}
