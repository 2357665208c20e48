package com.casebridge.sync.cases.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommunicationRelayServiceTest {

    @Test
    void recognizes_messages_forwarded_from_chat() {
        assertTrue(CommunicationRelayService.isFromChat("[From Alice via Lark] please check"));
        assertFalse(CommunicationRelayService.isFromChat("Hello from AWS Support"));
        assertFalse(CommunicationRelayService.isFromChat("quoted [From Alice via Lark] text"));
        assertFalse(CommunicationRelayService.isFromChat(null));
    }
}
