package com.quick.duel.duel;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlayerSessionTest {

    private WebSocketSession transport;
    private StateStore store;
    private PlayerSession session;

    @BeforeEach
    void setUp() {
        transport = mock(WebSocketSession.class);
        when(transport.getId()).thenReturn("ws-1");
        when(transport.isOpen()).thenReturn(true);
        store = mock(StateStore.class);
        session = new PlayerSession(transport, new MessageCodec(new ObjectMapper()), store);
    }

    @Test
    void startShouldRegisterWithStore() {
        session.start();

        verify(store).create(session);
        assertInstanceOf(PlayerSession.Initializing.class, session.state());
    }

    @Test
    void connectedShouldActivateAndReachTransport() throws IOException {
        session.publish(new OutgoingMessage.Connected(7));

        assertEquals(new PlayerSession.Active(7), session.state());
        assertEquals(Optional.of(7), session.playerId());
        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(transport).sendMessage(sent.capture());
        assertEquals("{\"type\":\"connected\",\"id\":7}", sent.getValue().getPayload());
    }

    @Test
    void payloadBeforeActivationShouldBeDropped() {
        session.onText("{\"type\":\"play_card\",\"card\":\"ATTACK\"}");

        verify(store, never()).receive(anyInt(), anyString());
    }

    @Test
    void activeSessionShouldForwardPayloadAndDeleteOnClose() {
        session.publish(new OutgoingMessage.Connected(3));

        session.onText("hello");
        session.onClose();

        verify(store).receive(3, "hello");
        verify(store).delete(3);
        assertInstanceOf(PlayerSession.Closed.class, session.state());
    }

    @Test
    void closeBeforeConnectedShouldDeleteLatePlayer() throws IOException {
        session.onClose();
        session.publish(new OutgoingMessage.Connected(5));

        verify(store).delete(5);
        verify(transport, never()).sendMessage(any());
        assertInstanceOf(PlayerSession.Closed.class, session.state());
    }

    @Test
    void sendFailureShouldNotPropagate() throws IOException {
        doThrow(new IOException("broken pipe")).when(transport).sendMessage(any());

        assertDoesNotThrow(() -> session.publish(new OutgoingMessage.Err("nope")));
    }

    @Test
    void closedTransportShouldSkipSend() throws IOException {
        when(transport.isOpen()).thenReturn(false);

        session.publish(new OutgoingMessage.Challenge(2));

        verify(transport, never()).sendMessage(any());
    }
}
