package com.rebenew.musicParty.queuesync.core;

import org.springframework.web.socket.CloseStatus;

import java.io.IOException;

/**
 * Una conexión de un miembro a la que se entregan eventos ya serializados.
 * Un mismo miembro puede tener varias (un sink por dispositivo).
 */
public interface EventSink {

    String id();

    String memberId();

    boolean isOpen();

    void send(String json) throws IOException;

    void close(CloseStatus status);
}
