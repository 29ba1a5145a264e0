package com.example.shiftplanner.realtime;

import java.io.IOException;

/**
 * Transport behind one connected client. Implementations must tolerate concurrent {@link #send}.
 */
public interface ClientConnection {

    boolean isOpen();

    void send(String payload) throws IOException;

    void close();
}
