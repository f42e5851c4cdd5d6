package com.example.notifyhub.notification.realtime;

import java.io.IOException;

/**
 * One live client connection of a user. Implementations must allow {@link #send} from several
 * threads at once.
 */
public interface ConnectionHandle {

  String id();

  boolean isOpen();

  void send(String message) throws IOException;

  /** Closes the connection; never throws. */
  void close();
}
