package com.example.notifyhub.notification.delivery;

import java.util.Optional;

/** Resolves contact details of a user owned by another service. */
public interface RecipientDirectory {

  /**
   * @return the address, or empty when the user exists but has no usable address
   * @throws AccountDirectoryException when the lookup itself fails or the user is unknown
   */
  Optional<String> findEmailAddress(String userId);
}
