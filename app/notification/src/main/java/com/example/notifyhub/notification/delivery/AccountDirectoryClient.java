/*
 * Where: notification delivery
 * What: looks up a user's email address through the account service internal API
 * Why: contact data is owned by the account service and is not copied into this database
 */
package com.example.notifyhub.notification.delivery;

import com.example.notifyhub.notification.config.AccountClientProperties;
import java.net.SocketTimeoutException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@RequiredArgsConstructor
public class AccountDirectoryClient implements RecipientDirectory {

  private static final String STATUS_ACTIVE = "ACTIVE";

  private final RestClient accountRestClient;
  private final AccountClientProperties properties;

  @Override
  public Optional<String> findEmailAddress(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
    final AccountContactResponse response = callGetContact(userId);
    if (!STATUS_ACTIVE.equalsIgnoreCase(response.status())) {
      return Optional.empty();
    }
    if (response.email() == null || response.email().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(response.email());
  }

  private AccountContactResponse callGetContact(String userId) {
    try {
      final AccountContactResponse response =
          accountRestClient
              .get()
              .uri(properties.contactPath(), userId)
              .header(properties.internalApiHeaderName(), properties.internalApiToken())
              .retrieve()
              .body(AccountContactResponse.class);
      return requireValid(response);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (AccountDirectoryException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new AccountDirectoryException(
          AccountDirectoryException.Reason.INVALID_RESPONSE, "account response parse failed", ex);
    }
  }

  private AccountContactResponse requireValid(AccountContactResponse response) {
    if (response == null || isBlank(response.userId()) || isBlank(response.status())) {
      throw new AccountDirectoryException(
          AccountDirectoryException.Reason.INVALID_RESPONSE, "account response is invalid");
    }
    return response;
  }

  private AccountDirectoryException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 404) {
      return new AccountDirectoryException(
          AccountDirectoryException.Reason.NOT_FOUND, "account user not found", ex);
    }
    if (status == 401 || status == 403) {
      return new AccountDirectoryException(
          AccountDirectoryException.Reason.UNAUTHORIZED, "account rejected internal auth", ex);
    }
    return new AccountDirectoryException(
        AccountDirectoryException.Reason.BAD_GATEWAY, "account request failed status=" + status, ex);
  }

  private AccountDirectoryException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      return new AccountDirectoryException(
          AccountDirectoryException.Reason.TIMEOUT, "account request timeout", ex);
    }
    return new AccountDirectoryException(
        AccountDirectoryException.Reason.BAD_GATEWAY, "account connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
