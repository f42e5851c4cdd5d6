package com.example.notifyhub.notification.delivery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.notifyhub.notification.config.AccountClientProperties;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class AccountDirectoryClientTest {

  private static final String CONTACT_URL = "http://account.test/users/user-1/contact";

  @Test
  void findEmailAddressRejectsBlankUserId() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(() -> fixture.client.findEmailAddress(" "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("userId is required");
  }

  @Test
  void findEmailAddressCallsAccountWithInternalToken() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(CONTACT_URL))
        .andExpect(method(GET))
        .andExpect(header("X-Internal-Token", "token-x"))
        .andRespond(
            withSuccess(
                """
                {"userId":"user-1","email":"user1@example.com","status":"ACTIVE"}
                """,
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.findEmailAddress("user-1")).contains("user1@example.com");
    fixture.server.verify();
  }

  @Test
  void suspendedAccountHasNoDeliverableAddress() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(CONTACT_URL))
        .andRespond(
            withSuccess(
                """
                {"userId":"user-1","email":"user1@example.com","status":"SUSPENDED"}
                """,
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.findEmailAddress("user-1")).isEmpty();
  }

  @Test
  void activeAccountWithoutEmailHasNoAddress() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(CONTACT_URL))
        .andRespond(
            withSuccess(
                """
                {"userId":"user-1","status":"ACTIVE"}
                """,
                MediaType.APPLICATION_JSON));

    assertThat(fixture.client.findEmailAddress("user-1")).isEmpty();
  }

  @Test
  void maps404ToNotFound() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(CONTACT_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertReason(fixture, AccountDirectoryException.Reason.NOT_FOUND);
  }

  @Test
  void maps403ToUnauthorized() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(CONTACT_URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertReason(fixture, AccountDirectoryException.Reason.UNAUTHORIZED);
  }

  @Test
  void maps5xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(CONTACT_URL)).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.findEmailAddress("user-1"))
        .isInstanceOf(AccountDirectoryException.class)
        .hasMessage("account request failed status=500")
        .extracting(ex -> ((AccountDirectoryException) ex).reason())
        .isEqualTo(AccountDirectoryException.Reason.BAD_GATEWAY);
  }

  @Test
  void mapsMissingFieldsToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(CONTACT_URL))
        .andRespond(withSuccess("{\"foo\":\"bar\"}", MediaType.APPLICATION_JSON));

    assertReason(fixture, AccountDirectoryException.Reason.INVALID_RESPONSE);
  }

  @Test
  void mapsTimeoutToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(CONTACT_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertReason(fixture, AccountDirectoryException.Reason.TIMEOUT);
  }

  @Test
  void mapsConnectionFailureToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(CONTACT_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertReason(fixture, AccountDirectoryException.Reason.BAD_GATEWAY);
  }

  private void assertReason(ClientFixture fixture, AccountDirectoryException.Reason reason) {
    assertThatThrownBy(() -> fixture.client.findEmailAddress("user-1"))
        .isInstanceOf(AccountDirectoryException.class)
        .extracting(ex -> ((AccountDirectoryException) ex).reason())
        .isEqualTo(reason);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://account.test").build();
    final AccountClientProperties properties =
        new AccountClientProperties(
            "http://account.test",
            "/users/{userId}/contact",
            "token-x",
            "X-Internal-Token",
            Duration.ofSeconds(1),
            Duration.ofSeconds(1));
    return new ClientFixture(new AccountDirectoryClient(restClient, properties), server);
  }

  private record ClientFixture(AccountDirectoryClient client, MockRestServiceServer server) {}
}
