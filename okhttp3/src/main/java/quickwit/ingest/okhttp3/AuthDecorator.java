/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.okhttp3;

import java.util.function.Supplier;
import okhttp3.Credentials;
import okhttp3.Request;

/**
 * Adds credentials to each ingest request, immediately before it is sent. This is invoked once
 * per attempt, including retries, so rotating tokens are picked up naturally.
 *
 * <p>Here's an example that reads a token that is refreshed elsewhere:
 * <pre>{@code
 * client.auth(AuthDecorator.bearer(tokenHolder::current));
 * }</pre>
 */
public interface AuthDecorator {
  /** Leaves requests as they are. */
  AuthDecorator NONE = new AuthDecorator() {
    @Override public void decorate(Request.Builder request) {
    }

    @Override public String toString() {
      return "NoAuth";
    }
  };

  /**
   * Adds or replaces headers on the request. Invoked on the worker thread. A runtime exception
   * thrown here fails the attempt, which is retried like a transport error.
   */
  void decorate(Request.Builder request);

  /**
   * Sets "Authorization: Bearer {token}", reading the token on each attempt. Surrounding
   * whitespace is trimmed, such as the trailing newline of a token file.
   */
  static AuthDecorator bearer(Supplier<String> token) {
    if (token == null) throw new NullPointerException("token == null");
    return request -> {
      String value = token.get();
      if (value == null) throw new IllegalStateException("token supplier returned null");
      request.header("Authorization", "Bearer " + value.trim());
    };
  }

  /** Sets HTTP basic credentials. */
  static AuthDecorator basic(String username, String password) {
    if (username == null) throw new NullPointerException("username == null");
    if (password == null) throw new NullPointerException("password == null");
    String credential = Credentials.basic(username, password);
    return request -> request.header("Authorization", credential);
  }
}
