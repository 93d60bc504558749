/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.okhttp3;

import java.io.IOException;
import java.util.List;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import okio.BufferedSink;
import okio.GzipSink;
import okio.Okio;
import quickwit.ingest.AsyncIngester;
import quickwit.ingest.BaseHttpSender;
import quickwit.ingest.IngestStatusException;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Sends records to Quickwit, using its <a href="https://quickwit.io/docs/reference/rest-api">ingest
 * API</a>.
 *
 * <h3>Usage</h3>
 * <p>
 * This type is designed for {@link AsyncIngester.Builder#build the async ingester}.
 *
 * <p>Here's a simple configuration:
 *
 * <pre>{@code
 * sender = OkHttpIngestSender.create("http://127.0.0.1:7280/api/v1/logs");
 * }</pre>
 *
 * <p>Here's an example that shares the application's client, and adds a bearer token:
 *
 * <pre>{@code
 * sender = OkHttpIngestSender.newBuilder()
 *   .endpoint("https://quickwit.example.com/api/v1/logs")
 *   .client(applicationClient)
 *   .authDecorator(AuthDecorator.bearer(tokens::current))
 *   .build();
 * }</pre>
 *
 * <h3>Implementation Notes</h3>
 *
 * <p>A batch is acknowledged only by status 200. Other statuses raise
 * {@link IngestStatusException}. The response body is always read fully and closed, so the
 * connection can be reused.
 *
 * <p>This sender is thread-safe.
 */
public final class OkHttpIngestSender extends BaseHttpSender<HttpUrl, RequestBody> {
  /** Creates a sender with a client of its own. */
  public static OkHttpIngestSender create(String endpoint) {
    return newBuilder().endpoint(endpoint).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    final OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder();
    OkHttpClient client;
    String endpoint;
    AuthDecorator authDecorator = AuthDecorator.NONE;
    boolean compressionEnabled;

    Builder() {
    }

    /**
     * No default. The index URL of Quickwit's REST API, usually
     * "http://quickwithost:7280/api/v1/{index}". Records are POSTed to "{endpoint}/ingest".
     */
    public Builder endpoint(String endpoint) {
      if (endpoint == null) throw new NullPointerException("endpoint == null");
      this.endpoint = endpoint;
      return this;
    }

    /**
     * Sends with the given client, which may be shared with other code. The sender will not close
     * it. When unset, the sender creates and owns a client, configured with the timeouts on this
     * builder.
     */
    public Builder client(OkHttpClient client) {
      if (client == null) throw new NullPointerException("client == null");
      this.client = client;
      return this;
    }

    /** Invoked before each attempt. Default {@link AuthDecorator#NONE}. */
    public Builder authDecorator(AuthDecorator authDecorator) {
      if (authDecorator == null) throw new NullPointerException("authDecorator == null");
      this.authDecorator = authDecorator;
      return this;
    }

    /** Default false. true implies that messages will be gzipped before transport. */
    public Builder compressionEnabled(boolean compressionEnabled) {
      this.compressionEnabled = compressionEnabled;
      return this;
    }

    /** Sets the default connect timeout (in milliseconds) for new connections. Default 10000 */
    public Builder connectTimeout(int connectTimeoutMillis) {
      clientBuilder.connectTimeout(connectTimeoutMillis, MILLISECONDS);
      return this;
    }

    /** Sets the default read timeout (in milliseconds) for new connections. Default 10000 */
    public Builder readTimeout(int readTimeoutMillis) {
      clientBuilder.readTimeout(readTimeoutMillis, MILLISECONDS);
      return this;
    }

    /** Sets the default write timeout (in milliseconds) for new connections. Default 10000 */
    public Builder writeTimeout(int writeTimeoutMillis) {
      clientBuilder.writeTimeout(writeTimeoutMillis, MILLISECONDS);
      return this;
    }

    /**
     * @throws IllegalArgumentException if the endpoint isn't an HTTP or HTTPS URL
     */
    public OkHttpIngestSender build() {
      if (endpoint == null) throw new NullPointerException("endpoint == null");
      return new OkHttpIngestSender(this);
    }
  }

  final OkHttpClient client;
  final boolean ownsClient;
  final AuthDecorator authDecorator;
  final boolean compressionEnabled;

  OkHttpIngestSender(Builder builder) {
    super(builder.endpoint);
    ownsClient = builder.client == null;
    client = ownsClient ? builder.clientBuilder.build() : builder.client;
    authDecorator = builder.authDecorator;
    compressionEnabled = builder.compressionEnabled;
  }

  @Override protected HttpUrl newIngestUrl(String ingestUrl) {
    HttpUrl parsed = HttpUrl.parse(ingestUrl);
    if (parsed == null) throw new IllegalArgumentException("invalid POST url: " + ingestUrl);
    return parsed;
  }

  @Override protected RequestBody newBody(List<byte[]> encodedRecords) {
    return new JsonLinesRequestBody(encodedRecords);
  }

  @Override protected void postRecords(HttpUrl ingestUrl, RequestBody body) throws IOException {
    Request request = newRequest(ingestUrl, body);
    Call call = client.newCall(request);
    parseResponse(call.execute());
  }

  Request newRequest(HttpUrl ingestUrl, RequestBody body) throws IOException {
    Request.Builder request = new Request.Builder().url(ingestUrl);
    if (compressionEnabled) {
      request.addHeader("Content-Encoding", "gzip");
      Buffer gzipped = new Buffer();
      BufferedSink gzipSink = Okio.buffer(new GzipSink(gzipped));
      body.writeTo(gzipSink);
      gzipSink.close();
      body = new BufferRequestBody(body.contentType(), gzipped);
    }
    request.post(body);
    try {
      authDecorator.decorate(request); // each attempt, so that rotated credentials apply
    } catch (RuntimeException e) {
      // ex. an invalid header value. A later rotation may fix it, so this is retriable.
      throw new IOException("cannot decorate request with " + authDecorator, e);
    }
    return request.build();
  }

  static final class BufferRequestBody extends RequestBody {
    final MediaType contentType;
    final Buffer body;

    BufferRequestBody(MediaType contentType, Buffer body) {
      this.contentType = contentType;
      this.body = body;
    }

    @Override public long contentLength() {
      return body.size();
    }

    @Override public MediaType contentType() {
      return contentType;
    }

    @Override public void writeTo(BufferedSink sink) throws IOException {
      sink.write(body.clone(), body.size()); // clone, as OkHttp may write the body again on retry
    }
  }

  /** Reads the whole response, so that the connection can be reused, then checks the status. */
  static void parseResponse(Response response) throws IOException {
    try {
      ResponseBody responseBody = response.body();
      String content = responseBody != null ? responseBody.string() : "";
      if (response.code() != HTTP_OK) {
        throw new IngestStatusException(response.code(),
          "ingest status " + response.code() + " " + response.message() + ": " + content);
      }
    } finally {
      response.close();
    }
  }

  /** Releases the client's threads and connections, unless it was supplied by the caller. */
  @Override protected void doClose() {
    if (!ownsClient) return;
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }

  /** The client, which is the transport requests execute on. */
  public OkHttpClient client() {
    return client;
  }
}
