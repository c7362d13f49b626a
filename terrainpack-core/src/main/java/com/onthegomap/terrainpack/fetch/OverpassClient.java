package com.onthegomap.terrainpack.fetch;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import org.apache.commons.lang3.StringUtils;

/**
 * Sends one request to the map-feature query service and returns the response body.
 * <p>
 * Abstracted from {@link HttpClient} so tests can substitute canned responses.
 */
@FunctionalInterface
public interface OverpassClient {

  /** Returns a client that sends requests through {@code client}, decoding gzip-compressed responses. */
  static OverpassClient wrap(HttpClient client) {
    return req -> {
      var response = client.send(req, BodyHandlers.ofInputStream());
      int status = response.statusCode();
      if (status >= 400) {
        String body;
        try (var is = response.body()) {
          body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
          body = "Error reading body: " + e;
        }
        throw new IOException(describeStatus(status) + ": " + StringUtils.abbreviate(body.strip(), 500));
      }
      String encoding = response.headers().firstValue("Content-Encoding").orElse("");
      InputStream is = response.body();
      // requests only advertise gzip
      return "gzip".equalsIgnoreCase(encoding) ? new GZIPInputStream(is) : is;
    };
  }

  /** Returns a human-readable explanation of an HTTP error status from the query service. */
  static String describeStatus(int status) {
    if (status == 429) {
      return "Rate limited by query service (HTTP 429), too many requests";
    } else if (status == 504) {
      return "Query service timed out (HTTP 504)";
    } else if (status >= 500) {
      return "Query service error (HTTP " + status + ")";
    }
    return "Query rejected (HTTP " + status + ")";
  }

  /**
   * Sends {@code req} and returns the response body, which the caller must close.
   *
   * @throws IOException if the request fails or the service responds with an error status
   */
  InputStream send(HttpRequest req) throws IOException, InterruptedException;
}
