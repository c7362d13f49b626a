package com.onthegomap.terrainpack.fetch;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.Test;

class OverpassClientTest {

  private static final String BODY = "{\"elements\":[]}";
  private static final HttpRequest REQUEST = HttpRequest.newBuilder(URI.create("https://example.com/api")).build();

  private final HttpClient httpClient = mock(HttpClient.class);
  @SuppressWarnings("unchecked")
  private final HttpResponse<InputStream> response = mock(HttpResponse.class);

  private void respond(int status, Map<String, List<String>> headers, byte[] body) throws Exception {
    when(response.statusCode()).thenReturn(status);
    when(response.headers()).thenReturn(HttpHeaders.of(headers, (name, value) -> true));
    when(response.body()).thenReturn(new ByteArrayInputStream(body));
    when(httpClient.<InputStream>send(any(), any())).thenReturn(response);
  }

  private static String read(InputStream is) throws IOException {
    try (is) {
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  @Test
  void testGzipBodyDecoded() throws Exception {
    var compressed = new ByteArrayOutputStream();
    try (var gzip = new GZIPOutputStream(compressed)) {
      gzip.write(BODY.getBytes(StandardCharsets.UTF_8));
    }
    respond(200, Map.of("Content-Encoding", List.of("gzip")), compressed.toByteArray());
    assertEquals(BODY, read(OverpassClient.wrap(httpClient).send(REQUEST)));
  }

  @Test
  void testUncompressedBodyPassedThrough() throws Exception {
    respond(200, Map.of(), BODY.getBytes(StandardCharsets.UTF_8));
    assertEquals(BODY, read(OverpassClient.wrap(httpClient).send(REQUEST)));
  }

  @Test
  void testErrorStatusIncludesBody() throws Exception {
    respond(429, Map.of(), "slow down".getBytes(StandardCharsets.UTF_8));
    var e = assertThrows(IOException.class, () -> OverpassClient.wrap(httpClient).send(REQUEST));
    assertTrue(e.getMessage().contains("Rate limited"), e.getMessage());
    assertTrue(e.getMessage().endsWith(": slow down"), e.getMessage());
  }
}
