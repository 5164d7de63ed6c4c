package com.flamingo.ai.researchcache.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchcache.config.ResearchCacheProperties;
import com.flamingo.ai.researchcache.exception.SourceConnectionException;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

@DisplayName("ZoteroWebApiClient Tests")
class ZoteroWebApiClientTest {

  private ResearchCacheProperties properties;
  private final List<ClientRequest> requests = new ArrayList<>();

  @BeforeEach
  void setUp() {
    properties = new ResearchCacheProperties();
    ResearchCacheProperties.Source source = properties.getSource();
    source.setBaseUrl("https://zotero.test");
    source.setLibraryType("user");
    source.setLibraryId("4242");
    source.setApiKey("secret");
    source.setPageSize(2);
    source.setTimeoutSeconds(1);
  }

  private ZoteroWebApiClient clientAnswering(Function<ClientRequest, Mono<ClientResponse>> answer) {
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  requests.add(request);
                  return answer.apply(request);
                });
    return new ZoteroWebApiClient(properties, new ObjectMapper(), builder);
  }

  private static Mono<ClientResponse> json(String body) {
    return Mono.just(
        ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
  }

  private static Mono<ClientResponse> page(String body, int totalResults) {
    return Mono.just(
        ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .header("Total-Results", String.valueOf(totalResults))
            .body(body)
            .build());
  }

  private static Mono<ClientResponse> status(HttpStatus status) {
    return Mono.just(ClientResponse.create(status).build());
  }

  private static String startOf(ClientRequest request) {
    return UriComponentsBuilder.fromUri(request.url()).build().getQueryParams().getFirst("start");
  }

  @Nested
  @DisplayName("Requests and mapping")
  class Mapping {

    @Test
    @DisplayName("Should address the library and send the API headers")
    void shouldSendLibraryPathAndHeaders() {
      ZoteroWebApiClient client =
          clientAnswering(
              request ->
                  json(
                      "{\"key\":\"COLL0001\",\"version\":7,"
                          + "\"data\":{\"name\":\"Thesis\",\"parentCollection\":\"PARENT01\"}}"));

      RemoteCollection collection = client.getCollection("COLL0001");

      assertThat(collection).isEqualTo(new RemoteCollection("COLL0001", "Thesis", "PARENT01", 7));
      ClientRequest request = requests.get(0);
      assertThat(request.url().getPath()).isEqualTo("/users/4242/collections/COLL0001");
      assertThat(request.headers().getFirst("Zotero-API-Key")).isEqualTo("secret");
      assertThat(request.headers().getFirst("Zotero-API-Version")).isEqualTo("3");
    }

    @Test
    @DisplayName("Should map a top-level collection without parent to null")
    void shouldMapMissingParentToNull() {
      ZoteroWebApiClient client =
          clientAnswering(
              request ->
                  json(
                      "{\"key\":\"COLL0001\",\"version\":7,"
                          + "\"data\":{\"name\":\"Thesis\",\"parentCollection\":false}}"));

      assertThat(client.getCollection("COLL0001").parentKey()).isNull();
    }

    @Test
    @DisplayName("Should use group paths for group libraries")
    void shouldUseGroupPath() {
      properties.getSource().setLibraryType("group");
      ZoteroWebApiClient client = clientAnswering(request -> page("[]", 0));

      client.getItems("COLL0001");

      assertThat(requests.get(0).url().getPath())
          .isEqualTo("/groups/4242/collections/COLL0001/items/top");
    }

    @Test
    @DisplayName("Should map items and derive note titles from the note body")
    void shouldMapItemsAndNoteTitles() {
      String body =
          "[{\"key\":\"ITEM0001\",\"version\":12,\"data\":{\"itemType\":\"journalArticle\","
              + "\"title\":\"Sampling frames\",\"date\":\"2021\",\"url\":\"\","
              + "\"collections\":[\"COLL0001\",\"COLL0002\"]}},"
              + "{\"key\":\"NOTE0001\",\"version\":13,\"data\":{\"itemType\":\"note\","
              + "\"note\":\"<h1>Reading list</h1><p>body</p>\",\"collections\":[\"COLL0001\"]}}]";
      ZoteroWebApiClient client = clientAnswering(request -> page(body, 2));

      List<RemoteItem> items = client.getItems("COLL0001");

      assertThat(items).hasSize(2);
      RemoteItem article = items.get(0);
      assertThat(article.title()).isEqualTo("Sampling frames");
      assertThat(article.date()).isEqualTo("2021");
      assertThat(article.url()).isNull();
      assertThat(article.collections()).containsExactly("COLL0001", "COLL0002");
      assertThat(article.metadata()).containsEntry("itemType", "journalArticle");
      RemoteItem note = items.get(1);
      assertThat(note.isNote()).isTrue();
      assertThat(note.title()).isEqualTo("Reading list");
    }

    @Test
    @DisplayName("Should map attachment and note children")
    void shouldMapChildren() {
      String body =
          "[{\"key\":\"ATT00001\",\"version\":4,\"data\":{\"itemType\":\"attachment\","
              + "\"title\":\"Full Text PDF\",\"filename\":\"paper.pdf\","
              + "\"contentType\":\"application/pdf\",\"linkMode\":\"imported_url\"}},"
              + "{\"key\":\"NOTE0002\",\"version\":5,\"data\":{\"itemType\":\"note\","
              + "\"note\":\"<p>check &amp; compare</p>\"}}]";
      ZoteroWebApiClient client = clientAnswering(request -> page(body, 2));

      List<RemoteChild> children = client.getChildren("ITEM0001");

      assertThat(children.get(0).hasDownloadableFile()).isTrue();
      assertThat(children.get(0).filename()).isEqualTo("paper.pdf");
      assertThat(children.get(1).isNote()).isTrue();
      assertThat(children.get(1).title()).isEqualTo("check & compare");
      assertThat(requests.get(0).url().getPath()).isEqualTo("/users/4242/items/ITEM0001/children");
    }

    @Test
    @DisplayName("Should download attachment bytes")
    void shouldDownloadBytes() {
      byte[] pdf = "%PDF-1.7".getBytes(StandardCharsets.US_ASCII);
      ZoteroWebApiClient client =
          clientAnswering(
              request ->
                  Mono.just(
                      ClientResponse.create(HttpStatus.OK)
                          .header(
                              HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_OCTET_STREAM_VALUE)
                          .body(new String(pdf, StandardCharsets.US_ASCII))
                          .build()));

      assertThat(client.downloadAttachment("ATT00001")).isEqualTo(pdf);
      assertThat(requests.get(0).url().getPath()).isEqualTo("/users/4242/items/ATT00001/file");
    }
  }

  @Nested
  @DisplayName("Paging")
  class Paging {

    @Test
    @DisplayName("Should page with start and limit until Total-Results is reached")
    void shouldStopAtTotalResults() {
      ZoteroWebApiClient client =
          clientAnswering(
              request ->
                  "0".equals(startOf(request))
                      ? page(
                          "[{\"key\":\"S1\",\"version\":1,\"data\":{\"name\":\"A\"}},"
                              + "{\"key\":\"S2\",\"version\":1,\"data\":{\"name\":\"B\"}}]",
                          3)
                      : page("[{\"key\":\"S3\",\"version\":1,\"data\":{\"name\":\"C\"}}]", 3));

      List<RemoteCollection> subcollections = client.getSubcollections("COLL0001");

      assertThat(subcollections)
          .extracting(RemoteCollection::key)
          .containsExactly("S1", "S2", "S3");
      assertThat(requests).extracting(ZoteroWebApiClientTest::startOf).containsExactly("0", "2");
      assertThat(
              UriComponentsBuilder.fromUri(requests.get(0).url())
                  .build()
                  .getQueryParams()
                  .getFirst("limit"))
          .isEqualTo("2");
    }

    @Test
    @DisplayName("Should stop at an empty page")
    void shouldStopAtEmptyPage() {
      ZoteroWebApiClient client = clientAnswering(request -> page("[]", 10));

      assertThat(client.getItems("COLL0001")).isEmpty();
      assertThat(requests).hasSize(1);
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should report an unreachable server as a connection failure")
    void shouldTranslateTransportFailure() {
      ZoteroWebApiClient client =
          clientAnswering(
              request ->
                  Mono.error(
                      new WebClientRequestException(
                          new ConnectException("Connection refused"),
                          HttpMethod.GET,
                          URI.create("https://zotero.test/users/4242/collections/X"),
                          HttpHeaders.EMPTY)));

      assertThatThrownBy(() -> client.getCollection("X"))
          .isInstanceOf(SourceConnectionException.class)
          .hasMessageContaining("/collections/X");
    }

    @Test
    @DisplayName("Should report a timeout as a connection failure")
    void shouldTranslateTimeout() {
      ZoteroWebApiClient client = clientAnswering(request -> Mono.never());

      assertThatThrownBy(() -> client.getItems("COLL0001"))
          .isInstanceOf(SourceConnectionException.class);
    }

    @Test
    @DisplayName("Should report rate limiting and server errors as connection failures")
    void shouldTranslateRateLimitAndServerErrors() {
      ZoteroWebApiClient rateLimited =
          clientAnswering(request -> status(HttpStatus.TOO_MANY_REQUESTS));
      assertThatThrownBy(() -> rateLimited.getChildren("ITEM0001"))
          .isInstanceOf(SourceConnectionException.class)
          .hasMessageContaining("429");

      ZoteroWebApiClient failing = clientAnswering(request -> status(HttpStatus.BAD_GATEWAY));
      assertThatThrownBy(() -> failing.downloadAttachment("ATT00001"))
          .isInstanceOf(SourceConnectionException.class)
          .hasMessageContaining("502");
    }

    @Test
    @DisplayName("Should fail only the record for other client errors")
    void shouldKeepClientErrorsAsRecordFailures() {
      ZoteroWebApiClient client = clientAnswering(request -> status(HttpStatus.NOT_FOUND));

      assertThatThrownBy(() -> client.downloadAttachment("GONE0001"))
          .isInstanceOf(WebClientResponseException.NotFound.class)
          .isNotInstanceOf(SourceConnectionException.class);
    }
  }
}
