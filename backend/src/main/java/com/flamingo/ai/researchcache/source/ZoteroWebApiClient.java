package com.flamingo.ai.researchcache.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchcache.config.ResearchCacheProperties;
import com.flamingo.ai.researchcache.exception.SourceConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;

/**
 * {@link SourceApiClient} for the Zotero Web API v3.
 *
 * <p>List endpoints are paged with {@code start}/{@code limit} until {@code Total-Results} is
 * reached. Connection failures, timeouts, rate limiting and server errors surface as {@link
 * SourceConnectionException}; other client errors are failures of the record being fetched.
 */
@Component
@Slf4j
public class ZoteroWebApiClient implements SourceApiClient {

  private static final String TOTAL_RESULTS = "Total-Results";
  private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {};

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final String libraryPrefix;
  private final int pageSize;
  private final Duration timeout;

  @Autowired
  public ZoteroWebApiClient(ResearchCacheProperties properties, ObjectMapper objectMapper) {
    // file downloads redirect to storage
    this(
        properties,
        objectMapper,
        WebClient.builder()
            .clientConnector(
                new ReactorClientHttpConnector(HttpClient.create().followRedirect(true))));
  }

  ZoteroWebApiClient(
      ResearchCacheProperties properties,
      ObjectMapper objectMapper,
      WebClient.Builder webClientBuilder) {
    ResearchCacheProperties.Source source = properties.getSource();
    this.objectMapper = objectMapper;
    this.pageSize = source.getPageSize();
    this.timeout = Duration.ofSeconds(source.getTimeoutSeconds());
    this.libraryPrefix =
        ("group".equalsIgnoreCase(source.getLibraryType()) ? "/groups/" : "/users/")
            + source.getLibraryId();
    int maxBytes = source.getMaxDownloadMb() * 1024 * 1024;
    this.webClient =
        webClientBuilder
            .baseUrl(source.getBaseUrl())
            .defaultHeader("Zotero-API-Version", "3")
            .defaultHeader("Zotero-API-Key", source.getApiKey())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
            .build();
    log.info(
        "Zotero client initialized: baseUrl={}, library={}", source.getBaseUrl(), libraryPrefix);
  }

  @Override
  public RemoteCollection getCollection(String collectionKey) {
    JsonNode node = call("/collections/" + collectionKey, JsonNode.class);
    return toCollection(node);
  }

  @Override
  public List<RemoteCollection> getSubcollections(String collectionKey) {
    return fetchAll("/collections/" + collectionKey + "/collections", this::toCollection);
  }

  @Override
  public List<RemoteItem> getItems(String collectionKey) {
    return fetchAll("/collections/" + collectionKey + "/items/top", this::toItem);
  }

  @Override
  public List<RemoteChild> getChildren(String itemKey) {
    return fetchAll("/items/" + itemKey + "/children", this::toChild);
  }

  @Override
  public byte[] downloadAttachment(String attachmentKey) {
    byte[] bytes = call("/items/" + attachmentKey + "/file", byte[].class);
    return bytes == null ? new byte[0] : bytes;
  }

  // ---- transport ----

  private <T> List<T> fetchAll(String path, Function<JsonNode, T> mapper) {
    List<T> results = new ArrayList<>();
    int start = 0;
    while (true) {
      ResponseEntity<JsonNode> page = callEntity(path, start);
      JsonNode body = page.getBody();
      if (body == null || !body.isArray() || body.isEmpty()) {
        break;
      }
      body.forEach(node -> results.add(mapper.apply(node)));
      start += body.size();
      String total = page.getHeaders().getFirst(TOTAL_RESULTS);
      if (total == null || start >= Integer.parseInt(total.trim())) {
        break;
      }
    }
    log.debug("Fetched {} records from {}", results.size(), path);
    return results;
  }

  private ResponseEntity<JsonNode> callEntity(String path, int start) {
    try {
      return webClient
          .get()
          .uri(
              uri ->
                  uri.path(libraryPrefix + path)
                      .queryParam("start", start)
                      .queryParam("limit", pageSize)
                      .build())
          .retrieve()
          .toEntity(JsonNode.class)
          .timeout(timeout)
          .block();
    } catch (RuntimeException e) {
      throw translate(path, e);
    }
  }

  private <T> T call(String path, Class<T> type) {
    try {
      return webClient
          .get()
          .uri(libraryPrefix + path)
          .retrieve()
          .bodyToMono(type)
          .timeout(timeout)
          .block();
    } catch (RuntimeException e) {
      throw translate(path, e);
    }
  }

  private RuntimeException translate(String path, RuntimeException e) {
    Throwable cause = Exceptions.unwrap(e);
    if (cause instanceof WebClientRequestException || cause instanceof TimeoutException) {
      return new SourceConnectionException("Zotero request " + path + " failed: " + cause, e);
    }
    if (cause instanceof WebClientResponseException response) {
      int status = response.getStatusCode().value();
      if (status == 429 || status >= 500) {
        return new SourceConnectionException(
            "Zotero request " + path + " failed with status " + status, e);
      }
    }
    return e;
  }

  // ---- mapping ----

  private RemoteCollection toCollection(JsonNode node) {
    JsonNode data = node.path("data");
    JsonNode parent = data.path("parentCollection");
    return new RemoteCollection(
        node.path("key").asText(),
        data.path("name").asText(),
        parent.isTextual() ? parent.asText() : null,
        node.path("version").asLong());
  }

  private RemoteItem toItem(JsonNode node) {
    JsonNode data = node.path("data");
    List<String> collections = new ArrayList<>();
    data.path("collections").forEach(key -> collections.add(key.asText()));
    String itemType = data.path("itemType").asText();
    String note = textOrNull(data, "note");
    String title = textOrNull(data, "title");
    if (title == null && note != null) {
      title = NoteTitles.fromHtml(note);
    }
    return new RemoteItem(
        node.path("key").asText(),
        node.path("version").asLong(),
        itemType,
        title,
        textOrNull(data, "date"),
        textOrNull(data, "url"),
        objectMapper.convertValue(data, RECORD),
        collections,
        note);
  }

  private RemoteChild toChild(JsonNode node) {
    JsonNode data = node.path("data");
    String note = textOrNull(data, "note");
    String title = textOrNull(data, "title");
    if (title == null && note != null) {
      title = NoteTitles.fromHtml(note);
    }
    return new RemoteChild(
        node.path("key").asText(),
        data.path("itemType").asText(),
        node.path("version").asLong(),
        title,
        textOrNull(data, "filename"),
        textOrNull(data, "contentType"),
        textOrNull(data, "linkMode"),
        note);
  }

  private static String textOrNull(JsonNode data, String field) {
    JsonNode value = data.get(field);
    return value == null || value.isNull() || value.asText().isEmpty() ? null : value.asText();
  }
}
