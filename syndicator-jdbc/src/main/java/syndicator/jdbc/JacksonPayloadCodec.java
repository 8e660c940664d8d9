package syndicator.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import syndicator.MediaAsset;
import syndicator.QuoteRef;
import syndicator.ReplyRef;
import syndicator.SourceItem;
import syndicator.spi.PayloadCodec;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link PayloadCodec} storing source items as JSON. Media bytes are written as base64.
 */
public final class JacksonPayloadCodec implements PayloadCodec {
  private final ObjectMapper mapper;

  public JacksonPayloadCodec() {
    this(JsonSupport.newObjectMapper());
  }

  public JacksonPayloadCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public String encode(SourceItem item) {
    try {
      return mapper.writeValueAsString(StoredItem.of(item));
    } catch (JsonProcessingException e) {
      throw new StoreException("Failed to encode payload of " + item.id(), e);
    }
  }

  @Override
  public SourceItem decode(String payload) {
    try {
      return mapper.readValue(payload, StoredItem.class).toItem();
    } catch (JsonProcessingException e) {
      throw new StoreException("Failed to decode payload", e);
    }
  }

  record StoredItem(
      String id,
      String contentCid,
      Instant createdAt,
      String text,
      List<MediaAsset> media,
      List<String> links,
      ReplyRef reply,
      QuoteRef quote) {

    static StoredItem of(SourceItem item) {
      return new StoredItem(item.id(), item.contentCid(), item.createdAt(), item.text(),
          item.media(), item.links(), item.reply(), item.quote());
    }

    SourceItem toItem() {
      return SourceItem.builder(id)
          .contentCid(contentCid)
          .createdAt(createdAt)
          .text(text)
          .media(media)
          .links(links)
          .reply(reply)
          .quote(quote)
          .build();
    }
  }
}
