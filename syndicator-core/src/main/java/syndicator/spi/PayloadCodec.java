package syndicator.spi;

import syndicator.SourceItem;

/**
 * Serializes publish job payloads for durable job stores.
 */
public interface PayloadCodec {

    String encode(SourceItem item);

    SourceItem decode(String payload);
}
