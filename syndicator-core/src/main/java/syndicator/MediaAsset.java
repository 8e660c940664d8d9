package syndicator;

import java.util.Arrays;
import java.util.Objects;

/**
 * A media attachment carried by a {@link SourceItem}. The bytes are already fetched by the
 * feed; publishers upload them in whatever form their target requires.
 *
 * @param type     image or video
 * @param mimeType MIME type reported by the source, e.g. {@code image/jpeg}
 * @param data     raw media bytes
 * @param altText  accessibility description, may be {@code null}
 * @param filename original file name, may be {@code null}
 */
public record MediaAsset(MediaType type, String mimeType, byte[] data, String altText, String filename) {

    public MediaAsset {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(mimeType, "mimeType");
        Objects.requireNonNull(data, "data");
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MediaAsset other)) return false;
        return type == other.type
                && mimeType.equals(other.mimeType)
                && Arrays.equals(data, other.data)
                && Objects.equals(altText, other.altText)
                && Objects.equals(filename, other.filename);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type, mimeType, altText, filename);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "MediaAsset{type=" + type + ", mimeType=" + mimeType + ", size=" + data.length + "}";
    }
}
