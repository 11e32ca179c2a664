package io.chainindex.core.codec;

import java.util.Map;

/**
 * How a coin lays out and hashes its block headers. Implementations are stateless and are
 * composed into a {@link StandardCodec}.
 */
public interface HeaderFormat {

    /** Size of the fixed portion of a header. For static formats this is the whole header. */
    int basicSize();

    /** True when every header is exactly {@link #basicSize()} bytes. */
    boolean isStatic();

    /** Length of the header at the start of {@code rawBlock}. */
    int headerLength(byte[] rawBlock);

    byte[] headerHash(byte[] header);

    /** The JSON-ready representation served to clients. */
    Map<String, Object> electrumHeader(byte[] header, int height);
}
