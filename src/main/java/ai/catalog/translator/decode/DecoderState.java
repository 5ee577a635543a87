package ai.catalog.translator.decode;

/**
 * Scanner states of {@link StreamingResponseDecoder}.
 */
public enum DecoderState {
    /** Outside any recognized tag. */
    SCANNING,
    /** Inside a reasoning block; text is forwarded verbatim and never parsed as items. */
    IN_REASONING_BLOCK,
    /** Between an item's open and close markers. */
    IN_ITEM,
    /** The buffer ends with a partial marker; waiting for the next chunk. */
    AWAITING_CLOSE
}
