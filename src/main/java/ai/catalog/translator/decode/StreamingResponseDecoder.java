package ai.catalog.translator.decode;

import ai.catalog.translator.model.LocalizedItem;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incremental tokenizer for the item format returned by translation backends:
 *
 * <pre>
 * &lt;thinking&gt;optional reasoning&lt;/thinking&gt;
 * &lt;item&gt;
 *   &lt;key&gt;welcome.title&lt;/key&gt;
 *   &lt;trx&gt;&lt;![CDATA[Bienvenue]]&gt;&lt;/trx&gt;
 *   &lt;comment&gt;&lt;![CDATA[optional note]]&gt;&lt;/comment&gt;
 * &lt;/item&gt;
 * </pre>
 *
 * <p>Chunks may be split anywhere, including inside markers. Items are emitted once, in document
 * order, as soon as their closing marker has been consumed. Text inside a CDATA section is never
 * scanned for markers until the section's terminator arrives.
 *
 * <p>Instances are not thread-safe; each backend stream owns its own decoder.
 */
public final class StreamingResponseDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingResponseDecoder.class);

    private static final String ITEM_OPEN = "<item>";
    private static final String ITEM_CLOSE = "</item>";
    private static final String REASONING_OPEN = "<thinking>";
    private static final String REASONING_CLOSE = "</thinking>";
    private static final String QUOTE_OPEN = "<![CDATA[";
    private static final String QUOTE_CLOSE = "]]>";
    private static final String FIELD_KEY = "key";
    private static final String FIELD_TEXT = "trx";
    private static final String FIELD_COMMENT = "comment";
    private static final List<String> FIELDS = List.of(FIELD_KEY, FIELD_TEXT, FIELD_COMMENT);
    private static final List<String> SCANNING_MARKERS = List.of(ITEM_OPEN, REASONING_OPEN);
    private static final List<String> ITEM_MARKERS = itemMarkers();

    private final DecoderListener listener;
    private final StringBuilder buffer = new StringBuilder();
    private final Set<String> seenKeys = new HashSet<>();
    private final List<LocalizedItem> items = new ArrayList<>();
    private DecoderState state = DecoderState.SCANNING;
    private DecoderState resumeState = DecoderState.SCANNING;
    private ItemBuilder current;

    public StreamingResponseDecoder(DecoderListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Consumes the next chunk of backend output.
     */
    public void feed(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        buffer.append(chunk);
        if (state == DecoderState.AWAITING_CLOSE) {
            state = resumeState;
        }
        drain();
    }

    /**
     * Re-parses the complete response text and emits only the items whose keys were not seen
     * while streaming. Safe to call after streaming finished or instead of streaming.
     *
     * @return every item emitted by this decoder, in emission order
     */
    public List<LocalizedItem> finish(String fullText) {
        if (fullText != null && !fullText.isEmpty()) {
            StreamingResponseDecoder replay = new StreamingResponseDecoder(this::accept);
            replay.feed(fullText);
        }
        return List.copyOf(items);
    }

    public List<LocalizedItem> items() {
        return List.copyOf(items);
    }

    public DecoderState state() {
        return state;
    }

    private void drain() {
        boolean progressed = true;
        while (progressed) {
            progressed = switch (state) {
                case SCANNING -> scan();
                case IN_REASONING_BLOCK -> readReasoning();
                case IN_ITEM -> readItem();
                case AWAITING_CLOSE -> false;
            };
        }
    }

    private boolean scan() {
        int open = buffer.indexOf("<");
        if (open < 0) {
            buffer.setLength(0);
            return false;
        }
        consume(open);
        if (startsWith(ITEM_OPEN)) {
            consume(ITEM_OPEN.length());
            current = new ItemBuilder();
            state = DecoderState.IN_ITEM;
            return true;
        }
        if (startsWith(REASONING_OPEN)) {
            consume(REASONING_OPEN.length());
            state = DecoderState.IN_REASONING_BLOCK;
            listener.onReasoningStart();
            return true;
        }
        if (isPartialMarker(SCANNING_MARKERS)) {
            awaitMore(DecoderState.SCANNING);
            return false;
        }
        consume(1);
        return true;
    }

    private boolean readReasoning() {
        int close = buffer.indexOf(REASONING_CLOSE);
        if (close >= 0) {
            forwardReasoning(buffer.substring(0, close));
            consume(close + REASONING_CLOSE.length());
            listener.onReasoningEnd();
            state = DecoderState.SCANNING;
            return true;
        }
        int keep = partialSuffixLength(REASONING_CLOSE);
        String ready = buffer.substring(0, buffer.length() - keep);
        forwardReasoning(ready);
        consume(ready.length());
        if (keep > 0) {
            awaitMore(DecoderState.IN_REASONING_BLOCK);
        }
        return false;
    }

    private boolean readItem() {
        if (current.inQuotedSpan) {
            int close = buffer.indexOf(QUOTE_CLOSE);
            if (close >= 0) {
                current.appendQuoted(buffer.substring(0, close));
                consume(close + QUOTE_CLOSE.length());
                current.inQuotedSpan = false;
                return true;
            }
            int keep = partialSuffixLength(QUOTE_CLOSE);
            current.appendQuoted(buffer.substring(0, buffer.length() - keep));
            consume(buffer.length() - keep);
            if (keep > 0) {
                awaitMore(DecoderState.IN_ITEM);
            }
            return false;
        }

        int open = buffer.indexOf("<");
        if (open < 0) {
            current.appendPlain(buffer.toString());
            buffer.setLength(0);
            return false;
        }
        current.appendPlain(buffer.substring(0, open));
        consume(open);

        if (startsWith(QUOTE_OPEN)) {
            consume(QUOTE_OPEN.length());
            current.openQuote();
            return true;
        }
        if (startsWith(ITEM_CLOSE)) {
            consume(ITEM_CLOSE.length());
            completeItem();
            state = DecoderState.SCANNING;
            return true;
        }
        for (String field : FIELDS) {
            String fieldOpen = "<" + field + ">";
            String fieldClose = "</" + field + ">";
            if (startsWith(fieldOpen)) {
                consume(fieldOpen.length());
                current.openField(field);
                return true;
            }
            if (startsWith(fieldClose)) {
                consume(fieldClose.length());
                current.closeField();
                return true;
            }
        }
        if (isPartialMarker(ITEM_MARKERS)) {
            awaitMore(DecoderState.IN_ITEM);
            return false;
        }
        current.appendPlain("<");
        consume(1);
        return true;
    }

    private void completeItem() {
        current.closeField();
        String key = current.value(FIELD_KEY).strip();
        String text = current.value(FIELD_TEXT);
        Optional<String> comment = Optional.of(current.value(FIELD_COMMENT).strip());
        current = null;
        if (key.isEmpty()) {
            LOGGER.debug("Ignoring item without key");
            return;
        }
        accept(new LocalizedItem(key, text, comment));
    }

    private void accept(LocalizedItem item) {
        if (!seenKeys.add(item.key())) {
            LOGGER.debug("Ignoring duplicate item for key {}", item.key());
            return;
        }
        items.add(item);
        listener.onItem(item);
    }

    private void forwardReasoning(String text) {
        if (!text.isEmpty()) {
            listener.onReasoningDelta(text);
        }
    }

    private void awaitMore(DecoderState resume) {
        resumeState = resume;
        state = DecoderState.AWAITING_CLOSE;
    }

    private void consume(int length) {
        buffer.delete(0, length);
    }

    private boolean startsWith(String marker) {
        return buffer.length() >= marker.length() && buffer.substring(0, marker.length()).equals(marker);
    }

    /**
     * True when the whole buffer is a proper prefix of one of the markers.
     */
    private boolean isPartialMarker(List<String> markers) {
        String pending = buffer.toString();
        for (String marker : markers) {
            if (pending.length() < marker.length() && marker.startsWith(pending)) {
                return true;
            }
        }
        return false;
    }

    private int partialSuffixLength(String marker) {
        int max = Math.min(marker.length() - 1, buffer.length());
        for (int length = max; length > 0; length--) {
            if (buffer.substring(buffer.length() - length).equals(marker.substring(0, length))) {
                return length;
            }
        }
        return 0;
    }

    private static List<String> itemMarkers() {
        List<String> markers = new ArrayList<>(List.of(QUOTE_OPEN, ITEM_CLOSE));
        for (String field : FIELDS) {
            markers.add("<" + field + ">");
            markers.add("</" + field + ">");
        }
        return List.copyOf(markers);
    }

    static String decodeEntities(String raw) {
        if (raw.indexOf('&') < 0) {
            return raw;
        }
        StringBuilder decoded = new StringBuilder(raw.length());
        int index = 0;
        while (index < raw.length()) {
            char ch = raw.charAt(index);
            int end = ch == '&' ? raw.indexOf(';', index) : -1;
            if (end > index && end - index <= 10) {
                String entity = raw.substring(index + 1, end);
                String replacement = resolveEntity(entity);
                if (replacement != null) {
                    decoded.append(replacement);
                    index = end + 1;
                    continue;
                }
            }
            decoded.append(ch);
            index++;
        }
        return decoded.toString();
    }

    private static String resolveEntity(String entity) {
        switch (entity) {
            case "lt":
                return "<";
            case "gt":
                return ">";
            case "amp":
                return "&";
            case "quot":
                return "\"";
            case "apos":
                return "'";
            default:
                break;
        }
        try {
            if (entity.startsWith("#x") || entity.startsWith("#X")) {
                return new String(Character.toChars(Integer.parseInt(entity.substring(2), 16)));
            }
            if (entity.startsWith("#")) {
                return new String(Character.toChars(Integer.parseInt(entity.substring(1))));
            }
        } catch (IllegalArgumentException ex) {
            LOGGER.debug("Leaving malformed entity &{}; as is", entity);
        }
        return null;
    }

    /**
     * Accumulates the sub-fields of the item being read. Plain text runs are entity-decoded when
     * they end; quoted runs are kept verbatim.
     */
    private static final class ItemBuilder {

        private final Map<String, StringBuilder> values = new HashMap<>();
        private final StringBuilder plainRun = new StringBuilder();
        private String field;
        private boolean inQuotedSpan;

        void openField(String name) {
            closeField();
            field = name;
            values.put(name, new StringBuilder());
        }

        void closeField() {
            flushPlain(true);
            field = null;
        }

        void openQuote() {
            flushPlain(false);
            inQuotedSpan = true;
        }

        void appendPlain(String text) {
            if (field != null) {
                plainRun.append(text);
            }
        }

        void appendQuoted(String text) {
            if (field != null) {
                values.get(field).append(text);
            }
        }

        String value(String name) {
            StringBuilder value = values.get(name);
            return value == null ? "" : value.toString();
        }

        private void flushPlain(boolean closing) {
            if (field == null) {
                plainRun.setLength(0);
                return;
            }
            StringBuilder value = values.get(field);
            String decoded = decodeEntities(plainRun.toString());
            plainRun.setLength(0);
            if (value.length() == 0) {
                decoded = decoded.stripLeading();
            }
            if (closing) {
                decoded = decoded.stripTrailing();
            }
            value.append(decoded);
        }
    }
}
