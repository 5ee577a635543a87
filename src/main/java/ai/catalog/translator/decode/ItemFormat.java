package ai.catalog.translator.decode;

import java.util.Map;

/**
 * Renders entries in the item format understood by {@link StreamingResponseDecoder}.
 */
public final class ItemFormat {

    private ItemFormat() {
    }

    public static String render(Map<String, String> entries) {
        StringBuilder builder = new StringBuilder();
        entries.forEach((key, value) -> builder.append(renderItem(key, value)).append('\n'));
        return builder.toString();
    }

    public static String renderItem(String key, String value) {
        return "<item><key>" + escape(key) + "</key><trx>" + quote(value) + "</trx></item>";
    }

    static String quote(String value) {
        return "<![CDATA[" + value.replace("]]>", "]]]]><![CDATA[>") + "]]>";
    }

    private static String escape(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
