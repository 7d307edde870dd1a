package ch.so.agi.lspbridge.tools;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.eclipse.lsp4j.jsonrpc.json.MessageJsonHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured answer of a tool call: an ordered list of {@code text} and {@code json} items plus an
 * error flag.
 */
public final class ToolResult {

    private static final Gson PROTOCOL_GSON = new MessageJsonHandler(Collections.emptyMap()).getGson();

    public static final class Item {
        private final String type;
        private final String text;
        private final JsonElement data;

        private Item(String type, String text, JsonElement data) {
            this.type = type;
            this.text = text;
            this.data = data;
        }

        public String getType() {
            return type;
        }

        public String getText() {
            return text;
        }

        public JsonElement getData() {
            return data;
        }
    }

    private final List<Item> content = new ArrayList<>();
    private final boolean error;

    private ToolResult(boolean error) {
        this.error = error;
    }

    public static ToolResult ok() {
        return new ToolResult(false);
    }

    public static ToolResult error(String text) {
        return new ToolResult(true).text(text);
    }

    public ToolResult text(String text) {
        content.add(new Item("text", text, null));
        return this;
    }

    /** Adds {@code data} converted with the protocol adapters, so lsp4j types keep their wire shape. */
    public ToolResult json(Object data) {
        content.add(new Item("json", null, data != null ? PROTOCOL_GSON.toJsonTree(data) : JsonNull.INSTANCE));
        return this;
    }

    public List<Item> getContent() {
        return Collections.unmodifiableList(content);
    }

    public boolean isError() {
        return error;
    }

    /** The first text item, or {@code null}. */
    public String firstText() {
        for (Item item : content) {
            if (item.text != null) return item.text;
        }
        return null;
    }

    public JsonObject toJson() {
        JsonArray items = new JsonArray();
        for (Item item : content) {
            JsonObject o = new JsonObject();
            o.addProperty("type", item.type);
            if (item.text != null) {
                o.addProperty("text", item.text);
            } else {
                o.add("data", item.data);
            }
            items.add(o);
        }
        JsonObject result = new JsonObject();
        result.add("content", items);
        if (error) {
            result.addProperty("isError", true);
        }
        return result;
    }

    @Override public String toString() {
        return toJson().toString();
    }
}
