package com.mimecast.listrunner.queue;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Queued message metadata.
 *
 * <p>String keyed mapping stored next to the payload as a JSON object.
 * <p>Backed by a Gson {@link JsonObject} so that a dequeue returns exactly what was enqueued.
 * <p>Instances are mutable and not thread safe, each pipeline run works on its own copy.
 */
public class MessageMetadata {

    // Routing.
    public static final String LISTNAME = "listname";
    public static final String PIPELINE = "pipeline";
    public static final String ENVSENDER = "envsender";
    public static final String RECEIVED_TIME = "received_time";
    public static final String WHICHQ = "whichq";

    // Role flags.
    public static final String TO_LIST = "to_list";
    public static final String TO_OWNER = "to_owner";
    public static final String TO_REQUEST = "to_request";
    public static final String TO_JOIN = "to_join";
    public static final String TO_LEAVE = "to_leave";
    public static final String TO_BOUNCE = "to_bounce";

    // Runner bookkeeping.
    public static final String PIPELINE_POSITION = "pipeline_position";
    public static final String FAILURES = "failures";
    public static final String LAST_ERROR = "last_error";
    public static final String SHUNT_REASON = "shunt_reason";
    public static final String SHUNTED_TIME = "shunted_time";

    // Moderation.
    public static final String APPROVED = "approved";
    public static final String HOLD_REASONS = "hold_reasons";

    // Delivery.
    public static final String RECIPS = "recips";
    public static final String VERP = "verp";
    public static final String NODECORATE = "nodecorate";
    public static final String ADD_HEADERS = "add_headers";
    public static final String STRIP_HEADERS = "strip_headers";
    public static final String SUBJECT_PREFIX = "subject_prefix";
    public static final String MSG_HEADER = "msg_header";
    public static final String MSG_FOOTER = "msg_footer";

    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    private final JsonObject json;

    /**
     * Constructs a new empty MessageMetadata instance.
     */
    public MessageMetadata() {
        this(new JsonObject());
    }

    /**
     * Constructs a new MessageMetadata instance wrapping given object.
     *
     * @param json JsonObject instance.
     */
    private MessageMetadata(JsonObject json) {
        this.json = json;
    }

    /**
     * Parses serialized metadata.
     *
     * @param text JSON text.
     * @return MessageMetadata instance.
     * @throws QueueException Text is not a JSON object.
     */
    public static MessageMetadata fromJson(String text) throws QueueException {
        try {
            JsonElement element = JsonParser.parseString(text);
            if (!element.isJsonObject()) {
                throw new QueueException("Metadata is not a JSON object");
            }
            return new MessageMetadata(element.getAsJsonObject());
        } catch (JsonParseException | IllegalStateException e) {
            throw new QueueException("Unreadable metadata: " + e.getMessage(), e);
        }
    }

    /**
     * Serializes metadata.
     *
     * @return JSON text.
     */
    public String toJson() {
        return gson.toJson(json);
    }

    /**
     * Deep copy.
     *
     * @return MessageMetadata instance.
     */
    public MessageMetadata copy() {
        return new MessageMetadata(json.deepCopy());
    }

    public boolean has(String key) {
        return json.has(key) && !json.get(key).isJsonNull();
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(json.keySet());
    }

    public MessageMetadata remove(String key) {
        json.remove(key);
        return this;
    }

    /**
     * Gets string value.
     *
     * @param key Key.
     * @return String or null.
     */
    public String getString(String key) {
        return getString(key, null);
    }

    /**
     * Gets string value with default.
     *
     * @param key          Key.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getString(String key, String defaultValue) {
        if (!has(key)) {
            return defaultValue;
        }
        JsonElement element = json.get(key);
        return element.isJsonPrimitive() ? element.getAsString() : element.toString();
    }

    public MessageMetadata setString(String key, String value) {
        if (value == null) {
            json.remove(key);
        } else {
            json.addProperty(key, value);
        }
        return this;
    }

    /**
     * Gets long value with default.
     *
     * @param key          Key.
     * @param defaultValue Default value.
     * @return Long.
     */
    public long getLong(String key, long defaultValue) {
        if (!has(key)) {
            return defaultValue;
        }
        try {
            return json.get(key).getAsLong();
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
            return defaultValue;
        }
    }

    public MessageMetadata setLong(String key, long value) {
        json.addProperty(key, value);
        return this;
    }

    public int getInt(String key, int defaultValue) {
        return Math.toIntExact(getLong(key, defaultValue));
    }

    public MessageMetadata setInt(String key, int value) {
        json.addProperty(key, value);
        return this;
    }

    /**
     * Gets boolean flag.
     * <p>Missing keys read as false.
     *
     * @param key Key.
     * @return Boolean.
     */
    public boolean getBoolean(String key) {
        if (!has(key)) {
            return false;
        }
        JsonElement element = json.get(key);
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                return primitive.getAsBoolean();
            }
            if (primitive.isNumber()) {
                return primitive.getAsInt() != 0;
            }
            return Boolean.parseBoolean(primitive.getAsString());
        }
        return false;
    }

    public MessageMetadata setBoolean(String key, boolean value) {
        json.addProperty(key, value);
        return this;
    }

    /**
     * Gets string list.
     * <p>A scalar value reads as a single element list.
     *
     * @param key Key.
     * @return List of strings, empty if missing.
     */
    public List<String> getStringList(String key) {
        List<String> list = new ArrayList<>();
        if (!has(key)) {
            return list;
        }
        JsonElement element = json.get(key);
        if (element.isJsonArray()) {
            for (JsonElement entry : element.getAsJsonArray()) {
                if (!entry.isJsonNull()) {
                    list.add(entry.getAsString());
                }
            }
        } else if (element.isJsonPrimitive()) {
            list.add(element.getAsString());
        }
        return list;
    }

    public MessageMetadata setStringList(String key, List<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        json.add(key, array);
        return this;
    }

    /**
     * Appends to a string list unless already present.
     *
     * @param key   Key.
     * @param value Value.
     * @return Self.
     */
    public MessageMetadata addToList(String key, String value) {
        List<String> list = getStringList(key);
        if (!list.contains(value)) {
            list.add(value);
            setStringList(key, list);
        }
        return this;
    }

    // Shorthands used across runners and handlers.

    public String getListName() {
        return getString(LISTNAME);
    }

    public int getPipelinePosition() {
        return getInt(PIPELINE_POSITION, 0);
    }

    public int getFailures() {
        return getInt(FAILURES, 0);
    }

    public boolean isApproved() {
        return getBoolean(APPROVED);
    }

    public List<String> getHoldReasons() {
        return getStringList(HOLD_REASONS);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MessageMetadata other)) {
            return false;
        }
        return json.equals(other.json);
    }

    @Override
    public int hashCode() {
        return json.hashCode();
    }

    @Override
    public String toString() {
        return toJson();
    }
}
