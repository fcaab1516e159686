package io.surfworks.todome.server.protocol;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.List;

/**
 * JSON payloads for the editor protocol values.
 *
 * <p>Field names follow the record components, which already match the
 * protocol's camelCase names. Severities travel as their numeric code and
 * null fields are left out.
 */
public final class ProtocolJson {

    private static final Gson GSON = new GsonBuilder()
        .registerTypeAdapter(DiagnosticSeverity.class, new SeverityAdapter())
        .disableHtmlEscaping()
        .create();

    private ProtocolJson() {}

    public static String toJson(Object value) {
        return GSON.toJson(value);
    }

    /**
     * Parameters of a publish-diagnostics notification for one document.
     */
    public static String publishDiagnostics(String uri, List<Diagnostic> diagnostics) {
        JsonObject params = new JsonObject();
        params.addProperty("uri", uri);
        params.add("diagnostics", GSON.toJsonTree(diagnostics));
        return GSON.toJson(params);
    }

    public static Position position(String json) {
        return parse(json, Position.class);
    }

    /**
     * Reads one content change; a change without {@code range} replaces the whole document.
     */
    public static TextChange textChange(String json) {
        return parse(json, TextChange.class);
    }

    private static <T> T parse(String json, Class<T> type) {
        T value = GSON.fromJson(json, type);
        if (value == null) {
            throw new JsonParseException("Empty payload for " + type.getSimpleName());
        }
        return value;
    }

    private static final class SeverityAdapter extends TypeAdapter<DiagnosticSeverity> {

        @Override
        public void write(JsonWriter out, DiagnosticSeverity value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.code());
            }
        }

        @Override
        public DiagnosticSeverity read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return DiagnosticSeverity.fromCode(in.nextInt());
        }
    }
}
