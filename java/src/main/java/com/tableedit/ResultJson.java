package com.tableedit;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * JSON rendering of edit results for scripting: rows become objects in column order.
 */
public final class ResultJson {
    private static final Gson gson = new GsonBuilder()
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .create();

    private ResultJson() {}

    public static String toJson(EditResult result) {
        JsonObject root = new JsonObject();
        root.addProperty("ok", result.ok());
        if (result.ok()) {
            root.add("result", payload(result.result()));
        }
        JsonArray errors = new JsonArray();
        for (ParseError error : result.errors()) {
            errors.add(error(error));
        }
        root.add("errors", errors);
        return gson.toJson(root);
    }

    private static JsonObject payload(EditPayload payload) {
        JsonObject obj = new JsonObject();
        if (payload instanceof Table table) {
            obj.addProperty("type", "full");
            obj.add("columns", gson.toJsonTree(table.columns()));
            obj.add("rows", rows(table.rows()));
        } else if (payload instanceof TableDiff diff) {
            obj.addProperty("type", "diff");
            obj.add("added", rows(diff.added()));
            obj.add("removed", rows(diff.removed()));
            JsonArray modified = new JsonArray();
            for (TableDiff.ModifiedRow m : diff.modified()) {
                JsonObject pair = new JsonObject();
                pair.add("old", gson.toJsonTree(m.oldRow().values()));
                pair.add("new", gson.toJsonTree(m.newRow().values()));
                modified.add(pair);
            }
            obj.add("modified", modified);
        } else if (payload instanceof Changes changes) {
            obj.addProperty("type", "changes_only");
            obj.add("added", rows(changes.added()));
            obj.add("modified", rows(changes.modified()));
        }
        return obj;
    }

    private static JsonArray rows(List<Row> rows) {
        JsonArray arr = new JsonArray();
        for (Row row : rows) {
            arr.add(gson.toJsonTree(row.values()));
        }
        return arr;
    }

    private static JsonObject error(ParseError error) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", error.kind().name());
        obj.addProperty("line", error.line());
        if (error.isColumnScoped()) {
            obj.addProperty("column", error.columnName());
        } else {
            obj.addProperty("column", error.columnIndex());
        }
        obj.addProperty("message", error.message());
        return obj;
    }
}
