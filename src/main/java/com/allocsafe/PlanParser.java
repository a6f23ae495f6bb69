package com.allocsafe;

import java.util.Locale;

import com.allocsafe.refactor.RefactorType;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Reads a refactor plan.
 *
 * <pre>
 * {
 *   "errorCode": "ENOMEM",
 *   "functions": [
 *     { "name": "make_buf", "type": "PTR_TO_INT_OUT", "returnType": "char *" },
 *     { "name": "init",     "type": "VOID_TO_INT" }
 *   ]
 * }
 * </pre>
 */
public class PlanParser {

    public static RefactorPlan parse(String content) {
        String text = content == null ? "" : content.trim();
        if (text.isEmpty()) {
            throw FixerException.invalidArgument("empty refactor plan");
        }
        JsonObject obj;
        try {
            obj = JsonParser.parseString(text).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new FixerException(FixerException.ErrorKind.INVALID_ARGUMENT,
                    "refactor plan is not a JSON object: " + e.getMessage(), e);
        }

        RefactorPlan plan = new RefactorPlan();
        plan.errorCode = asString(obj.get("errorCode"), "errorCode");
        JsonElement functions = obj.get("functions");
        JsonArray arr = new JsonArray();
        if (functions != null && !functions.isJsonNull()) {
            if (!functions.isJsonArray()) {
                throw FixerException.invalidArgument("functions is not an array");
            }
            arr = functions.getAsJsonArray();
        }
        for (int i = 0; i < arr.size(); i++) {
            plan.functions.add(parseEntry(arr.get(i), i));
        }
        return plan;
    }

    private static RefactorPlan.Entry parseEntry(JsonElement el, int index) {
        if (!el.isJsonObject()) {
            throw FixerException.invalidArgument("functions[" + index + "] is not an object");
        }
        JsonObject o = el.getAsJsonObject();
        RefactorPlan.Entry e = new RefactorPlan.Entry();
        e.name = asString(o.get("name"), "functions[" + index + "].name");
        if (e.name == null || e.name.isEmpty()) {
            throw FixerException.invalidArgument("functions[" + index + "] has no name");
        }
        String type = asString(o.get("type"), "functions[" + index + "].type");
        e.type = toType(type, index);
        e.returnType = asString(o.get("returnType"), "functions[" + index + "].returnType");
        if (e.type == RefactorType.PTR_TO_INT_OUT && e.returnType == null) {
            throw FixerException.invalidArgument("functions[" + index + "] (" + e.name + ") needs a returnType");
        }
        return e;
    }

    private static RefactorType toType(String s, int index) {
        if (s == null) {
            throw FixerException.invalidArgument("functions[" + index + "] has no type");
        }
        String norm = s.trim().toUpperCase(Locale.ROOT);
        // accept the short spellings too
        if (norm.equals("VOID") || norm.equals("VOID_TO_INT")) {
            return RefactorType.VOID_TO_INT;
        }
        if (norm.equals("PTR") || norm.equals("PTR_TO_INT_OUT")) {
            return RefactorType.PTR_TO_INT_OUT;
        }
        throw FixerException.invalidArgument("functions[" + index + "] has unknown type '" + s + "'");
    }

    private static String asString(JsonElement e, String field) {
        if (e == null || e.isJsonNull()) {
            return null;
        }
        if (!e.isJsonPrimitive()) {
            throw FixerException.invalidArgument(field + " is not a string");
        }
        return e.getAsString();
    }
}
