package com.lobsim.simulation;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.lobsim.domain.OrderRequest;
import com.lobsim.domain.OrderType;
import com.lobsim.domain.Side;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads a JSON document of orders used to pre-populate the book before the
 * participants start trading:
 *
 * <pre>
 * {"orders": [
 *   {"side": "BUY",  "price": 99.5,  "quantity": 10},
 *   {"side": "SELL", "type": "LIMIT", "price": 100.5, "quantity": 10, "owner": "seed"}
 * ]}
 * </pre>
 *
 * {@code type} defaults to LIMIT and {@code owner} to {@value #DEFAULT_OWNER}. Seed
 * orders are submitted like any other order, so they match if they cross.
 */
public final class SeedOrderLoader {

    public static final String DEFAULT_OWNER = "seed";

    private SeedOrderLoader() {
    }

    public static List<OrderRequest> load(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException if the document is not valid JSON or an entry
     *                                  is missing a required field or has an unknown enum value
     */
    public static List<OrderRequest> parse(String body) {
        JsonArray ordersArray;
        try {
            JsonElement root = JsonParser.parseString(body);
            if (!root.isJsonObject() || !root.getAsJsonObject().has("orders")) {
                throw new IllegalArgumentException("Seed document must be an object with an \"orders\" array");
            }
            ordersArray = root.getAsJsonObject().getAsJsonArray("orders");
        } catch (JsonParseException | ClassCastException e) {
            throw new IllegalArgumentException("Malformed seed document: " + e.getMessage(), e);
        }

        List<OrderRequest> orders = new ArrayList<>(ordersArray.size());
        int index = 0;
        for (JsonElement element : ordersArray) {
            try {
                orders.add(parseOrder(element.getAsJsonObject()));
            } catch (IllegalStateException | UnsupportedOperationException
                     | NumberFormatException | ClassCastException e) {
                throw new IllegalArgumentException("Malformed seed order at index " + index
                        + ": " + e.getMessage(), e);
            }
            index++;
        }
        return orders;
    }

    private static OrderRequest parseOrder(JsonObject orderJson) {
        Side side = Side.valueOf(required(orderJson, "side").getAsString().toUpperCase(Locale.ROOT));
        OrderType type = OrderType.valueOf(
                orderJson.has("type")
                        ? orderJson.get("type").getAsString().toUpperCase(Locale.ROOT)
                        : "LIMIT");
        double price = orderJson.has("price") && !orderJson.get("price").isJsonNull()
                ? orderJson.get("price").getAsDouble()
                : 0.0;
        long quantity = required(orderJson, "quantity").getAsLong();
        String owner = orderJson.has("owner") && !orderJson.get("owner").isJsonNull()
                ? orderJson.get("owner").getAsString()
                : DEFAULT_OWNER;

        if (type == OrderType.LIMIT && !orderJson.has("price")) {
            throw new IllegalStateException("limit order requires a price");
        }
        return new OrderRequest(side, type, price, quantity, owner);
    }

    private static JsonElement required(JsonObject json, String field) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            throw new IllegalStateException("missing field \"" + field + "\"");
        }
        return element;
    }
}
