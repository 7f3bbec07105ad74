package com.lobsim.simulation;

import com.lobsim.domain.OrderRequest;
import com.lobsim.domain.OrderType;
import com.lobsim.domain.Side;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeedOrderLoaderTest {

    @Test
    void loadsSeedFile() throws Exception {
        Path path = Paths.get(getClass().getResource("/seed-orders.json").toURI());

        List<OrderRequest> orders = SeedOrderLoader.load(path);

        assertEquals(4, orders.size());

        OrderRequest first = orders.get(0);
        assertEquals(Side.BUY, first.getSide());
        assertEquals(OrderType.LIMIT, first.getType());
        assertEquals(99.5, first.getPrice());
        assertEquals(10, first.getQuantity());
        assertEquals(SeedOrderLoader.DEFAULT_OWNER, first.getOwner());

        assertEquals("desk", orders.get(1).getOwner());
        assertEquals(100.5, orders.get(2).getPrice());

        OrderRequest market = orders.get(3);
        assertEquals(Side.SELL, market.getSide());
        assertEquals(OrderType.MARKET, market.getType());
        assertEquals(5, market.getQuantity());
    }

    @Test
    void emptyOrderListIsAllowed() {
        assertTrue(SeedOrderLoader.parse("{\"orders\": []}").isEmpty());
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThrows(IllegalArgumentException.class, () -> SeedOrderLoader.parse("{"));
        assertThrows(IllegalArgumentException.class, () -> SeedOrderLoader.parse("[]"));
        assertThrows(IllegalArgumentException.class, () -> SeedOrderLoader.parse("{\"orders\": 5}"));
    }

    @Test
    void rejectsMalformedEntries() {
        IllegalArgumentException missingQty = assertThrows(IllegalArgumentException.class,
                () -> SeedOrderLoader.parse("{\"orders\": [{\"side\": \"BUY\", \"price\": 99}]}"));
        assertTrue(missingQty.getMessage().contains("index 0"));

        assertThrows(IllegalArgumentException.class,
                () -> SeedOrderLoader.parse("{\"orders\": [{\"side\": \"BUY\", \"quantity\": 5}]}"));
        assertThrows(IllegalArgumentException.class,
                () -> SeedOrderLoader.parse("{\"orders\": [{\"side\": \"HOLD\", \"price\": 1, \"quantity\": 5}]}"));
        assertThrows(IllegalArgumentException.class,
                () -> SeedOrderLoader.parse("{\"orders\": [\"BUY\"]}"));
    }
}
